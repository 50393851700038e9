package io.warren.topology.properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

class TopologyDefinitionLoaderTest {

    private final TopologyDefinitionLoader loader = new TopologyDefinitionLoader();

    @Test
    void loadsYamlPreservingKeyOrder() throws Exception {
        Map<String, Object> definitions;
        try (InputStream in = getClass().getResourceAsStream("/topology/orders.yml")) {
            definitions = loader.load(in, "orders.yml");
        }

        assertThat(definitions).containsOnlyKeys("exchange_orders", "exchange_notifications", "connection_audit");
        assertThat(definitions.keySet()).first().isEqualTo("exchange_orders");
        assertThat(definitions.get("exchange_notifications"))
            .asInstanceOf(InstanceOfAssertFactories.MAP)
            .containsEntry("bind-to_exchange_orders", "order.#");
    }

    @Test
    void loadsJson() throws Exception {
        Map<String, Object> definitions;
        try (InputStream in = getClass().getResourceAsStream("/topology/orders.json")) {
            definitions = loader.load(in, "orders.json");
        }

        assertThat(definitions).containsOnlyKeys("exchange_orders");
    }

    @Test
    void reportsUnparseableDocument() {
        InputStream in = new ByteArrayInputStream("{not json".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> loader.load(in, "broken.json"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Failed to parse topology definition broken.json");
    }
}
