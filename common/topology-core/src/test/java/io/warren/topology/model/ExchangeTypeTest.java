package io.warren.topology.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.warren.topology.TopologyConfigurationException;
import org.junit.jupiter.api.Test;

class ExchangeTypeTest {

    @Test
    void resolvesKnownTokens() {
        assertThat(ExchangeType.lookup("direct")).contains(ExchangeType.DIRECT);
        assertThat(ExchangeType.lookup("fanout")).contains(ExchangeType.FANOUT);
        assertThat(ExchangeType.lookup("topic")).contains(ExchangeType.TOPIC);
        assertThat(ExchangeType.lookup("headers")).contains(ExchangeType.HEADERS);
        assertThat(ExchangeType.lookup(null)).isEmpty();
        assertThat(ExchangeType.lookup(" ")).isEmpty();
    }

    @Test
    void rejectsUnknownToken() {
        assertThatThrownBy(() -> ExchangeType.lookup("x-consistent-hash"))
            .isInstanceOf(TopologyConfigurationException.class)
            .hasMessage("unknown exchange type 'x-consistent-hash'; expected one of direct, fanout, topic, headers");
    }

    @Test
    void tokensAreCaseSensitive() {
        assertThatThrownBy(() -> ExchangeType.lookup("TOPIC"))
            .isInstanceOf(TopologyConfigurationException.class)
            .hasMessageStartingWith("unknown exchange type 'TOPIC'");
        assertThatThrownBy(() -> ExchangeType.lookup(" Fanout "))
            .isInstanceOf(TopologyConfigurationException.class);
    }

    @Test
    void matchModeAcceptsOnlyAnyAndAll() {
        assertThat(MatchMode.find("any")).contains(MatchMode.ANY);
        assertThat(MatchMode.find("all")).contains(MatchMode.ALL);
        assertThat(MatchMode.find("ANY")).isEmpty();
        assertThat(MatchMode.find("bogus")).isEmpty();
        assertThat(MatchMode.find(null)).isEmpty();
    }

    @Test
    void declarationsRequireNameAndType() {
        assertThatThrownBy(() -> ExchangeDeclaration.of(" ", ExchangeType.DIRECT))
            .isInstanceOf(TopologyConfigurationException.class)
            .hasMessage("an exchange name must be provided");
        assertThatThrownBy(() -> ExchangeDeclaration.of("orders", null))
            .isInstanceOf(TopologyConfigurationException.class)
            .hasMessage("a type must be provided for the exchange 'orders'");
        assertThatThrownBy(() -> QueueDeclaration.of(null))
            .isInstanceOf(TopologyConfigurationException.class)
            .hasMessage("name is required to declare a queue");
    }

    @Test
    void linkDirectionDecidesSourceAndDestination() {
        ExchangeLink destination = new ExchangeLink("orders", "order.#", null);
        ExchangeLink source = new ExchangeLink("archive", "#", ExchangeLink.Direction.lookup("source"));

        assertThat(destination.toBinding("notifications", "main"))
            .isEqualTo(new ExchangeBinding("orders", "notifications", "order.#", "main"));
        assertThat(source.toBinding("notifications", "main"))
            .isEqualTo(new ExchangeBinding("notifications", "archive", "#", "main"));
        assertThat(source.toBinding("notifications", "main")).hasToString("notifications to archive: #");
    }
}
