package io.warren.topology;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.Channel;
import io.warren.topology.model.ExchangeBinding;
import io.warren.topology.model.ExchangeDeclaration;
import io.warren.topology.model.ExchangeLink;
import io.warren.topology.model.ExchangeType;
import io.warren.topology.model.QueueBinding;
import io.warren.topology.model.QueueDeclaration;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.amqp.AmqpException;

class DeclarationEngineTest {

    private final MockBroker broker = MockBroker.withDefault("main").connection("secondary", false);
    private final DeclarationEngine engine = new DeclarationEngine(broker.registry());
    private final Channel main = broker.channel("main");
    private final Channel secondary = broker.channel("secondary");

    @Test
    void declaresStandaloneQueueWithoutBinding() throws Exception {
        engine.declareQueue(TopologyScope.root(), QueueDeclaration.of("jobs").durable(true));

        verify(main).queueDeclare("jobs", true, false, false, Map.of());
        verify(main, never()).queueBind(anyString(), anyString(), anyString());
        verify(main).close();
        assertThat(engine.declaredQueues()).containsExactly("jobs");
    }

    @Test
    void bindsQueueWithRoutingKeyToExplicitExchange() throws Exception {
        engine.declareQueue(TopologyScope.root(),
            QueueDeclaration.of("created").boundTo("orders", QueueBinding.routingKey("order.created")));

        InOrder order = inOrder(main);
        order.verify(main).queueDeclare("created", false, false, false, Map.of());
        order.verify(main).queueBind("created", "orders", "order.created");
        order.verify(main).close();
    }

    @Test
    void bindsQueueWithEmptyRoutingKeyWhenNoBindingGiven() throws Exception {
        engine.declareQueue(TopologyScope.root(), QueueDeclaration.of("broadcast").boundTo("events", null));

        verify(main, times(1)).queueBind("broadcast", "events", "");
    }

    @Test
    void bindsHeaderQueueWithMatchMode() throws Exception {
        engine.declareQueue(TopologyScope.root(), QueueDeclaration.of("eu-orders")
            .boundTo("by-region", QueueBinding.headers(Map.of("region", "eu"), "all")));

        verify(main).queueBind("eu-orders", "by-region", "", Map.of("region", "eu", "x-match", "all"));
        assertThat(engine.skippedQueueBindings()).isEmpty();
    }

    @Test
    void skipsHeaderBindingWithInvalidMatchModeButKeepsQueue() throws Exception {
        engine.declareQueue(TopologyScope.root(), QueueDeclaration.of("eu-orders")
            .boundTo("by-region", QueueBinding.headers(Map.of("region", "eu"), "bogus")));

        verify(main).queueDeclare("eu-orders", false, false, false, Map.of());
        verify(main, never()).queueBind(anyString(), anyString(), anyString(), anyMap());
        verify(main, never()).queueBind(anyString(), anyString(), anyString());
        assertThat(engine.declaredQueues()).containsExactly("eu-orders");
        assertThat(engine.skippedQueueBindings()).containsExactly("eu-orders");
    }

    @Test
    void parentExchangeTakesPrecedenceOverExplicitExchange() throws Exception {
        engine.declareExchange(TopologyScope.root(), ExchangeDeclaration.of("orders", ExchangeType.TOPIC),
            scope -> engine.declareQueue(scope,
                QueueDeclaration.of("created").boundTo("elsewhere", QueueBinding.routingKey("order.created"))));

        verify(main, times(1)).queueBind(anyString(), anyString(), anyString());
        verify(main).queueBind("created", "orders", "order.created");
    }

    @Test
    void declaresExchangeAndDefersItsLinks() throws Exception {
        ExchangeDeclaration notifications = ExchangeDeclaration.of("notifications", ExchangeType.TOPIC)
            .durable(true)
            .bindTo(new ExchangeLink("orders", "order.#", ExchangeLink.Direction.DESTINATION))
            .bindTo(new ExchangeLink("archive", "#", ExchangeLink.Direction.SOURCE));

        engine.declareExchange(TopologyScope.root(), notifications, null);

        verify(main).exchangeDeclare("notifications", "topic", true, false, Map.of());
        verify(main, never()).exchangeBind(anyString(), anyString(), anyString());
        assertThat(engine.deferredBindings()).containsExactly(
            new ExchangeBinding("orders", "notifications", "order.#", "main"),
            new ExchangeBinding("notifications", "archive", "#", "main"));
    }

    @Test
    void rejectsExchangeNestedInsideExchange() {
        ExchangeDeclaration outer = ExchangeDeclaration.of("outer", ExchangeType.DIRECT);
        ExchangeDeclaration inner = ExchangeDeclaration.of("inner", ExchangeType.DIRECT);

        assertThatThrownBy(() -> engine.declareExchange(TopologyScope.root(), outer,
            scope -> engine.declareExchange(scope, inner, null)))
            .isInstanceOf(TopologyConfigurationException.class)
            .hasMessage("cannot declare exchange 'inner' within exchange 'outer'");
    }

    @Test
    void nestedScopeInheritsExchangeConnection() throws Exception {
        AtomicReference<TopologyScope> nested = new AtomicReference<>();
        engine.declareExchange(TopologyScope.root(),
            ExchangeDeclaration.of("audit", ExchangeType.FANOUT).onConnection("secondary"), nested::set);

        assertThat(nested.get().exchange()).contains("audit");
        assertThat(nested.get().connection().orElseThrow().name()).isEqualTo("secondary");
        verify(secondary).exchangeDeclare("audit", "fanout", false, false, Map.of());

        engine.declareQueue(nested.get(), QueueDeclaration.of("audit-log"));
        verify(secondary).queueBind("audit-log", "audit", "");
    }

    @Test
    void explicitConnectionOverridesScopeConnection() throws Exception {
        TopologyScope scope = TopologyScope.root().enterConnection("main", broker.registry());

        engine.declareQueue(scope, QueueDeclaration.of("jobs").onConnection("secondary"));

        verify(secondary).queueDeclare("jobs", false, false, false, Map.of());
        verify(main, never()).queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), anyMap());
    }

    @Test
    void releasesChannelAndPropagatesBrokerFailure() throws Exception {
        when(main.exchangeDeclare("orders", "topic", false, false, Map.of()))
            .thenThrow(new IOException("inequivalent arg 'durable'"));

        assertThatThrownBy(() -> engine.declareExchange(TopologyScope.root(),
            ExchangeDeclaration.of("orders", ExchangeType.TOPIC), null))
            .isInstanceOf(AmqpException.class)
            .hasRootCauseMessage("inequivalent arg 'durable'");
        verify(main).close();
        assertThat(engine.declaredExchanges()).isEmpty();
    }

    @Test
    void failsForUnknownConnection() {
        assertThatThrownBy(() -> engine.declareQueue(TopologyScope.root(), QueueDeclaration.of("jobs").onConnection("missing")))
            .isInstanceOf(TopologyConfigurationException.class)
            .hasMessage("no connection with name 'missing' found");
    }

    @Test
    void deferredBindingsKeepRecordingOrder() {
        engine.recordBinding(new ExchangeBinding("a", "b", "x", "main"));
        engine.recordBinding(new ExchangeBinding("c", "d", "y", "main"));

        assertThat(engine.deferredBindings()).extracting(ExchangeBinding::source).isEqualTo(List.of("a", "c"));
    }
}
