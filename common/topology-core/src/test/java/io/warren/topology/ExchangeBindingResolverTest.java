package io.warren.topology;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.rabbitmq.client.Channel;
import io.warren.topology.model.ExchangeBinding;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ExchangeBindingResolverTest {

    private final MockBroker broker = MockBroker.withDefault("main").connection("secondary", false);
    private final ExchangeBindingResolver resolver = new ExchangeBindingResolver(broker.registry());

    @Test
    void appliesBindingsInRecordingOrderOnTheirConnections() throws Exception {
        Channel main = broker.channel("main");
        Channel secondary = broker.channel("secondary");

        ExchangeBindingResolver.Result result = resolver.apply(List.of(
            new ExchangeBinding("orders", "notifications", "order.#", "main"),
            new ExchangeBinding("audit", "archive", "", "secondary"),
            new ExchangeBinding("orders", "billing", "order.paid", null)));

        InOrder order = inOrder(main);
        order.verify(main).exchangeBind("notifications", "orders", "order.#");
        order.verify(main).exchangeBind("billing", "orders", "order.paid");
        verify(secondary).exchangeBind("archive", "audit", "");
        assertThat(result.applied()).hasSize(3);
        assertThat(result.failed()).isEmpty();
    }

    @Test
    void brokerFailureIsIsolatedAndChannelReleased() throws Exception {
        Channel main = broker.channel("main");
        doThrow(new IOException("NOT_FOUND")).when(main).exchangeBind("b", "a", "x");

        ExchangeBindingResolver.Result result = resolver.apply(List.of(
            new ExchangeBinding("a", "b", "x", "main"),
            new ExchangeBinding("c", "d", "y", "main")));

        verify(main).exchangeBind("d", "c", "y");
        verify(main, times(2)).close();
        assertThat(result.failed()).extracting(ExchangeBinding::source).containsExactly("a");
        assertThat(result.applied()).extracting(ExchangeBinding::source).containsExactly("c");
    }

    @Test
    void bindingOnConnectionThatNoLongerResolvesFailsAlone() throws Exception {
        Channel main = broker.channel("main");

        ExchangeBindingResolver.Result result = resolver.apply(List.of(
            new ExchangeBinding("a", "b", "x", "gone"),
            new ExchangeBinding("c", "d", "y", "main")));

        verify(main).exchangeBind("d", "c", "y");
        assertThat(result.failed()).containsExactly(new ExchangeBinding("a", "b", "x", "gone"));
    }
}
