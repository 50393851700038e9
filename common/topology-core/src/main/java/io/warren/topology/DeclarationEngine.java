package io.warren.topology;

import com.rabbitmq.client.Channel;
import io.warren.topology.connection.BrokerConnection;
import io.warren.topology.connection.ConnectionRegistry;
import io.warren.topology.model.ExchangeBinding;
import io.warren.topology.model.ExchangeDeclaration;
import io.warren.topology.model.ExchangeLink;
import io.warren.topology.model.MatchMode;
import io.warren.topology.model.QueueBinding;
import io.warren.topology.model.QueueDeclaration;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues declare and bind calls for one configuration pass.
 * <p>
 * Exchanges and queues are declared immediately. Exchange-to-exchange bindings are only
 * recorded; {@link ExchangeBindingResolver} applies them once the whole definition has been
 * evaluated. An engine instance belongs to a single pass and is not thread-safe.
 */
public final class DeclarationEngine {

    private static final Logger log = LoggerFactory.getLogger(DeclarationEngine.class);

    private final ConnectionRegistry connections;
    private final List<ExchangeBinding> deferredBindings = new ArrayList<>();
    private final List<String> declaredExchanges = new ArrayList<>();
    private final List<String> declaredQueues = new ArrayList<>();
    private final List<String> skippedQueueBindings = new ArrayList<>();

    public DeclarationEngine(ConnectionRegistry connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    public ConnectionRegistry connections() {
        return connections;
    }

    /**
     * Declares the queue and, when {@code scope} has a parent exchange or the queue names one,
     * binds it. The parent exchange takes precedence.
     */
    public void declareQueue(TopologyScope scope, QueueDeclaration queue) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(queue, "queue");
        BrokerConnection connection = scope.resolveConnection(queue.connection(), connections);
        Optional<String> exchange = scope.exchange().or(() -> Optional.ofNullable(queue.exchange()));
        connection.execute(channel -> {
            log.debug("Declaring queue '{}' on connection '{}'", queue.name(), connection.name());
            channel.queueDeclare(queue.name(), queue.durable(), queue.exclusive(), queue.autoDelete(), queue.arguments());
            if (exchange.isPresent()) {
                bindQueue(channel, queue, exchange.get());
            }
            return null;
        });
        declaredQueues.add(queue.name());
    }

    /**
     * Declares the exchange, records its exchange bindings and runs {@code nested} with a scope
     * whose parent exchange is this one.
     *
     * @param nested optional nested evaluation, may be {@code null}
     */
    public void declareExchange(TopologyScope scope, ExchangeDeclaration exchange, Consumer<TopologyScope> nested) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(exchange, "exchange");
        scope.requireOutsideExchange(exchange.name());
        BrokerConnection connection = scope.resolveConnection(exchange.connection(), connections);
        connection.execute(channel -> {
            log.debug("Declaring {} exchange '{}' on connection '{}'",
                exchange.type().token(), exchange.name(), connection.name());
            channel.exchangeDeclare(exchange.name(), exchange.type().token(), exchange.durable(),
                exchange.autoDelete(), exchange.arguments());
            return null;
        });
        declaredExchanges.add(exchange.name());
        for (ExchangeLink link : exchange.links()) {
            recordBinding(link.toBinding(exchange.name(), connection.name()));
        }
        if (nested != null) {
            nested.accept(scope.enterExchange(exchange.name(), connection));
        }
    }

    public void recordBinding(ExchangeBinding binding) {
        Objects.requireNonNull(binding, "binding");
        log.debug("Deferring exchange binding {}", binding);
        deferredBindings.add(binding);
    }

    public List<ExchangeBinding> deferredBindings() {
        return List.copyOf(deferredBindings);
    }

    public List<String> declaredExchanges() {
        return List.copyOf(declaredExchanges);
    }

    public List<String> declaredQueues() {
        return List.copyOf(declaredQueues);
    }

    public List<String> skippedQueueBindings() {
        return List.copyOf(skippedQueueBindings);
    }

    private void bindQueue(Channel channel, QueueDeclaration queue, String exchange) throws IOException {
        QueueBinding binding = queue.binding();
        if (binding instanceof QueueBinding.RoutingKey routingKey) {
            channel.queueBind(queue.name(), exchange, routingKey.routingKey());
        } else if (binding instanceof QueueBinding.Headers headers) {
            Optional<MatchMode> match = headers.matchMode();
            if (match.isEmpty()) {
                log.warn("skipping queue binding of queue '{}' to headers exchange '{}' because the 'match' property "
                    + "was not set or not one of ('any', 'all'): {}", queue.name(), exchange, headers.match());
                skippedQueueBindings.add(queue.name());
                return;
            }
            Map<String, Object> arguments = new LinkedHashMap<>(headers.headers());
            arguments.put("x-match", match.get().token());
            channel.queueBind(queue.name(), exchange, "", arguments);
        } else {
            channel.queueBind(queue.name(), exchange, "");
        }
        log.debug("Bound queue '{}' to exchange '{}'", queue.name(), exchange);
    }
}
