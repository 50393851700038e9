package io.warren.topology;

import io.warren.topology.model.ExchangeDeclaration;
import io.warren.topology.model.ExchangeType;
import io.warren.topology.model.MatchMode;
import io.warren.topology.model.QueueDeclaration;
import io.warren.topology.properties.ExchangeProperties;
import io.warren.topology.properties.QueueProperties;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Builder front end. Each nested block receives its own {@code TopologyDsl} bound to the
 * nested scope:
 *
 * <pre>{@code
 * configurer.configure(topology -> {
 *     topology.exchange("orders", Map.of("type", topology.topic(), "durable", true), orders -> {
 *         orders.queue("created", Map.of("binding", "order.created"));
 *     });
 *     topology.connection("audit", audit -> audit.queue("audit-log", Map.of("durable", true)));
 * });
 * }</pre>
 */
public final class TopologyDsl {

    private final DeclarationEngine engine;
    private final TopologyScope scope;

    public TopologyDsl(DeclarationEngine engine, TopologyScope scope) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public TopologyScope scope() {
        return scope;
    }

    public void queue(Map<String, ?> parameters) {
        queue(null, parameters);
    }

    public void queue(String name, Map<String, ?> parameters) {
        queue(DeclarationParameters.queue(name, parameters));
    }

    public void queue(QueueDeclaration queue) {
        engine.declareQueue(scope, queue);
    }

    public void queue(QueueProperties properties) {
        properties.validate();
        queue(properties.toDeclaration());
    }

    public void exchange(Map<String, ?> parameters) {
        exchange(null, parameters, null);
    }

    public void exchange(Map<String, ?> parameters, Consumer<TopologyDsl> nested) {
        exchange(null, parameters, nested);
    }

    public void exchange(String name, Map<String, ?> parameters, Consumer<TopologyDsl> nested) {
        scope.requireOutsideExchange(name != null ? name : String.valueOf(parameters.get("name")));
        exchange(DeclarationParameters.exchange(name, parameters), nested);
    }

    public void exchange(ExchangeDeclaration exchange, Consumer<TopologyDsl> nested) {
        engine.declareExchange(scope, exchange,
            nested == null ? null : nestedScope -> nested.accept(new TopologyDsl(engine, nestedScope)));
    }

    /**
     * Declares a decoded exchange. Its explicit exchange bindings are recorded on the connection
     * the exchange is declared on.
     */
    public void exchange(ExchangeProperties properties) {
        exchange(properties.toDeclaration(), null);
    }

    /**
     * Runs {@code nested} against the named connection. Use {@code null} for the default.
     */
    public void connection(String name, Consumer<TopologyDsl> nested) {
        Objects.requireNonNull(nested, "nested");
        nested.accept(new TopologyDsl(engine, scope.enterConnection(name, engine.connections())));
    }

    public String direct() {
        return ExchangeType.DIRECT.token();
    }

    public String fanout() {
        return ExchangeType.FANOUT.token();
    }

    public String topic() {
        return ExchangeType.TOPIC.token();
    }

    public String headers() {
        return ExchangeType.HEADERS.token();
    }

    public String any() {
        return MatchMode.ANY.token();
    }

    public String all() {
        return MatchMode.ALL.token();
    }
}
