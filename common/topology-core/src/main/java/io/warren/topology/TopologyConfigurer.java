package io.warren.topology;

import io.warren.topology.connection.ConnectionRegistry;
import io.warren.topology.properties.ExchangeProperties;
import io.warren.topology.properties.QueueProperties;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for declaring topology. Each call is one pass: the definition is evaluated,
 * every exchange and queue is declared, and the deferred exchange bindings are applied last.
 */
public class TopologyConfigurer {

    private static final Logger log = LoggerFactory.getLogger(TopologyConfigurer.class);

    private final ConnectionRegistry connections;
    private final FlatTopologyResolver resolver = new FlatTopologyResolver();

    public TopologyConfigurer(ConnectionRegistry connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    public TopologyReport configure(Consumer<TopologyDsl> definition) {
        Objects.requireNonNull(definition, "definition");
        DeclarationEngine engine = new DeclarationEngine(connections);
        definition.accept(new TopologyDsl(engine, TopologyScope.root()));
        ExchangeBindingResolver.Result bindings = new ExchangeBindingResolver(connections).apply(engine.deferredBindings());
        TopologyReport report = new TopologyReport(engine.declaredExchanges(), engine.declaredQueues(),
            engine.skippedQueueBindings(), bindings.applied(), bindings.failed());
        log.info("Declared {} exchange(s) and {} queue(s); applied {} of {} exchange binding(s)",
            report.exchanges().size(), report.queues().size(), report.appliedBindings().size(),
            report.appliedBindings().size() + report.failedBindings().size());
        return report;
    }

    public TopologyReport configure(Map<String, ?> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        return configure(topology -> resolver.resolve(definitions, topology));
    }

    /**
     * Declares decoded exchanges first, then decoded queues, in one pass.
     */
    public TopologyReport configure(Collection<ExchangeProperties> exchanges, Collection<QueueProperties> queues) {
        Objects.requireNonNull(exchanges, "exchanges");
        Objects.requireNonNull(queues, "queues");
        return configure(topology -> {
            exchanges.forEach(topology::exchange);
            queues.forEach(topology::queue);
        });
    }

    public FlatTopologyResolver resolver() {
        return resolver;
    }
}
