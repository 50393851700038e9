package io.warren.topology;

import io.warren.topology.connection.BrokerConnection;
import io.warren.topology.connection.ConnectionRegistry;
import io.warren.topology.model.ExchangeBinding;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies deferred exchange-to-exchange bindings after every exchange in the pass exists.
 * <p>
 * The connection of each binding is looked up again by the name it was recorded with; a
 * binding whose connection no longer resolves fails on its own. Failures are logged and never
 * stop the remaining bindings.
 */
public final class ExchangeBindingResolver {

    private static final Logger log = LoggerFactory.getLogger(ExchangeBindingResolver.class);

    private final ConnectionRegistry connections;

    public ExchangeBindingResolver(ConnectionRegistry connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    public Result apply(List<ExchangeBinding> bindings) {
        Objects.requireNonNull(bindings, "bindings");
        List<ExchangeBinding> applied = new ArrayList<>();
        List<ExchangeBinding> failed = new ArrayList<>();
        for (ExchangeBinding binding : bindings) {
            try {
                BrokerConnection connection = connections.resolve(binding.connection());
                connection.execute(channel -> {
                    channel.exchangeBind(binding.destination(), binding.source(), binding.routingKey());
                    return null;
                });
                log.debug("Bound exchange {}", binding);
                applied.add(binding);
            } catch (RuntimeException ex) {
                log.warn("Could not set up exchange binding {} because {}", binding, ex.getMessage(), ex);
                failed.add(binding);
            }
        }
        return new Result(applied, failed);
    }

    public record Result(List<ExchangeBinding> applied, List<ExchangeBinding> failed) {
        public Result {
            applied = List.copyOf(applied);
            failed = List.copyOf(failed);
        }
    }
}
