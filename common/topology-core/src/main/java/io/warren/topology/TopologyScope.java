package io.warren.topology;

import io.warren.topology.connection.BrokerConnection;
import io.warren.topology.connection.ConnectionRegistry;
import java.util.Optional;

/**
 * Connection and parent exchange that apply to a nested declaration.
 * <p>
 * Scopes are immutable: entering a connection or exchange returns a new scope for the nested
 * evaluation and leaves the enclosing one untouched. Only one connection scope and one exchange
 * scope may be active at a time.
 */
public final class TopologyScope {

    private static final TopologyScope ROOT = new TopologyScope(null, null);

    private final BrokerConnection connection;
    private final String exchange;

    private TopologyScope(BrokerConnection connection, String exchange) {
        this.connection = connection;
        this.exchange = exchange;
    }

    public static TopologyScope root() {
        return ROOT;
    }

    public Optional<BrokerConnection> connection() {
        return Optional.ofNullable(connection);
    }

    public Optional<String> exchange() {
        return Optional.ofNullable(exchange);
    }

    /**
     * @param name connection name, {@code null} for the default connection
     */
    public TopologyScope enterConnection(String name, ConnectionRegistry connections) {
        if (connection != null) {
            throw new TopologyConfigurationException("unexpected connection '" + name
                + "' in the queue configuration; connection '" + connection.name() + "' is already open");
        }
        return new TopologyScope(connections.resolve(name), exchange);
    }

    public void requireOutsideExchange(String name) {
        if (exchange != null) {
            throw new TopologyConfigurationException(
                "cannot declare exchange '" + name + "' within exchange '" + exchange + "'");
        }
    }

    TopologyScope enterExchange(String name, BrokerConnection effectiveConnection) {
        requireOutsideExchange(name);
        return new TopologyScope(effectiveConnection, name);
    }

    /**
     * Picks the connection for a declaration: the explicit name, then this scope's connection,
     * then the registry default.
     */
    public BrokerConnection resolveConnection(String explicit, ConnectionRegistry connections) {
        if (explicit != null && !explicit.isBlank()) {
            return connections.resolve(explicit);
        }
        if (connection != null) {
            return connection;
        }
        return connections.resolve(null);
    }

    @Override
    public String toString() {
        return "TopologyScope[connection=" + (connection == null ? null : connection.name())
            + ", exchange=" + exchange + "]";
    }
}
