package io.warren.topology.connection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

/**
 * Fixed set of named connections. The default is the one registered as such, or the only
 * registered connection when there is exactly one.
 */
public final class DefaultConnectionRegistry implements ConnectionRegistry {

    private final Map<String, BrokerConnection> connections;
    private final String defaultName;

    private DefaultConnectionRegistry(Map<String, BrokerConnection> connections, String defaultName) {
        this.connections = Collections.unmodifiableMap(new LinkedHashMap<>(connections));
        this.defaultName = defaultName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DefaultConnectionRegistry single(String name, ConnectionFactory connectionFactory) {
        return builder().register(name, connectionFactory, true).build();
    }

    @Override
    public Optional<BrokerConnection> find(String name) {
        if (name != null) {
            return Optional.ofNullable(connections.get(name));
        }
        if (defaultName != null) {
            return Optional.ofNullable(connections.get(defaultName));
        }
        if (connections.size() == 1) {
            return connections.values().stream().findFirst();
        }
        return Optional.empty();
    }

    public Map<String, BrokerConnection> connections() {
        return connections;
    }

    public static final class Builder {
        private final Map<String, BrokerConnection> connections = new LinkedHashMap<>();
        private String defaultName;

        private Builder() {
        }

        public Builder register(String name, ConnectionFactory connectionFactory) {
            return register(name, connectionFactory, false);
        }

        public Builder register(String name, ConnectionFactory connectionFactory, boolean isDefault) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("connection name must not be null or blank");
            }
            connections.put(name, new BrokerConnection(name, Objects.requireNonNull(connectionFactory, "connectionFactory")));
            if (isDefault) {
                if (defaultName != null && !defaultName.equals(name)) {
                    throw new IllegalStateException(
                        "only one default connection is allowed, found '%s' and '%s'".formatted(defaultName, name));
                }
                defaultName = name;
            }
            return this;
        }

        public boolean contains(String name) {
            return connections.containsKey(name);
        }

        public DefaultConnectionRegistry build() {
            return new DefaultConnectionRegistry(connections, defaultName);
        }
    }
}
