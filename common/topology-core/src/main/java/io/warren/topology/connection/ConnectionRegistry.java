package io.warren.topology.connection;

import io.warren.topology.TopologyConfigurationException;
import java.util.Optional;

/**
 * Looks up the broker connections topology is declared against.
 */
public interface ConnectionRegistry {

    /**
     * @param name connection name, or {@code null} for the default connection
     */
    Optional<BrokerConnection> find(String name);

    default BrokerConnection resolve(String name) {
        return find(name).orElseThrow(() -> new TopologyConfigurationException(name == null
            ? "no default connection found"
            : "no connection with name '" + name + "' found"));
    }
}
