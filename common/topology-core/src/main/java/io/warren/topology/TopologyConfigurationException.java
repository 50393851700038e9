package io.warren.topology;

/**
 * Raised when a topology definition is structurally invalid. Aborts the whole declaration pass.
 */
public class TopologyConfigurationException extends RuntimeException {

    public TopologyConfigurationException(String message) {
        super(message);
    }

    public TopologyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
