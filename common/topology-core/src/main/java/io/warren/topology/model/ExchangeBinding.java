package io.warren.topology.model;

import java.util.Objects;

/**
 * Deferred exchange-to-exchange binding. Messages routed to {@code source} with a matching
 * {@code routingKey} are forwarded to {@code destination}.
 *
 * @param connection name of the connection the binding was recorded on, {@code null} for the default
 */
public record ExchangeBinding(String source, String destination, String routingKey, String connection) {

    public ExchangeBinding {
        routingKey = Objects.requireNonNullElse(routingKey, "");
    }

    @Override
    public String toString() {
        return source + " to " + destination + ": " + routingKey;
    }
}
