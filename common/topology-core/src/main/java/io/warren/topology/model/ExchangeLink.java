package io.warren.topology.model;

import io.warren.topology.TopologyConfigurationException;
import java.util.Objects;

/**
 * A {@code bind-to} request attached to an exchange declaration, naming the other exchange and
 * which side of the binding the declared exchange sits on.
 */
public record ExchangeLink(String exchange, String routingKey, Direction as) {

    public ExchangeLink {
        if (exchange == null || exchange.isBlank()) {
            throw new TopologyConfigurationException("exchange binding requires the name of the exchange to bind to");
        }
        routingKey = Objects.requireNonNullElse(routingKey, "");
        as = Objects.requireNonNullElse(as, Direction.DESTINATION);
    }

    public ExchangeBinding toBinding(String self, String connection) {
        return switch (as) {
            case SOURCE -> new ExchangeBinding(self, exchange, routingKey, connection);
            case DESTINATION -> new ExchangeBinding(exchange, self, routingKey, connection);
        };
    }

    public enum Direction {
        /** The declared exchange routes into the linked one. */
        SOURCE,
        /** The declared exchange receives from the linked one. */
        DESTINATION;

        public static Direction lookup(Object value) {
            return value != null && "source".equals(value.toString()) ? SOURCE : DESTINATION;
        }
    }
}
