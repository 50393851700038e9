package io.warren.topology.model;

import io.warren.topology.TopologyConfigurationException;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Exchange types understood by the broker.
 */
public enum ExchangeType {
    DIRECT("direct"),
    FANOUT("fanout"),
    TOPIC("topic"),
    HEADERS("headers");

    private final String token;

    ExchangeType(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * Resolves a configuration token to a type. Tokens are matched exactly, as the broker does.
     *
     * @return empty when {@code value} is null or blank
     * @throws TopologyConfigurationException when {@code value} names no known type
     */
    public static Optional<ExchangeType> lookup(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (ExchangeType type : values()) {
            if (type.token.equals(value)) {
                return Optional.of(type);
            }
        }
        throw new TopologyConfigurationException("unknown exchange type '" + value + "'; expected one of "
            + Arrays.stream(values()).map(ExchangeType::token).collect(Collectors.joining(", ")));
    }
}
