package io.warren.topology.model;

import java.util.Optional;

/**
 * Header-match modes for bindings to a headers exchange, sent as {@code x-match}.
 */
public enum MatchMode {
    ANY("any"),
    ALL("all");

    private final String token;

    MatchMode(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<MatchMode> find(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MatchMode mode : values()) {
            if (mode.token.equals(value.toString())) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
