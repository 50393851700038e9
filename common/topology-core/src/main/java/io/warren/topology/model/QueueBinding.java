package io.warren.topology.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * How a queue is bound to its exchange.
 */
public sealed interface QueueBinding permits QueueBinding.RoutingKey, QueueBinding.Headers, QueueBinding.Unkeyed {

    static QueueBinding routingKey(String routingKey) {
        return new RoutingKey(routingKey);
    }

    static QueueBinding headers(Map<String, ?> headers, String match) {
        return new Headers(headers == null ? null : new LinkedHashMap<String, Object>(headers), match);
    }

    /**
     * Decodes a configured {@code binding} value: a string is a routing key, a mapping is a
     * header match using {@code match}. Any other value, or none, binds with an empty key.
     */
    static QueueBinding of(Object binding, String match) {
        if (binding instanceof Map<?, ?> headers) {
            Map<String, Object> values = new LinkedHashMap<>();
            headers.forEach((key, value) -> values.put(String.valueOf(key), value));
            return new Headers(values, match);
        }
        if (binding instanceof CharSequence routingKey) {
            return new RoutingKey(routingKey.toString());
        }
        return none();
    }

    static QueueBinding none() {
        return Unkeyed.INSTANCE;
    }

    record RoutingKey(String routingKey) implements QueueBinding {
        public RoutingKey {
            routingKey = Objects.requireNonNull(routingKey, "routingKey");
        }
    }

    /**
     * Header-match binding. {@code match} is kept as configured so an invalid mode can be
     * reported when the binding is attempted.
     */
    record Headers(Map<String, Object> headers, String match) implements QueueBinding {
        public Headers {
            headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        }

        public Optional<MatchMode> matchMode() {
            return MatchMode.find(match);
        }
    }

    /** Empty routing key, as used with fanout exchanges. */
    enum Unkeyed implements QueueBinding {
        INSTANCE
    }
}
