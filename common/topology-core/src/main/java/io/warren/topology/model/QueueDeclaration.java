package io.warren.topology.model;

import io.warren.topology.TopologyConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A queue to declare and, when it names an exchange or sits inside one, bind.
 */
public record QueueDeclaration(String name,
                               boolean durable,
                               boolean exclusive,
                               boolean autoDelete,
                               Map<String, Object> arguments,
                               String exchange,
                               QueueBinding binding,
                               String connection) {

    public QueueDeclaration {
        if (name == null || name.isBlank()) {
            throw new TopologyConfigurationException("name is required to declare a queue");
        }
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        binding = binding == null ? QueueBinding.none() : binding;
    }

    public static QueueDeclaration of(String name) {
        return new QueueDeclaration(name, false, false, false, Map.of(), null, QueueBinding.none(), null);
    }

    public QueueDeclaration durable(boolean value) {
        return new QueueDeclaration(name, value, exclusive, autoDelete, arguments, exchange, binding, connection);
    }

    public QueueDeclaration boundTo(String exchangeName, QueueBinding queueBinding) {
        return new QueueDeclaration(name, durable, exclusive, autoDelete, arguments, exchangeName, queueBinding, connection);
    }

    public QueueDeclaration onConnection(String value) {
        return new QueueDeclaration(name, durable, exclusive, autoDelete, arguments, exchange, binding, value);
    }
}
