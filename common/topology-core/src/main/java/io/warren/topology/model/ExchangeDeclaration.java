package io.warren.topology.model;

import io.warren.topology.TopologyConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An exchange to declare, with the exchange bindings it requests.
 *
 * @param connection connection name, {@code null} to inherit the enclosing scope or the default
 */
public record ExchangeDeclaration(String name,
                                  ExchangeType type,
                                  boolean durable,
                                  boolean autoDelete,
                                  Map<String, Object> arguments,
                                  String connection,
                                  List<ExchangeLink> links) {

    public ExchangeDeclaration {
        if (name == null || name.isBlank()) {
            throw new TopologyConfigurationException("an exchange name must be provided");
        }
        if (type == null) {
            throw new TopologyConfigurationException("a type must be provided for the exchange '" + name + "'");
        }
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static ExchangeDeclaration of(String name, ExchangeType type) {
        return new ExchangeDeclaration(name, type, false, false, Map.of(), null, List.of());
    }

    public ExchangeDeclaration durable(boolean value) {
        return new ExchangeDeclaration(name, type, value, autoDelete, arguments, connection, links);
    }

    public ExchangeDeclaration autoDelete(boolean value) {
        return new ExchangeDeclaration(name, type, durable, value, arguments, connection, links);
    }

    public ExchangeDeclaration onConnection(String value) {
        return new ExchangeDeclaration(name, type, durable, autoDelete, arguments, value, links);
    }

    public ExchangeDeclaration bindTo(ExchangeLink link) {
        List<ExchangeLink> updated = new ArrayList<>(links);
        updated.add(link);
        return new ExchangeDeclaration(name, type, durable, autoDelete, arguments, connection, updated);
    }
}
