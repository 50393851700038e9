package io.warren.topology;

import io.warren.topology.model.ExchangeDeclaration;
import io.warren.topology.model.ExchangeLink;
import io.warren.topology.model.ExchangeType;
import io.warren.topology.model.QueueBinding;
import io.warren.topology.model.QueueDeclaration;
import io.warren.topology.properties.TopologyParameters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lowers parameter maps from the builder and flat-map front ends into declarations.
 */
public final class DeclarationParameters {

    private DeclarationParameters() {
    }

    /**
     * @param defaultName name used when the parameters carry no {@code name}
     */
    public static QueueDeclaration queue(String defaultName, Map<String, ?> parameters) {
        TopologyParameters values = TopologyParameters.of(parameters);
        String name = firstText(values.text("name"), defaultName);
        if (name == null) {
            throw new TopologyConfigurationException("name is required to declare a queue");
        }
        return new QueueDeclaration(
            name,
            values.flag("durable", false),
            values.flag("exclusive", false),
            values.flag("autoDelete", false),
            values.mapping("arguments"),
            values.text("exchange"),
            queueBinding(values),
            values.text("connection"));
    }

    public static ExchangeDeclaration exchange(String defaultName, Map<String, ?> parameters) {
        TopologyParameters values = TopologyParameters.of(parameters);
        String name = firstText(values.text("name"), defaultName);
        if (name == null) {
            throw new TopologyConfigurationException("an exchange name must be provided");
        }
        ExchangeType type = ExchangeType.lookup(values.text("type"))
            .orElseThrow(() -> new TopologyConfigurationException(
                "a type must be provided for the exchange '" + name + "'"));
        return new ExchangeDeclaration(
            name,
            type,
            values.flag("durable", false),
            values.flag("autoDelete", false),
            values.mapping("arguments"),
            values.text("connection"),
            bindToLinks(name, values.asMap()));
    }

    static QueueBinding queueBinding(TopologyParameters values) {
        Object match = values.get("match");
        return QueueBinding.of(values.get("binding"), match == null ? null : match.toString());
    }

    /**
     * Collects {@code bind-to_exchange_<name>} entries. A string value is the routing key; a
     * mapping carries {@code binding} and an optional {@code as} of {@code source} or
     * {@code destination}.
     */
    static List<ExchangeLink> bindToLinks(String exchange, Map<String, ?> parameters) {
        List<ExchangeLink> links = new ArrayList<>();
        parameters.forEach((key, value) -> {
            if (!ConfigurationKey.isBindTo(key)) {
                return;
            }
            String target = ConfigurationKey.bindTarget(exchange, key);
            if (value instanceof Map<?, ?> map) {
                TopologyParameters link = TopologyParameters.of(TopologyParameters.stringKeys(map));
                String routingKey = link.text("binding");
                if (routingKey == null) {
                    throw new TopologyConfigurationException(
                        "exchange '" + exchange + "' has 'bind-to' parameter '" + key + "' but no binding provided");
                }
                links.add(new ExchangeLink(target, routingKey, ExchangeLink.Direction.lookup(link.get("as"))));
            } else if (value instanceof CharSequence routingKey) {
                links.add(new ExchangeLink(target, routingKey.toString(), ExchangeLink.Direction.DESTINATION));
            } else {
                throw new TopologyConfigurationException(
                    "exchange '" + exchange + "' has 'bind-to' parameter '" + key + "' that is neither a mapping nor a string");
            }
        });
        return links;
    }

    private static String firstText(String value, String fallback) {
        if (value != null) {
            return value;
        }
        return fallback == null || fallback.isBlank() ? null : fallback;
    }
}
