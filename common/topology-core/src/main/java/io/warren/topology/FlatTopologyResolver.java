package io.warren.topology;

import io.warren.topology.properties.TopologyParameters;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat keyed-map front end. Every key is {@code <type>_<name>}:
 * <ul>
 *   <li>{@code queue_<name>} declares a queue, {@code <name>} being the default queue name;</li>
 *   <li>{@code connection_<name>} scopes the {@code queue*}/{@code exchange*} keys of its value to
 *       that connection;</li>
 *   <li>{@code exchange_<name>} declares an exchange and evaluates its {@code queues} mapping, or
 *       otherwise its {@code queue*}/{@code exchange*} keys, inside it.</li>
 * </ul>
 */
public final class FlatTopologyResolver {

    public void resolve(Map<String, ?> definitions, TopologyDsl topology) {
        definitions.forEach((key, value) -> {
            ConfigurationKey parsed = ConfigurationKey.parse(key);
            Map<String, Object> parameters = requireMapping(key, value);
            switch (parsed.type()) {
                case QUEUE -> topology.queue(parsed.name(), parameters);
                case CONNECTION -> topology.connection(parsed.name(),
                    nested -> resolve(select(parameters), nested));
                case EXCHANGE -> topology.exchange(parsed.name(), parameters,
                    nested -> resolve(exchangeChildren(parameters), nested));
                default -> throw new TopologyConfigurationException("configuration key '" + key + "' is not recognised");
            }
        });
    }

    private static Map<String, Object> exchangeChildren(Map<String, Object> parameters) {
        Object queues = parameters.get("queues");
        if (queues instanceof Map<?, ?> map) {
            return TopologyParameters.stringKeys(map);
        }
        return select(parameters);
    }

    private static Map<String, Object> select(Map<String, Object> parameters) {
        Map<String, Object> children = new LinkedHashMap<>();
        parameters.forEach((key, value) -> {
            if (key.startsWith("queue") || key.startsWith("exchange")) {
                children.put(key, value);
            }
        });
        return children;
    }

    private static Map<String, Object> requireMapping(String key, Object value) {
        if (value instanceof Map<?, ?> map) {
            return TopologyParameters.stringKeys(map);
        }
        throw new TopologyConfigurationException("configuration key '" + key + "' must map to a set of parameters");
    }
}
