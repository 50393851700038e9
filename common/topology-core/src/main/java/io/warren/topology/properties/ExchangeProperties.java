package io.warren.topology.properties;

import io.warren.topology.TopologyConfigurationException;
import io.warren.topology.model.ExchangeBinding;
import io.warren.topology.model.ExchangeDeclaration;
import io.warren.topology.model.ExchangeLink;
import io.warren.topology.model.ExchangeType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed view of a single exchange definition.
 * <p>
 * Bindings to other exchanges are listed explicitly:
 * <pre>
 * exchangeBindings:
 *   - exchange: orders      # exchange to bind to
 *     binding: order.#      # routing key
 *     as: destination       # or source; defaults to destination
 * </pre>
 * Decoding performs no broker calls.
 */
public class ExchangeProperties {

    private static final Pattern INDEX_KEY = Pattern.compile("\\[?(\\d+)]?");

    /**
     * Exchange arguments (see RabbitMQ documentation).
     */
    private final Map<String, Object> arguments;

    /**
     * Whether the exchange deletes itself once nothing is bound to it.
     */
    private final boolean autoDelete;

    private final boolean durable;

    private final String name;

    private final ExchangeType type;

    /**
     * Connection to declare the exchange on. No value uses the default connection.
     */
    private final String connection;

    private final List<ExchangeLink> exchangeLinks;

    public ExchangeProperties(Map<String, ?> configuration) {
        TopologyParameters values = TopologyParameters.of(configuration);
        name = values.text("name");
        arguments = values.mapping("arguments");
        autoDelete = values.flag("autoDelete", false);
        durable = values.flag("durable", false);
        type = ExchangeType.lookup(values.text("type")).orElse(null);
        connection = values.text("connection");
        exchangeLinks = decodeLinks(values.get("exchangeBindings"));
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public boolean isDurable() {
        return durable;
    }

    public String getName() {
        return name;
    }

    public ExchangeType getType() {
        return type;
    }

    public String getConnection() {
        return connection;
    }

    /**
     * @return the configured exchange bindings, on this exchange's own {@code connection}
     */
    public List<ExchangeBinding> getExchangeBindings() {
        return exchangeLinks.stream().map(link -> link.toBinding(name, connection)).toList();
    }

    /**
     * Checks that the minimum requirements of this configuration have been met.
     */
    public void validate() {
        if (name == null) {
            throw new TopologyConfigurationException("exchange name is required");
        }
        if (type == null) {
            throw new TopologyConfigurationException("exchange type is required");
        }
    }

    /**
     * @return the declaration, carrying its exchange bindings so they are recorded on the
     * connection the exchange is declared on
     */
    public ExchangeDeclaration toDeclaration() {
        validate();
        return new ExchangeDeclaration(name, type, durable, autoDelete, arguments, connection, exchangeLinks);
    }

    private static List<ExchangeLink> decodeLinks(Object configured) {
        if (configured == null) {
            return List.of();
        }
        List<ExchangeLink> links = new ArrayList<>();
        for (Object entry : entries(configured)) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new TopologyConfigurationException("exchange binding configuration must be a list of maps");
            }
            TopologyParameters binding = TopologyParameters.of(TopologyParameters.stringKeys(map));
            links.add(new ExchangeLink(binding.text("exchange"), binding.text("binding"),
                ExchangeLink.Direction.lookup(binding.get("as"))));
        }
        return List.copyOf(links);
    }

    /**
     * Accepts a list, or a mapping keyed by list index as produced when binding lists into
     * {@code Map<String, Object>}.
     */
    private static Collection<?> entries(Object configured) {
        if (configured instanceof Collection<?> collection) {
            return collection;
        }
        if (configured instanceof Map<?, ?> map) {
            TreeMap<Integer, Object> ordered = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Matcher matcher = INDEX_KEY.matcher(String.valueOf(entry.getKey()));
                if (!matcher.matches()) {
                    throw new TopologyConfigurationException("exchange bindings configuration must be a list of maps");
                }
                ordered.put(Integer.parseInt(matcher.group(1)), entry.getValue());
            }
            return ordered.values();
        }
        throw new TopologyConfigurationException("exchange bindings configuration must be a list of maps");
    }
}
