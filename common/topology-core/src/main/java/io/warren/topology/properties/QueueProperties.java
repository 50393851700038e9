package io.warren.topology.properties;

import io.warren.topology.TopologyConfigurationException;
import io.warren.topology.model.QueueBinding;
import io.warren.topology.model.QueueDeclaration;
import java.util.Map;

/**
 * Typed view of a single queue definition.
 */
public class QueueProperties {

    private final Map<String, Object> arguments;
    private final boolean autoDelete;
    private final boolean durable;
    private final boolean exclusive;
    private final String name;

    /**
     * Exchange to bind the queue to, if any.
     */
    private final String exchange;

    /**
     * Routing key, or header values for a headers exchange.
     */
    private final Object binding;

    /**
     * Header match mode, {@code any} or {@code all}; only used with a header binding.
     */
    private final String match;

    private final String connection;

    public QueueProperties(Map<String, ?> configuration) {
        TopologyParameters values = TopologyParameters.of(configuration);
        name = values.text("name");
        arguments = values.mapping("arguments");
        autoDelete = values.flag("autoDelete", false);
        durable = values.flag("durable", false);
        exclusive = values.flag("exclusive", false);
        exchange = values.text("exchange");
        binding = values.get("binding");
        match = values.text("match");
        connection = values.text("connection");
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

    public boolean isExclusive() {
        return exclusive;
    }

    public String getName() {
        return name;
    }

    public String getExchange() {
        return exchange;
    }

    public Object getBinding() {
        return binding;
    }

    public String getMatch() {
        return match;
    }

    public String getConnection() {
        return connection;
    }

    public void validate() {
        if (name == null) {
            throw new TopologyConfigurationException("queue name is required");
        }
    }

    public QueueDeclaration toDeclaration() {
        validate();
        QueueBinding queueBinding = QueueBinding.of(binding, match);
        return new QueueDeclaration(name, durable, exclusive, autoDelete, arguments, exchange, queueBinding, connection);
    }
}
