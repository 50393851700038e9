package io.warren.topology;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.Channel;
import io.warren.topology.connection.DefaultConnectionRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

/**
 * Mocked connection factories, one channel mock per connection name.
 */
public final class MockBroker {

    private final Map<String, Channel> channels = new LinkedHashMap<>();
    private final Map<String, ConnectionFactory> factories = new LinkedHashMap<>();
    private final DefaultConnectionRegistry.Builder registry = DefaultConnectionRegistry.builder();

    public static MockBroker withDefault(String name) {
        return new MockBroker().connection(name, true);
    }

    public MockBroker connection(String name, boolean isDefault) {
        ConnectionFactory factory = mock(ConnectionFactory.class);
        Connection connection = mock(Connection.class);
        Channel channel = mock(Channel.class);
        when(factory.createConnection()).thenReturn(connection);
        when(connection.createChannel(false)).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);
        channels.put(name, channel);
        factories.put(name, factory);
        registry.register(name, factory, isDefault);
        return this;
    }

    public Channel channel(String name) {
        return channels.get(name);
    }

    public ConnectionFactory factory(String name) {
        return factories.get(name);
    }

    public DefaultConnectionRegistry registry() {
        return registry.build();
    }
}
