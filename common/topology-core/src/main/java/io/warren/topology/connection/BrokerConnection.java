package io.warren.topology.connection;

import com.rabbitmq.client.Channel;
import java.util.Objects;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.RabbitUtils;
import org.springframework.amqp.rabbit.core.ChannelCallback;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

/**
 * A named broker connection that hands out short-lived channels for declare and bind calls.
 */
public final class BrokerConnection {

    private final String name;
    private final ConnectionFactory connectionFactory;

    public BrokerConnection(String name, ConnectionFactory connectionFactory) {
        this.name = Objects.requireNonNull(name, "name");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    }

    public String name() {
        return name;
    }

    public ConnectionFactory connectionFactory() {
        return connectionFactory;
    }

    /**
     * Runs {@code callback} on a fresh channel. The channel is closed on every exit path; broker
     * failures surface as {@link org.springframework.amqp.AmqpException}.
     */
    public <T> T execute(ChannelCallback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        Connection connection = connectionFactory.createConnection();
        Channel channel = null;
        try {
            channel = connection.createChannel(false);
            return callback.doInRabbit(channel);
        } catch (Exception ex) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(ex);
        } finally {
            RabbitUtils.closeChannel(channel);
            RabbitUtils.closeConnection(connection);
        }
    }

    @Override
    public String toString() {
        return "BrokerConnection[" + name + "]";
    }
}
