package io.warren.topology.spring;

import io.warren.topology.connection.BrokerConnection;
import io.warren.topology.connection.ConnectionRegistry;
import io.warren.topology.connection.DefaultConnectionRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.DisposableBean;

/**
 * Connection registry backed by Spring AMQP connection factories.
 * <p>
 * The application's own {@link ConnectionFactory} is registered as {@value #DEFAULT_CONNECTION}
 * and serves as the default unless a configured connection is marked {@code default}.
 * Configured connections get a {@link CachingConnectionFactory} owned by this registry and
 * closed with it.
 */
public final class SpringConnectionRegistry implements ConnectionRegistry, DisposableBean {

    public static final String DEFAULT_CONNECTION = "default";

    private static final Logger log = LoggerFactory.getLogger(SpringConnectionRegistry.class);

    private final DefaultConnectionRegistry delegate;
    private final List<CachingConnectionFactory> ownedFactories;

    private SpringConnectionRegistry(DefaultConnectionRegistry delegate, List<CachingConnectionFactory> ownedFactories) {
        this.delegate = delegate;
        this.ownedFactories = List.copyOf(ownedFactories);
    }

    public static SpringConnectionRegistry create(ConnectionFactory applicationConnectionFactory,
                                                  Map<String, TopologyProperties.ConnectionProperties> configured) {
        DefaultConnectionRegistry.Builder builder = DefaultConnectionRegistry.builder();
        boolean configuredDefault = configured.values().stream().anyMatch(TopologyProperties.ConnectionProperties::isDefault);
        if (applicationConnectionFactory != null) {
            builder.register(DEFAULT_CONNECTION, applicationConnectionFactory, !configuredDefault);
        }
        List<CachingConnectionFactory> owned = new ArrayList<>();
        configured.forEach((name, properties) -> {
            if (builder.contains(name)) {
                log.info("Topology connection '{}' replaces the application connection factory", name);
            }
            CachingConnectionFactory factory = connectionFactory(properties);
            owned.add(factory);
            builder.register(name, factory, properties.isDefault());
        });
        return new SpringConnectionRegistry(builder.build(), owned);
    }

    @Override
    public Optional<BrokerConnection> find(String name) {
        return delegate.find(name);
    }

    public Map<String, BrokerConnection> connections() {
        return delegate.connections();
    }

    @Override
    public void destroy() {
        for (CachingConnectionFactory factory : ownedFactories) {
            factory.destroy();
        }
    }

    private static CachingConnectionFactory connectionFactory(TopologyProperties.ConnectionProperties properties) {
        CachingConnectionFactory factory = new CachingConnectionFactory(properties.getHost(), properties.getPort());
        factory.setUsername(properties.getUsername());
        factory.setPassword(properties.getPassword());
        factory.setVirtualHost(properties.getVirtualHost());
        return factory;
    }
}
