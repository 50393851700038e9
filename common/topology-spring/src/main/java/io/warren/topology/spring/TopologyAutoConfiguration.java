package io.warren.topology.spring;

import com.rabbitmq.client.Channel;
import io.warren.topology.TopologyConfigurer;
import io.warren.topology.connection.ConnectionRegistry;
import io.warren.topology.properties.TopologyDefinitionLoader;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Auto-configuration that declares exchanges, queues and bindings from {@code warren.topology.*}.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter(RabbitAutoConfiguration.class)
@ConditionalOnClass({ConnectionFactory.class, Channel.class})
@ConditionalOnProperty(prefix = "warren.topology", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TopologyProperties.class)
public class TopologyAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionRegistry.class)
    SpringConnectionRegistry topologyConnectionRegistry(ObjectProvider<ConnectionFactory> connectionFactory,
                                                        TopologyProperties properties) {
        return SpringConnectionRegistry.create(connectionFactory.getIfUnique(), properties.getConnections());
    }

    @Bean
    @ConditionalOnMissingBean
    TopologyConfigurer topologyConfigurer(ConnectionRegistry topologyConnectionRegistry) {
        return new TopologyConfigurer(topologyConnectionRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    TopologyDefinitionLoader topologyDefinitionLoader() {
        return new TopologyDefinitionLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "warren.topology", name = "declare-on-startup", havingValue = "true", matchIfMissing = true)
    TopologyInitializer topologyInitializer(TopologyConfigurer configurer,
                                            TopologyProperties properties,
                                            TopologyDefinitionLoader loader,
                                            ResourceLoader resourceLoader) {
        return new TopologyInitializer(configurer, properties, loader, resourceLoader);
    }
}
