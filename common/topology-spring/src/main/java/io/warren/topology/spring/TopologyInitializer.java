package io.warren.topology.spring;

import io.warren.topology.TopologyConfigurer;
import io.warren.topology.TopologyReport;
import io.warren.topology.properties.ExchangeProperties;
import io.warren.topology.properties.QueueProperties;
import io.warren.topology.properties.TopologyDefinitionLoader;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Declares the configured topology once the application has started. Any configuration error
 * or broker failure during declaration fails startup.
 */
public class TopologyInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TopologyInitializer.class);

    private final TopologyConfigurer configurer;
    private final TopologyProperties properties;
    private final TopologyDefinitionLoader loader;
    private final ResourceLoader resourceLoader;

    public TopologyInitializer(TopologyConfigurer configurer,
                               TopologyProperties properties,
                               TopologyDefinitionLoader loader,
                               ResourceLoader resourceLoader) {
        this.configurer = Objects.requireNonNull(configurer, "configurer");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
    }

    @Override
    public void run(ApplicationArguments args) {
        Map<String, Object> definitions = definitions();
        List<ExchangeProperties> exchanges = properties.getExchanges().stream().map(ExchangeProperties::new).toList();
        List<QueueProperties> queues = properties.getQueues().stream().map(QueueProperties::new).toList();
        if (definitions.isEmpty() && exchanges.isEmpty() && queues.isEmpty()) {
            log.debug("No topology configured; skipping declaration");
            return;
        }
        TopologyReport report = configurer.configure(topology -> {
            configurer.resolver().resolve(definitions, topology);
            exchanges.forEach(topology::exchange);
            queues.forEach(topology::queue);
        });
        if (!report.complete()) {
            log.warn("Topology declared with skipped queue bindings {} and failed exchange bindings {}",
                report.skippedQueueBindings(), report.failedBindings());
        }
    }

    Map<String, Object> definitions() {
        Map<String, Object> definitions = new LinkedHashMap<>();
        String location = properties.getDefinitionsLocation();
        if (location != null && !location.isBlank()) {
            Resource resource = resourceLoader.getResource(location);
            try (InputStream in = resource.getInputStream()) {
                definitions.putAll(loader.load(in, resource.getFilename()));
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read topology definitions from " + location, ex);
            }
        }
        definitions.putAll(properties.getDefinitions());
        return definitions;
    }
}
