package io.warren.topology.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for topology declaration.
 * <p>
 * Keys in {@code definitions} contain underscores, which Spring Boot strips from map keys
 * unless they are bracketed: {@code warren.topology.definitions[exchange_orders].type=topic}.
 * Larger definitions are easier to keep in a JSON or YAML document referenced by
 * {@code definitions-location}.
 */
@Validated
@ConfigurationProperties(prefix = "warren.topology")
public class TopologyProperties {

    private boolean enabled = true;
    private boolean declareOnStartup = true;
    private Map<String, Object> definitions = new LinkedHashMap<>();
    private String definitionsLocation;
    private List<Map<String, Object>> exchanges = new ArrayList<>();
    private List<Map<String, Object>> queues = new ArrayList<>();
    @Valid
    private Map<String, ConnectionProperties> connections = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isDeclareOnStartup() {
        return declareOnStartup;
    }

    public void setDeclareOnStartup(boolean declareOnStartup) {
        this.declareOnStartup = declareOnStartup;
    }

    public Map<String, Object> getDefinitions() {
        return definitions;
    }

    public void setDefinitions(Map<String, Object> definitions) {
        this.definitions = Objects.requireNonNullElseGet(definitions, LinkedHashMap::new);
    }

    public String getDefinitionsLocation() {
        return definitionsLocation;
    }

    public void setDefinitionsLocation(String definitionsLocation) {
        this.definitionsLocation = definitionsLocation;
    }

    public List<Map<String, Object>> getExchanges() {
        return exchanges;
    }

    public void setExchanges(List<Map<String, Object>> exchanges) {
        this.exchanges = Objects.requireNonNullElseGet(exchanges, ArrayList::new);
    }

    public List<Map<String, Object>> getQueues() {
        return queues;
    }

    public void setQueues(List<Map<String, Object>> queues) {
        this.queues = Objects.requireNonNullElseGet(queues, ArrayList::new);
    }

    public Map<String, ConnectionProperties> getConnections() {
        return connections;
    }

    public void setConnections(Map<String, ConnectionProperties> connections) {
        this.connections = Objects.requireNonNullElseGet(connections, LinkedHashMap::new);
    }

    public static class ConnectionProperties {

        @NotBlank
        private String host = "localhost";
        @Min(1)
        @Max(65535)
        private int port = 5672;
        private String username = "guest";
        private String password = "guest";
        private String virtualHost = "/";
        private boolean isDefault;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = requireText(host, "host");
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getVirtualHost() {
            return virtualHost;
        }

        public void setVirtualHost(String virtualHost) {
            this.virtualHost = requireText(virtualHost, "virtual-host");
        }

        public boolean isDefault() {
            return isDefault;
        }

        public void setDefault(boolean isDefault) {
            this.isDefault = isDefault;
        }
    }

    private static String requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("warren.topology.connections." + property + " must not be null or blank");
        }
        return value;
    }
}
