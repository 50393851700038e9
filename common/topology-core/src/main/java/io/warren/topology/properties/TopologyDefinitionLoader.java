package io.warren.topology.properties;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a flat topology definition from a JSON or YAML document. Key order is preserved.
 */
public final class TopologyDefinitionLoader {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public TopologyDefinitionLoader() {
        this.jsonMapper = new ObjectMapper().findAndRegisterModules();
        this.yamlMapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();
    }

    public Map<String, Object> load(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.getFileName().toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read topology definition " + path, ex);
        }
    }

    /**
     * @param filename used to choose the format; {@code .json} is read as JSON, anything else as YAML
     */
    public Map<String, Object> load(InputStream in, String filename) {
        Objects.requireNonNull(in, "in");
        ObjectMapper mapper = filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".json")
            ? jsonMapper
            : yamlMapper;
        try {
            LinkedHashMap<String, Object> definitions = mapper.readValue(in, MAP_TYPE);
            return definitions == null ? new LinkedHashMap<>() : definitions;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to parse topology definition " + filename, ex);
        }
    }
}
