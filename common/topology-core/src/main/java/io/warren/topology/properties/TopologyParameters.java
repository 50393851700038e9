package io.warren.topology.properties;

import io.warren.topology.TopologyConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.core.convert.ConversionException;
import org.springframework.core.convert.ConversionService;
import org.springframework.core.convert.support.DefaultConversionService;

/**
 * Read-only view over a declaration's parameter map.
 * <p>
 * Keys are looked up as written and then in kebab-case ({@code autoDelete} falls back to
 * {@code auto-delete}), so maps bound from Spring Boot configuration read the same as maps
 * written in code.
 */
public final class TopologyParameters {

    private static final ConversionService CONVERSIONS = DefaultConversionService.getSharedInstance();

    private final Map<String, ?> values;

    private TopologyParameters(Map<String, ?> values) {
        this.values = values;
    }

    public static TopologyParameters of(Map<String, ?> values) {
        return new TopologyParameters(values == null ? Map.of() : values);
    }

    public boolean contains(String key) {
        return get(key) != null;
    }

    public Object get(String key) {
        Objects.requireNonNull(key, "key");
        Object value = values.get(key);
        if (value == null) {
            String alias = kebab(key);
            if (!alias.equals(key)) {
                value = values.get(alias);
            }
        }
        return value;
    }

    /**
     * @return the value as a string, {@code null} when absent or blank
     */
    public String text(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
            throw new TopologyConfigurationException("parameter '" + key + "' must be a plain value but was " + value);
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    public boolean flag(String key, boolean fallback) {
        Object value = get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        try {
            Boolean converted = CONVERSIONS.convert(value.toString().trim(), Boolean.class);
            return converted == null ? fallback : converted;
        } catch (ConversionException ex) {
            throw new TopologyConfigurationException(
                "parameter '" + key + "' must be a boolean but was '" + value + "'", ex);
        }
    }

    /**
     * @return a copy of the mapping stored under {@code key}; empty when absent or not a mapping
     */
    public Map<String, Object> mapping(String key) {
        Object value = get(key);
        if (value instanceof Map<?, ?> map) {
            return stringKeys(map);
        }
        return Map.of();
    }

    public Map<String, ?> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    static String kebab(String key) {
        StringBuilder out = new StringBuilder(key.length() + 4);
        for (int i = 0; i < key.length(); i++) {
            char ch = key.charAt(i);
            if (Character.isUpperCase(ch)) {
                if (i > 0) {
                    out.append('-');
                }
                out.append(Character.toLowerCase(ch));
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }
}
