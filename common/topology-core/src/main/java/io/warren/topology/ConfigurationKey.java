package io.warren.topology;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A flat-map configuration key of the form {@code <type>_<name>}, e.g. {@code exchange_orders}.
 */
public record ConfigurationKey(Type type, String name) {

    static final Pattern NAMING_PATTERN = Pattern.compile("(?<type>queue|connection|exchange)_(?<name>[-\\w]+)");

    static final String BIND_TO_PREFIX = "bind-to_";

    public enum Type {
        QUEUE,
        CONNECTION,
        EXCHANGE
    }

    public static ConfigurationKey parse(String key) {
        Matcher matcher = key == null ? null : NAMING_PATTERN.matcher(key);
        if (matcher == null || !matcher.matches()) {
            throw new TopologyConfigurationException("configuration key '" + key
                + "' does not match pattern <type>_<name> with type one of queue, connection, exchange");
        }
        return new ConfigurationKey(Type.valueOf(matcher.group("type").toUpperCase(Locale.ROOT)),
            matcher.group("name"));
    }

    public static boolean isBindTo(String key) {
        return key != null && key.startsWith(BIND_TO_PREFIX);
    }

    /**
     * Parses a {@code bind-to_exchange_<name>} key on {@code exchange} and returns the target name.
     */
    public static String bindTarget(String exchange, String key) {
        String remainder = key.substring(BIND_TO_PREFIX.length());
        Matcher matcher = NAMING_PATTERN.matcher(remainder);
        if (!matcher.matches() || !"exchange".equals(matcher.group("type"))) {
            throw new TopologyConfigurationException("exchange '" + exchange
                + "' has 'bind-to' parameter '" + key + "' that does not match pattern bind-to_exchange_<name>");
        }
        return matcher.group("name");
    }
}
