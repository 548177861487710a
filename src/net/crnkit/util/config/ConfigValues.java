package net.crnkit.util.config;

/**
 * Typed accessors for Configuration values.
 */
public final class ConfigValues {

    /* Prevent construction */
    private ConfigValues() {}

    /**
     * Return whether the string represents an affirmative value.
     * More lenient than Boolean.parseBoolean(); accepts inputs such as "1",
     * "y", "yes", "on" (ignoring case) as true.
     */
    public static boolean isTrue(String s) {
        if (s == null) return false;
        return (Boolean.parseBoolean(s) || s.equalsIgnoreCase("1") ||
            s.equalsIgnoreCase("y") || s.equalsIgnoreCase("yes") ||
            s.equalsIgnoreCase("on"));
    }

    public static boolean getBoolean(Configuration config, String key,
                                     boolean defaultValue) {
        String value = config.get(key);
        if (value == null || value.trim().isEmpty()) return defaultValue;
        return isTrue(value.trim());
    }

    public static int getInt(Configuration config, String key,
                             int defaultValue) {
        String value = config.get(key);
        if (value == null || value.trim().isEmpty()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid integer value " +
                "for configuration key " + key + ": " + value, exc);
        }
    }

}
