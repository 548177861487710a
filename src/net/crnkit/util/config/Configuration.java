package net.crnkit.util.config;

/**
 * A read-only source of string-valued settings.
 * Keys are dotted lowercase names like "crnkit.parser.tabSize"; absent
 * settings yield null.
 */
public interface Configuration {

    Configuration NULL = new DynamicConfiguration();

    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    String get(String key);

}
