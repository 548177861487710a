package net.crnkit.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A Configuration made of explicit overrides backed by a list of further
 * sources, consulted in order.
 */
public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    /* "crnkit.parser.tabSize" is looked up as CRNKIT_PARSER_TABSIZE. */
    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(key.toUpperCase().replace(".", "_"));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> overrides;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        overrides = new LinkedHashMap<String, String>();
    }

    public Map<String, String> getOverrides() {
        return overrides;
    }

    public List<Configuration> getSources() {
        return sources;
    }

    public String get(String key) {
        if (overrides.containsKey(key)) return overrides.get(key);
        for (Configuration src : sources) {
            String ret = src.get(key);
            if (ret != null) return ret;
        }
        return null;
    }

    /**
     * Override the given setting; a null value masks all sources.
     */
    public DynamicConfiguration put(String key, String value) {
        overrides.put(key, value);
        return this;
    }

    public void remove(String key) {
        overrides.remove(key);
    }

    public DynamicConfiguration addSource(Configuration source) {
        sources.add(source);
        return this;
    }
    public void removeSource(Configuration source) {
        sources.remove(source);
    }

    /**
     * A configuration consulting system properties first and the
     * environment second.
     */
    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
