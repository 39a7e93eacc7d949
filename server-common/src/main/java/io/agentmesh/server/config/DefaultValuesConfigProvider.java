package io.agentmesh.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads defaults from every {@value #DEFAULTS_RESOURCE} found on the classpath.
 * <p>
 * Two resources defining the same key with different values are rejected, so a module
 * cannot silently override another module's default.
 */
public class DefaultValuesConfigProvider implements ConfigProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValuesConfigProvider.class);

    public static final String DEFAULTS_RESOURCE = "META-INF/agentmesh-defaults.properties";

    private final Map<String, String> defaults;

    public DefaultValuesConfigProvider() {
        this(Thread.currentThread().getContextClassLoader() != null
                ? Thread.currentThread().getContextClassLoader()
                : DefaultValuesConfigProvider.class.getClassLoader());
    }

    public DefaultValuesConfigProvider(ClassLoader classLoader) {
        this.defaults = Map.copyOf(loadDefaults(classLoader));
    }

    private static Map<String, String> loadDefaults(ClassLoader classLoader) {
        Map<String, String> values = new HashMap<>();
        Map<String, URL> origins = new HashMap<>();
        try {
            Enumeration<URL> resources = classLoader.getResources(DEFAULTS_RESOURCE);
            while (resources.hasMoreElements()) {
                URL url = resources.nextElement();
                Properties properties = new Properties();
                try (InputStream in = url.openStream()) {
                    properties.load(in);
                }
                for (String key : properties.stringPropertyNames()) {
                    String value = properties.getProperty(key);
                    String existing = values.putIfAbsent(key, value);
                    if (existing != null && !existing.equals(value)) {
                        throw new IllegalStateException("Duplicate default for '" + key + "' in " + url
                                + " (already defined in " + origins.get(key) + ")");
                    }
                    origins.putIfAbsent(key, url);
                }
                LOGGER.debug("Loaded {} default values from {}", properties.size(), url);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
        return values;
    }

    @Override
    public String getValue(String name) {
        String value = defaults.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No configuration value found for: " + name);
        }
        return value;
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        return Optional.ofNullable(defaults.get(name));
    }
}
