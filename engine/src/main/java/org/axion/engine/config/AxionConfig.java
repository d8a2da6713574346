package org.axion.engine.config;

import org.axion.AxionException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Engine settings.
 *
 * Values come from {@code axion.properties} on the classpath; a JVM system
 * property with the same key wins over the file. Instances are immutable.
 */
public final class AxionConfig {

    public static final String MAX_ITERATIONS = "axion.simplify.maxIterations";
    public static final String DEFAULT_VARIABLE = "axion.cas.defaultVariable";
    public static final String HASH_ALGORITHM = "axion.hash.algorithm";

    private static final String RESOURCE = "axion.properties";

    private final int maxIterations;
    private final String defaultVariable;
    private final String hashAlgorithm;

    private AxionConfig(int maxIterations, String defaultVariable, String hashAlgorithm) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.defaultVariable = defaultVariable;
        this.hashAlgorithm = hashAlgorithm;
    }

    /**
     * Built-in values, ignoring the classpath and system properties.
     */
    public static AxionConfig defaults() {
        return new AxionConfig(100, "x", "SHA-256");
    }

    /**
     * Loads {@code axion.properties} from the classpath and applies system
     * property overrides.
     */
    public static AxionConfig load() {
        Properties properties = new Properties();
        try (InputStream in = AxionConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    properties.load(reader);
                }
            }
        } catch (IOException e) {
            throw new AxionException("Failed to read " + RESOURCE, e);
        }
        return from(properties);
    }

    static AxionConfig from(Properties properties) {
        AxionConfig defaults = defaults();
        String iterations = setting(properties, MAX_ITERATIONS, String.valueOf(defaults.maxIterations));
        int maxIterations;
        try {
            maxIterations = Integer.parseInt(iterations.trim());
        } catch (NumberFormatException e) {
            throw new AxionException("Invalid value for " + MAX_ITERATIONS + ": " + iterations, e);
        }
        return new AxionConfig(
                maxIterations,
                setting(properties, DEFAULT_VARIABLE, defaults.defaultVariable).trim(),
                setting(properties, HASH_ALGORITHM, defaults.hashAlgorithm).trim());
    }

    private static String setting(Properties properties, String key, String fallback) {
        String override = System.getProperty(key);
        if (override != null) {
            return override;
        }
        return properties.getProperty(key, fallback);
    }

    public AxionConfig withMaxIterations(int maxIterations) {
        return new AxionConfig(maxIterations, defaultVariable, hashAlgorithm);
    }

    public AxionConfig withDefaultVariable(String defaultVariable) {
        return new AxionConfig(maxIterations, defaultVariable, hashAlgorithm);
    }

    public int maxIterations() {
        return maxIterations;
    }

    public String defaultVariable() {
        return defaultVariable;
    }

    public String hashAlgorithm() {
        return hashAlgorithm;
    }

    @Override
    public String toString() {
        return "AxionConfig{maxIterations=" + maxIterations
                + ", defaultVariable=" + defaultVariable
                + ", hashAlgorithm=" + hashAlgorithm + "}";
    }
}
