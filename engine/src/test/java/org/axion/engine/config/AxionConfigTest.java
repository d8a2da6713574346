package org.axion.engine.config;

import org.axion.AxionException;
import org.junit.jupiter.api.*;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Axion Config Tests")
class AxionConfigTest {

    @Test
    @DisplayName("Built-in defaults")
    void defaults() {
        AxionConfig config = AxionConfig.defaults();
        assertEquals(100, config.maxIterations());
        assertEquals("x", config.defaultVariable());
        assertEquals("SHA-256", config.hashAlgorithm());
    }

    @Test
    @DisplayName("Classpath file is read")
    void loadFromClasspath() {
        AxionConfig config = AxionConfig.load();
        assertEquals(100, config.maxIterations());
        assertEquals("x", config.defaultVariable());
        assertEquals("SHA-256", config.hashAlgorithm());
    }

    @Test
    @DisplayName("File values replace defaults, missing keys keep them")
    void fromProperties() {
        Properties properties = new Properties();
        properties.setProperty(AxionConfig.MAX_ITERATIONS, " 25 ");
        properties.setProperty(AxionConfig.DEFAULT_VARIABLE, "t");

        AxionConfig config = AxionConfig.from(properties);

        assertEquals(25, config.maxIterations());
        assertEquals("t", config.defaultVariable());
        assertEquals("SHA-256", config.hashAlgorithm());
    }

    @Test
    @DisplayName("System properties win over the file")
    void systemPropertyOverride() {
        Properties properties = new Properties();
        properties.setProperty(AxionConfig.MAX_ITERATIONS, "25");
        System.setProperty(AxionConfig.MAX_ITERATIONS, "7");
        try {
            assertEquals(7, AxionConfig.from(properties).maxIterations());
        } finally {
            System.clearProperty(AxionConfig.MAX_ITERATIONS);
        }
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void invalidValues() {
        Properties notANumber = new Properties();
        notANumber.setProperty(AxionConfig.MAX_ITERATIONS, "many");
        AxionException exception = assertThrows(AxionException.class, () -> AxionConfig.from(notANumber));
        assertTrue(exception.getMessage().contains(AxionConfig.MAX_ITERATIONS));

        assertThrows(IllegalArgumentException.class, () -> AxionConfig.defaults().withMaxIterations(0));
    }
}
