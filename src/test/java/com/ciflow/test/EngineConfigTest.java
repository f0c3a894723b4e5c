package com.ciflow.test;

import com.ciflow.app.EngineConfig;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for engine configuration parsing.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class EngineConfigTest {

    /**
     * Test 1: Empty properties give the defaults.
     */
    @Test
    @Order(1)
    public void testDefaults() {
        EngineConfig config = EngineConfig.fromProperties(new Properties());

        assertEquals(4, config.getWorkers());
        assertEquals(Duration.ofHours(6), config.getDefaultTimeout());
        assertEquals(8080, config.getStatusPort());
        assertEquals(EngineConfig.ArtifactBackend.MEMORY, config.getArtifacts());
    }

    /**
     * Test 2: Explicit values are honoured.
     */
    @Test
    @Order(2)
    public void testExplicitValues() {
        Properties properties = new Properties();
        properties.setProperty("ciflow.workers", " 8 ");
        properties.setProperty("ciflow.defaultTimeout", "PT30M");
        properties.setProperty("ciflow.statusPort", "0");
        properties.setProperty("ciflow.artifacts", "h2");
        properties.setProperty("ciflow.jdbcUrl", "jdbc:h2:mem:other");

        EngineConfig config = EngineConfig.fromProperties(properties);

        assertEquals(8, config.getWorkers());
        assertEquals(Duration.ofMinutes(30), config.getDefaultTimeout());
        assertEquals(0, config.getStatusPort());
        assertEquals(EngineConfig.ArtifactBackend.H2, config.getArtifacts());
        assertEquals("jdbc:h2:mem:other", config.getJdbcUrl());
    }

    /**
     * Test 3: Malformed values are rejected with the offending key.
     */
    @Test
    @Order(3)
    public void testMalformedValues() {
        assertRejected("ciflow.workers", "many");
        assertRejected("ciflow.workers", "0");
        assertRejected("ciflow.defaultTimeout", "6 hours");
        assertRejected("ciflow.artifacts", "s3");
        assertRejected("ciflow.defaultTimeout", "PT9999999999999H");
    }

    /**
     * Test 4: The bundled resource loads.
     */
    @Test
    @Order(4)
    public void testLoadBundled() {
        EngineConfig config = EngineConfig.load();
        assertTrue(config.getWorkers() >= 1);
        assertNotNull(config.getJdbcUrl());
    }

    private static void assertRejected(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromProperties(properties));
        assertTrue(e.getMessage().contains(key), e.getMessage());
    }
}
