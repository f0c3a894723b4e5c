package com.ciflow.app;

import com.ciflow.core.JobTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Engine settings read from {@code ciflow.properties} on the classpath. Every key can be
 * overridden with a system property of the same name, e.g. {@code -Dciflow.workers=8}.
 *
 * <p><b>Keys:</b></p>
 * <ul>
 *   <li>{@code ciflow.workers}: worker pool size (default 4)</li>
 *   <li>{@code ciflow.defaultTimeout}: ISO-8601 limit for jobs without their own (default PT6H)</li>
 *   <li>{@code ciflow.statusPort}: port of the check status server, 0 to disable (default 8080)</li>
 *   <li>{@code ciflow.artifacts}: {@code memory} or {@code h2} (default memory)</li>
 *   <li>{@code ciflow.jdbcUrl}: H2 URL when artifacts go to H2</li>
 * </ul>
 */
public final class EngineConfig {
    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public static final String RESOURCE = "ciflow.properties";

    public enum ArtifactBackend {
        MEMORY,
        H2
    }

    private final int workers;
    private final Duration defaultTimeout;
    private final int statusPort;
    private final ArtifactBackend artifacts;
    private final String jdbcUrl;

    public EngineConfig(int workers, Duration defaultTimeout, int statusPort, ArtifactBackend artifacts, String jdbcUrl) {
        if (workers < 1) {
            throw new IllegalArgumentException("ciflow.workers must be at least 1, got " + workers);
        }
        if (defaultTimeout != null && defaultTimeout.compareTo(JobTemplate.MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException("ciflow.defaultTimeout must not exceed " + JobTemplate.MAX_TIMEOUT
                    + ", got " + defaultTimeout);
        }
        this.workers = workers;
        this.defaultTimeout = defaultTimeout;
        this.statusPort = statusPort;
        this.artifacts = artifacts;
        this.jdbcUrl = jdbcUrl;
    }

    /**
     * Load the classpath resource, then apply system property overrides.
     *
     * @throws IllegalArgumentException on a malformed value
     */
    public static EngineConfig load() {
        Properties properties = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.info(RESOURCE + " not found, using defaults");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("ciflow.")) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    public static EngineConfig fromProperties(Properties properties) {
        int workers = parseInt(properties, "ciflow.workers", 4);
        int statusPort = parseInt(properties, "ciflow.statusPort", 8080);

        Duration timeout;
        String rawTimeout = properties.getProperty("ciflow.defaultTimeout", "PT6H").trim();
        try {
            timeout = Duration.parse(rawTimeout);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("ciflow.defaultTimeout is not an ISO-8601 duration: " + rawTimeout, e);
        }

        String rawBackend = properties.getProperty("ciflow.artifacts", "memory").trim();
        ArtifactBackend backend;
        try {
            backend = ArtifactBackend.valueOf(rawBackend.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("ciflow.artifacts must be memory or h2, got " + rawBackend, e);
        }

        String jdbcUrl = properties.getProperty("ciflow.jdbcUrl", "jdbc:h2:mem:ciflow;DB_CLOSE_DELAY=-1").trim();
        return new EngineConfig(workers, timeout, statusPort, backend, jdbcUrl);
    }

    private static int parseInt(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
    }

    public int getWorkers() {
        return workers;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public int getStatusPort() {
        return statusPort;
    }

    public ArtifactBackend getArtifacts() {
        return artifacts;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    @Override
    public String toString() {
        return "EngineConfig{workers=" + workers + ", defaultTimeout=" + defaultTimeout + ", statusPort="
                + statusPort + ", artifacts=" + artifacts + '}';
    }
}
