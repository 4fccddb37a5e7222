/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.fleetrun.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for batch runs.
 *
 * <p>Each key resolves, highest priority first, from an environment variable
 * ({@code fleetrun.batch.node-timeout-ms} becomes {@code FLEETRUN_BATCH_NODE_TIMEOUT_MS}),
 * a system property, explicit overrides passed to the constructor, the
 * {@code fleetrun.properties} classpath resource, and finally the built-in default.</p>
 *
 * <p>Instances are created explicitly and handed to the components that need them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-17
 * @version 1.0
 */
public final class FleetRunConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(FleetRunConfiguration.class);
    private static final String CONFIG_FILE = "fleetrun.properties";

    public static final String NODE_TIMEOUT_MS = "fleetrun.batch.node-timeout-ms";
    public static final String RUN_TIMEOUT_MS = "fleetrun.batch.run-timeout-ms";
    public static final String ABANDON_TIMEOUT_MS = "fleetrun.batch.abandon-timeout-ms";
    public static final String TIMESTAMP_PATTERN = "fleetrun.progress.timestamp-pattern";
    public static final String METRICS_ENABLED = "fleetrun.metrics.enabled";

    static final long DEFAULT_NODE_TIMEOUT_MS = 1_800_000L;
    static final long DEFAULT_RUN_TIMEOUT_MS = 0L;
    static final long DEFAULT_ABANDON_TIMEOUT_MS = 30_000L;
    static final String DEFAULT_TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private final Properties fileProperties;
    private final Properties overrides;

    public FleetRunConfiguration() {
        this(new Properties());
    }

    public FleetRunConfiguration(Properties overrides) {
        this.fileProperties = new Properties();
        this.overrides = new Properties();
        if (overrides != null) {
            this.overrides.putAll(overrides);
        }
        loadProperties();
    }

    // ==================== Batch ====================

    /**
     * Budget for one node from admission to terminal report.
     */
    public Duration getNodeTimeout() {
        return Duration.ofMillis(getLong(NODE_TIMEOUT_MS, DEFAULT_NODE_TIMEOUT_MS));
    }

    /**
     * Optional budget for the whole run. Empty when not configured (zero).
     */
    public Optional<Duration> getRunTimeout() {
        long millis = getLong(RUN_TIMEOUT_MS, DEFAULT_RUN_TIMEOUT_MS);
        return millis > 0 ? Optional.of(Duration.ofMillis(millis)) : Optional.empty();
    }

    /**
     * How long in-flight nodes may still finish after a run is cancelled.
     */
    public Duration getAbandonTimeout() {
        return Duration.ofMillis(getLong(ABANDON_TIMEOUT_MS, DEFAULT_ABANDON_TIMEOUT_MS));
    }

    // ==================== Progress / Telemetry ====================

    public String getTimestampPattern() {
        return getString(TIMESTAMP_PATTERN, DEFAULT_TIMESTAMP_PATTERN);
    }

    public boolean isMetricsEnabled() {
        return getBoolean(METRICS_ENABLED, true);
    }

    // ==================== Core Property Accessors ====================

    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        String override = overrides.getProperty(key);
        if (override != null) {
            return override;
        }

        return fileProperties.getProperty(key, defaultValue);
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Fails fast on values the scheduler cannot work with.
     *
     * @throws IllegalStateException if a timeout or the timestamp pattern is invalid
     */
    public void validate() {
        if (getNodeTimeout().toMillis() <= 0) {
            throw new IllegalStateException(
                    "Node timeout must be positive, got: " + getNodeTimeout().toMillis());
        }
        if (getLong(RUN_TIMEOUT_MS, DEFAULT_RUN_TIMEOUT_MS) < 0) {
            throw new IllegalStateException(
                    "Run timeout must not be negative, got: " + getLong(RUN_TIMEOUT_MS, DEFAULT_RUN_TIMEOUT_MS));
        }
        if (getAbandonTimeout().toMillis() <= 0) {
            throw new IllegalStateException(
                    "Abandon timeout must be positive, got: " + getAbandonTimeout().toMillis());
        }
        try {
            DateTimeFormatter.ofPattern(getTimestampPattern());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid timestamp pattern: " + getTimestampPattern(), e);
        }
    }

    public void logConfiguration() {
        logger.info("=== FleetRun Configuration ===");
        logger.info("  Node Timeout:         {}ms", getNodeTimeout().toMillis());
        logger.info("  Run Timeout:          {}", getRunTimeout().map(d -> d.toMillis() + "ms").orElse("none"));
        logger.info("  Abandon Timeout:      {}ms", getAbandonTimeout().toMillis());
        logger.info("  Timestamp Pattern:    {}", getTimestampPattern());
        logger.info("  Metrics Enabled:      {}", isMetricsEnabled());
        logger.info("==============================");
    }

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                fileProperties.load(input);
                logger.debug("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.debug("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
    }
}
