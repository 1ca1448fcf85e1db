package com.farmsentinel.service;

import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration for the detection service process.
 *
 * <p>
 * Values are resolved from environment variables with defaults. Detector and
 * ensemble tuning lives in {@code ensemble.yml}, not here.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code HTTP_PORT} (8080)</li>
 * <li>{@code ENSEMBLE_CONFIG_PATH}: YAML file overriding the classpath
 * {@code ensemble.yml}</li>
 * <li>{@code READINGS_PATH}: JSON readings file loaded at startup</li>
 * <li>{@code DETECTION_THREADS} (4): farm fan-out and HTTP worker threads</li>
 * <li>{@code MAX_RETURNED_ANOMALIES} (20): anomalies listed per room
 * response</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    private final int httpPort;
    private final String ensembleConfigPath;
    private final String readingsPath;
    private final int detectionThreads;
    private final int maxReturnedAnomalies;

    private ServiceConfig(Builder b) {
        this.httpPort = b.httpPort;
        this.ensembleConfigPath = b.ensembleConfigPath;
        this.readingsPath = b.readingsPath;
        this.detectionThreads = b.detectionThreads;
        this.maxReturnedAnomalies = b.maxReturnedAnomalies;
    }

    /**
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static ServiceConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .httpPort(Integer.parseInt(value(env, "HTTP_PORT", "8080")))
                    .ensembleConfigPath(value(env, "ENSEMBLE_CONFIG_PATH", ""))
                    .readingsPath(value(env, "READINGS_PATH", ""))
                    .detectionThreads(Integer.parseInt(value(env, "DETECTION_THREADS", "4")))
                    .maxReturnedAnomalies(Integer.parseInt(value(env, "MAX_RETURNED_ANOMALIES", "20")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ------- Getters -------

    public int getHttpPort() {
        return httpPort;
    }

    public String getEnsembleConfigPath() {
        return ensembleConfigPath;
    }

    public String getReadingsPath() {
        return readingsPath;
    }

    public int getDetectionThreads() {
        return detectionThreads;
    }

    public int getMaxReturnedAnomalies() {
        return maxReturnedAnomalies;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; {@link #build()} checks the port is in [0, 65535] (0
     * binds an ephemeral port) and that thread and result counts are positive.
     */
    public static class Builder {
        private int httpPort = 8080;
        private String ensembleConfigPath = "";
        private String readingsPath = "";
        private int detectionThreads = 4;
        private int maxReturnedAnomalies = 20;

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder ensembleConfigPath(String v) {
            this.ensembleConfigPath = v;
            return this;
        }

        public Builder readingsPath(String v) {
            this.readingsPath = v;
            return this;
        }

        public Builder detectionThreads(int v) {
            this.detectionThreads = v;
            return this;
        }

        public Builder maxReturnedAnomalies(int v) {
            this.maxReturnedAnomalies = v;
            return this;
        }

        public ServiceConfig build() {
            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (detectionThreads < 1) {
                throw new IllegalArgumentException("detectionThreads must be >= 1, got: " + detectionThreads);
            }
            if (maxReturnedAnomalies < 1) {
                throw new IllegalArgumentException(
                        "maxReturnedAnomalies must be >= 1, got: " + maxReturnedAnomalies);
            }
            ensembleConfigPath = ensembleConfigPath == null ? "" : ensembleConfigPath;
            readingsPath = readingsPath == null ? "" : readingsPath;
            return new ServiceConfig(this);
        }
    }

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v != null && !v.isBlank()) ? v : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "httpPort=" + httpPort +
                ", ensembleConfigPath='" + ensembleConfigPath + '\'' +
                ", readingsPath='" + readingsPath + '\'' +
                ", detectionThreads=" + detectionThreads +
                ", maxReturnedAnomalies=" + maxReturnedAnomalies +
                '}';
    }
}
