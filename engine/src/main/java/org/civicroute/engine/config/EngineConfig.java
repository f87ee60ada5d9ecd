package org.civicroute.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.civicroute.engine.domain.model.RoutingConfig;
import org.civicroute.engine.workload.WorkloadFailurePolicy;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Immutable configuration for the routing engine.
 * Values come from the process environment, then a .env file (current or parent directory), then defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_API_URL = "http://localhost:5000/api/";
    public static final int DEFAULT_CALLBACK_PORT = 8083;
    public static final int DEFAULT_REFRESH_INTERVAL = 300;
    public static final int DEFAULT_QUERY_TIMEOUT_MILLIS = 5000;
    public static final int DEFAULT_WORKLOAD_THREADS = 4;
    public static final int DEFAULT_CONFLICT_RETRIES = 3;
    public static final String DEFAULT_LOG_FILE = "/app/logs/engine/engine.log";

    // API Configuration
    private final String apiBaseUrl;
    private final String apiToken;

    // Callback Server Configuration
    private final int callbackPort;

    // Registry Configuration
    private final int registryRefreshIntervalSeconds;
    private final boolean registrySchedulerEnabled;

    // Query Configuration
    private final int externalQueryTimeoutMillis;
    private final int workloadQueryThreads;
    private final WorkloadFailurePolicy workloadFailurePolicy;
    private final int conflictRetries;

    // Logging Configuration
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private final RoutingConfig routingConfig;

    private EngineConfig(Builder builder) {
        this.apiBaseUrl = builder.apiBaseUrl;
        this.apiToken = builder.apiToken;
        this.callbackPort = builder.callbackPort;
        this.registryRefreshIntervalSeconds = builder.registryRefreshIntervalSeconds;
        this.registrySchedulerEnabled = builder.registrySchedulerEnabled;
        this.externalQueryTimeoutMillis = builder.externalQueryTimeoutMillis;
        this.workloadQueryThreads = builder.workloadQueryThreads;
        this.workloadFailurePolicy = builder.workloadFailurePolicy;
        this.conflictRetries = builder.conflictRetries;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
        this.routingConfig = builder.routingConfig;
    }

    /**
     * Creates configuration from environment variables and .env files.
     */
    public static EngineConfig fromEnvironment() {
        Map<String, String> source = new HashMap<>();
        putAll(source, Dotenv.configure().directory("../").ignoreIfMissing().load());
        // current directory wins over the parent; system environment wins over both
        putAll(source, Dotenv.configure().ignoreIfMissing().load());
        source.putAll(System.getenv());
        return fromSource(source);
    }

    /**
     * Creates configuration from a flat key/value source.
     */
    public static EngineConfig fromSource(Map<String, String> source) {
        Objects.requireNonNull(source, "source must not be null");
        return new Builder()
                .apiBaseUrl(getString(source, "API_BASE_URL", DEFAULT_API_URL))
                .apiToken(getString(source, "API_TOKEN", ""))
                .callbackPort(getInt(source, "ENGINE_CALLBACK_PORT", DEFAULT_CALLBACK_PORT))
                .registryRefreshIntervalSeconds(getInt(source, "REGISTRY_REFRESH_INTERVAL_SECONDS", DEFAULT_REFRESH_INTERVAL))
                .registrySchedulerEnabled(getBoolean(source, "REGISTRY_SCHEDULER_ENABLED", true))
                .externalQueryTimeoutMillis(getInt(source, "EXTERNAL_QUERY_TIMEOUT_MILLIS", DEFAULT_QUERY_TIMEOUT_MILLIS))
                .workloadQueryThreads(getInt(source, "WORKLOAD_QUERY_THREADS", DEFAULT_WORKLOAD_THREADS))
                .workloadFailurePolicy(getPolicy(source, "WORKLOAD_FAILURE_POLICY"))
                .conflictRetries(getInt(source, "ASSIGNMENT_CONFLICT_RETRIES", DEFAULT_CONFLICT_RETRIES))
                .logFilePath(getString(source, "ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(source, "ENGINE_FILE_LOGGING_ENABLED", true))
                .routingConfig(RoutingConfig.fromMap(RoutingConfig.overridesFrom(source)))
                .build();
    }

    // Getters
    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public int getCallbackPort() {
        return callbackPort;
    }

    public int getRegistryRefreshIntervalSeconds() {
        return registryRefreshIntervalSeconds;
    }

    public boolean isRegistrySchedulerEnabled() {
        return registrySchedulerEnabled;
    }

    public Duration getExternalQueryTimeout() {
        return Duration.ofMillis(externalQueryTimeoutMillis);
    }

    public int getWorkloadQueryThreads() {
        return workloadQueryThreads;
    }

    public WorkloadFailurePolicy getWorkloadFailurePolicy() {
        return workloadFailurePolicy;
    }

    public int getConflictRetries() {
        return conflictRetries;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public RoutingConfig getRoutingConfig() {
        return routingConfig;
    }

    // Source helpers
    private static void putAll(Map<String, String> target, Dotenv dotenv) {
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            target.put(entry.getKey(), entry.getValue());
        }
    }

    private static String getString(Map<String, String> source, String key, String defaultValue) {
        String value = source.get(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(Map<String, String> source, String key, int defaultValue) {
        String value = source.get(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(Map<String, String> source, String key, boolean defaultValue) {
        String value = source.get(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static WorkloadFailurePolicy getPolicy(Map<String, String> source, String key) {
        String value = source.get(key);
        try {
            return WorkloadFailurePolicy.fromCode(value);
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> String.format("Invalid policy for %s: %s, using FAIL_CLOSED", key, value));
            return WorkloadFailurePolicy.FAIL_CLOSED;
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "apiBaseUrl='" + apiBaseUrl + '\'' +
                ", apiToken=" + (apiToken.isEmpty() ? "<none>" : "<set>") +
                ", callbackPort=" + callbackPort +
                ", registryRefreshIntervalSeconds=" + registryRefreshIntervalSeconds +
                ", registrySchedulerEnabled=" + registrySchedulerEnabled +
                ", externalQueryTimeoutMillis=" + externalQueryTimeoutMillis +
                ", workloadFailurePolicy=" + workloadFailurePolicy +
                ", conflictRetries=" + conflictRetries +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String apiBaseUrl = DEFAULT_API_URL;
        private String apiToken = "";
        private int callbackPort = DEFAULT_CALLBACK_PORT;
        private int registryRefreshIntervalSeconds = DEFAULT_REFRESH_INTERVAL;
        private boolean registrySchedulerEnabled = true;
        private int externalQueryTimeoutMillis = DEFAULT_QUERY_TIMEOUT_MILLIS;
        private int workloadQueryThreads = DEFAULT_WORKLOAD_THREADS;
        private WorkloadFailurePolicy workloadFailurePolicy = WorkloadFailurePolicy.FAIL_CLOSED;
        private int conflictRetries = DEFAULT_CONFLICT_RETRIES;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = true;
        private RoutingConfig routingConfig = RoutingConfig.defaults();

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = Objects.requireNonNull(apiBaseUrl, "apiBaseUrl must not be null");
            return this;
        }

        public Builder apiToken(String apiToken) {
            this.apiToken = apiToken != null ? apiToken : "";
            return this;
        }

        public Builder callbackPort(int callbackPort) {
            if (callbackPort < 0 || callbackPort > 65535) {
                throw new IllegalArgumentException("callbackPort must be between 0 and 65535");
            }
            this.callbackPort = callbackPort;
            return this;
        }

        public Builder registryRefreshIntervalSeconds(int registryRefreshIntervalSeconds) {
            if (registryRefreshIntervalSeconds < 1) {
                throw new IllegalArgumentException("registryRefreshIntervalSeconds must be at least 1");
            }
            this.registryRefreshIntervalSeconds = registryRefreshIntervalSeconds;
            return this;
        }

        public Builder registrySchedulerEnabled(boolean registrySchedulerEnabled) {
            this.registrySchedulerEnabled = registrySchedulerEnabled;
            return this;
        }

        public Builder externalQueryTimeoutMillis(int externalQueryTimeoutMillis) {
            if (externalQueryTimeoutMillis < 1) {
                throw new IllegalArgumentException("externalQueryTimeoutMillis must be at least 1");
            }
            this.externalQueryTimeoutMillis = externalQueryTimeoutMillis;
            return this;
        }

        public Builder workloadQueryThreads(int workloadQueryThreads) {
            if (workloadQueryThreads < 1) {
                throw new IllegalArgumentException("workloadQueryThreads must be at least 1");
            }
            this.workloadQueryThreads = workloadQueryThreads;
            return this;
        }

        public Builder workloadFailurePolicy(WorkloadFailurePolicy workloadFailurePolicy) {
            this.workloadFailurePolicy = Objects.requireNonNull(workloadFailurePolicy,
                    "workloadFailurePolicy must not be null");
            return this;
        }

        public Builder conflictRetries(int conflictRetries) {
            if (conflictRetries < 0) {
                throw new IllegalArgumentException("conflictRetries must not be negative");
            }
            this.conflictRetries = conflictRetries;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public Builder routingConfig(RoutingConfig routingConfig) {
            this.routingConfig = Objects.requireNonNull(routingConfig, "routingConfig must not be null");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
