package com.aerarisk.job;

import com.aerarisk.core.config.ConfigurationException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of the nightly risk job.
 *
 * <p>
 * Values are resolved from environment variables. The store URL and service
 * key are required; everything else has a default.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String ENV_SUPABASE_URL = "SUPABASE_URL";
    public static final String ENV_SUPABASE_KEY = "SUPABASE_SERVICE_ROLE_KEY";
    public static final String ENV_MODEL_VERSION = "AERA_MODEL_VERSION";
    public static final String ENV_MODEL_CONFIG_PATH = "MODEL_CONFIG_PATH";
    public static final String ENV_READ_TIMEOUT = "STORE_READ_TIMEOUT_SECONDS";
    public static final String ENV_WRITE_TIMEOUT = "STORE_WRITE_TIMEOUT_SECONDS";

    public static final String DEFAULT_MODEL_VERSION = "level3-2026.02";

    // ---------------------------------------------------------------
    // Store
    // ---------------------------------------------------------------
    private final String supabaseUrl;
    private final String serviceKey;
    private final Duration readTimeout;
    private final Duration writeTimeout;

    // ---------------------------------------------------------------
    // Model
    // ---------------------------------------------------------------
    private final String modelVersion;
    private final String modelConfigPath;

    private JobConfig(Builder b) {
        this.supabaseUrl = b.supabaseUrl;
        this.serviceKey = b.serviceKey;
        this.readTimeout = Duration.ofSeconds(b.readTimeoutSeconds);
        this.writeTimeout = Duration.ofSeconds(b.writeTimeoutSeconds);
        this.modelVersion = b.modelVersion;
        this.modelConfigPath = b.modelConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws ConfigurationException if a required variable is missing or a
     *                                value cannot be parsed
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from the given variables.
     *
     * @param env variable name to value
     * @return fully populated configuration
     * @throws ConfigurationException if a required variable is missing or a
     *                                value cannot be parsed
     */
    public static JobConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .supabaseUrl(env(env, ENV_SUPABASE_URL, null))
                    .serviceKey(env(env, ENV_SUPABASE_KEY, null))
                    .modelVersion(env(env, ENV_MODEL_VERSION, DEFAULT_MODEL_VERSION))
                    .modelConfigPath(env(env, ENV_MODEL_CONFIG_PATH, ""))
                    .readTimeoutSeconds(Long.parseLong(env(env, ENV_READ_TIMEOUT, "60")))
                    .writeTimeoutSeconds(Long.parseLong(env(env, ENV_WRITE_TIMEOUT, "120")))
                    .build();
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSupabaseUrl() {
        return supabaseUrl;
    }

    public String getServiceKey() {
        return serviceKey;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public String getModelConfigPath() {
        return modelConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} requires a non-blank URL and key and positive timeouts.
     * A trailing {@code /} on the URL is removed.
     * </p>
     */
    public static class Builder {
        private String supabaseUrl;
        private String serviceKey;
        private String modelVersion = DEFAULT_MODEL_VERSION;
        private String modelConfigPath = "";
        private long readTimeoutSeconds = 60;
        private long writeTimeoutSeconds = 120;

        public Builder supabaseUrl(String v) {
            this.supabaseUrl = v;
            return this;
        }

        public Builder serviceKey(String v) {
            this.serviceKey = v;
            return this;
        }

        public Builder modelVersion(String v) {
            this.modelVersion = v;
            return this;
        }

        public Builder modelConfigPath(String v) {
            this.modelConfigPath = v;
            return this;
        }

        public Builder readTimeoutSeconds(long v) {
            this.readTimeoutSeconds = v;
            return this;
        }

        public Builder writeTimeoutSeconds(long v) {
            this.writeTimeoutSeconds = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws ConfigurationException if any value is missing or invalid
         */
        public JobConfig build() {
            requireNonBlank(supabaseUrl, ENV_SUPABASE_URL);
            requireNonBlank(serviceKey, ENV_SUPABASE_KEY);
            requireNonBlank(modelVersion, ENV_MODEL_VERSION);

            if (readTimeoutSeconds < 1) {
                throw new ConfigurationException(
                        "readTimeoutSeconds must be >= 1, got: " + readTimeoutSeconds);
            }
            if (writeTimeoutSeconds < 1) {
                throw new ConfigurationException(
                        "writeTimeoutSeconds must be >= 1, got: " + writeTimeoutSeconds);
            }

            supabaseUrl = stripTrailingSlash(supabaseUrl.trim());
            if (modelConfigPath == null) {
                modelConfigPath = "";
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new ConfigurationException(name + " must be set");
            }
        }

        private static String stripTrailingSlash(String url) {
            String result = url;
            while (result.endsWith("/")) {
                result = result.substring(0, result.length() - 1);
            }
            return result;
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        // never print the service key
        return "JobConfig{" +
                "supabaseUrl='" + supabaseUrl + '\'' +
                ", modelVersion='" + modelVersion + '\'' +
                ", modelConfigPath='" + modelConfigPath + '\'' +
                ", readTimeout=" + readTimeout +
                ", writeTimeout=" + writeTimeout +
                '}';
    }
}
