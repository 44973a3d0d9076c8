package com.eia.api.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.exceptions.InvalidArgumentException;
import com.eia.api.fetch.RetryPolicy;
import com.eia.api.query.EndpointBuilder;

/**
 * Immutable client configuration. Built explicitly with {@link #builder()} or
 * resolved by {@link #load(File)} from these sources, later ones overriding:
 * <ol>
 * <li>classpath {@value #DEFAULT_PROPERTIES_FILE}</li>
 * <li>an explicit properties file</li>
 * <li>environment variables ({@value #ENV_API_KEY}, {@value #ENV_BASE_URL})</li>
 * <li>system properties prefixed {@value #SYSTEM_PROPERTY_PREFIX}</li>
 * </ol>
 */
public final class EiaClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(EiaClientConfig.class);

    // Configuration keys
    public static final String API_KEY = "apiKey";
    public static final String BASE_URL = "baseUrl";
    public static final String MAX_ROWS_PER_REQUEST = "maxRowsPerRequest";
    public static final String CONCURRENCY = "concurrency";
    public static final String RETRY_MAX_ATTEMPTS = "retryMaxAttempts";
    public static final String RETRY_INITIAL_BACKOFF_MILLIS = "retryInitialBackoffMillis";
    public static final String DEBUG_LEVEL = "debugLevel";

    public static final String ENV_API_KEY = "EIA_API_KEY";
    public static final String ENV_BASE_URL = "EIA_BASE_URL";
    public static final String SYSTEM_PROPERTY_PREFIX = "eia.";
    public static final String DEFAULT_PROPERTIES_FILE = "eia-client.properties";

    public static final int DEFAULT_MAX_ROWS_PER_REQUEST = 4000;
    public static final int DEFAULT_CONCURRENCY = 8;
    public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 1;
    public static final long DEFAULT_RETRY_INITIAL_BACKOFF_MILLIS = 500;

    private final String apiKey;
    private final String baseUrl;
    private final int maxRowsPerRequest;
    private final int concurrency;
    private final int retryMaxAttempts;
    private final long retryInitialBackoffMillis;
    private final int debugLevel;

    private EiaClientConfig(Builder builder) {
        this.apiKey = builder.apiKey;
        this.baseUrl = builder.baseUrl;
        this.maxRowsPerRequest = builder.maxRowsPerRequest;
        this.concurrency = builder.concurrency;
        this.retryMaxAttempts = builder.retryMaxAttempts;
        this.retryInitialBackoffMillis = builder.retryInitialBackoffMillis;
        this.debugLevel = builder.debugLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EiaClientConfig load() {
        return load(null);
    }

    /**
     * Resolve configuration from all sources.
     *
     * @param propertiesFile optional file layered over the classpath defaults; ignored if missing
     */
    public static EiaClientConfig load(File propertiesFile) {
        Properties config = new Properties();
        loadFromClasspath(config);
        loadFromFile(config, propertiesFile);
        loadFromEnvironment(config, System.getenv());
        loadFromSystemProperties(config, System.getProperties());

        EiaClientConfig resolved = fromProperties(config);
        resolved.logConfigurationStatus();
        return resolved;
    }

    /**
     * Build from already merged properties. Missing keys take their defaults.
     *
     * @throws InvalidArgumentException if a numeric key does not parse
     */
    public static EiaClientConfig fromProperties(Properties properties) {
        Builder builder = builder()
                .apiKey(trimToNull(properties.getProperty(API_KEY)))
                .maxRowsPerRequest(intProperty(properties, MAX_ROWS_PER_REQUEST, DEFAULT_MAX_ROWS_PER_REQUEST))
                .concurrency(intProperty(properties, CONCURRENCY, DEFAULT_CONCURRENCY))
                .retryMaxAttempts(intProperty(properties, RETRY_MAX_ATTEMPTS, DEFAULT_RETRY_MAX_ATTEMPTS))
                .retryInitialBackoffMillis(longProperty(properties, RETRY_INITIAL_BACKOFF_MILLIS,
                        DEFAULT_RETRY_INITIAL_BACKOFF_MILLIS))
                .debugLevel(intProperty(properties, DEBUG_LEVEL, 0));
        String baseUrl = trimToNull(properties.getProperty(BASE_URL));
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    private static void loadFromClasspath(Properties config) {
        try (InputStream input = EiaClientConfig.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES_FILE)) {
            if (input != null) {
                config.load(input);
                logger.debug("Loaded configuration from classpath {}", DEFAULT_PROPERTIES_FILE);
            } else {
                logger.debug("Properties file {} not found in classpath", DEFAULT_PROPERTIES_FILE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties file {}: {}", DEFAULT_PROPERTIES_FILE, e.getMessage());
        }
    }

    private static void loadFromFile(Properties config, File propertiesFile) {
        if (propertiesFile == null) {
            return;
        }
        if (!propertiesFile.isFile()) {
            logger.debug("Configuration file {} not found", propertiesFile.getAbsolutePath());
            return;
        }
        try (InputStream input = new FileInputStream(propertiesFile)) {
            config.load(input);
            logger.info("Loaded configuration from {}", propertiesFile.getAbsolutePath());
        } catch (IOException e) {
            logger.warn("Failed to load configuration file {}: {}", propertiesFile, e.getMessage());
        }
    }

    static void loadFromEnvironment(Properties config, Map<String, String> environment) {
        mapEnvToProperty(config, environment, ENV_API_KEY, API_KEY);
        mapEnvToProperty(config, environment, ENV_BASE_URL, BASE_URL);
    }

    static void loadFromSystemProperties(Properties config, Properties systemProperties) {
        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                config.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()),
                        systemProperties.getProperty(name));
            }
        }
    }

    private static void mapEnvToProperty(Properties config, Map<String, String> environment,
            String envKey, String propKey) {
        String envValue = environment.get(envKey);
        if (envValue != null && !envValue.trim().isEmpty()) {
            config.setProperty(propKey, envValue.trim());
        }
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Configuration key '" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static long longProperty(Properties properties, String key, long defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Configuration key '" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static String trimToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private void logConfigurationStatus() {
        logger.info("EIA Configuration Status:");
        logger.info("  API Key: {}", hasApiKey() ? "configured" : "missing");
        logger.info("  Base URL: {}", baseUrl);
        logger.info("  Max rows per request: {}", maxRowsPerRequest);
        logger.info("  Concurrency: {}", concurrency);
        logger.info("  Retry: {}", getRetryPolicy());
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getMaxRowsPerRequest() {
        return maxRowsPerRequest;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public long getRetryInitialBackoffMillis() {
        return retryInitialBackoffMillis;
    }

    public int getDebugLevel() {
        return debugLevel;
    }

    public RetryPolicy getRetryPolicy() {
        return RetryPolicy.exponential(retryMaxAttempts, Duration.ofMillis(retryInitialBackoffMillis));
    }

    public Builder toBuilder() {
        return builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .maxRowsPerRequest(maxRowsPerRequest)
                .concurrency(concurrency)
                .retryMaxAttempts(retryMaxAttempts)
                .retryInitialBackoffMillis(retryInitialBackoffMillis)
                .debugLevel(debugLevel);
    }

    @Override
    public String toString() {
        return "EiaClientConfig[baseUrl=" + baseUrl + ", apiKey=" + (hasApiKey() ? "***" : "none")
                + ", maxRowsPerRequest=" + maxRowsPerRequest + ", concurrency=" + concurrency
                + ", retryMaxAttempts=" + retryMaxAttempts + ", debugLevel=" + debugLevel + "]";
    }

    public static final class Builder {

        private String apiKey;
        private String baseUrl = EndpointBuilder.DEFAULT_BASE_URL;
        private int maxRowsPerRequest = DEFAULT_MAX_ROWS_PER_REQUEST;
        private int concurrency = DEFAULT_CONCURRENCY;
        private int retryMaxAttempts = DEFAULT_RETRY_MAX_ATTEMPTS;
        private long retryInitialBackoffMillis = DEFAULT_RETRY_INITIAL_BACKOFF_MILLIS;
        private int debugLevel;

        private Builder() {
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder maxRowsPerRequest(int maxRowsPerRequest) {
            this.maxRowsPerRequest = maxRowsPerRequest;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder retryMaxAttempts(int retryMaxAttempts) {
            this.retryMaxAttempts = retryMaxAttempts;
            return this;
        }

        public Builder retryInitialBackoffMillis(long retryInitialBackoffMillis) {
            this.retryInitialBackoffMillis = retryInitialBackoffMillis;
            return this;
        }

        public Builder debugLevel(int debugLevel) {
            this.debugLevel = debugLevel;
            return this;
        }

        public EiaClientConfig build() {
            if (baseUrl == null || baseUrl.trim().isEmpty()) {
                throw new InvalidArgumentException("Base URL must not be blank");
            }
            if (maxRowsPerRequest <= 0) {
                throw new InvalidArgumentException("maxRowsPerRequest must be positive, got: " + maxRowsPerRequest);
            }
            if (concurrency <= 0) {
                throw new InvalidArgumentException("concurrency must be positive, got: " + concurrency);
            }
            if (retryMaxAttempts < 1) {
                throw new InvalidArgumentException("retryMaxAttempts must be at least 1, got: " + retryMaxAttempts);
            }
            if (retryInitialBackoffMillis < 0) {
                throw new InvalidArgumentException("retryInitialBackoffMillis must not be negative");
            }
            return new EiaClientConfig(this);
        }
    }
}
