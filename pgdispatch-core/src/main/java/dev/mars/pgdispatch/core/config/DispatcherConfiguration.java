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
package dev.mars.pgdispatch.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

/**
 * Property-based configuration for the dispatcher.
 *
 * <p>Sources, later ones overriding earlier ones:</p>
 * <ol>
 *   <li>{@code /pgdispatch-default.properties} on the classpath</li>
 *   <li>{@code /pgdispatch-<profile>.properties} when a profile other than "default" is active</li>
 *   <li>{@code PGDISPATCH_*} environment variables ({@code PGDISPATCH_CONNECT_TIMEOUT_MS} sets
 *       {@code pgdispatch.connect.timeout.ms})</li>
 *   <li>{@code pgdispatch.*} system properties</li>
 * </ol>
 * <p>The profile comes from the {@code pgdispatch.profile} system property or the
 * {@code PGDISPATCH_PROFILE} environment variable.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class DispatcherConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(DispatcherConfiguration.class);

    public static final String CONNECT_TIMEOUT_MS = "pgdispatch.connect.timeout.ms";
    public static final String SSL_ENABLED = "pgdispatch.native.ssl.enabled";
    public static final String METRICS_ENABLED = "pgdispatch.metrics.enabled";
    public static final String METRICS_INSTANCE_ID = "pgdispatch.metrics.instance.id";

    private final Properties properties;
    private final String profile;

    public DispatcherConfiguration() {
        this(getActiveProfile());
    }

    public DispatcherConfiguration(String profile) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        validateConfiguration();
        logger.info("Loaded dispatcher configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("pgdispatch.profile",
               System.getenv("PGDISPATCH_PROFILE") != null ? System.getenv("PGDISPATCH_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/pgdispatch-default.properties");
        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/pgdispatch-" + profile + ".properties");
        }

        System.getenv().forEach((key, value) -> {
            if (key.startsWith("PGDISPATCH_")) {
                props.setProperty(key.toLowerCase().replace("_", "."), value);
            }
        });

        // system properties last so -D wins over the environment
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("pgdispatch.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        String timeout = properties.getProperty(CONNECT_TIMEOUT_MS);
        if (timeout != null) {
            try {
                if (Long.parseLong(timeout.trim()) < 1) {
                    errors.add("Connect timeout must be at least 1ms");
                }
            } catch (NumberFormatException e) {
                errors.add("Connect timeout is not a number: " + timeout);
            }
        }

        String instanceId = properties.getProperty(METRICS_INSTANCE_ID);
        if (instanceId != null && instanceId.isBlank()) {
            errors.add("Metrics instance id cannot be blank");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }
    }

    public String getProfile() {
        return profile;
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public DispatcherConfig getDispatcherConfig() {
        return new DispatcherConfig.Builder()
            .connectTimeoutMs(getLong(CONNECT_TIMEOUT_MS, DispatcherConfig.DEFAULT_CONNECT_TIMEOUT_MS))
            .sslEnabled(getBoolean(SSL_ENABLED, false))
            .metricsEnabled(getBoolean(METRICS_ENABLED, true))
            .instanceId(getString(METRICS_INSTANCE_ID, "pgdispatch-" + UUID.randomUUID().toString().substring(0, 8)))
            .build();
    }
}
