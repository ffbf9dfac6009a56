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

/**
 * Settings of one dispatcher instance and its native driver.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class DispatcherConfig {

    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 15000L;

    private final long connectTimeoutMs;
    private final boolean sslEnabled;
    private final boolean metricsEnabled;
    private final String instanceId;

    private DispatcherConfig(Builder builder) {
        if (builder.connectTimeoutMs < 1) {
            throw new IllegalArgumentException("Connect timeout must be at least 1ms, got: " + builder.connectTimeoutMs);
        }
        this.connectTimeoutMs = builder.connectTimeoutMs;
        this.sslEnabled = builder.sslEnabled;
        this.metricsEnabled = builder.metricsEnabled;
        this.instanceId = builder.instanceId;
    }

    public static DispatcherConfig defaults() {
        return new Builder().build();
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public boolean isSslEnabled() {
        return sslEnabled;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    /**
     * Value of the {@code instance} tag on dispatcher metrics, or null for no tag.
     */
    public String getInstanceId() {
        return instanceId;
    }

    @Override
    public String toString() {
        return "DispatcherConfig{connectTimeoutMs=" + connectTimeoutMs + ", sslEnabled=" + sslEnabled
            + ", metricsEnabled=" + metricsEnabled + ", instanceId='" + instanceId + "'}";
    }

    /**
     * Builder for DispatcherConfig.
     */
    public static class Builder {
        private long connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        private boolean sslEnabled = false;
        private boolean metricsEnabled = true;
        private String instanceId;

        public Builder connectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder sslEnabled(boolean sslEnabled) {
            this.sslEnabled = sslEnabled;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public DispatcherConfig build() {
            return new DispatcherConfig(this);
        }
    }
}
