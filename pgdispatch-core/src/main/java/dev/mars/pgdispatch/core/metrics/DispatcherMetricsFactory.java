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
package dev.mars.pgdispatch.core.metrics;

import dev.mars.pgdispatch.api.metrics.DispatcherMetrics;
import dev.mars.pgdispatch.core.config.DispatcherConfig;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Chooses the metrics implementation for a dispatcher.
 */
public final class DispatcherMetricsFactory {

    private DispatcherMetricsFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return Micrometer metrics when enabled and a registry is available, otherwise no-op
     */
    public static DispatcherMetrics create(DispatcherConfig config, MeterRegistry registry) {
        if (!config.isMetricsEnabled() || registry == null) {
            return NoOpDispatcherMetrics.INSTANCE;
        }
        return new MicrometerDispatcherMetrics(registry, config.getInstanceId());
    }
}
