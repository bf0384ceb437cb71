/*
 * Copyright 2025 AxonOps
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

package com.axonops.regexr.dropwizard;

import com.axonops.regexr.config.RegexrConfig;
import com.axonops.regexr.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link RegexrConfig} with Dropwizard Metrics integration.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Application registry, exposed via JMX:
 * MetricRegistry registry = new MetricRegistry();
 * Regexr.configure(RegexrMetricsConfig.withMetrics(registry, "com.myapp.regexr"));
 *
 * // Registry already reported elsewhere:
 * Regexr.configure(RegexrMetricsConfig.withMetrics(registry, "com.myapp.regexr", false));
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> one {@link JmxReporter} is started for the first registry
 * passed with JMX enabled and kept until {@link #shutdown()}.
 *
 * @since 1.0.0
 */
public final class RegexrMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(RegexrMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private RegexrMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a config recording into the registry, exposed via JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return config with metrics enabled
     */
    public static RegexrConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a config recording into the registry.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start a JMX reporter for the registry
     * @return config with metrics enabled
     */
    public static RegexrConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return RegexrConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Creates a config with prefix {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}, exposed via
     * JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return config with metrics enabled
     */
    public static RegexrConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * @return whether a JMX reporter is running
     */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("Regexr: Registering JmxReporter for metrics");
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("Regexr: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - metrics are still recorded in the registry
                logger.warn("Regexr: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Stops the JMX reporter, if one is running.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Regexr: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
