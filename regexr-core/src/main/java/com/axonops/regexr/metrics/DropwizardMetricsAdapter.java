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

package com.axonops.regexr.metrics;

import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link RegexrMetricsRegistry} backed by a Dropwizard {@link MetricRegistry}.
 *
 * <p>Every metric name is prefixed, so with prefix {@code "com.myapp.regexr"} the composition
 * counter appears as {@code com.myapp.regexr.patterns.composed.total.count}.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * Regexr.configure(RegexrConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "com.myapp.regexr"))
 *     .build());
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements RegexrMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.regexr";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with prefix {@value #DEFAULT_PREFIX}.
     *
     * @param registry registry to record into
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry registry to record into
     * @param prefix metric name prefix (e.g., "com.myapp.regexr")
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
