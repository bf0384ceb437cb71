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

import com.axonops.regexr.api.Regexr;
import com.axonops.regexr.config.RegexrConfig;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.Set;

import static com.axonops.regexr.api.Predefined.*;
import static com.axonops.regexr.api.Regex.*;
import static org.assertj.core.api.Assertions.*;

/**
 * JMX integration tests.
 *
 * Verifies that metrics are actually exposed via JMX and accessible
 * through the platform MBean server.
 */
class JmxIntegrationTest {

    private JmxReporter jmxReporter;
    private MetricRegistry registry;
    private RegexrConfig originalConfig;

    @BeforeEach
    void setup() {
        originalConfig = Regexr.getConfig();
        registry = new MetricRegistry();
        RegexrMetricsConfig.shutdown();
    }

    @AfterEach
    void cleanup() {
        if (jmxReporter != null) {
            jmxReporter.stop();
            jmxReporter = null;
        }
        RegexrMetricsConfig.shutdown();
        Regexr.configure(originalConfig);
    }

    @Test
    void testMetricsExposedViaJmx() throws Exception {
        // Start our own reporter, leave JMX off in the config
        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
        Regexr.configure(RegexrMetricsConfig.withMetrics(registry, "com.test.jmx", false));

        // Compose and pretty-print to generate metrics
        Regexr.of(START, named("id", DIGITS), END).pretty();

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();

        // Dropwizard uses the "metrics" domain with type classification
        Set<ObjectName> mbeans = mBeanServer.queryNames(
            new ObjectName("metrics:name=com.test.jmx.*,type=*"), null
        );

        assertThat(mbeans)
            .as("JMX MBeans should be registered for Regexr metrics")
            .hasSize(5);

        boolean foundComposedCounter = mbeans.stream()
            .anyMatch(name -> name.toString().contains("patterns.composed.total.count") && name.toString().contains("type=counters"));

        boolean foundCompactTimer = mbeans.stream()
            .anyMatch(name -> name.toString().contains("rendering.compact.latency") && name.toString().contains("type=timers"));

        boolean foundPrettyTimer = mbeans.stream()
            .anyMatch(name -> name.toString().contains("rendering.pretty.latency") && name.toString().contains("type=timers"));

        assertThat(foundComposedCounter)
            .as("patterns.composed.total.count counter should be in JMX")
            .isTrue();

        assertThat(foundCompactTimer)
            .as("rendering.compact.latency timer should be in JMX")
            .isTrue();

        assertThat(foundPrettyTimer)
            .as("rendering.pretty.latency timer should be in JMX")
            .isTrue();
    }

    @Test
    void testCounterValueReadableViaJmx() throws Exception {
        // JMX reporter started by the config factory
        Regexr.configure(RegexrMetricsConfig.withMetrics(registry, "com.test.jmxvalue"));
        assertThat(RegexrMetricsConfig.isJmxReporterRunning()).isTrue();

        Regexr.of(literal("a"));
        Regexr.of(literal("b"));

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName composed = new ObjectName(
            "metrics:name=com.test.jmxvalue.patterns.composed.total.count,type=counters");

        assertThat(mBeanServer.isRegistered(composed)).isTrue();
        assertThat(mBeanServer.getAttribute(composed, "Count")).isEqualTo(2L);
    }

    @Test
    void testShutdownUnregistersMBeans() throws Exception {
        Regexr.configure(RegexrMetricsConfig.withMetrics(registry, "com.test.jmxstop"));
        Regexr.of(literal("a"));

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName composed = new ObjectName(
            "metrics:name=com.test.jmxstop.patterns.composed.total.count,type=counters");
        assertThat(mBeanServer.isRegistered(composed)).isTrue();

        RegexrMetricsConfig.shutdown();

        assertThat(RegexrMetricsConfig.isJmxReporterRunning()).isFalse();
        assertThat(mBeanServer.isRegistered(composed)).isFalse();
    }
}
