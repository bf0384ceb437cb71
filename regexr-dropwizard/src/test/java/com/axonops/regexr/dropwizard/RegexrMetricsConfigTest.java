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
import com.axonops.regexr.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.axonops.regexr.api.Regex.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for RegexrMetricsConfig convenience factory.
 */
class RegexrMetricsConfigTest {

  private RegexrConfig originalConfig;

  @BeforeEach
  void setup() {
    originalConfig = Regexr.getConfig();
    RegexrMetricsConfig.shutdown();
  }

  @AfterEach
  void cleanup() {
    RegexrMetricsConfig.shutdown();
    Regexr.configure(originalConfig);
  }

  @Test
  void testWithMetrics_CustomPrefix() {
    MetricRegistry registry = new MetricRegistry();

    RegexrConfig config = RegexrMetricsConfig.withMetrics(registry, "com.myapp.regex", false);

    assertThat(config).isNotNull();
    assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
    assertThat(config.indentUnit()).isEqualTo(RegexrConfig.DEFAULT_INDENT);

    Regexr.configure(config);
    Regexr.of(literal("a"));

    assertThat(registry.getCounters()).containsKey("com.myapp.regex.patterns.composed.total.count");
  }

  @Test
  void testWithMetrics_DefaultPrefix() {
    MetricRegistry registry = new MetricRegistry();

    RegexrConfig config = RegexrMetricsConfig.withMetrics(registry);
    Regexr.configure(config);
    Regexr.of(literal("a"));

    assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
    assertThat(registry.getCounters()).containsKey("com.axonops.regexr.patterns.composed.total.count");
  }

  @Test
  void testWithMetrics_EnablesJmxByDefault() {
    RegexrMetricsConfig.withMetrics(new MetricRegistry(), "test");

    assertThat(RegexrMetricsConfig.isJmxReporterRunning()).isTrue();
  }

  @Test
  void testWithMetrics_DisableJmx() {
    RegexrConfig config = RegexrMetricsConfig.withMetrics(new MetricRegistry(), "test", false);

    assertThat(config).isNotNull();
    assertThat(RegexrMetricsConfig.isJmxReporterRunning()).isFalse();
  }

  @Test
  void testShutdown_Idempotent() {
    RegexrMetricsConfig.withMetrics(new MetricRegistry(), "test");

    RegexrMetricsConfig.shutdown();
    RegexrMetricsConfig.shutdown();

    assertThat(RegexrMetricsConfig.isJmxReporterRunning()).isFalse();
  }

  @Test
  void testNullRegistry_ThrowsException() {
    assertThatThrownBy(() -> RegexrMetricsConfig.withMetrics(null, "test"))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("registry");
  }

  @Test
  void testNullPrefix_ThrowsException() {
    MetricRegistry registry = new MetricRegistry();

    assertThatThrownBy(() -> RegexrMetricsConfig.withMetrics(registry, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("metricPrefix");
  }
}
