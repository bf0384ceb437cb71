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

package com.axonops.regexr.config;

import com.axonops.regexr.metrics.NoOpMetricsRegistry;
import com.axonops.regexr.metrics.RegexrMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for pattern composition.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: two-space indent, metrics disabled
 * Regexr.configure(RegexrConfig.DEFAULT);
 *
 * // Tab indent, Dropwizard metrics
 * Regexr.configure(RegexrConfig.builder()
 *     .indentUnit("\t")
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.regexr"))
 *     .build());
 * }</pre>
 *
 * @param indentUnit text added once per nesting level by {@code Regexr.pretty()}; must not contain
 *     line breaks. Non-whitespace is accepted but then the pretty form no longer reduces to the
 *     compact form by stripping indentation.
 * @param metricsRegistry Metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 * @see com.axonops.regexr.metrics.MetricNames
 */
public record RegexrConfig(String indentUnit, RegexrMetricsRegistry metricsRegistry) {

  private static final Logger logger = LoggerFactory.getLogger(RegexrConfig.class);

  /** Default indent unit, two spaces. */
  public static final String DEFAULT_INDENT = "  ";

  /** Two-space indent, metrics disabled. */
  public static final RegexrConfig DEFAULT =
      new RegexrConfig(
          DEFAULT_INDENT, // Two spaces
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  /**
   * Compact constructor with validation.
   */
  public RegexrConfig {
    if (indentUnit == null) {
      throw new IllegalArgumentException("indentUnit cannot be null");
    }
    if (indentUnit.indexOf('\n') >= 0 || indentUnit.indexOf('\r') >= 0) {
      throw new IllegalArgumentException("indentUnit must not contain line breaks");
    }
    if (metricsRegistry == null) {
      throw new IllegalArgumentException("metricsRegistry cannot be null");
    }

    // Still valid, but stripping indentation no longer recovers the compact pattern
    if (!indentUnit.isBlank()) {
      logger.warn(
          "Regexr: indentUnit '{}' is not whitespace - pretty output will not reduce to the compact pattern",
          indentUnit);
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. */
  public static class Builder {
    private String indentUnit = DEFAULT_INDENT;
    private RegexrMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Set the indent unit used by {@code Regexr.pretty()}.
     *
     * <p><b>Default: two spaces</b>
     *
     * @param indentUnit indent text, without line breaks
     * @return this builder
     */
    public Builder indentUnit(String indentUnit) {
      this.indentUnit = indentUnit;
      return this;
    }

    /**
     * Set the metrics registry.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry#INSTANCE}</b>
     *
     * @param metricsRegistry metrics implementation
     * @return this builder
     */
    public Builder metricsRegistry(RegexrMetricsRegistry metricsRegistry) {
      this.metricsRegistry = metricsRegistry;
      return this;
    }

    /**
     * Build the configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if a value is invalid
     */
    public RegexrConfig build() {
      return new RegexrConfig(indentUnit, metricsRegistry);
    }
  }
}
