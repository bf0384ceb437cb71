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

/**
 * Metric name constants for pattern composition and rendering.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * Regexr.configure(RegexrMetricsConfig.withMetrics(registry, "myapp.regexr", true));
 *
 * Regexr.of(Regex.named("year", Predefined.DIGITS));
 *
 * Counter composed = registry.counter(
 *     MetricRegistry.name("myapp.regexr", MetricNames.PATTERNS_COMPOSED));
 * }</pre>
 *
 * @since 1.0.0
 * @see com.axonops.regexr.api.Regexr
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Composition
  // ========================================

  /**
   * Patterns composed.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> Each successful {@code Regexr.of(...)}
   */
  public static final String PATTERNS_COMPOSED = "patterns.composed.total.count";

  /**
   * Nodes rendered to compact text, counted over whole trees.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Divided by {@link #PATTERNS_COMPOSED}, the mean tree size
   */
  public static final String NODES_RENDERED = "nodes.rendered.total.count";

  /**
   * Compact rendering latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String RENDERING_COMPACT_LATENCY = "rendering.compact.latency";

  // ========================================
  // Pretty Rendering
  // ========================================

  /**
   * Pretty renderings requested.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String RENDERING_PRETTY = "rendering.pretty.total.count";

  /**
   * Pretty rendering latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String RENDERING_PRETTY_LATENCY = "rendering.pretty.latency";

  // ========================================
  // Errors
  // ========================================

  /**
   * Compositions rejected by {@code Regexr.of} because a flag toggle is not the first segment.
   *
   * <p>Node construction errors (bounds, names, flag codes) are thrown to the caller before
   * composition and are not counted here.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Should be zero; non-zero indicates a caller bug
   */
  public static final String ERRORS_FLAG_TOGGLE_PLACEMENT = "errors.flag_toggle_placement.total.count";
}
