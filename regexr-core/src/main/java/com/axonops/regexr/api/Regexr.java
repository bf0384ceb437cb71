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

package com.axonops.regexr.api;

import com.axonops.regexr.config.RegexrConfig;
import com.axonops.regexr.metrics.MetricNames;
import com.axonops.regexr.metrics.RegexrMetricsRegistry;
import com.axonops.regexr.node.Node;
import com.axonops.regexr.node.NodeKind;
import com.axonops.regexr.render.CompactRenderer;
import com.axonops.regexr.render.PrettyRenderer;
import com.axonops.regexr.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A composed regular expression: the top-level segments and their rendered pattern text.
 *
 * <p>The segments are concatenated in order. The compact pattern is rendered once, at
 * construction; the pretty form is rendered on demand.
 *
 * <pre>{@code
 * Regexr date = Regexr.of(
 *     Predefined.START,
 *     Regex.named("year", Regex.repeatExact(4, Predefined.DIGIT)),
 *     Regex.literal("-"),
 *     Regex.named("month", Regex.repeatExact(2, Predefined.DIGIT)),
 *     Predefined.END);
 *
 * date.pattern();  // ^(?P<year>\d{4})\-(?P<month>\d{2})$
 * }</pre>
 *
 * Thread-safe: instances are immutable.
 *
 * @since 1.0.0
 */
public final class Regexr {
    private static final Logger logger = LoggerFactory.getLogger(Regexr.class);

    // Global configuration (swapped as a whole)
    private static volatile RegexrConfig config = RegexrConfig.DEFAULT;

    private final List<Node> segments;
    private final String pattern;

    private Regexr(List<Node> segments, String pattern) {
        this.segments = segments;
        this.pattern = pattern;
    }

    /**
     * Replaces the global configuration.
     *
     * @param newConfig configuration for subsequent compositions
     */
    public static void configure(RegexrConfig newConfig) {
        Objects.requireNonNull(newConfig, "config cannot be null");
        config = newConfig;
        logger.info("Regexr: Configuration updated - indentUnit length: {}, metrics: {}",
            newConfig.indentUnit().length(), newConfig.metricsRegistry().getClass().getSimpleName());
    }

    public static RegexrConfig getConfig() {
        return config;
    }

    /**
     * Composes a pattern from segments.
     *
     * @param segments nodes to concatenate
     * @return the composed pattern
     * @throws IllegalArgumentException if a flag toggle is not the first segment
     */
    public static Regexr of(Node... segments) {
        Objects.requireNonNull(segments, "segments cannot be null");
        return of(Arrays.asList(segments));
    }

    /**
     * Composes a pattern from segments.
     *
     * @param segments nodes to concatenate
     * @return the composed pattern
     * @throws IllegalArgumentException if a flag toggle is not the first segment
     */
    public static Regexr of(List<Node> segments) {
        Objects.requireNonNull(segments, "segments cannot be null");
        List<Node> owned = List.copyOf(segments);
        RegexrMetricsRegistry metrics = config.metricsRegistry();

        for (int i = 1; i < owned.size(); i++) {
            if (owned.get(i).kind() == NodeKind.FLAG_TOGGLE) {
                metrics.incrementCounter(MetricNames.ERRORS_FLAG_TOGGLE_PLACEMENT);
                logger.debug("Regexr: Composition rejected - flag toggle at segment {}", i);
                throw new IllegalArgumentException(
                    "Regexr: Flag toggle must be the first segment, found at segment " + i);
            }
        }

        long startNanos = System.nanoTime();
        StringBuilder text = new StringBuilder();
        int nodes = 0;
        for (Node segment : owned) {
            text.append(CompactRenderer.INSTANCE.render(segment));
            nodes += segment.treeSize();
        }
        String pattern = text.toString();
        long durationNanos = System.nanoTime() - startNanos;

        metrics.recordTimer(MetricNames.RENDERING_COMPACT_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.PATTERNS_COMPOSED);
        metrics.incrementCounter(MetricNames.NODES_RENDERED, nodes);

        logger.trace("Regexr: Pattern composed - hash: {}, segments: {}, nodes: {}, length: {}, timeNs: {}",
            PatternHasher.hash(pattern), owned.size(), nodes, pattern.length(), durationNanos);

        return new Regexr(owned, pattern);
    }

    /**
     * @return the compact pattern text
     */
    public String pattern() {
        return pattern;
    }

    /**
     * @return the segments, in order
     */
    public List<Node> segments() {
        return segments;
    }

    /**
     * Multi-line layout using the configured indent unit.
     */
    public String pretty() {
        return pretty(config.indentUnit());
    }

    /**
     * Multi-line layout, one top-level segment after another.
     *
     * @param indentUnit text added once per nesting level
     * @return the layout
     */
    public String pretty(String indentUnit) {
        Objects.requireNonNull(indentUnit, "indentUnit cannot be null");
        RegexrMetricsRegistry metrics = config.metricsRegistry();
        PrettyRenderer renderer = new PrettyRenderer(indentUnit);

        long startNanos = System.nanoTime();
        List<String> parts = new ArrayList<>(segments.size());
        for (Node segment : segments) {
            parts.add(renderer.render(segment));
        }
        String pretty = String.join("\n", parts);
        long durationNanos = System.nanoTime() - startNanos;

        metrics.recordTimer(MetricNames.RENDERING_PRETTY_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.RENDERING_PRETTY);
        logger.trace("Regexr: Pretty rendered - hash: {}, lines: {}",
            PatternHasher.hashWithStyle(pattern, "pretty"), pretty.isEmpty() ? 0 : pretty.split("\n", -1).length);

        return pretty;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Regexr)) {
            return false;
        }
        return pattern.equals(((Regexr) o).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
