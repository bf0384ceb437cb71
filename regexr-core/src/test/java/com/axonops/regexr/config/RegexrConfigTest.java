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

import com.axonops.regexr.metrics.DropwizardMetricsAdapter;
import com.axonops.regexr.metrics.NoOpMetricsRegistry;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RegexrConfig} defaults, builder and validation.
 */
@DisplayName("Regexr configuration")
class RegexrConfigTest {

    @Test
    @DisplayName("Default config should use two spaces and no metrics")
    void defaultConfig_values() {
        assertThat(RegexrConfig.DEFAULT.indentUnit()).isEqualTo("  ");
        assertThat(RegexrConfig.DEFAULT.metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
    }

    @Test
    @DisplayName("Builder without settings should equal the default")
    void builder_noSettings_equalsDefault() {
        assertThat(RegexrConfig.builder().build()).isEqualTo(RegexrConfig.DEFAULT);
    }

    @Test
    @DisplayName("Builder should apply custom values")
    void builder_customValues_applied() {
        DropwizardMetricsAdapter metrics = new DropwizardMetricsAdapter(new MetricRegistry(), "app");
        RegexrConfig config = RegexrConfig.builder()
            .indentUnit("\t")
            .metricsRegistry(metrics)
            .build();

        assertThat(config.indentUnit()).isEqualTo("\t");
        assertThat(config.metricsRegistry()).isSameAs(metrics);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "    ", "\t", " \t"})
    @DisplayName("Whitespace indents should be accepted")
    void indentUnit_whitespace_accepted(String indent) {
        assertThat(RegexrConfig.builder().indentUnit(indent).build().indentUnit()).isEqualTo(indent);
    }

    @Test
    @DisplayName("Visible indent should be accepted")
    void indentUnit_visible_accepted() {
        assertThat(RegexrConfig.builder().indentUnit("..").build().indentUnit()).isEqualTo("..");
    }

    @ParameterizedTest
    @ValueSource(strings = {"\n", " \n ", "\r", "\r\n"})
    @DisplayName("Indents with line breaks should be rejected")
    void indentUnit_lineBreak_throws(String indent) {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> RegexrConfig.builder().indentUnit(indent).build())
            .withMessageContaining("line breaks");
    }

    @Test
    @DisplayName("Null values should be rejected")
    void nullValues_throw() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> RegexrConfig.builder().indentUnit(null).build())
            .withMessageContaining("indentUnit");
        assertThatIllegalArgumentException()
            .isThrownBy(() -> RegexrConfig.builder().metricsRegistry(null).build())
            .withMessageContaining("metricsRegistry");
    }
}
