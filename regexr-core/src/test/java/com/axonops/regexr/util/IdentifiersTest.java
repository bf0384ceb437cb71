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

package com.axonops.regexr.util;

import com.axonops.regexr.api.InvalidIdentifierException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Group identifiers")
class IdentifiersTest {

    @ParameterizedTest
    @ValueSource(strings = {"a", "a1", "_", "_private", "year", "CamelCase", "μ", "𝔘𝔫𝔦𝔠𝔬𝔡𝔢", "名前"})
    @DisplayName("Identifiers should be accepted")
    void isValid_identifiers_true(String name) {
        assertThat(Identifiers.isValid(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1a", "a.b", "a-b", "a b", "a$", "-"})
    @DisplayName("Non-identifiers should be rejected")
    void isValid_nonIdentifiers_false(String name) {
        assertThat(Identifiers.isValid(name)).isFalse();
    }

    @Test
    @DisplayName("null should not be an identifier")
    void isValid_null_false() {
        assertThat(Identifiers.isValid(null)).isFalse();
    }

    @Test
    @DisplayName("requireValid() should report the rejected name")
    void requireValid_invalid_throwsWithIdentifier() {
        assertThatThrownBy(() -> Identifiers.requireValid("a.b", "capture name"))
            .isInstanceOf(InvalidIdentifierException.class)
            .hasMessageContaining("capture name")
            .satisfies(e -> assertThat(((InvalidIdentifierException) e).getIdentifier()).isEqualTo("a.b"));
        assertThat(Identifiers.requireValid("ok", "capture name")).isEqualTo("ok");
    }

    @Test
    @DisplayName("PatternHasher should be stable and tag the style")
    void patternHasher_sameInput_sameHash() {
        assertThat(PatternHasher.hash("a+")).isEqualTo(PatternHasher.hash("a+"));
        assertThat(PatternHasher.hash(null)).isEqualTo("null");
        assertThat(PatternHasher.hashWithStyle("a+", "pretty")).endsWith("[pretty]");
    }
}
