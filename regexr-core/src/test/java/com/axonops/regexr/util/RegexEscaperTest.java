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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Literal escaping")
class RegexEscaperTest {

    @Test
    @DisplayName("Plain text should be returned unchanged")
    void escape_plainText_unchanged() {
        String text = "abcXYZ_019";
        assertThat(RegexEscaper.escape(text)).isSameAs(text);
        assertThat(RegexEscaper.escape("")).isEmpty();
    }

    @Test
    @DisplayName("Every metacharacter should get a backslash")
    void escape_metacharacters_backslashed() {
        assertThat(RegexEscaper.escape("()[]{}?*+-|^$\\.&~# "))
            .isEqualTo("\\(\\)\\[\\]\\{\\}\\?\\*\\+\\-\\|\\^\\$\\\\\\.\\&\\~\\#\\ ");
    }

    @Test
    @DisplayName("Control characters should become letter escapes")
    void escape_controlCharacters_letterEscapes() {
        assertThat(RegexEscaper.escape("a\tb\nc\rd\fe\013f")).isEqualTo("a\\tb\\nc\\rd\\fe\\x0bf");
    }

    @Test
    @DisplayName("Characters that need no escape should pass through")
    void escape_otherPunctuation_unchanged() {
        assertThat(RegexEscaper.escape("a,b:c=d!e<f>g'h\"i%j@k/l")).isEqualTo("a,b:c=d!e<f>g'h\"i%j@k/l");
        assertThat(RegexEscaper.escape("μ𝔘")).isEqualTo("μ𝔘");
    }

    @ParameterizedTest
    @ValueSource(strings = {"a.b", "1+1=2", "(x|y)", "[a-z]*", "c:\\temp", "price $5 ^ up?", "tab\there", "#{x}~&"})
    @DisplayName("Escaped text should match itself literally")
    void escape_anyText_matchesItself(String text) {
        assertThat(Pattern.matches(RegexEscaper.escape(text), text)).isTrue();
    }

    @Test
    @DisplayName("Escaped text should never contain a raw line break")
    void escape_lineBreaks_neverRaw() {
        assertThat(RegexEscaper.escape("one\ntwo\rthree")).doesNotContain("\n", "\r");
    }
}
