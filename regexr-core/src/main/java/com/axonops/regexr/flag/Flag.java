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

package com.axonops.regexr.flag;

/**
 * Inline flags understood by the target pattern syntax.
 *
 * <p>Declaration order is the canonical order used when encoding a flag set: {@code aiLmsux}.
 *
 * @since 1.0.0
 */
public enum Flag {
    /** ASCII-only matching for {@code \w}, {@code \b}, {@code \d}, {@code \s}. */
    ASCII('a'),
    /** Case-insensitive matching. */
    IGNORE_CASE('i'),
    /** Locale dependent matching (bytes patterns only). */
    LOCALE('L'),
    /** {@code ^} and {@code $} match at line boundaries. */
    MULTILINE('m'),
    /** {@code .} also matches line terminators. */
    DOT_ALL('s'),
    /** Unicode matching. */
    UNICODE('u'),
    /** Verbose mode: whitespace and comments in the pattern are ignored. */
    VERBOSE('x');

    private final char code;

    Flag(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }
}
