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

/**
 * Escapes literal text so that it matches itself when embedded in a pattern.
 *
 * <p>Escapes the metacharacter set {@code ()[]{}?*+-|^$\.&~#} and space with a backslash.
 * Control characters are written as escapes rather than raw characters, so escaped text never
 * contains a line break:
 *
 * <ul>
 *   <li>tab, newline, carriage return, form feed: {@code \t}, {@code \n}, {@code \r}, {@code \f}
 *   <li>vertical tab: {@code \x0b}
 * </ul>
 *
 * <p>All other characters, including non-ASCII ones, pass through unchanged.
 *
 * @since 1.0.0
 */
public final class RegexEscaper {

    private static final String SPECIAL = "()[]{}?*+-|^$\\.&~# ";

    private RegexEscaper() {
        // Utility class
    }

    public static String escape(String text) {
        if (text == null) {
            throw new NullPointerException("text cannot be null");
        }
        StringBuilder out = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement = replacementFor(c);
            if (replacement == null) {
                if (out != null) {
                    out.append(c);
                }
                continue;
            }
            if (out == null) {
                out = new StringBuilder(text.length() + 8);
                out.append(text, 0, i);
            }
            out.append(replacement);
        }
        return out == null ? text : out.toString();
    }

    private static String replacementFor(char c) {
        switch (c) {
            case '\t':
                return "\\t";
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            case '\f':
                return "\\f";
            case '\013':
                return "\\x0b";
            default:
                return SPECIAL.indexOf(c) >= 0 ? "\\" + c : null;
        }
    }
}
