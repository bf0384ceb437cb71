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

import com.axonops.regexr.node.Raw;

/**
 * Common pattern fragments.
 *
 * <p>All are raw text marked as self-contained, so quantifiers apply to them without an extra
 * group: {@code oneOrMore(DIGIT)} renders {@code \d+}.
 *
 * @since 1.0.0
 */
public final class Predefined {

    private Predefined() {
        // Constants only
    }

    // Anchors
    public static final Raw START = Raw.entire("^");
    public static final Raw START_OF_STRING = Raw.entire("\\A");
    public static final Raw END = Raw.entire("$");
    public static final Raw END_OF_STRING = Raw.entire("\\Z");

    // Digits
    public static final Raw NUMBER = Raw.entire("\\d");
    public static final Raw DIGIT = NUMBER;
    public static final Raw NUMBERS = Raw.entire("\\d+");
    public static final Raw DIGITS = NUMBERS;
    public static final Raw MAYBE_NUMBERS = Raw.entire("\\d*");
    public static final Raw MAYBE_DIGITS = MAYBE_NUMBERS;
    public static final Raw NON_NUMBER = Raw.entire("\\D");
    public static final Raw NON_DIGIT = NON_NUMBER;

    // Word characters
    public static final Raw WORD = Raw.entire("\\w");
    public static final Raw WORDS = Raw.entire("\\w+");
    public static final Raw MAYBE_WORDS = Raw.entire("\\w*");
    public static final Raw NON_WORD = Raw.entire("\\W");
    public static final Raw WORD_BOUNDARY = Raw.entire("\\b");
    public static final Raw NON_WORD_BOUNDARY = Raw.entire("\\B");

    // Whitespace
    public static final Raw WHITESPACE = Raw.entire("\\s");
    public static final Raw WHITESPACES = Raw.entire("\\s+");
    public static final Raw MAYBE_WHITESPACES = Raw.entire("\\s*");
    public static final Raw NON_WHITESPACE = Raw.entire("\\S");
    public static final Raw SPACE = Raw.entire(" ");
    public static final Raw SPACES = Raw.entire(" +");
    public static final Raw MAYBE_SPACES = Raw.entire(" *");
    public static final Raw TAB = Raw.entire("\\t");

    // Any character
    public static final Raw DOT = Raw.entire("\\.");
    public static final Raw ANYCHAR = Raw.entire(".");
    public static final Raw ANYCHARS = Raw.entire(".+");
    public static final Raw MAYBE_ANYCHARS = Raw.entire(".*");

    // ASCII letters and digits
    public static final Raw LETTER = Raw.entire("[a-zA-Z]");
    public static final Raw LETTERS = Raw.entire("[a-zA-Z]+");
    public static final Raw MAYBE_LETTERS = Raw.entire("[a-zA-Z]*");
    public static final Raw LOWERCASE = Raw.entire("[a-z]");
    public static final Raw LOWERCASES = Raw.entire("[a-z]+");
    public static final Raw MAYBE_LOWERCASES = Raw.entire("[a-z]*");
    public static final Raw UPPERCASE = Raw.entire("[A-Z]");
    public static final Raw UPPERCASES = Raw.entire("[A-Z]+");
    public static final Raw MAYBE_UPPERCASES = Raw.entire("[A-Z]*");
    public static final Raw ALNUM = Raw.entire("[a-zA-Z0-9]");
    public static final Raw ALNUMS = Raw.entire("[a-zA-Z0-9]+");
    public static final Raw MAYBE_ALNUMS = Raw.entire("[a-zA-Z0-9]*");
}
