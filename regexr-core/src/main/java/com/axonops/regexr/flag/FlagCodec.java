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

import com.axonops.regexr.api.UnknownFlagCodeException;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Converts between flag sets and their short code form ({@code "im"}, {@code "aiLmsux"}).
 *
 * <p>Encoding always emits codes in canonical order, so {@code decode("mi")} followed by
 * {@code encode(...)} yields {@code "im"}.
 *
 * @since 1.0.0
 */
public final class FlagCodec {

    private FlagCodec() {
        // Utility class
    }

    /**
     * Encodes flags in canonical order.
     *
     * @param flags flags to encode (may be empty)
     * @return code string, empty for an empty set
     */
    public static String encode(Collection<Flag> flags) {
        Objects.requireNonNull(flags, "flags cannot be null");
        EnumSet<Flag> ordered = flags.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(flags);
        StringBuilder codes = new StringBuilder(ordered.size());
        for (Flag flag : ordered) {
            codes.append(flag.code());
        }
        return codes.toString();
    }

    /**
     * Decodes and validates a code string.
     *
     * @param codes code string, e.g. {@code "im"}
     * @return the decoded flags; duplicates collapse
     * @throws UnknownFlagCodeException if a character is not one of {@code aiLmsux}
     */
    public static EnumSet<Flag> decode(String codes) {
        Objects.requireNonNull(codes, "codes cannot be null");
        EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
        for (char c : codes.toCharArray()) {
            flags.add(fromCode(c, codes));
        }
        return flags;
    }

    /**
     * Normalizes a code string to canonical order after validating it.
     *
     * @param codes code string
     * @return canonical code string
     */
    public static String canonicalize(String codes) {
        return encode(decode(codes));
    }

    /**
     * Looks up a single flag by its code.
     *
     * @param code flag character
     * @return the flag
     * @throws UnknownFlagCodeException if the character is not a flag code
     */
    public static Flag fromCode(char code) {
        return fromCode(code, String.valueOf(code));
    }

    static Set<Flag> copyOf(Flag... flags) {
        EnumSet<Flag> set = EnumSet.noneOf(Flag.class);
        for (Flag flag : flags) {
            set.add(Objects.requireNonNull(flag, "flag cannot be null"));
        }
        return set;
    }

    private static Flag fromCode(char code, String codes) {
        switch (code) {
            case 'a':
                return Flag.ASCII;
            case 'i':
                return Flag.IGNORE_CASE;
            case 'L':
                return Flag.LOCALE;
            case 'm':
                return Flag.MULTILINE;
            case 's':
                return Flag.DOT_ALL;
            case 'u':
                return Flag.UNICODE;
            case 'x':
                return Flag.VERBOSE;
            default:
                throw new UnknownFlagCodeException(codes, code);
        }
    }
}
