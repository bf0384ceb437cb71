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

/**
 * Group name validation.
 *
 * <p>A group name starts with a Unicode letter (or other identifier-start code point) or an
 * underscore, followed by identifier-part code points. Supplementary code points are handled, so
 * names such as {@code "μ"} or mathematical Fraktur letters are accepted.
 *
 * @since 1.0.0
 */
public final class Identifiers {

    private Identifiers() {
        // Utility class
    }

    public static boolean isValid(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        int first = name.codePointAt(0);
        if (first != '_' && !Character.isUnicodeIdentifierStart(first)) {
            return false;
        }
        for (int i = Character.charCount(first); i < name.length(); ) {
            int cp = name.codePointAt(i);
            if (!Character.isUnicodeIdentifierPart(cp) || Character.isIdentifierIgnorable(cp)) {
                return false;
            }
            i += Character.charCount(cp);
        }
        return true;
    }

    /**
     * Validates a group name.
     *
     * @param name candidate name
     * @param role what the name is used for, for the error message
     * @return the name
     * @throws InvalidIdentifierException if the name is not a valid identifier
     */
    public static String requireValid(String name, String role) {
        if (!isValid(name)) {
            throw new InvalidIdentifierException(name, "invalid " + role);
        }
        return name;
    }
}
