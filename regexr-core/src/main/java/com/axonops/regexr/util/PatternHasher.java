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
 * Short, stable identifiers for rendered patterns in log output.
 *
 * <p>Composed patterns may embed user data in literals, so logs carry a hash instead of the text.
 * The same pattern text always yields the same hash.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * @param pattern rendered pattern text
     * @return hex hash, or {@code "null"}
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(pattern.hashCode());
    }

    /**
     * Hash tagged with the rendering style, e.g. {@code "7a3f2b1c[pretty]"}.
     */
    public static String hashWithStyle(String pattern, String style) {
        return hash(pattern) + "[" + style + "]";
    }
}
