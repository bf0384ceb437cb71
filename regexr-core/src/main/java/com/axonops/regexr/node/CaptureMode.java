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

package com.axonops.regexr.node;

import com.axonops.regexr.util.Identifiers;

/**
 * Whether, and how, a node captures what it matches.
 *
 * @since 1.0.0
 */
public sealed interface CaptureMode permits CaptureMode.None, CaptureMode.Anonymous, CaptureMode.Named {

    CaptureMode NONE = new None();

    CaptureMode ANONYMOUS = new Anonymous();

    /**
     * @param name group name
     * @return named capture
     * @throws com.axonops.regexr.api.InvalidIdentifierException if the name is not an identifier
     */
    static CaptureMode named(String name) {
        return new Named(name);
    }

    boolean isCapturing();

    /** No capture. */
    record None() implements CaptureMode {
        @Override
        public boolean isCapturing() {
            return false;
        }
    }

    /** Numbered capture, {@code (...)}. */
    record Anonymous() implements CaptureMode {
        @Override
        public boolean isCapturing() {
            return true;
        }
    }

    /** Named capture, {@code (?P<name>...)}. */
    record Named(String name) implements CaptureMode {

        public Named {
            Identifiers.requireValid(name, "capture name");
        }

        @Override
        public boolean isCapturing() {
            return true;
        }
    }
}
