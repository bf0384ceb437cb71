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

import com.axonops.regexr.api.InvalidIdentifierException;
import com.axonops.regexr.util.Identifiers;

/**
 * Target of a backreference or a conditional: a group number or a group name.
 *
 * @since 1.0.0
 */
public sealed interface GroupReference permits GroupReference.Index, GroupReference.Name {

    static GroupReference index(int index) {
        return new Index(index);
    }

    static GroupReference name(String name) {
        return new Name(name);
    }

    /**
     * @return the group number or name as it appears inside {@code (?(...)...)}
     */
    String token();

    /** Reference by group number. */
    record Index(int index) implements GroupReference {

        public Index {
            if (index < 0) {
                throw new InvalidIdentifierException(
                    String.valueOf(index), "group number must be non-negative");
            }
        }

        @Override
        public String token() {
            return Integer.toString(index);
        }
    }

    /** Reference by group name. */
    record Name(String name) implements GroupReference {

        public Name {
            Identifiers.requireValid(name, "group reference");
        }

        @Override
        public String token() {
            return name;
        }
    }
}
