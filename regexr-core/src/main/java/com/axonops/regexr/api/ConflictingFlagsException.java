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

import com.axonops.regexr.flag.Flag;

import java.util.Set;

/**
 * Thrown when the same flag is requested to be turned on and off in one scope.
 *
 * @since 1.0.0
 */
public final class ConflictingFlagsException extends RegexrException {

    private final Set<Flag> flags;

    public ConflictingFlagsException(Set<Flag> flags) {
        super("Regexr: Flags turned on and off in the same scope: " + flags);
        this.flags = Set.copyOf(flags);
    }

    /**
     * @return the flags present in both the enable and the disable set
     */
    public Set<Flag> getFlags() {
        return flags;
    }
}
