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

import com.axonops.regexr.api.ConflictingFlagsException;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Flags switched on and off for the extent of one node.
 *
 * <p>Renders as the code part of an inline scope: {@code (?<enable>-<disable>:...)}.
 *
 * @param enable flags turned on inside the scope
 * @param disable flags turned off inside the scope
 * @since 1.0.0
 */
public record FlagScope(Set<Flag> enable, Set<Flag> disable) {

    /** Scope that changes nothing. */
    public static final FlagScope NONE = new FlagScope(Set.of(), Set.of());

    /**
     * Validates that no flag is both enabled and disabled.
     *
     * @throws ConflictingFlagsException if the sets intersect
     */
    public FlagScope {
        Objects.requireNonNull(enable, "enable cannot be null");
        Objects.requireNonNull(disable, "disable cannot be null");
        enable = immutableCopy(enable);
        disable = immutableCopy(disable);

        EnumSet<Flag> overlap = enable.isEmpty() ? EnumSet.noneOf(Flag.class) : EnumSet.copyOf(enable);
        overlap.retainAll(disable);
        if (!overlap.isEmpty()) {
            throw new ConflictingFlagsException(overlap);
        }
    }

    public static FlagScope enabling(Flag... flags) {
        return new FlagScope(FlagCodec.copyOf(flags), Set.of());
    }

    public static FlagScope disabling(Flag... flags) {
        return new FlagScope(Set.of(), FlagCodec.copyOf(flags));
    }

    /**
     * Builds a scope from code strings.
     *
     * @param enableCodes codes to turn on, e.g. {@code "i"}
     * @param disableCodes codes to turn off, e.g. {@code "m"}
     * @return the scope
     */
    public static FlagScope of(String enableCodes, String disableCodes) {
        return new FlagScope(FlagCodec.decode(enableCodes), FlagCodec.decode(disableCodes));
    }

    /**
     * Returns a scope with additional flags turned on.
     */
    public FlagScope plusEnabled(Collection<Flag> flags) {
        EnumSet<Flag> merged = EnumSet.noneOf(Flag.class);
        merged.addAll(enable);
        merged.addAll(flags);
        return new FlagScope(merged, disable);
    }

    /**
     * Returns a scope with additional flags turned off.
     */
    public FlagScope plusDisabled(Collection<Flag> flags) {
        EnumSet<Flag> merged = EnumSet.noneOf(Flag.class);
        merged.addAll(disable);
        merged.addAll(flags);
        return new FlagScope(enable, merged);
    }

    public boolean isEmpty() {
        return enable.isEmpty() && disable.isEmpty();
    }

    /**
     * @return {@code "<enable>"}, {@code "<enable>-<disable>"} or {@code "-<disable>"}
     */
    public String codes() {
        String on = FlagCodec.encode(enable);
        return disable.isEmpty() ? on : on + "-" + FlagCodec.encode(disable);
    }

    private static Set<Flag> immutableCopy(Set<Flag> flags) {
        return flags.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }
}
