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

import com.axonops.regexr.flag.Flag;
import com.axonops.regexr.flag.FlagCodec;
import com.axonops.regexr.flag.FlagScope;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Global flag toggle {@code (?flags)}, valid only at the start of a pattern.
 *
 * <p>Cannot be captured or flag-scoped.
 *
 * @since 1.0.0
 */
public final class FlagToggle extends Node {

    private final Set<Flag> flags;

    /**
     * @throws IllegalArgumentException if no flag is given
     */
    public FlagToggle(Set<Flag> flags) {
        super(List.of(), CaptureMode.NONE, FlagScope.NONE);
        Objects.requireNonNull(flags, "flags cannot be null");
        if (flags.isEmpty()) {
            throw new IllegalArgumentException("Regexr: flag toggle requires at least one flag");
        }
        this.flags = Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public Set<Flag> flags() {
        return flags;
    }

    /**
     * @return flag codes in canonical order
     */
    public String codes() {
        return FlagCodec.encode(flags);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FLAG_TOGGLE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFlagToggle(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        throw new IllegalArgumentException("Regexr: flag toggle cannot be captured or flag-scoped");
    }
}
