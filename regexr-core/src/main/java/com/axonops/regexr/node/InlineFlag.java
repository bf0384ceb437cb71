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

import com.axonops.regexr.flag.FlagScope;

import java.util.List;

/**
 * Scoped flag change {@code (?on-off:...)} around the concatenated children.
 *
 * @since 1.0.0
 */
public final class InlineFlag extends Node {

    /**
     * @throws IllegalArgumentException if the scope neither enables nor disables a flag
     */
    public InlineFlag(List<Node> children, CaptureMode captureMode, FlagScope flagScope) {
        super(children, captureMode, flagScope);
        if (flagScope.isEmpty()) {
            throw new IllegalArgumentException("Regexr: inline flag requires flags to enable or disable");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INLINE_FLAG;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInlineFlag(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        return new InlineFlag(children(), captureMode, flagScope);
    }
}
