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
import java.util.Objects;

/**
 * Zero-width lookahead or lookbehind assertion.
 *
 * @since 1.0.0
 */
public final class Lookaround extends Node {

    /** Assertion direction and polarity. */
    public enum Type {
        AHEAD("?="),
        BEHIND("?<="),
        NEGATIVE_AHEAD("?!"),
        NEGATIVE_BEHIND("?<!");

        private final String prefix;

        Type(String prefix) {
            this.prefix = prefix;
        }

        /**
         * @return token following the opening parenthesis
         */
        public String prefix() {
            return prefix;
        }
    }

    private final Type type;

    public Lookaround(Type type, List<Node> children, CaptureMode captureMode, FlagScope flagScope) {
        super(children, captureMode, flagScope);
        this.type = Objects.requireNonNull(type, "type cannot be null");
    }

    public Type type() {
        return type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOOKAROUND;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLookaround(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        return new Lookaround(type, children(), captureMode, flagScope);
    }
}
