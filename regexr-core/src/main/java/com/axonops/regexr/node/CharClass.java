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
 * Character set, {@code [...]} or negated {@code [^...]}.
 *
 * <p>Literal children are inserted as written (ranges such as {@code a-z} must stay unescaped).
 *
 * @since 1.0.0
 */
public final class CharClass extends Node {

    private final boolean negated;

    public CharClass(boolean negated, List<Node> children, CaptureMode captureMode, FlagScope flagScope) {
        super(children, captureMode, flagScope);
        this.negated = negated;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CHAR_CLASS;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCharClass(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        return new CharClass(negated, children(), captureMode, flagScope);
    }
}
