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
 * Literal text, escaped on output so that it matches itself.
 *
 * <p>A literal never carries a capture or flag scope of its own. Capturing or flagging a literal
 * yields a {@link Concat} around it.
 *
 * @since 1.0.0
 */
public final class Literal extends Node {

    private final String text;

    public Literal(String text) {
        super(List.of(), CaptureMode.NONE, FlagScope.NONE);
        this.text = Objects.requireNonNull(text, "text cannot be null");
    }

    public String text() {
        return text;
    }

    /**
     * @return length in code points
     */
    public int length() {
        return text.codePointCount(0, text.length());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        return new Concat(List.of(this), captureMode, flagScope);
    }
}
