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

import com.axonops.regexr.api.NonStringOperandException;
import com.axonops.regexr.flag.FlagScope;

import java.util.ArrayList;
import java.util.List;

/**
 * Pattern text emitted verbatim, without escaping.
 *
 * <p>The caller is responsible for the validity of the text. All operands must be {@link Literal}
 * text; the texts are concatenated.
 *
 * <p>An <b>entire</b> raw node declares that its text is already one self-contained unit (such as
 * {@code \d}, {@code [a-z]+} or {@code ^}), so a quantifier applied to it does not add a group.
 *
 * @since 1.0.0
 */
public final class Raw extends Node {

    private final String text;
    private final boolean entire;

    /**
     * @param parts literal text parts
     * @param entire whether the text is one self-contained unit
     * @param captureMode capture of this node
     * @param flagScope flags of this node
     * @throws NonStringOperandException if a part is not a {@link Literal}
     */
    public Raw(List<Node> parts, boolean entire, CaptureMode captureMode, FlagScope flagScope) {
        super(parts, captureMode, flagScope);
        StringBuilder joined = new StringBuilder();
        for (Node part : children()) {
            if (part.kind() != NodeKind.LITERAL) {
                throw new NonStringOperandException("got " + part.kind() + " node " + part.render());
            }
            joined.append(((Literal) part).text());
        }
        this.text = joined.toString();
        this.entire = entire;
    }

    public static Raw of(String... texts) {
        return new Raw(literals(texts), false, CaptureMode.NONE, FlagScope.NONE);
    }

    public static Raw entire(String... texts) {
        return new Raw(literals(texts), true, CaptureMode.NONE, FlagScope.NONE);
    }

    public String text() {
        return text;
    }

    public boolean isEntire() {
        return entire;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RAW;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRaw(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        return new Raw(children(), entire, captureMode, flagScope);
    }

    private static List<Node> literals(String... texts) {
        List<Node> parts = new ArrayList<>(texts.length);
        for (String text : texts) {
            parts.add(new Literal(text));
        }
        return parts;
    }
}
