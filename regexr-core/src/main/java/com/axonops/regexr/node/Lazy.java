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

import com.axonops.regexr.api.ArityException;
import com.axonops.regexr.api.NotAQuantifierException;
import com.axonops.regexr.flag.FlagScope;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lazy modifier {@code ?} appended to an already quantified operand.
 *
 * @since 1.0.0
 */
public final class Lazy extends Node {

    private static final Pattern TRAILING_BOUND = Pattern.compile("\\{\\d+(?:,\\d*)?\\}$");

    /**
     * @throws ArityException unless there is exactly one operand
     * @throws NotAQuantifierException unless the operand renders ending in a greedy quantifier: a
     *     non-lazy {@link Quantifier} or raw text ending in an unescaped {@code * + ? {m,n}}, neither
     *     captured nor flag-scoped
     */
    public Lazy(List<Node> children, CaptureMode captureMode, FlagScope flagScope) {
        super(children, captureMode, flagScope);
        if (children().size() != 1) {
            throw new ArityException("lazy takes exactly one operand, got " + children().size());
        }
        Node operand = children().get(0);
        if (!isQuantified(operand)) {
            throw new NotAQuantifierException(operand.render());
        }
    }

    /**
     * @return the quantified operand
     */
    public Node operand() {
        return children().get(0);
    }

    private static boolean isQuantified(Node operand) {
        // Any wrapper would close after the quantifier
        if (operand.isCapturing() || !operand.flagScope().isEmpty()) {
            return false;
        }
        if (operand.kind() == NodeKind.QUANTIFIER) {
            return !((Quantifier) operand).isLazy();
        }
        if (operand.kind() != NodeKind.RAW) {
            return false;
        }
        String text = ((Raw) operand).text();
        int start = trailingQuantifierStart(text);
        // Needs something to quantify, and must not already be lazy or possessive
        return start > 0 && trailingQuantifierStart(text.substring(0, start)) < 0;
    }

    /**
     * Index where an unescaped trailing quantifier begins, or -1 if the text does not end in one.
     */
    private static int trailingQuantifierStart(String text) {
        if (text.isEmpty()) {
            return -1;
        }
        int start;
        char last = text.charAt(text.length() - 1);
        if (last == '*' || last == '+' || last == '?') {
            start = text.length() - 1;
        } else {
            Matcher bound = TRAILING_BOUND.matcher(text);
            if (!bound.find()) {
                return -1;
            }
            start = bound.start();
        }
        return isEscaped(text, start) ? -1 : start;
    }

    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAZY;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLazy(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        return new Lazy(children(), captureMode, flagScope);
    }
}
