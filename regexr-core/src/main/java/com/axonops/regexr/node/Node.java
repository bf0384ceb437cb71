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
import com.axonops.regexr.render.CompactRenderer;
import com.axonops.regexr.render.PrettyRenderer;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One unit of a composed pattern.
 *
 * <p>A node owns an ordered list of child nodes (literal text is a {@link Literal} child), an
 * optional capture and an optional flag scope. The set of variants is closed; renderers dispatch
 * over it through {@link NodeVisitor}.
 *
 * <p>Immutable: every "with" method returns a new node. Nodes can be shared between threads and
 * between trees, and rendered concurrently.
 *
 * <p>Rendering:
 *
 * <ul>
 *   <li>{@link #render()} - compact single-line pattern text, including this node's own capture
 *       and flag wrapper
 *   <li>{@link #pretty(String, int)} - multi-line layout of the same text
 * </ul>
 *
 * @since 1.0.0
 */
public abstract sealed class Node
    permits Literal,
            Raw,
            CharClass,
            Lookaround,
            Quantifier,
            Lazy,
            Alternation,
            CaptureGroup,
            NonCaptureGroup,
            Concat,
            Backreference,
            Conditional,
            FlagToggle,
            InlineFlag {

    private final List<Node> children;
    private final CaptureMode captureMode;
    private final FlagScope flagScope;

    Node(List<Node> children, CaptureMode captureMode, FlagScope flagScope) {
        this.children = List.copyOf(Objects.requireNonNull(children, "children cannot be null"));
        this.captureMode = Objects.requireNonNull(captureMode, "captureMode cannot be null");
        this.flagScope = Objects.requireNonNull(flagScope, "flagScope cannot be null");
    }

    public abstract NodeKind kind();

    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * Rebuilds this node with another capture and flag scope, keeping everything else.
     */
    abstract Node withOptions(CaptureMode captureMode, FlagScope flagScope);

    public final List<Node> children() {
        return children;
    }

    public final CaptureMode captureMode() {
        return captureMode;
    }

    public final FlagScope flagScope() {
        return flagScope;
    }

    public final boolean isCapturing() {
        return captureMode.isCapturing();
    }

    /**
     * @return this node as a numbered capture group
     */
    public Node captured() {
        return withOptions(CaptureMode.ANONYMOUS, flagScope);
    }

    /**
     * @param name group name
     * @return this node as a named capture group
     * @throws com.axonops.regexr.api.InvalidIdentifierException if the name is not an identifier
     */
    public Node capturedAs(String name) {
        return withOptions(CaptureMode.named(name), flagScope);
    }

    public Node withFlags(Flag... flags) {
        return withOptions(captureMode, flagScope.plusEnabled(Arrays.asList(flags)));
    }

    public Node withFlags(String codes) {
        return withOptions(captureMode, flagScope.plusEnabled(FlagCodec.decode(codes)));
    }

    public Node withoutFlags(Flag... flags) {
        return withOptions(captureMode, flagScope.plusDisabled(Arrays.asList(flags)));
    }

    public Node withoutFlags(String codes) {
        return withOptions(captureMode, flagScope.plusDisabled(FlagCodec.decode(codes)));
    }

    /**
     * Number of nodes in this subtree, this node included.
     */
    public int treeSize() {
        int size = 1;
        for (Node child : children) {
            size += child.treeSize();
        }
        return size;
    }

    /**
     * @return compact pattern text
     */
    public final String render() {
        return CompactRenderer.INSTANCE.render(this);
    }

    /**
     * @param indentUnit text inserted once per indentation level
     * @param depth indentation level of the first line
     * @return multi-line layout of {@link #render()}
     */
    public final String pretty(String indentUnit, int depth) {
        return new PrettyRenderer(indentUnit).render(this, depth);
    }

    @Override
    public String toString() {
        return render();
    }
}
