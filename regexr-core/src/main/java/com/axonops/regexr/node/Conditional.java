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
import java.util.Optional;

/**
 * Conditional match {@code (?(id)yes|no)}: {@code yes} applies when the selected group took part in
 * the match, {@code no} otherwise.
 *
 * <p>An empty literal {@code no} branch is the same as no branch.
 *
 * @since 1.0.0
 */
public final class Conditional extends Node {

    private final GroupReference selector;
    private final Node yes;
    private final Node no;

    /**
     * @param selector group whose participation is tested
     * @param yes branch taken when the group matched
     * @param no branch taken otherwise, may be null
     * @param captureMode capture of this node
     * @param flagScope flags of this node
     */
    public Conditional(
            GroupReference selector, Node yes, Node no, CaptureMode captureMode, FlagScope flagScope) {
        super(branches(yes, no), captureMode, flagScope);
        this.selector = Objects.requireNonNull(selector, "selector cannot be null");
        this.yes = yes;
        this.no = isEmptyLiteral(no) ? null : no;
    }

    private static List<Node> branches(Node yes, Node no) {
        Objects.requireNonNull(yes, "yes cannot be null");
        return isEmptyLiteral(no) ? List.of(yes) : List.of(yes, no);
    }

    private static boolean isEmptyLiteral(Node node) {
        return node == null || (node.kind() == NodeKind.LITERAL && ((Literal) node).text().isEmpty());
    }

    public GroupReference selector() {
        return selector;
    }

    public Node yes() {
        return yes;
    }

    public Optional<Node> no() {
        return Optional.ofNullable(no);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONDITIONAL;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        return new Conditional(selector, yes, no, captureMode, flagScope);
    }
}
