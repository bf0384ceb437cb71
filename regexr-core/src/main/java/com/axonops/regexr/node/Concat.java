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
 * Plain sequence of the children, emitted without a group unless captured or flagged.
 *
 * @since 1.0.0
 */
public final class Concat extends Node {

    public Concat(List<Node> children, CaptureMode captureMode, FlagScope flagScope) {
        super(children, captureMode, flagScope);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONCAT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConcat(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        return new Concat(children(), captureMode, flagScope);
    }
}
