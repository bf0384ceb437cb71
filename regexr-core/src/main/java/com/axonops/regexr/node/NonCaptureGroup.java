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
 * Non-capturing group {@code (?:...)}. A flag scope replaces the plain group with
 * {@code (?flags:...)}.
 *
 * @since 1.0.0
 */
public final class NonCaptureGroup extends Node {

    public NonCaptureGroup(List<Node> children, FlagScope flagScope) {
        super(children, CaptureMode.NONE, flagScope);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NON_CAPTURE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNonCaptureGroup(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        if (captureMode.isCapturing()) {
            return new CaptureGroup(children(), captureMode, flagScope);
        }
        return new NonCaptureGroup(children(), flagScope);
    }
}
