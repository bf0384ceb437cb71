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

/**
 * Traversal over the closed set of node variants.
 *
 * <p>Adding a variant adds a method here, so every renderer fails to compile until it handles it.
 *
 * @param <R> result of visiting one node
 */
public interface NodeVisitor<R> {

    R visitLiteral(Literal literal);

    R visitRaw(Raw raw);

    R visitCharClass(CharClass charClass);

    R visitLookaround(Lookaround lookaround);

    R visitQuantifier(Quantifier quantifier);

    R visitLazy(Lazy lazy);

    R visitAlternation(Alternation alternation);

    R visitCaptureGroup(CaptureGroup group);

    R visitNonCaptureGroup(NonCaptureGroup group);

    R visitConcat(Concat concat);

    R visitBackreference(Backreference backreference);

    R visitConditional(Conditional conditional);

    R visitFlagToggle(FlagToggle toggle);

    R visitInlineFlag(InlineFlag inlineFlag);
}
