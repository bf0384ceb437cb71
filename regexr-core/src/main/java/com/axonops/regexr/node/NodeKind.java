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
 * Closed tag identifying each node variant, with the per-variant grouping traits.
 *
 * <h2>Grouping traits</h2>
 *
 * <ul>
 *   <li><b>groupsWhenBare</b> - a node of this kind that is neither captured nor flag-scoped is
 *       emitted inside {@code (?:...)}. Set for alternations (so {@code a|b} followed by {@code c}
 *       does not become {@code a|bc}) and for explicit non-capturing groups.
 *   <li><b>atomicOperand</b> - the rendered form is always a single unit, so a quantifier applied
 *       to it never adds a group: {@code [ab]*}, {@code (a)*}, {@code \1*}.
 * </ul>
 *
 * @since 1.0.0
 */
public enum NodeKind {
    LITERAL(false, false),
    RAW(false, false),
    CHAR_CLASS(false, true),
    LOOKAROUND(false, false),
    QUANTIFIER(false, false),
    LAZY(false, false),
    ALTERNATION(true, false),
    CAPTURE(false, true),
    NON_CAPTURE(true, false),
    CONCAT(false, false),
    BACKREFERENCE(false, true),
    CONDITIONAL(false, false),
    FLAG_TOGGLE(false, false),
    INLINE_FLAG(false, false);

    private final boolean groupsWhenBare;
    private final boolean atomicOperand;

    NodeKind(boolean groupsWhenBare, boolean atomicOperand) {
        this.groupsWhenBare = groupsWhenBare;
        this.atomicOperand = atomicOperand;
    }

    public boolean groupsWhenBare() {
        return groupsWhenBare;
    }

    public boolean atomicOperand() {
        return atomicOperand;
    }
}
