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
import com.axonops.regexr.api.InvalidBoundException;
import com.axonops.regexr.flag.FlagScope;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Repetition of an operand: {@code *}, {@code +}, {@code ?}, {@code {m,n}}, {@code {m,}} or
 * {@code {m}}, optionally lazy.
 *
 * <p>The operand is the concatenation of the children. It is grouped with {@code (?:...)} on output
 * whenever the repetition would otherwise bind to only its last character.
 *
 * @since 1.0.0
 */
public final class Quantifier extends Node {

    /** Repetition operator. */
    public enum Type {
        ZERO_OR_MORE,
        ONE_OR_MORE,
        OPTIONAL,
        REPEAT,
        REPEAT_EXACT
    }

    private final Type type;
    private final int min;
    private final OptionalInt max;
    private final boolean lazy;

    /**
     * @param type repetition operator
     * @param min lower bound, used by {@link Type#REPEAT} and {@link Type#REPEAT_EXACT}
     * @param max upper bound for {@link Type#REPEAT}; empty for an open range
     * @param lazy whether the lazy modifier follows the operator
     * @param children operand
     * @param captureMode capture of this node
     * @param flagScope flags of this node
     * @throws ArityException if there is no operand
     * @throws InvalidBoundException if the bounds are out of range
     */
    public Quantifier(
            Type type,
            int min,
            OptionalInt max,
            boolean lazy,
            List<Node> children,
            CaptureMode captureMode,
            FlagScope flagScope) {
        super(children, captureMode, flagScope);
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.max = Objects.requireNonNull(max, "max cannot be null");
        this.min = min;
        this.lazy = lazy;
        if (children().isEmpty()) {
            throw new ArityException(type + " requires at least one operand");
        }
        validateBounds();
    }

    public static Quantifier zeroOrMore(List<Node> operand) {
        return simple(Type.ZERO_OR_MORE, operand);
    }

    public static Quantifier oneOrMore(List<Node> operand) {
        return simple(Type.ONE_OR_MORE, operand);
    }

    public static Quantifier optional(List<Node> operand) {
        return simple(Type.OPTIONAL, operand);
    }

    /**
     * {@code {m,}} repetition.
     */
    public static Quantifier atLeast(int min, List<Node> operand) {
        return new Quantifier(
            Type.REPEAT, min, OptionalInt.empty(), false, operand, CaptureMode.NONE, FlagScope.NONE);
    }

    /**
     * {@code {m,n}} repetition.
     */
    public static Quantifier between(int min, int max, List<Node> operand) {
        return new Quantifier(
            Type.REPEAT, min, OptionalInt.of(max), false, operand, CaptureMode.NONE, FlagScope.NONE);
    }

    /**
     * {@code {m}} repetition.
     */
    public static Quantifier exactly(int count, List<Node> operand) {
        return new Quantifier(
            Type.REPEAT_EXACT, count, OptionalInt.empty(), false, operand, CaptureMode.NONE, FlagScope.NONE);
    }

    private static Quantifier simple(Type type, List<Node> operand) {
        return new Quantifier(type, 0, OptionalInt.empty(), false, operand, CaptureMode.NONE, FlagScope.NONE);
    }

    private void validateBounds() {
        switch (type) {
            case REPEAT:
                if (min < 0) {
                    throw new InvalidBoundException("minimum " + min + " must be non-negative");
                }
                if (max.isPresent() && max.getAsInt() < min) {
                    throw new InvalidBoundException(
                        "maximum " + max.getAsInt() + " is less than minimum " + min);
                }
                break;
            case REPEAT_EXACT:
                if (min <= 0) {
                    throw new InvalidBoundException("exact count " + min + " must be positive");
                }
                break;
            default:
                break;
        }
    }

    /**
     * @return the same repetition with the lazy modifier
     */
    public Quantifier lazy() {
        return new Quantifier(type, min, max, true, children(), captureMode(), flagScope());
    }

    public Type type() {
        return type;
    }

    public int min() {
        return min;
    }

    public OptionalInt max() {
        return max;
    }

    public boolean isLazy() {
        return lazy;
    }

    /**
     * Operator text without the lazy modifier, e.g. {@code "+"} or {@code "{2,5}"}.
     */
    public String symbol() {
        return switch (type) {
            case ZERO_OR_MORE -> "*";
            case ONE_OR_MORE -> "+";
            case OPTIONAL -> "?";
            case REPEAT -> max.isPresent() ? "{" + min + "," + max.getAsInt() + "}" : "{" + min + ",}";
            case REPEAT_EXACT -> "{" + min + "}";
        };
    }

    @Override
    public NodeKind kind() {
        return NodeKind.QUANTIFIER;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitQuantifier(this);
    }

    @Override
    Node withOptions(CaptureMode captureMode, FlagScope flagScope) {
        return new Quantifier(type, min, max, lazy, children(), captureMode, flagScope);
    }
}
