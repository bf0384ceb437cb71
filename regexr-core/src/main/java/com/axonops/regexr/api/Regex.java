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

package com.axonops.regexr.api;

import com.axonops.regexr.flag.Flag;
import com.axonops.regexr.flag.FlagCodec;
import com.axonops.regexr.flag.FlagScope;
import com.axonops.regexr.node.Alternation;
import com.axonops.regexr.node.Backreference;
import com.axonops.regexr.node.CaptureGroup;
import com.axonops.regexr.node.CaptureMode;
import com.axonops.regexr.node.CharClass;
import com.axonops.regexr.node.Concat;
import com.axonops.regexr.node.Conditional;
import com.axonops.regexr.node.FlagToggle;
import com.axonops.regexr.node.GroupReference;
import com.axonops.regexr.node.InlineFlag;
import com.axonops.regexr.node.Lazy;
import com.axonops.regexr.node.Literal;
import com.axonops.regexr.node.Lookaround;
import com.axonops.regexr.node.Node;
import com.axonops.regexr.node.NonCaptureGroup;
import com.axonops.regexr.node.Quantifier;
import com.axonops.regexr.node.Raw;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static factories for every node variant.
 *
 * <p>String arguments are literal text (escaped on output), except in {@link #raw(String...)},
 * {@link #lazy(String)} and the character class factories, where they are pattern text.
 *
 * <pre>{@code
 * import static com.axonops.regexr.api.Regex.*;
 * import static com.axonops.regexr.api.Predefined.*;
 *
 * Regexr balanced = Regexr.of(
 *     START,
 *     optional(capture("(")),
 *     oneOrMore(noneOf("()")).captured(),
 *     conditional(1, ")"),
 *     END);
 * // ^(\()?([^()]+)(?(1)\))$
 * }</pre>
 *
 * Captures and flags are added with the fluent methods of {@link Node}: {@code or("a", "b")
 * .captured()}, {@code concat("x").withFlags(Flag.IGNORE_CASE)}.
 *
 * @since 1.0.0
 */
public final class Regex {

    private Regex() {
        // Utility class
    }

    // ========================================
    // Text
    // ========================================

    public static Literal literal(String text) {
        return new Literal(text);
    }

    /**
     * Pattern text emitted as is.
     */
    public static Raw raw(String... text) {
        return Raw.of(text);
    }

    /**
     * Pattern text emitted as is, declared to be one self-contained unit.
     */
    public static Raw rawEntire(String... text) {
        return Raw.entire(text);
    }

    // ========================================
    // Character classes
    // ========================================

    /**
     * {@code [...]}; strings are inserted unescaped, so ranges like {@code a-z} work.
     */
    public static CharClass oneOf(String... members) {
        return new CharClass(false, literals(members), CaptureMode.NONE, FlagScope.NONE);
    }

    public static CharClass oneOf(Node... members) {
        return new CharClass(false, nodes(members), CaptureMode.NONE, FlagScope.NONE);
    }

    /**
     * {@code [^...]}; strings are inserted unescaped.
     */
    public static CharClass noneOf(String... members) {
        return new CharClass(true, literals(members), CaptureMode.NONE, FlagScope.NONE);
    }

    public static CharClass noneOf(Node... members) {
        return new CharClass(true, nodes(members), CaptureMode.NONE, FlagScope.NONE);
    }

    // ========================================
    // Lookaround
    // ========================================

    public static Lookaround lookahead(Node... parts) {
        return look(Lookaround.Type.AHEAD, nodes(parts));
    }

    public static Lookaround lookahead(String... parts) {
        return look(Lookaround.Type.AHEAD, literals(parts));
    }

    public static Lookaround lookbehind(Node... parts) {
        return look(Lookaround.Type.BEHIND, nodes(parts));
    }

    public static Lookaround lookbehind(String... parts) {
        return look(Lookaround.Type.BEHIND, literals(parts));
    }

    public static Lookaround negativeLookahead(Node... parts) {
        return look(Lookaround.Type.NEGATIVE_AHEAD, nodes(parts));
    }

    public static Lookaround negativeLookahead(String... parts) {
        return look(Lookaround.Type.NEGATIVE_AHEAD, literals(parts));
    }

    public static Lookaround negativeLookbehind(Node... parts) {
        return look(Lookaround.Type.NEGATIVE_BEHIND, nodes(parts));
    }

    public static Lookaround negativeLookbehind(String... parts) {
        return look(Lookaround.Type.NEGATIVE_BEHIND, literals(parts));
    }

    private static Lookaround look(Lookaround.Type type, List<Node> parts) {
        return new Lookaround(type, parts, CaptureMode.NONE, FlagScope.NONE);
    }

    // ========================================
    // Quantifiers
    // ========================================

    public static Quantifier zeroOrMore(Node... operand) {
        return Quantifier.zeroOrMore(nodes(operand));
    }

    public static Quantifier zeroOrMore(String... operand) {
        return Quantifier.zeroOrMore(literals(operand));
    }

    public static Quantifier oneOrMore(Node... operand) {
        return Quantifier.oneOrMore(nodes(operand));
    }

    public static Quantifier oneOrMore(String... operand) {
        return Quantifier.oneOrMore(literals(operand));
    }

    public static Quantifier optional(Node... operand) {
        return Quantifier.optional(nodes(operand));
    }

    public static Quantifier optional(String... operand) {
        return Quantifier.optional(literals(operand));
    }

    /**
     * {@code {min,}}
     *
     * @throws InvalidBoundException if min is negative
     */
    public static Quantifier repeat(int min, Node... operand) {
        return Quantifier.atLeast(min, nodes(operand));
    }

    public static Quantifier repeat(int min, String... operand) {
        return Quantifier.atLeast(min, literals(operand));
    }

    /**
     * {@code {min,max}}
     *
     * @throws InvalidBoundException if min is negative or max is less than min
     */
    public static Quantifier repeat(int min, int max, Node... operand) {
        return Quantifier.between(min, max, nodes(operand));
    }

    public static Quantifier repeat(int min, int max, String... operand) {
        return Quantifier.between(min, max, literals(operand));
    }

    /**
     * {@code {count}}
     *
     * @throws InvalidBoundException if count is not positive
     */
    public static Quantifier repeatExact(int count, Node... operand) {
        return Quantifier.exactly(count, nodes(operand));
    }

    public static Quantifier repeatExact(int count, String... operand) {
        return Quantifier.exactly(count, literals(operand));
    }

    /**
     * Lazy modifier on a quantified node.
     *
     * @throws ArityException unless exactly one operand is given
     * @throws NotAQuantifierException if the operand is not quantified
     */
    public static Lazy lazy(Node... operand) {
        return new Lazy(nodes(operand), CaptureMode.NONE, FlagScope.NONE);
    }

    /**
     * Lazy modifier on pattern text that ends in a quantifier, e.g. {@code lazy(".*")}.
     *
     * @throws NotAQuantifierException if the text does not end in a quantifier
     */
    public static Lazy lazy(String quantified) {
        return lazy(Raw.of(quantified));
    }

    // ========================================
    // Alternation and grouping
    // ========================================

    public static Alternation or(Node... alternatives) {
        return new Alternation(nodes(alternatives), CaptureMode.NONE, FlagScope.NONE);
    }

    public static Alternation or(String... alternatives) {
        return new Alternation(literals(alternatives), CaptureMode.NONE, FlagScope.NONE);
    }

    public static CaptureGroup capture(Node... parts) {
        return new CaptureGroup(nodes(parts), CaptureMode.ANONYMOUS, FlagScope.NONE);
    }

    public static CaptureGroup capture(String... parts) {
        return new CaptureGroup(literals(parts), CaptureMode.ANONYMOUS, FlagScope.NONE);
    }

    /**
     * @throws InvalidIdentifierException if the name is not an identifier
     */
    public static CaptureGroup named(String name, Node... parts) {
        return new CaptureGroup(nodes(parts), CaptureMode.named(name), FlagScope.NONE);
    }

    public static CaptureGroup named(String name, String... parts) {
        return new CaptureGroup(literals(parts), CaptureMode.named(name), FlagScope.NONE);
    }

    public static NonCaptureGroup nonCapture(Node... parts) {
        return new NonCaptureGroup(nodes(parts), FlagScope.NONE);
    }

    public static NonCaptureGroup nonCapture(String... parts) {
        return new NonCaptureGroup(literals(parts), FlagScope.NONE);
    }

    public static Concat concat(Node... parts) {
        return new Concat(nodes(parts), CaptureMode.NONE, FlagScope.NONE);
    }

    public static Concat concat(String... parts) {
        return new Concat(literals(parts), CaptureMode.NONE, FlagScope.NONE);
    }

    // ========================================
    // Backreferences and conditionals
    // ========================================

    /**
     * {@code \index}
     *
     * @throws InvalidIdentifierException if index is negative
     */
    public static Backreference backreference(int index) {
        return new Backreference(GroupReference.index(index), CaptureMode.NONE, FlagScope.NONE);
    }

    /**
     * {@code (?P=name)}
     *
     * @throws InvalidIdentifierException if the name is not an identifier
     */
    public static Backreference backreference(String name) {
        return new Backreference(GroupReference.name(name), CaptureMode.NONE, FlagScope.NONE);
    }

    public static Conditional conditional(int index, Node yes) {
        return conditional(GroupReference.index(index), yes, null);
    }

    public static Conditional conditional(int index, Node yes, Node no) {
        return conditional(GroupReference.index(index), yes, no);
    }

    public static Conditional conditional(int index, String yes) {
        return conditional(GroupReference.index(index), literal(yes), null);
    }

    public static Conditional conditional(int index, String yes, String no) {
        return conditional(GroupReference.index(index), literal(yes), literal(no));
    }

    public static Conditional conditional(String name, Node yes) {
        return conditional(GroupReference.name(name), yes, null);
    }

    public static Conditional conditional(String name, Node yes, Node no) {
        return conditional(GroupReference.name(name), yes, no);
    }

    public static Conditional conditional(String name, String yes) {
        return conditional(GroupReference.name(name), literal(yes), null);
    }

    public static Conditional conditional(String name, String yes, String no) {
        return conditional(GroupReference.name(name), literal(yes), literal(no));
    }

    /**
     * Conditional on the group a backreference points to.
     */
    public static Conditional conditional(Backreference selector, Node yes, Node no) {
        Objects.requireNonNull(selector, "selector cannot be null");
        return conditional(selector.reference(), yes, no);
    }

    public static Conditional conditional(Backreference selector, String yes, String no) {
        Objects.requireNonNull(selector, "selector cannot be null");
        return conditional(selector.reference(), literal(yes), literal(no));
    }

    /**
     * @param no branch when the group did not match, may be null
     */
    public static Conditional conditional(GroupReference selector, Node yes, Node no) {
        return new Conditional(selector, yes, no, CaptureMode.NONE, FlagScope.NONE);
    }

    // ========================================
    // Flags
    // ========================================

    /**
     * Global flag toggle {@code (?flags)}; must be the first segment of a {@link Regexr}.
     */
    public static FlagToggle flags(Flag... flags) {
        Objects.requireNonNull(flags, "flags cannot be null");
        return new FlagToggle(Set.copyOf(Arrays.asList(flags)));
    }

    /**
     * @throws UnknownFlagCodeException if a code is not one of {@code aiLmsux}
     */
    public static FlagToggle flags(String codes) {
        return new FlagToggle(FlagCodec.decode(codes));
    }

    /**
     * {@code (?on-off:...)}
     *
     * @throws IllegalArgumentException if the scope is empty
     */
    public static InlineFlag inlineFlags(FlagScope scope, Node... parts) {
        return new InlineFlag(nodes(parts), CaptureMode.NONE, scope);
    }

    public static InlineFlag inlineFlags(FlagScope scope, String... parts) {
        return new InlineFlag(literals(parts), CaptureMode.NONE, scope);
    }

    private static List<Node> nodes(Node... nodes) {
        Objects.requireNonNull(nodes, "nodes cannot be null");
        return Arrays.asList(nodes);
    }

    private static List<Node> literals(String... texts) {
        Objects.requireNonNull(texts, "texts cannot be null");
        List<Node> parts = new ArrayList<>(texts.length);
        for (String text : texts) {
            parts.add(new Literal(text));
        }
        return parts;
    }
}
