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
import com.axonops.regexr.flag.FlagScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.axonops.regexr.api.Predefined.*;
import static com.axonops.regexr.api.Regex.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Node tree")
class NodeTest {

    // ========== Immutability ==========

    @Test
    @DisplayName("Children should be copied and unmodifiable")
    void children_copiedAndUnmodifiable() {
        List<Node> parts = new ArrayList<>(List.of(literal("a"), literal("b")));
        Concat concat = new Concat(parts, CaptureMode.NONE, FlagScope.NONE);
        parts.add(literal("c"));

        assertThat(concat.children()).hasSize(2);
        assertThatThrownBy(() -> concat.children().add(literal("d")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Fluent options should return new nodes and leave the original unchanged")
    void withOptions_newNode_originalUnchanged() {
        Node original = or("a", "b");
        Node captured = original.captured();
        Node flagged = original.withFlags(Flag.IGNORE_CASE);

        assertThat(captured).isNotSameAs(original);
        assertThat(original.isCapturing()).isFalse();
        assertThat(original.flagScope().isEmpty()).isTrue();
        assertThat(captured.captureMode()).isEqualTo(CaptureMode.ANONYMOUS);
        assertThat(flagged.flagScope().enable()).containsExactly(Flag.IGNORE_CASE);
        assertThat(original.render()).isEqualTo("(?:a|b)");
    }

    @Test
    @DisplayName("Captures and flags should combine in any order")
    void withOptions_chained_combined() {
        Node a = concat("x").capturedAs("n").withFlags("i");
        Node b = concat("x").withFlags("i").capturedAs("n");
        assertThat(a.render()).isEqualTo(b.render()).isEqualTo("(?P<n>(?i:x))");
        assertThat(a.captureMode()).isEqualTo(CaptureMode.named("n"));
    }

    @Test
    @DisplayName("Literal with options should become a concatenation")
    void literal_withOptions_concat() {
        Literal text = literal("ab");
        Node node = text.captured();
        assertThat(node.kind()).isEqualTo(NodeKind.CONCAT);
        assertThat(node.children()).containsExactly(text);
    }

    @Test
    @DisplayName("Captured groups should keep the capture group kind")
    void captureGroup_sameNodeKinds() {
        assertThat(capture("a").kind()).isEqualTo(NodeKind.CAPTURE);
        assertThat(nonCapture("a").captured().kind()).isEqualTo(NodeKind.CAPTURE);
        assertThat(capture("a").withFlags("s").kind()).isEqualTo(NodeKind.CAPTURE);
    }

    // ========== Accessors ==========

    @Test
    @DisplayName("Quantifier should expose its bounds")
    void quantifier_accessors() {
        Quantifier q = repeat(2, 4, "a");
        assertThat(q.type()).isEqualTo(Quantifier.Type.REPEAT);
        assertThat(q.min()).isEqualTo(2);
        assertThat(q.max()).hasValue(4);
        assertThat(q.isLazy()).isFalse();
        assertThat(q.lazy().isLazy()).isTrue();
        assertThat(q.symbol()).isEqualTo("{2,4}");
        assertThat(q.lazy().symbol()).isEqualTo("{2,4}");
        assertThat(q.lazy().render()).isEqualTo("a{2,4}?");
    }

    @Test
    @DisplayName("Conditional should expose its branches")
    void conditional_accessors() {
        Conditional withNo = conditional("g", "a", "b");
        assertThat(withNo.selector()).isEqualTo(GroupReference.name("g"));
        assertThat(withNo.yes().render()).isEqualTo("a");
        assertThat(withNo.no()).map(Node::render).contains("b");
        assertThat(withNo.children()).hasSize(2);

        Conditional withoutNo = conditional(2, "a", "");
        assertThat(withoutNo.no()).isEmpty();
        assertThat(withoutNo.children()).hasSize(1);
        assertThat(withoutNo.selector().token()).isEqualTo("2");
    }

    @Test
    @DisplayName("Lookaround types should carry their prefixes")
    void lookaround_prefixes() {
        assertThat(lookahead("a").render()).isEqualTo("(?=a)");
        assertThat(lookbehind("a").render()).isEqualTo("(?<=a)");
        assertThat(negativeLookahead("a").render()).isEqualTo("(?!a)");
        assertThat(negativeLookbehind("a").render()).isEqualTo("(?<!a)");
        assertThat(Lookaround.Type.NEGATIVE_BEHIND.prefix()).isEqualTo("?<!");
    }

    @Test
    @DisplayName("Flag toggle should expose canonical codes")
    void flagToggle_codes() {
        FlagToggle toggle = flags(Flag.VERBOSE, Flag.DOT_ALL, Flag.IGNORE_CASE);
        assertThat(toggle.codes()).isEqualTo("isx");
        assertThat(toggle.flags()).containsExactlyInAnyOrder(Flag.VERBOSE, Flag.DOT_ALL, Flag.IGNORE_CASE);
    }

    @Test
    @DisplayName("Raw text should join its parts")
    void raw_text_joined() {
        assertThat(raw("a", "|", "b").text()).isEqualTo("a|b");
        assertThat(rawEntire("\\d").isEntire()).isTrue();
        assertThat(raw("\\d").isEntire()).isFalse();
        assertThat(literal("𝔘a").length()).isEqualTo(2);
    }

    // ========== Tree ==========

    @Test
    @DisplayName("Tree size should count every node")
    void treeSize_countsNodes() {
        assertThat(literal("a").treeSize()).isEqualTo(1);
        assertThat(DIGITS.treeSize()).isEqualTo(2);
        assertThat(capture("a", "b").treeSize()).isEqualTo(3);
        assertThat(oneOrMore(capture("a")).treeSize()).isEqualTo(3);
        assertThat(flags("i").treeSize()).isEqualTo(1);
        assertThat(backreference(1).treeSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("toString() should return the compact pattern")
    void toString_compactPattern() {
        Node node = named("word", oneOrMore(WORD));
        assertThat(node).hasToString("(?P<word>\\w+)");
    }

    @Test
    @DisplayName("Visitor should be dispatched by node type")
    void accept_dispatchesByType() {
        NodeKind kind = or("a").accept(new KindVisitor());
        assertThat(kind).isEqualTo(NodeKind.ALTERNATION);
        assertThat(lazy(".*").accept(new KindVisitor())).isEqualTo(NodeKind.LAZY);
        assertThat(inlineFlags(FlagScope.enabling(Flag.ASCII), "a").accept(new KindVisitor()))
            .isEqualTo(NodeKind.INLINE_FLAG);
    }

    private static final class KindVisitor implements NodeVisitor<NodeKind> {
        @Override public NodeKind visitLiteral(Literal node) { return node.kind(); }
        @Override public NodeKind visitRaw(Raw node) { return node.kind(); }
        @Override public NodeKind visitCharClass(CharClass node) { return node.kind(); }
        @Override public NodeKind visitLookaround(Lookaround node) { return node.kind(); }
        @Override public NodeKind visitQuantifier(Quantifier node) { return node.kind(); }
        @Override public NodeKind visitLazy(Lazy node) { return node.kind(); }
        @Override public NodeKind visitAlternation(Alternation node) { return node.kind(); }
        @Override public NodeKind visitCaptureGroup(CaptureGroup node) { return node.kind(); }
        @Override public NodeKind visitNonCaptureGroup(NonCaptureGroup node) { return node.kind(); }
        @Override public NodeKind visitConcat(Concat node) { return node.kind(); }
        @Override public NodeKind visitBackreference(Backreference node) { return node.kind(); }
        @Override public NodeKind visitConditional(Conditional node) { return node.kind(); }
        @Override public NodeKind visitFlagToggle(FlagToggle node) { return node.kind(); }
        @Override public NodeKind visitInlineFlag(InlineFlag node) { return node.kind(); }
    }
}
