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

package com.axonops.regexr.render;

import com.axonops.regexr.node.Alternation;
import com.axonops.regexr.node.Backreference;
import com.axonops.regexr.node.CaptureGroup;
import com.axonops.regexr.node.CharClass;
import com.axonops.regexr.node.Concat;
import com.axonops.regexr.node.Conditional;
import com.axonops.regexr.node.FlagToggle;
import com.axonops.regexr.node.InlineFlag;
import com.axonops.regexr.node.Lazy;
import com.axonops.regexr.node.Literal;
import com.axonops.regexr.node.Lookaround;
import com.axonops.regexr.node.Node;
import com.axonops.regexr.node.NodeVisitor;
import com.axonops.regexr.node.NonCaptureGroup;
import com.axonops.regexr.node.Quantifier;
import com.axonops.regexr.node.Raw;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a node tree as indented multi-line text.
 *
 * <p>Removing the leading whitespace of every line and joining the lines yields exactly the compact
 * rendering, as long as the indent unit is whitespace.
 *
 * <p>Layout rules:
 *
 * <ul>
 *   <li>sequences put each child on its own line
 *   <li>a group whose body fits on one line stays on one line; otherwise the opening and closing
 *       delimiters get their own lines and the body is indented one unit
 *   <li>alternatives go on separate lines, prefixed with {@code |}, once any of them spans lines
 *   <li>quantifiers, character classes, raw text, backreferences and flag toggles are atomic and
 *       print as in the compact form
 * </ul>
 *
 * @since 1.0.0
 */
public final class PrettyRenderer implements NodeVisitor<String> {

    private final String indentUnit;

    /**
     * @param indentUnit text added once per nesting level
     */
    public PrettyRenderer(String indentUnit) {
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit cannot be null");
    }

    public String render(Node node) {
        return render(node, 0);
    }

    /**
     * @param node root of the tree
     * @param depth nesting level of the root; every line gets {@code depth} indent units
     * @return the layout
     * @throws IllegalArgumentException if depth is negative
     */
    public String render(Node node, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be non-negative: " + depth);
        }
        String layout = layout(node);
        if (depth == 0 || layout.isEmpty()) {
            return layout;
        }
        return indent(layout, indentUnit.repeat(depth));
    }

    private String layout(Node node) {
        String body = node.accept(this);
        if (Wrapping.isBare(node)) {
            return body;
        }
        String open = Wrapping.open(node);
        String close = Wrapping.close(node);
        if (!isMultiLine(body)) {
            return open + body + close;
        }
        return open + "\n" + indent(body, indentUnit) + "\n" + close;
    }

    private String lines(List<Node> children) {
        List<String> out = new ArrayList<>(children.size());
        for (Node child : children) {
            out.add(layout(child));
        }
        return String.join("\n", out);
    }

    private static boolean isMultiLine(String text) {
        return text.indexOf('\n') >= 0;
    }

    private static String indent(String text, String prefix) {
        String[] lines = text.split("\n");
        StringBuilder out = new StringBuilder(text.length() + lines.length * prefix.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(prefix).append(lines[i]);
        }
        return out.toString();
    }

    private static String compactBody(Node node) {
        return node.accept(CompactRenderer.INSTANCE);
    }

    @Override
    public String visitLiteral(Literal literal) {
        return compactBody(literal);
    }

    @Override
    public String visitRaw(Raw raw) {
        return compactBody(raw);
    }

    @Override
    public String visitCharClass(CharClass charClass) {
        return compactBody(charClass);
    }

    @Override
    public String visitLookaround(Lookaround lookaround) {
        String prefix = "(" + lookaround.type().prefix();
        String body = lines(lookaround.children());
        if (!isMultiLine(body)) {
            return prefix + body + ")";
        }
        return prefix + "\n" + indent(body, indentUnit) + "\n)";
    }

    @Override
    public String visitQuantifier(Quantifier quantifier) {
        return compactBody(quantifier);
    }

    @Override
    public String visitLazy(Lazy lazy) {
        return layout(lazy.operand()) + "?";
    }

    @Override
    public String visitAlternation(Alternation alternation) {
        List<String> branches = new ArrayList<>(alternation.children().size());
        boolean multiLine = false;
        for (Node child : alternation.children()) {
            String branch = layout(child);
            multiLine |= isMultiLine(branch);
            branches.add(branch);
        }
        return String.join(multiLine ? "\n|" : "|", branches);
    }

    @Override
    public String visitCaptureGroup(CaptureGroup group) {
        return lines(group.children());
    }

    @Override
    public String visitNonCaptureGroup(NonCaptureGroup group) {
        return lines(group.children());
    }

    @Override
    public String visitConcat(Concat concat) {
        return lines(concat.children());
    }

    @Override
    public String visitBackreference(Backreference backreference) {
        return compactBody(backreference);
    }

    @Override
    public String visitConditional(Conditional conditional) {
        String head = "(?(" + conditional.selector().token() + ")";
        String yes = layout(conditional.yes());
        String no = conditional.no()
            .filter(branch -> !CompactRenderer.INSTANCE.render(branch).isEmpty())
            .map(this::layout)
            .orElse("");
        if (!isMultiLine(yes) && !isMultiLine(no)) {
            return head + yes + (no.isEmpty() ? "" : "|" + no) + ")";
        }
        StringBuilder out = new StringBuilder(head).append('\n').append(indent(yes, indentUnit));
        if (!no.isEmpty()) {
            out.append('\n').append(indent("|" + no, indentUnit));
        }
        return out.append("\n)").toString();
    }

    @Override
    public String visitFlagToggle(FlagToggle toggle) {
        return compactBody(toggle);
    }

    @Override
    public String visitInlineFlag(InlineFlag inlineFlag) {
        return lines(inlineFlag.children());
    }
}
