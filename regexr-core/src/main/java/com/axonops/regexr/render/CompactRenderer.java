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
import com.axonops.regexr.node.GroupReference;
import com.axonops.regexr.node.InlineFlag;
import com.axonops.regexr.node.Lazy;
import com.axonops.regexr.node.Literal;
import com.axonops.regexr.node.Lookaround;
import com.axonops.regexr.node.Node;
import com.axonops.regexr.node.NodeKind;
import com.axonops.regexr.node.NodeVisitor;
import com.axonops.regexr.node.NonCaptureGroup;
import com.axonops.regexr.node.Quantifier;
import com.axonops.regexr.node.Raw;
import com.axonops.regexr.util.RegexEscaper;

import java.util.List;

/**
 * Renders a node tree to single-line pattern text.
 *
 * <p>Stateless and thread-safe; use {@link #INSTANCE}.
 *
 * <p>Each visit method returns the node's body without its own capture or flag wrapper;
 * {@link #render(Node)} adds the wrapper.
 *
 * @since 1.0.0
 */
public final class CompactRenderer implements NodeVisitor<String> {

    public static final CompactRenderer INSTANCE = new CompactRenderer();

    private CompactRenderer() {
    }

    /**
     * @param node root of the tree
     * @return pattern text, including the root's own wrapper
     */
    public String render(Node node) {
        return Wrapping.open(node) + node.accept(this) + Wrapping.close(node);
    }

    private String join(List<Node> children, String separator) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            out.append(render(children.get(i)));
        }
        return out.toString();
    }

    @Override
    public String visitLiteral(Literal literal) {
        return RegexEscaper.escape(literal.text());
    }

    @Override
    public String visitRaw(Raw raw) {
        return raw.text();
    }

    @Override
    public String visitCharClass(CharClass charClass) {
        StringBuilder out = new StringBuilder(charClass.isNegated() ? "[^" : "[");
        for (Node child : charClass.children()) {
            // Ranges like a-z must survive, so literal text is not escaped here
            out.append(child.kind() == NodeKind.LITERAL ? ((Literal) child).text() : render(child));
        }
        return out.append(']').toString();
    }

    @Override
    public String visitLookaround(Lookaround lookaround) {
        return "(" + lookaround.type().prefix() + join(lookaround.children(), "") + ")";
    }

    @Override
    public String visitQuantifier(Quantifier quantifier) {
        String operand = join(quantifier.children(), "");
        if (Wrapping.operandNeedsGroup(quantifier)) {
            operand = "(?:" + operand + ")";
        }
        return operand + quantifier.symbol() + (quantifier.isLazy() ? "?" : "");
    }

    @Override
    public String visitLazy(Lazy lazy) {
        return render(lazy.operand()) + "?";
    }

    @Override
    public String visitAlternation(Alternation alternation) {
        return join(alternation.children(), "|");
    }

    @Override
    public String visitCaptureGroup(CaptureGroup group) {
        return join(group.children(), "");
    }

    @Override
    public String visitNonCaptureGroup(NonCaptureGroup group) {
        return join(group.children(), "");
    }

    @Override
    public String visitConcat(Concat concat) {
        return join(concat.children(), "");
    }

    @Override
    public String visitBackreference(Backreference backreference) {
        GroupReference reference = backreference.reference();
        if (reference instanceof GroupReference.Name name) {
            return "(?P=" + name.name() + ")";
        }
        return "\\" + reference.token();
    }

    @Override
    public String visitConditional(Conditional conditional) {
        String no = conditional.no().map(this::render).orElse("");
        return "(?(" + conditional.selector().token() + ")"
            + render(conditional.yes())
            + (no.isEmpty() ? "" : "|" + no)
            + ")";
    }

    @Override
    public String visitFlagToggle(FlagToggle toggle) {
        return "(?" + toggle.codes() + ")";
    }

    @Override
    public String visitInlineFlag(InlineFlag inlineFlag) {
        return join(inlineFlag.children(), "");
    }
}
