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

import com.axonops.regexr.node.CaptureMode;
import com.axonops.regexr.node.Literal;
import com.axonops.regexr.node.Node;
import com.axonops.regexr.node.Quantifier;
import com.axonops.regexr.node.Raw;

/**
 * Group delimiters shared by both renderers.
 *
 * <p>The flag wrapper sits inside the capture wrapper: {@code (?P<name>(?i:...))}. A plain
 * {@code (?:...)} is only used for kinds that group when bare, and only when there is no flag
 * wrapper to do the grouping.
 */
final class Wrapping {

    private Wrapping() {
        // Utility class
    }

    static boolean isBare(Node node) {
        return open(node).isEmpty();
    }

    static String open(Node node) {
        String flags = node.flagScope().isEmpty() ? "" : "(?" + node.flagScope().codes() + ":";
        CaptureMode capture = node.captureMode();
        if (capture instanceof CaptureMode.Named named) {
            return "(?P<" + named.name() + ">" + flags;
        }
        if (capture.isCapturing()) {
            return "(" + flags;
        }
        if (flags.isEmpty() && node.kind().groupsWhenBare()) {
            return "(?:";
        }
        return flags;
    }

    static String close(Node node) {
        String flags = node.flagScope().isEmpty() ? "" : ")";
        if (node.isCapturing()) {
            return flags + ")";
        }
        if (flags.isEmpty() && node.kind().groupsWhenBare()) {
            return ")";
        }
        return flags;
    }

    /**
     * Whether the operand of a quantifier must be put in a non-capturing group so the repetition
     * applies to all of it.
     */
    static boolean operandNeedsGroup(Quantifier quantifier) {
        if (quantifier.children().size() > 1) {
            return true;
        }
        Node operand = quantifier.children().get(0);
        switch (operand.kind()) {
            case LITERAL:
                return ((Literal) operand).length() > 1;
            case RAW:
                return !((Raw) operand).isEntire() && !operand.isCapturing();
            default:
                return !operand.kind().atomicOperand()
                    && !operand.kind().groupsWhenBare()
                    && !operand.isCapturing();
        }
    }
}
