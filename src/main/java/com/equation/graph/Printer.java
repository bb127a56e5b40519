package com.equation.graph;

import com.equation.graph.ir.*; // Node model
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Renders an equation tree as a single line that reads as the equation itself.
 * <p>
 * Binary operators whose symbol differs from their name are written infix and always parenthesized,
 * e.g. {@code ((x + y) * 2)}. Every other operator is written as a call, {@code name(arg0, arg1)}.
 * Output accumulates across calls; call {@link #reset()} before rendering another tree.
 * <p>
 * Only the outermost visit returns the accumulated output; visits made while descending return null.
 */
public class Printer implements NodeVisitor<String> {

    private static final Logger LOG = LoggerFactory.getLogger(Printer.class);

    private final StringBuilder output = new StringBuilder();
    // Nesting level of the visit in progress, 0 when idle
    private int depth;

    /**
     * Convenience entry point: renders a tree with a fresh printer.
     * @param root The root of the equation tree.
     * @return The one-line rendering.
     */
    public static String print(Node root) {
        return new Printer().render(root);
    }

    /**
     * Renders the tree under {@code root}, appending to the current output.
     * @return The full accumulated output.
     */
    public String render(Node root) {
        return root.accept(this);
    }

    public String getOutput() {
        return output.toString();
    }

    public void reset() {
        LOG.debug("Resetting Printer output of length {}", output.length());
        output.setLength(0);
        depth = 0;
    }

    @Override
    public String visitArgument(Argument argument) {
        depth++;
        try {
            if (argument.hasName()) {
                output.append(argument.getName());
            } else {
                output.append(argument.getValue());
            }
        } finally {
            depth--;
        }
        return result();
    }

    @Override
    public String visitOperator(Operator operator) {
        depth++;
        try {
            if (isInfix(operator)) {
                appendInfix(operator);
            } else {
                appendCall(operator);
            }
        } finally {
            depth--;
        }
        return result();
    }

    private String result() {
        return depth == 0 ? output.toString() : null;
    }

    // Naming convention, not a semantic check: a missing symbol also differs from the name
    private static boolean isInfix(Operator operator) {
        return operator.getArity() == 2 && !Objects.equals(operator.getName(), operator.getSymbol());
    }

    private void appendCall(Operator operator) {
        List<Node> children = operator.getChildren();
        output.append(operator.getName()).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i != 0) {
                output.append(", ");
            }
            children.get(i).accept(this);
        }
        output.append(')');
    }

    private void appendInfix(Operator operator) {
        List<Node> children = operator.getChildren();
        // Fewer than two children is a malformed tree; get() throws IndexOutOfBoundsException
        Node lhs = children.get(0);
        Node rhs = children.get(1);
        output.append('(');
        lhs.accept(this);
        output.append(' ').append(operator.getSymbol()).append(' ');
        rhs.accept(this);
        output.append(')');
    }
}
