package com.equation.graph.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents a function or algebraic operator applied to its children in order.
 * The operator owns its children exclusively.
 * <p>
 * {@code children.size() == arity} is expected by visitors but not checked here; that belongs to
 * whoever builds the tree. A mismatch surfaces as an out-of-range access during traversal.
 */
public class Operator implements Node {
    private final String name;
    private final String symbol;
    private final int arity;
    private final List<Node> children;

    public Operator(String name, String symbol, int arity, List<Node> children) {
        this.name = Objects.requireNonNull(name, "name is null");
        this.symbol = symbol;
        if (arity < 0) {
            throw new IllegalArgumentException("Operator arity must be non-negative, got " + arity);
        }
        this.arity = arity;
        List<Node> copy = new ArrayList<>(Objects.requireNonNull(children, "children is null"));
        for (Node child : copy) {
            Objects.requireNonNull(child, "child node is null");
        }
        this.children = Collections.unmodifiableList(copy);
    }

    public String getName() {
        return name;
    }

    /**
     * @return The infix symbol, or null when none is registered.
     */
    public String getSymbol() {
        return symbol;
    }

    public int getArity() {
        return arity;
    }

    public List<Node> getChildren() {
        return children; // Already unmodifiable
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOperator(this);
    }

    @Override
    public String toString() {
        return "Operator[" + name + (symbol != null ? " '" + symbol + "'" : "") + ", arity=" + arity
                + ", children=" + children.size() + "]";
    }
}
