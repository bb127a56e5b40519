package com.equation.graph.ir;

/**
 * Base interface for nodes in an equation tree.
 * A tree is built from {@link Argument} leaves and {@link Operator} internal nodes;
 * {@link Operator#getChildren()} is the only edge set and no node stores a reference to its parent.
 */
public interface Node {

    /**
     * Accepts a visitor according to the visitor pattern.
     * Implementations call exactly one visit method, passing themselves, and return its result unchanged.
     * @param visitor The visitor implementation.
     * @return The result returned by the visitor's specific visit method.
     * @param <R> The return type of the visitor.
     */
    <R> R accept(NodeVisitor<R> visitor);
}
