package com.equation.graph.ir;

/**
 * Visitor pattern interface for traversing an equation tree.
 * Visitors accumulate their result internally and must not mutate the nodes they visit.
 *
 * @param <R> Return type of the visit methods.
 */
public interface NodeVisitor<R> {

    R visitArgument(Argument argument);

    R visitOperator(Operator operator);

    /**
     * Handler for node kinds this visitor has no method for.
     * Should generally not be called directly, use node.accept(visitor).
     *
     * @param node The node being visited.
     * @return Never returns normally.
     * @throws UnsupportedOperationException always.
     */
    default R visitNode(Node node) {
        throw new UnsupportedOperationException("Unsupported node kind: " + node.getClass().getName()
                + " for visitor " + getClass().getSimpleName());
    }
}
