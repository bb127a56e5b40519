package com.equation.graph;

import com.equation.graph.ir.*; // Node model
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the Argument leaves of an equation tree in depth-first, left-to-right order.
 * <p>
 * Every occurrence is collected: an Argument shared by two operators appears twice.
 * Use {@link com.equation.graph.util.ArgumentUtils#distinctByIdentity(List)} when the distinct set is needed.
 * The accumulator is not cleared between traversals; call {@link #reset()} before reusing an instance.
 */
public class ArgFinder implements NodeVisitor<List<Argument>> {

    private static final Logger LOG = LoggerFactory.getLogger(ArgFinder.class);

    private final boolean getConsts;
    private final List<Argument> args = new ArrayList<>();
    private final List<Argument> argsView = Collections.unmodifiableList(args);

    public ArgFinder() {
        this(true);
    }

    /**
     * @param getConsts Whether constant arguments are collected.
     */
    public ArgFinder(boolean getConsts) {
        this.getConsts = getConsts;
    }

    /**
     * Convenience entry point: collects the arguments of a tree with a fresh finder.
     * @param root The root of the equation tree.
     * @param getConsts Whether constant arguments are collected.
     * @return The collected arguments, in order of encounter.
     */
    public static List<Argument> findArguments(Node root, boolean getConsts) {
        return new ArgFinder(getConsts).find(root);
    }

    /**
     * Walks the tree under {@code root}, appending to whatever this finder already holds.
     * @return An unmodifiable view of the accumulated arguments.
     */
    public List<Argument> find(Node root) {
        return root.accept(this);
    }

    public List<Argument> getArguments() {
        return argsView;
    }

    public boolean isGetConsts() {
        return getConsts;
    }

    public void reset() {
        LOG.debug("Resetting ArgFinder holding {} argument(s)", args.size());
        args.clear();
    }

    @Override
    public List<Argument> visitArgument(Argument argument) {
        if (getConsts || !argument.isConstant()) {
            args.add(argument);
        }
        return argsView;
    }

    @Override
    public List<Argument> visitOperator(Operator operator) {
        // Operators contribute nothing themselves
        for (Node child : operator.getChildren()) {
            child.accept(this);
        }
        return argsView;
    }
}
