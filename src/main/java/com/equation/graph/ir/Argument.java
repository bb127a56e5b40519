package com.equation.graph.ir;

import java.util.Objects;

/**
 * Represents a leaf quantity: a refinable parameter or a fixed constant.
 * An argument without a name is identified by its numeric value, rendered with the value's own
 * {@code toString}, so {@code Integer} 2 prints {@code 2} and {@code Double} 3.0 prints {@code 3.0}.
 * Equality is identity; two arguments with the same name and value are still distinct leaves.
 */
public class Argument implements Node {
    private final String name;
    private final boolean constant;
    // Updated by the refinement layer between traversals, never by a visitor
    private Number value;

    public Argument(String name, Number value, boolean constant) {
        this.name = name;
        this.value = Objects.requireNonNull(value, "value is null");
        this.constant = constant;
    }

    public Argument(String name, Number value) {
        this(name, value, false);
    }

    /**
     * Creates an unnamed constant, rendered by its value.
     */
    public static Argument literal(Number value) {
        return new Argument(null, value, true);
    }

    public String getName() {
        return name;
    }

    public boolean hasName() {
        return name != null;
    }

    public Number getValue() {
        return value;
    }

    public void setValue(Number value) {
        this.value = Objects.requireNonNull(value, "value is null");
    }

    public boolean isConstant() {
        return constant;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArgument(this);
    }

    @Override
    public String toString() {
        return "Argument[" + (name != null ? name : "<unnamed>") + "=" + value + (constant ? ", const" : "") + "]";
    }
}
