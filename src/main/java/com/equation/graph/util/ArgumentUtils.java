package com.equation.graph.util;

import com.equation.graph.ir.Argument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Utility methods for working with the argument lists collected from equation trees.
 */
public final class ArgumentUtils {

    private ArgumentUtils() {}

    /**
     * Removes repeated occurrences of the same Argument instance, keeping the first.
     * Arguments that merely share a name or value are kept.
     * @param arguments Arguments in order of encounter, possibly with repeats.
     * @return An unmodifiable list of distinct instances, in order of first encounter.
     */
    public static List<Argument> distinctByIdentity(List<Argument> arguments) {
        Objects.requireNonNull(arguments, "arguments is null");
        Map<Argument, Boolean> seen = new IdentityHashMap<>();
        List<Argument> distinct = new ArrayList<>();
        for (Argument argument : arguments) {
            if (seen.put(argument, Boolean.TRUE) == null) {
                distinct.add(argument);
            }
        }
        return Collections.unmodifiableList(distinct);
    }

    /**
     * Gets the names of the given arguments, rendering unnamed ones by value.
     * @param arguments The arguments.
     * @return Their display names, in the same order.
     */
    public static List<String> names(List<Argument> arguments) {
        List<String> names = new ArrayList<>(arguments.size());
        for (Argument argument : arguments) {
            names.add(argument.hasName() ? argument.getName() : String.valueOf(argument.getValue()));
        }
        return names;
    }
}
