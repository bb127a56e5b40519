package com.equation.graph;

import com.equation.graph.ir.Argument;
import com.equation.graph.ir.Node;
import com.equation.graph.ir.Operator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestInstance(TestInstance.Lifecycle.PER_CLASS) // To allow @BeforeAll on non-static method
public class ArgFinderTests {

    private Config config;

    @BeforeAll
    void setup() {
        config = Config.loadFromResources("config.yaml");
    }

    @Test
    @DisplayName("Constants are excluded only when requested")
    void testConstantFiltering() {
        Argument a = new Argument("a", 1.0, true);
        Argument b = new Argument("b", 2.0, false);
        Node root = config.operator("add", a, b);

        assertEquals(List.of(b), ArgFinder.findArguments(root, false));
        assertEquals(List.of(a, b), ArgFinder.findArguments(root, true));
        assertEquals(List.of(a, b), new ArgFinder().find(root));
    }

    @Test
    @DisplayName("Arguments are collected depth-first, left to right")
    void testTraversalOrder() {
        Argument x = new Argument("x", 1.0);
        Argument y = new Argument("y", 1.0);
        Argument two = Argument.literal(2.0);
        Argument z = new Argument("z", 1.0);
        Node root = config.operator("add",
                config.operator("multiply", config.operator("add", x, y), two),
                config.operator("sin", z));

        assertEquals(List.of(x, y, two, z), ArgFinder.findArguments(root, true));
        assertEquals(List.of(x, y, z), ArgFinder.findArguments(root, false));
    }

    @Test
    @DisplayName("Shared arguments are collected once per occurrence")
    void testOccurrencesNotDeduplicated() {
        Argument x = new Argument("x", 1.0);
        Node root = config.operator("multiply", x, config.operator("add", x, Argument.literal(1.0)));

        List<Argument> found = ArgFinder.findArguments(root, true);
        assertEquals(3, found.size());
        assertSame(x, found.get(0));
        assertSame(x, found.get(1));
        assertEquals(2, ArgFinder.findArguments(root, false).size());
    }

    @Test
    @DisplayName("A lone argument and an empty operator")
    void testDegenerateTrees() {
        Argument c = Argument.literal(5.0);
        assertEquals(List.of(c), ArgFinder.findArguments(c, true));
        assertTrue(ArgFinder.findArguments(c, false).isEmpty());
        assertTrue(ArgFinder.findArguments(new Operator("pi", "pi", 0, Collections.emptyList()), true).isEmpty());
    }

    @Test
    @DisplayName("Results accumulate until reset, and reset prevents leakage")
    void testResetBetweenTraversals() {
        Argument p = new Argument("p", 1.0);
        Argument q = new Argument("q", 1.0);
        ArgFinder finder = new ArgFinder(false);

        finder.find(config.operator("sin", p));
        assertEquals(List.of(p, q), finder.find(config.operator("cos", q)));

        finder.reset();
        assertTrue(finder.getArguments().isEmpty());
        assertEquals(List.of(q), finder.find(config.operator("exp", q)));
    }

    @Test
    @DisplayName("Returned list is a read-only view")
    void testResultIsUnmodifiable() {
        List<Argument> found = new ArgFinder().find(new Argument("x", 1.0));
        assertThrows(UnsupportedOperationException.class, () -> found.add(new Argument("y", 1.0)));
    }
}
