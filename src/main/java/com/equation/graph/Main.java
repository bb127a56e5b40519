package com.equation.graph;

import com.equation.graph.ir.Argument;
import com.equation.graph.ir.Node;
import com.equation.graph.util.ArgumentUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        printHeader();

        // --- Load Config ---
        Config config;
        try {
            config = Config.loadFromResources("config.yaml");
            LOG.info("Loaded operators: {}", config.getOperators().keySet());
        } catch (RuntimeException e) {
            LOG.error("Configuration loading failed: {}", e.getMessage(), e);
            return;
        }

        // --- Demo equation: ((x + y) * 2) ---
        Argument x = new Argument("x", 1.5);
        Argument y = new Argument("y", 2.5);
        Node root = config.operator("multiply",
                config.operator("add", x, y),
                Argument.literal(2));

        LOG.info("Equation: {}", Printer.print(root));
        List<Argument> free = ArgFinder.findArguments(root, false);
        LOG.info("Free arguments: {}", ArgumentUtils.names(free));
    }

    /**
     * Prints a header with current timestamp.
     */
    private static void printHeader() {
        ZonedDateTime zdtNow = ZonedDateTime.now(ZoneId.systemDefault());
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
        System.out.println("--- Equation Graph ---");
        System.out.println("Run Time: " + zdtNow.format(formatter));
        System.out.println("----------------------");
    }
}
