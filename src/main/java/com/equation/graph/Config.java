package com.equation.graph;

import com.equation.graph.ir.Node;
import com.equation.graph.ir.Operator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Loads and holds the operator registry from the config.yaml file.
 * Each entry names an operator and the symbol and arity it is built with.
 */
public class Config {

    private static final Logger LOG = LoggerFactory.getLogger(Config.class);

    // Field name must match the top-level key in config.yaml
    private Map<String, OperatorDefinition> operators;

    // Getters are needed for Jackson deserialization
    public Map<String, OperatorDefinition> getOperators() {
        return operators;
    }

    public void setOperators(Map<String, OperatorDefinition> operators) {
        this.operators = operators;
    }

    // --- Inner class representing the structure in YAML ---

    public static class OperatorDefinition {
        // Field names 'symbol' and 'arity' match keys in YAML
        private String symbol;
        private int arity;

        public String getSymbol() {
            return symbol;
        }

        public void setSymbol(String symbol) {
            this.symbol = symbol;
        }

        public int getArity() {
            return arity;
        }

        public void setArity(int arity) {
            this.arity = arity;
        }

        /**
         * Builds an operator from this definition. The child count is not checked against the arity.
         * @param name The operator name the definition was registered under.
         * @param children The operands, in order.
         * @return A new Operator.
         */
        public Operator create(String name, Node... children) {
            return new Operator(name, symbol, arity, Arrays.asList(children));
        }
    }

    // --- Loading Logic ---

    /**
     * Loads configuration from the specified classpath resource path.
     * @param resourcePath Path relative to the classpath root (e.g., "config.yaml")
     * @return Loaded Config object.
     * @throws RuntimeException if loading fails.
     */
    public static Config loadFromResources(String resourcePath) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = Config.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new RuntimeException("Cannot find configuration file in classpath: " + resourcePath);
            }
            Config config = mapper.readValue(is, Config.class);
            if (config.getOperators() == null) {
                config.operators = Collections.emptyMap(); // Avoid NPE later
            }
            LOG.info("Loaded {} operator definition(s) from {}", config.operators.size(), resourcePath);
            return config;
        } catch (Exception e) {
            throw new RuntimeException("Failed to load configuration from " + resourcePath, e);
        }
    }

    // --- Convenience Accessors ---

    /**
     * Gets the definition for a specific operator.
     * @param name The operator name.
     * @return The OperatorDefinition object.
     * @throws IllegalArgumentException if the operator is not found.
     */
    public OperatorDefinition getOperator(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        OperatorDefinition def = (operators != null) ? operators.get(name) : null;
        if (def == null) {
            throw new IllegalArgumentException("Operator definition not found in config: " + name);
        }
        return def;
    }

    /**
     * Shorthand for {@code getOperator(name).create(name, children)}.
     */
    public Operator operator(String name, Node... children) {
        return getOperator(name).create(name, children);
    }
}
