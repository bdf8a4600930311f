package com.backtester.core.indicator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks indicator dependency graphs. Indicators are identified by {@link Indicator#name()}.
 */
public final class IndicatorValidator {

    private IndicatorValidator() {
    }

    /**
     * @throws IllegalArgumentException if any indicator reaches itself through its dependencies
     */
    public static void validate(List<? extends Indicator<?>> indicators) {
        executionOrder(indicators);
    }

    /**
     * Dependencies-first order of the given indicators and everything they depend on.
     * Each name appears once.
     *
     * @throws IllegalArgumentException on a circular dependency; the message names the chain
     */
    public static List<Indicator<?>> executionOrder(List<? extends Indicator<?>> indicators) {
        Set<String> visited = new HashSet<>();
        Set<String> stack = new HashSet<>();
        List<Indicator<?>> ordered = new ArrayList<>();
        for (Indicator<?> indicator : indicators) {
            visit(indicator, visited, stack, ordered, new ArrayList<>());
        }
        return ordered;
    }

    private static void visit(Indicator<?> indicator, Set<String> visited, Set<String> stack,
                              List<Indicator<?>> ordered, List<String> path) {
        String name = indicator.name();
        path.add(name);
        if (stack.contains(name)) {
            throw new IllegalArgumentException("Circular indicator dependency: " + String.join(" -> ", path));
        }
        if (visited.contains(name)) {
            path.remove(path.size() - 1);
            return;
        }
        stack.add(name);
        visited.add(name);
        for (Indicator<?> dependency : indicator.dependencies()) {
            visit(dependency, visited, stack, ordered, path);
        }
        stack.remove(name);
        path.remove(path.size() - 1);
        ordered.add(indicator);
    }
}
