package com.vidnyan.j2py.domain.graph;

import com.vidnyan.j2py.domain.mapped.MappedClass;
import com.vidnyan.j2py.domain.mapped.MappedIr;
import lombok.Builder;
import lombok.Value;

import java.util.*;

/**
 * Class-level inheritance graph of one migration unit.
 * Nodes are class names in declaration order; an edge A → B means A extends or implements B
 * and B is declared in the same unit. Classes are never linked by object reference, so cycles
 * are found by traversal instead of unbounded recursion over the model.
 */
@Value
@Builder
public class InheritanceGraph {
    // Class → classes it inherits from, in declaration order
    Map<String, List<String>> parents;

    // Class → declaration index
    Map<String, Integer> order;

    /**
     * Build inheritance graph from a mapped IR.
     */
    public static InheritanceGraph build(MappedIr ir) {
        Map<String, Integer> order = new LinkedHashMap<>();
        for (MappedClass cls : ir.getClasses()) {
            order.putIfAbsent(cls.getName(), order.size());
        }

        Map<String, List<String>> parents = new LinkedHashMap<>();
        for (MappedClass cls : ir.getClasses()) {
            List<String> edges = new ArrayList<>();
            cls.getSuperclass()
                    .filter(order::containsKey)
                    .ifPresent(edges::add);
            for (String capability : cls.getCapabilities()) {
                if (order.containsKey(capability) && !edges.contains(capability)) {
                    edges.add(capability);
                }
            }
            parents.put(cls.getName(), List.copyOf(edges));
        }

        return InheritanceGraph.builder()
                .parents(Collections.unmodifiableMap(parents))
                .order(Collections.unmodifiableMap(order))
                .build();
    }

    public List<String> getParents(String className) {
        return parents.getOrDefault(className, List.of());
    }

    /**
     * Every class in the unit that {@code className} inherits from, directly or transitively.
     */
    public Set<String> ancestors(String className) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(getParents(className));
        while (!pending.isEmpty()) {
            String next = pending.poll();
            if (seen.add(next)) {
                pending.addAll(getParents(next));
            }
        }
        return seen;
    }

    /**
     * Stable topological order: parents before children, ties broken by declaration order.
     * Empty when the graph has a cycle; use {@link #findCycle()} for the offending path.
     */
    public Optional<List<String>> topologicalOrder() {
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> children = new HashMap<>();
        for (var entry : parents.entrySet()) {
            pending.put(entry.getKey(), entry.getValue().size());
            for (String parent : entry.getValue()) {
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(entry.getKey());
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparingInt(order::get));
        pending.forEach((name, count) -> {
            if (count == 0) {
                ready.add(name);
            }
        });

        List<String> sorted = new ArrayList<>();
        while (!ready.isEmpty()) {
            String next = ready.poll();
            sorted.add(next);
            for (String child : children.getOrDefault(next, List.of())) {
                if (pending.merge(child, -1, Integer::sum) == 0) {
                    ready.add(child);
                }
            }
        }
        return sorted.size() == parents.size() ? Optional.of(sorted) : Optional.empty();
    }

    /**
     * Detect an inheritance cycle using DFS. Returns the path with the first node repeated
     * at the end, e.g. {@code [A, B, A]}, or an empty list when acyclic.
     */
    public List<String> findCycle() {
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        for (String node : order.keySet()) {
            if (!visited.contains(node)) {
                List<String> cycle = dfs(node, visited, stack);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    private List<String> dfs(String node, Set<String> visited, Deque<String> stack) {
        visited.add(node);
        stack.addLast(node);

        for (String parent : getParents(node)) {
            if (stack.contains(parent)) {
                // Found a cycle
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String onStack : stack) {
                    if (onStack.equals(parent)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(onStack);
                    }
                }
                cycle.add(parent);
                return cycle;
            }
            if (!visited.contains(parent)) {
                List<String> cycle = dfs(parent, visited, stack);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }

        stack.removeLast();
        return List.of();
    }

    /**
     * Length of the superclass chain. A superclass outside the unit counts as one level.
     */
    public int inheritanceDepth(MappedIr ir, String className) {
        int depth = 0;
        Set<String> seen = new HashSet<>();
        Optional<MappedClass> current = ir.findClass(className);
        while (current.isPresent() && current.get().getSuperclass().isPresent() && seen.add(current.get().getName())) {
            depth++;
            current = ir.findClass(current.get().getSuperclass().get());
        }
        return depth;
    }
}
