package com.amphitheatre.composer.resolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph over Actor names; an edge points from an Actor to each Actor
 * it depends on.
 *
 * Built fresh for every reconcile pass. Node order is declaration order and
 * is used to break ties in {@link #topologicalOrder()}.
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();

    public void addNode(String name) {
        edges.computeIfAbsent(name, n -> new LinkedHashSet<>());
    }

    /** Record that {@code from} depends on {@code to}. Both become nodes. */
    public void addEdge(String from, String to) {
        addNode(from);
        addNode(to);
        edges.get(from).add(to);
    }

    public boolean contains(String name) {
        return edges.containsKey(name);
    }

    public List<String> nodes() {
        return List.copyOf(edges.keySet());
    }

    public Set<String> dependenciesOf(String name) {
        return Collections.unmodifiableSet(edges.getOrDefault(name, Set.of()));
    }

    /** Every node that depends on {@code name}, directly or transitively. */
    public Set<String> dependentsOf(String name) {
        Set<String> found = new LinkedHashSet<>();
        Deque<String> work = new ArrayDeque<>(List.of(name));
        while (!work.isEmpty()) {
            String current = work.poll();
            for (Map.Entry<String, Set<String>> e : edges.entrySet()) {
                if (e.getValue().contains(current) && found.add(e.getKey())) {
                    work.add(e.getKey());
                }
            }
        }
        return found;
    }

    // ------------------------------------------------------------------
    // Cycle detection
    // ------------------------------------------------------------------

    private enum Colour { WHITE, GREY, BLACK }

    /**
     * Depth-first search with white/grey/black colouring. Reaching a grey node
     * means the current path loops back on itself.
     *
     * @return the first cycle found, as [n0, n1, ..., n0], or empty if acyclic
     */
    public Optional<List<String>> findCycle() {
        Map<String, Colour> colour = new HashMap<>();
        edges.keySet().forEach(n -> colour.put(n, Colour.WHITE));

        for (String start : edges.keySet()) {
            if (colour.get(start) == Colour.WHITE) {
                List<String> path = new ArrayList<>();
                Optional<List<String>> cycle = visit(start, colour, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(String node, Map<String, Colour> colour, List<String> path) {
        colour.put(node, Colour.GREY);
        path.add(node);
        for (String dep : edges.get(node)) {
            Colour c = colour.get(dep);
            if (c == Colour.GREY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                return Optional.of(cycle);
            }
            if (c == Colour.WHITE) {
                Optional<List<String>> found = visit(dep, colour, path);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        path.remove(path.size() - 1);
        colour.put(node, Colour.BLACK);
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Ordering
    // ------------------------------------------------------------------

    /**
     * Kahn's algorithm, dependencies first. Among nodes that are ready at the
     * same time the one declared earlier goes first.
     *
     * @throws CycleException if the graph is not acyclic
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> remaining = new HashMap<>();
        edges.forEach((node, deps) -> remaining.put(node, deps.size()));

        List<String> declared = nodes();
        List<String> order = new ArrayList<>(declared.size());
        Set<String> done = new LinkedHashSet<>();

        while (order.size() < declared.size()) {
            String next = null;
            for (String n : declared) {
                if (!done.contains(n) && remaining.get(n) == 0) {
                    next = n;
                    break;
                }
            }
            if (next == null) {
                throw new CycleException(findCycle().orElseThrow());
            }
            order.add(next);
            done.add(next);
            for (Map.Entry<String, Set<String>> e : edges.entrySet()) {
                if (e.getValue().contains(next)) {
                    remaining.merge(e.getKey(), -1, Integer::sum);
                }
            }
        }
        return order;
    }
}
