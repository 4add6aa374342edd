package com.amphitheatre.composer.resolver;

import java.util.List;

/**
 * A dependency cycle. {@link #getCycle()} lists every node on it in edge
 * order, starting and ending with the same node (e.g. [a, b, c, a]).
 *
 * The subjects are the Actors the cycle is charged to. For a cycle of
 * Actors that is the cycle itself; a cycle running through discovered
 * partners is charged to the Actors that introduced them.
 */
public class CycleException extends ResolveException {

    private final List<String> cycle;

    public CycleException(List<String> cycle) {
        this(cycle, cycle.subList(0, cycle.size() - 1));
    }

    public CycleException(List<String> cycle, List<String> subjects) {
        super(Kind.CYCLE, subjects, "dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() { return cycle; }
}
