package com.amphitheatre.composer.resolver;

import com.amphitheatre.composer.model.SourceLocator;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of one successful {@link Resolver#resolve} call.
 *
 * @param graph      acyclic dependency graph over Actor names
 * @param order      topological order, dependencies first
 * @param commits    resolved commit per walked node
 * @param discovered manifest partners per walked node
 * @param partners   partners that are not Actors of the Playbook yet, with their source
 */
public record Resolution(DependencyGraph graph,
                         List<String> order,
                         Map<String, String> commits,
                         Map<String, Set<String>> discovered,
                         Map<String, SourceLocator> partners) {

    public Optional<String> commitOf(String name) {
        return Optional.ofNullable(commits.get(name));
    }

    public Set<String> discoveredBy(String name) {
        return discovered.getOrDefault(name, Set.of());
    }
}
