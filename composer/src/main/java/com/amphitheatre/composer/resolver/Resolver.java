package com.amphitheatre.composer.resolver;

import com.amphitheatre.composer.model.Actor;
import com.amphitheatre.composer.model.ErrorClass;
import com.amphitheatre.composer.model.SourceLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the Actors of a Playbook into a {@link DependencyGraph}.
 *
 * For every Actor the source reference is resolved to a commit, the tree at
 * that commit is checked for the Actor's path, and the {@code .amp.toml} found
 * there is read for partner declarations. Partners that are not Actors yet
 * are walked as well, so the returned graph is transitively complete.
 *
 * Stateless apart from the manifest cache; safe to call concurrently for
 * different Playbooks. Fetch failures propagate as {@link ResolveException}
 * of kind FETCH and are never retried here.
 */
public class Resolver {

    private static final Logger log = LoggerFactory.getLogger(Resolver.class);

    private final SourceFetcher  fetcher;
    private final ManifestParser parser;
    private final ManifestCache  cache;

    public Resolver(SourceFetcher fetcher, ManifestParser parser, ManifestCache cache) {
        this.fetcher = fetcher;
        this.parser  = parser;
        this.cache   = cache;
    }

    private record Node(String name, SourceLocator source, Set<String> declared) {}

    /**
     * Resolve a Playbook's Actors.
     *
     * Actors that already failed on a configuration error are kept as graph
     * nodes (so their dependents stay ordered behind them) but are not walked.
     *
     * @throws CycleException   if the dependencies loop
     * @throws ResolveException UNRESOLVED, MALFORMED_MANIFEST or FETCH
     */
    public Resolution resolve(List<Actor> actors) {
        DependencyGraph graph              = new DependencyGraph();
        Map<String, Actor> byName          = new LinkedHashMap<>();
        Map<String, String> commits        = new LinkedHashMap<>();
        Map<String, Set<String>> found     = new LinkedHashMap<>();
        Map<String, SourceLocator> partners = new LinkedHashMap<>();
        Map<String, String> introducedBy   = new LinkedHashMap<>();
        List<Node> walked                  = new ArrayList<>();

        Deque<Node> work = new ArrayDeque<>();
        for (Actor actor : actors) {
            byName.put(actor.getName(), actor);
            graph.addNode(actor.getName());
            if (!isBlocked(actor)) {
                work.add(new Node(actor.getName(), actor.getSource(), actor.getDependencies()));
            }
        }

        while (!work.isEmpty()) {
            Node node = work.poll();
            walked.add(node);

            ManifestCache.Entry source = load(node, byName, introducedBy);
            commits.put(node.name(), source.tree().commit());

            Set<String> partnerNames = new LinkedHashSet<>();
            for (Map.Entry<String, SourceLocator> p : source.manifest().partners().entrySet()) {
                String partner = p.getKey();
                partnerNames.add(partner);
                graph.addEdge(node.name(), partner);
                if (!byName.containsKey(partner) && !partners.containsKey(partner)) {
                    partners.put(partner, p.getValue());
                    introducedBy.put(partner, node.name());
                    work.add(new Node(partner, p.getValue(), Set.of()));
                }
            }
            found.put(node.name(), partnerNames);
        }

        // Declared names are checked after the walk: a later manifest may supply them.
        List<String> unresolved = new ArrayList<>();
        List<String> details    = new ArrayList<>();
        for (Node node : walked) {
            for (String dep : node.declared()) {
                if (byName.containsKey(dep) || partners.containsKey(dep)) {
                    graph.addEdge(node.name(), dep);
                } else {
                    unresolved.add(node.name());
                    details.add(node.name() + " -> " + dep);
                }
            }
        }
        if (!unresolved.isEmpty()) {
            throw new ResolveException(ResolveException.Kind.UNRESOLVED, unresolved,
                    "unresolved dependency: " + String.join(", ", details));
        }

        Optional<List<String>> cycle = graph.findCycle();
        if (cycle.isPresent()) {
            List<String> nodes = cycle.get();
            Set<String> charged = new LinkedHashSet<>();
            for (String name : nodes.subList(0, nodes.size() - 1)) {
                charged.add(attribute(name, byName, introducedBy));
            }
            throw new CycleException(nodes, List.copyOf(charged));
        }

        List<String> order = graph.topologicalOrder();
        log.debug("Resolved {} nodes ({} discovered partners), order {}",
                order.size(), partners.size(), order);
        return new Resolution(graph, order, commits, found, partners);
    }

    /** Drop any cached manifest for this source at this commit. */
    public void invalidate(SourceLocator source, String commit) {
        if (commit != null) {
            cache.invalidate(source, commit);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static boolean isBlocked(Actor actor) {
        return actor.isTerminallyFailed() && actor.getErrorClass() == ErrorClass.CONFIGURATION;
    }

    private ManifestCache.Entry load(Node node, Map<String, Actor> byName,
                                     Map<String, String> introducedBy) {
        SourceLocator source = node.source();
        List<String> subject = List.of(attribute(node.name(), byName, introducedBy));
        try {
            String commit = source.getCommit() != null && !source.getCommit().isBlank()
                    ? source.getCommit()
                    : fetcher.resolveCommit(source);

            Optional<ManifestCache.Entry> cached = cache.get(source, commit);
            if (cached.isPresent()) {
                return cached.get();
            }

            SourceTree tree = fetcher.fetch(source, commit);
            if (!tree.contains(source.getPath())) {
                throw new ResolveException(ResolveException.Kind.UNRESOLVED, subject,
                        "path '" + source.getPath() + "' not found in " + source.getRepository()
                        + " at " + commit);
            }

            ActorManifest manifest = ActorManifest.EMPTY;
            if (tree.manifest() != null) {
                try {
                    manifest = parser.parse(tree.manifest(), source);
                } catch (IllegalArgumentException e) {
                    throw new ResolveException(ResolveException.Kind.MALFORMED_MANIFEST, subject,
                            "malformed manifest for " + node.name() + " (" + source + "): "
                            + e.getMessage(), e);
                }
            }

            ManifestCache.Entry entry = new ManifestCache.Entry(tree, manifest);
            cache.put(source, commit, entry);
            return entry;
        } catch (FetchException e) {
            ResolveException.Kind kind = e.getKind() == FetchException.Kind.INVALID_LOCATOR
                    ? ResolveException.Kind.UNRESOLVED
                    : ResolveException.Kind.FETCH;
            throw new ResolveException(kind, subject,
                    "cannot fetch " + source + " for " + node.name() + ": " + e.getMessage(), e);
        }
    }

    /** The Actor a discovered partner is charged to: the nearest real Actor that introduced it. */
    private static String attribute(String name, Map<String, Actor> byName,
                                    Map<String, String> introducedBy) {
        String current = name;
        while (!byName.containsKey(current) && introducedBy.containsKey(current)) {
            current = introducedBy.get(current);
        }
        return current;
    }
}
