package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Answers "who is affected" questions over a dependency graph.
 *
 * <p>All traversals walk incoming edges breadth-first from the changed
 * service, so direct dependents are found before deeper ones and every
 * reported path is a shortest one. A visited set keeps them finite on
 * cyclic graphs. An unknown target has no impact.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ImpactAnalyzer {

    private ImpactAnalyzer() {
    }

    /**
     * Returns every service that transitively depends on the target.
     *
     * @param graph the graph
     * @param target the changed service
     * @return the affected services, nearest first
     */
    public static List<String> findImpact(final DependencyGraph graph,
            final String target) {
        final List<String> result = new ArrayList<>();
        for (final ImpactInfo impact : detailedImpact(graph, target)) {
            result.add(impact.service());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns every service that transitively depends on the target,
     * with the path through which it was first reached.
     *
     * @param graph the graph
     * @param target the changed service
     * @return one entry per affected service, nearest first
     */
    public static List<ImpactInfo> detailedImpact(final DependencyGraph graph,
            final String target) {
        Preconditions.requireNonNull(graph, "Graph is required");
        final int origin = graph.indexOf(target);
        if (origin < 0) {
            return List.of();
        }

        final int[] parent = new int[graph.nodeCount()];
        final boolean[] chainRequired = new boolean[graph.nodeCount()];
        final boolean[] visited = new boolean[graph.nodeCount()];
        visited[origin] = true;
        parent[origin] = -1;
        chainRequired[origin] = true;

        final List<ImpactInfo> result = new ArrayList<>();
        final Deque<Integer> queue = new ArrayDeque<>();
        queue.add(origin);

        while (!queue.isEmpty()) {
            final int node = queue.poll();
            for (final DependencyGraph.Edge edge : graph.incoming(node)) {
                final int dependent = edge.node();
                if (visited[dependent]) {
                    continue;
                }
                visited[dependent] = true;
                parent[dependent] = node;
                final boolean required = edge.spec().required();
                chainRequired[dependent] = chainRequired[node] && required;
                result.add(describe(graph, dependent, parent, required,
                        chainRequired[dependent]));
                queue.add(dependent);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the services that cannot run without the target.
     *
     * <p>A service is critically impacted when it reaches the target
     * through required dependencies only. A single optional hop anywhere
     * on every path excludes it.</p>
     *
     * @param graph the graph
     * @param target the changed service
     * @return the critically affected services, nearest first
     */
    public static List<String> criticalImpact(final DependencyGraph graph,
            final String target) {
        Preconditions.requireNonNull(graph, "Graph is required");
        final int origin = graph.indexOf(target);
        if (origin < 0) {
            return List.of();
        }

        final boolean[] visited = new boolean[graph.nodeCount()];
        visited[origin] = true;
        final List<Integer> found = new ArrayList<>();
        final Deque<Integer> queue = new ArrayDeque<>();
        queue.add(origin);

        while (!queue.isEmpty()) {
            final int node = queue.poll();
            for (final DependencyGraph.Edge edge : graph.incoming(node)) {
                if (!edge.spec().required() || visited[edge.node()]) {
                    continue;
                }
                visited[edge.node()] = true;
                found.add(edge.node());
                queue.add(edge.node());
            }
        }
        return Collections.unmodifiableList(graph.namesOf(found));
    }

    private static ImpactInfo describe(final DependencyGraph graph,
            final int service, final int[] parent, final boolean required,
            final boolean transitivelyRequired) {
        final List<String> path = new ArrayList<>();
        for (int node = service; node != -1; node = parent[node]) {
            path.add(graph.nameOf(node));
        }
        Collections.reverse(path);

        final String kind = transitivelyRequired ? "Required" : "Optional";
        final String description = kind + " dependency chain from '"
                + path.get(0) + "' to '" + graph.nameOf(service) + "'";
        return new ImpactInfo(graph.nameOf(service), required,
                transitivelyRequired, path, description);
    }

}
