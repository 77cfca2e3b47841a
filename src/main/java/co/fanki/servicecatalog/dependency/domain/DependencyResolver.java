package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.registry.domain.ServiceNotFoundException;
import co.fanki.servicecatalog.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the order in which services must be brought up.
 *
 * <p>Resolution first extracts the transitive closure of the requested
 * roots, then sorts that subgraph with Kahn's in-degree algorithm. Edges
 * point from dependent to dependency, so Kahn's natural output lists
 * dependents first; it is reversed before being returned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyResolver {

    private DependencyResolver() {
    }

    /**
     * Returns the services reachable from the given roots, roots included.
     *
     * @param graph the graph
     * @param roots the root service names
     * @return the closure in discovery order
     * @throws ServiceNotFoundException if a root is not part of the graph
     */
    public static Set<String> closure(final DependencyGraph graph,
            final List<String> roots) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return new LinkedHashSet<>(graph.namesOf(
                closureOf(graph, indexesOf(graph, roots))));
    }

    /**
     * Returns a start order for the given roots and everything they
     * transitively depend on. Every dependency precedes its dependents.
     *
     * @param graph the graph
     * @param roots the root service names, may be empty
     * @return the ordered service names
     * @throws ServiceNotFoundException if a root is not part of the graph
     * @throws CycleException if the closure of the roots holds a cycle
     */
    public static List<String> resolveOrder(final DependencyGraph graph,
            final List<String> roots) {
        Preconditions.requireNonNull(graph, "Graph is required");
        if (Preconditions.requireNonNull(roots, "Roots are required")
                .isEmpty()) {
            return List.of();
        }

        final Set<Integer> subgraph = closureOf(graph,
                indexesOf(graph, roots));

        final Optional<CycleInfo> cycle = CycleDetector.detect(graph,
                subgraph);
        if (cycle.isPresent()) {
            throw new CycleException(cycle.get());
        }

        final List<Integer> order = kahn(graph, subgraph);
        if (order.size() != subgraph.size()) {
            throw new InternalInvariantException("Topological sort produced "
                    + order.size() + " services for a subgraph of "
                    + subgraph.size());
        }
        Collections.reverse(order);
        return Collections.unmodifiableList(graph.namesOf(order));
    }

    private static List<Integer> indexesOf(final DependencyGraph graph,
            final List<String> roots) {
        Preconditions.requireNonNull(roots, "Roots are required");
        final List<Integer> result = new ArrayList<>(roots.size());
        for (final String root : roots) {
            final int index = graph.indexOf(root);
            if (index < 0) {
                throw new ServiceNotFoundException(root);
            }
            result.add(index);
        }
        return result;
    }

    private static Set<Integer> closureOf(final DependencyGraph graph,
            final List<Integer> roots) {
        final Set<Integer> visited = new LinkedHashSet<>();
        final Deque<Integer> stack = new ArrayDeque<>();
        for (final int root : roots) {
            if (visited.add(root)) {
                stack.push(root);
            }
            while (!stack.isEmpty()) {
                final int node = stack.pop();
                for (final DependencyGraph.Edge edge : graph.outgoing(node)) {
                    if (visited.add(edge.node())) {
                        stack.push(edge.node());
                    }
                }
            }
        }
        return visited;
    }

    private static List<Integer> kahn(final DependencyGraph graph,
            final Set<Integer> subgraph) {
        final int[] inDegree = new int[graph.nodeCount()];
        for (final int node : subgraph) {
            for (final DependencyGraph.Edge edge : graph.outgoing(node)) {
                inDegree[edge.node()]++;
            }
        }

        final Deque<Integer> queue = new ArrayDeque<>();
        for (final int node : subgraph) {
            if (inDegree[node] == 0) {
                queue.add(node);
            }
        }

        final List<Integer> order = new ArrayList<>(subgraph.size());
        while (!queue.isEmpty()) {
            final int node = queue.poll();
            order.add(node);
            for (final DependencyGraph.Edge edge : graph.outgoing(node)) {
                if (--inDegree[edge.node()] == 0) {
                    queue.add(edge.node());
                }
            }
        }
        return order;
    }

}
