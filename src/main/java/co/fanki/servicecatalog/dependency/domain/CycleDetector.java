package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.shared.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Finds dependency cycles with a three-color depth-first search.
 *
 * <p>White nodes are unvisited, gray nodes sit on the current path and
 * black nodes are finished. Reaching a gray node closes a cycle. The walk
 * keeps its own stack of frames (node plus next-edge cursor) so deep
 * graphs cannot exhaust the call stack.</p>
 *
 * <p>Roots are tried in node insertion order and edges in declaration
 * order, so identical input always yields the same cycle.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CycleDetector {

    private static final byte WHITE = 0;
    private static final byte GRAY = 1;
    private static final byte BLACK = 2;

    private CycleDetector() {
    }

    /**
     * Returns the first cycle of the whole graph.
     *
     * @param graph the graph, never null
     * @return the cycle, or empty when the graph is acyclic
     */
    public static Optional<CycleInfo> detect(final DependencyGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        final List<Integer> roots = new ArrayList<>(graph.nodeCount());
        for (int i = 0; i < graph.nodeCount(); i++) {
            roots.add(i);
        }
        return detect(graph, roots);
    }

    /**
     * Returns the first cycle reachable from the given node indexes.
     *
     * @param graph the graph
     * @param roots the node indexes to start from
     * @return the cycle, or empty when none is reachable
     */
    static Optional<CycleInfo> detect(final DependencyGraph graph,
            final Collection<Integer> roots) {
        final byte[] color = new byte[graph.nodeCount()];
        // position of each gray node on the current path
        final int[] pathPosition = new int[graph.nodeCount()];
        Arrays.fill(pathPosition, -1);

        final int[] frameNode = new int[graph.nodeCount()];
        final int[] frameCursor = new int[graph.nodeCount()];

        for (final int root : roots) {
            if (color[root] != WHITE) {
                continue;
            }
            int depth = 0;
            frameNode[0] = root;
            frameCursor[0] = 0;
            color[root] = GRAY;
            pathPosition[root] = 0;

            while (depth >= 0) {
                final int node = frameNode[depth];
                final List<DependencyGraph.Edge> edges = graph.outgoing(node);

                if (frameCursor[depth] == edges.size()) {
                    color[node] = BLACK;
                    pathPosition[node] = -1;
                    depth--;
                    continue;
                }

                final int next = edges.get(frameCursor[depth]++).node();
                if (color[next] == GRAY) {
                    return Optional.of(closePath(graph, frameNode,
                            pathPosition[next], depth, next));
                }
                if (color[next] == WHITE) {
                    depth++;
                    frameNode[depth] = next;
                    frameCursor[depth] = 0;
                    color[next] = GRAY;
                    pathPosition[next] = depth;
                }
            }
        }
        return Optional.empty();
    }

    private static CycleInfo closePath(final DependencyGraph graph,
            final int[] frameNode, final int from, final int to,
            final int revisited) {
        final List<String> path = new ArrayList<>(to - from + 2);
        for (int i = from; i <= to; i++) {
            path.add(graph.nameOf(frameNode[i]));
        }
        path.add(graph.nameOf(revisited));
        return CycleInfo.of(path);
    }

}
