package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.registry.domain.ServiceDefinition;
import co.fanki.servicecatalog.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency structure over service names.
 *
 * <p>Names are interned to dense integer indexes when first seen; the
 * traversal algorithms of this package work on indexes and only translate
 * back to names at their public boundary. Edges point from the dependent
 * to the dependency and carry the declaring {@link DependencySpec}.</p>
 *
 * <p>A graph is built fresh from the current service set for every
 * analysis and is never stored. It is not thread-safe; build it from a
 * snapshot and keep it confined to the analysing thread.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    /**
     * An outgoing (or, in the reverse index, incoming) edge.
     *
     * @param node the index of the node at the other end
     * @param spec the dependency that produced the edge
     */
    record Edge(int node, DependencySpec spec) {}

    private final List<String> names = new ArrayList<>();

    private final Map<String, Integer> indexes = new HashMap<>();

    private final List<List<Edge>> outgoing = new ArrayList<>();

    /** Lazily computed; dropped whenever an edge is added. */
    private List<List<Edge>> incoming;

    private int edgeCount;

    /**
     * Builds the graph of a service set.
     *
     * <p>Every service becomes a node. A declared dependency becomes an
     * edge only when its target is part of the same set; dangling
     * dependencies are left to the dependency validator.</p>
     *
     * @param services the services, never null
     * @return the graph
     */
    public static DependencyGraph of(
            final Collection<ServiceDefinition> services) {
        Preconditions.requireNoNulls(services, "Services are required");

        final DependencyGraph graph = new DependencyGraph();
        final Set<String> present = new HashSet<>();
        for (final ServiceDefinition service : services) {
            graph.addNode(service.name());
            present.add(service.name());
        }
        for (final ServiceDefinition service : services) {
            for (final DependencySpec dependency : service.dependencies()) {
                if (present.contains(dependency.target())) {
                    graph.addEdge(service.name(), dependency.target(),
                            dependency);
                }
            }
        }
        return graph;
    }

    /**
     * Adds a node; adding an existing name is a no-op.
     *
     * @param name the service name
     */
    public void addNode(final String name) {
        intern(Preconditions.requireNonBlank(name, "Node name is required"));
    }

    /**
     * Adds an edge, creating both endpoints as nodes when missing.
     *
     * @param from the dependent service
     * @param to the dependency
     * @param spec the declaring dependency
     */
    public void addEdge(final String from, final String to,
            final DependencySpec spec) {
        Preconditions.requireNonBlank(from, "Edge source is required");
        Preconditions.requireNonBlank(to, "Edge target is required");
        Preconditions.requireNonNull(spec, "Dependency spec is required");

        final int source = intern(from);
        final int target = intern(to);
        outgoing.get(source).add(new Edge(target, spec));
        edgeCount++;
        incoming = null;
    }

    /**
     * Returns the direct dependencies of a service, in declaration order.
     *
     * @param name the service name
     * @return the dependency names, empty when the node is unknown
     */
    public List<String> neighbors(final String name) {
        final Integer index = indexes.get(name);
        if (index == null) {
            return List.of();
        }
        final List<String> result = new ArrayList<>();
        for (final Edge edge : outgoing.get(index)) {
            result.add(names.get(edge.node()));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the dependency specs on the outgoing edges of a service.
     *
     * @param name the service name
     * @return the specs, empty when the node is unknown
     */
    public List<DependencySpec> dependencySpecs(final String name) {
        final Integer index = indexes.get(name);
        if (index == null) {
            return List.of();
        }
        final List<DependencySpec> result = new ArrayList<>();
        for (final Edge edge : outgoing.get(index)) {
            result.add(edge.spec());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Checks whether the graph holds a node.
     *
     * @param name the service name
     * @return true if the node exists
     */
    public boolean contains(final String name) {
        return name != null && indexes.containsKey(name);
    }

    /** Returns the number of nodes. */
    public int nodeCount() {
        return names.size();
    }

    /** Returns the number of edges. */
    public int edgeCount() {
        return edgeCount;
    }

    /**
     * Returns all node names in insertion order.
     *
     * @return unmodifiable list of names
     */
    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    // -- index level access for the algorithms of this package ------------

    int indexOf(final String name) {
        final Integer index = indexes.get(name);
        return index == null ? -1 : index;
    }

    String nameOf(final int index) {
        return names.get(index);
    }

    List<Edge> outgoing(final int index) {
        return outgoing.get(index);
    }

    List<Edge> incoming(final int index) {
        if (incoming == null) {
            incoming = buildIncoming();
        }
        return incoming.get(index);
    }

    List<String> namesOf(final Collection<Integer> nodes) {
        final List<String> result = new ArrayList<>(nodes.size());
        for (final int node : nodes) {
            result.add(names.get(node));
        }
        return result;
    }

    private List<List<Edge>> buildIncoming() {
        final List<List<Edge>> reverse = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            reverse.add(new ArrayList<>());
        }
        for (int source = 0; source < outgoing.size(); source++) {
            for (final Edge edge : outgoing.get(source)) {
                reverse.get(edge.node()).add(new Edge(source, edge.spec()));
            }
        }
        return reverse;
    }

    private int intern(final String name) {
        final Integer existing = indexes.get(name);
        if (existing != null) {
            return existing;
        }
        final int index = names.size();
        names.add(name);
        indexes.put(name, index);
        outgoing.add(new ArrayList<>());
        incoming = null;
        return index;
    }

}
