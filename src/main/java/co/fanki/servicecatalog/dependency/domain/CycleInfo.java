package co.fanki.servicecatalog.dependency.domain;

import co.fanki.servicecatalog.shared.Preconditions;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A dependency cycle found in a graph.
 *
 * @param path the services along the cycle; the first and last element
 *        are the same service
 * @param description human readable rendering of the path
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CycleInfo(List<String> path, String description) {

    /**
     * Validates the closed path.
     */
    public CycleInfo {
        Preconditions.requireNonNull(path, "Cycle path is required");
        Preconditions.require(path.size() >= 2,
                "Cycle path needs at least two elements");
        Preconditions.require(path.get(0).equals(path.get(path.size() - 1)),
                "Cycle path must start and end with the same service");
        path = List.copyOf(path);
    }

    /**
     * Creates a cycle with a description derived from the path.
     *
     * @param path the closed path
     * @return the cycle
     */
    public static CycleInfo of(final List<String> path) {
        return new CycleInfo(path, String.join(" -> ", path));
    }

    /**
     * Returns the distinct services taking part in the cycle.
     *
     * @return the participants, in path order
     */
    public Set<String> participants() {
        return new LinkedHashSet<>(path.subList(0, path.size() - 1));
    }

}
