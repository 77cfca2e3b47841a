package co.fanki.servicecatalog.dependency.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ImpactAnalyzer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ImpactAnalyzerTest {

    /** a -> b (required), a -> c (optional), b -> d (required). */
    private static DependencyGraph sampleGraph() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addEdge("a", "b", DependencySpec.required("b"));
        graph.addEdge("a", "c", DependencySpec.optional("c"));
        graph.addEdge("b", "d", DependencySpec.required("d"));
        return graph;
    }

    @Test
    void whenFindingImpact_givenLeaf_shouldReturnAllTransitiveDependents() {
        assertEquals(List.of("b", "a"),
                ImpactAnalyzer.findImpact(sampleGraph(), "d"));
    }

    @Test
    void whenFindingImpact_givenRoot_shouldReturnEmpty() {
        assertTrue(ImpactAnalyzer.findImpact(sampleGraph(), "a").isEmpty());
    }

    @Test
    void whenFindingImpact_givenUnknownService_shouldReturnEmpty() {
        assertTrue(ImpactAnalyzer.findImpact(sampleGraph(), "ghost")
                .isEmpty());
        assertTrue(ImpactAnalyzer.criticalImpact(sampleGraph(), "ghost")
                .isEmpty());
    }

    @Test
    void whenFindingImpact_givenCycle_shouldTerminateWithoutOrigin() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addEdge("x", "y", DependencySpec.required("y"));
        graph.addEdge("y", "z", DependencySpec.required("z"));
        graph.addEdge("z", "x", DependencySpec.required("x"));

        assertEquals(Set.of("x", "y"),
                Set.copyOf(ImpactAnalyzer.findImpact(graph, "z")));
    }

    @Test
    void whenDetailing_givenLeaf_shouldDescribeShortestPaths() {
        final List<ImpactInfo> impact =
                ImpactAnalyzer.detailedImpact(sampleGraph(), "d");

        assertEquals(2, impact.size());
        final ImpactInfo b = impact.get(0);
        assertEquals("b", b.service());
        assertEquals(List.of("d", "b"), b.path());
        assertTrue(b.required());
        assertEquals(1, b.distance());

        final ImpactInfo a = impact.get(1);
        assertEquals(List.of("d", "b", "a"), a.path());
        assertEquals("d", a.origin());
        assertTrue(a.transitivelyRequired());
        assertEquals("Required dependency chain from 'd' to 'a'",
                a.description());
    }

    @Test
    void whenDetailing_givenOptionalEdge_shouldMarkChainOptional() {
        final List<ImpactInfo> impact =
                ImpactAnalyzer.detailedImpact(sampleGraph(), "c");

        assertEquals(1, impact.size());
        assertFalse(impact.get(0).required());
        assertFalse(impact.get(0).transitivelyRequired());
        assertEquals("Optional dependency chain from 'c' to 'a'",
                impact.get(0).description());
    }

    @Test
    void whenFindingCriticalImpact_givenRequiredChain_shouldIncludeWholeChain() {
        assertEquals(List.of("b", "a"),
                ImpactAnalyzer.criticalImpact(sampleGraph(), "d"));
    }

    @Test
    void whenFindingCriticalImpact_givenOptionalDependent_shouldExcludeIt() {
        assertTrue(ImpactAnalyzer.criticalImpact(sampleGraph(), "c")
                .isEmpty());
    }

    @Test
    void whenFindingCriticalImpact_givenOptionalHopMidChain_shouldStopThere() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addEdge("top", "mid", DependencySpec.required("mid"));
        graph.addEdge("mid", "base", DependencySpec.optional("base"));

        assertTrue(ImpactAnalyzer.criticalImpact(graph, "base").isEmpty());
        assertEquals(List.of("mid", "top"),
                ImpactAnalyzer.findImpact(graph, "base"));
    }

    @Test
    void whenFindingCriticalImpact_givenRequiredDetourAroundOptionalEdge_shouldIncludeService() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addEdge("top", "base", DependencySpec.optional("base"));
        graph.addEdge("top", "mid", DependencySpec.required("mid"));
        graph.addEdge("mid", "base", DependencySpec.required("base"));

        assertEquals(Set.of("top", "mid"),
                Set.copyOf(ImpactAnalyzer.criticalImpact(graph, "base")));
        assertFalse(ImpactAnalyzer.detailedImpact(graph, "base").get(0)
                .transitivelyRequired());
    }

}
