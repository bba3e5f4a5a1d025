package com.conveyal.coverage.process;

import com.conveyal.coverage.CoverageProcessException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BandDependencyGraphTest {

    @SuppressWarnings("unchecked")
    private static Map<String, Set<String>> dependencies (Object... bandsAndUses) {
        Map<String, Set<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < bandsAndUses.length; i += 2) {
            map.put((String) bandsAndUses[i], (Set<String>) bandsAndUses[i + 1]);
        }
        return map;
    }

    @Test
    void dependenciesComeFirst () {
        BandDependencyGraph graph = new BandDependencyGraph(dependencies(
                "vegetated", Set.of("ndvi"),
                "ndvi", Set.of(),
                "water", Set.of()
        ));
        assertEquals(List.of("ndvi", "vegetated", "water"), graph.evaluationOrder());
        assertEquals(Set.of("ndvi"), graph.dependenciesOf("vegetated"));
    }

    @Test
    void independentBandsKeepDeclaredOrder () {
        BandDependencyGraph graph = new BandDependencyGraph(dependencies(
                "c", Set.of(), "a", Set.of(), "b", Set.of()));
        assertEquals(List.of("c", "a", "b"), graph.evaluationOrder());
    }

    @Test
    void requestedSubsetIncludesTransitiveDependencies () {
        BandDependencyGraph graph = new BandDependencyGraph(dependencies(
                "a", Set.of(),
                "b", Set.of("a"),
                "c", Set.of("b"),
                "d", Set.of()
        ));
        assertEquals(List.of("a", "b", "c"), graph.evaluationOrderFor(List.of("c")));
        assertEquals(List.of("d"), graph.evaluationOrderFor(List.of("d")));
        assertEquals(List.of(), graph.evaluationOrderFor(List.of("B04")));
    }

    @Test
    void selfReferenceIsCyclic () {
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> new BandDependencyGraph(dependencies("b4", Set.of("b4"))));
        assertEquals(CoverageProcessException.Type.CYCLIC_DEFINITION, e.type);
    }

    @Test
    void mutualReferenceIsCyclic () {
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> new BandDependencyGraph(dependencies(
                        "ndvi", Set.of("x"),
                        "x", Set.of("ndvi"),
                        "ok", Set.of()
                )));
        assertEquals(CoverageProcessException.Type.CYCLIC_DEFINITION, e.type);
        assertTrue(e.getMessage().contains("ndvi"));
        assertTrue(e.getMessage().contains("x"));
    }

}
