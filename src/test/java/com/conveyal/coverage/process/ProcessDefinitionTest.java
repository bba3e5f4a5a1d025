package com.conveyal.coverage.process;

import com.conveyal.coverage.CoverageProcessException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProcessDefinitionTest {

    private static CoverageProcessException.Type failure (String id, List<String> sources, Map<String, String> functions) {
        return assertThrows(CoverageProcessException.class,
                () -> ProcessDefinition.compile(new ProcessDocument(id, sources, functions, List.of()))).type;
    }

    @Test
    void compilesAndOrdersBands () {
        Map<String, String> functions = new LinkedHashMap<>();
        functions.put("vegetated", "where(ndvi > 0.4, 1, 0)");
        functions.put("ndvi", "(B08 - B04) / (B08 + B04)");
        functions.put("red", "B04");
        ProcessDefinition definition = ProcessDefinition.compile(
                new ProcessDocument("veg", List.of("B04", "B08", "B11"), functions, List.of()));
        assertEquals(List.of("vegetated", "ndvi", "red"), definition.outputBands());
        assertEquals(List.of("ndvi", "vegetated", "red"), definition.evaluationOrder());
        assertEquals(List.of("ndvi", "vegetated"), definition.evaluationOrderFor(List.of("vegetated")));
        assertEquals(List.of("B04", "B08"), definition.sourceBandsFor(List.of("ndvi", "vegetated")));
        assertEquals(List.of("B04"), definition.sourceBandsFor(List.of("red")));
    }

    @Test
    void rejectsStructuralProblems () {
        Map<String, String> ndvi = Map.of("ndvi", "(B08 - B04) / (B08 + B04)");
        assertEquals(CoverageProcessException.Type.INVALID_DEFINITION, failure(null, List.of("B04", "B08"), ndvi));
        assertEquals(CoverageProcessException.Type.INVALID_DEFINITION, failure("../up", List.of("B04", "B08"), ndvi));
        assertEquals(CoverageProcessException.Type.INVALID_DEFINITION, failure("p", List.of("B04"), Map.of()));
        assertEquals(CoverageProcessException.Type.INVALID_DEFINITION, failure("p", List.of("B04", "B04", "B08"), ndvi));
        // Reads a band that is neither declared nor computed.
        assertEquals(CoverageProcessException.Type.INVALID_DEFINITION, failure("p", List.of("B04"), ndvi));
        // An output may not shadow a source.
        assertEquals(CoverageProcessException.Type.INVALID_DEFINITION,
                failure("p", List.of("B04"), Map.of("B04", "B04 * 2")));
    }

    @Test
    void rejectsBadScriptsAndCycles () {
        assertEquals(CoverageProcessException.Type.EXPRESSION_SYNTAX_ERROR,
                failure("p", List.of("B04"), Map.of("x", "B04 +")));
        assertEquals(CoverageProcessException.Type.CYCLIC_DEFINITION,
                failure("p", List.of("B04"), Map.of("b4", "b4 + 1")));
        assertEquals(CoverageProcessException.Type.CYCLIC_DEFINITION,
                failure("p", List.of("B04"), Map.of("ndvi", "x + B04", "x", "ndvi * 2")));
    }

}
