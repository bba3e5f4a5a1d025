package com.conveyal.coverage.process;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProcessDocumentTest {

    private static JsonNode json (String text) throws Exception {
        return JsonUtil.objectMapper.readTree(text.replace('\'', '"'));
    }

    @Test
    void readsNestedLayout () throws Exception {
        ProcessDocument document = ProcessDocument.fromJson(json("{'id': 'ndvi', 'inputs': {"
                + "'data': [{'collection': 'http://localhost:8080/ogcapi/collections/sentinel-2-l2a/'}],"
                + "'sourceBands': [{'value': ['B04', 'B08']}],"
                + "'bandsPythonFunctions': {'value': {'ndvi': '(B08 - B04) / (B08 + B04)'}}}}"));
        assertEquals("ndvi", document.id);
        assertEquals(List.of("sentinel-2-l2a"), document.collections);
        assertEquals(List.of("B04", "B08"), document.sourceBands);
        assertEquals(Map.of("ndvi", "(B08 - B04) / (B08 + B04)"), document.bandFunctions);
    }

    @Test
    void readsFlatLayout () throws Exception {
        ProcessDocument document = ProcessDocument.fromJson(json("{'id': 'p', 'sourceBands': ['B04'],"
                + "'bandFunctions': {'b': 'B04 * 2', 'a': 'b + 1'}, 'collections': ['s2']}"));
        assertEquals(List.of("B04"), document.sourceBands);
        assertEquals(List.of("b", "a"), List.copyOf(document.bandFunctions.keySet()));
        assertEquals(List.of("s2"), document.collections);
    }

    @Test
    void missingPartsAreEmpty () throws Exception {
        ProcessDocument document = ProcessDocument.fromJson(json("{'sourceBands': []}"));
        assertNull(document.id);
        assertEquals(List.of(), document.collections);
        assertEquals(Map.of(), document.bandFunctions);
    }

    @Test
    void writtenFormReadsBackTheSame () throws Exception {
        ProcessDocument original = new ProcessDocument(
                "p", List.of("B04", "B08"), Map.of("ndvi", "(B08 - B04) / (B08 + B04)"), List.of("s2"));
        ProcessDocument reread = ProcessDocument.fromJson(original.toJson());
        assertEquals(original.id, reread.id);
        assertEquals(original.sourceBands, reread.sourceBands);
        assertEquals(original.bandFunctions, reread.bandFunctions);
        assertEquals(original.collections, reread.collections);
    }

    @Test
    void exampleFileIsReadable () throws Exception {
        try (InputStream in = Files.newInputStream(Path.of("examples", "ndvi-process.json"))) {
            ProcessDefinition definition = ProcessDefinition.compile(ProcessDocument.fromJson(in));
            assertEquals(List.of("ndvi", "vegetated"), definition.evaluationOrder());
        }
    }

    @Test
    void rejectsMalformedShapes () throws Exception {
        assertEquals(CoverageProcessException.Type.INVALID_DEFINITION, assertThrows(CoverageProcessException.class,
                () -> ProcessDocument.fromJson(json("['not', 'an', 'object']"))).type);
        assertEquals(CoverageProcessException.Type.INVALID_DEFINITION, assertThrows(CoverageProcessException.class,
                () -> ProcessDocument.fromJson(json("{'id': 'p', 'bandFunctions': {'a': 3}}"))).type);
        assertEquals(CoverageProcessException.Type.INVALID_DEFINITION, assertThrows(CoverageProcessException.class,
                () -> ProcessDocument.fromJson(json("{'id': 'p', 'bandFunctions': ['a']}"))).type);
    }

    @Test
    void collectionUrlsReduceToIds () {
        assertEquals("s2", ProcessDocument.lastPathSegment("https://example.com/collections/s2//"));
        assertEquals("s2", ProcessDocument.lastPathSegment("s2"));
    }

}
