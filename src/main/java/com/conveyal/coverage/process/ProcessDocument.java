package com.conveyal.coverage.process;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The JSON form of a process registration, as submitted by process authors and as persisted. Two layouts are read.
 * The flat layout {"id", "sourceBands": [...], "bandFunctions": {...}, "collections": [...]} is also the one written.
 * The nested layout {"id", "inputs": {"data": [{"collection": url}], "sourceBands": [{"value": [...]}],
 * "bandsPythonFunctions": {"value": {...}}}} follows the OGC API Processes style of earlier clients.
 * Nothing is validated here beyond the JSON shape; see ProcessDefinition.
 */
public class ProcessDocument {

    public final String id;
    public final List<String> sourceBands;
    public final Map<String, String> bandFunctions;
    public final List<String> collections;

    public ProcessDocument (String id, List<String> sourceBands, Map<String, String> bandFunctions,
                            List<String> collections) {
        this.id = id;
        this.sourceBands = sourceBands;
        this.bandFunctions = bandFunctions;
        this.collections = collections;
    }

    public static ProcessDocument fromJson (InputStream inputStream) throws IOException {
        return fromJson(JsonUtil.objectMapper.readTree(inputStream));
    }

    public static ProcessDocument fromJson (JsonNode root) {
        if (root == null || !root.isObject()) {
            throw CoverageProcessException.invalidDefinition("A process definition must be a JSON object.");
        }
        JsonNode inputs = root.has("inputs") ? root.get("inputs") : root;
        List<String> collections = new ArrayList<>();
        for (JsonNode item : unwrap(inputs.has("data") ? inputs.get("data") : inputs.path("collections"))) {
            String collection = item.isObject() ? item.path("collection").asText("") : item.asText("");
            if (!collection.isEmpty()) collections.add(lastPathSegment(collection));
        }
        List<String> sourceBands = new ArrayList<>();
        for (JsonNode band : flatten(unwrap(inputs.path("sourceBands")))) {
            sourceBands.add(band.asText());
        }
        JsonNode functions = unwrap(inputs.has("bandsPythonFunctions")
                ? inputs.get("bandsPythonFunctions") : inputs.path("bandFunctions"));
        Map<String, String> bandFunctions = new LinkedHashMap<>();
        if (functions.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = functions.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isTextual()) {
                    throw CoverageProcessException.invalidDefinition(
                            "The function of band " + field.getKey() + " must be a string.");
                }
                bandFunctions.put(field.getKey(), field.getValue().asText());
            }
        } else if (!functions.isMissingNode() && !functions.isNull()) {
            throw CoverageProcessException.invalidDefinition("Band functions must be a JSON object.");
        }
        return new ProcessDocument(root.path("id").asText(null), sourceBands, bandFunctions, collections);
    }

    /** Strip an OGC API Processes {"value": ...} wrapper if present. */
    private static JsonNode unwrap (JsonNode node) {
        return node.isObject() && node.has("value") ? node.get("value") : node;
    }

    /** Source bands may be a list of names, or a list of {"value": [names]} objects. */
    private static List<JsonNode> flatten (JsonNode node) {
        List<JsonNode> result = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                JsonNode unwrapped = unwrap(item);
                if (unwrapped.isArray()) unwrapped.forEach(result::add);
                else result.add(unwrapped);
            }
        } else if (node.isTextual()) {
            result.add(node);
        }
        return result;
    }

    /** Collections may be referred to by full URL, of which the last path segment is the collection id. */
    static String lastPathSegment (String reference) {
        String trimmed = reference.replaceAll("/+$", "");
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    public ObjectNode toJson () {
        ObjectNode root = JsonUtil.objectMapper.createObjectNode();
        root.put("id", id);
        ArrayNode sources = root.putArray("sourceBands");
        sourceBands.forEach(sources::add);
        ObjectNode functions = root.putObject("bandFunctions");
        bandFunctions.forEach(functions::put);
        ArrayNode collectionArray = root.putArray("collections");
        collections.forEach(collectionArray::add);
        return root;
    }

}
