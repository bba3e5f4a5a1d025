package com.conveyal.coverage.catalog;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.fetch.TemporalSubset;
import com.conveyal.coverage.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A collection catalog loaded once from a JSON document of the form
 * {"collections": [{"id", "title", "bbox": [minX, minY, maxX, maxY], "crs", "temporal": {"begin", "end"}, "bands"}]}.
 * A bare array of collection objects is accepted too.
 */
public class JsonCollectionCatalog implements CollectionCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(JsonCollectionCatalog.class);

    public interface Config {
        String collectionsFile ();
    }

    private final Map<String, Collection> collections;

    public JsonCollectionCatalog (Config config) {
        this(new File(config.collectionsFile()));
    }

    public JsonCollectionCatalog (File file) {
        try {
            this.collections = parse(JsonUtil.objectMapper.readTree(file));
        } catch (IOException e) {
            throw new RuntimeException("Could not load collection catalog from " + file, e);
        }
        LOG.info("Loaded {} collections from {}.", collections.size(), file);
    }

    public JsonCollectionCatalog (InputStream inputStream) throws IOException {
        this.collections = parse(JsonUtil.objectMapper.readTree(inputStream));
    }

    private static Map<String, Collection> parse (JsonNode root) {
        JsonNode array = root.isArray() ? root : root.path("collections");
        checkArgument(array.isArray(), "Collection catalog must contain an array of collections.");
        Map<String, Collection> collections = new LinkedHashMap<>();
        for (JsonNode node : array) {
            Collection collection = parseCollection(node);
            checkArgument(!collections.containsKey(collection.id), "Duplicate collection id %s.", collection.id);
            collections.put(collection.id, collection);
        }
        return collections;
    }

    private static Collection parseCollection (JsonNode node) {
        String id = node.path("id").asText(null);
        checkArgument(id != null && !id.isEmpty(), "Every collection needs an id.");
        JsonNode bbox = node.path("bbox");
        checkArgument(bbox.isArray() && bbox.size() == 4, "Collection %s needs a four element bbox.", id);
        Envelope envelope = new Envelope(
                bbox.get(0).asDouble(), bbox.get(2).asDouble(), bbox.get(1).asDouble(), bbox.get(3).asDouble());
        List<String> bands = new ArrayList<>();
        for (JsonNode band : node.path("bands")) {
            bands.add(band.asText());
        }
        JsonNode temporal = node.path("temporal");
        return new Collection(
                id,
                node.path("title").asText(null),
                envelope,
                node.path("crs").asText("EPSG:4326"),
                TemporalSubset.parseInstant(temporal.path("begin").asText(null)),
                TemporalSubset.parseInstant(temporal.path("end").asText(null)),
                bands
        );
    }

    @Override
    public Collection get (String collectionId) {
        Collection collection = collections.get(collectionId);
        if (collection == null) {
            throw CoverageProcessException.dataUnavailable("Unknown collection: " + collectionId);
        }
        return collection;
    }

    @Override
    public List<Collection> list () {
        return new ArrayList<>(collections.values());
    }

}
