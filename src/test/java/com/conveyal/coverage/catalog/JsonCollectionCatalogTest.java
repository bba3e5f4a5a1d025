package com.conveyal.coverage.catalog;

import com.conveyal.coverage.CoverageProcessException;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonCollectionCatalogTest {

    private static InputStream json (String text) {
        return new ByteArrayInputStream(text.replace('\'', '"').getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void bundledCatalogLoads () {
        JsonCollectionCatalog catalog = new JsonCollectionCatalog(new File("collections.json"));
        Collection sentinel = catalog.get("sentinel-2-l2a");
        assertEquals("EPSG:4326", sentinel.crs);
        assertTrue(sentinel.hasBand("B04"));
        assertTrue(sentinel.hasBand("B08"));
        assertEquals(Instant.parse("2015-06-27T00:00:00Z"), sentinel.temporalBegin);
        assertNull(sentinel.temporalEnd);
    }

    @Test
    void readsBareArrays () throws IOException {
        JsonCollectionCatalog catalog = new JsonCollectionCatalog(json(
                "[{'id': 'a', 'bbox': [0, 0, 10, 10], 'bands': ['x']}, {'id': 'b', 'bbox': [0, 0, 1, 1]}]"));
        assertEquals(2, catalog.list().size());
        assertEquals("a", catalog.list().get(0).id);
        assertEquals("a", catalog.get("a").title);
        assertEquals(new Envelope(0, 10, 0, 10), catalog.get("a").bbox);
    }

    @Test
    void unknownCollectionIsUnavailable () throws IOException {
        JsonCollectionCatalog catalog = new JsonCollectionCatalog(json("{'collections': []}"));
        CoverageProcessException e = assertThrows(CoverageProcessException.class, () -> catalog.get("s2"));
        assertEquals(CoverageProcessException.Type.DATA_UNAVAILABLE, e.type);
    }

    @Test
    void rejectsMalformedEntries () {
        assertThrows(IllegalArgumentException.class,
                () -> new JsonCollectionCatalog(json("{'collections': [{'id': 'a', 'bbox': [0, 0, 1]}]}")));
        assertThrows(IllegalArgumentException.class,
                () -> new JsonCollectionCatalog(json("{'collections': [{'bbox': [0, 0, 1, 1]}]}")));
        assertThrows(IllegalArgumentException.class, () -> new JsonCollectionCatalog(json(
                "[{'id': 'a', 'bbox': [0, 0, 1, 1]}, {'id': 'a', 'bbox': [0, 0, 1, 1]}]")));
        assertThrows(IllegalArgumentException.class, () -> new JsonCollectionCatalog(json(
                "[{'id': 'a', 'bbox': [0, 0, 1, 1], 'temporal': {'begin': '2020-01-01', 'end': '2019-01-01'}}]")));
    }

    @Test
    void spatialAndTemporalOverlap () {
        Collection collection = new Collection("c", null, new Envelope(10, 20, 40, 50), "EPSG:4326",
                Instant.parse("2020-01-01T00:00:00Z"), Instant.parse("2020-12-31T00:00:00Z"), List.of("B04"));
        assertTrue(collection.intersects(new Envelope(15, 25, 45, 55), "EPSG:4326"));
        assertFalse(collection.intersects(new Envelope(20, 25, 45, 55), "EPSG:4326"));
        assertTrue(collection.overlapsTime(Instant.parse("2020-06-01T00:00:00Z"), null));
        assertFalse(collection.overlapsTime(Instant.parse("2021-06-01T00:00:00Z"), null));
        assertFalse(collection.overlapsTime(null, Instant.parse("2019-06-01T00:00:00Z")));
    }

}
