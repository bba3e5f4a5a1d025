package com.conveyal.coverage.raster;

import com.conveyal.coverage.CoverageProcessException;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetTest {

    private static final GridExtents GRID = new GridExtents("EPSG:4326", new Envelope(0, 2, 0, 2), 2, 2);

    @Test
    void keepsInsertionOrder () {
        Dataset dataset = new Dataset()
                .add(new RasterArray("b", GRID))
                .add(new RasterArray("a", GRID));
        assertEquals(List.of("b", "a"), dataset.labels());
        assertEquals(GRID, dataset.extents());
    }

    @Test
    void rejectsDifferentShapes () {
        GridExtents wider = new GridExtents("EPSG:4326", new Envelope(0, 3, 0, 2), 3, 2);
        Dataset dataset = new Dataset().add(new RasterArray("a", GRID));
        CoverageProcessException e = assertThrows(CoverageProcessException.class,
                () -> dataset.add(new RasterArray("b", wider)));
        assertEquals(CoverageProcessException.Type.GRID_MISMATCH, e.type);
        assertEquals(1, dataset.size());
    }

    @Test
    void rejectsDuplicateLabels () {
        Dataset dataset = new Dataset().add(new RasterArray("a", GRID));
        assertThrows(IllegalArgumentException.class, () -> dataset.add(new RasterArray("a", GRID)));
    }

    @Test
    void sameContentComparesSamples () {
        double[][] rows = {{1, 2}, {3, Double.NaN}};
        Dataset first = new Dataset().add(RasterArray.fromRows("a", GRID, rows));
        Dataset second = new Dataset().add(RasterArray.fromRows("a", GRID, rows));
        assertTrue(first.sameContent(second));
        Dataset third = new Dataset().add(RasterArray.fromRows("a", GRID, new double[][] {{1, 2}, {3, 4}}));
        assertTrue(!first.sameContent(third));
    }

}
