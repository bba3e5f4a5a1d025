package com.conveyal.coverage.raster;

import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import org.locationtech.jts.geom.Envelope;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.conveyal.coverage.raster.GeoTiffWriter.KEY_GEOGRAPHIC_TYPE;
import static com.conveyal.coverage.raster.GeoTiffWriter.KEY_PROJECTED_CS_TYPE;
import static com.conveyal.coverage.raster.GeoTiffWriter.KEY_RASTER_TYPE;
import static com.conveyal.coverage.raster.GeoTiffWriter.RASTER_PIXEL_IS_POINT;
import static com.conveyal.coverage.raster.GeoTiffWriter.TAG_GDAL_METADATA;
import static com.conveyal.coverage.raster.GeoTiffWriter.TAG_GDAL_NODATA;
import static com.conveyal.coverage.raster.GeoTiffWriter.TAG_GEO_KEY_DIRECTORY;
import static com.conveyal.coverage.raster.GeoTiffWriter.TAG_MODEL_PIXEL_SCALE;
import static com.conveyal.coverage.raster.GeoTiffWriter.TAG_MODEL_TIEPOINT;

/**
 * Reads the first image of a north-up GeoTIFF into a Dataset. Only georeferencing by pixel scale and tie point with an
 * EPSG coded CRS is understood, which covers what OGC API coverage servers and this project's own writer produce.
 * Malformed or unsupported files cause an IllegalArgumentException; callers decide which error kind that becomes.
 */
public abstract class GeoTiffReader {

    private static final Pattern GDAL_DESCRIPTION = Pattern.compile(
            "<Item name=\"DESCRIPTION\" sample=\"(\\d+)\"[^>]*>([^<]*)</Item>");

    public static Dataset read (byte[] bytes) throws IOException {
        return read(TiffReader.readTiff(bytes));
    }

    public static Dataset read (File file) throws IOException {
        return read(TiffReader.readTiff(file));
    }

    private static Dataset read (TIFFImage image) {
        FileDirectory directory = image.getFileDirectory();
        if (directory == null) {
            throw new IllegalArgumentException("TIFF contains no image.");
        }
        int width = directory.getImageWidth().intValue();
        int height = directory.getImageHeight().intValue();
        List<Double> scale = numbers(entryValues(directory, TAG_MODEL_PIXEL_SCALE));
        List<Double> tiepoint = numbers(entryValues(directory, TAG_MODEL_TIEPOINT));
        List<Double> geoKeys = numbers(entryValues(directory, TAG_GEO_KEY_DIRECTORY));
        if (scale.size() < 2 || tiepoint.size() < 6 || geoKeys.size() < 4) {
            throw new IllegalArgumentException("TIFF is not georeferenced by pixel scale and tie point.");
        }
        double pixelWidth = scale.get(0);
        double pixelHeight = scale.get(1);
        double west = tiepoint.get(3) - tiepoint.get(0) * pixelWidth;
        double north = tiepoint.get(4) + tiepoint.get(1) * pixelHeight;
        if (geoKey(geoKeys, KEY_RASTER_TYPE) == RASTER_PIXEL_IS_POINT) {
            // Tie point refers to a pixel center rather than its corner.
            west -= pixelWidth / 2;
            north += pixelHeight / 2;
        }
        int epsg = geoKey(geoKeys, KEY_PROJECTED_CS_TYPE);
        if (epsg <= 0) epsg = geoKey(geoKeys, KEY_GEOGRAPHIC_TYPE);
        if (epsg <= 0) {
            throw new IllegalArgumentException("GeoTIFF does not declare an EPSG coded CRS.");
        }
        GridExtents extents = new GridExtents("EPSG:" + epsg,
                new Envelope(west, west + width * pixelWidth, north - height * pixelHeight, north), width, height);

        Rasters rasters = directory.readRasters();
        int nBands = rasters.getSamplesPerPixel();
        List<String> labels = bandLabels(directory, nBands);
        double noData = noDataValue(directory);
        Dataset dataset = new Dataset();
        for (int band = 0; band < nBands; band++) {
            double[] values = new double[width * height];
            for (int y = 0, i = 0; y < height; y++) {
                for (int x = 0; x < width; x++, i++) {
                    double value = rasters.getPixelSample(band, x, y).doubleValue();
                    values[i] = (value == noData) ? Double.NaN : value;
                }
            }
            dataset.add(new RasterArray(labels.get(band), extents, values));
        }
        return dataset;
    }

    /** Value of a short GeoKey stored directly in the key directory, or -1 if absent. */
    private static int geoKey (List<Double> directory, int key) {
        int nKeys = directory.get(3).intValue();
        for (int k = 0; k < nKeys && 4 + k * 4 + 3 < directory.size(); k++) {
            int offset = 4 + k * 4;
            if (directory.get(offset).intValue() == key && directory.get(offset + 1).intValue() == 0) {
                return directory.get(offset + 3).intValue();
            }
        }
        return -1;
    }

    /**
     * Band labels from GDAL descriptions, else from a comma separated image description with one entry per band,
     * else band1, band2 and so on.
     */
    private static List<String> bandLabels (FileDirectory directory, int nBands) {
        List<String> labels = new ArrayList<>(Collections.nCopies(nBands, null));
        String metadata = string(entryValues(directory, TAG_GDAL_METADATA));
        if (metadata != null) {
            Matcher matcher = GDAL_DESCRIPTION.matcher(metadata);
            while (matcher.find()) {
                int sample = Integer.parseInt(matcher.group(1));
                if (sample < nBands) labels.set(sample, unescapeXml(matcher.group(2)));
            }
        }
        String description = string(entryValues(directory, FieldTagType.ImageDescription.getId()));
        String[] described = description == null ? new String[0] : description.split(",");
        for (int band = 0; band < nBands; band++) {
            if (labels.get(band) == null || labels.get(band).isEmpty()) {
                labels.set(band, described.length == nBands ? described[band].trim() : "band" + (band + 1));
            }
        }
        return labels;
    }

    private static double noDataValue (FileDirectory directory) {
        String noData = string(entryValues(directory, TAG_GDAL_NODATA));
        if (noData == null) return Double.NaN;
        try {
            return Double.parseDouble(noData.trim());
        } catch (NumberFormatException e) {
            // "nan" and other spellings all mean NaN, which needs no conversion.
            return Double.NaN;
        }
    }

    private static Object entryValues (FileDirectory directory, int tag) {
        for (FileDirectoryEntry entry : directory.getEntries()) {
            if (entry.getFieldTag() != null && entry.getFieldTag().getId() == tag) {
                return entry.getValues();
            }
        }
        return null;
    }

    private static List<Double> numbers (Object values) {
        List<Double> numbers = new ArrayList<>();
        if (values instanceof List) {
            for (Object value : (List<?>) values) {
                if (value instanceof Number) numbers.add(((Number) value).doubleValue());
            }
        } else if (values instanceof Number) {
            numbers.add(((Number) values).doubleValue());
        }
        return numbers;
    }

    private static String string (Object values) {
        if (values instanceof String) return (String) values;
        if (values instanceof List && !((List<?>) values).isEmpty()) {
            StringBuilder builder = new StringBuilder();
            for (Object value : (List<?>) values) builder.append(value);
            return builder.toString();
        }
        return null;
    }

    private static String unescapeXml (String text) {
        return text.replace("&quot;", "\"").replace("&lt;", "<").replace("&gt;", ">").replace("&amp;", "&");
    }

}
