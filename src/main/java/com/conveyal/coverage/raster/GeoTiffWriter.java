package com.conveyal.coverage.raster;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Writes a Dataset as a single-image GeoTIFF: 32-bit float samples, one sample per band, uncompressed. The CRS goes
 * into the GeoKey directory as an EPSG code, the grid into pixel scale and tie point tags. Band labels are written
 * both as GDAL band descriptions and, comma separated, as the image description.
 */
public abstract class GeoTiffWriter {

    private static final Logger LOG = LoggerFactory.getLogger(GeoTiffWriter.class);

    // GeoTIFF and GDAL private tags.
    static final int TAG_MODEL_PIXEL_SCALE = 33550;
    static final int TAG_MODEL_TIEPOINT = 33922;
    static final int TAG_GEO_KEY_DIRECTORY = 34735;
    static final int TAG_GDAL_METADATA = 42112;
    static final int TAG_GDAL_NODATA = 42113;

    // GeoKeys.
    static final int KEY_MODEL_TYPE = 1024;
    static final int KEY_RASTER_TYPE = 1025;
    static final int KEY_GEOGRAPHIC_TYPE = 2048;
    static final int KEY_PROJECTED_CS_TYPE = 3072;

    static final int MODEL_TYPE_PROJECTED = 1;
    static final int MODEL_TYPE_GEOGRAPHIC = 2;
    static final int RASTER_PIXEL_IS_AREA = 1;
    static final int RASTER_PIXEL_IS_POINT = 2;

    public static final String MEDIA_TYPE = "image/tiff; application=geotiff";

    public static void write (Dataset dataset, File file) throws IOException {
        TiffWriter.writeTiff(file, toTiffImage(dataset));
    }

    public static byte[] writeToBytes (Dataset dataset) throws IOException {
        return TiffWriter.writeTiffToBytes(toTiffImage(dataset));
    }

    private static TIFFImage toTiffImage (Dataset dataset) {
        checkArgument(!dataset.isEmpty(), "Cannot write a GeoTIFF with no bands.");
        GridExtents extents = dataset.extents();
        List<String> labels = dataset.labels();
        int nBands = labels.size();

        Rasters rasters = new Rasters(extents.width, extents.height, nBands, FieldType.FLOAT);
        for (int band = 0; band < nBands; band++) {
            double[] values = dataset.get(labels.get(band)).values();
            for (int y = 0, i = 0; y < extents.height; y++) {
                for (int x = 0; x < extents.width; x++, i++) {
                    rasters.setPixelSample(band, x, y, (float) values[i]);
                }
            }
        }

        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(extents.width);
        directory.setImageHeight(extents.height);
        directory.setBitsPerSample(Collections.nCopies(nBands, FieldType.FLOAT.getBits()));
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(nBands);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(Collections.nCopies(nBands, TiffConstants.SAMPLE_FORMAT_FLOAT));
        directory.setWriteRasters(rasters);

        if (nBands > 1) {
            // Extra samples of unspecified meaning, otherwise readers take the first sample as the only gray channel.
            addEntry(directory, FieldTagType.ExtraSamples.getId(), FieldType.SHORT, nBands - 1,
                    Collections.nCopies(nBands - 1, 0));
        }
        addEntry(directory, TAG_MODEL_PIXEL_SCALE, FieldType.DOUBLE, 3,
                List.of(extents.pixelWidth(), extents.pixelHeight(), 0.0));
        addEntry(directory, TAG_MODEL_TIEPOINT, FieldType.DOUBLE, 6,
                List.of(0.0, 0.0, 0.0, extents.envelope.getMinX(), extents.envelope.getMaxY(), 0.0));
        List<Integer> geoKeys = geoKeys(extents.crs);
        addEntry(directory, TAG_GEO_KEY_DIRECTORY, FieldType.SHORT, geoKeys.size(), geoKeys);
        addAscii(directory, FieldTagType.ImageDescription.getId(), String.join(",", labels));
        addAscii(directory, TAG_GDAL_METADATA, gdalMetadata(labels));
        addAscii(directory, TAG_GDAL_NODATA, "nan");

        TIFFImage image = new TIFFImage();
        image.add(directory);
        return image;
    }

    /** Header, then model type, raster type and the EPSG code of the CRS, each as a (key, location, count, value). */
    private static List<Integer> geoKeys (String crs) {
        boolean geographic = CrsTransforms.isGeographic(crs);
        int epsg = CrsTransforms.epsgCode(crs);
        List<Integer> keys = new ArrayList<>();
        Collections.addAll(keys, 1, 1, 0, 3);
        Collections.addAll(keys, KEY_MODEL_TYPE, 0, 1, geographic ? MODEL_TYPE_GEOGRAPHIC : MODEL_TYPE_PROJECTED);
        Collections.addAll(keys, KEY_RASTER_TYPE, 0, 1, RASTER_PIXEL_IS_AREA);
        Collections.addAll(keys, geographic ? KEY_GEOGRAPHIC_TYPE : KEY_PROJECTED_CS_TYPE, 0, 1, epsg);
        return keys;
    }

    static String gdalMetadata (List<String> labels) {
        StringBuilder xml = new StringBuilder("<GDALMetadata>");
        for (int i = 0; i < labels.size(); i++) {
            xml.append(String.format("<Item name=\"DESCRIPTION\" sample=\"%d\" role=\"description\">%s</Item>",
                    i, escapeXml(labels.get(i))));
        }
        return xml.append("</GDALMetadata>").toString();
    }

    private static String escapeXml (String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    private static void addAscii (FileDirectory directory, int tag, String value) {
        int length = value.getBytes(StandardCharsets.UTF_8).length + 1;
        addEntry(directory, tag, FieldType.ASCII, length, List.of(value));
    }

    private static void addEntry (FileDirectory directory, int tag, FieldType type, long count, Object values) {
        FieldTagType tagType = FieldTagType.getById(tag);
        if (tagType == null) {
            // Older builds of the TIFF library do not know every GDAL tag. Band labels are still in the description.
            LOG.warn("TIFF library does not support tag {}, omitting it.", tag);
            return;
        }
        directory.addEntry(new FileDirectoryEntry(tagType, type, count, values));
    }

}
