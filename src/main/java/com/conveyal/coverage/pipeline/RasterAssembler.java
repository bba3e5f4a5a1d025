package com.conveyal.coverage.pipeline;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.components.Component;
import com.conveyal.coverage.raster.Dataset;
import com.conveyal.coverage.raster.GeoTiffWriter;
import com.conveyal.coverage.raster.RasterArray;
import com.conveyal.file.FileCategory;
import com.conveyal.file.FileStorage;
import com.conveyal.file.FileStorageFormat;
import com.conveyal.file.FileStorageKey;
import com.conveyal.file.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Combines evaluated bands into the output Dataset and writes it to storage. Files are written in full to a scratch
 * location and only then moved into storage, so a failed serialization never leaves a partial artifact behind.
 */
public class RasterAssembler implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(RasterAssembler.class);

    private final FileStorage fileStorage;

    public RasterAssembler (FileStorage fileStorage) {
        this.fileStorage = fileStorage;
    }

    /**
     * Select the requested output bands, in the requested order, into a new Dataset. A requested band that was
     * evaluated is taken from the evaluated bands, otherwise from the source dataset. All bands must lie on the grid of
     * the source dataset, failing with GRID_MISMATCH otherwise.
     */
    public Dataset assemble (Dataset sourceDataset, Map<String, RasterArray> evaluatedBands,
                             List<String> requestedOutputBands) {
        Dataset output = new Dataset();
        for (String band : requestedOutputBands) {
            RasterArray array = evaluatedBands.get(band);
            if (array == null) array = sourceDataset.get(band);
            if (array == null) {
                throw CoverageProcessException.bandNotFound("Output band " + band + " was not produced.");
            }
            if (!sourceDataset.isEmpty() && !sourceDataset.extents().sameGrid(array.extents)) {
                throw CoverageProcessException.gridMismatch(String.format(
                        "Band %s on grid %s does not match the source grid %s.",
                        band, array.extents, sourceDataset.extents()));
            }
            output.add(array.band.equals(band) ? array : array.relabel(band));
        }
        return output;
    }

    /**
     * Write the dataset in the given format and move it into storage under the given path (without extension) in
     * the RESULTS category. Only GeoTIFF is a raster format. Fails with UNSUPPORTED_FORMAT for any other format
     * identifier and with SERIALIZATION_ERROR if writing fails.
     */
    public OutputArtifact serialize (Dataset dataset, String format, String path) {
        FileStorageFormat storageFormat = FileStorageFormat.fromIdentifier(format);
        if (storageFormat != FileStorageFormat.GEOTIFF) {
            throw CoverageProcessException.unsupportedFormat(format);
        }
        if (dataset.isEmpty()) {
            throw CoverageProcessException.serializationError("Cannot write a dataset with no bands.", null);
        }
        FileStorageKey key = new FileStorageKey(FileCategory.RESULTS, path, storageFormat.extension);
        File scratch = FileUtils.createScratchFile(storageFormat.extension);
        long size;
        boolean stored = false;
        try {
            GeoTiffWriter.write(dataset, scratch);
            size = scratch.length();
            fileStorage.moveIntoStorage(key, scratch);
            stored = true;
        } catch (IOException | UncheckedIOException e) {
            throw CoverageProcessException.serializationError("Could not write output raster " + key.path, e);
        } finally {
            // Whatever failed, including unchecked exceptions from the TIFF library, the scratch file is not kept.
            if (!stored) FileUtils.deleteScratchFile(scratch);
        }
        OutputArtifact artifact = new OutputArtifact(
                key, fileStorage.getURL(key), GeoTiffWriter.MEDIA_TYPE, size, dataset.labels());
        LOG.debug("Stored {}", artifact);
        return artifact;
    }

}
