package com.conveyal.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

public abstract class FileUtils {

    private static final Logger LOG = LoggerFactory.getLogger(FileUtils.class);

    /**
     * Make a file that will be written, closed and then put into FileStorage. This does not belong on FileStorage,
     * which deals only with complete, immutable files.
     *
     * @param type a short suffix revealing what kind of file this is, to make names more readable.
     */
    public static File createScratchFile (String type) {
        try {
            File tempFile = File.createTempFile("com.conveyal.coverage", "." + type);
            // The shutdown hook applies to the temporary path. Once moved into storage the file is not deleted.
            tempFile.deleteOnExit();
            return tempFile;
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Remove a scratch file that will not be put into storage, for example after a failed write. Failure to delete is
     * only logged, as the file is also scheduled for deletion on exit.
     */
    public static void deleteScratchFile (File file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file.toPath());
        } catch (IOException e) {
            LOG.warn("Could not delete scratch file {}: {}", file, e.toString());
        }
    }

}
