package com.conveyal.file;

import com.conveyal.coverage.components.Component;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Stores the files this service produces and keeps. Files are always written elsewhere first and handed over once
 * complete, so a file visible in storage is never partial. Stored files are treated as immutable. Methods are blocking:
 * when one returns, every other component can see its effect.
 */
public interface FileStorage extends Component {

    /**
     * Take a complete file from elsewhere on the local filesystem and make it the permanent file for the given key,
     * replacing any previous file with that key. The source file no longer exists at its old path afterward.
     */
    void moveIntoStorage (FileStorageKey fileStorageKey, File file);

    /** Files returned from this method must be treated as immutable. Never write to them. */
    File getFile (FileStorageKey fileStorageKey);

    /** A URL at which clients can retrieve the file. */
    String getURL (FileStorageKey fileStorageKey);

    void delete (FileStorageKey fileStorageKey);

    boolean exists (FileStorageKey fileStorageKey);

    /** Keys of all files stored in a category, in no particular order. */
    List<FileStorageKey> list (FileCategory category);

    default InputStream getInputStream (FileStorageKey fileStorageKey) throws IOException {
        return new BufferedInputStream(new FileInputStream(getFile(fileStorageKey)));
    }

}
