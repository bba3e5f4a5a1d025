package com.conveyal.file;

import java.util.Objects;

/**
 * Identifies a file within storage: a category, mapping to a directory, and a relative path inside it. Paths are
 * built from process and invocation ids, which come from outside, so anything that could climb out of the category
 * directory is refused.
 */
public class FileStorageKey {

    public final FileCategory category;

    public final String path;

    public FileStorageKey (FileCategory category, String path) {
        checkPath(path);
        this.category = category;
        this.path = path;
    }

    public FileStorageKey (FileCategory category, String path, String ext) {
        this(category, path + "." + ext);
    }

    /** The final path element, without any directories. */
    public String fileName () {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /** Reject empty and absolute paths, and any that could be used for directory traversal. */
    public static void checkPath (String path) {
        if (path == null || path.isEmpty() || path.startsWith("/") || path.startsWith("\\")) {
            throw new IllegalArgumentException("Storage path must be a non-empty relative path: " + path);
        }
        if (path.contains("..")) {
            throw new IllegalArgumentException("Path looks like it could be a directory traversal attack.");
        }
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileStorageKey that = (FileStorageKey) o;
        return category == that.category && path.equals(that.path);
    }

    @Override
    public int hashCode () {
        return Objects.hash(category, path);
    }

    @Override
    public String toString () {
        return String.format("[File storage key: category='%s', key='%s']", category, path);
    }

}
