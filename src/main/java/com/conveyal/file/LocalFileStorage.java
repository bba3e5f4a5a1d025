package com.conveyal.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static java.nio.file.attribute.PosixFilePermission.OWNER_READ;
import static java.nio.file.attribute.PosixFilePermission.OWNER_WRITE;

/**
 * Stores files in a local directory hierarchy, one subdirectory per category. URLs point at a file server rooted at
 * the configured server URL, which the deployment provides.
 */
public class LocalFileStorage implements FileStorage {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFileStorage.class);

    public interface Config {
        // The local directory where files will be stored.
        String localCacheDirectory ();
        // Prefix of the URLs at which stored files are served, e.g. http://localhost:7070/files
        String serverUrl ();
    }

    public final String directory;

    private final String urlPrefix;

    public LocalFileStorage (Config config) {
        this(config.localCacheDirectory(), config.serverUrl());
    }

    public LocalFileStorage (String directory, String urlPrefix) {
        this.directory = directory;
        this.urlPrefix = urlPrefix.replaceAll("/+$", "");
        new File(directory).mkdirs();
    }

    /**
     * Move the file to the path represented by the key. Where the filesystem does not allow the move, the file is
     * copied and the source removed.
     */
    @Override
    public void moveIntoStorage (FileStorageKey key, File sourceFile) {
        File storedFile = getFile(key);
        storedFile.getParentFile().mkdirs();
        try {
            try {
                Files.move(sourceFile.toPath(), storedFile.toPath(),
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (FileSystemException e) {
                // Typically a move across filesystems, from the temporary directory to the storage directory.
                // Copy under a temporary name next to the target, then rename, so readers never see a partial file.
                Path partial = storedFile.toPath().resolveSibling(storedFile.getName() + ".partial");
                Files.copy(sourceFile.toPath(), partial, StandardCopyOption.REPLACE_EXISTING);
                Files.move(partial, storedFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
                Files.delete(sourceFile.toPath());
                LOG.debug("Could not move {} atomically, copied instead.", sourceFile.getName());
            }
            setReadOnly(storedFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not move file into storage at " + key, e);
        }
    }

    @Override
    public File getFile (FileStorageKey key) {
        return new File(String.join("/", directory, key.category.directoryName(), key.path));
    }

    @Override
    public String getURL (FileStorageKey key) {
        return String.join("/", urlPrefix, key.category.directoryName(), key.path);
    }

    @Override
    public void delete (FileStorageKey key) {
        try {
            File storedFile = getFile(key);
            if (storedFile.exists()) {
                // Stored files are read-only, so permissions must be changed to allow deletion.
                Files.setPosixFilePermissions(storedFile.toPath(), Set.of(OWNER_READ, OWNER_WRITE));
                Files.delete(storedFile.toPath());
            } else {
                LOG.warn("Attempted to delete non-existing file: {}", storedFile);
            }
        } catch (Exception e) {
            throw new RuntimeException("Exception while deleting stored file.", e);
        }
    }

    @Override
    public boolean exists (FileStorageKey key) {
        return getFile(key).exists();
    }

    @Override
    public List<FileStorageKey> list (FileCategory category) {
        Path root = new File(directory, category.directoryName()).toPath();
        List<FileStorageKey> keys = new ArrayList<>();
        if (!Files.isDirectory(root)) return keys;
        try (Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isRegularFile)
                 .filter(path -> !path.getFileName().toString().endsWith(".partial"))
                 .forEach(path -> keys.add(new FileStorageKey(category, root.relativize(path).toString().replace('\\', '/'))));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list stored files in " + root, e);
        }
        return keys;
    }

    /**
     * Make the file read-only and accessible only by the current user, as a safeguard against corruption. POSIX
     * permissions are tried first, falling back on the portable but less precise java.io.File methods.
     */
    public static void setReadOnly (File file) {
        try {
            Files.setPosixFilePermissions(file.toPath(), EnumSet.of(PosixFilePermission.OWNER_READ));
        } catch (UnsupportedOperationException e) {
            LOG.warn("POSIX permissions unsupported on this filesystem. Falling back on portable NIO methods.");
            if (!(file.setReadable(true) && file.setWritable(false))) {
                LOG.error("Could not set read-only permissions on file {}", file);
            }
        } catch (IOException e) {
            LOG.error("Could not set read-only permissions on file {}", file, e);
        }
    }

}
