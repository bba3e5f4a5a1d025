package com.conveyal.file;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalFileStorageTest {

    @TempDir
    Path tempDir;

    private LocalFileStorage storage;

    @BeforeEach
    void setUp () {
        storage = new LocalFileStorage(tempDir.resolve("store").toString(), "http://localhost:7070/files//");
    }

    private File scratch (String content) throws Exception {
        File file = Files.createTempFile(tempDir, "scratch", ".tmp").toFile();
        Files.writeString(file.toPath(), content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void movedFilesAreStoredReadOnly () throws Exception {
        FileStorageKey key = new FileStorageKey(FileCategory.RESULTS, "ndvi/run", "tif");
        File source = scratch("raster");
        storage.moveIntoStorage(key, source);

        assertFalse(source.exists());
        assertTrue(storage.exists(key));
        File stored = storage.getFile(key);
        assertEquals("raster", Files.readString(stored.toPath(), StandardCharsets.UTF_8));
        assertEquals(Set.of(PosixFilePermission.OWNER_READ), Files.getPosixFilePermissions(stored.toPath()));
        assertEquals("http://localhost:7070/files/results/ndvi/run.tif", storage.getURL(key));
        assertEquals("run.tif", key.fileName());
    }

    @Test
    void replacingAndDeleting () throws Exception {
        FileStorageKey key = new FileStorageKey(FileCategory.PROCESSES, "p.json");
        storage.moveIntoStorage(key, scratch("first"));
        storage.moveIntoStorage(key, scratch("second"));
        assertEquals("second", Files.readString(storage.getFile(key).toPath(), StandardCharsets.UTF_8));
        storage.delete(key);
        assertFalse(storage.exists(key));
    }

    @Test
    void listsOneCategory () throws Exception {
        storage.moveIntoStorage(new FileStorageKey(FileCategory.PROCESSES, "a.json"), scratch("{}"));
        storage.moveIntoStorage(new FileStorageKey(FileCategory.RESULTS, "a/b.tif"), scratch("x"));
        assertEquals(List.of(new FileStorageKey(FileCategory.PROCESSES, "a.json")),
                storage.list(FileCategory.PROCESSES));
        assertEquals(List.of(new FileStorageKey(FileCategory.RESULTS, "a/b.tif")), storage.list(FileCategory.RESULTS));
    }

    @Test
    void emptyCategoryListsNothing () {
        assertTrue(storage.list(FileCategory.RESULTS).isEmpty());
    }

    @Test
    void traversalIsRefused () {
        assertThrows(IllegalArgumentException.class, () -> new FileStorageKey(FileCategory.RESULTS, "../etc/passwd"));
        assertThrows(IllegalArgumentException.class, () -> new FileStorageKey(FileCategory.RESULTS, "/abs"));
        assertThrows(IllegalArgumentException.class, () -> new FileStorageKey(FileCategory.RESULTS, ""));
    }

    @Test
    void formatsByIdentifierAndFilename () {
        assertEquals(FileStorageFormat.GEOTIFF, FileStorageFormat.fromIdentifier("GeoTIFF"));
        assertEquals(FileStorageFormat.GEOTIFF, FileStorageFormat.fromIdentifier(" image/tiff; application=geotiff "));
        assertEquals(FileStorageFormat.GEOTIFF, FileStorageFormat.fromIdentifier("image/TIFF"));
        assertEquals(FileStorageFormat.JSON, FileStorageFormat.fromIdentifier("application/json; charset=utf-8"));
        assertNull(FileStorageFormat.fromIdentifier("png"));
        assertNull(FileStorageFormat.fromIdentifier(null));
        assertEquals(FileStorageFormat.JSON, FileStorageFormat.fromFilename("p.JSON"));
        assertNull(FileStorageFormat.fromFilename("readme"));
    }

}
