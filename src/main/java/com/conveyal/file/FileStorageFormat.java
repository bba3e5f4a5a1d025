package com.conveyal.file;

import java.util.List;
import java.util.Locale;

/**
 * The file types this service writes: output rasters and process definitions. Output formats are requested by
 * clients under a number of aliases (an f= query parameter value, a file extension or a media type).
 */
public enum FileStorageFormat {

    GEOTIFF("tif", "image/tiff; application=geotiff", List.of("geotiff", "tif", "tiff", "image/tiff")),
    JSON("json", "application/json", List.of("json", "application/json"));

    public final String extension;

    public final String mimeType;

    /** Lower case identifiers under which clients may ask for this format. */
    private final List<String> identifiers;

    FileStorageFormat (String extension, String mimeType, List<String> identifiers) {
        this.extension = extension;
        this.mimeType = mimeType;
        this.identifiers = identifiers;
    }

    /**
     * Look up a format by any of its identifiers, ignoring case and media type parameters. Returns null if no format
     * is known under that identifier.
     */
    public static FileStorageFormat fromIdentifier (String identifier) {
        if (identifier == null) return null;
        String normalized = identifier.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals(GEOTIFF.mimeType)) return GEOTIFF;
        int parameters = normalized.indexOf(';');
        if (parameters >= 0) normalized = normalized.substring(0, parameters).trim();
        for (FileStorageFormat format : FileStorageFormat.values()) {
            if (format.identifiers.contains(normalized)) {
                return format;
            }
        }
        return null;
    }

    public static FileStorageFormat fromFilename (String filename) {
        String extension = filename.substring(filename.lastIndexOf(".") + 1).toLowerCase(Locale.ROOT);
        for (FileStorageFormat format : FileStorageFormat.values()) {
            if (format.extension.equals(extension)) {
                return format;
            }
        }
        return null;
    }

}
