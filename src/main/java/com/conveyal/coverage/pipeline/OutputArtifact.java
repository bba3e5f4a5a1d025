package com.conveyal.coverage.pipeline;

import com.conveyal.file.FileStorageKey;
import com.google.common.collect.ImmutableList;

import java.util.List;

/** A serialized output raster once it is in storage. Immutable. */
public class OutputArtifact {

    public final FileStorageKey key;

    /** Where clients can retrieve the file. */
    public final String url;

    public final String mediaType;

    /** File size in bytes. */
    public final long size;

    /** Band labels in file order. */
    public final List<String> bands;

    public OutputArtifact (FileStorageKey key, String url, String mediaType, long size, List<String> bands) {
        this.key = key;
        this.url = url;
        this.mediaType = mediaType;
        this.size = size;
        this.bands = ImmutableList.copyOf(bands);
    }

    @Override
    public String toString () {
        return String.format("%s (%s, %d bytes, bands %s)", url, mediaType, size, bands);
    }

}
