package com.conveyal.coverage.raster;

import java.util.Locale;

/** How samples are read from a source grid at positions that do not fall on its pixel centers. */
public enum Interpolation {

    NEAREST("nearest"),
    BILINEAR("bilinear");

    /** The name used in configuration files. */
    public final String key;

    Interpolation (String key) {
        this.key = key;
    }

    public static Interpolation fromKey (String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Interpolation interpolation : Interpolation.values()) {
            if (interpolation.key.equals(normalized)) {
                return interpolation;
            }
        }
        throw new IllegalArgumentException("Unknown interpolation method: " + key);
    }

}
