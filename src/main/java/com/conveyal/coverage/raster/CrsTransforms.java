package com.conveyal.coverage.raster;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.locationtech.proj4j.proj.LongLatProjection;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lookup of coordinate reference systems by EPSG code and construction of point transforms between them.
 * CRS definitions are immutable and cached. Proj4J transforms keep scratch state, so a new one is handed out on every
 * call and must stay confined to the thread that asked for it.
 *
 * All geographic coordinates are handled in longitude, latitude (x, y) order, which is also how Proj4J treats them.
 */
public abstract class CrsTransforms {

    public static final String WGS84 = "EPSG:4326";

    private static final Pattern EPSG_URI = Pattern.compile(".*/def/crs/EPSG/[^/]+/(\\d+)$");
    private static final Pattern EPSG_CODE = Pattern.compile("^EPSG:+(\\d+)$");

    /** Envelope edges are sampled at this many points when transforming, to catch curved edges. */
    private static final int EDGE_SAMPLES = 16;

    private static final CRSFactory crsFactory = new CRSFactory();
    private static final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private static final Map<String, CoordinateReferenceSystem> crsCache = new ConcurrentHashMap<>();

    /**
     * Reduce the different spellings of a CRS used by OGC APIs and GeoTIFF tooling to EPSG:nnnn. The OGC CRS84 URI is
     * longitude-first WGS84, which is how EPSG:4326 is treated throughout this code.
     */
    public static String normalize (String crs) {
        String trimmed = crs.trim();
        if (trimmed.endsWith("/OGC/1.3/CRS84") || trimmed.equalsIgnoreCase("CRS84")) {
            return WGS84;
        }
        Matcher uri = EPSG_URI.matcher(trimmed);
        if (uri.matches()) {
            return "EPSG:" + uri.group(1);
        }
        Matcher code = EPSG_CODE.matcher(trimmed.toUpperCase(Locale.ROOT));
        if (code.matches()) {
            return "EPSG:" + code.group(1);
        }
        throw new IllegalArgumentException("Unrecognized coordinate reference system: " + crs);
    }

    public static int epsgCode (String crs) {
        String normalized = normalize(crs);
        return Integer.parseInt(normalized.substring(normalized.indexOf(':') + 1));
    }

    public static CoordinateReferenceSystem lookup (String crs) {
        return crsCache.computeIfAbsent(normalize(crs), crsFactory::createFromName);
    }

    public static boolean isGeographic (String crs) {
        return lookup(crs).getProjection() instanceof LongLatProjection;
    }

    /** A fresh transform from one CRS to another, for use by a single thread. */
    public static CoordinateTransform transform (String fromCrs, String toCrs) {
        return transformFactory.createTransform(lookup(fromCrs), lookup(toCrs));
    }

    /**
     * The bounding envelope, in the target CRS, of the given envelope. Points along every edge are transformed, not
     * only the corners, since straight edges in one projection can bow outward in another.
     */
    public static Envelope transformEnvelope (Envelope envelope, String fromCrs, String toCrs) {
        if (normalize(fromCrs).equals(normalize(toCrs))) {
            return new Envelope(envelope);
        }
        CoordinateTransform transform = transform(fromCrs, toCrs);
        Envelope result = new Envelope();
        ProjCoordinate source = new ProjCoordinate();
        ProjCoordinate target = new ProjCoordinate();
        for (int i = 0; i <= EDGE_SAMPLES; i++) {
            double fraction = (double) i / EDGE_SAMPLES;
            double x = envelope.getMinX() + fraction * envelope.getWidth();
            double y = envelope.getMinY() + fraction * envelope.getHeight();
            double[][] edgePoints = {
                {x, envelope.getMinY()}, {x, envelope.getMaxY()}, {envelope.getMinX(), y}, {envelope.getMaxX(), y}
            };
            for (double[] point : edgePoints) {
                source.x = point[0];
                source.y = point[1];
                transform.transform(source, target);
                if (Double.isFinite(target.x) && Double.isFinite(target.y)) {
                    result.expandToInclude(target.x, target.y);
                }
            }
        }
        return result;
    }

}
