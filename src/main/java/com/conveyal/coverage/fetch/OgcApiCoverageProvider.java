package com.conveyal.coverage.fetch;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.catalog.Collection;
import com.conveyal.coverage.raster.CrsTransforms;
import com.conveyal.coverage.raster.Dataset;
import com.conveyal.coverage.raster.GeoTiffReader;
import com.conveyal.coverage.raster.GridExtents;
import com.conveyal.coverage.raster.Interpolation;
import com.conveyal.coverage.raster.RasterArray;
import com.conveyal.coverage.raster.Resampler;
import com.conveyal.coverage.util.ExceptionUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.config.SocketConfig;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Fetches bands from a server implementing OGC API - Coverages, one GET per band:
 * {@code {base}/collections/{id}/coverage?subset=Lat(..),Lon(..)[,time(..)]&rangeSubset={band}&f=GeoTIFF}.
 * The server is expected to mosaic any time interval into a single slice. Responses are decoded as GeoTIFF and
 * cropped to the requested area on the server's own grid.
 */
public class OgcApiCoverageProvider implements CoverageProvider {

    private static final Logger LOG = LoggerFactory.getLogger(OgcApiCoverageProvider.class);

    public interface Config {
        String upstreamUrl ();
        int upstreamTimeoutSeconds ();
    }

    private final String baseUrl;

    private final HttpClient httpClient;

    private final Resampler cropper = new Resampler(Interpolation.NEAREST);

    public OgcApiCoverageProvider (Config config) {
        this.baseUrl = config.upstreamUrl().replaceAll("/+$", "");
        this.httpClient = makeHttpClient(config.upstreamTimeoutSeconds());
    }

    /** Retries are left to the job runner, so the client itself never retries. */
    private static HttpClient makeHttpClient (int timeoutSeconds) {
        PoolingHttpClientConnectionManager mgr = new PoolingHttpClientConnectionManager();
        mgr.setDefaultMaxPerRoute(20);
        int timeoutMilliseconds = timeoutSeconds * 1000;
        mgr.setDefaultSocketConfig(SocketConfig.custom().setSoTimeout(timeoutMilliseconds).build());
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMilliseconds)
                .setConnectionRequestTimeout(timeoutMilliseconds)
                .setSocketTimeout(timeoutMilliseconds)
                .build();
        return HttpClients.custom().disableAutomaticRetries()
                .setConnectionManager(mgr)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Override
    public RasterArray fetch (Collection collection, String band, CoverageRequest request) {
        URI uri = coverageUri(collection.id, band, request);
        LOG.debug("GET {}", uri);
        HttpEntity entity = null;
        byte[] body;
        try {
            HttpResponse response = httpClient.execute(new HttpGet(uri));
            entity = response.getEntity();
            int status = response.getStatusLine().getStatusCode();
            if (status == 404 || status == 204) {
                throw CoverageProcessException.dataUnavailable(String.format(
                        "No data for band %s of collection %s in the requested subset (HTTP %d).",
                        band, collection.id, status));
            }
            if (status != 200 || entity == null) {
                throw CoverageProcessException.upstreamFetchError(String.format(
                        "Coverage source answered HTTP %d for band %s of collection %s.", status, band, collection.id),
                        null);
            }
            body = EntityUtils.toByteArray(entity);
        } catch (IOException e) {
            throw CoverageProcessException.upstreamFetchError(
                    "Could not fetch band " + band + " of collection " + collection.id + ": "
                            + ExceptionUtils.shortCauseString(e), e);
        } finally {
            // Release the connection back to the pool whatever happened.
            EntityUtils.consumeQuietly(entity);
        }
        return decode(body, collection, band, request);
    }

    private RasterArray decode (byte[] body, Collection collection, String band, CoverageRequest request) {
        Dataset dataset;
        try {
            dataset = GeoTiffReader.read(body);
        } catch (IOException | RuntimeException e) {
            throw CoverageProcessException.upstreamFetchError(
                    "Unreadable coverage for band " + band + " of collection " + collection.id, e);
        }
        RasterArray array;
        if (dataset.contains(band)) {
            array = dataset.get(band);
        } else if (dataset.size() == 1) {
            array = dataset.get(dataset.labels().get(0)).relabel(band);
        } else {
            throw CoverageProcessException.upstreamFetchError(String.format(
                    "Coverage source returned bands %s instead of %s.", dataset.labels(), band), null);
        }
        Envelope subset = CrsTransforms.transformEnvelope(request.subset, request.subsetCrs, array.extents.crs);
        GridExtents clipped = array.extents.clip(subset);
        if (clipped == null) {
            throw CoverageProcessException.dataUnavailable(String.format(
                    "Coverage returned for band %s does not overlap the requested subset.", band));
        }
        return cropper.resample(array, clipped);
    }

    URI coverageUri (String collectionId, String band, CoverageRequest request) {
        Envelope lonLat = CrsTransforms.transformEnvelope(request.subset, request.subsetCrs, CrsTransforms.WGS84);
        StringBuilder subset = new StringBuilder();
        subset.append("Lat(").append(plain(lonLat.getMinY())).append(':').append(plain(lonLat.getMaxY())).append(')');
        subset.append(",Lon(").append(plain(lonLat.getMinX())).append(':').append(plain(lonLat.getMaxX())).append(')');
        if (request.temporal != null) {
            subset.append(",time(").append(request.temporal.toQueryValue()).append(')');
        }
        try {
            return new URIBuilder(baseUrl + "/collections/" + collectionId + "/coverage")
                    .addParameter("subset", subset.toString())
                    .addParameter("rangeSubset", band)
                    .addParameter("f", "GeoTIFF")
                    .build();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid coverage URL for collection " + collectionId, e);
        }
    }

    private static String plain (double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

}
