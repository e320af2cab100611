// CrsSupport.java
// proj4j lookups shared by the raster writer and the resampler
// EPSG names need proj4j-epsg on the classpath

package com.thetalimited.pansharpen.raster;

import java.util.HashMap;
import java.util.Map;

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.proj.LongLatProjection;

public final class CrsSupport
{
    private static final CRSFactory crsFactory = new CRSFactory();
    private static final CoordinateTransformFactory ctf = new CoordinateTransformFactory();

    // tiny cache so we don't re-parse the EPSG database for every raster
    private static final Map<String, CoordinateReferenceSystem> crsCache = new HashMap<>();

    private CrsSupport() {}

    /**
     * Looks up a CRS by name, e.g. "EPSG:32616".
     *
     * @throws IllegalArgumentException if proj4j does not know the name
     */
    public static synchronized CoordinateReferenceSystem lookup(String name) {
        CoordinateReferenceSystem crs = crsCache.get(name);
        if (crs != null) return crs;
        try {
            crs = crsFactory.createFromName(name);
        }
        catch (Proj4jException e) {
            throw new IllegalArgumentException("Unknown or unsupported CRS " + name + ": " + e.getMessage(), e);
        }
        if (crs == null) {
            throw new IllegalArgumentException("Unknown CRS " + name);
        }
        crsCache.put(name, crs);
        return crs;
    }

    public static CoordinateTransform transform(String fromName, String toName) {
        return ctf.createTransform(lookup(fromName), lookup(toName));
    }

    // lon/lat CRS (EPSG:4326 and friends) rather than a projected one
    public static boolean isGeographic(String name) {
        try {
            return lookup(name).getProjection() instanceof LongLatProjection;
        }
        catch (IllegalArgumentException e) {
            // EPSG reserves 4000-4999 for geographic 2D CRSs
            Integer code = GeoTiffTags.epsgCode(name);
            return code != null && code >= 4000 && code < 5000;
        }
    }

} // CrsSupport
