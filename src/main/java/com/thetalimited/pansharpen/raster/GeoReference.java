// GeoReference.java
// pixel <-> world mapping plus horizontal CRS for a raster grid
// affine is GDAL style and corner based:
//   x = a0 + a1*col + a2*row
//   y = b0 + b1*col + b2*row

package com.thetalimited.pansharpen.raster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import mil.nga.tiff.FileDirectoryEntry;

public final class GeoReference
{
    private final double a0, a1, a2, b0, b1, b2;
    private final double inv00, inv01, inv10, inv11;

    private final String horizontalCRS; // e.g. "EPSG:32616", null if unknown
    private final boolean pixelIsPoint;
    private final boolean georeferenced;

    // georeferencing tags exactly as read from a file; empty when built in memory
    private final List<FileDirectoryEntry> sourceEntries;

    private GeoReference(double a0, double a1, double a2, double b0, double b1, double b2,
                         String horizontalCRS, boolean pixelIsPoint, boolean georeferenced,
                         List<FileDirectoryEntry> sourceEntries) {
        double det = a1*b2 - a2*b1;
        if (Math.abs(det) < 1e-12) {
            throw new IllegalStateException("Non-invertible geotransform (det≈0)");
        }
        this.a0 = a0; this.a1 = a1; this.a2 = a2;
        this.b0 = b0; this.b1 = b1; this.b2 = b2;
        this.inv00 =  b2/det; this.inv01 = -a2/det;
        this.inv10 = -b1/det; this.inv11 =  a1/det;
        this.horizontalCRS = horizontalCRS;
        this.pixelIsPoint = pixelIsPoint;
        this.georeferenced = georeferenced;
        this.sourceEntries = Collections.unmodifiableList(new ArrayList<>(sourceEntries));
    }

    /** Builds an in-memory georeference from a GDAL geotransform (a0, a1, a2, b0, b1, b2). */
    public static GeoReference of(double[] geoTransform, String horizontalCRS) {
        if (geoTransform == null || geoTransform.length != 6) {
            throw new IllegalArgumentException("geotransform must have 6 coefficients");
        }
        return new GeoReference(geoTransform[0], geoTransform[1], geoTransform[2],
                                geoTransform[3], geoTransform[4], geoTransform[5],
                                horizontalCRS, false, true, List.of());
    }

    // north-up grid: origin is the upper left corner, pixel sizes are positive
    public static GeoReference northUp(double originX, double originY, double pixelSizeX,
                                       double pixelSizeY, String horizontalCRS) {
        return of(new double[] { originX, pixelSizeX, 0.0, originY, 0.0, -pixelSizeY }, horizontalCRS);
    }

    // no georeferencing at all; operate in pixel space
    public static GeoReference pixelSpace() {
        return new GeoReference(0, 1, 0, 0, 0, -1, null, false, false, List.of());
    }

    static GeoReference fromFile(double[] geoTransform, String horizontalCRS, boolean pixelIsPoint,
                                 List<FileDirectoryEntry> sourceEntries) {
        return new GeoReference(geoTransform[0], geoTransform[1], geoTransform[2],
                                geoTransform[3], geoTransform[4], geoTransform[5],
                                horizontalCRS, pixelIsPoint, true, sourceEntries);
    }

    public double[] worldFromPixel(double col, double row) {
        return new double[] { a0 + a1*col + a2*row, b0 + b1*col + b2*row };
    }

    public double[] pixelFromWorld(double x, double y) {
        double dx = x - a0, dy = y - b0;
        double col = inv00*dx + inv01*dy;
        double row = inv10*dx + inv11*dy;
        return new double[] { col, row };
    }

    public double[] getGeoTransform() { return new double[] { a0, a1, a2, b0, b1, b2 }; }
    public String getHorizontalCRS() { return horizontalCRS; }
    public boolean isPixelIsPoint() { return pixelIsPoint; }
    public boolean isGeoreferenced() { return georeferenced; }
    public boolean isNorthUp() { return a2 == 0.0 && b1 == 0.0; }
    public List<FileDirectoryEntry> getSourceEntries() { return sourceEntries; }

    /** True when both grids use the same affine and CRS, ignoring how the tags were stored. */
    public boolean sameGrid(GeoReference other) {
        if (other == null) return false;
        return a0 == other.a0 && a1 == other.a1 && a2 == other.a2
            && b0 == other.b0 && b1 == other.b1 && b2 == other.b2
            && Objects.equals(horizontalCRS, other.horizontalCRS);
    }

    @Override
    public String toString() {
        return String.format("GeoReference[%s; %.6f, %.9f, %.9f, %.6f, %.9f, %.9f]",
                             horizontalCRS == null ? "unknown CRS" : horizontalCRS,
                             a0, a1, a2, b0, b1, b2);
    }

} // GeoReference
