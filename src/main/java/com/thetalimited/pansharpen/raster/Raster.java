// Raster.java
// in-memory raster: one [row][col] plane of doubles per band
// plus the georeference of its grid

package com.thetalimited.pansharpen.raster;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class Raster
{
    private final double[][][] bands; // [band][row][col]
    private final int width, height;
    private final GeoReference geoReference;

    public Raster(List<double[][]> bands, GeoReference geoReference) {
        Objects.requireNonNull(bands, "bands must not be null");
        this.geoReference = Objects.requireNonNull(geoReference, "geoReference must not be null");
        if (bands.isEmpty()) {
            throw new IllegalArgumentException("a raster needs at least one band");
        }

        double[][] first = bands.get(0);
        this.height = first.length;
        this.width = height == 0 ? 0 : first[0].length;
        if (width == 0 || height == 0) {
            throw new IllegalArgumentException("raster bands must not be empty");
        }

        this.bands = new double[bands.size()][][];
        for (int b = 0; b < bands.size(); b++) {
            double[][] plane = bands.get(b);
            requireShape(plane, width, height, "band " + (b + 1));
            this.bands[b] = plane;
        }
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getBandCount() { return bands.length; }
    public GeoReference getGeoReference() { return geoReference; }

    public GridSpec getGridSpec() {
        return new GridSpec(width, height, geoReference);
    }

    // zero based band index
    public double[][] getBand(int band) {
        if (band < 0 || band >= bands.length) {
            throw new IndexOutOfBoundsException("band " + band + " of " + bands.length);
        }
        return bands[band];
    }

    public List<double[][]> getBands() {
        List<double[][]> out = new ArrayList<>(bands.length);
        for (double[][] plane : bands) out.add(plane);
        return out;
    }

    public double get(int band, int col, int row) {
        return bands[band][row][col];
    }

    static void requireShape(double[][] plane, int width, int height, String what) {
        if (plane == null || plane.length != height) {
            throw new IllegalArgumentException(what + " does not have " + height + " rows");
        }
        for (double[] row : plane) {
            if (row == null || row.length != width) {
                throw new IllegalArgumentException(what + " does not have " + width + " columns");
            }
        }
    }

    @Override
    public String toString() {
        return "Raster[" + width + "x" + height + "x" + bands.length + ", " + geoReference + "]";
    }

} // Raster
