// GridSpec.java
// the shape and georeference of a grid that another raster gets aligned to

package com.thetalimited.pansharpen.raster;

import java.util.Objects;

public final class GridSpec
{
    private final int width, height;
    private final GeoReference geoReference;

    public GridSpec(int width, int height, GeoReference geoReference) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("grid must be at least 1x1, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.geoReference = Objects.requireNonNull(geoReference, "geoReference must not be null");
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public GeoReference getGeoReference() { return geoReference; }

    @Override
    public String toString() {
        return width + "x" + height + " " + geoReference;
    }

} // GridSpec
