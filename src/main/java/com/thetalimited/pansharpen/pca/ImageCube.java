// ImageCube.java
// d co-registered bands viewed as a (pixels x d) matrix
// plus a per-pixel validity mask. Stored column-wise: one
// double[] per band, pixels in row-major order.
//
// A pixel is invalid (nodata) when any of its band values is 0 or NaN.

package com.thetalimited.pansharpen.pca;

import java.util.ArrayList;
import java.util.List;

public final class ImageCube
{
    private final double[][] columns; // [band][pixel]
    private final boolean[] valid;    // [pixel]
    private final int width, height;

    private ImageCube(double[][] columns, boolean[] valid, int width, int height) {
        this.columns = columns;
        this.valid = valid;
        this.width = width;
        this.height = height;
    }

    /**
     * Stacks 2-D band planes ([row][col]) into a cube and derives the validity mask.
     * All planes must have the same dimensions.
     */
    public static ImageCube stack(List<double[][]> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("cannot stack zero bands");
        }
        int height = bands.get(0).length;
        int width = height == 0 ? 0 : bands.get(0)[0].length;
        if (width == 0 || height == 0) {
            throw new IllegalArgumentException("bands must not be empty");
        }

        int pixels = width * height;
        double[][] columns = new double[bands.size()][pixels];
        for (int b = 0; b < bands.size(); b++) {
            double[][] plane = bands.get(b);
            if (plane == null || plane.length != height) {
                throw new IllegalArgumentException("band " + (b + 1) + " does not have " + height + " rows");
            }
            for (int r = 0; r < height; r++) {
                if (plane[r] == null || plane[r].length != width) {
                    throw new IllegalArgumentException("band " + (b + 1) + " does not have " + width + " columns");
                }
                System.arraycopy(plane[r], 0, columns[b], r * width, width);
            }
        }

        boolean[] valid = new boolean[pixels];
        for (int p = 0; p < pixels; p++) {
            boolean ok = true;
            for (double[] column : columns) {
                if (isNoData(column[p])) { ok = false; break; }
            }
            valid[p] = ok;
        }
        return new ImageCube(columns, valid, width, height);
    }

    // a cube that shares the mask and shape of another; used for projected/reconstructed data
    static ImageCube withMask(double[][] columns, ImageCube like) {
        return new ImageCube(columns, like.valid, like.width, like.height);
    }

    public static boolean isNoData(double v) {
        return v == 0.0 || Double.isNaN(v);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getPixelCount() { return width * height; }
    public int getDimensions() { return columns.length; }

    public double get(int pixel, int band) { return columns[band][pixel]; }
    public void set(int pixel, int band, double value) { columns[band][pixel] = value; }

    public boolean isValid(int pixel) { return valid[pixel]; }

    public int getValidCount() {
        int n = 0;
        for (boolean v : valid) if (v) n++;
        return n;
    }

    // backing column, not a copy
    double[] column(int band) { return columns[band]; }

    /** Splits the cube back into [row][col] planes, one per band, in band order. */
    public List<double[][]> toBands() {
        List<double[][]> out = new ArrayList<>(columns.length);
        for (double[] column : columns) {
            double[][] plane = new double[height][width];
            for (int r = 0; r < height; r++) {
                System.arraycopy(column, r * width, plane[r], 0, width);
            }
            out.add(plane);
        }
        return out;
    }

} // ImageCube
