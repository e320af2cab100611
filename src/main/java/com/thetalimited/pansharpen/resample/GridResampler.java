// GridResampler.java
// puts a raster onto another raster's grid: same width, height,
// geotransform and CRS as the target, values interpolated from the source
//
// Works on target pixel centres. When both rasters carry a CRS and they
// differ, target world coordinates are reprojected with proj4j at control
// points every reprojectionStep columns and linearly interpolated in between.

package com.thetalimited.pansharpen.resample;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.ProjCoordinate;
import org.locationtech.proj4j.Proj4jException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.pansharpen.raster.CrsSupport;
import com.thetalimited.pansharpen.raster.GeoReference;
import com.thetalimited.pansharpen.raster.GeoTiffDataset;
import com.thetalimited.pansharpen.raster.GeoTiffRasterIO;
import com.thetalimited.pansharpen.raster.GridSpec;
import com.thetalimited.pansharpen.raster.Raster;
import com.thetalimited.pansharpen.raster.RasterFormatException;

public class GridResampler
{
    private static final Logger log = LoggerFactory.getLogger(GridResampler.class);

    public static final int DEFAULT_REPROJECTION_STEP = 16;

    private final int reprojectionStep;

    public GridResampler() {
        this(DEFAULT_REPROJECTION_STEP);
    }

    public GridResampler(int reprojectionStep) {
        if (reprojectionStep < 1) {
            throw new IllegalArgumentException("reprojection step must be >= 1, got " + reprojectionStep);
        }
        this.reprojectionStep = reprojectionStep;
    }

    public int getReprojectionStep() { return reprojectionStep; }

    /**
     * Resamples every band of {@code source} onto {@code target}.
     *
     * @return a raster with the source's band count and the target's grid and georeference
     * @throws ResampleException if a CRS is unknown or the source does not overlap the target grid
     */
    public Raster align(Raster source, GridSpec target, Interpolation interpolation) throws ResampleException {
        if (source == null || target == null) {
            throw new IllegalArgumentException("source and target must not be null");
        }
        if (interpolation == null) interpolation = Interpolation.CUBIC;

        GeoReference srcRef = source.getGeoReference();
        GeoReference dstRef = target.getGeoReference();
        CoordinateTransform ct = transformBetween(dstRef, srcRef);

        int w = target.getWidth();
        int h = target.getHeight();
        int bands = source.getBandCount();
        int srcW = source.getWidth();
        int srcH = source.getHeight();

        List<double[][]> out = new ArrayList<>(bands);
        for (int b = 0; b < bands; b++) out.add(new double[h][w]);

        double[] srcCol = new double[w];
        double[] srcRow = new double[w];
        long inside = 0;

        for (int row = 0; row < h; row++) {
            sourcePixelsForRow(row, w, dstRef, srcRef, ct, srcCol, srcRow);

            for (int col = 0; col < w; col++) {
                double sc = srcCol[col], sr = srcRow[col];
                // footprint is [0, srcW] x [0, srcH] in corner based pixel coordinates
                if (!(sc >= 0.0 && sc <= srcW && sr >= 0.0 && sr <= srcH)) {
                    continue;
                }
                inside++;
                for (int b = 0; b < bands; b++) {
                    out.get(b)[row][col] = sample(source.getBand(b), srcW, srcH, sc, sr, interpolation);
                }
            }
        }

        if (inside == 0) {
            throw new ResampleException("source grid " + source.getGridSpec()
                    + " does not overlap target grid " + target);
        }
        log.debug("aligned {}x{}x{} onto {}x{} ({} of {} pixels inside source footprint, {})",
                  srcW, srcH, bands, w, h, inside, (long) w * h, interpolation);

        return new Raster(out, dstRef);
    }

    /**
     * Aligns the raster at {@code source} onto the grid of the raster at {@code target} and
     * writes it to {@code output}, replacing whatever is there.
     */
    public Path alignFile(Path source, Path target, Path output, Interpolation interpolation) throws ResampleException {
        GridSpec grid;
        try (GeoTiffDataset ds = GeoTiffDataset.open(target)) {
            grid = ds.getGridSpec();
        }
        catch (RasterFormatException e) {
            throw new ResampleException("Cannot read target grid: " + e.getMessage(), e);
        }

        Raster src;
        try {
            src = GeoTiffRasterIO.load(source);
        }
        catch (RasterFormatException e) {
            throw new ResampleException("Cannot read source raster: " + e.getMessage(), e);
        }

        log.info("resampling {} onto the grid of {}", source, target);
        Raster aligned = align(src, grid, interpolation);

        try {
            GeoTiffRasterIO.save(output, aligned);
        }
        catch (IOException e) {
            throw new ResampleException("Cannot write resampled raster " + output + ": " + e.getMessage(), e);
        }

        if (!Files.isRegularFile(output)) {
            throw new ResampleException("Resampled raster " + output + " was not created");
        }
        return output;
    }

    // target -> source transform, or null when no reprojection is needed
    private static CoordinateTransform transformBetween(GeoReference from, GeoReference to) throws ResampleException {
        String fromCrs = from.getHorizontalCRS();
        String toCrs = to.getHorizontalCRS();
        if (fromCrs == null || toCrs == null) {
            if (fromCrs != null || toCrs != null) {
                log.warn("CRS known on one side only ({} vs {}); assuming both grids share it", fromCrs, toCrs);
            }
            return null;
        }
        if (fromCrs.equalsIgnoreCase(toCrs)) {
            return null;
        }
        try {
            log.debug("reprojecting {} -> {}", fromCrs, toCrs);
            return CrsSupport.transform(fromCrs, toCrs);
        }
        catch (IllegalArgumentException | Proj4jException e) {
            throw new ResampleException("Unsupported CRS pair " + fromCrs + " -> " + toCrs + ": " + e.getMessage(), e);
        }
    }

    // fills continuous source pixel coordinates for the centres of one target row
    private void sourcePixelsForRow(int row, int w, GeoReference dstRef, GeoReference srcRef,
                                    CoordinateTransform ct, double[] srcCol, double[] srcRow) {
        double y = row + 0.5;

        if (ct == null) {
            for (int col = 0; col < w; col++) {
                double[] world = dstRef.worldFromPixel(col + 0.5, y);
                double[] px = srcRef.pixelFromWorld(world[0], world[1]);
                srcCol[col] = px[0];
                srcRow[col] = px[1];
            }
            return;
        }

        // exact at control points, linear in between
        int prev = -1;
        double prevX = 0, prevY = 0;
        for (int col = 0; ; col = Math.min(col + reprojectionStep, w - 1)) {
            double[] world = dstRef.worldFromPixel(col + 0.5, y);
            double[] xy = reproject(ct, world[0], world[1]);
            double[] px = srcRef.pixelFromWorld(xy[0], xy[1]);

            if (prev >= 0) {
                int span = col - prev;
                for (int i = 1; i < span; i++) {
                    double f = (double) i / span;
                    srcCol[prev + i] = prevX + f * (px[0] - prevX);
                    srcRow[prev + i] = prevY + f * (px[1] - prevY);
                }
            }
            srcCol[col] = px[0];
            srcRow[col] = px[1];
            prev = col;
            prevX = px[0];
            prevY = px[1];

            if (col == w - 1) break;
        }
    }

    private static double[] reproject(CoordinateTransform ct, double x, double y) {
        ProjCoordinate src = new ProjCoordinate(x, y);
        ProjCoordinate dst = new ProjCoordinate();
        try {
            ct.transform(src, dst);
        }
        catch (Proj4jException e) {
            // outside the projection's domain; the pixel ends up as nodata
            log.trace("cannot reproject ({}, {}): {}", x, y, e.getMessage());
            return new double[] { Double.NaN, Double.NaN };
        }
        return new double[] { dst.x, dst.y };
    }

    // sc/sr are corner based; sample centres sit at i + 0.5
    static double sample(double[][] band, int srcW, int srcH, double sc, double sr, Interpolation interpolation) {
        if (interpolation.radius() == 0) {
            int i = clamp((int) Math.floor(sc), srcW);
            int j = clamp((int) Math.floor(sr), srcH);
            return band[j][i];
        }

        double u = sc - 0.5;
        double v = sr - 0.5;
        int iu = (int) Math.floor(u);
        int iv = (int) Math.floor(v);
        int r = interpolation.radius();

        double sum = 0.0, wsum = 0.0;
        for (int j = iv - r + 1; j <= iv + r; j++) {
            double wy = interpolation.weight(v - j);
            if (wy == 0.0) continue;
            double[] line = band[clamp(j, srcH)];
            for (int i = iu - r + 1; i <= iu + r; i++) {
                double wx = interpolation.weight(u - i);
                if (wx == 0.0) continue;
                sum += wx * wy * line[clamp(i, srcW)];
                wsum += wx * wy;
            }
        }
        return wsum == 0.0 ? 0.0 : sum / wsum;
    }

    private static int clamp(int i, int n) {
        return i < 0 ? 0 : (i >= n ? n - 1 : i);
    }

} // GridResampler
