// PcaPansharpener.java
// PCA component substitution: the first principal component of the
// multispectral bands is swapped for the intensity-matched pan band
// and the cube is transformed back

package com.thetalimited.pansharpen.fusion;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.pansharpen.pca.ImageCube;
import com.thetalimited.pansharpen.pca.PcaResult;
import com.thetalimited.pansharpen.pca.PcaTransform;

public class PcaPansharpener
{
    private static final Logger log = LoggerFactory.getLogger(PcaPansharpener.class);

    private final boolean restoreNoData;

    public PcaPansharpener() {
        this(true);
    }

    /**
     * @param restoreNoData when true, pixels that were nodata in the multispectral cube
     *                      or zero in the pan band come out as 0 in every band
     */
    public PcaPansharpener(boolean restoreNoData) {
        this.restoreNoData = restoreNoData;
    }

    public boolean isRestoreNoData() { return restoreNoData; }

    /**
     * Fuses co-registered bands with a pan band of the same dimensions.
     *
     * @param nir may be null for a 3-band image
     * @return sharpened bands in input order: red, green, blue[, nir]
     */
    public List<double[][]> fuse(double[][] red, double[][] green, double[][] blue,
                                 double[][] nir, double[][] pan) {
        if (red == null || green == null || blue == null || pan == null) {
            throw new IllegalArgumentException("red, green, blue and pan bands are required");
        }

        List<double[][]> bands = new ArrayList<>(4);
        bands.add(red);
        bands.add(green);
        bands.add(blue);
        if (nir != null) bands.add(nir);

        ImageCube cube = ImageCube.stack(bands);
        int w = cube.getWidth();
        int h = cube.getHeight();
        double[] panValues = flatten(pan, w, h);

        PcaResult pca = PcaTransform.forward(cube);
        ImageCube projected = pca.getProjected();

        // intensity match of pan against the projected data
        double[] fStats = projectedStats(projected);
        double[] panStats = panStats(panValues);
        double scale = panStats[1] == 0.0 ? 0.0 : fStats[1] / panStats[1];
        log.debug("intensity match: mean(F)={} std(F)={} mean(pan)={} std(pan)={} scale={}",
                  fStats[0], fStats[1], panStats[0], panStats[1], scale);
        if (panStats[1] == 0.0) {
            log.warn("pan band has no variance; first component is replaced by a constant");
        }

        int pixels = cube.getPixelCount();
        for (int p = 0; p < pixels; p++) {
            projected.set(p, 0, (panValues[p] - panStats[0]) * scale + fStats[0]);
        }

        ImageCube sharpened = PcaTransform.inverse(projected, pca.getMapping());

        if (restoreNoData) {
            int restored = 0;
            for (int p = 0; p < pixels; p++) {
                if (!cube.isValid(p) || ImageCube.isNoData(panValues[p])) {
                    for (int b = 0; b < sharpened.getDimensions(); b++) sharpened.set(p, b, 0.0);
                    restored++;
                }
            }
            log.debug("{} nodata pixels restored to 0", restored);
        }

        return sharpened.toBands();
    }

    // {mean, population std} over every component of every valid pixel
    private static double[] projectedStats(ImageCube projected) {
        int k = projected.getDimensions();
        double sum = 0.0;
        long n = 0;
        for (int p = 0; p < projected.getPixelCount(); p++) {
            if (!projected.isValid(p)) continue;
            for (int c = 0; c < k; c++) sum += projected.get(p, c);
            n += k;
        }
        if (n == 0) return new double[] { 0.0, 0.0 };
        double mean = sum / n;

        double ss = 0.0;
        for (int p = 0; p < projected.getPixelCount(); p++) {
            if (!projected.isValid(p)) continue;
            for (int c = 0; c < k; c++) {
                double d = projected.get(p, c) - mean;
                ss += d * d;
            }
        }
        return new double[] { mean, Math.sqrt(ss / n) };
    }

    // {mean, population std} over every pan pixel, zeros included; NaN is skipped
    private static double[] panStats(double[] pan) {
        double sum = 0.0;
        long n = 0;
        for (double v : pan) {
            if (Double.isNaN(v)) continue;
            sum += v;
            n++;
        }
        if (n == 0) return new double[] { 0.0, 0.0 };
        double mean = sum / n;

        double ss = 0.0;
        for (double v : pan) {
            if (Double.isNaN(v)) continue;
            ss += (v - mean) * (v - mean);
        }
        return new double[] { mean, Math.sqrt(ss / n) };
    }

    private static double[] flatten(double[][] plane, int w, int h) {
        if (plane.length != h) {
            throw new IllegalArgumentException("pan band has " + plane.length + " rows, expected " + h);
        }
        double[] out = new double[w * h];
        for (int r = 0; r < h; r++) {
            if (plane[r] == null || plane[r].length != w) {
                throw new IllegalArgumentException("pan band row " + r + " does not have " + w + " columns");
            }
            System.arraycopy(plane[r], 0, out, r * w, w);
        }
        return out;
    }

} // PcaPansharpener
