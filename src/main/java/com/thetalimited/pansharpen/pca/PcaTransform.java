// PcaTransform.java
// forward and inverse principal component transform over an ImageCube
//
// Statistics (band means, covariance) use only valid pixels. Every pixel is
// projected; a nodata element contributes as if it held the band mean.

package com.thetalimited.pansharpen.pca;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealVector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PcaTransform
{
    private static final Logger log = LoggerFactory.getLogger(PcaTransform.class);

    private PcaTransform() {}

    /** Full-rank forward transform: as many components as bands. */
    public static PcaResult forward(ImageCube cube) {
        return forward(cube, cube.getDimensions());
    }

    /**
     * Projects the cube onto its leading principal components.
     *
     * @param dimensions number of components to keep; values above the band count are clamped
     */
    public static PcaResult forward(ImageCube cube, int dimensions) {
        if (cube == null) {
            throw new IllegalArgumentException("cube must not be null");
        }
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be >= 1, got " + dimensions);
        }
        int d = cube.getDimensions();
        int k = Math.min(dimensions, d);

        double[] mean = maskedMean(cube);
        double[][] cov = maskedCovariance(cube, mean);

        double[][] vectors = new double[d][k];
        double[] eigenvalues = new double[k];

        if (isZero(cov)) {
            // nothing varies; keep the band axes
            for (int c = 0; c < k; c++) vectors[c][c] = 1.0;
        }
        else {
            EigenDecomposition eig = new EigenDecomposition(new Array2DRowRealMatrix(cov, false));
            double[] values = eig.getRealEigenvalues();

            // descending by eigenvalue; the decomposition does not promise an order
            Integer[] order = IntStream.range(0, d).boxed().toArray(Integer[]::new);
            Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).reversed());

            for (int c = 0; c < k; c++) {
                int src = order[c];
                eigenvalues[c] = values[src];
                RealVector v = eig.getEigenvector(src);
                for (int b = 0; b < d; b++) {
                    vectors[b][c] = v.getEntry(b);
                }
            }
        }
        log.debug("eigenvalues {}", Arrays.toString(eigenvalues));

        PcaMapping mapping = new PcaMapping(mean, vectors, eigenvalues);

        int pixels = cube.getPixelCount();
        double[][] projected = new double[k][pixels];
        double[] centered = new double[d];
        for (int p = 0; p < pixels; p++) {
            for (int b = 0; b < d; b++) {
                double x = cube.get(p, b);
                centered[b] = ImageCube.isNoData(x) ? 0.0 : x - mean[b];
            }
            for (int c = 0; c < k; c++) {
                double s = 0.0;
                for (int b = 0; b < d; b++) s += centered[b] * vectors[b][c];
                projected[c][p] = s;
            }
        }
        return new PcaResult(ImageCube.withMask(projected, cube), mapping);
    }

    /** Maps component-space data back to band space: projected x E^T + mean. */
    public static ImageCube inverse(ImageCube projected, PcaMapping mapping) {
        if (projected.getDimensions() != mapping.getComponents()) {
            throw new IllegalArgumentException("projected cube has " + projected.getDimensions()
                    + " components, mapping expects " + mapping.getComponents());
        }
        int d = mapping.getBands();
        int k = mapping.getComponents();
        int pixels = projected.getPixelCount();

        double[][] out = new double[d][pixels];
        for (int p = 0; p < pixels; p++) {
            for (int b = 0; b < d; b++) {
                double s = mapping.mean(b);
                for (int c = 0; c < k; c++) s += projected.get(p, c) * mapping.eigenvector(b, c);
                out[b][p] = s;
            }
        }
        return ImageCube.withMask(out, projected);
    }

    private static boolean isZero(double[][] m) {
        for (double[] row : m) {
            for (double v : row) if (v != 0.0) return false;
        }
        return true;
    }

    static double[] maskedMean(ImageCube cube) {
        int d = cube.getDimensions();
        double[] sum = new double[d];
        int n = 0;
        for (int p = 0; p < cube.getPixelCount(); p++) {
            if (!cube.isValid(p)) continue;
            n++;
            for (int b = 0; b < d; b++) sum[b] += cube.get(p, b);
        }
        if (n == 0) {
            log.warn("no valid pixels in a {}x{} cube; using zero band means", cube.getWidth(), cube.getHeight());
            return new double[d];
        }
        for (int b = 0; b < d; b++) sum[b] /= n;
        return sum;
    }

    // sample covariance (n - 1) over valid pixels; NaN/Inf entries become 0
    static double[][] maskedCovariance(ImageCube cube, double[] mean) {
        int d = cube.getDimensions();
        double[][] cov = new double[d][d];
        int n = 0;
        for (int p = 0; p < cube.getPixelCount(); p++) {
            if (!cube.isValid(p)) continue;
            n++;
            for (int i = 0; i < d; i++) {
                double di = cube.get(p, i) - mean[i];
                for (int j = i; j < d; j++) {
                    cov[i][j] += di * (cube.get(p, j) - mean[j]);
                }
            }
        }

        int replaced = 0;
        for (int i = 0; i < d; i++) {
            for (int j = i; j < d; j++) {
                double v = n > 0 ? cov[i][j] / (n - 1) : 0.0;
                if (Double.isNaN(v) || Double.isInfinite(v)) {
                    v = 0.0;
                    replaced++;
                }
                cov[i][j] = v;
                cov[j][i] = v;
            }
        }
        if (replaced > 0) {
            log.debug("covariance had {} non-finite entries ({} valid pixels); set to 0", replaced, n);
        }
        return cov;
    }

} // PcaTransform
