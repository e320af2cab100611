// Interpolation.java
// separable resampling kernels, evaluated at a distance t (in source pixels)
// from the sample position

package com.thetalimited.pansharpen.resample;

public enum Interpolation
{
    NEAREST(0) {
        @Override
        public double weight(double t) {
            return 1.0;
        }
    },

    BILINEAR(1) {
        @Override
        public double weight(double t) {
            double a = Math.abs(t);
            return a < 1.0 ? 1.0 - a : 0.0;
        }
    },

    // Keys cubic convolution, a = -0.5 (same as GDAL's cubic)
    CUBIC(2) {
        @Override
        public double weight(double t) {
            final double a = -0.5;
            double x = Math.abs(t);
            if (x <= 1.0) {
                return ((a + 2.0) * x - (a + 3.0)) * x * x + 1.0;
            }
            if (x < 2.0) {
                return ((a * x - 5.0 * a) * x + 8.0 * a) * x - 4.0 * a;
            }
            return 0.0;
        }
    };

    private final int radius;

    Interpolation(int radius) {
        this.radius = radius;
    }

    /** Half width of the kernel support in source pixels; 0 means nearest neighbour. */
    public int radius() { return radius; }

    public abstract double weight(double t);

} // Interpolation
