package com.lshann.common;

import java.util.SplittableRandom;

/**
 * Small numeric helpers shared by the hash families.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    public static double norm(float[] v) {
        return Math.sqrt(dot(v, v));
    }

    /** Box-Muller from a uniform SplittableRandom (deterministic for a fixed seed). */
    public static double nextGaussian(SplittableRandom r) {
        double u1 = Math.max(Double.MIN_VALUE, r.nextDouble());
        double u2 = r.nextDouble();
        double mag = Math.sqrt(-2.0 * Math.log(u1));
        return mag * Math.cos(2.0 * Math.PI * u2);
    }

    /** Rows of independent standard normal samples, drawn row-major. */
    public static float[][] gaussianMatrix(SplittableRandom r, int rows, int cols) {
        float[][] m = new float[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                m[i][j] = (float) nextGaussian(r);
            }
        }
        return m;
    }
}
