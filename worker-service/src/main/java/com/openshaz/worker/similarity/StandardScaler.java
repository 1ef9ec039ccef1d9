package com.openshaz.worker.similarity;

/**
 * Per-column standardization {@code (x - mean) / stddev} using the population standard
 * deviation. Columns with zero spread keep a scale of 1 so they pass through centered.
 * Statistics are fixed at construction and never refitted on queries.
 */
public final class StandardScaler {

    private final double[] mean;
    private final double[] scale;

    private StandardScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    public static StandardScaler fit(double[][] matrix) {
        int rows = matrix.length;
        int columns = matrix[0].length;
        double[] mean = new double[columns];
        double[] scale = new double[columns];

        for (double[] row : matrix) {
            for (int c = 0; c < columns; c++) {
                mean[c] += row[c];
            }
        }
        for (int c = 0; c < columns; c++) {
            mean[c] /= rows;
        }

        for (double[] row : matrix) {
            for (int c = 0; c < columns; c++) {
                double diff = row[c] - mean[c];
                scale[c] += diff * diff;
            }
        }
        for (int c = 0; c < columns; c++) {
            double std = Math.sqrt(scale[c] / rows);
            scale[c] = std == 0.0 ? 1.0 : std;
        }
        return new StandardScaler(mean, scale);
    }

    public double[] transform(double[] vector) {
        double[] out = new double[vector.length];
        for (int c = 0; c < vector.length; c++) {
            out[c] = (vector[c] - mean[c]) / scale[c];
        }
        return out;
    }

    public void transformInPlace(double[][] matrix) {
        for (double[] row : matrix) {
            for (int c = 0; c < row.length; c++) {
                row[c] = (row[c] - mean[c]) / scale[c];
            }
        }
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getScale() {
        return scale.clone();
    }
}
