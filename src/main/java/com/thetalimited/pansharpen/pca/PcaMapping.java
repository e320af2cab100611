// PcaMapping.java
// what it takes to go back from component space to band space:
// band means, eigenvectors (columns, descending eigenvalue) and eigenvalues

package com.thetalimited.pansharpen.pca;

public final class PcaMapping
{
    private final double[] mean;          // [band]
    private final double[][] eigenvectors; // [band][component]
    private final double[] eigenvalues;   // [component], descending

    PcaMapping(double[] mean, double[][] eigenvectors, double[] eigenvalues) {
        this.mean = mean;
        this.eigenvectors = eigenvectors;
        this.eigenvalues = eigenvalues;
    }

    public int getBands() { return mean.length; }
    public int getComponents() { return eigenvalues.length; }

    public double[] getMean() { return mean.clone(); }
    public double[] getEigenvalues() { return eigenvalues.clone(); }

    public double[][] getEigenvectors() {
        double[][] copy = new double[eigenvectors.length][];
        for (int i = 0; i < eigenvectors.length; i++) copy[i] = eigenvectors[i].clone();
        return copy;
    }

    double mean(int band) { return mean[band]; }
    double eigenvector(int band, int component) { return eigenvectors[band][component]; }

} // PcaMapping
