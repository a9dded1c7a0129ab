package com.policyparser.discovery.scoring;

import java.util.Random;

/**
 * Weights of the link scoring network: input(24) -> hidden(16) -> output(1). Instances are
 * immutable; training produces a new instance with the generation advanced by one.
 */
public final class ScoringModel {
    public static final int INPUT_NODES = FeatureExtractor.FEATURE_COUNT;
    public static final int HIDDEN_NODES = 16;
    public static final int OUTPUT_NODES = 1;
    public static final double DEFAULT_LEARNING_RATE = 0.1;

    private final int inputNodes;
    private final int hiddenNodes;
    private final int outputNodes;
    private final double[][] weightsIh;
    private final double[][] weightsHo;
    private final double[] biasH;
    private final double[] biasO;
    private final double learningRate;
    private final long generation;

    public ScoringModel(int inputNodes, int hiddenNodes, int outputNodes,
                        double[][] weightsIh, double[][] weightsHo,
                        double[] biasH, double[] biasO,
                        double learningRate, long generation) {
        checkShape("weights_ih", weightsIh, hiddenNodes, inputNodes);
        checkShape("weights_ho", weightsHo, outputNodes, hiddenNodes);
        checkLength("bias_h", biasH, hiddenNodes);
        checkLength("bias_o", biasO, outputNodes);
        if (generation < 0) throw new IllegalArgumentException("generation must be >= 0");
        this.inputNodes = inputNodes;
        this.hiddenNodes = hiddenNodes;
        this.outputNodes = outputNodes;
        this.weightsIh = copy(weightsIh);
        this.weightsHo = copy(weightsHo);
        this.biasH = biasH.clone();
        this.biasO = biasO.clone();
        this.learningRate = learningRate;
        this.generation = generation;
    }

    /**
     * Fresh model with Gaussian weights scaled by 1/sqrt(fan-in) and zero biases.
     */
    public static ScoringModel initialize(Random random, double learningRate) {
        double[][] ih = gaussian(random, HIDDEN_NODES, INPUT_NODES);
        double[][] ho = gaussian(random, OUTPUT_NODES, HIDDEN_NODES);
        return new ScoringModel(INPUT_NODES, HIDDEN_NODES, OUTPUT_NODES, ih, ho,
                new double[HIDDEN_NODES], new double[OUTPUT_NODES], learningRate, 0);
    }

    private static double[][] gaussian(Random random, int rows, int cols) {
        double scale = 1.0 / Math.sqrt(cols);
        double[][] m = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                m[i][j] = random.nextGaussian() * scale;
            }
        }
        return m;
    }

    public int inputNodes() {
        return inputNodes;
    }

    public int hiddenNodes() {
        return hiddenNodes;
    }

    public int outputNodes() {
        return outputNodes;
    }

    public double learningRate() {
        return learningRate;
    }

    public long generation() {
        return generation;
    }

    public double[][] weightsIh() {
        return copy(weightsIh);
    }

    public double[][] weightsHo() {
        return copy(weightsHo);
    }

    public double[] biasH() {
        return biasH.clone();
    }

    public double[] biasO() {
        return biasO.clone();
    }

    // read-only views for the scorer
    double[][] ih() {
        return weightsIh;
    }

    double[][] ho() {
        return weightsHo;
    }

    double[] bh() {
        return biasH;
    }

    double[] bo() {
        return biasO;
    }

    private static void checkShape(String name, double[][] m, int rows, int cols) {
        if (m == null) throw new IllegalArgumentException(name + " is missing");
        if (m.length != rows) throw new DimensionMismatchException(name + " rows", rows, m.length);
        for (double[] row : m) {
            if (row == null || row.length != cols) {
                throw new DimensionMismatchException(name + " columns", cols, row == null ? 0 : row.length);
            }
        }
    }

    private static void checkLength(String name, double[] v, int length) {
        if (v == null) throw new IllegalArgumentException(name + " is missing");
        if (v.length != length) throw new DimensionMismatchException(name, length, v.length);
    }

    private static double[][] copy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) out[i] = m[i].clone();
        return out;
    }
}
