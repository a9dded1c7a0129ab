package com.policyparser.discovery.scoring;

import org.springframework.stereotype.Component;

/**
 * Forward pass and single-step backpropagation over a {@link ScoringModel}. Holds no state.
 */
@Component
public class NeuralScorer {

    // smallest distance kept from 0 and 1 so saturated outputs stay inside the open interval
    private static final double EDGE = 1e-12;

    public double predict(ScoringModel model, double[] input) {
        checkInput(model, input);
        double[] hidden = layer(model.ih(), model.bh(), input);
        double out = layer(model.ho(), model.bo(), hidden)[0];
        return Math.min(1 - EDGE, Math.max(EDGE, out));
    }

    public ScoringModel train(ScoringModel model, double[] input, double target) {
        checkInput(model, input);
        if (target < 0 || target > 1) throw new IllegalArgumentException("target must be in [0,1], was " + target);

        double[][] wih = model.weightsIh();
        double[][] who = model.weightsHo();
        double[] bh = model.biasH();
        double[] bo = model.biasO();
        double lr = model.learningRate();

        double[] hidden = layer(wih, bh, input);
        double[] outputs = layer(who, bo, hidden);

        double[] outputErrors = new double[outputs.length];
        double[] outputGradients = new double[outputs.length];
        for (int o = 0; o < outputs.length; o++) {
            outputErrors[o] = target - outputs[o];
            outputGradients[o] = outputs[o] * (1 - outputs[o]) * outputErrors[o] * lr;
        }
        for (int o = 0; o < who.length; o++) {
            for (int h = 0; h < hidden.length; h++) {
                who[o][h] += outputGradients[o] * hidden[h];
            }
            bo[o] += outputGradients[o];
        }

        // hidden errors are taken through the already-updated output weights
        double[] hiddenGradients = new double[hidden.length];
        for (int h = 0; h < hidden.length; h++) {
            double err = 0;
            for (int o = 0; o < who.length; o++) err += who[o][h] * outputErrors[o];
            hiddenGradients[h] = hidden[h] * (1 - hidden[h]) * err * lr;
        }
        for (int h = 0; h < wih.length; h++) {
            for (int i = 0; i < input.length; i++) {
                wih[h][i] += hiddenGradients[h] * input[i];
            }
            bh[h] += hiddenGradients[h];
        }

        return new ScoringModel(model.inputNodes(), model.hiddenNodes(), model.outputNodes(),
                wih, who, bh, bo, lr, model.generation() + 1);
    }

    private static void checkInput(ScoringModel model, double[] input) {
        if (input == null) throw new DimensionMismatchException("features", model.inputNodes(), 0);
        if (input.length != model.inputNodes()) {
            throw new DimensionMismatchException("features", model.inputNodes(), input.length);
        }
    }

    private static double[] layer(double[][] weights, double[] bias, double[] in) {
        double[] out = new double[weights.length];
        for (int r = 0; r < weights.length; r++) {
            double sum = bias[r];
            for (int c = 0; c < in.length; c++) sum += weights[r][c] * in[c];
            out[r] = sigmoid(sum);
        }
        return out;
    }

    static double sigmoid(double x) {
        return 1 / (1 + Math.exp(-x));
    }
}
