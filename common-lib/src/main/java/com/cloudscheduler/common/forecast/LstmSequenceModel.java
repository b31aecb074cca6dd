package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.exception.ModelInferenceException;

/**
 * Forward pass of a stacked LSTM followed by a linear head applied to the last hidden state.
 * Hidden and cell states start at zero for every window; dropout is inactive at inference.
 */
public final class LstmSequenceModel implements SequenceModel {

    private static final String MODEL_NAME = "LstmSequenceModel";

    private final LstmWeights weights;

    public LstmSequenceModel(LstmWeights weights) {
        this.weights = weights;
    }

    @Override
    public double[] predictNext(double[][] window) {
        if (window == null || window.length == 0) {
            throw new ModelInferenceException(MODEL_NAME, "Empty input window");
        }
        int hidden = weights.hiddenSize();
        double[][] h = new double[weights.numLayers()][hidden];
        double[][] c = new double[weights.numLayers()][hidden];

        for (double[] step : window) {
            if (step.length != weights.inputSize()) {
                throw new ModelInferenceException(MODEL_NAME, "Expected " + weights.inputSize()
                    + " input features, got " + step.length);
            }
            double[] x = step;
            for (int l = 0; l < weights.numLayers(); l++) {
                cell(weights.layer(l), x, h[l], c[l]);
                x = h[l];
            }
        }

        double[] top = h[weights.numLayers() - 1];
        double[][] fc = weights.outputWeights();
        double[] output = weights.outputBias().clone();
        for (int o = 0; o < output.length; o++) {
            output[o] += dot(fc[o], top);
            if (!Double.isFinite(output[o])) {
                throw new ModelInferenceException(MODEL_NAME, "Non-finite output at index " + o);
            }
        }
        return output;
    }

    /** Updates {@code h} and {@code c} in place for one time step. */
    private static void cell(LstmWeights.Layer layer, double[] x, double[] h, double[] c) {
        int hidden = h.length;
        double[] gates = new double[4 * hidden];
        for (int g = 0; g < gates.length; g++) {
            gates[g] = dot(layer.inputWeights()[g], x) + layer.inputBias()[g]
                     + dot(layer.recurrentWeights()[g], h) + layer.recurrentBias()[g];
        }
        for (int j = 0; j < hidden; j++) {
            double input  = sigmoid(gates[j]);
            double forget = sigmoid(gates[hidden + j]);
            double update = Math.tanh(gates[2 * hidden + j]);
            double output = sigmoid(gates[3 * hidden + j]);
            c[j] = forget * c[j] + input * update;
            h[j] = output * Math.tanh(c[j]);
        }
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double sigmoid(double v) {
        return 1.0 / (1.0 + Math.exp(-v));
    }
}
