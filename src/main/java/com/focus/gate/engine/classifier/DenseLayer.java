package com.focus.gate.engine.classifier;

public final class DenseLayer {

    private final int inputSize;
    private final int outputSize;
    private final float[] weights;
    private final float[] bias;

    public DenseLayer(int inputSize, int outputSize, float[] weights, float[] bias) {
        if (weights.length != inputSize * outputSize) {
            throw new IllegalArgumentException("Expected " + inputSize * outputSize + " weights, got " + weights.length);
        }
        if (bias.length != outputSize) {
            throw new IllegalArgumentException("Expected " + outputSize + " biases, got " + bias.length);
        }
        this.inputSize = inputSize;
        this.outputSize = outputSize;
        this.weights = weights;
        this.bias = bias;
    }

    public int inputSize() {
        return inputSize;
    }

    public int outputSize() {
        return outputSize;
    }

    float[] weights() {
        return weights;
    }

    float[] bias() {
        return bias;
    }

    float[] forward(float[] input) {
        float[] out = new float[outputSize];
        for (int o = 0; o < outputSize; o++) {
            double sum = bias[o];
            int row = o * inputSize;
            for (int i = 0; i < inputSize; i++) {
                sum += weights[row + i] * input[i];
            }
            out[o] = (float) sum;
        }
        return out;
    }
}
