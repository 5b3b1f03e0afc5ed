package com.focus.gate.engine.classifier;

import com.focus.gate.engine.feature.FeatureVector;
import com.focus.gate.model.AdmissionAction;

import java.util.List;
import java.util.Random;

public class ProductivityClassifier {

    static final int[] HIDDEN_SIZES = {256, 128, 64};

    private final List<DenseLayer> layers;
    private final double threshold;
    private final boolean trained;
    private final String version;

    public ProductivityClassifier(List<DenseLayer> layers, double threshold, boolean trained, String version) {
        validate(layers);
        this.layers = List.copyOf(layers);
        this.threshold = threshold;
        this.trained = trained;
        this.version = version;
    }

    public static ProductivityClassifier untrained(int inputSize, double threshold, long seed) {
        Random random = new Random(seed);
        int[] sizes = {inputSize, HIDDEN_SIZES[0], HIDDEN_SIZES[1], HIDDEN_SIZES[2], 1};
        DenseLayer[] layers = new DenseLayer[sizes.length - 1];
        for (int l = 0; l < layers.length; l++) {
            int in = sizes[l];
            int out = sizes[l + 1];
            double bound = 1.0 / Math.sqrt(in);
            float[] weights = new float[in * out];
            float[] bias = new float[out];
            for (int i = 0; i < weights.length; i++) {
                weights[i] = (float) ((random.nextDouble() * 2 - 1) * bound);
            }
            for (int i = 0; i < bias.length; i++) {
                bias[i] = (float) ((random.nextDouble() * 2 - 1) * bound);
            }
            layers[l] = new DenseLayer(in, out, weights, bias);
        }
        return new ProductivityClassifier(List.of(layers), threshold, false, "untrained-" + seed);
    }

    public Prediction predict(FeatureVector features) {
        double probability = score(features.toArray());
        AdmissionAction action = probability > threshold ? AdmissionAction.ALLOW : AdmissionAction.BLOCK;
        return new Prediction(probability, action);
    }

    double score(float[] input) {
        if (input.length != inputSize()) {
            throw new IllegalArgumentException("Expected " + inputSize() + " inputs, got " + input.length);
        }
        float[] activation = input;
        for (int l = 0; l < layers.size(); l++) {
            activation = layers.get(l).forward(activation);
            if (l < layers.size() - 1) {
                relu(activation);
            }
        }
        return sigmoid(activation[0]);
    }

    public int inputSize() {
        return layers.get(0).inputSize();
    }

    public double threshold() {
        return threshold;
    }

    public boolean trained() {
        return trained;
    }

    public String version() {
        return version;
    }

    List<DenseLayer> layers() {
        return layers;
    }

    private static void relu(float[] values) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] < 0) {
                values[i] = 0;
            }
        }
    }

    private static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    private static void validate(List<DenseLayer> layers) {
        if (layers.size() != HIDDEN_SIZES.length + 1) {
            throw new ModelLoadException("Expected " + (HIDDEN_SIZES.length + 1) + " layers, got " + layers.size());
        }
        for (int l = 0; l < HIDDEN_SIZES.length; l++) {
            if (layers.get(l).outputSize() != HIDDEN_SIZES[l]) {
                throw new ModelLoadException("Layer " + l + " must have " + HIDDEN_SIZES[l]
                        + " outputs, got " + layers.get(l).outputSize());
            }
        }
        for (int l = 1; l < layers.size(); l++) {
            if (layers.get(l).inputSize() != layers.get(l - 1).outputSize()) {
                throw new ModelLoadException("Layer " + l + " input does not match previous layer output");
            }
        }
        if (layers.get(layers.size() - 1).outputSize() != 1) {
            throw new ModelLoadException("Output layer must have a single unit");
        }
    }
}
