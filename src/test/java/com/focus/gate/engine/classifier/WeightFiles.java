package com.focus.gate.engine.classifier;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Writes weight files in the reader's format for tests.
 */
final class WeightFiles {

    private WeightFiles() {
    }

    static byte[] write(String layout, String version, List<DenseLayer> layers) {
        try {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            DataOutputStream out = new DataOutputStream(bytes);
            out.writeInt(WeightFileReader.MAGIC);
            out.writeInt(WeightFileReader.FORMAT_VERSION);
            out.writeUTF(layout);
            out.writeUTF(version);
            out.writeInt(layers.size());
            for (DenseLayer layer : layers) {
                out.writeInt(layer.inputSize());
                out.writeInt(layer.outputSize());
                for (float w : layer.weights()) {
                    out.writeFloat(w);
                }
                for (float b : layer.bias()) {
                    out.writeFloat(b);
                }
            }
            out.flush();
            return bytes.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Network whose output layer is all zeros except the bias, so every input scores sigmoid(bias). */
    static List<DenseLayer> constantNetwork(int inputs, float outputBias) {
        return List.of(
                zeros(inputs, 256, 0f),
                zeros(256, 128, 0f),
                zeros(128, 64, 0f),
                zeros(64, 1, outputBias));
    }

    static DenseLayer zeros(int in, int out, float bias) {
        float[] b = new float[out];
        java.util.Arrays.fill(b, bias);
        return new DenseLayer(in, out, new float[in * out], b);
    }
}
