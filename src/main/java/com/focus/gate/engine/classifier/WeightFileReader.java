package com.focus.gate.engine.classifier;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads versioned classifier weight files.
 *
 * <pre>
 *   magic        4 bytes  "FGCW"
 *   format       int      1
 *   layout       UTF      feature layout the weights were trained against
 *   modelVersion UTF
 *   layerCount   int
 *   per layer:   int in, int out, float[out*in] weights, float[out] bias
 * </pre>
 * All values big-endian.
 */
public class WeightFileReader {

    public static final int MAGIC = 0x46474357; // "FGCW"
    public static final int FORMAT_VERSION = 1;

    private static final int MAX_LAYER_UNITS = 1 << 16;

    private final String expectedLayout;

    public WeightFileReader(String expectedLayout) {
        this.expectedLayout = expectedLayout;
    }

    public ProductivityClassifier read(InputStream in, double threshold) {
        try {
            DataInputStream data = new DataInputStream(in);
            if (data.readInt() != MAGIC) {
                throw new ModelLoadException("Not a classifier weight file");
            }
            int format = data.readInt();
            if (format != FORMAT_VERSION) {
                throw new ModelLoadException("Unsupported weight file format " + format);
            }
            String layout = data.readUTF();
            if (!expectedLayout.equals(layout)) {
                throw new ModelLoadException("Weights trained for feature layout " + layout
                        + ", extractor produces " + expectedLayout);
            }
            String modelVersion = data.readUTF();

            int layerCount = data.readInt();
            if (layerCount <= 0 || layerCount > 16) {
                throw new ModelLoadException("Implausible layer count " + layerCount);
            }
            List<DenseLayer> layers = new ArrayList<>(layerCount);
            for (int l = 0; l < layerCount; l++) {
                int inputs = data.readInt();
                int outputs = data.readInt();
                if (inputs <= 0 || outputs <= 0 || inputs > MAX_LAYER_UNITS || outputs > MAX_LAYER_UNITS) {
                    throw new ModelLoadException("Implausible layer shape " + inputs + "x" + outputs);
                }
                float[] weights = readFloats(data, inputs * outputs);
                float[] bias = readFloats(data, outputs);
                layers.add(new DenseLayer(inputs, outputs, weights, bias));
            }
            return new ProductivityClassifier(layers, threshold, true, modelVersion);
        } catch (EOFException e) {
            throw new ModelLoadException("Weight file is truncated", e);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read weight file: " + e.getMessage(), e);
        }
    }

    private static float[] readFloats(DataInputStream data, int count) throws IOException {
        float[] values = new float[count];
        for (int i = 0; i < count; i++) {
            values[i] = data.readFloat();
        }
        return values;
    }
}
