package com.focus.gate.engine.feature;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Fixed-length classifier input. Layout (version {@value #LAYOUT_VERSION}):
 * <pre>
 *   [0, 384)      URL lexical
 *   [384, 768)    mission lexical
 *   [768, 1152)   content lexical
 *   [1152, 1167)  URL structure
 *   [1167, 1182)  content-derived
 *   [1182, 1186)  temporal
 * </pre>
 */
public final class FeatureVector {

    public static final String LAYOUT_VERSION = "fv-2";

    public static final int TEXT_BLOCK = 384;
    public static final int URL_STRUCTURE_BLOCK = 15;
    public static final int CONTENT_BLOCK = 15;
    public static final int TEMPORAL_BLOCK = 4;
    public static final int DIMENSION = 3 * TEXT_BLOCK + URL_STRUCTURE_BLOCK + CONTENT_BLOCK + TEMPORAL_BLOCK;

    public static final int URL_TEXT_OFFSET = 0;
    public static final int MISSION_TEXT_OFFSET = TEXT_BLOCK;
    public static final int CONTENT_TEXT_OFFSET = 2 * TEXT_BLOCK;
    public static final int URL_STRUCTURE_OFFSET = 3 * TEXT_BLOCK;
    public static final int CONTENT_OFFSET = URL_STRUCTURE_OFFSET + URL_STRUCTURE_BLOCK;
    public static final int TEMPORAL_OFFSET = CONTENT_OFFSET + CONTENT_BLOCK;

    private final float[] values;

    public FeatureVector(float[] values) {
        if (values.length != DIMENSION) {
            throw new IllegalArgumentException("Expected " + DIMENSION + " features, got " + values.length);
        }
        this.values = values.clone();
    }

    public int dimension() {
        return values.length;
    }

    public float get(int index) {
        return values[index];
    }

    public float[] toArray() {
        return values.clone();
    }

    public byte[] toBytes() {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : values) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    public static FeatureVector fromBytes(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] values = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.getFloat();
        }
        return new FeatureVector(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }
}
