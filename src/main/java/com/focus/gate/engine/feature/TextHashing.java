package com.focus.gate.engine.feature;

import org.apache.commons.codec.digest.MurmurHash3;

import java.nio.charset.StandardCharsets;

public final class TextHashing {

    public static final int SEED = 0x5EED_F0C5;

    private TextHashing() {
    }

    public static float bucket(String key) {
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        int hash = MurmurHash3.hash32x86(bytes, 0, bytes.length, SEED);
        return (Integer.toUnsignedLong(hash) % 1000) / 1000.0f;
    }
}
