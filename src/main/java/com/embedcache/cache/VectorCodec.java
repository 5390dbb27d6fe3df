package com.embedcache.cache;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Stored value layout: IEEE-754 binary32 components, little-endian, no header. Raw bit patterns
 * are kept, so NaN payloads and signed zeros survive a round trip.
 */
public final class VectorCodec {
    private VectorCodec() {
    }

    public static byte[] encode(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float component : vector) {
            buffer.putInt(Float.floatToRawIntBits(component));
        }
        return buffer.array();
    }

    public static float[] decode(byte[] bytes, int expectedDimension) {
        if (bytes.length != expectedDimension * Float.BYTES) {
            throw new IntegrityException("Stored vector has " + bytes.length + " bytes, expected "
                    + expectedDimension * Float.BYTES);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[expectedDimension];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = Float.intBitsToFloat(buffer.getInt());
        }
        return vector;
    }
}
