package com.ringprobe.partition;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Converts keys into the bytes fed to the hash function.
 */
@FunctionalInterface
public interface KeyEncoder {

    /**
     * Encode a key.
     *
     * @param key the key, never null
     * @return the bytes to hash
     */
    byte[] encode(Object key);

    /**
     * Get the standard encoder.
     *
     * <ul>
     *   <li>{@code byte[]} is used as is</li>
     *   <li>{@link RingKey} supplies its own bytes</li>
     *   <li>{@link CharSequence} is encoded as UTF-8</li>
     *   <li>{@link Long}, {@link Integer}, {@link Short} and {@link Byte} are
     *       little-endian at their natural width</li>
     *   <li>{@link UUID} is 16 bytes, most significant half first</li>
     *   <li>anything else falls back to the UTF-8 bytes of {@code String.valueOf(key)}</li>
     * </ul>
     *
     * <p>The fallback is only as stable as the key's {@code toString()}. Without
     * an override that is the class name plus a 32-bit {@code hashCode()} in
     * hex, so such keys spread over at most 2^32 positions, renaming the class
     * moves every one of them, and without a {@code hashCode()} override equal
     * values land at unrelated positions. Node types should implement
     * {@link RingKey} or override {@code toString()} with a value-based form.
     *
     * @return the standard encoder
     */
    static KeyEncoder standard() {
        return KeyEncoder::encodeStandard;
    }

    private static byte[] encodeStandard(Object key) {
        if (key instanceof byte[]) {
            return (byte[]) key;
        }
        if (key instanceof RingKey) {
            return ((RingKey) key).ringKey();
        }
        if (key instanceof CharSequence) {
            return key.toString().getBytes(StandardCharsets.UTF_8);
        }
        if (key instanceof Long) {
            return littleEndian(Long.BYTES).putLong((Long) key).array();
        }
        if (key instanceof Integer) {
            return littleEndian(Integer.BYTES).putInt((Integer) key).array();
        }
        if (key instanceof Short) {
            return littleEndian(Short.BYTES).putShort((Short) key).array();
        }
        if (key instanceof Byte) {
            return new byte[] {(Byte) key};
        }
        if (key instanceof UUID) {
            UUID uuid = (UUID) key;
            return ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
        }
        return String.valueOf(key).getBytes(StandardCharsets.UTF_8);
    }

    private static ByteBuffer littleEndian(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }
}
