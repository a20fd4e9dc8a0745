package com.peerkeys.crypto;

import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Closed set of public key serialisations: lowercase {@link #HEX} or raw {@link #BUFFER} bytes.
 *
 * @param <T> the encoded representation
 */
public final class PublicKeyFormat<T> {

    public static final PublicKeyFormat<String> HEX = new PublicKeyFormat<>("hex", Hex::toHexString);
    public static final PublicKeyFormat<byte[]> BUFFER =
            new PublicKeyFormat<>("buffer", bytes -> Arrays.copyOf(bytes, bytes.length));

    private final String name;
    private final Function<byte[], T> encoder;

    private PublicKeyFormat(String name, Function<byte[], T> encoder) {
        this.name = name;
        this.encoder = encoder;
    }

    /**
     * Look up a format by name. A null or empty name selects {@link #HEX}.
     *
     * @throws IllegalArgumentException for any other name
     */
    public static PublicKeyFormat<?> named(String name) {
        if (name == null || name.isEmpty() || HEX.name.equals(name)) {
            return HEX;
        }
        if (BUFFER.name.equals(name)) {
            return BUFFER;
        }
        throw new IllegalArgumentException("Supported formats are `hex` and `buffer`");
    }

    public T encode(byte[] publicKey) {
        return encoder.apply(publicKey);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
