package com.peerkeys.crypto;

import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Immutable secp256k1 key pair. The public key is always derived from the private key,
 * so only {@link #marshal()} needs to be persisted.
 */
public final class IdentityKeyPair {

    private final BigInteger d;
    private final byte[] privateKey;
    private final byte[] publicKey;

    private IdentityKeyPair(BigInteger d) {
        this.d = d;
        this.privateKey = BigIntegers.asUnsignedByteArray(Secp256k1.PRIVATE_KEY_LENGTH, d);
        this.publicKey = Secp256k1.derivePublicKey(d);
    }

    /**
     * Generate a new key pair.
     *
     * @param random entropy source
     * @return the new key pair
     */
    public static IdentityKeyPair generate(SecureRandom random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        return fromPrivateKey(Secp256k1.generatePrivateKey(random));
    }

    /**
     * Rebuild a key pair from marshaled private key bytes.
     *
     * @param privateKey the 32-byte private key
     * @return the key pair with its derived public key
     * @throws IllegalArgumentException if the bytes are not a valid secp256k1 private key
     */
    public static IdentityKeyPair fromPrivateKey(byte[] privateKey) {
        return new IdentityKeyPair(Secp256k1.parsePrivateKey(privateKey));
    }

    /**
     * @return a copy of the 32-byte private key
     */
    public byte[] marshal() {
        return Arrays.copyOf(privateKey, privateKey.length);
    }

    /**
     * @return a copy of the 33-byte compressed public key
     */
    public byte[] getPublicKey() {
        return Arrays.copyOf(publicKey, publicKey.length);
    }

    public String getPublicKeyHex() {
        return Hex.toHexString(publicKey);
    }

    /**
     * Sign raw bytes.
     *
     * @return the DER encoded signature
     */
    public byte[] sign(byte[] data) {
        return Secp256k1.sign(d, data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdentityKeyPair that = (IdentityKeyPair) o;
        return Arrays.equals(privateKey, that.privateKey);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(publicKey);
    }

    @Override
    public String toString() {
        return "IdentityKeyPair{" +
               "curve=" + Secp256k1.CURVE_NAME +
               ", publicKey=" + getPublicKeyHex() +
               '}';
    }
}
