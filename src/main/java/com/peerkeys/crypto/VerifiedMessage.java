package com.peerkeys.crypto;

import java.security.MessageDigest;
import java.util.Arrays;

/**
 * A (public key, data) pair whose signature has already been verified successfully.
 */
public final class VerifiedMessage {

    private final byte[] publicKey;
    private final byte[] data;

    public VerifiedMessage(byte[] publicKey, byte[] data) {
        this.publicKey = Arrays.copyOf(publicKey, publicKey.length);
        this.data = Arrays.copyOf(data, data.length);
    }

    /**
     * Byte-for-byte comparison of both the public key and the data.
     */
    public boolean matches(byte[] otherPublicKey, byte[] otherData) {
        return MessageDigest.isEqual(publicKey, otherPublicKey) && MessageDigest.isEqual(data, otherData);
    }

    public byte[] getPublicKey() {
        return Arrays.copyOf(publicKey, publicKey.length);
    }

    public int getDataLength() {
        return data.length;
    }

    @Override
    public String toString() {
        return "VerifiedMessage{" +
               "publicKeyLength=" + publicKey.length +
               ", dataLength=" + data.length +
               '}';
    }
}
