package com.peerkeys.crypto;

import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Signing and verification of messages with {@link IdentityKeyPair}s.
 * Signatures and public keys travel as lowercase hex strings; string data is signed as UTF-8.
 */
public final class Signatures {

    private static final Logger logger = LoggerFactory.getLogger(Signatures.class);

    private Signatures() {
    }

    /**
     * Sign a message.
     *
     * @param keys the signing key pair
     * @param data the message bytes
     * @return the signature as lowercase hex
     * @throws IllegalArgumentException if the key pair or the data is missing
     */
    public static String signMessage(IdentityKeyPair keys, byte[] data) {
        if (keys == null) {
            throw new IllegalArgumentException("No signing key given");
        }
        requireData(data);
        return Hex.toHexString(keys.sign(data));
    }

    public static String signMessage(IdentityKeyPair keys, String data) {
        if (keys == null) {
            throw new IllegalArgumentException("No signing key given");
        }
        return signMessage(keys, toBytes(data));
    }

    /**
     * Check a signature against a public key and message. A signature or key that cannot be
     * parsed is reported exactly like a wrong signature.
     *
     * @param signature    hex DER signature
     * @param publicKeyHex hex public key
     * @param data         the message bytes
     * @return true only if the signature is valid for this key and message
     * @throws IllegalArgumentException if any argument is missing
     */
    public static boolean verifySignature(String signature, String publicKeyHex, byte[] data) {
        requireVerifyArguments(signature, publicKeyHex, data);
        try {
            return Secp256k1.verify(Hex.decode(publicKeyHex), data, Hex.decode(signature));
        } catch (RuntimeException e) {
            logger.debug("Signature rejected: {}", e.getMessage());
            return false;
        }
    }

    public static boolean verifySignature(String signature, String publicKeyHex, String data) {
        requireVerifyArguments(signature, publicKeyHex, data);
        return verifySignature(signature, publicKeyHex, toBytes(data));
    }

    static void requireVerifyArguments(String signature, String publicKeyHex, Object data) {
        if (signature == null || signature.isEmpty()) {
            throw new IllegalArgumentException("No signature given");
        }
        if (publicKeyHex == null || publicKeyHex.isEmpty()) {
            throw new IllegalArgumentException("Given publicKey was undefined");
        }
        requireData(data);
    }

    static byte[] toBytes(String data) {
        requireData(data);
        return data.getBytes(StandardCharsets.UTF_8);
    }

    private static void requireData(Object data) {
        if (data == null) {
            throw new IllegalArgumentException("Given input data was undefined");
        }
    }
}
