package com.peerkeys.crypto;

import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * secp256k1 primitives: key generation, public key derivation, signing and verification.
 * <p>
 * Messages are hashed with SHA-256 and signed with deterministic ECDSA (RFC 6979). Signatures
 * are normalised to low-S and DER encoded; verification rejects high-S and non-DER input.
 * Public keys are encoded as 33-byte compressed points, private keys as 32-byte big-endian scalars.
 */
public final class Secp256k1 {

    public static final String CURVE_NAME = "secp256k1";
    public static final int PRIVATE_KEY_LENGTH = 32;
    public static final int PUBLIC_KEY_LENGTH = 33;

    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName(CURVE_NAME);
    private static final ECDomainParameters DOMAIN = new ECDomainParameters(
            PARAMS.getCurve(), PARAMS.getG(), PARAMS.getN(), PARAMS.getH());
    private static final BigInteger HALF_ORDER = PARAMS.getN().shiftRight(1);

    private Secp256k1() {
    }

    /**
     * Generate a fresh private key.
     *
     * @param random entropy source
     * @return the 32-byte private key
     */
    public static byte[] generatePrivateKey(SecureRandom random) {
        ECKeyPairGenerator generator = new ECKeyPairGenerator();
        generator.init(new ECKeyGenerationParameters(DOMAIN, random));
        AsymmetricCipherKeyPair pair = generator.generateKeyPair();
        BigInteger d = ((ECPrivateKeyParameters) pair.getPrivate()).getD();
        return BigIntegers.asUnsignedByteArray(PRIVATE_KEY_LENGTH, d);
    }

    /**
     * Parse a private key, checking it is a valid scalar for the curve.
     *
     * @throws IllegalArgumentException if the bytes are not a valid private key
     */
    public static BigInteger parsePrivateKey(byte[] privateKey) {
        if (privateKey == null || privateKey.length != PRIVATE_KEY_LENGTH) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_LENGTH + " bytes");
        }
        BigInteger d = new BigInteger(1, privateKey);
        if (d.signum() == 0 || d.compareTo(DOMAIN.getN()) >= 0) {
            throw new IllegalArgumentException("Private key is out of range for " + CURVE_NAME);
        }
        return d;
    }

    /**
     * @return the compressed public key for the private scalar {@code d}
     */
    public static byte[] derivePublicKey(BigInteger d) {
        ECPoint q = new FixedPointCombMultiplier().multiply(DOMAIN.getG(), d).normalize();
        return q.getEncoded(true);
    }

    /**
     * Sign {@code data} with the private scalar {@code d}.
     *
     * @return the DER encoded low-S signature
     */
    public static byte[] sign(BigInteger d, byte[] data) {
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(d, DOMAIN));
        BigInteger[] rs = signer.generateSignature(sha256(data));
        BigInteger s = rs[1];
        if (s.compareTo(HALF_ORDER) > 0) {
            s = DOMAIN.getN().subtract(s);
        }
        return encodeDer(rs[0], s);
    }

    /**
     * Verify a DER signature over {@code data}.
     *
     * @param publicKey compressed or uncompressed public key
     * @return true if the signature is valid, low-S and strictly DER encoded
     * @throws IllegalArgumentException if the public key or the signature cannot be parsed
     */
    public static boolean verify(byte[] publicKey, byte[] data, byte[] signature) {
        ECPoint q = DOMAIN.getCurve().decodePoint(publicKey);
        BigInteger[] rs = decodeDer(signature);
        if (rs[1].compareTo(HALF_ORDER) > 0) {
            return false;
        }
        ECDSASigner verifier = new ECDSASigner();
        verifier.init(false, new ECPublicKeyParameters(q, DOMAIN));
        return verifier.verifySignature(sha256(data), rs[0], rs[1]);
    }

    static byte[] sha256(byte[] data) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    private static byte[] encodeDer(BigInteger r, BigInteger s) {
        ASN1EncodableVector vector = new ASN1EncodableVector(2);
        vector.add(new ASN1Integer(r));
        vector.add(new ASN1Integer(s));
        try {
            return new DERSequence(vector).getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot encode signature", e);
        }
    }

    private static BigInteger[] decodeDer(byte[] signature) {
        try {
            ASN1Sequence sequence = ASN1Sequence.getInstance(ASN1Primitive.fromByteArray(signature));
            if (sequence == null || sequence.size() != 2) {
                throw new IllegalArgumentException("Signature must hold exactly two integers");
            }
            if (!Arrays.equals(sequence.getEncoded(ASN1Encoding.DER), signature)) {
                throw new IllegalArgumentException("Signature is not DER encoded");
            }
            BigInteger r = ASN1Integer.getInstance(sequence.getObjectAt(0)).getValue();
            BigInteger s = ASN1Integer.getInstance(sequence.getObjectAt(1)).getValue();
            return new BigInteger[] { r, s };
        } catch (IOException | IllegalStateException e) {
            throw new IllegalArgumentException("Malformed signature", e);
        }
    }
}
