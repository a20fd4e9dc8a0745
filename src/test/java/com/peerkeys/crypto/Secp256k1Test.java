package com.peerkeys.crypto;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import static org.assertj.core.api.Assertions.*;

class Secp256k1Test {

    // Private key 1: its public key is the curve generator.
    private static final byte[] PRIVATE_KEY_ONE =
        Hex.decode("0000000000000000000000000000000000000000000000000000000000000001");
    private static final String GENERATOR_COMPRESSED =
        "0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798";

    @Test
    void derivePublicKey_ofOne_isGenerator() {
        BigInteger d = Secp256k1.parsePrivateKey(PRIVATE_KEY_ONE);

        assertThat(Hex.toHexString(Secp256k1.derivePublicKey(d))).isEqualTo(GENERATOR_COMPRESSED);
    }

    @Test
    void sign_matchesPublishedRfc6979Vector() {
        BigInteger d = Secp256k1.parsePrivateKey(PRIVATE_KEY_ONE);

        byte[] signature = Secp256k1.sign(d, "Satoshi Nakamoto".getBytes(StandardCharsets.UTF_8));

        assertThat(Hex.toHexString(signature)).isEqualTo(
            "3045022100934b1ea10a4b3c1757e2b0c017d0b6143ce3c9a7e6a4a49860d7a6ab210ee3d8"
                + "02202442ce9d2b916064108014783e923ec36b49743e2ffa1c4496f01a512aafd9e5");
    }

    @Test
    void sign_isDeterministic() {
        BigInteger d = Secp256k1.parsePrivateKey(Secp256k1.generatePrivateKey(new SecureRandom()));
        byte[] data = "data data data".getBytes(StandardCharsets.UTF_8);

        assertThat(Secp256k1.sign(d, data)).isEqualTo(Secp256k1.sign(d, data));
    }

    @Test
    void sign_producesLowS() {
        BigInteger halfOrder = new BigInteger(
            "7fffffffffffffffffffffffffffffff5d576e7357a4501ddfe92f46681b20a0", 16);
        SecureRandom random = new SecureRandom();

        for (int i = 0; i < 20; i++) {
            BigInteger d = Secp256k1.parsePrivateKey(Secp256k1.generatePrivateKey(random));
            byte[] signature = Secp256k1.sign(d, ("message " + i).getBytes(StandardCharsets.UTF_8));
            int rLength = signature[3];
            int sLength = signature[4 + rLength + 1];
            byte[] sBytes = new byte[sLength];
            System.arraycopy(signature, 4 + rLength + 2, sBytes, 0, sLength);

            assertThat(new BigInteger(1, sBytes)).isLessThanOrEqualTo(halfOrder);
        }
    }

    @Test
    void verify_acceptsOwnSignature() {
        BigInteger d = Secp256k1.parsePrivateKey(Secp256k1.generatePrivateKey(new SecureRandom()));
        byte[] data = "hello".getBytes(StandardCharsets.UTF_8);

        assertThat(Secp256k1.verify(Secp256k1.derivePublicKey(d), data, Secp256k1.sign(d, data))).isTrue();
    }

    @Test
    void generatePrivateKey_isThirtyTwoBytes() {
        assertThat(Secp256k1.generatePrivateKey(new SecureRandom())).hasSize(Secp256k1.PRIVATE_KEY_LENGTH);
    }

    @Test
    void parsePrivateKey_rejectsOutOfRangeScalars() {
        assertThatThrownBy(() -> Secp256k1.parsePrivateKey(new byte[32]))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Secp256k1.parsePrivateKey(Hex.decode(
            "fffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Secp256k1.parsePrivateKey(new byte[31]))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_malformedSignature_throwsIllegalArgument() {
        byte[] publicKey = Hex.decode(GENERATOR_COMPRESSED);

        assertThatThrownBy(() -> Secp256k1.verify(publicKey, new byte[] { 1 }, new byte[] { 0x02, 0x01, 0x01 }))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
