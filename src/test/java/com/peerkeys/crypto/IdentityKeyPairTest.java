package com.peerkeys.crypto;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;

import static org.assertj.core.api.Assertions.*;

class IdentityKeyPairTest {

    @Test
    void fromPrivateKey_derivesSamePublicKey() {
        IdentityKeyPair generated = IdentityKeyPair.generate(new SecureRandom());

        IdentityKeyPair restored = IdentityKeyPair.fromPrivateKey(generated.marshal());

        assertThat(restored).isEqualTo(generated);
        assertThat(restored.hashCode()).isEqualTo(generated.hashCode());
        assertThat(restored.getPublicKey()).isEqualTo(generated.getPublicKey());
    }

    @Test
    void keyLengths() {
        IdentityKeyPair keys = IdentityKeyPair.generate(new SecureRandom());

        assertThat(keys.marshal()).hasSize(Secp256k1.PRIVATE_KEY_LENGTH);
        assertThat(keys.getPublicKey()).hasSize(Secp256k1.PUBLIC_KEY_LENGTH);
        assertThat(keys.getPublicKeyHex()).hasSize(Secp256k1.PUBLIC_KEY_LENGTH * 2);
    }

    @Test
    void accessors_returnCopies() {
        IdentityKeyPair keys = IdentityKeyPair.generate(new SecureRandom());
        byte[] privateKey = keys.marshal();

        keys.marshal()[0] ^= 0x01;
        keys.getPublicKey()[0] ^= 0x01;

        assertThat(keys.marshal()).isEqualTo(privateKey);
        assertThat(keys.getPublicKey()[0]).isIn((byte) 0x02, (byte) 0x03);
    }

    @Test
    void toString_doesNotExposePrivateKey() {
        IdentityKeyPair keys = IdentityKeyPair.generate(new SecureRandom());
        String privateHex = Hex.toHexString(keys.marshal());

        assertThat(keys.toString()).contains(keys.getPublicKeyHex()).doesNotContain(privateHex);
    }

    @Test
    void fromPrivateKey_rejectsInvalidBytes() {
        assertThatThrownBy(() -> IdentityKeyPair.fromPrivateKey(new byte[] { 1, 2, 3 }))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IdentityKeyPair.fromPrivateKey(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void publicKeyFormats_encodeSameBytes() {
        IdentityKeyPair keys = IdentityKeyPair.generate(new SecureRandom());

        String hex = PublicKeyFormat.HEX.encode(keys.getPublicKey());
        byte[] raw = PublicKeyFormat.BUFFER.encode(keys.getPublicKey());

        assertThat(Hex.toHexString(raw)).isEqualTo(hex);
    }

    @Test
    void publicKeyFormat_named() {
        assertThat(PublicKeyFormat.named("hex")).isSameAs(PublicKeyFormat.HEX);
        assertThat(PublicKeyFormat.named("buffer")).isSameAs(PublicKeyFormat.BUFFER);
        assertThat(PublicKeyFormat.named(null)).isSameAs(PublicKeyFormat.HEX);
        assertThatThrownBy(() -> PublicKeyFormat.named("foo"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Supported formats");
    }
}
