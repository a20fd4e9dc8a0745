package com.peerkeys.crypto;

import com.peerkeys.storage.LruStorage;
import com.peerkeys.storage.Storage;
import com.peerkeys.util.MetricsCollector;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Signature verification memoised by signature.
 * <p>
 * The first successful verification of a signature stores the public key and data it was
 * checked against. Later calls with the same signature skip the elliptic-curve check and
 * succeed only if both the public key and the data are byte-for-byte identical to the
 * stored ones. Failed verifications are never stored.
 */
public class MessageVerifier {

    private static final Logger logger = LoggerFactory.getLogger(MessageVerifier.class);

    private final Storage<VerifiedMessage> cache;
    private final MetricsCollector metrics;

    /**
     * Create a verifier with a 1000-entry cache.
     */
    public MessageVerifier() {
        this(LruStorage.DEFAULT_CAPACITY);
    }

    public MessageVerifier(int capacity) {
        this(new LruStorage<>(capacity), new MetricsCollector());
    }

    /**
     * @param cache   holds verified messages keyed by signature hex
     * @param metrics receives cached/crypto/failed counts
     */
    public MessageVerifier(Storage<VerifiedMessage> cache, MetricsCollector metrics) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        this.cache = cache;
        this.metrics = metrics != null ? metrics : new MetricsCollector();
    }

    /**
     * Verify a signature, answering from the cache when this signature was verified before.
     *
     * @param signature    hex DER signature
     * @param publicKeyHex hex public key
     * @param data         the message bytes
     * @return true if the signature is valid for this key and message
     * @throws IllegalArgumentException if any argument is missing
     */
    public boolean verifyMessage(String signature, String publicKeyHex, byte[] data) {
        Signatures.requireVerifyArguments(signature, publicKeyHex, data);
        long start = System.nanoTime();

        Optional<VerifiedMessage> cached = cache.get(signature);
        boolean verified;
        if (cached.isPresent()) {
            verified = matchesCached(cached.get(), publicKeyHex, data);
            logger.trace("Verification cache hit for signature {} -> {}", abbreviate(signature), verified);
        } else {
            verified = Signatures.verifySignature(signature, publicKeyHex, data);
            if (verified) {
                cache.put(signature, new VerifiedMessage(Hex.decode(publicKeyHex), data));
            }
        }

        metrics.recordVerification(System.nanoTime() - start, cached.isPresent(), verified);
        return verified;
    }

    public boolean verifyMessage(String signature, String publicKeyHex, String data) {
        Signatures.requireVerifyArguments(signature, publicKeyHex, data);
        return verifyMessage(signature, publicKeyHex, Signatures.toBytes(data));
    }

    /**
     * Forget every verified signature.
     */
    public void clear() {
        cache.clear();
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    private boolean matchesCached(VerifiedMessage cached, String publicKeyHex, byte[] data) {
        byte[] publicKey;
        try {
            publicKey = Hex.decode(publicKeyHex);
        } catch (RuntimeException e) {
            logger.debug("Unparseable public key against cached signature: {}", e.getMessage());
            return false;
        }
        return cached.matches(publicKey, data);
    }

    private static String abbreviate(String signature) {
        return signature.length() > 16 ? signature.substring(0, 16) + "..." : signature;
    }
}
