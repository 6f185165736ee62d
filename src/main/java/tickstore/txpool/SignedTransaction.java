package tickstore.txpool;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A transaction as submitted by a player: who sent it, for which game namespace, its replay
 * protection nonce, the sender's signature and the encoded message body.
 * <p>
 * It is journaled verbatim next to the decoded payload so that a recovered tick sees exactly
 * the source transactions of the interrupted one.
 */
public record SignedTransaction(String personaTag, String namespace, long nonce, String signature, byte[] body) {

    public SignedTransaction {
        if (personaTag == null || personaTag.isBlank()) {
            throw new IllegalArgumentException("Persona tag cannot be null or blank");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Namespace cannot be null or blank");
        }
        Objects.requireNonNull(signature, "signature");
        if (body == null) {
            throw new IllegalArgumentException("Body cannot be null");
        }
    }

    /**
     * SHA-256 over persona tag, namespace, nonce and body, hex encoded. The signature is not
     * part of the hash, so the hash identifies what was signed.
     */
    public String hash() {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        digest.update(personaTag.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(namespace.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(nonce).array());
        digest.update(body);
        return HexFormat.of().formatHex(digest.digest());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SignedTransaction other)) return false;
        return nonce == other.nonce
                && personaTag.equals(other.personaTag)
                && namespace.equals(other.namespace)
                && signature.equals(other.signature)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(personaTag, namespace, nonce, signature, Arrays.hashCode(body));
    }

    @Override
    public String toString() {
        return "SignedTransaction{personaTag=" + personaTag + ", namespace=" + namespace
                + ", nonce=" + nonce + ", body=" + body.length + " bytes}";
    }
}
