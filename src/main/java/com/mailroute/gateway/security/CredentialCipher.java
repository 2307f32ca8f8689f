package com.mailroute.gateway.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for provider credentials at rest.
 *
 * <p>Ciphertext format: {@code base64(iv || ciphertext+tag)} with a 12-byte
 * random IV and a 128-bit tag. Plaintext returned by {@link #decrypt} must
 * stay a local variable of the transport call that needs it.
 */
public final class CredentialCipher {

    private static final Logger LOG = LoggerFactory.getLogger(CredentialCipher.class);

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int    GCM_TAG_BITS   = 128;
    private static final int    GCM_IV_BYTES   = 12;
    private static final int    KEY_BYTES      = 32;

    private final SecretKeySpec key;
    private final SecureRandom  secureRandom = new SecureRandom();

    public CredentialCipher(final byte[] rawKey) {
        if (rawKey == null || rawKey.length != KEY_BYTES) {
            throw new IllegalArgumentException("Credential key must be " + KEY_BYTES + " bytes (AES-256)");
        }
        this.key = new SecretKeySpec(rawKey.clone(), "AES");
    }

    /**
     * Build from a base64 key. A blank value yields a random per-process key,
     * which only works when every credential is encrypted at startup.
     */
    public static CredentialCipher fromBase64Key(final String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            LOG.warn("No credential key configured; using an ephemeral key for this process");
            return ephemeral();
        }
        final byte[] raw;
        try {
            raw = Base64.getDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Credential key is not valid base64", e);
        }
        return new CredentialCipher(raw);
    }

    public static CredentialCipher ephemeral() {
        final byte[] raw = new byte[KEY_BYTES];
        new SecureRandom().nextBytes(raw);
        return new CredentialCipher(raw);
    }

    public String encrypt(final String plaintext) {
        if (plaintext == null) return null;
        final byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            final byte[] ct = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            final byte[] out = ByteBuffer.allocate(iv.length + ct.length).put(iv).put(ct).array();
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new CredentialException("Failed to encrypt credential", e);
        }
    }

    /**
     * @throws CredentialException if the value is malformed, was encrypted
     *         under another key, or has been tampered with
     */
    public String decrypt(final String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new CredentialException("Credential is not configured");
        }
        final byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new CredentialException("Credential is not valid base64", e);
        }
        if (raw.length <= GCM_IV_BYTES) {
            throw new CredentialException("Credential ciphertext is too short");
        }
        try {
            final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, raw, 0, GCM_IV_BYTES));
            final byte[] plain = cipher.doFinal(raw, GCM_IV_BYTES, raw.length - GCM_IV_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new CredentialException("Failed to decrypt credential", e);
        }
    }

    /** Raised when a credential cannot be encrypted or decrypted. Message never contains key material. */
    public static final class CredentialException extends RuntimeException {
        public CredentialException(final String message) {
            super(message);
        }

        public CredentialException(final String message, final Throwable cause) {
            super(message, cause);
        }
    }
}
