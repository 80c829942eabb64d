package com.waqiti.auditpipeline.security;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption of violation event snapshots.
 *
 * <p>Ciphertext format: {@code v1:} followed by base64 of {@code iv || ciphertext+tag}.
 * Without a configured key the cipher is disabled and snapshots pass through unchanged.
 */
@Component
@Slf4j
public class SnapshotCipher {

    private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128;
    private static final int GCM_IV_LENGTH = 12;
    private static final int KEY_LENGTH_BYTES = 32;
    static final String VERSION_PREFIX = "v1:";

    private final SecretKey key;
    private final SecureRandom secureRandom = new SecureRandom();

    @Autowired
    public SnapshotCipher(AuditPipelineProperties properties) {
        this(properties.getSecurity().getSnapshotKey());
    }

    public SnapshotCipher(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            log.warn("No snapshot key configured - violation snapshots are stored redacted but unencrypted");
            this.key = null;
            return;
        }
        byte[] keyBytes = Base64.getDecoder().decode(base64Key.trim());
        if (keyBytes.length != KEY_LENGTH_BYTES) {
            throw new IllegalArgumentException("Snapshot key must be 256 bits, got " + keyBytes.length * 8);
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    public boolean isEnabled() {
        return key != null;
    }

    public String encrypt(String plaintext) {
        if (!isEnabled() || plaintext == null) {
            return plaintext;
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + encrypted.length);
            buffer.put(iv).put(encrypted);
            return VERSION_PREFIX + Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt violation snapshot", e);
        }
    }

    public String decrypt(String stored) {
        if (stored == null || !stored.startsWith(VERSION_PREFIX)) {
            return stored;
        }
        if (!isEnabled()) {
            throw new IllegalStateException("Encrypted snapshot found but no snapshot key is configured");
        }
        try {
            byte[] payload = Base64.getDecoder().decode(stored.substring(VERSION_PREFIX.length()));
            ByteBuffer buffer = ByteBuffer.wrap(payload);
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] encrypted = new byte[buffer.remaining()];
            buffer.get(encrypted);

            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to decrypt violation snapshot", e);
        }
    }
}
