package com.example.hubsyncservice.service;

import com.example.hubsyncservice.exception.EncryptionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for secrets at rest (workspace API token, webhook signing secrets).
 *
 * Format: {@code {iv_base64}:{ciphertext_with_tag_base64}}
 */
@Service
@Slf4j
public class SecretEncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int WEBHOOK_SECRET_BYTES = 32;

    private final SecretKeySpec secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    public SecretEncryptionService(@Value("${encryption.secret-key}") String keyHex) {
        byte[] keyBytes;
        try {
            keyBytes = Hex.decodeHex(keyHex.trim());
        } catch (DecoderException e) {
            throw new IllegalArgumentException("encryption.secret-key must be hex encoded", e);
        }
        if (keyBytes.length != 32) {
            throw new IllegalArgumentException(
                    "Encryption key must be 32 bytes (256 bits), got " + keyBytes.length);
        }
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
        log.info("Secret encryption service initialized with AES-256-GCM");
    }

    public String encrypt(String plaintext) {
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            return Base64.getEncoder().encodeToString(iv) + ":" + Base64.getEncoder().encodeToString(ciphertext);
        } catch (GeneralSecurityException e) {
            log.error("Encryption failed", e);
            throw new EncryptionException("Failed to encrypt secret", e);
        }
    }

    /**
     * @throws EncryptionException on a malformed value or a failed auth tag check
     */
    public String decrypt(String encrypted) {
        String[] parts = encrypted == null ? new String[0] : encrypted.split(":", 2);
        if (parts.length != 2) {
            throw new EncryptionException("Invalid encrypted format", null);
        }
        try {
            byte[] iv = Base64.getDecoder().decode(parts[0]);
            byte[] ciphertext = Base64.getDecoder().decode(parts[1]);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.error("Decryption failed: {}", e.getMessage());
            throw new EncryptionException("Failed to decrypt secret", e);
        }
    }

    /**
     * Fresh webhook signing secret: 32 random bytes, hex encoded.
     */
    public String generateWebhookSecret() {
        byte[] bytes = new byte[WEBHOOK_SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }
}
