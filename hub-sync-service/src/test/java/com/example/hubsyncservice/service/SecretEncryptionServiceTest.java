package com.example.hubsyncservice.service;

import com.example.hubsyncservice.exception.EncryptionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretEncryptionServiceTest {

    private static final String KEY_HEX = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

    private final SecretEncryptionService encryptionService = new SecretEncryptionService(KEY_HEX);

    @Test
    void testEncrypt_FreshIvEveryTime() {
        String first = encryptionService.encrypt("lin_api_token");
        String second = encryptionService.encrypt("lin_api_token");

        assertThat(first).isNotEqualTo(second).contains(":").doesNotContain("lin_api_token");
        assertThat(encryptionService.decrypt(first)).isEqualTo("lin_api_token");
        assertThat(encryptionService.decrypt(second)).isEqualTo("lin_api_token");
    }

    @Test
    void testDecrypt_OtherKey_Fails() {
        String encrypted = encryptionService.encrypt("lin_api_token");
        SecretEncryptionService otherKey = new SecretEncryptionService(
                "1f1e1d1c1b1a191817161514131211100f0e0d0c0b0a09080706050403020100");

        assertThatThrownBy(() -> otherKey.decrypt(encrypted)).isInstanceOf(EncryptionException.class);
    }

    @Test
    void testDecrypt_MalformedValue_Fails() {
        assertThatThrownBy(() -> encryptionService.decrypt("no-separator")).isInstanceOf(EncryptionException.class);
        assertThatThrownBy(() -> encryptionService.decrypt("!!!:???")).isInstanceOf(EncryptionException.class);
        assertThatThrownBy(() -> encryptionService.decrypt(null)).isInstanceOf(EncryptionException.class);
    }

    @Test
    void testConstructor_WrongKeyLength_Rejected() {
        assertThatThrownBy(() -> new SecretEncryptionService("0011"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 bytes");
        assertThatThrownBy(() -> new SecretEncryptionService("not-hex"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testGenerateWebhookSecret_64HexChars() {
        String secret = encryptionService.generateWebhookSecret();

        assertThat(secret).hasSize(64).matches("[0-9a-f]+");
        assertThat(encryptionService.generateWebhookSecret()).isNotEqualTo(secret);
    }
}
