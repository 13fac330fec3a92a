package com.openrangelabs.ingestor.service;

import com.openrangelabs.ingestor.exception.CredentialEncryptionException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * AES-256/CBC encryption keyed by the SHA-256 hash of the configured master key.
 * Every encryption draws a fresh 16 byte IV, returned next to the ciphertext.
 */
@Component
public class AesCredentialEncryptor {

    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final int IV_LENGTH = 16;

    /**
     * Base64 ciphertext and IV as persisted.
     */
    public record EncryptedSecret(String cipherText, String iv) {
    }

    private final SecretKeySpec key;
    private final BytesKeyGenerator ivGenerator = KeyGenerators.secureRandom(IV_LENGTH);

    public AesCredentialEncryptor(@Value("${ingestion.encryption.master-key}") String masterKey) {
        if (masterKey == null || masterKey.isBlank()) {
            throw new IllegalArgumentException("ingestion.encryption.master-key must be set");
        }
        this.key = new SecretKeySpec(sha256(masterKey), "AES");
    }

    public EncryptedSecret encrypt(String plainText) {
        try {
            byte[] iv = ivGenerator.generateKey();
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
            byte[] encrypted = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));
            return new EncryptedSecret(Base64.getEncoder().encodeToString(encrypted), Base64.getEncoder().encodeToString(iv));
        } catch (GeneralSecurityException e) {
            throw new CredentialEncryptionException(CredentialEncryptionException.ENCRYPTION,
                    "Failed to encrypt credential value", e);
        }
    }

    public String decrypt(String cipherText, String iv) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(Base64.getDecoder().decode(iv)));
            byte[] decrypted = cipher.doFinal(Base64.getDecoder().decode(cipherText));
            return new String(decrypted, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new CredentialEncryptionException(CredentialEncryptionException.DECRYPTION,
                    "Failed to decrypt credential value", e);
        }
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
