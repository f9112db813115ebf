package io.restoreassist.sync.integration.secret;

import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** AES-256-GCM encrypted secrets in the {@code integration_secrets} table. */
@Component
public class EncryptedDatabaseSecretStore implements SecretStore {

  private static final Logger log = LoggerFactory.getLogger(EncryptedDatabaseSecretStore.class);

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128; // bits
  private static final int IV_LENGTH = 12; // bytes
  private static final int KEY_VERSION = 1;

  private final IntegrationSecretRepository repository;
  private final SecretKeySpec encryptionKey;
  private final SecureRandom secureRandom = new SecureRandom();

  public EncryptedDatabaseSecretStore(
      IntegrationSecretRepository repository,
      @Value("${integration.encryption-key:}") String encodedKey) {
    this.repository = repository;
    if (encodedKey == null || encodedKey.isBlank()) {
      this.encryptionKey = null;
    } else {
      this.encryptionKey = new SecretKeySpec(Base64.getDecoder().decode(encodedKey), "AES");
    }
  }

  @PostConstruct
  void validateKey() {
    if (encryptionKey == null) {
      throw new IllegalStateException(
          "INTEGRATION_ENCRYPTION_KEY is not set. "
              + "Cannot start without an encryption key for provider credentials.");
    }
    if (encryptionKey.getEncoded().length != 32) {
      throw new IllegalStateException(
          "INTEGRATION_ENCRYPTION_KEY must be a Base64-encoded 256-bit (32-byte) key. Got "
              + encryptionKey.getEncoded().length
              + " bytes.");
    }
  }

  @Override
  @Transactional
  public void store(String secretKey, String plaintext) {
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    byte[] ciphertext =
        apply(Cipher.ENCRYPT_MODE, plaintext.getBytes(StandardCharsets.UTF_8), iv);

    String encodedCiphertext = Base64.getEncoder().encodeToString(ciphertext);
    String encodedIv = Base64.getEncoder().encodeToString(iv);

    var existing = repository.findBySecretKey(secretKey);
    if (existing.isPresent()) {
      existing.get().rotate(encodedCiphertext, encodedIv, KEY_VERSION);
      repository.save(existing.get());
    } else {
      repository.save(new IntegrationSecret(secretKey, encodedCiphertext, encodedIv, KEY_VERSION));
    }
    log.debug("Stored secret {}", secretKey);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<String> retrieve(String secretKey) {
    return repository
        .findBySecretKey(secretKey)
        .map(
            secret -> {
              byte[] ciphertext = Base64.getDecoder().decode(secret.getEncryptedValue());
              byte[] iv = Base64.getDecoder().decode(secret.getIv());
              return new String(apply(Cipher.DECRYPT_MODE, ciphertext, iv), StandardCharsets.UTF_8);
            });
  }

  @Override
  @Transactional
  public void delete(String secretKey) {
    repository.deleteBySecretKey(secretKey);
  }

  private byte[] apply(int mode, byte[] input, byte[] iv) {
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(mode, encryptionKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return cipher.doFinal(input);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(
          mode == Cipher.ENCRYPT_MODE ? "Encryption failed" : "Decryption failed", e);
    }
  }
}
