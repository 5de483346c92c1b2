package tech.yump.passkeeper.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.Mac;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;

/**
 * Encrypts small text fields into self-contained Fernet tokens.
 * <p>
 * Token layout: {@code 0x80 || timestamp (8, big endian seconds) || IV (16) || AES-128-CBC ciphertext || HMAC-SHA256 (32)},
 * URL-safe base64 encoded. The 32 byte key is split into a signing half and an encryption half.
 */
@Slf4j
public class FieldCipher {

  private static final byte VERSION = (byte) 0x80;
  private static final int KEY_LENGTH_BYTE = 32;
  private static final int TIMESTAMP_LENGTH_BYTE = 8;
  private static final int IV_LENGTH_BYTE = 16;
  private static final int BLOCK_LENGTH_BYTE = 16;
  private static final int HMAC_LENGTH_BYTE = 32;
  private static final int HEADER_LENGTH_BYTE = 1 + TIMESTAMP_LENGTH_BYTE + IV_LENGTH_BYTE;
  private static final int MIN_TOKEN_LENGTH_BYTE = HEADER_LENGTH_BYTE + BLOCK_LENGTH_BYTE + HMAC_LENGTH_BYTE;
  private static final long MAX_CLOCK_SKEW_SECONDS = 60;

  private static final String CIPHER_ALGORITHM = "AES/CBC/PKCS5Padding";
  private static final String MAC_ALGORITHM = "HmacSHA256";
  private static final String AES = "AES";

  private final SecretKey signingKey;
  private final SecretKey encryptionKey;
  private final Instant issuedAfter;
  private final Clock clock;
  private final SecureRandom secureRandom = new SecureRandom();

  /**
   * @param base64UrlKey 32 bytes, URL-safe base64 encoded
   * @param issuedAfter  tokens created before this instant are treated as expired by {@link #decrypt(String)}
   * @param clock        source of token timestamps and age checks
   */
  public FieldCipher(String base64UrlKey, Instant issuedAfter, Clock clock) {
    byte[] keyBytes;
    try {
      keyBytes = Base64.getUrlDecoder().decode(base64UrlKey.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Field cipher key must be URL-safe base64.", e);
    }
    if (keyBytes.length != KEY_LENGTH_BYTE) {
      throw new IllegalArgumentException("Field cipher key must decode to " + KEY_LENGTH_BYTE + " bytes, got " + keyBytes.length);
    }
    this.signingKey = new SecretKeySpec(keyBytes, 0, KEY_LENGTH_BYTE / 2, MAC_ALGORITHM);
    this.encryptionKey = new SecretKeySpec(keyBytes, KEY_LENGTH_BYTE / 2, KEY_LENGTH_BYTE / 2, AES);
    Arrays.fill(keyBytes, (byte) 0);
    this.issuedAfter = issuedAfter;
    this.clock = clock;
    log.info("FieldCipher initialized. Tokens issued before {} are rejected as expired.", issuedAfter);
  }

  /**
   * Encrypts the plaintext into a token stamped with the current time.
   *
   * @param plaintext the bytes to encrypt, may be empty but not null
   * @return the URL-safe base64 token
   * @throws CipherException if a cryptographic error occurs
   */
  public String encrypt(byte[] plaintext) {
    if (plaintext == null) {
      throw new CipherException("Plaintext cannot be null.");
    }
    log.trace("Encrypting {} bytes into a field token.", plaintext.length);

    byte[] iv = new byte[IV_LENGTH_BYTE];
    secureRandom.nextBytes(iv);
    long timestamp = clock.instant().getEpochSecond();

    try {
      Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
      byte[] ciphertext = cipher.doFinal(plaintext);

      ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH_BYTE + ciphertext.length + HMAC_LENGTH_BYTE);
      buffer.put(VERSION);
      buffer.putLong(timestamp);
      buffer.put(iv);
      buffer.put(ciphertext);
      buffer.put(sign(buffer.array(), HEADER_LENGTH_BYTE + ciphertext.length));

      return Base64.getUrlEncoder().encodeToString(buffer.array());

    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException | IllegalBlockSizeException | BadPaddingException e) {
      log.error("Field encryption failed: {}", e.getMessage(), e);
      throw new CipherException("Failed to encrypt field.", e);
    }
  }

  public String encryptText(String plaintext) {
    if (plaintext == null) {
      throw new CipherException("Plaintext cannot be null.");
    }
    return encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Decrypts a token, accepting only tokens created after the configured cut-off instant.
   */
  public byte[] decrypt(String token) {
    return decrypt(token, Duration.between(issuedAfter, clock.instant()));
  }

  public String decryptText(String token) {
    return new String(decrypt(token), StandardCharsets.UTF_8);
  }

  /**
   * Verifies and decrypts a token.
   *
   * @param token  the URL-safe base64 token
   * @param maxAge the oldest acceptable token age
   * @return the original plaintext
   * @throws CipherInvalidException if the token is malformed or its HMAC does not verify
   * @throws CipherExpiredException if the token is authentic but older than {@code maxAge}
   */
  public byte[] decrypt(String token, Duration maxAge) {
    if (token == null || token.isBlank()) {
      throw new CipherInvalidException("Invalid input: token is null or empty.");
    }

    byte[] data;
    try {
      data = Base64.getUrlDecoder().decode(token.trim());
    } catch (IllegalArgumentException e) {
      log.error("Field token rejected: not valid URL-safe base64.");
      throw new CipherInvalidException("Invalid token encoding.", e);
    }

    int ciphertextLength = data.length - HEADER_LENGTH_BYTE - HMAC_LENGTH_BYTE;
    if (data.length < MIN_TOKEN_LENGTH_BYTE || ciphertextLength % BLOCK_LENGTH_BYTE != 0) {
      log.error("Field token rejected: unexpected length {} bytes.", data.length);
      throw new CipherInvalidException("Invalid token length.");
    }
    if (data[0] != VERSION) {
      log.error("Field token rejected: unknown version byte.");
      throw new CipherInvalidException("Invalid token version.");
    }

    byte[] expectedHmac = sign(data, data.length - HMAC_LENGTH_BYTE);
    byte[] actualHmac = Arrays.copyOfRange(data, data.length - HMAC_LENGTH_BYTE, data.length);
    if (!MessageDigest.isEqual(expectedHmac, actualHmac)) {
      // Tampering or wrong key
      log.error("Field token rejected: HMAC verification failed (potential tampering or wrong key).");
      throw new CipherInvalidException("Invalid token signature.");
    }

    ByteBuffer buffer = ByteBuffer.wrap(data);
    buffer.get();
    long timestamp = buffer.getLong();
    long now = clock.instant().getEpochSecond();
    if (timestamp > now + MAX_CLOCK_SKEW_SECONDS) {
      log.error("Field token rejected: timestamp {} is in the future (now {}).", timestamp, now);
      throw new CipherInvalidException("Invalid token timestamp.");
    }
    if (maxAge != null && now - timestamp > maxAge.getSeconds()) {
      log.error("Field token rejected: token age {}s exceeds maximum {}s.", now - timestamp, maxAge.getSeconds());
      throw new CipherExpiredException("Token has expired.");
    }

    byte[] iv = new byte[IV_LENGTH_BYTE];
    buffer.get(iv);
    byte[] ciphertext = new byte[ciphertextLength];
    buffer.get(ciphertext);

    try {
      Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
      byte[] plaintext = cipher.doFinal(ciphertext);
      log.trace("Field token decrypted, plaintext length: {} bytes.", plaintext.length);
      return plaintext;
    } catch (BadPaddingException | IllegalBlockSizeException e) {
      log.error("Field token rejected: ciphertext did not decrypt: {}", e.getMessage());
      throw new CipherInvalidException("Invalid token ciphertext.", e);
    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException e) {
      log.error("Field decryption failed due to other cryptographic error: {}", e.getMessage(), e);
      throw new CipherException("Failed to decrypt field.", e);
    }
  }

  private byte[] sign(byte[] data, int length) {
    try {
      Mac mac = Mac.getInstance(MAC_ALGORITHM);
      mac.init(signingKey);
      mac.update(data, 0, length);
      return mac.doFinal();
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      log.error("Field token HMAC computation failed: {}", e.getMessage(), e);
      throw new CipherException("Failed to compute token HMAC.", e);
    }
  }
}
