package tech.yump.passkeeper.crypto;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import javax.crypto.AEADBadTagException;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;
import java.util.Base64;
import java.util.Set;

/**
 * AES-GCM encryption for file content. Output format: {@code nonce (12) || ciphertext || tag (16)}.
 */
@Slf4j
public class BlobCipher {

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int TAG_LENGTH_BIT = 128; // Standard for GCM
  private static final int NONCE_LENGTH_BYTE = 12; // Recommended for GCM
  private static final String AES = "AES";
  private static final Set<Integer> ALLOWED_KEY_LENGTHS = Set.of(16, 24, 32);

  private final SecretKey key;
  private final SecureRandom secureRandom = new SecureRandom();

  /**
   * @param base64Key a 128, 192 or 256 bit AES key, standard base64 encoded
   */
  public BlobCipher(String base64Key) {
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(base64Key.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Blob cipher key must be base64 encoded.", e);
    }
    if (!ALLOWED_KEY_LENGTHS.contains(keyBytes.length)) {
      throw new IllegalArgumentException("Blob cipher key must decode to 16, 24 or 32 bytes, got " + keyBytes.length);
    }
    this.key = new SecretKeySpec(keyBytes, AES);
    Arrays.fill(keyBytes, (byte) 0);
    log.info("BlobCipher initialized with a {}-bit AES key.", key.getEncoded().length * 8);
  }

  /**
   * Encrypts the given content using AES-GCM with a fresh random nonce.
   *
   * @param plaintext The byte array to encrypt. May be empty, cannot be null.
   * @return nonce || ciphertext || tag
   * @throws CipherException If any cryptographic error occurs during encryption.
   */
  public byte[] encrypt(byte[] plaintext) {
    if (plaintext == null) {
      throw new CipherException("Plaintext cannot be null.");
    }
    log.debug("Attempting to encrypt {} bytes of blob content.", plaintext.length);

    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    secureRandom.nextBytes(nonce);
    GCMParameterSpec gcmParameterSpec = new GCMParameterSpec(TAG_LENGTH_BIT, nonce);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, gcmParameterSpec);

      // JCE appends the tag to the ciphertext
      byte[] ciphertext = cipher.doFinal(plaintext);
      log.debug("Blob encryption successful, ciphertext length: {} bytes.", ciphertext.length);

      return ByteBuffer.allocate(nonce.length + ciphertext.length)
              .put(nonce)
              .put(ciphertext)
              .array();

    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException | IllegalBlockSizeException | BadPaddingException e) {
      log.error("Blob encryption failed: {}", e.getMessage(), e);
      throw new CipherException("Failed to encrypt blob.", e);
    }
  }

  /**
   * Decrypts content produced by {@link #encrypt(byte[])}, verifying the GCM tag.
   *
   * @param nonceAndCiphertext nonce || ciphertext || tag
   * @return the original content
   * @throws CipherInvalidException if the input is shorter than a nonce or the tag does not verify
   * @throws CipherException        on other cryptographic errors
   */
  public byte[] decrypt(byte[] nonceAndCiphertext) {
    if (nonceAndCiphertext == null || nonceAndCiphertext.length < NONCE_LENGTH_BYTE) {
      throw new CipherInvalidException("Invalid input: nonce and ciphertext array is null or too short.");
    }
    log.debug("Attempting to decrypt {} bytes of blob content.", nonceAndCiphertext.length);

    ByteBuffer bb = ByteBuffer.wrap(nonceAndCiphertext);
    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    bb.get(nonce);
    byte[] ciphertext = new byte[bb.remaining()];
    bb.get(ciphertext);

    GCMParameterSpec gcmParameterSpec = new GCMParameterSpec(TAG_LENGTH_BIT, nonce);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, gcmParameterSpec);
      byte[] plaintext = cipher.doFinal(ciphertext);
      log.debug("Blob decryption successful, plaintext length: {} bytes.", plaintext.length);
      return plaintext;

    } catch (AEADBadTagException e) {
      log.error("Blob decryption failed due to invalid authentication tag (potential tampering or wrong key): {}", e.getMessage());
      throw new CipherInvalidException("Decryption failed: invalid authentication tag.", e);
    } catch (IllegalBlockSizeException | BadPaddingException e) {
      // Input shorter than the tag lands here
      log.error("Blob decryption failed, ciphertext is malformed: {}", e.getMessage());
      throw new CipherInvalidException("Decryption failed: malformed ciphertext.", e);
    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException e) {
      log.error("Blob decryption failed due to other cryptographic error: {}", e.getMessage(), e);
      throw new CipherException("Failed to decrypt blob.", e);
    }
  }
}
