package tech.yump.passkeeper.crypto;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.AEADBadTagException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class BlobCipherTest {

  private static final String KEY = "AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=";
  private static final int NONCE_LENGTH = 12;
  private static final int TAG_LENGTH = 16;

  private BlobCipher blobCipher;
  private byte[] samplePlaintext;

  @BeforeEach
  void setUp() {
    blobCipher = new BlobCipher(KEY);
    samplePlaintext = "%PDF-1.7 binary content".getBytes(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("Encrypt then Decrypt should return original content")
  void encryptDecrypt_RoundTrip_Success() {
    byte[] encrypted = blobCipher.encrypt(samplePlaintext);

    assertEquals(NONCE_LENGTH + samplePlaintext.length + TAG_LENGTH, encrypted.length,
            "Output should be nonce + ciphertext + tag");
    assertArrayEquals(samplePlaintext, blobCipher.decrypt(encrypted));
  }

  @Test
  @DisplayName("Empty content should round trip")
  void encryptDecrypt_EmptyContent_Success() {
    byte[] encrypted = blobCipher.encrypt(new byte[0]);

    assertArrayEquals(new byte[0], blobCipher.decrypt(encrypted));
  }

  @Test
  @DisplayName("Each encryption should use a fresh nonce")
  void encrypt_SameContent_UsesFreshNonce() {
    byte[] first = blobCipher.encrypt(samplePlaintext);
    byte[] second = blobCipher.encrypt(samplePlaintext);

    assertFalse(Arrays.equals(Arrays.copyOf(first, NONCE_LENGTH), Arrays.copyOf(second, NONCE_LENGTH)));
  }

  @Test
  @DisplayName("Decrypt should throw CipherInvalidException when any byte of nonce, ciphertext or tag is flipped")
  void decrypt_WhenTampered_ThrowsCipherInvalidException() {
    byte[] encrypted = blobCipher.encrypt(samplePlaintext);

    for (int i = 0; i < encrypted.length; i++) {
      byte[] tampered = encrypted.clone();
      tampered[i] ^= 0x01;
      CipherInvalidException exception = assertThrows(CipherInvalidException.class, () -> blobCipher.decrypt(tampered),
              "Flipping a bit at position " + i + " should invalidate the blob");
      assertInstanceOf(AEADBadTagException.class, exception.getCause());
    }
  }

  @Test
  @DisplayName("Decrypt should throw CipherInvalidException for content encrypted with another key")
  void decrypt_WhenWrongKey_ThrowsCipherInvalidException() {
    BlobCipher other = new BlobCipher("M2M3MzBhNzM2Nzk2NGFiZDkxODdkZjJiYjE3NGQzNmI=");
    byte[] encrypted = other.encrypt(samplePlaintext);

    assertThrows(CipherInvalidException.class, () -> blobCipher.decrypt(encrypted));
  }

  @Test
  @DisplayName("Decrypt should throw CipherInvalidException for input shorter than a nonce")
  void decrypt_WhenTooShort_ThrowsCipherInvalidException() {
    assertThrows(CipherInvalidException.class, () -> blobCipher.decrypt(new byte[5]));
    assertThrows(CipherInvalidException.class, () -> blobCipher.decrypt(null));
  }

  @Test
  @DisplayName("Constructor should reject keys of unsupported length")
  void constructor_WhenKeyLengthInvalid_ThrowsIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> new BlobCipher("c2hvcnQ="));
    assertThrows(IllegalArgumentException.class, () -> new BlobCipher("not base64 ***"));
  }
}
