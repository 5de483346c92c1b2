package tech.yump.passkeeper.crypto;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class FieldCipherTest {

  private static final String KEY = "QijSv1fl9KAz733U_Rjxc2ribjQpJguYP2C5ezrQcwA=";
  private static final Instant ISSUED_AFTER = Instant.parse("2024-11-07T00:00:00Z");
  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

  private FieldCipher fieldCipher;

  @BeforeEach
  void setUp() {
    fieldCipher = cipherAt(NOW);
  }

  private static FieldCipher cipherAt(Instant instant) {
    return new FieldCipher(KEY, ISSUED_AFTER, Clock.fixed(instant, ZoneOffset.UTC));
  }

  @Test
  @DisplayName("Encrypt then decrypt should return the original text")
  void encryptDecrypt_RoundTrip_Success() {
    String token = fieldCipher.encryptText("correct horse battery staple");

    assertNotEquals("correct horse battery staple", token);
    assertEquals("correct horse battery staple", fieldCipher.decryptText(token));
  }

  @Test
  @DisplayName("Empty plaintext should round trip to empty")
  void encryptDecrypt_EmptyInput_Success() {
    String token = fieldCipher.encrypt(new byte[0]);

    assertArrayEquals(new byte[0], fieldCipher.decrypt(token));
  }

  @Test
  @DisplayName("Two encryptions of the same text should produce different tokens")
  void encrypt_SamePlaintext_ProducesDistinctTokens() {
    assertNotEquals(fieldCipher.encryptText("same"), fieldCipher.encryptText("same"));
  }

  @Test
  @DisplayName("Decrypt should accept a token produced by another Fernet implementation")
  void decrypt_ReferenceToken_Success() {
    // Reference vector: key, token and time from the Fernet specification
    String referenceKey = "cw_0x689RpI-jtRR7oE8h_eQsKImvJapLeSbXpwF4e4=";
    String referenceToken = "gAAAAAAdwJ6wAAECAwQFBgcICQoLDA0ODy021cpGVWKZ_eEwCGM4BLLF_5CV9dOPmrhuVUPgJobwOz7JcbmrR64jVmpU4IwqDA==";
    FieldCipher reference = new FieldCipher(referenceKey, Instant.EPOCH,
            Clock.fixed(Instant.ofEpochSecond(499162801L), ZoneOffset.UTC));

    byte[] plaintext = reference.decrypt(referenceToken, Duration.ofSeconds(60));

    assertEquals("hello", new String(plaintext, StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Decrypt should throw CipherInvalidException when any bit of the token is flipped")
  void decrypt_WhenTampered_ThrowsCipherInvalidException() {
    byte[] raw = Base64.getUrlDecoder().decode(fieldCipher.encryptText("secret"));

    for (int i = 0; i < raw.length; i++) {
      byte[] tampered = raw.clone();
      tampered[i] ^= 0x01;
      String tamperedToken = Base64.getUrlEncoder().encodeToString(tampered);
      assertThrows(CipherInvalidException.class, () -> fieldCipher.decrypt(tamperedToken),
              "Flipping a bit at position " + i + " should invalidate the token");
    }
  }

  @Test
  @DisplayName("Decrypt should throw CipherInvalidException for a token made with another key")
  void decrypt_WhenWrongKey_ThrowsCipherInvalidException() {
    FieldCipher other = new FieldCipher("cw_0x689RpI-jtRR7oE8h_eQsKImvJapLeSbXpwF4e4=", ISSUED_AFTER,
            Clock.fixed(NOW, ZoneOffset.UTC));
    String token = other.encryptText("secret");

    assertThrows(CipherInvalidException.class, () -> fieldCipher.decrypt(token));
  }

  @Test
  @DisplayName("Decrypt should throw CipherInvalidException for garbage input")
  void decrypt_WhenMalformed_ThrowsCipherInvalidException() {
    assertThrows(CipherInvalidException.class, () -> fieldCipher.decrypt("not a token!"));
    assertThrows(CipherInvalidException.class, () -> fieldCipher.decrypt("gAAAAA"));
    assertThrows(CipherInvalidException.class, () -> fieldCipher.decrypt(""));
    assertThrows(CipherInvalidException.class, () -> fieldCipher.decrypt((String) null));
  }

  @Test
  @DisplayName("Decrypt should throw CipherExpiredException when the token is older than maxAge")
  void decrypt_WhenOlderThanMaxAge_ThrowsCipherExpiredException() {
    String token = cipherAt(NOW.minusSeconds(120)).encryptText("secret");

    assertThrows(CipherExpiredException.class, () -> fieldCipher.decrypt(token, Duration.ofSeconds(60)));
    assertEquals("secret", new String(fieldCipher.decrypt(token, Duration.ofSeconds(300)), StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Decrypt without maxAge should reject tokens created before the issued-after instant")
  void decrypt_WhenCreatedBeforeCutOff_ThrowsCipherExpiredException() {
    String token = cipherAt(ISSUED_AFTER.minus(Duration.ofDays(1))).encryptText("legacy");

    assertThrows(CipherExpiredException.class, () -> fieldCipher.decrypt(token));
  }

  @Test
  @DisplayName("Decrypt should throw CipherInvalidException for a token stamped too far in the future")
  void decrypt_WhenFromTheFuture_ThrowsCipherInvalidException() {
    String token = cipherAt(NOW.plusSeconds(3600)).encryptText("secret");

    assertThrows(CipherInvalidException.class, () -> fieldCipher.decrypt(token));
    // Within the allowed clock skew
    String skewed = cipherAt(NOW.plusSeconds(30)).encryptText("secret");
    assertEquals("secret", fieldCipher.decryptText(skewed));
  }

  @Test
  @DisplayName("Constructor should reject keys that are not 32 bytes of URL-safe base64")
  void constructor_WhenKeyInvalid_ThrowsIllegalArgumentException() {
    Clock clock = Clock.systemUTC();
    assertThrows(IllegalArgumentException.class, () -> new FieldCipher("c2hvcnQ=", ISSUED_AFTER, clock));
    assertThrows(IllegalArgumentException.class, () -> new FieldCipher("***", ISSUED_AFTER, clock));
  }
}
