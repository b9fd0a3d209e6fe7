/* Moodvault © 2025 — MIT */
package dev.moodvault.migration;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.moodvault.api.ErrorCode;
import dev.moodvault.api.ValidationException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class FernetTokenTest {
  private static final Instant ISSUED = Instant.parse("2023-11-02T08:30:00Z");

  private static byte[] key(int seed) {
    byte[] key = new byte[32];
    Arrays.fill(key, (byte) seed);
    return key;
  }

  @Test
  void opensTokenAndReportsIssueTime() throws Exception {
    String token = LegacyFixtures.fernet(key(1), ISSUED, "{\"mood\":\"6\"}");

    FernetToken.Opened opened = FernetToken.open(token, key(1));

    assertArrayEquals("{\"mood\":\"6\"}".getBytes(StandardCharsets.UTF_8), opened.plaintext());
    assertEquals(ISSUED, opened.issuedAt());
  }

  @Test
  void wrongKeyFailsSignatureCheck() throws Exception {
    String token = LegacyFixtures.fernet(key(1), ISSUED, "{}");

    ValidationException e =
        assertThrows(ValidationException.class, () -> FernetToken.open(token, key(2)));
    assertEquals(ErrorCode.INVALID_RECORD, e.errorCode());
    assertEquals("token signature does not verify", e.getMessage());
  }

  @Test
  void tamperedCiphertextIsRejected() throws Exception {
    byte[] raw = Base64.getUrlDecoder().decode(LegacyFixtures.fernet(key(1), ISSUED, "{}"));
    raw[30] ^= 0x01;
    String tampered = Base64.getUrlEncoder().encodeToString(raw);

    assertThrows(ValidationException.class, () -> FernetToken.open(tampered, key(1)));
  }

  @Test
  void malformedTokensAreRejected() {
    assertThrows(ValidationException.class, () -> FernetToken.open("***", key(1)));
    assertThrows(ValidationException.class, () -> FernetToken.open("gAAAAA", key(1)));
    assertThrows(IllegalArgumentException.class, () -> FernetToken.open("gAAAAA", new byte[16]));
  }
}
