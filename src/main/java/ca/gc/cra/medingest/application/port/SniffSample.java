package ca.gc.cra.medingest.application.port;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Bounded prefix of a file used for content sniffing.
 *
 * @param bytes leading bytes, at most the selector's sniff limit
 * @param text prefix decoded as UTF-8; {@code null} when the bytes are not valid UTF-8
 * @since 0.1.0
 */
public record SniffSample(byte[] bytes, String text) {
  public SniffSample {
    bytes = bytes == null ? new byte[0] : Arrays.copyOf(bytes, bytes.length);
  }

  /**
   * Builds a sample, decoding the bytes strictly as UTF-8. A multi-byte sequence cut off at the end of the
   * prefix does not count as invalid.
   *
   * @param bytes leading bytes
   * @return sample
   */
  public static SniffSample of(byte[] bytes) {
    byte[] safe = bytes == null ? new byte[0] : bytes;
    return new SniffSample(safe, decodeUtf8(safe));
  }

  @Override
  public byte[] bytes() {
    return Arrays.copyOf(bytes, bytes.length);
  }

  /**
   * Returns the decoded text, if the prefix was valid UTF-8.
   *
   * @return optional text
   */
  public Optional<String> utf8Text() {
    return Optional.ofNullable(text);
  }

  /**
   * Checks whether the prefix starts with the given magic bytes.
   *
   * @param magic expected leading bytes
   * @return {@code true} on match
   */
  public boolean startsWith(byte[] magic) {
    if (magic.length > bytes.length) {
      return false;
    }
    for (int i = 0; i < magic.length; i++) {
      if (bytes[i] != magic[i]) {
        return false;
      }
    }
    return true;
  }

  private static String decodeUtf8(byte[] bytes) {
    int end = bytes.length;
    // Drop a trailing partial sequence (at most 3 continuation/lead bytes).
    int back = 0;
    while (back < 3 && end - back - 1 >= 0 && (bytes[end - back - 1] & 0xC0) == 0x80) {
      back++;
    }
    if (end - back - 1 >= 0) {
      int lead = bytes[end - back - 1] & 0xFF;
      int expected = lead >= 0xF0 ? 4 : lead >= 0xE0 ? 3 : lead >= 0xC0 ? 2 : 1;
      if (expected > back + 1) {
        end = end - back - 1;
      }
    }
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes, 0, end))
          .toString();
    } catch (CharacterCodingException ex) {
      return null;
    }
  }
}
