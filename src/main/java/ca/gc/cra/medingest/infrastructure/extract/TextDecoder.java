package ca.gc.cra.medingest.infrastructure.extract;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Decodes file bytes with a declared charset and one permissive fallback.
 * <p>A UTF-8 byte-order mark is removed before decoding.</p>
 *
 * @since 0.1.0
 */
public final class TextDecoder {
  private final Charset primary;
  private final Charset fallback;

  /** Creates a decoder for UTF-8 with an ISO-8859-1 fallback. */
  public TextDecoder() {
    this(StandardCharsets.UTF_8, StandardCharsets.ISO_8859_1);
  }

  /**
   * Creates a decoder.
   *
   * @param primary declared charset, decoded strictly
   * @param fallback charset tried once when the primary rejects the input
   */
  public TextDecoder(Charset primary, Charset fallback) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  /**
   * Decoded text and the charset that produced it.
   *
   * @param text decoded text
   * @param charset charset used
   * @param usedFallback whether the fallback charset was needed
   */
  public record Decoded(String text, Charset charset, boolean usedFallback) {}

  /**
   * Decodes bytes strictly with the primary charset, then with the fallback.
   *
   * @param bytes raw file bytes
   * @return decoded text, or empty when both charsets reject the input
   */
  public Optional<Decoded> decode(byte[] bytes) {
    byte[] body = stripBom(bytes);
    Optional<String> text = strict(body, primary);
    if (text.isPresent()) {
      return Optional.of(new Decoded(text.get(), primary, false));
    }
    return strict(body, fallback).map(value -> new Decoded(value, fallback, true));
  }

  private static Optional<String> strict(byte[] bytes, Charset charset) {
    try {
      return Optional.of(charset.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString());
    } catch (CharacterCodingException ex) {
      return Optional.empty();
    }
  }

  private static byte[] stripBom(byte[] bytes) {
    if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
      byte[] body = new byte[bytes.length - 3];
      System.arraycopy(bytes, 3, body, 0, body.length);
      return body;
    }
    return bytes;
  }
}
