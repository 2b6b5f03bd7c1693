package ca.gc.cra.sentinel.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep source content and secrets out of logs.
 * <p><strong>Why:</strong> Analysed files may contain credentials; logs and finding snippets must carry
 * only short, masked excerpts.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate UTF-8 text to a safe byte budget while preserving readability.</li>
 *   <li>Mask secret values so only a recognizable prefix survives.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final int MASK_VISIBLE_PREFIX = 4;

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, Math.min(bytes.length, maxBytes), StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Replaces every occurrence of {@code secret} in {@code text} with a masked form that keeps the first
   * four characters (e.g., {@code AKIA****************}).
   *
   * @param text surrounding text such as a source line; {@code null} yields {@code "<null>"}
   * @param secret matched secret value; blank values leave {@code text} unchanged
   * @return text with the secret masked
   */
  public static String mask(String text, String secret) {
    if (text == null) {
      return NULL_PLACEHOLDER;
    }
    if (secret == null || secret.isBlank()) {
      return text;
    }
    int visible = Math.min(MASK_VISIBLE_PREFIX, secret.length() / 2);
    String masked = secret.substring(0, visible) + "*".repeat(secret.length() - visible);
    return text.replace(secret, masked);
  }
}
