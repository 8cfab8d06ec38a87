package ca.gc.cra.eventstream.domain.stream;

import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Opaque, remote-assigned replay position within a topic's event history.
 *
 * <p>Instances are immutable; the backing bytes are copied on the way in and on the way out so
 * the owning subscription worker is the only party able to move its position forward.</p>
 *
 * @since 0.1.0
 */
public final class Checkpoint {
  private final byte[] value;

  private Checkpoint(byte[] value) {
    this.value = value;
  }

  /**
   * Wraps a copy of the supplied replay id.
   *
   * @param replayId raw replay id bytes; must not be {@code null} or empty
   * @return checkpoint holding a private copy of {@code replayId}
   * @throws IllegalArgumentException when {@code replayId} is empty
   */
  public static Checkpoint of(byte[] replayId) {
    Objects.requireNonNull(replayId, "replayId");
    if (replayId.length == 0) {
      throw new IllegalArgumentException("replayId must not be empty");
    }
    return new Checkpoint(replayId.clone());
  }

  /**
   * Decodes a base64 replay id as written in configuration files.
   *
   * @param base64 base64 text; must not be blank
   * @return decoded checkpoint
   * @throws IllegalArgumentException when the text is blank or not valid base64
   */
  public static Checkpoint fromBase64(String base64) {
    if (base64 == null || base64.isBlank()) {
      throw new IllegalArgumentException("replay id must not be blank");
    }
    try {
      return of(Base64.getDecoder().decode(base64.trim()));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("replay id must be valid base64", ex);
    }
  }

  /**
   * Returns a copy of the replay id bytes.
   *
   * @return replay id bytes; caller owns the returned array
   */
  public byte[] toBytes() {
    return value.clone();
  }

  /**
   * Returns the base64 text form used in configuration and logs.
   *
   * @return base64 encoding of the replay id
   */
  public String toBase64() {
    return Base64.getEncoder().encodeToString(value);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof Checkpoint that && Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return "Checkpoint[" + HexFormat.of().formatHex(value) + ']';
  }
}
