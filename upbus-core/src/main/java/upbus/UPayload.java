package upbus;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable message payload: an opaque byte sequence with a declared format.
 *
 * <p>A message without payload carries no {@code UPayload} at all, which is distinct from
 * a message carrying an empty payload.
 */
public final class UPayload {
  private final byte[] bytes;
  private final UPayloadFormat format;

  private UPayload(byte[] bytes, UPayloadFormat format) {
    this.bytes = bytes;
    this.format = format;
  }

  /**
   * Creates a payload holding the UTF-8 encoding of a string.
   *
   * @param value the text
   * @return a {@link UPayloadFormat#TEXT} payload
   */
  public static UPayload fromString(String value) {
    Objects.requireNonNull(value, "value");
    return new UPayload(value.getBytes(StandardCharsets.UTF_8), UPayloadFormat.TEXT);
  }

  /**
   * Creates a payload from raw bytes. The array is copied.
   *
   * @param data the bytes
   * @return a {@link UPayloadFormat#RAW} payload
   */
  public static UPayload fromBytes(byte[] data) {
    return of(data, UPayloadFormat.RAW);
  }

  /**
   * Creates a payload with an explicit format. The array is copied.
   *
   * @param data   the bytes
   * @param format the declared format
   * @return a new payload
   */
  public static UPayload of(byte[] data, UPayloadFormat format) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(format, "format");
    return new UPayload(Arrays.copyOf(data, data.length), format);
  }

  public byte[] bytes() {
    return Arrays.copyOf(bytes, bytes.length);
  }

  public UPayloadFormat format() {
    return format;
  }

  public int size() {
    return bytes.length;
  }

  public boolean isEmpty() {
    return bytes.length == 0;
  }

  /**
   * Decodes the bytes as UTF-8.
   *
   * @return the text, or empty if the bytes are not valid UTF-8
   */
  public Optional<String> asString() {
    try {
      return Optional.of(StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString());
    } catch (CharacterCodingException e) {
      return Optional.empty();
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof UPayload)) return false;
    UPayload other = (UPayload) o;
    return format == other.format && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(bytes) + format.hashCode();
  }

  @Override
  public String toString() {
    return "UPayload{format=" + format + ", size=" + bytes.length + '}';
  }
}
