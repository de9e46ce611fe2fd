package upbus;

/**
 * Declared encoding of a {@link UPayload}'s bytes.
 *
 * <p>The ordinal is part of the network wire format; append new constants only.
 */
public enum UPayloadFormat {
  UNSPECIFIED,
  /** UTF-8 text. */
  TEXT,
  /** Opaque bytes. */
  RAW
}
