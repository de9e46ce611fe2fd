package upbus.network;

import upbus.UMessage;

/**
 * Codec between {@link UMessage}s and the frames a {@link PubSubSession} carries.
 *
 * <p>Encoding must be lossless for id, type, source, destination, payload bytes and payload
 * format. The default implementation ({@link BinaryUMessageCodec}) is a compact,
 * versioned binary format.
 *
 * @see #getDefault()
 */
public interface UMessageCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link UMessageCodec}
   */
  static UMessageCodec getDefault() {
    return BinaryUMessageCodec.INSTANCE;
  }

  /**
   * Encodes a message.
   *
   * @param message the message
   * @return the frame
   */
  byte[] encode(UMessage message);

  /**
   * Decodes a frame.
   *
   * @param frame the frame
   * @return the message
   * @throws IllegalArgumentException if the frame is not a valid encoding
   */
  UMessage decode(byte[] frame);
}
