package upbus.network;

import upbus.UMessage;
import upbus.UMessageType;
import upbus.UPayload;
import upbus.UPayloadFormat;
import upbus.UUri;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UTFDataFormatException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Compact binary {@link UMessageCodec}. Has no external dependencies.
 *
 * <p>Layout (big-endian):
 * <pre>
 * magic 'U' 'M' | version u8 | type u8 | id utf
 * source uri
 * has-destination u8 [destination uri]
 * has-payload u8 [format u8 | length i32 | bytes]
 *
 * uri = authority utf | entity i32 | version u8 | resource u16
 * </pre>
 *
 * <p>Accessible via {@link UMessageCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class BinaryUMessageCodec implements UMessageCodec {
  static final BinaryUMessageCodec INSTANCE = new BinaryUMessageCodec();

  static final byte MAGIC_0 = 'U';
  static final byte MAGIC_1 = 'M';
  static final byte FORMAT_VERSION = 1;

  BinaryUMessageCodec() {
  }

  @Override
  public byte[] encode(UMessage message) {
    Objects.requireNonNull(message, "message");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      out.writeByte(MAGIC_0);
      out.writeByte(MAGIC_1);
      out.writeByte(FORMAT_VERSION);
      out.writeByte(message.type().ordinal());
      out.writeUTF(message.id());
      writeUri(out, message.source());

      UUri destination = message.destination().orElse(null);
      out.writeBoolean(destination != null);
      if (destination != null) {
        writeUri(out, destination);
      }

      UPayload payload = message.payload().orElse(null);
      out.writeBoolean(payload != null);
      if (payload != null) {
        byte[] data = payload.bytes();
        out.writeByte(payload.format().ordinal());
        out.writeInt(data.length);
        out.write(data);
      }
    } catch (UTFDataFormatException e) {
      // id or authority longer than 65535 encoded bytes
      throw new IllegalArgumentException("Message " + abbreviate(message.id()) + " does not fit a frame", e);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  @Override
  public UMessage decode(byte[] frame) {
    Objects.requireNonNull(frame, "frame");
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(frame))) {
      if (in.readByte() != MAGIC_0 || in.readByte() != MAGIC_1) {
        throw new IllegalArgumentException("Not a message frame");
      }
      int version = in.readUnsignedByte();
      if (version != FORMAT_VERSION) {
        throw new IllegalArgumentException("Unsupported frame version " + version);
      }
      UMessageType type = enumAt(UMessageType.values(), in.readUnsignedByte(), "message type");
      String id = in.readUTF();
      UUri source = readUri(in);
      UUri destination = in.readBoolean() ? readUri(in) : null;
      if ((type == UMessageType.NOTIFICATION) != (destination != null)) {
        throw new IllegalArgumentException("Destination does not match message type " + type);
      }

      UPayload payload = null;
      if (in.readBoolean()) {
        UPayloadFormat format = enumAt(UPayloadFormat.values(), in.readUnsignedByte(), "payload format");
        int length = in.readInt();
        if (length < 0 || length > in.available()) {
          throw new IllegalArgumentException("Invalid payload length " + length);
        }
        byte[] data = new byte[length];
        in.readFully(data);
        payload = UPayload.of(data, format);
      }
      if (in.available() > 0) {
        throw new IllegalArgumentException(in.available() + " trailing bytes after message");
      }
      return UMessage.builder(type, source, destination).id(id).payload(payload).build();
    } catch (IOException e) {
      throw new IllegalArgumentException("Truncated message frame", e);
    }
  }

  private static void writeUri(DataOutputStream out, UUri uri) throws IOException {
    out.writeUTF(uri.authority());
    out.writeInt(uri.entityId());
    out.writeByte(uri.version());
    out.writeShort(uri.resourceId());
  }

  private static UUri readUri(DataInputStream in) throws IOException {
    String authority = in.readUTF();
    int entityId = in.readInt();
    int version = in.readUnsignedByte();
    int resourceId = in.readUnsignedShort();
    return new UUri(authority, entityId, version, resourceId);
  }

  private static <E extends Enum<E>> E enumAt(E[] values, int ordinal, String what) {
    if (ordinal >= values.length) {
      throw new IllegalArgumentException("Unknown " + what + " " + ordinal);
    }
    return values[ordinal];
  }

  private static String abbreviate(String value) {
    return value.length() <= 32 ? value : value.substring(0, 32) + "...";
  }
}
