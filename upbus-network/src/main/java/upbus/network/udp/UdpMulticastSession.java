package upbus.network.udp;

import upbus.network.PubSubSession;
import upbus.network.PubSubSessionFactory;
import upbus.util.DaemonThreadFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PubSubSession} over UDP multicast. Every session joins one multicast group and
 * sends each frame as a single datagram prefixed with its key; receivers filter by key.
 *
 * <p>Datagram layout: key length as unsigned 16-bit big-endian, UTF-8 key bytes, frame
 * bytes. A datagram is limited to {@value #MAX_DATAGRAM} bytes. Multicast loopback is
 * enabled so sessions in the same process and on the same host see each other's frames.
 *
 * <p>Delivery is best effort: datagrams can be lost or reordered by the network. Handlers
 * run on the session's single receiver thread.
 */
public final class UdpMulticastSession implements PubSubSession {
  private static final Logger logger = Logger.getLogger(UdpMulticastSession.class.getName());

  public static final String DEFAULT_GROUP = "239.255.77.1";
  public static final int DEFAULT_PORT = 7447;
  public static final int DEFAULT_TTL = 1;
  public static final int MAX_DATAGRAM = 65507;

  private final MulticastSocket socket;
  private final InetSocketAddress groupAddress;
  private final Map<String, List<KeySubscription>> subscriptions = new ConcurrentHashMap<>();
  private final AtomicBoolean open = new AtomicBoolean(true);
  private final Thread receiver;

  private UdpMulticastSession(MulticastSocket socket, InetSocketAddress groupAddress, String name) {
    this.socket = socket;
    this.groupAddress = groupAddress;
    this.receiver = new DaemonThreadFactory("upbus-udp-" + name + "-").newThread(this::receiveLoop);
    this.receiver.start();
  }

  /**
   * Joins a multicast group.
   *
   * @param group the multicast group address
   * @param port  the UDP port
   * @param ttl   the multicast time-to-live, 0..255
   * @return an open session
   * @throws IOException if the socket cannot be bound or the group cannot be joined
   */
  public static UdpMulticastSession open(String group, int port, int ttl) throws IOException {
    return open(group, port, ttl, "session");
  }

  /**
   * Returns a factory joining a multicast group for each opened session.
   *
   * @param group the multicast group address
   * @param port  the UDP port
   * @param ttl   the multicast time-to-live
   * @return the factory
   */
  public static PubSubSessionFactory factory(String group, int port, int ttl) {
    Objects.requireNonNull(group, "group");
    return authority -> open(group, port, ttl, authority);
  }

  private static UdpMulticastSession open(String group, int port, int ttl, String name) throws IOException {
    Objects.requireNonNull(group, "group");
    if (port < 1 || port > 0xFFFF) {
      throw new IllegalArgumentException("port must be within 1..65535: " + port);
    }
    if (ttl < 0 || ttl > 255) {
      throw new IllegalArgumentException("ttl must be within 0..255: " + ttl);
    }
    InetAddress address = InetAddress.getByName(group);
    if (!address.isMulticastAddress()) {
      throw new IOException("Not a multicast address: " + group);
    }
    InetSocketAddress groupAddress = new InetSocketAddress(address, port);
    MulticastSocket socket = new MulticastSocket(null);
    try {
      socket.setReuseAddress(true);
      socket.bind(new InetSocketAddress(port));
      socket.setTimeToLive(ttl);
      socket.setOption(StandardSocketOptions.IP_MULTICAST_LOOP, true);
      socket.joinGroup(groupAddress, null);
    } catch (IOException | RuntimeException e) {
      socket.close();
      throw e;
    }
    logger.info(() -> "Joined multicast group " + groupAddress + " for " + name);
    return new UdpMulticastSession(socket, groupAddress, name);
  }

  @Override
  public void put(String key, byte[] frame) throws IOException {
    if (!open.get()) {
      throw new IOException("UDP session is closed");
    }
    byte[] datagram = encodeDatagram(key, frame);
    socket.send(new DatagramPacket(datagram, datagram.length, groupAddress));
  }

  @Override
  public Subscription subscribe(String key, Consumer<byte[]> handler) throws IOException {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(handler, "handler");
    if (!open.get()) {
      throw new IOException("UDP session is closed");
    }
    KeySubscription subscription = new KeySubscription(key, handler);
    // close() of the last subscription may remove the list concurrently
    subscriptions.compute(key, (k, current) -> {
      List<KeySubscription> list = current == null ? new CopyOnWriteArrayList<>() : current;
      list.add(subscription);
      return list;
    });
    return subscription;
  }

  @Override
  public boolean isOpen() {
    return open.get();
  }

  @Override
  public void close() {
    if (!open.compareAndSet(true, false)) {
      return;
    }
    subscriptions.clear();
    try {
      socket.leaveGroup(groupAddress, null);
    } catch (IOException e) {
      logger.log(Level.FINE, "Failed to leave multicast group " + groupAddress, e);
    }
    socket.close();
    receiver.interrupt();
  }

  private void receiveLoop() {
    byte[] buffer = new byte[MAX_DATAGRAM];
    while (open.get()) {
      DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
      try {
        socket.receive(packet);
      } catch (IOException e) {
        if (!open.get() || socket.isClosed()) {
          break;
        }
        logger.log(Level.SEVERE, "Multicast receive failed", e);
        continue;
      }
      byte[] datagram = Arrays.copyOfRange(packet.getData(), packet.getOffset(),
          packet.getOffset() + packet.getLength());
      Datagram decoded;
      try {
        decoded = decodeDatagram(datagram);
      } catch (IllegalArgumentException e) {
        logger.log(Level.FINE, "Ignoring malformed datagram from " + packet.getSocketAddress(), e);
        continue;
      }
      List<KeySubscription> targets = subscriptions.get(decoded.key);
      if (targets == null) {
        continue;
      }
      for (KeySubscription subscription : targets) {
        if (subscription.active.get()) {
          try {
            subscription.handler.accept(Arrays.copyOf(decoded.frame, decoded.frame.length));
          } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Subscription handler failed on " + decoded.key, e);
          }
        }
      }
    }
    logger.fine(() -> "Receiver stopped for " + groupAddress);
  }

  static byte[] encodeDatagram(String key, byte[] frame) throws IOException {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(frame, "frame");
    byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
    if (keyBytes.length > 0xFFFF) {
      throw new IOException("Key too long: " + keyBytes.length + " bytes");
    }
    int size = 2 + keyBytes.length + frame.length;
    if (size > MAX_DATAGRAM) {
      throw new IOException("Frame of " + size + " bytes exceeds datagram limit of " + MAX_DATAGRAM);
    }
    return ByteBuffer.allocate(size)
        .putShort((short) keyBytes.length)
        .put(keyBytes)
        .put(frame)
        .array();
  }

  static Datagram decodeDatagram(byte[] datagram) {
    if (datagram.length < 2) {
      throw new IllegalArgumentException("Datagram too short");
    }
    ByteBuffer buffer = ByteBuffer.wrap(datagram);
    int keyLength = Short.toUnsignedInt(buffer.getShort());
    if (keyLength > buffer.remaining()) {
      throw new IllegalArgumentException("Key length " + keyLength + " exceeds datagram");
    }
    byte[] keyBytes = new byte[keyLength];
    buffer.get(keyBytes);
    byte[] frame = new byte[buffer.remaining()];
    buffer.get(frame);
    return new Datagram(new String(keyBytes, StandardCharsets.UTF_8), frame);
  }

  static final class Datagram {
    final String key;
    final byte[] frame;

    Datagram(String key, byte[] frame) {
      this.key = key;
      this.frame = frame;
    }
  }

  private final class KeySubscription implements Subscription {
    private final String key;
    private final Consumer<byte[]> handler;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private KeySubscription(String key, Consumer<byte[]> handler) {
      this.key = key;
      this.handler = handler;
    }

    @Override
    public String key() {
      return key;
    }

    @Override
    public void close() {
      if (active.compareAndSet(true, false)) {
        subscriptions.computeIfPresent(key, (k, list) -> {
          list.remove(this);
          return list.isEmpty() ? null : list;
        });
      }
    }
  }
}
