package upbus.network.loopback;

import upbus.network.PubSubSession;
import upbus.util.DaemonThreadFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

final class LoopbackSession implements PubSubSession {
  private static final Logger logger = Logger.getLogger(LoopbackSession.class.getName());

  private final LoopbackNetwork network;
  private final ExecutorService delivery;
  private final Map<String, List<KeySubscription>> subscriptions = new ConcurrentHashMap<>();
  private final AtomicBoolean open = new AtomicBoolean(true);

  LoopbackSession(LoopbackNetwork network, String authority) {
    this.network = network;
    this.delivery = Executors.newSingleThreadExecutor(
        new DaemonThreadFactory("upbus-loopback-" + authority + "-"));
  }

  @Override
  public void put(String key, byte[] frame) throws IOException {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(frame, "frame");
    if (!open.get()) {
      throw new IOException("Loopback session is closed");
    }
    network.route(key, Arrays.copyOf(frame, frame.length));
  }

  @Override
  public Subscription subscribe(String key, Consumer<byte[]> handler) throws IOException {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(handler, "handler");
    if (!open.get()) {
      throw new IOException("Loopback session is closed");
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

  void deliver(String key, byte[] frame) {
    List<KeySubscription> targets = subscriptions.get(key);
    if (targets == null || targets.isEmpty() || !open.get()) {
      return;
    }
    try {
      delivery.execute(() -> {
        for (KeySubscription subscription : targets) {
          if (subscription.active.get()) {
            handle(subscription, Arrays.copyOf(frame, frame.length));
          }
        }
      });
    } catch (RejectedExecutionException e) {
      logger.fine(() -> "Session closed; frame on " + key + " not delivered");
    }
  }

  private static void handle(KeySubscription subscription, byte[] frame) {
    try {
      subscription.handler.accept(frame);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Subscription handler failed on " + subscription.key, e);
    }
  }

  @Override
  public void close() {
    if (!open.compareAndSet(true, false)) {
      return;
    }
    network.detach(this);
    subscriptions.clear();
    delivery.shutdown();
    try {
      if (!delivery.awaitTermination(1, TimeUnit.SECONDS)) {
        delivery.shutdownNow();
      }
    } catch (InterruptedException e) {
      delivery.shutdownNow();
      Thread.currentThread().interrupt();
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
