package upbus.registry;

import upbus.InvalidTopicException;
import upbus.ListenerNotFoundException;
import upbus.UListener;
import upbus.UMessage;
import upbus.UUri;
import upbus.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link ListenerRegistry} keyed by topic.
 *
 * <h2>Thread Safety</h2>
 * <p>Each topic maps to an immutable list of registrations that is replaced, never modified,
 * by {@link Map#compute}, so mutations of one topic are atomic and different topics do not
 * contend. {@link #dispatch} iterates the list it read at the start; a listener that
 * registers or unregisters from inside its callback affects the next dispatch only.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ListenerRegistry registry = new DefaultListenerRegistry();
 * ListenerRegistration registration = registry.register(topic, msg -> handle(msg));
 * registry.dispatch(topic, message);
 * registry.unregister(registration);
 * }</pre>
 *
 * @see ListenerRegistration
 */
public final class DefaultListenerRegistry implements ListenerRegistry {
  private static final Logger logger = Logger.getLogger(DefaultListenerRegistry.class.getName());

  private final Map<UUri, List<ListenerRegistration>> listeners = new ConcurrentHashMap<>();
  private static final AtomicLong registrationIds = new AtomicLong();

  private final AtomicInteger registered = new AtomicInteger();
  private final MetricsExporter metrics;

  public DefaultListenerRegistry() {
    this(MetricsExporter.NOOP);
  }

  public DefaultListenerRegistry(MetricsExporter metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public ListenerRegistration register(UUri topic, UListener listener) {
    InvalidTopicException.requireTopic(topic);
    Objects.requireNonNull(listener, "listener");

    AtomicReference<ListenerRegistration> existing = new AtomicReference<>();
    AtomicReference<ListenerRegistration> created = new AtomicReference<>();
    listeners.compute(topic, (key, current) -> {
      List<ListenerRegistration> snapshot = current == null ? List.of() : current;
      for (ListenerRegistration registration : snapshot) {
        if (registration.listener() == listener) {
          existing.set(registration);
          return current;
        }
      }
      ListenerRegistration registration =
          new ListenerRegistration(registrationIds.incrementAndGet(), key, listener);
      created.set(registration);
      List<ListenerRegistration> next = new ArrayList<>(snapshot.size() + 1);
      next.addAll(snapshot);
      next.add(registration);
      return Collections.unmodifiableList(next);
    });

    if (existing.get() != null) {
      logger.fine(() -> "Listener already registered for " + topic + "; keeping " + existing.get());
      return existing.get();
    }
    registered.incrementAndGet();
    publishRegisteredCount();
    logger.fine(() -> "Registered " + created.get());
    return created.get();
  }

  @Override
  public void unregister(UUri topic, UListener listener) {
    InvalidTopicException.requireTopic(topic);
    Objects.requireNonNull(listener, "listener");
    removeMatching(topic, registration -> registration.listener() == listener);
  }

  @Override
  public void unregister(ListenerRegistration registration) {
    Objects.requireNonNull(registration, "registration");
    removeMatching(registration.topic(), candidate -> candidate == registration);
  }

  private void removeMatching(UUri topic, Predicate<ListenerRegistration> match) {
    AtomicReference<ListenerRegistration> removed = new AtomicReference<>();
    listeners.computeIfPresent(topic, (key, current) -> {
      List<ListenerRegistration> next = new ArrayList<>(current.size());
      for (ListenerRegistration registration : current) {
        if (removed.get() == null && match.test(registration)) {
          removed.set(registration);
        } else {
          next.add(registration);
        }
      }
      if (removed.get() == null) {
        return current;
      }
      return next.isEmpty() ? null : Collections.unmodifiableList(next);
    });

    if (removed.get() == null) {
      throw new ListenerNotFoundException(topic);
    }
    registered.decrementAndGet();
    publishRegisteredCount();
    logger.fine(() -> "Unregistered " + removed.get());
  }

  // reads the count under the lock so the last published value is never older than the last update
  private void publishRegisteredCount() {
    synchronized (registered) {
      metrics.recordRegisteredListeners(registered.get());
    }
  }

  @Override
  public int dispatch(UUri topic, UMessage message) {
    Objects.requireNonNull(message, "message");
    List<ListenerRegistration> snapshot = listeners.get(topic);
    if (snapshot == null) {
      return 0;
    }
    for (ListenerRegistration registration : snapshot) {
      try {
        registration.listener().onReceive(message);
      } catch (RuntimeException e) {
        metrics.incrementListenerFailure();
        logger.log(Level.WARNING, "Listener " + registration.id() + " failed on message "
            + message.id() + " for " + topic, e);
      }
    }
    return snapshot.size();
  }

  @Override
  public boolean isRegistered(ListenerRegistration registration) {
    List<ListenerRegistration> snapshot = listeners.get(registration.topic());
    if (snapshot == null) {
      return false;
    }
    for (ListenerRegistration candidate : snapshot) {
      if (candidate == registration) {
        return true;
      }
    }
    return false;
  }

  @Override
  public int listenerCount(UUri topic) {
    List<ListenerRegistration> snapshot = listeners.get(topic);
    return snapshot == null ? 0 : snapshot.size();
  }

  @Override
  public Set<UUri> topics() {
    return Set.copyOf(listeners.keySet());
  }

  @Override
  public void clear() {
    for (UUri topic : listeners.keySet()) {
      List<ListenerRegistration> removed = listeners.remove(topic);
      if (removed != null) {
        registered.addAndGet(-removed.size());
      }
    }
    publishRegisteredCount();
  }
}
