package upbus.registry;

import upbus.UListener;
import upbus.UUri;

import java.util.Objects;

/**
 * Handle for one (topic, listener) registration.
 *
 * <p>Unregistering by handle does not depend on how the caller's listener compares for
 * equality: the handle itself identifies the registration. Handles compare by identity, so a
 * handle only ever matches the registry that issued it. Ids are unique within the process.
 *
 * @see ListenerRegistry#unregister(ListenerRegistration)
 */
public final class ListenerRegistration {
  private final long id;
  private final UUri topic;
  private final UListener listener;

  ListenerRegistration(long id, UUri topic, UListener listener) {
    this.id = id;
    this.topic = Objects.requireNonNull(topic, "topic");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public long id() {
    return id;
  }

  public UUri topic() {
    return topic;
  }

  public UListener listener() {
    return listener;
  }

  @Override
  public String toString() {
    return "ListenerRegistration{id=" + id + ", topic=" + topic + '}';
  }
}
