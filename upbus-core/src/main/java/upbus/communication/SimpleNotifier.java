package upbus.communication;

import upbus.UListener;
import upbus.UMessage;
import upbus.UPayload;
import upbus.UTransport;
import upbus.UUri;
import upbus.UriProvider;
import upbus.registry.ListenerRegistration;

import java.util.Objects;

/**
 * {@link Notifier} on top of a {@link UTransport}.
 *
 * <p>Listening is forwarded to the transport's registration API; notifications are sent
 * with the entity's resource topic as source and the given destination.
 */
public final class SimpleNotifier implements Notifier {
  private final UTransport transport;
  private final UriProvider uriProvider;

  public SimpleNotifier(UTransport transport, UriProvider uriProvider) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.uriProvider = Objects.requireNonNull(uriProvider, "uriProvider");
  }

  @Override
  public void notify(int resourceId, UUri destination, UPayload payload) {
    Objects.requireNonNull(destination, "destination");
    UUri source = uriProvider.getResourceUri(resourceId);
    transport.send(UMessage.notification(source, destination).payload(payload).build());
  }

  @Override
  public ListenerRegistration startListening(UUri topic, UListener listener) {
    return transport.registerListener(topic, listener);
  }

  @Override
  public void stopListening(UUri topic, UListener listener) {
    transport.unregisterListener(topic, listener);
  }

  @Override
  public void stopListening(ListenerRegistration registration) {
    transport.unregisterListener(registration);
  }
}
