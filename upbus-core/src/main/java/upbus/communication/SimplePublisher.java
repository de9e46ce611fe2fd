package upbus.communication;

import upbus.UMessage;
import upbus.UPayload;
import upbus.UTransport;
import upbus.UUri;
import upbus.UriProvider;

import java.util.Objects;

/**
 * {@link Publisher} that resolves resource ids through a {@link UriProvider} and sends
 * publish messages over a {@link UTransport}.
 *
 * <pre>{@code
 * Publisher publisher = new SimplePublisher(transport, new StaticUriProvider("veh", 0xA34B, 1));
 * publisher.publish(0x8001, UPayload.fromString("hi"));
 * }</pre>
 */
public final class SimplePublisher implements Publisher {
  private final UTransport transport;
  private final UriProvider uriProvider;

  public SimplePublisher(UTransport transport, UriProvider uriProvider) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.uriProvider = Objects.requireNonNull(uriProvider, "uriProvider");
  }

  @Override
  public void publish(int resourceId, UPayload payload) {
    UUri topic = uriProvider.getResourceUri(resourceId);
    transport.send(UMessage.publish(topic).payload(payload).build());
  }
}
