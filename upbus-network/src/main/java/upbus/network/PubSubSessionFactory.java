package upbus.network;

import java.io.IOException;

/**
 * Opens the {@link PubSubSession} of a {@link NetworkTransport}.
 */
@FunctionalInterface
public interface PubSubSessionFactory {

  /**
   * Opens a session for an authority.
   *
   * @param authority the authority the transport serves
   * @return an open session
   * @throws IOException if the session cannot be opened
   */
  PubSubSession open(String authority) throws IOException;
}
