package campaign.spi;

import campaign.ProviderException;
import campaign.SendReceipt;
import campaign.SendRequest;
import campaign.model.Channel;

/**
 * Outbound provider for one channel: an e-mail API, an SMS gateway, a task system that
 * creates call tasks. This is the dispatcher's only external side effect.
 */
public interface MessageProvider {

  Channel channel();

  /**
   * Sends one rendered message.
   *
   * @return the provider's acknowledgment
   * @throws ProviderException classified as transient or permanent
   */
  SendReceipt send(SendRequest request);
}
