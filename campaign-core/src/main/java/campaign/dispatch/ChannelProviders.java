package campaign.dispatch;

import campaign.model.Channel;
import campaign.spi.MessageProvider;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One {@link MessageProvider} per channel.
 */
public final class ChannelProviders {
  private final Map<Channel, MessageProvider> providers;

  private ChannelProviders(Map<Channel, MessageProvider> providers) {
    this.providers = providers;
  }

  /**
   * @throws IllegalArgumentException if two providers claim the same channel
   */
  public static ChannelProviders of(Collection<? extends MessageProvider> providers) {
    Map<Channel, MessageProvider> byChannel = new EnumMap<>(Channel.class);
    for (MessageProvider provider : providers) {
      Channel channel = Objects.requireNonNull(provider.channel(), "provider.channel()");
      MessageProvider previous = byChannel.putIfAbsent(channel, provider);
      if (previous != null) {
        throw new IllegalArgumentException("Duplicate provider for channel " + channel.value() + ": "
            + previous.getClass().getName() + " and " + provider.getClass().getName());
      }
    }
    return new ChannelProviders(byChannel);
  }

  /**
   * @return the provider, or {@code null} when none is registered
   */
  public MessageProvider get(Channel channel) {
    return providers.get(channel);
  }

  public boolean isEmpty() {
    return providers.isEmpty();
  }
}
