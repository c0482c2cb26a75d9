package campaign.spring.boot;

import campaign.SendReceipt;
import campaign.SendRequest;
import campaign.model.Channel;
import campaign.spi.MessageProvider;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects the {@link MessageProvider} beans the engine dispatches through, applying
 * {@link CampaignProvider} channel bindings.
 *
 * @see CampaignProvider
 */
public class CampaignProviderRegistrar {
  private static final Logger logger = Logger.getLogger(CampaignProviderRegistrar.class.getName());

  private final ListableBeanFactory beanFactory;

  public CampaignProviderRegistrar(ListableBeanFactory beanFactory) {
    this.beanFactory = beanFactory;
  }

  /**
   * @return one provider per served channel, in bean registration order
   * @throws BeanCreationException if a {@code @CampaignProvider} bean is not a
   *     {@link MessageProvider}
   */
  public List<MessageProvider> providers() {
    for (Map.Entry<String, Object> entry : beanFactory.getBeansWithAnnotation(CampaignProvider.class).entrySet()) {
      if (!(entry.getValue() instanceof MessageProvider)) {
        throw new BeanCreationException(entry.getKey(), "Bean annotated with @CampaignProvider must implement "
            + "MessageProvider, but " + entry.getValue().getClass().getName() + " does not");
      }
    }

    List<MessageProvider> providers = new ArrayList<>();
    for (Map.Entry<String, MessageProvider> entry : beanFactory.getBeansOfType(MessageProvider.class).entrySet()) {
      MessageProvider provider = entry.getValue();
      Set<Channel> channels = boundChannels(provider);
      if (channels.isEmpty()) {
        providers.add(provider);
        continue;
      }
      for (Channel channel : channels) {
        providers.add(channel == provider.channel() ? provider : new ChannelBoundProvider(channel, provider));
      }
      logger.log(Level.FINE, "Provider bean {0} bound to channels {1}", new Object[]{entry.getKey(), channels});
    }
    return providers;
  }

  private static Set<Channel> boundChannels(MessageProvider provider) {
    // searches superclasses too, so CGLIB proxies still resolve
    CampaignProvider annotation = AnnotationUtils.findAnnotation(provider.getClass(), CampaignProvider.class);
    if (annotation == null) {
      return Set.of();
    }
    return new LinkedHashSet<>(Arrays.asList(annotation.channels()));
  }

  /**
   * Serves {@code channel} through a provider declared for another one.
   */
  static final class ChannelBoundProvider implements MessageProvider {
    private final Channel channel;
    private final MessageProvider delegate;

    ChannelBoundProvider(Channel channel, MessageProvider delegate) {
      this.channel = channel;
      this.delegate = delegate;
    }

    @Override
    public Channel channel() {
      return channel;
    }

    @Override
    public SendReceipt send(SendRequest request) {
      return delegate.send(request);
    }
  }
}
