package campaign.spring.boot;

import campaign.model.Channel;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a {@link campaign.spi.MessageProvider} bean to the channels it serves.
 *
 * <p>Unannotated provider beans serve the channel returned by
 * {@link campaign.spi.MessageProvider#channel()}. An annotated bean serves every channel
 * listed here instead, which lets one gateway cover several channels:
 *
 * <pre>{@code
 * @Component
 * @CampaignProvider(channels = {Channel.SMS, Channel.CALL})
 * public class TwilioProvider implements MessageProvider { ... }
 * }</pre>
 *
 * <p>An empty {@code channels} falls back to {@code channel()}. Two providers bound to
 * the same channel fail startup.
 *
 * @see CampaignProviderRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CampaignProvider {

  Channel[] channels() default {};
}
