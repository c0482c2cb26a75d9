package campaign.gate;

import campaign.model.Channel;

import java.util.Locale;

/**
 * Canonical form of destination addresses used as deny-list keys.
 */
public final class Addresses {

  private Addresses() {
  }

  public static String normalize(Channel channel, String address) {
    if (address == null) {
      return null;
    }
    String trimmed = address.trim();
    if (channel == Channel.EMAIL) {
      return trimmed.toLowerCase(Locale.ROOT);
    }
    return trimmed.replaceAll("[\\s().-]", "");
  }
}
