package campaign.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Identifier generation for engine-owned rows. Monotonic ULIDs sort by creation time.
 */
public final class Ids {

  private Ids() {
  }

  public static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
