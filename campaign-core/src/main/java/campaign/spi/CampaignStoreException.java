package campaign.spi;

/**
 * Unchecked wrapper for failures of the backing store. The dispatcher treats it as a
 * transient error.
 */
public class CampaignStoreException extends RuntimeException {

  public CampaignStoreException(String message) {
    super(message);
  }

  public CampaignStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
