package campaign;

/**
 * Malformed input: unknown template or plan version, missing address for a channel the
 * plan uses, duplicate enrollment, edits to a step frozen by a plan version. Never
 * retried.
 */
public class CampaignValidationException extends RuntimeException {

  public CampaignValidationException(String message) {
    super(message);
  }
}
