package campaign;

/**
 * Provider acknowledgment of a send.
 *
 * @param providerMessageId provider-side id, used to correlate webhooks
 * @param completed         {@code true} if the step needs no further provider feedback
 *                          (e.g. a call task was created), {@code false} if delivery is
 *                          reported later by webhook
 */
public record SendReceipt(String providerMessageId, boolean completed) {

  public static SendReceipt accepted(String providerMessageId) {
    return new SendReceipt(providerMessageId, false);
  }

  public static SendReceipt completed(String providerMessageId) {
    return new SendReceipt(providerMessageId, true);
  }
}
