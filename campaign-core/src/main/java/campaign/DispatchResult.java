package campaign;

import java.time.Instant;

/**
 * Outcome of dispatching one claimed action.
 *
 * <ul>
 *   <li>{@link Sent} / {@link AlreadySent}: success; the second means a previous attempt
 *       already sent under the same dedupe key.</li>
 *   <li>{@link Skipped}: a gate or branch condition stopped the step; not retried.</li>
 *   <li>{@link Deferred}: rate limited; the action is pending again without losing an attempt.</li>
 *   <li>{@link Retrying}: transient failure; the action is pending again at {@code nextAt}.</li>
 *   <li>{@link Failed}: permanent failure or retries exhausted.</li>
 *   <li>{@link Canceled}: the step or instance is no longer eligible.</li>
 * </ul>
 */
public sealed interface DispatchResult {

  default boolean isSuccess() {
    return this instanceof Sent || this instanceof AlreadySent;
  }

  record Sent(String messageId, String providerMessageId) implements DispatchResult {
  }

  record AlreadySent(String messageId) implements DispatchResult {
  }

  record Skipped(String reason) implements DispatchResult {
  }

  record Deferred(Instant nextAt) implements DispatchResult {
  }

  record Retrying(Instant nextAt, String error) implements DispatchResult {
  }

  record Failed(String error) implements DispatchResult {
  }

  record Canceled(String reason) implements DispatchResult {
  }
}
