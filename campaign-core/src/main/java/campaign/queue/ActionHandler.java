package campaign.queue;

import campaign.model.ScheduledAction;

/**
 * Receives actions claimed by the {@link ActionPoller}.
 *
 * @see campaign.dispatch.ActionWorkerPool
 */
public interface ActionHandler {

  /**
   * Accepts a claimed action for execution.
   *
   * @return {@code false} if the handler has no room; the poller releases the claim
   */
  boolean handle(ScheduledAction action);

  /**
   * @return how many more actions the handler can accept right now
   */
  int availableCapacity();
}
