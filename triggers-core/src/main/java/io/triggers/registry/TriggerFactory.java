package io.triggers.registry;

import io.triggers.Trigger;
import io.triggers.TriggerConfig;

/**
 * Constructor for one trigger type, registered under a name in a {@link TriggerRegistry}.
 *
 * <p>Usually a constructor reference:
 * <pre>{@code
 * registry.register("cron", CronTrigger::new);
 * }</pre>
 */
@FunctionalInterface
public interface TriggerFactory {

  /**
   * Creates a new, not-yet-started trigger.
   *
   * @param config name, options and collaborators for the new instance
   * @return the trigger
   */
  Trigger create(TriggerConfig config);
}
