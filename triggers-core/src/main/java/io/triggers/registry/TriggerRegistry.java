package io.triggers.registry;

import io.triggers.Trigger;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of trigger types and of the live instance created for each type.
 *
 * <p>The type catalog maps a name to a {@link TriggerFactory}; the instance catalog maps
 * the same name to at most one {@link Trigger} created through {@link #create}. Both
 * follow last-writer-wins: registering a name again replaces the factory, and creating
 * a name again replaces the stored instance.
 *
 * <p><b>Replacement hazard:</b> {@link #create} does not stop an instance it replaces.
 * Callers that re-create a running type must stop the previous instance themselves,
 * e.g. via {@code getInstance(name).ifPresent(Trigger::stop)}.
 *
 * @see DefaultTriggerRegistry
 */
public interface TriggerRegistry {

  /**
   * Registers (or replaces) the factory for a trigger type.
   *
   * @param name    the trigger type name
   * @param factory the factory
   */
  void register(String name, TriggerFactory factory);

  /**
   * Looks up the factory for a trigger type.
   *
   * @param name the trigger type name
   * @return the factory, or empty if the type is unknown
   */
  Optional<TriggerFactory> get(String name);

  /**
   * Creates an instance of a trigger type and stores it as the type's live instance.
   *
   * @param name    the trigger type name
   * @param options opaque startup options for the instance
   * @return the new (stopped) instance, or empty if the type is unknown
   */
  Optional<Trigger> create(String name, Map<String, ?> options);

  /**
   * Looks up the live instance stored for a trigger type.
   *
   * @param name the trigger type name
   * @return the instance, or empty if none was created
   */
  Optional<Trigger> getInstance(String name);

  /**
   * Returns the registered trigger type names in registration order.
   *
   * @return snapshot of type names
   */
  List<String> listTriggers();

  /**
   * Returns the names of stored instances that are running at call time.
   *
   * @return snapshot of running instance names
   */
  List<String> listRunning();
}
