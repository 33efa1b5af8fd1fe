package io.triggers;

import java.util.List;
import java.util.Map;

/**
 * A named, stateful unit that observes some external source of occurrences and
 * forwards them as {@link TriggerEvent}s to its registered {@link EventHandler}s.
 *
 * <p>Every trigger variant (manual, webhook, cron, ...) implements the same capability
 * set: a {@code start}/{@code stop} lifecycle, handler management, and an
 * {@link #onEvent} entry point that its source-listening logic calls. How a variant
 * observes its source is private to the variant.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   created --start()--&gt; running --stop()--&gt; stopped --start()--&gt; running ...
 * </pre>
 * <p>{@link #start()} either succeeds and sets {@link #isRunning()} or throws
 * {@link TriggerStartException} and leaves the trigger stopped and re-startable.
 * {@link #stop()} is idempotent.
 *
 * <h2>Dispatch</h2>
 * <p>{@link #dispatch} invokes every handler sequentially in registration order and
 * returns exactly one result per handler, in the same order. A failing handler yields
 * a failed result in its slot; dispatch itself never fails because of a handler.
 *
 * @see AbstractTrigger
 * @see io.triggers.registry.TriggerRegistry
 */
public interface Trigger extends AutoCloseable {

  /**
   * Returns the name this trigger was created under. Used for logging and metrics.
   *
   * @return the trigger name
   */
  String name();

  /**
   * Returns the startup options supplied at construction. Never mutated by the framework.
   *
   * @return unmodifiable options map
   */
  Map<String, Object> config();

  /**
   * Appends a handler. Duplicates are permitted and are invoked once per registration.
   *
   * @param handler the handler to add
   */
  void addHandler(EventHandler handler);

  /**
   * Removes the first registration of {@code handler}. A no-op if it is not registered.
   *
   * @param handler the handler to remove
   */
  void removeHandler(EventHandler handler);

  /**
   * Returns a snapshot of the registered handlers in dispatch order.
   *
   * @return immutable list of handlers
   */
  List<EventHandler> handlers();

  /**
   * Fans {@code event} out to every registered handler.
   *
   * @param event the event to dispatch
   * @return immutable list with one result per handler, in handler order
   */
  List<TriggerResult> dispatch(TriggerEvent event);

  /**
   * Starts observing the source.
   *
   * @throws TriggerStartException if setup fails; the trigger stays stopped
   */
  void start();

  /**
   * Stops observing the source and releases whatever {@link #start()} acquired.
   * Safe to call on a stopped trigger.
   */
  void stop();

  /**
   * Entry point for the trigger's own source-listening logic.
   *
   * <p>Each variant documents whether it returns the dispatch results or swallows
   * them (returning an empty list).
   *
   * @param event the observed occurrence
   * @return the results the variant surfaces to its caller
   */
  List<TriggerResult> onEvent(TriggerEvent event);

  boolean isRunning();

  /**
   * Equivalent to {@link #stop()}.
   */
  @Override
  default void close() {
    stop();
  }
}
