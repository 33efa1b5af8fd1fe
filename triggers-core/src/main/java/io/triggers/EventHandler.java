package io.triggers;

/**
 * Handler that consumes one {@link TriggerEvent} and reports one {@link TriggerResult}.
 *
 * <p>Handlers are registered on a trigger with {@link Trigger#addHandler(EventHandler)}
 * and invoked sequentially, in registration order, by {@link Trigger#dispatch(TriggerEvent)}.
 *
 * <h2>Error Handling</h2>
 * <p>A handler may throw. The dispatcher catches the exception and records a failed
 * result in the handler's slot; sibling handlers still run and the caller of
 * {@code dispatch} never sees the exception. Returning {@code null} is treated the
 * same way.
 *
 * <h2>Concurrency</h2>
 * <p>Two events arriving close together may be dispatched concurrently on the same
 * trigger, so handlers must be safe under concurrent invocation.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * trigger.addHandler(event -> {
 *   String runId = workflows.launch(event.workflow(), event.issueNumber());
 *   return TriggerResult.builder(true).workflow(event.workflow()).adwId(runId).build();
 * });
 * }</pre>
 *
 * @see Trigger
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Processes an event.
   *
   * @param event the event being dispatched
   * @return the outcome, never {@code null}
   * @throws Exception if processing fails; converted to a failed result by the dispatcher
   */
  TriggerResult handle(TriggerEvent event) throws Exception;
}
