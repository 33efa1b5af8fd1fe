package io.triggers.dispatch;

import io.triggers.Trigger;
import io.triggers.TriggerEvent;
import io.triggers.TriggerResult;

/**
 * Cross-cutting hook around each handler invocation inside
 * {@link Trigger#dispatch(TriggerEvent)}.
 *
 * <p>For every handler:
 * <ol>
 *   <li>{@link #beforeHandle} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterHandle} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeHandle} throws, the handler is skipped and its slot gets a failed
 * result; other handlers are unaffected. {@code afterHandle} exceptions are logged
 * but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultTriggerRegistry.builder()
 *     .interceptor(DispatchInterceptor.before((trigger, event) ->
 *         audit.log(trigger.name(), event.eventId())))
 *     .interceptor(DispatchInterceptor.after((trigger, event, result, error) -> {
 *         if (!result.success()) alerts.raise(result.error());
 *     }))
 *     .build();
 * }</pre>
 */
public interface DispatchInterceptor {

    /**
     * Called before a handler is invoked.
     *
     * @param trigger the dispatching trigger
     * @param event   the event about to be handled
     * @throws Exception to skip the handler and record a failed result
     */
    default void beforeHandle(Trigger trigger, TriggerEvent event) throws Exception {
    }

    /**
     * Called after the handler (or after a {@code beforeHandle} failure).
     *
     * @param trigger the dispatching trigger
     * @param event   the handled event
     * @param result  the result recorded for this handler, never null
     * @param error   null on normal completion, whatever was thrown on failure
     */
    default void afterHandle(Trigger trigger, TriggerEvent event, TriggerResult result, Throwable error) {
    }

    /**
     * Creates an interceptor with only a beforeHandle hook.
     */
    static DispatchInterceptor before(BeforeHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void beforeHandle(Trigger trigger, TriggerEvent event) throws Exception {
                hook.accept(trigger, event);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterHandle hook.
     */
    static DispatchInterceptor after(AfterHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void afterHandle(Trigger trigger, TriggerEvent event, TriggerResult result, Throwable error) {
                hook.accept(trigger, event, result, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Trigger trigger, TriggerEvent event) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Trigger trigger, TriggerEvent event, TriggerResult result, Throwable error);
    }
}
