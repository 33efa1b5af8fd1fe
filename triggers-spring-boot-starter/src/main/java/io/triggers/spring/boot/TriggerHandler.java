package io.triggers.spring.boot;

import io.triggers.manual.ManualTrigger;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a handler for a trigger instance.
 *
 * <p>The annotated bean must implement {@link io.triggers.EventHandler}. Handlers for
 * the same trigger are attached in {@link org.springframework.core.annotation.Order}
 * order.
 *
 * <pre>{@code
 * @Component
 * @TriggerHandler(trigger = "manual")
 * public class PlanLauncher implements EventHandler {
 *   public TriggerResult handle(TriggerEvent event) { ... }
 * }
 * }</pre>
 *
 * <p>If no instance of the trigger type was configured under
 * {@code triggers.instances}, one is created with empty options and started.
 *
 * @see TriggerHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TriggerHandler {

    /**
     * Name of the trigger type whose instance receives this handler.
     */
    String trigger() default ManualTrigger.NAME;
}
