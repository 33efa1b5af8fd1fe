/**
 * Source-agnostic trigger and event-dispatch framework.
 *
 * <h2>Core Design</h2>
 * <p>A {@linkplain io.triggers.Trigger trigger} observes some external source (a webhook,
 * a schedule, a direct call) and turns each occurrence into an immutable
 * {@link io.triggers.TriggerEvent}. {@link io.triggers.Trigger#dispatch dispatch} fans the
 * event out to every registered {@link io.triggers.EventHandler}, in order, and returns
 * one {@link io.triggers.TriggerResult} per handler. A failing handler produces a failed
 * result in its slot and never affects its siblings.
 *
 * <p>Trigger types are resolved by name through the
 * {@linkplain io.triggers.registry.TriggerRegistry registry}, which also keeps at most one
 * live instance per type. The {@linkplain io.triggers.manual.ManualTrigger manual trigger}
 * is always available.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>triggers-core</b> - event model, trigger base, registry, manual trigger</li>
 *   <li><b>triggers-micrometer</b> - Micrometer {@linkplain io.triggers.spi.MetricsExporter
 *       metrics exporter}</li>
 *   <li><b>triggers-spring-boot-starter</b> - auto-configuration and annotated handlers</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * DefaultTriggerRegistry registry = DefaultTriggerRegistry.withBuiltIns();
 *
 * ManualTrigger manual = (ManualTrigger) registry.create(ManualTrigger.NAME, Map.of())
 *     .orElseThrow();
 * manual.addHandler(event -> {
 *   System.out.println("Received: " + event.workflow() + " for #" + event.issueNumber());
 *   return TriggerResult.ok();
 * });
 * manual.start();
 *
 * List<TriggerResult> results = manual.emitPlanEvent(42, "acme/widgets");
 * }</pre>
 *
 * @see io.triggers.Trigger
 * @see io.triggers.AbstractTrigger
 * @see io.triggers.TriggerEvent
 * @see io.triggers.registry.DefaultTriggerRegistry
 */
package io.triggers;
