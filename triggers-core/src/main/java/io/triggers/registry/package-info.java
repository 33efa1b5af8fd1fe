/**
 * Name-based resolution of trigger types and their live instances.
 *
 * <p>The registry maps each type name to a {@link io.triggers.registry.TriggerFactory}
 * and to at most one live {@link io.triggers.Trigger}. Unknown names resolve to
 * {@link java.util.Optional#empty()}, never to an exception.
 *
 * @see io.triggers.registry.TriggerRegistry
 * @see io.triggers.registry.DefaultTriggerRegistry
 */
package io.triggers.registry;
