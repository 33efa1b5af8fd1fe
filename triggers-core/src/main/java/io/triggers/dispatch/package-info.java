/**
 * Hooks around handler invocation during dispatch.
 *
 * @see io.triggers.dispatch.DispatchInterceptor
 * @see io.triggers.AbstractTrigger#dispatch(io.triggers.TriggerEvent)
 */
package io.triggers.dispatch;
