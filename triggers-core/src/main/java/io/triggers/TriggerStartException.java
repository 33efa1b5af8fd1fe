package io.triggers;

/**
 * Thrown by {@link Trigger#start()} when a trigger cannot acquire what it needs to run.
 *
 * <p>When this is thrown the trigger is not running, any partially acquired resources
 * have been released, and {@code start()} may be called again.
 */
public class TriggerStartException extends TriggerException {

    public TriggerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
