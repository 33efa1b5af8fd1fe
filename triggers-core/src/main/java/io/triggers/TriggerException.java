package io.triggers;

/**
 * Unchecked exception for trigger lifecycle failures.
 *
 * <p>Handler failures never surface as exceptions; they become failed
 * {@link TriggerResult}s inside {@link Trigger#dispatch(TriggerEvent)}.
 *
 * @see TriggerStartException
 */
public class TriggerException extends RuntimeException {

    public TriggerException(String message) {
        super(message);
    }

    public TriggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
