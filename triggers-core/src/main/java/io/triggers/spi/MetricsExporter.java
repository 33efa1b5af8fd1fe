package io.triggers.spi;

/**
 * Observability hook for exporting dispatch counters to a metrics backend.
 *
 * <p>Every call carries the name of the trigger that dispatched. The {@link #NOOP}
 * instance discards everything. Implement this interface to bridge into Micrometer,
 * Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events passed to {@code dispatch}.
     *
     * @param trigger the dispatching trigger's name
     */
    void incrementEventsDispatched(String trigger);

    /**
     * Increments the count of handler invocations that produced a successful result.
     *
     * @param trigger the dispatching trigger's name
     */
    void incrementHandlerSuccess(String trigger);

    /**
     * Increments the count of handler invocations that threw or returned a failed result.
     *
     * @param trigger the dispatching trigger's name
     */
    void incrementHandlerFailure(String trigger);

    /**
     * Records the time spent in one handler invocation, interceptors included.
     *
     * @param trigger    the dispatching trigger's name
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(String trigger, long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsDispatched(String trigger) {
        }

        @Override
        public void incrementHandlerSuccess(String trigger) {
        }

        @Override
        public void incrementHandlerFailure(String trigger) {
        }
    }
}
