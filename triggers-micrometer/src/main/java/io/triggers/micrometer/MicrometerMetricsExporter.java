package io.triggers.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.triggers.spi.MetricsExporter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers meters with a {@link MeterRegistry} lazily, one set per trigger, tagged
 * {@code trigger=<name>}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code triggers.dispatch.events} - events passed to dispatch</li>
 *   <li>{@code triggers.handler.success} - handler invocations with a successful result</li>
 *   <li>{@code triggers.handler.failure} - handler invocations that threw or failed</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code triggers.handler.duration} - time spent per handler invocation</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  static final String TRIGGER_TAG = "trigger";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, TriggerMeters> meters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "triggers"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "triggers");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "ops.triggers"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementEventsDispatched(String trigger) {
    if (closed) return;
    metersFor(trigger).eventsDispatched.increment();
  }

  @Override
  public void incrementHandlerSuccess(String trigger) {
    if (closed) return;
    metersFor(trigger).handlerSuccess.increment();
  }

  @Override
  public void incrementHandlerFailure(String trigger) {
    if (closed) return;
    metersFor(trigger).handlerFailure.increment();
  }

  @Override
  public void recordHandlerDurationMs(String trigger, long durationMs) {
    if (closed) return;
    metersFor(trigger).handlerDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  private TriggerMeters metersFor(String trigger) {
    return meters.computeIfAbsent(trigger, name -> new TriggerMeters(registry, namePrefix, name));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed to prevent stale meters.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (TriggerMeters set : meters.values()) {
      for (Meter meter : set.all()) {
        try {
          registry.remove(meter);
        } catch (RuntimeException e) {
          if (first == null) first = e; else first.addSuppressed(e);
        }
      }
    }
    meters.clear();
    if (first != null) throw first;
  }

  private static final class TriggerMeters {
    final Counter eventsDispatched;
    final Counter handlerSuccess;
    final Counter handlerFailure;
    final Timer handlerDuration;

    TriggerMeters(MeterRegistry registry, String prefix, String trigger) {
      this.eventsDispatched = Counter.builder(prefix + ".dispatch.events")
          .description("Events passed to dispatch")
          .tag(TRIGGER_TAG, trigger)
          .register(registry);
      this.handlerSuccess = Counter.builder(prefix + ".handler.success")
          .description("Handler invocations with a successful result")
          .tag(TRIGGER_TAG, trigger)
          .register(registry);
      this.handlerFailure = Counter.builder(prefix + ".handler.failure")
          .description("Handler invocations that threw or returned a failure")
          .tag(TRIGGER_TAG, trigger)
          .register(registry);
      this.handlerDuration = Timer.builder(prefix + ".handler.duration")
          .description("Time spent per handler invocation")
          .tag(TRIGGER_TAG, trigger)
          .register(registry);
    }

    List<Meter> all() {
      return List.of(eventsDispatched, handlerSuccess, handlerFailure, handlerDuration);
    }
  }
}
