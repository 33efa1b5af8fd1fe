package io.triggers;

import io.triggers.dispatch.DispatchInterceptor;
import io.triggers.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class implementing handler management, fan-out dispatch and the running flag
 * for every trigger variant.
 *
 * <p>Subclasses supply {@link #doStart()} / {@link #doStop()} for their source and
 * implement {@link #onEvent(TriggerEvent)} with their own result policy.
 *
 * <h2>Dispatch</h2>
 * <p>Handlers run sequentially on the calling thread in registration order. Around each
 * handler, {@link DispatchInterceptor#beforeHandle} hooks run in registration order and
 * {@link DispatchInterceptor#afterHandle} hooks in reverse order. Anything thrown by a
 * handler or a {@code beforeHandle} hook becomes a failed result in that handler's
 * slot, including {@link Error}s such as {@link AssertionError} or
 * {@link LinkageError}. Only {@link VirtualMachineError}s other than
 * {@link StackOverflowError} propagate. Dispatch works on a snapshot of the handler list taken when it begins.
 *
 * <h2>Lifecycle</h2>
 * <p>{@link #start()} and {@link #stop()} are synchronized against each other; dispatch
 * is not serialized, so concurrent events may interleave. If {@link #doStart()} throws,
 * {@link #doStop()} is invoked to release anything acquired before the failure.
 *
 * <h2>Thread Safety</h2>
 * <p>Handler registration may happen concurrently with dispatch; an in-progress
 * dispatch keeps the handler list it started with.
 */
public abstract class AbstractTrigger implements Trigger {
  private static final Logger logger = Logger.getLogger(AbstractTrigger.class.getName());

  private final TriggerConfig triggerConfig;
  private final MetricsExporter metrics;
  private final List<DispatchInterceptor> interceptors;
  private final CopyOnWriteArrayList<EventHandler> handlers = new CopyOnWriteArrayList<>();
  private volatile boolean running;

  protected AbstractTrigger(TriggerConfig config) {
    this.triggerConfig = Objects.requireNonNull(config, "config");
    this.metrics = config.metrics();
    this.interceptors = config.interceptors();
  }

  @Override
  public String name() {
    return triggerConfig.name();
  }

  @Override
  public Map<String, Object> config() {
    return triggerConfig.options();
  }

  @Override
  public void addHandler(EventHandler handler) {
    handlers.add(Objects.requireNonNull(handler, "handler"));
  }

  @Override
  public void removeHandler(EventHandler handler) {
    handlers.remove(handler);
  }

  @Override
  public List<EventHandler> handlers() {
    return List.copyOf(handlers);
  }

  @Override
  public List<TriggerResult> dispatch(TriggerEvent event) {
    Objects.requireNonNull(event, "event");
    Object[] snapshot = handlers.toArray();
    metrics.incrementEventsDispatched(name());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Dispatching " + event + " to " + snapshot.length + " handler(s) on " + name());
    }
    List<TriggerResult> results = new ArrayList<>(snapshot.length);
    for (Object handler : snapshot) {
      results.add(invoke((EventHandler) handler, event));
    }
    return Collections.unmodifiableList(results);
  }

  /**
   * Runs {@link #dispatch(TriggerEvent)} on {@code executor}.
   *
   * @param event    the event to dispatch
   * @param executor where the handlers run
   * @return a future completed with one result per handler
   */
  public CompletableFuture<List<TriggerResult>> dispatchAsync(TriggerEvent event, Executor executor) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(() -> dispatch(event), executor);
  }

  private TriggerResult invoke(EventHandler handler, TriggerEvent event) {
    long startNanos = System.nanoTime();
    int completedBefore = 0;
    TriggerResult result;
    Throwable failure = null;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeHandle(this, event);
        completedBefore = i + 1;
      }
      result = handler.handle(event);
      if (result == null) {
        throw new IllegalStateException("Handler returned no result");
      }
    } catch (Throwable t) {
      if (isFatal(t)) {
        throw (VirtualMachineError) t;
      }
      if (t instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      failure = t;
      result = TriggerResult.failure(describe(t));
      logger.log(Level.WARNING, "Handler failed on trigger " + name()
          + " for eventId=" + event.eventId(), t);
    }
    runAfterHandle(event, result, failure, completedBefore);

    long durationMs = Math.max(0L, (System.nanoTime() - startNanos) / 1_000_000L);
    metrics.recordHandlerDurationMs(name(), durationMs);
    if (result.success()) {
      metrics.incrementHandlerSuccess(name());
    } else {
      metrics.incrementHandlerFailure(name());
    }
    return result;
  }

  private void runAfterHandle(TriggerEvent event, TriggerResult result, Throwable failure, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterHandle(this, event, result, failure);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterHandle failed", ex);
      }
    }
  }

  // the stack has already unwound by the time a StackOverflowError is caught here
  static boolean isFatal(Throwable t) {
    return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
  }

  static String describe(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isEmpty() ? t.getClass().getName() : message;
  }

  @Override
  public final synchronized void start() {
    if (running) {
      return;
    }
    try {
      doStart();
    } catch (Exception e) {
      releaseAfterFailedStart(e);
      throw new TriggerStartException("Failed to start trigger " + name(), e);
    }
    running = true;
    logger.info("Trigger " + name() + " started");
  }

  private void releaseAfterFailedStart(Exception cause) {
    try {
      doStop();
    } catch (Exception e) {
      cause.addSuppressed(e);
    }
  }

  @Override
  public final synchronized void stop() {
    if (!running) {
      return;
    }
    try {
      doStop();
    } catch (Exception e) {
      throw new TriggerException("Failed to stop trigger " + name() + " cleanly", e);
    } finally {
      running = false;
      logger.info("Trigger " + name() + " stopped");
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /**
   * Acquires whatever the trigger needs to observe its source.
   *
   * @throws Exception if setup fails; {@link #doStop()} is then called to clean up
   */
  protected abstract void doStart() throws Exception;

  /**
   * Releases everything {@link #doStart()} acquired. Must tolerate a partially completed
   * {@code doStart()}.
   *
   * @throws Exception if cleanup fails
   */
  protected abstract void doStop() throws Exception;

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name=" + name() + ", running=" + running
        + ", handlers=" + handlers.size() + '}';
  }
}
