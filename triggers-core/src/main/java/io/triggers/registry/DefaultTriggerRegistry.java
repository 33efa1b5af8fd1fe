package io.triggers.registry;

import io.triggers.Trigger;
import io.triggers.TriggerConfig;
import io.triggers.dispatch.DispatchInterceptor;
import io.triggers.manual.ManualTrigger;
import io.triggers.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link TriggerRegistry}.
 *
 * <p>Both catalogs are guarded by a single lock, so registration, creation and listing
 * may happen from multiple threads. Last-writer-wins semantics are unchanged: the lock
 * only makes each operation atomic. Factories run outside the lock.
 *
 * <p>Instances created through this registry receive the registry's
 * {@link MetricsExporter} and {@link DispatchInterceptor}s.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultTriggerRegistry registry = DefaultTriggerRegistry.builder()
 *     .metrics(exporter)
 *     .interceptor(auditInterceptor)
 *     .build();
 * ManualTrigger.register(registry);
 * registry.register("cron", CronTrigger::new);
 *
 * Trigger cron = registry.create("cron", Map.of("schedule", "0 * * * *")).orElseThrow();
 * cron.addHandler(handler);
 * cron.start();
 * }</pre>
 *
 * <p>{@link #close()} stops every stored instance; the catalogs themselves are kept.
 *
 * @see TriggerRegistry
 * @see ManualTrigger#register(TriggerRegistry)
 */
public final class DefaultTriggerRegistry implements TriggerRegistry, AutoCloseable {
  private static final Logger logger = Logger.getLogger(DefaultTriggerRegistry.class.getName());

  private final Object lock = new Object();
  private final Map<String, TriggerFactory> types = new LinkedHashMap<>();
  private final Map<String, Trigger> instances = new LinkedHashMap<>();
  private final MetricsExporter metrics;
  private final List<DispatchInterceptor> interceptors;

  public DefaultTriggerRegistry() {
    this(new Builder());
  }

  private DefaultTriggerRegistry(Builder builder) {
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a registry with the built-in trigger types registered.
   *
   * @return a new registry containing {@value ManualTrigger#NAME}
   */
  public static DefaultTriggerRegistry withBuiltIns() {
    DefaultTriggerRegistry registry = new DefaultTriggerRegistry();
    registerBuiltIns(registry);
    return registry;
  }

  /**
   * Registers the trigger types every process has available.
   *
   * @param registry the registry to populate
   */
  public static void registerBuiltIns(TriggerRegistry registry) {
    ManualTrigger.register(registry);
  }

  /**
   * Returns the process-wide registry, created with built-ins on first use.
   *
   * @return the shared registry
   */
  public static DefaultTriggerRegistry shared() {
    return SharedHolder.INSTANCE;
  }

  @Override
  public void register(String name, TriggerFactory factory) {
    requireName(name);
    Objects.requireNonNull(factory, "factory");
    synchronized (lock) {
      types.put(name, factory);
    }
  }

  @Override
  public Optional<TriggerFactory> get(String name) {
    synchronized (lock) {
      return Optional.ofNullable(types.get(name));
    }
  }

  @Override
  public Optional<Trigger> create(String name, Map<String, ?> options) {
    Optional<TriggerFactory> factory = get(name);
    if (factory.isEmpty()) {
      logger.fine("Unknown trigger type: " + name);
      return Optional.empty();
    }
    TriggerConfig config = TriggerConfig.builder(name)
        .options(options)
        .metrics(metrics)
        .interceptors(interceptors)
        .build();
    Trigger instance = Objects.requireNonNull(factory.get().create(config),
        "Factory for " + name + " returned null");

    Trigger previous;
    synchronized (lock) {
      previous = instances.put(name, instance);
    }
    if (previous != null && previous.isRunning()) {
      logger.warning("Replaced running trigger instance " + name
          + "; the previous instance was not stopped");
    }
    return Optional.of(instance);
  }

  @Override
  public Optional<Trigger> getInstance(String name) {
    synchronized (lock) {
      return Optional.ofNullable(instances.get(name));
    }
  }

  @Override
  public List<String> listTriggers() {
    synchronized (lock) {
      return List.copyOf(types.keySet());
    }
  }

  @Override
  public List<String> listRunning() {
    List<Map.Entry<String, Trigger>> snapshot;
    synchronized (lock) {
      snapshot = new ArrayList<>(instances.entrySet());
    }
    List<String> running = new ArrayList<>();
    for (Map.Entry<String, Trigger> entry : snapshot) {
      if (entry.getValue().isRunning()) {
        running.add(entry.getKey());
      }
    }
    return Collections.unmodifiableList(running);
  }

  /**
   * Stops every stored instance. Instances stay in the catalog.
   *
   * @throws RuntimeException the first stop failure, with later ones suppressed
   */
  @Override
  public void close() {
    List<Trigger> snapshot;
    synchronized (lock) {
      snapshot = new ArrayList<>(instances.values());
    }
    RuntimeException first = null;
    for (Trigger trigger : snapshot) {
      try {
        trigger.stop();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to stop trigger " + trigger.name(), e);
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private static void requireName(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
  }

  private static final class SharedHolder {
    static final DefaultTriggerRegistry INSTANCE = withBuiltIns();
  }

  /** Builder for {@link DefaultTriggerRegistry}. */
  public static final class Builder {
    private MetricsExporter metrics;
    private final List<DispatchInterceptor> interceptors = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the metrics exporter passed to every created instance.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Appends an interceptor passed to every created instance.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(DispatchInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<DispatchInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    public DefaultTriggerRegistry build() {
      return new DefaultTriggerRegistry(this);
    }
  }
}
