package io.triggers.registry;

import io.triggers.RecordingMetrics;
import io.triggers.StubTrigger;
import io.triggers.Trigger;
import io.triggers.TriggerEvent;
import io.triggers.TriggerResult;
import io.triggers.dispatch.DispatchInterceptor;
import io.triggers.manual.ManualTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DefaultTriggerRegistryTest {

  private DefaultTriggerRegistry registry;

  @BeforeEach
  void setUp() {
    registry = DefaultTriggerRegistry.withBuiltIns();
    registry.register("stub", StubTrigger::new);
  }

  @Test
  void unknownTypeIsAbsentEverywhere() {
    assertEquals(Optional.empty(), registry.create("unknown_type", Map.of()));
    assertEquals(Optional.empty(), registry.get("unknown_type"));
    assertEquals(Optional.empty(), registry.getInstance("unknown_type"));
    assertFalse(registry.listTriggers().contains("unknown_type"));
  }

  @Test
  void builtInsIncludeManual() {
    assertTrue(registry.get("manual").isPresent());
    assertEquals(List.of("manual", "stub"), registry.listTriggers());
  }

  @Test
  void createdManualTriggerIsStoppedUntilStarted() {
    Trigger manual = registry.create("manual", Map.of()).orElseThrow();

    assertInstanceOf(ManualTrigger.class, manual);
    assertFalse(manual.isRunning());

    manual.start();
    assertTrue(manual.isRunning());
  }

  @Test
  void createStoresInstanceAndPassesOptions() {
    Trigger stub = registry.create("stub", Map.of("port", 8001)).orElseThrow();

    assertSame(stub, registry.getInstance("stub").orElseThrow());
    assertEquals("stub", stub.name());
    assertEquals(8001, stub.config().get("port"));
  }

  @Test
  void createWithNullOptionsUsesEmptyConfig() {
    Trigger stub = registry.create("stub", null).orElseThrow();

    assertTrue(stub.config().isEmpty());
  }

  @Test
  void registerOverwritesFactory() {
    AtomicInteger secondFactoryCalls = new AtomicInteger();
    registry.register("stub", config -> {
      secondFactoryCalls.incrementAndGet();
      return new StubTrigger(config);
    });

    registry.create("stub", Map.of());

    assertEquals(1, secondFactoryCalls.get());
    assertEquals(1, registry.listTriggers().stream().filter("stub"::equals).count());
  }

  @Test
  void recreatingReplacesInstanceWithoutStoppingTheOldOne() {
    Trigger first = registry.create("stub", Map.of()).orElseThrow();
    first.start();

    Trigger second = registry.create("stub", Map.of()).orElseThrow();

    assertNotSame(first, second);
    assertSame(second, registry.getInstance("stub").orElseThrow());
    assertTrue(first.isRunning());
    assertFalse(second.isRunning());
    assertEquals(List.of(), registry.listRunning());
    first.stop();
  }

  @Test
  void listRunningReflectsLifecycleAtCallTime() {
    Trigger manual = registry.create("manual", Map.of()).orElseThrow();
    Trigger stub = registry.create("stub", Map.of()).orElseThrow();
    assertEquals(List.of(), registry.listRunning());

    manual.start();
    stub.start();
    assertEquals(List.of("manual", "stub"), registry.listRunning());

    stub.stop();
    assertEquals(List.of("manual"), registry.listRunning());
    assertTrue(registry.listTriggers().contains("stub"));
    assertSame(stub, registry.getInstance("stub").orElseThrow());
  }

  @Test
  void listingsAreSnapshots() {
    List<String> triggers = registry.listTriggers();
    registry.register("late", StubTrigger::new);

    assertFalse(triggers.contains("late"));
    assertThrows(UnsupportedOperationException.class, () -> triggers.add("x"));
  }

  @Test
  void createdInstancesReceiveRegistryMetricsAndInterceptors() {
    RecordingMetrics metrics = new RecordingMetrics();
    List<String> intercepted = new ArrayList<>();
    DefaultTriggerRegistry configured = DefaultTriggerRegistry.builder()
        .metrics(metrics)
        .interceptor(DispatchInterceptor.before((t, e) -> intercepted.add(t.name())))
        .build();
    DefaultTriggerRegistry.registerBuiltIns(configured);

    ManualTrigger manual = (ManualTrigger) configured.create("manual", Map.of()).orElseThrow();
    manual.addHandler(event -> TriggerResult.ok());
    manual.emitPatchEvent(5);

    assertEquals(1, metrics.dispatched.get());
    assertEquals(1, metrics.successes.get());
    assertEquals(List.of("manual"), intercepted);
  }

  @Test
  void rejectsInvalidRegistrations() {
    assertThrows(NullPointerException.class, () -> registry.register(null, StubTrigger::new));
    assertThrows(IllegalArgumentException.class, () -> registry.register("", StubTrigger::new));
    assertThrows(NullPointerException.class, () -> registry.register("x", null));
  }

  @Test
  void factoryReturningNullIsRejected() {
    registry.register("broken", config -> null);

    assertThrows(NullPointerException.class, () -> registry.create("broken", Map.of()));
    assertTrue(registry.getInstance("broken").isEmpty());
  }

  @Test
  void closeStopsAllInstancesAndKeepsCatalog() {
    Trigger manual = registry.create("manual", Map.of()).orElseThrow();
    Trigger stub = registry.create("stub", Map.of()).orElseThrow();
    manual.start();
    stub.start();

    registry.close();

    assertFalse(manual.isRunning());
    assertFalse(stub.isRunning());
    assertSame(manual, registry.getInstance("manual").orElseThrow());
  }

  @Test
  void closeReportsStopFailuresAfterStoppingEveryone() {
    StubTrigger failing = (StubTrigger) registry.create("stub", Map.of()).orElseThrow();
    Trigger manual = registry.create("manual", Map.of()).orElseThrow();
    failing.start();
    manual.start();
    failing.failOnStop = true;

    assertThrows(RuntimeException.class, () -> registry.close());
    assertFalse(failing.isRunning());
    assertFalse(manual.isRunning());
  }

  @Test
  void sharedRegistryIsSingletonWithBuiltIns() {
    assertSame(DefaultTriggerRegistry.shared(), DefaultTriggerRegistry.shared());
    assertTrue(DefaultTriggerRegistry.shared().get(ManualTrigger.NAME).isPresent());
  }

  @Test
  void concurrentRegistrationAndCreationAreSafe() throws Exception {
    int threads = 8;
    int perThread = 200;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        int id = t;
        futures.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < perThread; i++) {
            String name = "type-" + id + "-" + i;
            registry.register(name, StubTrigger::new);
            registry.create(name, Map.of()).orElseThrow().start();
            registry.listTriggers();
            registry.listRunning();
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(2 + threads * perThread, registry.listTriggers().size());
    assertEquals(threads * perThread, registry.listRunning().size());
  }

  @Test
  void dispatchThroughRegistryInstance() {
    Trigger manual = registry.create("manual", Map.of()).orElseThrow();
    manual.addHandler(event -> TriggerResult.ok(event.eventType()));

    List<TriggerResult> results = manual.onEvent(
        TriggerEvent.builder("issue_workflow").source("manual").build());

    assertEquals("issue_workflow", results.get(0).message());
  }
}
