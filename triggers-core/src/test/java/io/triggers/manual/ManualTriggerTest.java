package io.triggers.manual;

import io.triggers.TriggerEvent;
import io.triggers.TriggerResult;
import io.triggers.registry.DefaultTriggerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManualTriggerTest {

  private ManualTrigger trigger;
  private List<TriggerEvent> received;

  @BeforeEach
  void setUp() {
    trigger = new ManualTrigger();
    received = new ArrayList<>();
    trigger.addHandler(event -> {
      received.add(event);
      return TriggerResult.builder(true).workflow(event.workflow()).adwId(event.adwId()).build();
    });
  }

  @Test
  void startAndStopOnlyFlipTheFlag() {
    assertFalse(trigger.isRunning());
    trigger.start();
    assertTrue(trigger.isRunning());
    trigger.stop();
    assertFalse(trigger.isRunning());
  }

  @Test
  void emitPlanEventDispatchesIssueWorkflowEvent() {
    trigger.start();

    List<TriggerResult> results = trigger.emitPlanEvent(42);

    assertEquals(1, received.size());
    TriggerEvent event = received.get(0);
    assertEquals("issue_workflow", event.eventType());
    assertEquals(Map.of("workflow", "adw_plan_iso"), event.payload());
    assertEquals(42, event.issueNumber());
    assertEquals("manual", event.source());
    assertNull(event.adwId());
    assertNull(event.repoPath());
    assertTrue(Duration.between(event.timestamp(), Instant.now()).toSeconds() < 5);
    assertEquals(1, results.size());
    assertEquals("adw_plan_iso", results.get(0).workflow());
  }

  @Test
  void emitBuildEventCarriesAdwId() {
    trigger.emitBuildEvent(7, "a1b2c3d4", "acme/widgets");

    TriggerEvent event = received.get(0);
    assertEquals("adw_build_iso", event.workflow());
    assertEquals("a1b2c3d4", event.adwId());
    assertEquals("acme/widgets", event.repoPath());
  }

  @Test
  void emitBuildEventRequiresAdwId() {
    assertThrows(IllegalArgumentException.class, () -> trigger.emitBuildEvent(7, null, null));
    assertThrows(IllegalArgumentException.class, () -> trigger.emitBuildEvent(7, " ", null));
    assertTrue(received.isEmpty());
  }

  @Test
  void emitPatchEventUsesPatchWorkflow() {
    trigger.emitPatchEvent(9, "acme/widgets");

    assertEquals("adw_patch_iso", received.get(0).workflow());
    assertEquals(9, received.get(0).issueNumber());
  }

  @Test
  void emitIssueEventAcceptsAnyWorkflow() {
    trigger.emitIssueEvent(3, "adw_review_iso", null, "run-1");

    assertEquals("adw_review_iso", received.get(0).workflow());
    assertEquals("run-1", received.get(0).adwId());
  }

  @Test
  void emitWithCustomTypeAndPayload() {
    List<TriggerResult> results = trigger.emit("cron_tick", Map.of("schedule", "hourly"));

    assertEquals(1, results.size());
    assertEquals("cron_tick", received.get(0).eventType());
    assertEquals("hourly", received.get(0).payload().get("schedule"));
    assertEquals(1, received.get(0).payload().size());
  }

  @Test
  void emitWithNullPayloadUsesEmptyMap() {
    trigger.emit("ping", null);

    assertTrue(received.get(0).payload().isEmpty());
  }

  @Test
  void onEventPropagatesDispatchResults() {
    trigger.addHandler(event -> { throw new IllegalStateException("no such run"); });
    TriggerEvent event = TriggerEvent.builder("issue_workflow").source("manual").build();

    List<TriggerResult> results = trigger.onEvent(event);

    assertEquals(2, results.size());
    assertTrue(results.get(0).success());
    assertFalse(results.get(1).success());
    assertEquals("no such run", results.get(1).error());
  }

  @Test
  void registersUnderManualName() {
    DefaultTriggerRegistry registry = new DefaultTriggerRegistry();

    ManualTrigger.register(registry);

    assertEquals(List.of("manual"), registry.listTriggers());
    assertInstanceOf(ManualTrigger.class, registry.create("manual", Map.of()).orElseThrow());
  }
}
