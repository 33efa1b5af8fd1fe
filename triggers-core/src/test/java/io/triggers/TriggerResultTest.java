package io.triggers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TriggerResultTest {

  @Test
  void okFactoryHasNoError() {
    TriggerResult result = TriggerResult.ok("started");

    assertTrue(result.success());
    assertEquals("started", result.message());
    assertNull(result.error());
  }

  @Test
  void failureFactoryCarriesError() {
    TriggerResult result = TriggerResult.failure("boom");

    assertFalse(result.success());
    assertEquals("boom", result.error());
    assertThrows(NullPointerException.class, () -> TriggerResult.failure(null));
  }

  @Test
  void builderSetsAllFields() {
    TriggerResult result = TriggerResult.builder(true)
        .adwId("a1b2c3d4")
        .workflow("adw_plan_iso")
        .message("queued")
        .build();

    assertEquals("a1b2c3d4", result.adwId());
    assertEquals("adw_plan_iso", result.workflow());
    assertEquals("queued", result.message());
    assertEquals(result, TriggerResult.builder(true)
        .adwId("a1b2c3d4").workflow("adw_plan_iso").message("queued").build());
  }

  @Test
  void typeDoesNotForceErrorOnFailure() {
    TriggerResult result = TriggerResult.builder(false).build();

    assertFalse(result.success());
    assertNull(result.error());
  }
}
