package io.triggers.spring.boot;

import io.triggers.EventHandler;
import io.triggers.Trigger;
import io.triggers.TriggerResult;
import io.triggers.dispatch.DispatchInterceptor;
import io.triggers.manual.ManualTrigger;
import io.triggers.registry.DefaultTriggerRegistry;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TriggerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(TriggerAutoConfiguration.class));

  @Test
  void createsRegistryWithBuiltIns() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("triggerRegistry"));
      assertTrue(ctx.containsBean("triggerHandlerRegistrar"));
      var registry = ctx.getBean(DefaultTriggerRegistry.class);
      assertTrue(registry.get(ManualTrigger.NAME).isPresent());
      assertTrue(registry.listRunning().isEmpty());
    });
  }

  @Test
  void createsAndStartsConfiguredInstance() {
    runner.withPropertyValues("triggers.instances.manual.options.owner=ops").run(ctx -> {
      var registry = ctx.getBean(DefaultTriggerRegistry.class);
      Trigger manual = registry.getInstance("manual").orElseThrow();
      assertTrue(manual.isRunning());
      assertEquals("ops", manual.config().get("owner"));
      assertEquals(List.of("manual"), registry.listRunning());
    });
  }

  @Test
  void autoStartFalseLeavesInstanceStopped() {
    runner.withPropertyValues("triggers.instances.manual.auto-start=false").run(ctx -> {
      var registry = ctx.getBean(DefaultTriggerRegistry.class);
      assertFalse(registry.getInstance("manual").orElseThrow().isRunning());
    });
  }

  @Test
  void disabledInstanceIsNotCreated() {
    runner.withPropertyValues("triggers.instances.manual.enabled=false").run(ctx -> {
      var registry = ctx.getBean(DefaultTriggerRegistry.class);
      assertTrue(registry.getInstance("manual").isEmpty());
    });
  }

  @Test
  void unknownConfiguredTypeFailsStartup() {
    runner.withPropertyValues("triggers.instances.github_webhook.options.port=8001").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void customizerRegistersAdditionalTypes() {
    runner.withUserConfiguration(CustomizerConfig.class)
        .withPropertyValues("triggers.instances.scheduled.auto-start=false")
        .run(ctx -> {
          var registry = ctx.getBean(DefaultTriggerRegistry.class);
          assertEquals(List.of("manual", "scheduled"), registry.listTriggers());
          assertTrue(registry.getInstance("scheduled").isPresent());
        });
  }

  @Test
  void interceptorBeansApplyToCreatedInstances() {
    runner.withUserConfiguration(InterceptorConfig.class, HandlerConfig.class).run(ctx -> {
      var manual = (ManualTrigger) ctx.getBean(DefaultTriggerRegistry.class)
          .getInstance("manual").orElseThrow();
      manual.emitPlanEvent(1);
      assertEquals(List.of("manual"), ctx.getBean(InterceptorConfig.class).seen);
    });
  }

  @Test
  void closingContextStopsInstances() {
    AtomicReference<Trigger> manual = new AtomicReference<>();
    runner.withPropertyValues("triggers.instances.manual.auto-start=true").run(ctx ->
        manual.set(ctx.getBean(DefaultTriggerRegistry.class).getInstance("manual").orElseThrow()));

    assertFalse(manual.get().isRunning());
  }

  @Test
  void backsOffWhenRegistryBeanPresent() {
    runner.withUserConfiguration(CustomRegistryConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultTriggerRegistry.class);
      assertTrue(registry.listTriggers().isEmpty());
    });
  }

  @Configuration
  static class CustomizerConfig {
    @Bean
    TriggerRegistryCustomizer scheduledTriggerType() {
      return registry -> registry.register("scheduled", ManualTrigger::new);
    }
  }

  @Configuration
  static class InterceptorConfig {
    final List<String> seen = new ArrayList<>();

    @Bean
    DispatchInterceptor recordingInterceptor() {
      return DispatchInterceptor.before((trigger, event) -> seen.add(trigger.name()));
    }
  }

  @Configuration
  static class HandlerConfig {
    @Bean
    PlanHandler planHandler() {
      return new PlanHandler();
    }
  }

  @TriggerHandler
  static class PlanHandler implements EventHandler {
    @Override
    public TriggerResult handle(io.triggers.TriggerEvent event) {
      return TriggerResult.builder(true).workflow(event.workflow()).build();
    }
  }

  @Configuration
  static class CustomRegistryConfig {
    @Bean
    DefaultTriggerRegistry customRegistry() {
      return new DefaultTriggerRegistry();
    }
  }
}
