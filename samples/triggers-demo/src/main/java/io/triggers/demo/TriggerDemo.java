package io.triggers.demo;

import io.triggers.TriggerEvent;
import io.triggers.TriggerResult;
import io.triggers.dispatch.DispatchInterceptor;
import io.triggers.manual.ManualTrigger;
import io.triggers.manual.Workflows;
import io.triggers.registry.DefaultTriggerRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Simple demo showing trigger framework usage without Spring.
 * <p>
 * Run with: mvn -pl samples/triggers-demo exec:java
 */
public final class TriggerDemo {

    private static final Logger log = LoggerFactory.getLogger(TriggerDemo.class);

    public static void main(String[] args) {
        // 1. Registry with the manual trigger type and an audit interceptor
        try (DefaultTriggerRegistry registry = DefaultTriggerRegistry.builder()
                .interceptor(DispatchInterceptor.before((trigger, event) ->
                        log.info("[Audit] {} dispatching type={}, id={}",
                                trigger.name(), event.eventType(), event.eventId())))
                .build()) {
            DefaultTriggerRegistry.registerBuiltIns(registry);
            log.info("Registered trigger types: {}", registry.listTriggers());

            // 2. Create an instance and attach handlers
            ManualTrigger manual = (ManualTrigger) registry.create(ManualTrigger.NAME, Map.of())
                    .orElseThrow();
            manual.addHandler(TriggerDemo::runWorkflow);
            manual.addHandler(event -> {
                if (event.issueNumber() == null) {
                    throw new IllegalArgumentException("event has no issue number");
                }
                return TriggerResult.ok("noted issue #" + event.issueNumber());
            });

            // 3. Start and emit
            manual.start();
            log.info("Running triggers: {}", registry.listRunning());

            report("plan", manual.emitPlanEvent(42));
            report("build", manual.emitBuildEvent(42, "a1b2c3d4", "/repos/app"));
            report("patch", manual.emitPatchEvent(7, "/repos/app"));
            report("custom", manual.emit("cache_flush", Map.of("scope", "all")));
        }
        log.info("Registry closed");
    }

    private static TriggerResult runWorkflow(TriggerEvent event) {
        String workflow = event.workflow();
        if (workflow == null) {
            return TriggerResult.failure("no workflow requested by " + event.eventType());
        }
        String adwId = event.adwId() != null ? event.adwId() : event.eventId().substring(0, 8).toLowerCase();
        return TriggerResult.builder(true)
                .adwId(adwId)
                .workflow(workflow)
                .message(describe(workflow) + " started for issue #" + event.issueNumber())
                .build();
    }

    private static String describe(String workflow) {
        switch (workflow) {
            case Workflows.PLAN:
                return "Planning";
            case Workflows.BUILD:
                return "Build";
            case Workflows.PATCH:
                return "Patch";
            default:
                return workflow;
        }
    }

    private static void report(String label, List<TriggerResult> results) {
        for (TriggerResult result : results) {
            if (result.success()) {
                log.info("[{}] ok: {}", label, result);
            } else {
                log.warn("[{}] failed: {}", label, result.error());
            }
        }
    }
}
