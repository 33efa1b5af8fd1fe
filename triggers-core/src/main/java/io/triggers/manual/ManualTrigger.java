package io.triggers.manual;

import io.triggers.AbstractTrigger;
import io.triggers.TriggerConfig;
import io.triggers.TriggerEvent;
import io.triggers.TriggerResult;
import io.triggers.registry.TriggerRegistry;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Trigger for programmatic invocation: code calls {@link #emit} and gets the dispatch
 * results back synchronously.
 *
 * <p>Start and stop acquire nothing; they only flip the running flag. Emitting does not
 * require the trigger to be running. {@link #onEvent(TriggerEvent)} propagates the
 * dispatch results to its caller.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ManualTrigger trigger = new ManualTrigger();
 * trigger.addHandler(workflowLauncher);
 * trigger.start();
 *
 * trigger.emitPlanEvent(123, "acme/widgets");
 * trigger.emitBuildEvent(123, "a1b2c3d4", "acme/widgets");
 * }</pre>
 *
 * @see Workflows
 */
public class ManualTrigger extends AbstractTrigger {

  /** Name the manual trigger is registered under. */
  public static final String NAME = "manual";

  /** Source recorded on every emitted event. */
  public static final String SOURCE = "manual";

  public ManualTrigger() {
    this(TriggerConfig.named(NAME));
  }

  public ManualTrigger(TriggerConfig config) {
    super(config);
  }

  /**
   * Registers the manual trigger type under {@value #NAME}.
   *
   * @param registry the registry to register with
   */
  public static void register(TriggerRegistry registry) {
    registry.register(NAME, ManualTrigger::new);
  }

  @Override
  protected void doStart() {
    // nothing to acquire
  }

  @Override
  protected void doStop() {
    // nothing to release
  }

  /**
   * Dispatches {@code event} and returns the results.
   */
  @Override
  public List<TriggerResult> onEvent(TriggerEvent event) {
    return dispatch(event);
  }

  /**
   * Emits an event with no correlation ids.
   *
   * @param eventType the event type
   * @param payload   handler-defined data, may be null
   * @return one result per handler
   */
  public List<TriggerResult> emit(String eventType, Map<String, ?> payload) {
    return emit(eventType, payload, null, null, null);
  }

  /**
   * Builds a {@link TriggerEvent} with source {@value #SOURCE} and the current time,
   * then dispatches it.
   *
   * @param eventType   the event type
   * @param payload     handler-defined data, may be null
   * @param issueNumber optional issue number
   * @param adwId       optional id of existing work
   * @param repoPath    optional repository path
   * @return one result per handler
   */
  public List<TriggerResult> emit(String eventType, Map<String, ?> payload,
      Integer issueNumber, String adwId, String repoPath) {
    TriggerEvent event = TriggerEvent.builder(eventType)
        .source(SOURCE)
        .timestamp(Instant.now())
        .payload(payload)
        .issueNumber(issueNumber)
        .adwId(adwId)
        .repoPath(repoPath)
        .build();
    return dispatch(event);
  }

  /**
   * Emits an {@value Workflows#ISSUE_WORKFLOW} event asking for {@code workflow} to run
   * against an issue.
   *
   * @param issueNumber the issue number
   * @param workflow    the workflow name, stored as {@code payload.workflow}
   * @param repoPath    optional repository path
   * @param adwId       optional id of the run to continue
   * @return one result per handler
   */
  public List<TriggerResult> emitIssueEvent(int issueNumber, String workflow,
      String repoPath, String adwId) {
    Objects.requireNonNull(workflow, "workflow");
    return emit(Workflows.ISSUE_WORKFLOW, Map.of(TriggerEvent.WORKFLOW_KEY, workflow),
        issueNumber, adwId, repoPath);
  }

  public List<TriggerResult> emitPlanEvent(int issueNumber) {
    return emitPlanEvent(issueNumber, null);
  }

  public List<TriggerResult> emitPlanEvent(int issueNumber, String repoPath) {
    return emitIssueEvent(issueNumber, Workflows.PLAN, repoPath, null);
  }

  /**
   * Emits a build request. Builds continue an existing run, so {@code adwId} is
   * mandatory; whether that run exists is for the handler to decide.
   *
   * @param issueNumber the issue number
   * @param adwId       id of the run to continue
   * @param repoPath    optional repository path
   * @return one result per handler
   * @throws IllegalArgumentException if {@code adwId} is null or blank
   */
  public List<TriggerResult> emitBuildEvent(int issueNumber, String adwId, String repoPath) {
    if (adwId == null || adwId.isBlank()) {
      throw new IllegalArgumentException("adwId is required for " + Workflows.BUILD);
    }
    return emitIssueEvent(issueNumber, Workflows.BUILD, repoPath, adwId);
  }

  public List<TriggerResult> emitPatchEvent(int issueNumber) {
    return emitPatchEvent(issueNumber, null);
  }

  public List<TriggerResult> emitPatchEvent(int issueNumber, String repoPath) {
    return emitIssueEvent(issueNumber, Workflows.PATCH, repoPath, null);
  }
}
