package io.triggers.manual;

/**
 * Well-known event type and workflow names used by the manual trigger's issue helpers.
 */
public final class Workflows {

    /** Event type for "run a workflow for an issue" events. */
    public static final String ISSUE_WORKFLOW = "issue_workflow";

    /** Plans the work for an issue in an isolated worktree. Starts a new run. */
    public static final String PLAN = "adw_plan_iso";

    /** Builds on an existing plan. Continues a run, so it needs an {@code adwId}. */
    public static final String BUILD = "adw_build_iso";

    /** Applies a targeted patch for an issue. Starts a new run. */
    public static final String PATCH = "adw_patch_iso";

    private Workflows() {
    }
}
