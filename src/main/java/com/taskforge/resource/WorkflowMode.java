package com.taskforge.resource;

/**
 * How the bots of a team share a task. In {@link #PIPELINE} mode bots run one per turn in roster order;
 * every other collaboration model runs the whole roster against the same prompt.
 */
public enum WorkflowMode {
    PARALLEL,
    PIPELINE;

    public static WorkflowMode from(String collaborationModel) {
        return "pipeline".equalsIgnoreCase(collaborationModel) ? PIPELINE : PARALLEL;
    }
}
