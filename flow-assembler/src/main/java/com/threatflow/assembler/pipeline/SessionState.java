package com.threatflow.assembler.pipeline;

/**
 * Lifecycle of a {@link FlowGraphAssembler}.
 */
public enum SessionState {
    OPEN,
    COMPLETED,
    CANCELLED,
    FAILED
}
