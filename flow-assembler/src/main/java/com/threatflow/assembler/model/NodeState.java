package com.threatflow.assembler.model;

/**
 * Lifecycle of one original node id within a session.
 *
 * <p>Ordering matters: a later state implies the earlier ones.
 */
public enum NodeState {
    /** The stream mentioned the node but no display id exists yet. */
    KNOWN,
    /** A display id is assigned; the caller has not received the node. */
    MAPPED,
    /** The caller has received the node under its display id. */
    EMITTED;

    public boolean isAtLeast(NodeState other) {
        return compareTo(other) >= 0;
    }
}
