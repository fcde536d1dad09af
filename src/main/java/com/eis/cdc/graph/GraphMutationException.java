package com.eis.cdc.graph;

/**
 * Thrown when a graph mutation is illegal. The graph is left unchanged.
 */
public class GraphMutationException extends IllegalStateException {
    private final Reason reason;

    public GraphMutationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /** Why the mutation was rejected. */
    public enum Reason {
        /** The ordered pair is already linked. */
        DUPLICATE_LINK,
        /** Link out of the sink, into the source, or onto the same node. */
        INVALID_ENDPOINT,
        /** Attempt to delete a terminal. */
        PROTECTED_NODE,
        UNKNOWN_NODE,
        UNKNOWN_LINK
    }
}
