package com.eis.cdc.engine;

/**
 * Structural problems that keep a circuit graph from being written as CDC.
 */
public enum Violation {
    /** The source links straight to the sink, or a parallel branch holds no element. */
    SHORT_CIRCUIT,
    /** A node is unreachable from the source or lacks an input or output link. */
    DISCONNECTED_NODE,
    /** A junction neither splits (1+ in, 2+ out) nor merges (2+ in, 1+ out). */
    INSUFFICIENT_JUNCTION_FAN_IN_OUT,
    /** Branches reconverge in a way the nested series/parallel grammar cannot express. */
    UNRESOLVED_MERGE
}
