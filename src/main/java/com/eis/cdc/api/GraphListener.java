package com.eis.cdc.api;

/**
 * Receives notifications about circuit graph mutations.
 *
 * <p>
 * Callbacks run synchronously on the mutating thread, after the mutation has
 * been applied. Any CDC text or validity computed before the callback is
 * stale.
 */
public interface GraphListener {

    /**
     * Called after every successful mutation.
     *
     * @param revision The graph revision after the mutation.
     * @param mutation What changed.
     * @param nodeId   The node primarily affected, or the link source for link
     *                 mutations; {@link Integer#MIN_VALUE} for {@link Mutation#CLEAR}.
     */
    void onGraphChanged(long revision, Mutation mutation, int nodeId);

    /** Kinds of graph mutations. */
    enum Mutation {
        NODE_ADDED,
        NODE_DELETED,
        NODE_MOVED,
        ELEMENT_CHANGED,
        LINKED,
        UNLINKED,
        CLEAR
    }
}
