package com.eis.cdc.api;

/**
 * What a circuit graph node stands for.
 *
 * <p>
 * The kind is carried explicitly by each node; node ids are opaque keys and
 * never used to infer the kind.
 */
public enum NodeKind {
    /** The working electrode terminal. Only outgoing links. */
    SOURCE,
    /** The counter/reference electrode terminal. Only incoming links. */
    SINK,
    /** A circuit element. */
    ELEMENT,
    /** A zero-impedance fan-out/fan-in point. */
    JUNCTION;

    public boolean isTerminal() {
        return this == SOURCE || this == SINK;
    }
}
