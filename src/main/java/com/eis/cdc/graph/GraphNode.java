package com.eis.cdc.graph;

import com.eis.cdc.api.NodeKind;
import com.eis.cdc.element.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the circuit graph: a terminal, an element or a junction.
 *
 * <p>
 * Links are keyed by the id of the node at the other end and kept in creation
 * order, which fixes the branch order of the emitted CDC. Positions are in
 * layout grid units.
 */
public final class GraphNode {
    private final int id;
    private final NodeKind kind;
    private final Element element;
    private final Map<Integer, Link> inputLinks = new LinkedHashMap<>();
    private final Map<Integer, Link> outputLinks = new LinkedHashMap<>();
    private int x;
    private int y;

    GraphNode(int id, NodeKind kind, Element element, int x, int y) {
        if ((kind == NodeKind.ELEMENT) != (element != null))
            throw new IllegalArgumentException("An element is required for, and only for, ELEMENT nodes");
        this.id = id;
        this.kind = kind;
        this.element = element;
        this.x = x;
        this.y = y;
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    /** The element of an ELEMENT node, null otherwise. */
    public Element element() {
        return element;
    }

    public boolean isTerminal() {
        return kind.isTerminal();
    }

    /** Incoming links keyed by the id of the upstream node. */
    public Map<Integer, Link> inputLinks() {
        return Collections.unmodifiableMap(inputLinks);
    }

    /** Outgoing links keyed by the id of the downstream node. */
    public Map<Integer, Link> outputLinks() {
        return Collections.unmodifiableMap(outputLinks);
    }

    public int inputCount() {
        return inputLinks.size();
    }

    public int outputCount() {
        return outputLinks.size();
    }

    public int x() {
        return x;
    }

    public int y() {
        return y;
    }

    void moveTo(int x, int y) {
        this.x = x;
        this.y = y;
    }

    void addInput(Link link) {
        inputLinks.put(link.from(), link);
    }

    void addOutput(Link link) {
        outputLinks.put(link.to(), link);
    }

    void removeInput(int from) {
        inputLinks.remove(from);
    }

    void removeOutput(int to) {
        outputLinks.remove(to);
    }

    /** Short human-readable name, e.g. {@code R_0} or {@code junction -2}. */
    public String describe() {
        return switch (kind) {
            case SOURCE -> "source";
            case SINK -> "sink";
            case ELEMENT -> element.getDisplayLabel();
            case JUNCTION -> "junction " + id;
        };
    }

    @Override
    public String toString() {
        return describe();
    }
}
