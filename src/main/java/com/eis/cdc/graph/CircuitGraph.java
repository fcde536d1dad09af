package com.eis.cdc.graph;

import com.eis.cdc.api.GraphListener;
import com.eis.cdc.api.GraphListener.Mutation;
import com.eis.cdc.api.NodeKind;
import com.eis.cdc.element.Element;
import com.eis.cdc.graph.GraphMutationException.Reason;
import com.eis.cdc.util.CompositeGraphListener;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The editable circuit graph: two terminals plus element and junction nodes
 * joined by directed links.
 *
 * <p>
 * The source (working electrode) and the sink (counter and reference
 * electrode) exist for the whole life of the graph. Every successful mutation
 * bumps {@link #revision()} and notifies the registered listeners; a rejected
 * mutation throws {@link GraphMutationException} and changes nothing.
 *
 * <p>
 * Not thread-safe. One graph belongs to one editing session.
 */
@Log4j2
public final class CircuitGraph {
    public static final int SOURCE_ID = IdAllocator.SOURCE_ID;
    public static final int SINK_ID = IdAllocator.SINK_ID;

    /** Grid position of interactively added nodes. */
    public static final int DEFAULT_X = 0;
    public static final int DEFAULT_Y = 1;

    private final IdAllocator ids = new IdAllocator();
    private final GraphNode source = new GraphNode(SOURCE_ID, NodeKind.SOURCE, null, 0, 0);
    private final GraphNode sink = new GraphNode(SINK_ID, NodeKind.SINK, null, 2, 0);
    private final Map<Integer, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<Integer, Link> links = new LinkedHashMap<>();
    private final CompositeGraphListener listeners = new CompositeGraphListener();
    private int nextLinkId;
    private long revision;

    public GraphNode source() {
        return source;
    }

    public GraphNode sink() {
        return sink;
    }

    public long revision() {
        return revision;
    }

    /** Looks up any node, terminals included. */
    public GraphNode node(int id) {
        if (id == SOURCE_ID)
            return source;
        if (id == SINK_ID)
            return sink;
        GraphNode n = nodes.get(id);
        if (n == null)
            throw new GraphMutationException(Reason.UNKNOWN_NODE, "Unknown node: " + id);
        return n;
    }

    public boolean contains(int id) {
        return id == SOURCE_ID || id == SINK_ID || nodes.containsKey(id);
    }

    /** Element and junction nodes in insertion order. */
    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /** Element nodes in insertion order. */
    public List<GraphNode> elementNodes() {
        List<GraphNode> out = new ArrayList<>();
        for (GraphNode n : nodes.values()) {
            if (n.kind() == NodeKind.ELEMENT)
                out.add(n);
        }
        return out;
    }

    /** Junction nodes in insertion order. */
    public List<GraphNode> junctionNodes() {
        List<GraphNode> out = new ArrayList<>();
        for (GraphNode n : nodes.values()) {
            if (n.kind() == NodeKind.JUNCTION)
                out.add(n);
        }
        return out;
    }

    public Collection<Link> links() {
        return Collections.unmodifiableCollection(links.values());
    }

    public int linkCount() {
        return links.size();
    }

    /** The link from {@code from} to {@code to}, or null. */
    public Link findLink(int from, int to) {
        GraphNode a = node(from);
        return a.outputLinks().get(to);
    }

    public void addListener(GraphListener listener) {
        listeners.addForComposite(listener);
    }

    public boolean removeListener(GraphListener listener) {
        return listeners.removeFromComposite(listener);
    }

    // ── Mutations ────────────────────────────────────────────────

    public GraphNode addElementNode(Element element) {
        return addElementNode(element, DEFAULT_X, DEFAULT_Y);
    }

    /**
     * Places an element in the graph. The element's identifier becomes the new
     * node id.
     *
     * @throws IllegalArgumentException if the element already belongs to a
     *                                  node; add a {@link Element#copy()}
     *                                  instead.
     */
    public GraphNode addElementNode(Element element, int x, int y) {
        if (element == null)
            throw new IllegalArgumentException("element must not be null");
        if (element.getIdentifier() >= 0)
            throw new IllegalArgumentException("Element " + element.getDisplayLabel() + " already belongs to a node");
        int id = ids.nextElement();
        element.assignIdentifier(id);
        GraphNode n = new GraphNode(id, NodeKind.ELEMENT, element, x, y);
        nodes.put(id, n);
        log.debug("Added element node {} ({})", id, element.getSymbol());
        changed(Mutation.NODE_ADDED, id);
        return n;
    }

    public GraphNode addJunctionNode() {
        return addJunctionNode(DEFAULT_X, DEFAULT_Y);
    }

    public GraphNode addJunctionNode(int x, int y) {
        int id = ids.nextJunction();
        GraphNode n = new GraphNode(id, NodeKind.JUNCTION, null, x, y);
        nodes.put(id, n);
        log.debug("Added junction node {}", id);
        changed(Mutation.NODE_ADDED, id);
        return n;
    }

    public Link connect(GraphNode from, GraphNode to) {
        return connect(from.id(), to.id());
    }

    /**
     * Links the output of {@code from} to the input of {@code to}.
     */
    public Link connect(int from, int to) {
        if (!contains(from))
            throw new GraphMutationException(Reason.UNKNOWN_NODE, "Unknown node: " + from);
        if (!contains(to))
            throw new GraphMutationException(Reason.UNKNOWN_NODE, "Unknown node: " + to);
        if (from == to)
            throw new GraphMutationException(Reason.INVALID_ENDPOINT, "Cannot link node " + from + " to itself");
        if (from == SINK_ID)
            throw new GraphMutationException(Reason.INVALID_ENDPOINT, "The sink has no output");
        if (to == SOURCE_ID)
            throw new GraphMutationException(Reason.INVALID_ENDPOINT, "The source has no input");
        GraphNode a = node(from);
        GraphNode b = node(to);
        if (a.outputLinks().containsKey(to))
            throw new GraphMutationException(Reason.DUPLICATE_LINK,
                    "Link already exists: " + a.describe() + " -> " + b.describe());
        Link link = new Link(nextLinkId++, from, to);
        a.addOutput(link);
        b.addInput(link);
        links.put(link.id(), link);
        log.debug("Linked {} -> {}", a.describe(), b.describe());
        changed(Mutation.LINKED, from);
        return link;
    }

    public void disconnect(Link link) {
        disconnect(link.id());
    }

    public void disconnect(int linkId) {
        Link link = links.remove(linkId);
        if (link == null)
            throw new GraphMutationException(Reason.UNKNOWN_LINK, "Unknown link: " + linkId);
        node(link.from()).removeOutput(link.to());
        node(link.to()).removeInput(link.from());
        log.debug("Unlinked {} -> {}", link.from(), link.to());
        changed(Mutation.UNLINKED, link.from());
    }

    public void delete(GraphNode node) {
        delete(node.id());
    }

    /**
     * Removes a node and its incident links. Neighbours are not relinked.
     */
    public void delete(int id) {
        if (id == SOURCE_ID || id == SINK_ID)
            throw new GraphMutationException(Reason.PROTECTED_NODE, "Terminals cannot be deleted");
        GraphNode n = nodes.get(id);
        if (n == null)
            throw new GraphMutationException(Reason.UNKNOWN_NODE, "Unknown node: " + id);
        for (Link l : new ArrayList<>(n.inputLinks().values()))
            unlinkQuietly(l);
        for (Link l : new ArrayList<>(n.outputLinks().values()))
            unlinkQuietly(l);
        nodes.remove(id);
        log.debug("Deleted node {}", n.describe());
        if (n.kind() == NodeKind.ELEMENT)
            n.element().assignIdentifier(-1);
        changed(Mutation.NODE_DELETED, id);
    }

    /**
     * Removes every element, junction and link. The terminals stay and both id
     * counters restart.
     */
    public void clear() {
        for (GraphNode n : nodes.values()) {
            if (n.kind() == NodeKind.ELEMENT)
                n.element().assignIdentifier(-1);
        }
        nodes.clear();
        links.clear();
        for (Link l : new ArrayList<>(source.outputLinks().values()))
            source.removeOutput(l.to());
        for (Link l : new ArrayList<>(sink.inputLinks().values()))
            sink.removeInput(l.from());
        ids.reset();
        nextLinkId = 0;
        log.debug("Cleared graph");
        changed(Mutation.CLEAR, Integer.MIN_VALUE);
    }

    public void moveNode(int id, int x, int y) {
        node(id).moveTo(x, y);
        changed(Mutation.NODE_MOVED, id);
    }

    /**
     * Signals that the element of a node was edited (parameters or label).
     */
    public void elementChanged(int id) {
        GraphNode n = node(id);
        if (n.kind() != NodeKind.ELEMENT)
            throw new IllegalArgumentException("Node " + id + " is not an element");
        changed(Mutation.ELEMENT_CHANGED, id);
    }

    private void unlinkQuietly(Link link) {
        links.remove(link.id());
        node(link.from()).removeOutput(link.to());
        node(link.to()).removeInput(link.from());
    }

    private void changed(Mutation mutation, int nodeId) {
        revision++;
        listeners.onGraphChanged(revision, mutation, nodeId);
    }
}
