package com.eis.cdc;

import com.eis.cdc.api.GraphListener;
import com.eis.cdc.api.NodeKind;
import com.eis.cdc.circuit.Circuit;
import com.eis.cdc.element.Element;
import com.eis.cdc.element.ElementType;
import com.eis.cdc.engine.CircuitDecoder;
import com.eis.cdc.engine.CircuitStatus;
import com.eis.cdc.engine.CircuitValidator;
import com.eis.cdc.graph.CircuitGraph;
import com.eis.cdc.graph.GraphNode;
import com.eis.cdc.graph.Link;
import com.eis.cdc.io.CdcParseException;
import com.eis.cdc.io.CdcParser;
import com.eis.cdc.io.EditorSettings;
import com.eis.cdc.io.GraphLayoutDescriptor;
import com.eis.cdc.util.CircuitExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One circuit editing session: a circuit graph kept in step with its CDC.
 *
 * <p>
 * This class handles:
 * <ul>
 * <li>Parsing CDC text and regenerating the graph and its layout</li>
 * <li>Graph edits (nodes, links, element parameters and labels), each
 * followed by re-validation</li>
 * <li>Reporting the current CDC and status, cached per graph revision</li>
 * <li>Handing the accepted circuit over to a fitting back end</li>
 * </ul>
 *
 * <p>
 * A rejected edit throws and leaves the session as it was. Not thread-safe.
 */
public class CircuitEditor {
    private static final Logger log = LogManager.getLogger(CircuitEditor.class);

    private final EditorSettings settings;
    private final CircuitGraph graph = new CircuitGraph();
    private final CircuitValidator validator;
    private final CircuitDecoder decoder = new CircuitDecoder();

    private CircuitStatus cachedStatus;
    private long cachedRevision = -1;
    private CircuitStatus status;
    private boolean decoding;

    public CircuitEditor() {
        this(new EditorSettings());
    }

    public CircuitEditor(EditorSettings settings) {
        this.settings = settings.validate();
        this.validator = new CircuitValidator(settings);
        graph.addListener(this::onGraphChanged);
        this.status = validate();
    }

    public EditorSettings settings() {
        return settings;
    }

    /** The session graph. Edits made on it directly are picked up as well. */
    public CircuitGraph graph() {
        return graph;
    }

    public void addListener(GraphListener listener) {
        graph.addListener(listener);
    }

    // ── CDC ──────────────────────────────────────────────────────

    /**
     * Parses CDC text and, on success, replaces the graph with the parsed
     * circuit. On failure the graph is kept and {@link #status()} reports the
     * parse error.
     *
     * @return The parsed circuit, empty if the text is malformed.
     */
    public Optional<Circuit> parseCdc(String cdc) {
        Circuit circuit;
        try {
            circuit = CdcParser.parse(cdc);
        } catch (CdcParseException e) {
            log.warn("Rejected CDC '{}': {}", cdc, e.getMessage());
            status = new CircuitStatus(false, e.getMessage(), null, null, List.of(), "", "",
                    validate().nodeValidity());
            return Optional.empty();
        }
        decoding = true;
        try {
            decoder.decode(circuit, graph);
        } finally {
            decoding = false;
        }
        status = validate();
        if (status.valid() && !status.basicCdc().equals(circuit.toString()))
            log.warn("Regenerated circuit {} differs from parsed {}", status.basicCdc(), circuit);
        log.info("Loaded circuit {}", circuit);
        return Optional.of(circuit);
    }

    /** The circuit, message and tokens of the current graph. */
    public CircuitStatus generateCircuit() {
        return validate();
    }

    /** Validates the current graph. Repeated calls without edits are free. */
    public CircuitStatus validate() {
        if (cachedStatus == null || cachedRevision != graph.revision()) {
            cachedStatus = validator.validate(graph);
            cachedRevision = graph.revision();
        }
        return cachedStatus;
    }

    /** The status of the last user action, parse errors included. */
    public CircuitStatus status() {
        return status;
    }

    /** Layout of the session graph. */
    public GraphLayoutDescriptor nodesToDict() {
        return GraphLayoutDescriptor.of(graph, settings);
    }

    /**
     * Layout the given CDC would produce. The session graph is not touched.
     *
     * @throws CdcParseException if the text is malformed.
     */
    public GraphLayoutDescriptor nodesToDict(String cdc) {
        if (cdc == null || cdc.isEmpty())
            return nodesToDict();
        CircuitGraph scratch = new CircuitGraph();
        decoder.decode(CdcParser.parse(cdc), scratch);
        return GraphLayoutDescriptor.of(scratch, settings);
    }

    /** Text dump of the session graph, for logs and bug reports. */
    public String explain() {
        return new CircuitExplain(nodesToDict(), settings.getLabelWidth()).dumpTopology();
    }

    // ── Graph edits ──────────────────────────────────────────────

    public GraphNode addElement(String symbol) {
        return addElement(ElementType.requireSymbol(symbol).create());
    }

    public GraphNode addElement(Element element) {
        return graph.addElementNode(element);
    }

    public GraphNode addJunction() {
        return graph.addJunctionNode();
    }

    public Link connect(int from, int to) {
        return graph.connect(from, to);
    }

    public void disconnect(int linkId) {
        graph.disconnect(linkId);
    }

    public void delete(int nodeId) {
        graph.delete(nodeId);
    }

    public void moveNode(int nodeId, int x, int y) {
        graph.moveNode(nodeId, x, y);
    }

    public void clear() {
        graph.clear();
    }

    // ── Element edits ────────────────────────────────────────────

    public void setParameterValue(int nodeId, String key, double value) {
        element(nodeId).setValue(key, value);
        graph.elementChanged(nodeId);
    }

    public void setLowerLimit(int nodeId, String key, double lower) {
        element(nodeId).setLowerLimit(key, lower);
        graph.elementChanged(nodeId);
    }

    public void setUpperLimit(int nodeId, String key, double upper) {
        element(nodeId).setUpperLimit(key, upper);
        graph.elementChanged(nodeId);
    }

    public void setFixed(int nodeId, String key, boolean fixed) {
        element(nodeId).setFixed(key, fixed);
        graph.elementChanged(nodeId);
    }

    public void resetParameter(int nodeId, String key) {
        element(nodeId).resetParameter(key);
        graph.elementChanged(nodeId);
    }

    public void setLabel(int nodeId, String label) {
        element(nodeId).setLabel(label);
        graph.elementChanged(nodeId);
    }

    /** Element labels of the session graph, keyed by node id. */
    public Map<Integer, String> elementLabels() {
        Map<Integer, String> out = new LinkedHashMap<>();
        for (GraphNode n : graph.elementNodes())
            out.put(n.id(), n.element().getDisplayLabel());
        return out;
    }

    // ── Fitting ──────────────────────────────────────────────────

    /**
     * Hands the current circuit over to a fitting back end.
     *
     * @throws IllegalStateException if the graph is not a valid circuit.
     */
    public FitHandoff fittingHandoff() {
        CircuitStatus current = validate();
        if (!current.valid())
            throw new IllegalStateException("Circuit is not valid: " + current.message());
        Circuit circuit = current.circuit();
        return new FitHandoff(circuit.toString(settings.getTokenDecimals()), circuit.parameterSettings());
    }

    private Element element(int nodeId) {
        GraphNode n = graph.node(nodeId);
        if (n.kind() != NodeKind.ELEMENT)
            throw new IllegalArgumentException("Node " + nodeId + " is not an element");
        return n.element();
    }

    private void onGraphChanged(long revision, GraphListener.Mutation mutation, int nodeId) {
        if (decoding)
            return;
        status = validate();
        log.debug("{} at revision {}: {}", mutation, revision, status.message());
    }
}
