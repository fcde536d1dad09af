package com.eis.cdc.engine;

import com.eis.cdc.circuit.Circuit;
import com.eis.cdc.element.Element;
import com.eis.cdc.graph.CircuitGraph;
import com.eis.cdc.graph.GraphNode;
import com.eis.cdc.io.CdcParseException;
import com.eis.cdc.io.CdcParser;
import com.eis.cdc.io.EditorSettings;
import lombok.extern.log4j.Log4j2;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Encodes a circuit graph, re-parses the emitted text and reports the result
 * as a {@link CircuitStatus}.
 *
 * <p>
 * Violations never escape: they are downgraded to an invalid status whose
 * message is the first problem found and whose node validity flags the nodes
 * involved. Validation does not modify the graph.
 */
@Log4j2
public final class CircuitValidator {
    private final CircuitEncoder encoder;
    private final EditorSettings settings;

    public CircuitValidator() {
        this(new EditorSettings());
    }

    public CircuitValidator(EditorSettings settings) {
        this.settings = settings;
        this.encoder = new CircuitEncoder(settings);
    }

    public CircuitStatus validate(CircuitGraph graph) {
        CircuitEncoder.Encoding encoding;
        try {
            encoding = encoder.encode(graph);
        } catch (CircuitValidationException e) {
            return invalid(graph, e.getMessage(), e.getViolation(), e.getPartialTokens(), e.getOffendingNodes());
        }

        List<String> tokens = encoding.tokens();
        String text = encoding.text();
        Circuit circuit;
        try {
            circuit = CdcParser.parse(text);
        } catch (CdcParseException e) {
            log.warn("Emitted CDC failed to re-parse: {} ({})", text, e.getMessage());
            return invalid(graph, e.getMessage(), null, tokens, Set.of());
        }
        // Parsed elements follow emission order; give them back their node ids
        List<Element> elements = circuit.getElements();
        for (int i = 0; i < elements.size() && i < encoding.elementIds().size(); i++)
            elements.get(i).assignIdentifier(encoding.elementIds().get(i));
        return new CircuitStatus(true, CircuitStatus.OK, null, circuit, tokens,
                circuit.toString(), circuit.toString(settings.getDisplayDecimals()),
                validity(graph, Set.of()));
    }

    /** Removes parameter blocks from emitted CDC text. */
    public static String stripParameters(String cdc) {
        return cdc.replaceAll("\\{[^}]*}", "");
    }

    private CircuitStatus invalid(CircuitGraph graph, String message, Violation violation, List<String> tokens,
            Set<Integer> offending) {
        String extended = CircuitEncoder.join(tokens);
        return new CircuitStatus(false, message, violation, null, Collections.unmodifiableList(tokens),
                stripParameters(extended), extended, validity(graph, offending));
    }

    private static Map<Integer, Boolean> validity(CircuitGraph graph, Set<Integer> offending) {
        Map<Integer, Boolean> out = new LinkedHashMap<>();
        out.put(graph.source().id(), !offending.contains(graph.source().id()));
        for (GraphNode n : graph.nodes())
            out.put(n.id(), !offending.contains(n.id()));
        out.put(graph.sink().id(), !offending.contains(graph.sink().id()));
        return Collections.unmodifiableMap(out);
    }
}
