package com.eis.cdc.engine;

import com.eis.cdc.element.ElementType;
import com.eis.cdc.graph.CircuitGraph;
import com.eis.cdc.graph.GraphNode;
import com.eis.cdc.io.EditorSettings;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class CircuitEncoderTest {

    private CircuitGraph graph;
    private CircuitEncoder encoder;

    @Before
    public void setUp() {
        graph = new CircuitGraph();
        encoder = new CircuitEncoder();
    }

    private GraphNode add(ElementType type) {
        return graph.addElementNode(type.create());
    }

    private String basic() {
        return CircuitValidator.stripParameters(encoder.encode(graph).text());
    }

    private CircuitValidationException expectViolation(Violation violation) {
        try {
            encoder.encode(graph);
            fail("Expected " + violation);
            return null;
        } catch (CircuitValidationException e) {
            assertEquals(violation, e.getViolation());
            return e;
        }
    }

    @Test
    public void testSeries() {
        GraphNode r = add(ElementType.RESISTOR);
        GraphNode l = add(ElementType.INDUCTOR);
        GraphNode c = add(ElementType.CAPACITOR);
        graph.connect(graph.source(), r);
        graph.connect(r, l);
        graph.connect(l, c);
        graph.connect(c, graph.sink());

        assertEquals("[RLC]", basic());
        assertEquals(List.of(0, 1, 2), encoder.encode(graph).elementIds());
    }

    @Test
    public void testRandles() {
        // WE -> R0 -> {R1 -> W2, C3} -> CE+RE
        GraphNode r0 = add(ElementType.RESISTOR);
        GraphNode r1 = add(ElementType.RESISTOR);
        GraphNode w2 = add(ElementType.WARBURG);
        GraphNode c3 = add(ElementType.CAPACITOR);
        graph.connect(graph.source(), r0);
        graph.connect(r0, r1);
        graph.connect(r1, w2);
        graph.connect(r0, c3);
        graph.connect(w2, graph.sink());
        graph.connect(c3, graph.sink());

        assertEquals("[R([RW]C)]", basic());
    }

    @Test
    public void testParallelsJoinedByJunction() {
        GraphNode r0 = add(ElementType.RESISTOR);
        GraphNode c1 = add(ElementType.CAPACITOR);
        GraphNode j = graph.addJunctionNode();
        GraphNode r2 = add(ElementType.RESISTOR);
        GraphNode c3 = add(ElementType.CAPACITOR);
        graph.connect(graph.source(), r0);
        graph.connect(graph.source(), c1);
        graph.connect(r0, j);
        graph.connect(c1, j);
        graph.connect(j, r2);
        graph.connect(j, c3);
        graph.connect(r2, graph.sink());
        graph.connect(c3, graph.sink());

        assertEquals("[(RC)(RC)]", basic());
    }

    @Test
    public void testBranchOrderFollowsLinkOrder() {
        GraphNode r = add(ElementType.RESISTOR);
        GraphNode c = add(ElementType.CAPACITOR);
        graph.connect(graph.source(), c);
        graph.connect(graph.source(), r);
        graph.connect(r, graph.sink());
        graph.connect(c, graph.sink());

        assertEquals("[(CR)]", basic());
        // Deterministic
        assertEquals(encoder.encode(graph), encoder.encode(graph));
    }

    @Test
    public void testTokensCarryParameters() {
        GraphNode r = add(ElementType.RESISTOR);
        graph.connect(graph.source(), r);
        graph.connect(r, graph.sink());
        r.element().setValue("R", 50.0);

        assertEquals("[R{R=5.000000000000E+01}]", encoder.encode(graph).text());
        assertEquals("[R{R=5.00E+01}]", new CircuitEncoder(settings(2)).encode(graph).text());
    }

    private static EditorSettings settings(int tokenDecimals) {
        EditorSettings s = new EditorSettings();
        s.setTokenDecimals(tokenDecimals);
        return s;
    }

    @Test
    public void testSourceNotConnected() {
        CircuitValidationException e = expectViolation(Violation.DISCONNECTED_NODE);
        assertEquals("WE is not connected to anything!", e.getMessage());
    }

    @Test
    public void testShortCircuit() {
        graph.connect(graph.source(), graph.sink());
        CircuitValidationException e = expectViolation(Violation.SHORT_CIRCUIT);
        assertEquals("WE is shorted to CE+RE!", e.getMessage());
        assertEquals(Set.of(CircuitGraph.SOURCE_ID, CircuitGraph.SINK_ID), e.getOffendingNodes());
    }

    @Test
    public void testShortedParallelBranch() {
        // R0 in parallel with a bare wire
        GraphNode r0 = add(ElementType.RESISTOR);
        GraphNode c1 = add(ElementType.CAPACITOR);
        graph.connect(graph.source(), r0);
        graph.connect(r0, c1);
        graph.connect(r0, graph.sink());
        graph.connect(c1, graph.sink());

        expectViolation(Violation.SHORT_CIRCUIT);
    }

    @Test
    public void testElementMissingOutput() {
        GraphNode r = add(ElementType.RESISTOR);
        graph.connect(graph.source(), r);

        CircuitValidationException e = expectViolation(Violation.DISCONNECTED_NODE);
        assertEquals("R_0 is missing a connection!", e.getMessage());
        assertEquals(Set.of(r.id()), e.getOffendingNodes());
        assertEquals(List.of("["), e.getPartialTokens());
    }

    @Test
    public void testUnreachableElement() {
        GraphNode r = add(ElementType.RESISTOR);
        GraphNode c = add(ElementType.CAPACITOR);
        graph.connect(graph.source(), r);
        graph.connect(r, graph.sink());
        graph.connect(c, graph.sink());

        CircuitValidationException e = expectViolation(Violation.DISCONNECTED_NODE);
        assertEquals("C_1 has insufficient input connections!", e.getMessage());
    }

    @Test
    public void testDisconnectedIsland() {
        GraphNode r = add(ElementType.RESISTOR);
        graph.connect(graph.source(), r);
        graph.connect(r, graph.sink());
        // Two elements feeding each other, never reached from WE
        GraphNode a = add(ElementType.CAPACITOR);
        GraphNode b = add(ElementType.INDUCTOR);
        graph.connect(a, b);
        graph.connect(b, a);

        CircuitValidationException e = expectViolation(Violation.DISCONNECTED_NODE);
        assertEquals("Disconnected node(s) detected!", e.getMessage());
        assertEquals(Set.of(a.id(), b.id()), e.getOffendingNodes());
    }

    @Test
    public void testJunctionFanInOut() {
        GraphNode j = graph.addJunctionNode();
        GraphNode r = add(ElementType.RESISTOR);
        graph.connect(graph.source(), j);
        graph.connect(j, r);
        graph.connect(r, graph.sink());

        CircuitValidationException e = expectViolation(Violation.INSUFFICIENT_JUNCTION_FAN_IN_OUT);
        assertEquals(Set.of(j.id()), e.getOffendingNodes());
    }

    @Test
    public void testBridgeIsUnresolvedMerge() {
        // Wheatstone bridge: R4 spans the two middle junctions
        GraphNode r0 = add(ElementType.RESISTOR);
        GraphNode r1 = add(ElementType.RESISTOR);
        GraphNode r2 = add(ElementType.RESISTOR);
        GraphNode r3 = add(ElementType.RESISTOR);
        GraphNode r4 = add(ElementType.RESISTOR);
        GraphNode top = graph.addJunctionNode();
        GraphNode bottom = graph.addJunctionNode();
        graph.connect(graph.source(), r0);
        graph.connect(r0, top);
        graph.connect(top, r1);
        graph.connect(r1, graph.sink());
        graph.connect(graph.source(), r2);
        graph.connect(r2, bottom);
        graph.connect(bottom, r3);
        graph.connect(r3, graph.sink());
        graph.connect(top, r4);
        graph.connect(r4, bottom);

        CircuitValidationException e = expectViolation(Violation.UNRESOLVED_MERGE);
        assertEquals("The queue for nodes to visit is not empty!", e.getMessage());
    }

    @Test
    public void testLongSeries() {
        GraphNode prev = graph.source();
        for (int i = 0; i < 5000; i++) {
            GraphNode r = add(ElementType.RESISTOR);
            graph.connect(prev, r);
            prev = r;
        }
        graph.connect(prev, graph.sink());

        CircuitEncoder.Encoding encoding = encoder.encode(graph);
        assertEquals("[" + "R".repeat(5000) + "]", CircuitValidator.stripParameters(encoding.text()));
        assertEquals(5000, encoding.elementIds().size());
        assertEquals(Integer.valueOf(4999), encoding.elementIds().get(4999));
    }
}
