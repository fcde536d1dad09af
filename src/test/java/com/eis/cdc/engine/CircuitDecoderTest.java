package com.eis.cdc.engine;

import com.eis.cdc.api.NodeKind;
import com.eis.cdc.circuit.Circuit;
import com.eis.cdc.graph.CircuitGraph;
import com.eis.cdc.graph.GraphNode;
import com.eis.cdc.io.CdcParser;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CircuitDecoderTest {

    private static final String[] ROUND_TRIPS = {
            "[R([RW]C)]",
            "[RLC]",
            "[(RC)(RC)]",
            "[R]",
            "[(RC)]",
            "[(RCL)]",
            "[R(RC)(RW)L]",
            "[(R[C(RW)])]",
            "[([R(CW)]L)]",
            "[([(RC)L]W)]",
            "[R(C[R(CW)])]",
            "[R(RC)(QW)(LK)]",
    };

    private CircuitGraph graph;
    private CircuitDecoder decoder;
    private CircuitValidator validator;

    @Before
    public void setUp() {
        graph = new CircuitGraph();
        decoder = new CircuitDecoder();
        validator = new CircuitValidator();
    }

    private void assertAt(int id, int x, int y) {
        GraphNode n = graph.node(id);
        assertEquals("x of " + n, x, n.x());
        assertEquals("y of " + n, y, n.y());
    }

    @Test
    public void testRandlesLayout() {
        CircuitDecoder.Extent extent = decoder.decode(CdcParser.parse("[R([RW]C)]"), graph);

        assertEquals(new CircuitDecoder.Extent(3, 2), extent);
        assertEquals(4, graph.elementNodes().size());
        assertTrue(graph.junctionNodes().isEmpty());
        assertEquals(6, graph.linkCount());

        assertAt(CircuitGraph.SOURCE_ID, 0, 0);
        assertAt(0, 1, 0);
        assertAt(1, 2, 0);
        assertAt(2, 3, 0);
        assertAt(3, 2, 1);
        assertAt(CircuitGraph.SINK_ID, 4, 0);

        assertEquals(List.of(1, 3), List.copyOf(graph.node(0).outputLinks().keySet()));
        assertEquals(List.of(2, 3), List.copyOf(graph.sink().inputLinks().keySet()));
    }

    @Test
    public void testSeriesLayout() {
        decoder.decode(CdcParser.parse("[RLC]"), graph);

        assertEquals(4, graph.linkCount());
        assertAt(0, 1, 0);
        assertAt(1, 2, 0);
        assertAt(2, 3, 0);
        assertAt(CircuitGraph.SINK_ID, 4, 0);
    }

    @Test
    public void testJunctionBetweenParallels() {
        decoder.decode(CdcParser.parse("[(RC)(RC)]"), graph);

        List<GraphNode> junctions = graph.junctionNodes();
        assertEquals(1, junctions.size());
        GraphNode j = junctions.get(0);
        assertEquals(-2, j.id());
        assertEquals(NodeKind.JUNCTION, j.kind());
        assertEquals(List.of(0, 1), List.copyOf(j.inputLinks().keySet()));
        assertEquals(List.of(2, 3), List.copyOf(j.outputLinks().keySet()));
        assertAt(j.id(), 2, 0);
        assertAt(2, 3, 0);
        assertAt(3, 3, 1);
        assertAt(CircuitGraph.SINK_ID, 4, 0);
    }

    @Test
    public void testJunctionAtHeadOfBranch() {
        decoder.decode(CdcParser.parse("[([(RC)L]W)]"), graph);

        GraphNode j = graph.node(-2);
        assertEquals(List.of(CircuitGraph.SOURCE_ID), List.copyOf(j.inputLinks().keySet()));
        assertEquals(2, j.outputCount());
        assertEquals(2, graph.source().outputCount());
    }

    @Test
    public void testEmptyCircuit() {
        CircuitDecoder.Extent extent = decoder.decode(CdcParser.parse("[]"), graph);

        assertEquals(0, extent.width());
        assertEquals(0, graph.linkCount());
        assertTrue(graph.nodes().isEmpty());
        assertAt(CircuitGraph.SINK_ID, 1, 0);
    }

    @Test
    public void testDecodeReplacesGraph() {
        decoder.decode(CdcParser.parse("[R([RW]C)]"), graph);
        decoder.decode(CdcParser.parse("[RC]"), graph);

        assertEquals(2, graph.nodes().size());
        assertEquals(3, graph.linkCount());
        assertEquals(0, graph.node(0).id());
    }

    @Test
    public void testElementsAreCopied() {
        Circuit circuit = CdcParser.parse("[R{:bulk}C]");
        decoder.decode(circuit, graph);

        assertEquals(-1, circuit.getElements().get(0).getIdentifier());
        assertNotSame(circuit.getElements().get(0), graph.node(0).element());
        assertEquals("bulk", graph.node(0).element().getLabel());
    }

    @Test
    public void testRoundTrips() {
        for (String cdc : ROUND_TRIPS) {
            Circuit circuit = CdcParser.parse(cdc);
            decoder.decode(circuit, graph);
            CircuitStatus status = validator.validate(graph);
            assertTrue(cdc + ": " + status.message(), status.valid());
            assertEquals(cdc, status.basicCdc());
            assertEquals(cdc, circuit.toString(4), status.extendedCdc());
        }
    }

    @Test
    public void testEncodeThenDecodeIsStable() {
        for (String cdc : ROUND_TRIPS) {
            decoder.decode(CdcParser.parse(cdc), graph);
            String first = validator.validate(graph).extendedCdc();
            int links = graph.linkCount();
            decoder.decode(validator.validate(graph).circuit(), graph);
            assertEquals(cdc, first, validator.validate(graph).extendedCdc());
            assertEquals(cdc, links, graph.linkCount());
        }
    }
}
