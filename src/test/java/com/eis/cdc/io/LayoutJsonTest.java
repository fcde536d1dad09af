package com.eis.cdc.io;

import com.eis.cdc.engine.CircuitDecoder;
import com.eis.cdc.graph.CircuitGraph;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class LayoutJsonTest {

    private static GraphLayoutDescriptor randles() {
        CircuitGraph graph = new CircuitGraph();
        new CircuitDecoder().decode(CdcParser.parse("[R([RW]C)]"), graph);
        return GraphLayoutDescriptor.of(graph, new EditorSettings());
    }

    @Test
    public void testDescriptorOrderAndLabels() {
        GraphLayoutDescriptor d = randles();
        List<GraphLayoutDescriptor.NodeEntry> nodes = d.getNodes();

        assertEquals(6, nodes.size());
        assertEquals(CircuitGraph.SOURCE_ID, nodes.get(0).getId());
        assertEquals("WE", nodes.get(0).getLabel());
        assertEquals(CircuitGraph.SINK_ID, nodes.get(5).getId());
        assertEquals("CE+RE", nodes.get(5).getLabel());

        GraphLayoutDescriptor.NodeEntry r0 = d.find(0);
        assertEquals("R_0", r0.getLabel());
        assertEquals(List.of(CircuitGraph.SOURCE_ID), r0.getInputs());
        assertEquals(List.of(1, 3), r0.getOutputs());
        assertEquals(1, r0.getX());
        assertEquals(0, r0.getY());
        assertNull(d.find(42));
    }

    @Test
    public void testJsonRoundTrip() {
        GraphLayoutDescriptor d = randles();
        String json = LayoutJson.write(d);

        assertTrue(json.contains("\"label\" : \"W_2\""));
        assertEquals(d, LayoutJson.read(json));
    }

    @Test
    public void testJunctionLabel() {
        CircuitGraph graph = new CircuitGraph();
        new CircuitDecoder().decode(CdcParser.parse("[(RC)(RC)]"), graph);
        EditorSettings settings = new EditorSettings();
        settings.setJunctionLabel("J");

        assertEquals("J", GraphLayoutDescriptor.of(graph, settings).find(-2).getLabel());
    }

    @Test
    public void testReadRejectsMalformedJson() {
        try {
            LayoutJson.read("{\"nodes\": [");
            fail("Should reject malformed JSON");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Malformed layout JSON"));
        }
        try {
            LayoutJson.read("{\"nodes\": null}");
            fail("Should reject missing nodes");
        } catch (IllegalArgumentException e) {
            assertEquals("Missing 'nodes' key", e.getMessage());
        }
    }
}
