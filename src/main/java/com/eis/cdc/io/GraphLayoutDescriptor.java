package com.eis.cdc.io;

import com.eis.cdc.api.NodeKind;
import com.eis.cdc.graph.CircuitGraph;
import com.eis.cdc.graph.GraphNode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain description of a circuit graph layout: every node with its grid
 * position, label and neighbours. The source comes first and the sink last.
 *
 * <p>
 * Consumed by circuit previews and written to JSON by {@link LayoutJson}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphLayoutDescriptor {
    private List<NodeEntry> nodes = new ArrayList<>();

    /** One node of the layout. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeEntry {
        private int id;
        private int x, y;
        private String label;
        private List<Integer> inputs = new ArrayList<>();
        private List<Integer> outputs = new ArrayList<>();
    }

    /** Describes the current state of a graph. */
    public static GraphLayoutDescriptor of(CircuitGraph graph, EditorSettings settings) {
        GraphLayoutDescriptor d = new GraphLayoutDescriptor();
        d.nodes.add(entry(graph.source(), settings));
        for (GraphNode n : graph.nodes())
            d.nodes.add(entry(n, settings));
        d.nodes.add(entry(graph.sink(), settings));
        return d;
    }

    /** The entry with the given id, or null. */
    public NodeEntry find(int id) {
        for (NodeEntry e : nodes) {
            if (e.getId() == id)
                return e;
        }
        return null;
    }

    private static NodeEntry entry(GraphNode n, EditorSettings settings) {
        NodeEntry e = new NodeEntry();
        e.setId(n.id());
        e.setX(n.x());
        e.setY(n.y());
        e.setLabel(label(n, settings));
        e.setInputs(new ArrayList<>(n.inputLinks().keySet()));
        e.setOutputs(new ArrayList<>(n.outputLinks().keySet()));
        return e;
    }

    static String label(GraphNode n, EditorSettings settings) {
        NodeKind kind = n.kind();
        return switch (kind) {
            case SOURCE -> settings.getSourceLabel();
            case SINK -> settings.getSinkLabel();
            case JUNCTION -> settings.getJunctionLabel();
            case ELEMENT -> n.element().getDisplayLabel();
        };
    }
}
