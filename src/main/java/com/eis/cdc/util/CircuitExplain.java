package com.eis.cdc.util;

import com.eis.cdc.io.GraphLayoutDescriptor;
import com.eis.cdc.io.GraphLayoutDescriptor.NodeEntry;

/**
 * Diagnostic utility for inspecting a circuit layout.
 *
 * <p>
 * Produces human-readable dumps of a {@link GraphLayoutDescriptor} and a
 * Mermaid diagram for circuit previews. Intended for debugging and logging.
 */
public final class CircuitExplain {
    private final GraphLayoutDescriptor layout;
    private final int labelWidth;

    public CircuitExplain(GraphLayoutDescriptor layout) {
        this(layout, 0);
    }

    /**
     * @param labelWidth Preview labels are cut to this many characters; zero
     *                   keeps them whole.
     */
    public CircuitExplain(GraphLayoutDescriptor layout, int labelWidth) {
        this.layout = layout;
        this.labelWidth = labelWidth;
    }

    /**
     * Dumps a single node.
     *
     * @throws IllegalArgumentException if the layout has no such node.
     */
    public String explainNode(int id) {
        NodeEntry e = layout.find(id);
        if (e == null)
            throw new IllegalArgumentException("No node " + id + " in layout");
        StringBuilder sb = new StringBuilder(128);
        sb.append("Node: ").append(e.getLabel()).append('\n')
                .append("  Id: ").append(e.getId()).append('\n')
                .append("  Position: (").append(e.getX()).append(", ").append(e.getY()).append(")\n")
                .append("  Inputs (").append(e.getInputs().size()).append("): ");
        appendLabels(sb, e.getInputs());
        sb.append('\n').append("  Outputs (").append(e.getOutputs().size()).append("): ");
        appendLabels(sb, e.getOutputs());
        return sb.append('\n').toString();
    }

    /**
     * Dumps every node with its outgoing links.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Circuit (").append(layout.getNodes().size()).append(" nodes):\n");
        for (NodeEntry e : layout.getNodes()) {
            sb.append("  [").append(e.getId()).append("] ").append(e.getLabel())
                    .append(" @(").append(e.getX()).append(',').append(e.getY()).append(')');
            if (!e.getOutputs().isEmpty()) {
                sb.append(" -> ");
                appendLabels(sb, e.getOutputs());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a left-to-right Mermaid diagram of the circuit.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph LR;\n");
        for (NodeEntry e : layout.getNodes()) {
            sb.append("  ").append(nodeKey(e.getId())).append("[\"").append(previewLabel(e.getLabel()))
                    .append("\"];\n");
        }
        for (NodeEntry e : layout.getNodes()) {
            for (int to : e.getOutputs())
                sb.append("  ").append(nodeKey(e.getId())).append(" --> ").append(nodeKey(to)).append(";\n");
        }
        return sb.toString();
    }

    private void appendLabels(StringBuilder sb, java.util.List<Integer> ids) {
        for (int i = 0; i < ids.size(); i++) {
            NodeEntry other = layout.find(ids.get(i));
            sb.append(other != null ? other.getLabel() : String.valueOf(ids.get(i)));
            if (i < ids.size() - 1)
                sb.append(", ");
        }
    }

    private String previewLabel(String label) {
        String s = label == null ? "" : label;
        if (labelWidth > 0 && s.length() > labelWidth)
            s = s.substring(0, labelWidth);
        return s.replace("\"", "'");
    }

    private static String nodeKey(int id) {
        return id < 0 ? "n_m" + (-id) : "n_" + id;
    }
}
