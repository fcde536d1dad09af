package com.eis.cdc.engine;

import com.eis.cdc.api.Component;
import com.eis.cdc.circuit.Circuit;
import com.eis.cdc.circuit.Parallel;
import com.eis.cdc.circuit.Series;
import com.eis.cdc.element.Element;
import com.eis.cdc.graph.CircuitGraph;
import com.eis.cdc.graph.GraphNode;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a circuit graph, node positions included, from a parsed circuit.
 *
 * <p>
 * Series items are chained left to right; parallel branches are stacked top
 * to bottom. Each recursive step receives the open tails of what was built
 * before it (the nodes whose outputs the step must link from) and returns its
 * own tails together with the grid area it occupies.
 *
 * <p>
 * A junction is only added where a parallel group cannot fan out from its
 * predecessor directly: after another parallel group (several tails to merge
 * first) and at the head of a branch of an enclosing group (the predecessor
 * already fans out to the sibling branches). Elements and the sink merge any
 * number of tails by themselves.
 */
@Log4j2
public final class CircuitDecoder {

    /** Grid area of a decoded sub-circuit, in columns and rows. */
    public record Extent(int width, int height) {
        static final Extent EMPTY = new Extent(0, 1);
        static final Extent UNIT = new Extent(1, 1);
    }

    /** Result of decoding one component. */
    private record Placed(List<GraphNode> tails, Extent extent) {
    }

    /**
     * Clears the graph and rebuilds it from the circuit. The circuit's elements
     * are copied, so the circuit itself is never attached to the graph.
     *
     * @return The extent of the circuit between the two terminals.
     */
    public Extent decode(Circuit circuit, CircuitGraph graph) {
        graph.clear();
        graph.moveNode(CircuitGraph.SOURCE_ID, 0, 0);
        if (circuit.isEmpty()) {
            graph.moveNode(CircuitGraph.SINK_ID, 1, 0);
            log.debug("Decoded empty circuit");
            return Extent.EMPTY;
        }
        List<GraphNode> start = List.of(graph.source());
        Placed placed = decodeSeries(graph, circuit.getRoot(), start, 1, 0, true);
        GraphNode sink = graph.sink();
        graph.moveNode(sink.id(), placed.extent().width() + 1, 0);
        for (GraphNode tail : placed.tails())
            graph.connect(tail, sink);
        log.debug("Decoded {} into {} nodes and {} links", circuit, graph.nodes().size(), graph.linkCount());
        return placed.extent();
    }

    /**
     * @param exclusive Whether the tails link to nothing but what this series
     *                  builds. False for the series of a parallel branch.
     */
    private Placed decodeSeries(CircuitGraph graph, Series series, List<GraphNode> tails, int x, int y,
            boolean exclusive) {
        List<GraphNode> current = tails;
        int width = 0;
        int height = 1;
        boolean first = true;
        for (Component item : series.getItems()) {
            Placed placed = decodeItem(graph, item, current, x + width, y, first ? exclusive : true);
            current = placed.tails();
            width += placed.extent().width();
            height = Math.max(height, placed.extent().height());
            first = false;
        }
        return new Placed(current, new Extent(width, height));
    }

    private Placed decodeParallel(CircuitGraph graph, Parallel parallel, List<GraphNode> tails, int x, int y,
            boolean exclusive) {
        GraphNode fork;
        int junctionWidth = 0;
        if (tails.size() > 1 || !exclusive) {
            fork = graph.addJunctionNode(x, y);
            for (GraphNode tail : tails)
                graph.connect(tail, fork);
            junctionWidth = 1;
        } else {
            fork = tails.get(0);
        }

        List<GraphNode> branchTails = new ArrayList<>();
        List<GraphNode> forkOnly = List.of(fork);
        int width = 0;
        int height = 0;
        for (Component branch : parallel.getItems()) {
            Placed placed = decodeItem(graph, branch, forkOnly, x + junctionWidth, y + height, false);
            branchTails.addAll(placed.tails());
            width = Math.max(width, placed.extent().width());
            height += placed.extent().height();
        }
        return new Placed(branchTails, new Extent(junctionWidth + width, height));
    }

    private Placed decodeItem(CircuitGraph graph, Component item, List<GraphNode> tails, int x, int y,
            boolean exclusive) {
        if (item instanceof Element e) {
            GraphNode node = graph.addElementNode(e.copy(), x, y);
            for (GraphNode tail : tails)
                graph.connect(tail, node);
            return new Placed(List.of(node), Extent.UNIT);
        } else if (item instanceof Series s) {
            return decodeSeries(graph, s, tails, x, y, exclusive);
        } else if (item instanceof Parallel p) {
            return decodeParallel(graph, p, tails, x, y, exclusive);
        }
        throw new IllegalArgumentException("Unsupported component: " + item.getClass().getName());
    }
}
