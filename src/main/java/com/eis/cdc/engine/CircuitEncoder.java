package com.eis.cdc.engine;

import com.eis.cdc.api.NodeKind;
import com.eis.cdc.graph.CircuitGraph;
import com.eis.cdc.graph.GraphNode;
import com.eis.cdc.io.EditorSettings;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes a circuit graph as CDC tokens.
 *
 * <p>
 * <b>Algorithm:</b> depth-first walk from the source. A node with several
 * outputs opens a parallel group and walks each branch in link order, wrapping
 * a branch in a series when it emits more than one token. A node with several
 * inputs closes a group, but only once every one of its predecessors has been
 * visited; until then it is parked in the pending set and resumed by the node
 * that opened the enclosing group, after all of that node's branches are done.
 *
 * <p>
 * Element tokens are written in the extended form so that the fitting settings
 * of each element survive a re-parse.
 *
 * <p>
 * Stateless between calls; one instance may encode any number of graphs.
 */
@Log4j2
public final class CircuitEncoder {
    private final EditorSettings settings;

    public CircuitEncoder() {
        this(new EditorSettings());
    }

    public CircuitEncoder(EditorSettings settings) {
        this.settings = settings;
    }

    /**
     * Tokens emitted for a graph.
     *
     * @param tokens     To be joined without separators.
     * @param elementIds Ids of the element nodes in the order their tokens
     *                   were emitted.
     */
    public record Encoding(List<String> tokens, List<Integer> elementIds) {
        public String text() {
            return join(tokens);
        }
    }

    /**
     * Encodes the graph.
     *
     * @throws CircuitValidationException on the first structural violation.
     */
    public Encoding encode(CircuitGraph graph) {
        Walk walk = new Walk(graph);
        walk.start();
        log.debug("Encoded graph revision {} into {} tokens", graph.revision(), walk.tokens.size());
        return new Encoding(Collections.unmodifiableList(walk.tokens),
                Collections.unmodifiableList(walk.elementIds));
    }

    /** Joins tokens into one CDC string. */
    public static String join(List<String> tokens) {
        StringBuilder sb = new StringBuilder(tokens.size() * 8);
        for (String t : tokens)
            sb.append(t);
        return sb.toString();
    }

    /** State of one encoding pass. */
    private final class Walk {
        private final CircuitGraph graph;
        private final List<String> tokens = new ArrayList<>();
        private final List<Integer> elementIds = new ArrayList<>();
        private final Set<Integer> visited = new HashSet<>();
        private final Set<Integer> pending = new LinkedHashSet<>();

        Walk(CircuitGraph graph) {
            this.graph = graph;
        }

        void start() {
            GraphNode source = graph.source();
            GraphNode sink = graph.sink();
            if (source.outputCount() == 0)
                throw violation(Violation.DISCONNECTED_NODE,
                        settings.getSourceLabel() + " is not connected to anything!", source.id());
            if (source.outputLinks().containsKey(sink.id()))
                throw violation(Violation.SHORT_CIRCUIT,
                        settings.getSourceLabel() + " is shorted to " + settings.getSinkLabel() + "!",
                        source.id(), sink.id());

            tokens.add("[");
            if (source.outputCount() > 1) {
                tokens.add("(");
                walk(walkBranches(source));
            } else {
                walk(firstOutput(source));
            }
            checkCompletion();
        }

        /** Walks a series run iteratively, so its length does not grow the stack. */
        private void walk(GraphNode start) {
            GraphNode node = start;
            while (node != null)
                node = step(node);
        }

        /**
         * Emits one node.
         *
         * @return The node the series continues with, or null where it ends.
         */
        private GraphNode step(GraphNode node) {
            if (visited.contains(node.id()))
                return null;
            if (node.inputCount() > 1) {
                // A merge waits until every branch feeding it has been emitted
                if (!visited.containsAll(node.inputLinks().keySet())) {
                    pending.add(node.id());
                    return null;
                }
                if (pending.contains(node.id()))
                    return null;
                if (node.kind() == NodeKind.SINK && last().equals("("))
                    tokens.remove(tokens.size() - 1);
                else if (!last().equals(")"))
                    tokens.add(")");
            }
            visited.add(node.id());

            switch (node.kind()) {
                case SINK -> {
                    tokens.add("]");
                    return null;
                }
                case ELEMENT -> {
                    if (node.outputCount() == 0)
                        throw violation(Violation.DISCONNECTED_NODE,
                                node.element().getDisplayLabel() + " is missing a connection!", node.id());
                    tokens.add(node.element().toCdc(settings.getTokenDecimals()));
                    elementIds.add(node.id());
                }
                case JUNCTION -> {
                    if (!isValidJunction(node))
                        throw violation(Violation.INSUFFICIENT_JUNCTION_FAN_IN_OUT,
                                settings.getJunctionLabel() + " nodes must connect to at least one element on one side"
                                        + " and at least two elements on the other side!",
                                node.id());
                }
                default -> throw new IllegalStateException("Source reached twice");
            }

            if (node.outputCount() > 1) {
                tokens.add("(");
                return walkBranches(node);
            }
            return firstOutput(node);
        }

        /**
         * Emits one branch per output of a fork, then resumes the merges that
         * became pending while walking them. The last of those is returned
         * rather than walked, for the caller to continue its series with.
         */
        private GraphNode walkBranches(GraphNode fork) {
            Set<Integer> parkedBefore = new HashSet<>(pending);
            for (int next : fork.outputLinks().keySet()) {
                tokens.add("[");
                int mark = tokens.size();
                walk(graph.node(next));
                int added = tokens.size() - mark;
                if (added > 1) {
                    tokens.add("]");
                } else if (added == 1) {
                    tokens.remove(mark - 1);
                } else {
                    tokens.remove(mark - 1);
                    throw violation(Violation.SHORT_CIRCUIT,
                            "A parallel connection from " + describe(fork) + " is shorted!", fork.id(), next);
                }
            }
            // Source-opened groups are closed by the merge node instead
            if (fork.kind() != NodeKind.SOURCE)
                tokens.add(")");
            List<Integer> resumed = new ArrayList<>();
            for (int id : pending) {
                if (!parkedBefore.contains(id))
                    resumed.add(id);
            }
            for (int i = 0; i < resumed.size(); i++) {
                int id = resumed.get(i);
                pending.remove(id);
                if (i == resumed.size() - 1)
                    return graph.node(id);
                walk(graph.node(id));
            }
            return null;
        }

        private GraphNode firstOutput(GraphNode node) {
            for (int next : node.outputLinks().keySet())
                return graph.node(next);
            return null;
        }

        private void checkCompletion() {
            for (GraphNode n : graph.elementNodes()) {
                String label = n.element().getDisplayLabel();
                if (n.inputCount() == 0)
                    throw violation(Violation.DISCONNECTED_NODE,
                            label + " has insufficient input connections!", n.id());
                if (n.outputCount() == 0)
                    throw violation(Violation.DISCONNECTED_NODE,
                            label + " has insufficient output connections!", n.id());
            }
            for (GraphNode n : graph.junctionNodes()) {
                if (!isValidJunction(n))
                    throw violation(Violation.INSUFFICIENT_JUNCTION_FAN_IN_OUT,
                            "A " + settings.getJunctionLabel().toLowerCase() + " node has insufficient connections!",
                            n.id());
            }
            if (!pending.isEmpty())
                throw violation(Violation.UNRESOLVED_MERGE, "The queue for nodes to visit is not empty!",
                        pending.toArray(new Integer[0]));
            Set<Integer> missing = new LinkedHashSet<>();
            for (GraphNode n : graph.nodes()) {
                if (!visited.contains(n.id()))
                    missing.add(n.id());
            }
            if (!visited.contains(CircuitGraph.SINK_ID))
                missing.add(CircuitGraph.SINK_ID);
            if (!missing.isEmpty())
                throw violation(Violation.DISCONNECTED_NODE, "Disconnected node(s) detected!",
                        missing.toArray(new Integer[0]));
        }

        private boolean isValidJunction(GraphNode n) {
            int in = n.inputCount();
            int out = n.outputCount();
            return (in > 0 && out > 1) || (in > 1 && out > 0);
        }

        private String describe(GraphNode n) {
            return switch (n.kind()) {
                case SOURCE -> settings.getSourceLabel();
                case SINK -> settings.getSinkLabel();
                case JUNCTION -> settings.getJunctionLabel().toLowerCase() + " node " + n.id();
                case ELEMENT -> n.element().getDisplayLabel();
            };
        }

        private String last() {
            return tokens.isEmpty() ? "" : tokens.get(tokens.size() - 1);
        }

        private CircuitValidationException violation(Violation v, String message, Integer... nodeIds) {
            Set<Integer> ids = new LinkedHashSet<>(List.of(nodeIds));
            log.debug("{}: {} (nodes {})", v, message, ids);
            return new CircuitValidationException(v, message, ids, new ArrayList<>(tokens));
        }
    }
}
