package com.eis.cdc.engine;

import com.eis.cdc.circuit.Circuit;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of validating a circuit graph.
 *
 * @param valid        Whether the graph encodes to a parseable circuit.
 * @param message      {@code "OK"} or the first problem found.
 * @param violation    The structural violation, null when valid or when only
 *                     the re-parse failed.
 * @param circuit      The parsed circuit, null when invalid.
 * @param tokens       Tokens emitted by the encoder, possibly partial.
 * @param basicCdc     CDC without parameter blocks.
 * @param extendedCdc  CDC with parameter blocks.
 * @param nodeValidity Per node id (terminals included), false for offending
 *                     nodes.
 */
public record CircuitStatus(boolean valid, String message, Violation violation, Circuit circuit,
        List<String> tokens, String basicCdc, String extendedCdc, Map<Integer, Boolean> nodeValidity) {

    public static final String OK = "OK";

    public Optional<Circuit> optionalCircuit() {
        return Optional.ofNullable(circuit);
    }

    public boolean isNodeValid(int nodeId) {
        return nodeValidity.getOrDefault(nodeId, Boolean.TRUE);
    }
}
