package com.eis.cdc.engine;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Thrown by {@link CircuitEncoder} on the first structural violation found.
 * Carries the offending node ids and the tokens emitted so far.
 */
public class CircuitValidationException extends RuntimeException {
    private final Violation violation;
    private final Set<Integer> offendingNodes;
    private final List<String> partialTokens;

    public CircuitValidationException(Violation violation, String message, Set<Integer> offendingNodes,
            List<String> partialTokens) {
        super(message);
        this.violation = violation;
        this.offendingNodes = Collections.unmodifiableSet(offendingNodes);
        this.partialTokens = Collections.unmodifiableList(partialTokens);
    }

    public Violation getViolation() {
        return violation;
    }

    public Set<Integer> getOffendingNodes() {
        return offendingNodes;
    }

    public List<String> getPartialTokens() {
        return partialTokens;
    }
}
