package com.eis.cdc.graph;

/**
 * A directed edge from the output of node {@code from} to the input of node
 * {@code to}.
 */
public record Link(int id, int from, int to) {
}
