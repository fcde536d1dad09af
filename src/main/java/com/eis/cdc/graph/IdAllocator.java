package com.eis.cdc.graph;

/**
 * Hands out node ids for one circuit graph.
 *
 * <p>
 * Element ids count up from 0, junction ids count down from -2. Both ranges
 * stop short of the terminal sentinels, so an id never collides with a
 * terminal or with an id of the other range.
 */
final class IdAllocator {
    static final int SOURCE_ID = -999_999;
    static final int SINK_ID = 999_999;

    private int elementCounter = -1;
    private int junctionCounter = -1;

    int nextElement() {
        if (elementCounter + 1 >= SINK_ID)
            throw new IllegalStateException("Element ids exhausted");
        return ++elementCounter;
    }

    int nextJunction() {
        if (junctionCounter - 1 <= SOURCE_ID)
            throw new IllegalStateException("Junction ids exhausted");
        return --junctionCounter;
    }

    void reset() {
        elementCounter = -1;
        junctionCounter = -1;
    }
}
