package com.eis.cdc.api;

/**
 * A piece of a parsed circuit: either a leaf element or a series/parallel
 * connection of further components.
 *
 * <p>
 * Components serialize themselves to circuit description code (CDC). A
 * negative {@code decimals} selects the basic form (mnemonics and brackets
 * only); zero or more selects the extended form where every element carries
 * its parameter block, values written with that many decimals in scientific
 * notation.
 */
public interface Component {

    /**
     * Appends the CDC of this component.
     *
     * @param sb       Target buffer.
     * @param decimals Negative for the basic form, otherwise the number of
     *                 decimals of each parameter value.
     */
    void appendCdc(StringBuilder sb, int decimals);

    /** Returns the CDC of this component in the requested form. */
    default String toCdc(int decimals) {
        StringBuilder sb = new StringBuilder(32);
        appendCdc(sb, decimals);
        return sb.toString();
    }
}
