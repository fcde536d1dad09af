package com.eis.cdc;

import com.eis.cdc.circuit.Circuit;
import com.eis.cdc.io.CdcParser;
import com.eis.cdc.io.EditorSettings;

/**
 * Circuit description code (CDC) toolkit for impedance spectroscopy.
 *
 * <p>
 * An equivalent circuit is edited as a graph of elements between the working
 * electrode (source) and the counter and reference electrodes (sink), and
 * exchanged as nested-bracket text:
 * <ul>
 * <li>{@code [R([RW]C)]} is a resistor in series with a parallel connection of
 * a capacitor and a resistor-Warburg series (the Randles circuit).</li>
 * <li>{@code [...]} is a series connection, {@code (...)} a parallel one.</li>
 * <li>Elements may carry parameter blocks, e.g.
 * {@code R{R=1.0E+02f/0/inf:bulk}}.</li>
 * </ul>
 *
 * <p>
 * The {@link CircuitEditor} keeps graph and text in step: edits to the graph
 * are written back as CDC, and parsed CDC regenerates the graph.
 */
public final class Cdc {

    private Cdc() {
        // Prevent instantiation of utility class
    }

    /**
     * Parses CDC text into a normalized circuit tree.
     *
     * @throws com.eis.cdc.io.CdcParseException if the text is malformed.
     */
    public static Circuit parse(String cdc) {
        return CdcParser.parse(cdc);
    }

    /** Creates an editor with the settings found on the classpath. */
    public static CircuitEditor editor() {
        return new CircuitEditor(EditorSettings.loadDefault());
    }

    public static CircuitEditor editor(EditorSettings settings) {
        return new CircuitEditor(settings);
    }
}
