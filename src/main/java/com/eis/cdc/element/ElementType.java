package com.eis.cdc.element;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog of the circuit elements a CDC may reference.
 *
 * <p>
 * Each constant owns its mnemonic (the token used in CDC text), a description
 * and the ordered list of parameters with their default value and limits.
 */
public enum ElementType {
    RESISTOR("R", "Resistor",
            param("R", 1e3, 0.0, Double.POSITIVE_INFINITY)),
    CAPACITOR("C", "Capacitor",
            param("C", 1e-6, 1e-24, 1e3)),
    INDUCTOR("L", "Inductor",
            param("L", 1e-6, 0.0, 1e3)),
    WARBURG("W", "Warburg, semi-infinite diffusion",
            param("Y", 1.0, 0.0, Double.POSITIVE_INFINITY)),
    WARBURG_OPEN("Wo", "Warburg, finite space",
            param("Y", 1.0, 0.0, Double.POSITIVE_INFINITY),
            param("B", 1.0, 0.0, Double.POSITIVE_INFINITY)),
    WARBURG_SHORT("Ws", "Warburg, finite length",
            param("Y", 1.0, 0.0, Double.POSITIVE_INFINITY),
            param("B", 1.0, 0.0, Double.POSITIVE_INFINITY)),
    CONSTANT_PHASE("Q", "Constant phase element",
            param("Y", 1e-6, 1e-24, 1e3),
            param("n", 0.95, 0.0, 1.0)),
    MODIFIED_INDUCTOR("La", "Modified inductor",
            param("L", 1e-6, 0.0, 1e3),
            param("n", 0.95, 0.0, 1.0)),
    VOIGT("K", "Voigt element, time constant form",
            param("R", 1.0, 0.0, Double.POSITIVE_INFINITY),
            param("tau", 1.0, 1e-24, Double.POSITIVE_INFINITY)),
    GERISCHER("G", "Gerischer",
            param("Y", 1.0, 0.0, Double.POSITIVE_INFINITY),
            param("k", 1.0, 0.0, Double.POSITIVE_INFINITY),
            param("n", 0.5, 0.0, 1.0)),
    HAVRILIAK_NEGAMI("H", "Havriliak-Negami relaxation",
            param("dC", 1e-6, 0.0, Double.POSITIVE_INFINITY),
            param("tau", 1.0, 0.0, Double.POSITIVE_INFINITY),
            param("a", 0.9, 0.0, 1.0),
            param("b", 0.9, 0.0, 1.0));

    private static final Map<String, ElementType> BY_SYMBOL = new HashMap<>();

    static {
        for (ElementType type : values())
            BY_SYMBOL.put(type.symbol, type);
    }

    private final String symbol;
    private final String description;
    private final List<ParameterDefault> defaults;

    ElementType(String symbol, String description, ParameterDefault... defaults) {
        this.symbol = symbol;
        this.description = description;
        this.defaults = List.of(defaults);
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDescription() {
        return description;
    }

    /** Parameter defaults in declaration (and CDC serialization) order. */
    public List<ParameterDefault> getDefaults() {
        return defaults;
    }

    public ParameterDefault getDefault(String key) {
        for (ParameterDefault d : defaults)
            if (d.name().equals(key))
                return d;
        throw new IllegalArgumentException("Element " + symbol + " has no parameter '" + key + "'");
    }

    public boolean hasParameter(String key) {
        for (ParameterDefault d : defaults)
            if (d.name().equals(key))
                return true;
        return false;
    }

    /** Creates a fresh element of this type with default parameters. */
    public Element create() {
        return new Element(this);
    }

    /**
     * Looks up a type by its CDC mnemonic.
     *
     * @return the matching type, or null if the mnemonic is unknown.
     */
    public static ElementType fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }

    /** Like {@link #fromSymbol(String)} but fails for unknown mnemonics. */
    public static ElementType requireSymbol(String symbol) {
        ElementType type = BY_SYMBOL.get(symbol);
        if (type == null)
            throw new IllegalArgumentException("Unknown element: " + symbol);
        return type;
    }

    private static ParameterDefault param(String name, double value, double lower, double upper) {
        return new ParameterDefault(name, value, lower, upper);
    }

    /** Default value and limits of a single parameter. */
    public record ParameterDefault(String name, double value, double lower, double upper) {
    }
}
