package com.eis.cdc.element;

import com.eis.cdc.api.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A leaf circuit element (resistor, capacitor, Warburg, ...).
 *
 * <p>
 * The graph algorithms treat an element as an opaque payload. Its state is the
 * per-parameter fitting settings, an optional user label and the identifier
 * assigned when the element is placed in a circuit graph.
 */
public final class Element implements Component {
    private static final String LABEL_FORBIDDEN = "{}[](),:=/";

    private final ElementType type;
    private final Map<String, Parameter> parameters = new LinkedHashMap<>();
    private String label = "";
    private int identifier = -1;

    Element(ElementType type) {
        this.type = type;
        for (ElementType.ParameterDefault def : type.getDefaults())
            parameters.put(def.name(), new Parameter(def));
    }

    public ElementType getType() {
        return type;
    }

    public String getSymbol() {
        return type.getSymbol();
    }

    /** Parameters in declaration order. The map itself is read-only. */
    public Map<String, Parameter> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public Parameter getParameter(String key) {
        Parameter p = parameters.get(key);
        if (p == null)
            throw new IllegalArgumentException("Element " + type.getSymbol() + " has no parameter '" + key + "'");
        return p;
    }

    /**
     * Sets a parameter value. Enabled limits that would exclude the new value
     * are moved onto it.
     */
    public void setValue(String key, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            throw new IllegalArgumentException("Parameter value must be finite: " + value);
        Parameter p = getParameter(key);
        if (p.hasLowerLimit() && p.getLower() > value)
            p.setLower(value);
        if (p.hasUpperLimit() && p.getUpper() < value)
            p.setUpper(value);
        p.setValue(value);
    }

    /** Sets the lower limit, clamped to the current value. -inf disables it. */
    public void setLowerLimit(String key, double lower) {
        Parameter p = getParameter(key);
        p.setLower(Math.min(lower, p.getValue()));
    }

    /** Sets the upper limit, clamped to the current value. +inf disables it. */
    public void setUpperLimit(String key, double upper) {
        Parameter p = getParameter(key);
        p.setUpper(Math.max(upper, p.getValue()));
    }

    /** Fixing a parameter disables both of its limits. */
    public void setFixed(String key, boolean fixed) {
        Parameter p = getParameter(key);
        p.setFixed(fixed);
        if (fixed) {
            p.setLower(Double.NEGATIVE_INFINITY);
            p.setUpper(Double.POSITIVE_INFINITY);
        }
    }

    /** Restores the default value and limits and clears the fixed flag. */
    public void resetParameter(String key) {
        ElementType.ParameterDefault def = type.getDefault(key);
        parameters.put(key, new Parameter(def));
    }

    /**
     * Overwrites all settings of a parameter at once. Used by the parser, which
     * has already validated the limits.
     */
    public void applySettings(String key, double value, double lower, double upper, boolean fixed) {
        Parameter p = getParameter(key);
        p.setValue(value);
        p.setLower(lower);
        p.setUpper(upper);
        p.setFixed(fixed);
    }

    public String getLabel() {
        return label;
    }

    /**
     * Sets the user label. Blank labels, purely numeric labels and the default
     * label clear it.
     */
    public void setLabel(String label) {
        String trimmed = label == null ? "" : label.trim();
        for (int i = 0; i < trimmed.length(); i++) {
            if (LABEL_FORBIDDEN.indexOf(trimmed.charAt(i)) >= 0)
                throw new IllegalArgumentException("Label may not contain '" + trimmed.charAt(i) + "': " + trimmed);
        }
        if (isInteger(trimmed) || trimmed.equals(getDefaultLabel()))
            trimmed = "";
        this.label = trimmed;
    }

    public int getIdentifier() {
        return identifier;
    }

    public void assignIdentifier(int identifier) {
        this.identifier = identifier;
    }

    /** Label shown when the user has not set one, e.g. {@code R_3}. */
    public String getDefaultLabel() {
        return identifier >= 0 ? type.getSymbol() + "_" + identifier : type.getSymbol();
    }

    /** {@code symbol_label} when labelled, otherwise the default label. */
    public String getDisplayLabel() {
        return label.isEmpty() ? getDefaultLabel() : type.getSymbol() + "_" + label;
    }

    /** Deep copy; the identifier is not carried over. */
    public Element copy() {
        Element e = new Element(type);
        for (Parameter p : parameters.values())
            e.parameters.put(p.getName(), p.copy());
        e.label = label;
        return e;
    }

    @Override
    public void appendCdc(StringBuilder sb, int decimals) {
        sb.append(type.getSymbol());
        if (decimals < 0)
            return;
        sb.append('{');
        boolean first = true;
        for (Parameter p : parameters.values()) {
            if (!first)
                sb.append(',');
            first = false;
            sb.append(p.getName()).append('=').append(formatNumber(p.getValue(), decimals));
            if (p.isFixed())
                sb.append('f');
            ElementType.ParameterDefault def = type.getDefault(p.getName());
            if (p.getLower() != def.lower() || p.getUpper() != def.upper()) {
                sb.append('/').append(formatNumber(p.getLower(), decimals))
                        .append('/').append(formatNumber(p.getUpper(), decimals));
            }
        }
        if (!label.isEmpty())
            sb.append(':').append(label);
        sb.append('}');
    }

    @Override
    public String toString() {
        return toCdc(-1);
    }

    /** Scientific notation with a fixed number of decimals; infinities as "inf". */
    public static String formatNumber(double value, int decimals) {
        if (value == Double.POSITIVE_INFINITY)
            return "inf";
        if (value == Double.NEGATIVE_INFINITY)
            return "-inf";
        return String.format(Locale.ROOT, "%." + decimals + "E", value);
    }

    private static boolean isInteger(String s) {
        if (s.isEmpty())
            return false;
        try {
            Long.parseLong(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
