package com.eis.cdc.element;

import lombok.Data;

/**
 * Fitting settings of one element parameter.
 *
 * <p>
 * An infinite lower (upper) limit means the limit is disabled.
 */
@Data
public final class Parameter {
    private final String name;
    private double value;
    private double lower;
    private double upper;
    private boolean fixed;

    Parameter(ElementType.ParameterDefault def) {
        this(def.name(), def.value(), def.lower(), def.upper(), false);
    }

    public Parameter(String name, double value, double lower, double upper, boolean fixed) {
        this.name = name;
        this.value = value;
        this.lower = lower;
        this.upper = upper;
        this.fixed = fixed;
    }

    public boolean hasLowerLimit() {
        return lower != Double.NEGATIVE_INFINITY;
    }

    public boolean hasUpperLimit() {
        return upper != Double.POSITIVE_INFINITY;
    }

    public Parameter copy() {
        return new Parameter(name, value, lower, upper, fixed);
    }
}
