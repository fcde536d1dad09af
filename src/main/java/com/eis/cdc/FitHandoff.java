package com.eis.cdc;

import com.eis.cdc.element.Parameter;

import java.util.Map;

/**
 * What a fitting back end receives from the editor: the circuit as extended
 * CDC and the settings of every parameter, keyed by element display label.
 */
public record FitHandoff(String cdc, Map<String, Map<String, Parameter>> parameterSettings) {
}
