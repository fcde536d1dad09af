package com.eis.cdc.circuit;

import com.eis.cdc.element.Element;
import com.eis.cdc.element.Parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed equivalent circuit.
 *
 * <p>
 * The root is always a series, so the canonical CDC always starts with
 * {@code [} and ends with {@code ]}. The tree is normalized on construction
 * (see {@link Series#of} and {@link Parallel#of}), which makes
 * {@link #toString()} the canonical basic form and {@link #toString(int)} the
 * canonical extended form.
 */
public final class Circuit {
    private final Series root;

    public Circuit(Series root) {
        this.root = root;
    }

    public Series getRoot() {
        return root;
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    /** Elements in CDC order. */
    public List<Element> getElements() {
        List<Element> out = new ArrayList<>();
        root.collectElements(out);
        return Collections.unmodifiableList(out);
    }

    /**
     * Per-parameter fitting settings keyed by element display label, then by
     * parameter name. This is everything a fitting back end receives besides
     * the CDC itself. The returned parameters are copies.
     */
    public Map<String, Map<String, Parameter>> parameterSettings() {
        Map<String, Map<String, Parameter>> out = new LinkedHashMap<>();
        int position = 0;
        for (Element e : getElements()) {
            String key = e.getDisplayLabel();
            if (out.containsKey(key))
                key = key + "#" + position;
            Map<String, Parameter> params = new LinkedHashMap<>();
            for (Parameter p : e.getParameters().values())
                params.put(p.getName(), p.copy());
            out.put(key, Collections.unmodifiableMap(params));
            position++;
        }
        return Collections.unmodifiableMap(out);
    }

    /** Basic CDC: mnemonics and brackets only. */
    @Override
    public String toString() {
        return root.toCdc(-1);
    }

    /** Extended CDC with parameter blocks, values written with {@code decimals} decimals. */
    public String toString(int decimals) {
        if (decimals < 0)
            throw new IllegalArgumentException("decimals must be >= 0: " + decimals);
        return root.toCdc(decimals);
    }
}
