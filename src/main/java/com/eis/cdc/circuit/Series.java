package com.eis.cdc.circuit;

import com.eis.cdc.api.Component;

import java.util.ArrayList;
import java.util.List;

/** Components connected end to end: {@code [...]}. */
public final class Series extends Connection {

    private Series(List<Component> items) {
        super(items);
    }

    /**
     * Builds a normalized series. Series items are spliced into this one so a
     * series never directly contains another series.
     */
    public static Series of(List<? extends Component> items) {
        List<Component> flat = new ArrayList<>(items.size());
        for (Component c : items) {
            if (c instanceof Series s)
                flat.addAll(s.items);
            else
                flat.add(c);
        }
        return new Series(flat);
    }

    public static Series of(Component... items) {
        return of(List.of(items));
    }

    @Override
    protected char openBracket() {
        return '[';
    }

    @Override
    protected char closeBracket() {
        return ']';
    }
}
