package com.eis.cdc.circuit;

import com.eis.cdc.api.Component;

import java.util.ArrayList;
import java.util.List;

/** Components sharing both end points: {@code (...)}. */
public final class Parallel extends Connection {

    private Parallel(List<Component> items) {
        super(items);
    }

    /**
     * Builds a normalized parallel connection. Single-item series collapse to
     * their item and nested parallels are spliced in, so every branch is an
     * element or a series of at least two items.
     *
     * @throws IllegalArgumentException if fewer than two branches remain.
     */
    public static Parallel of(List<? extends Component> items) {
        List<Component> flat = new ArrayList<>(items.size());
        for (Component c : items) {
            Component branch = c;
            if (branch instanceof Series s && s.size() == 1)
                branch = s.getItems().get(0);
            if (branch instanceof Series s && s.isEmpty())
                throw new IllegalArgumentException("Parallel branch may not be empty");
            if (branch instanceof Parallel p)
                flat.addAll(p.items);
            else
                flat.add(branch);
        }
        if (flat.size() < 2)
            throw new IllegalArgumentException("Parallel connection requires at least two branches");
        return new Parallel(flat);
    }

    public static Parallel of(Component... items) {
        return of(List.of(items));
    }

    @Override
    protected char openBracket() {
        return '(';
    }

    @Override
    protected char closeBracket() {
        return ')';
    }
}
