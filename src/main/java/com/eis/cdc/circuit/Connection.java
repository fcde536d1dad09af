package com.eis.cdc.circuit;

import com.eis.cdc.api.Component;
import com.eis.cdc.element.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A series or parallel grouping of components.
 *
 * <p>
 * Connections only exist in parsed circuit trees; the circuit graph has no
 * counterpart for them.
 */
public abstract class Connection implements Component {
    protected final List<Component> items;

    protected Connection(List<Component> items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public List<Component> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    protected abstract char openBracket();

    protected abstract char closeBracket();

    /** Collects the elements of this subtree in CDC order. */
    public void collectElements(List<Element> out) {
        for (Component c : items) {
            if (c instanceof Element e)
                out.add(e);
            else
                ((Connection) c).collectElements(out);
        }
    }

    @Override
    public void appendCdc(StringBuilder sb, int decimals) {
        sb.append(openBracket());
        for (Component c : items)
            c.appendCdc(sb, decimals);
        sb.append(closeBracket());
    }

    @Override
    public String toString() {
        return toCdc(-1);
    }
}
