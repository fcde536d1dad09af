package com.eis.cdc.util;

import com.eis.cdc.api.GraphListener;
import java.util.Arrays;

/**
 * Fans graph mutation events out to several {@link GraphListener} instances,
 * in registration order.
 */
public class CompositeGraphListener implements GraphListener {
    private GraphListener[] listeners = new GraphListener[0];

    public void addForComposite(GraphListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener must not be null");
        GraphListener[] old = listeners;
        GraphListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public boolean removeFromComposite(GraphListener listener) {
        GraphListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                GraphListener[] next = new GraphListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onGraphChanged(long revision, Mutation mutation, int nodeId) {
        for (GraphListener l : listeners)
            l.onGraphChanged(revision, mutation, nodeId);
    }
}
