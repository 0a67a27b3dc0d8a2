package com.regiongraph.util;

import com.regiongraph.api.InitializationListener;
import java.util.Arrays;

/**
 * Forwards driver callbacks to every registered listener, in registration
 * order.
 *
 * Registration replaces the listener array rather than growing it in place,
 * so a listener registered from inside a callback is first called on the
 * next callback, never the one in flight.
 */
public class CompositeInitializationListener implements InitializationListener {
    private InitializationListener[] listeners = new InitializationListener[0];

    public void add(InitializationListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("Listener must not be null");
        InitializationListener[] next = Arrays.copyOf(listeners, listeners.length + 1);
        next[listeners.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onPassStart(int pass) {
        for (InitializationListener l : listeners)
            l.onPassStart(pass);
    }

    @Override
    public void onPassEnd(int pass, int unresolved) {
        for (InitializationListener l : listeners)
            l.onPassEnd(pass, unresolved);
    }

    @Override
    public void onInitialized(int passes) {
        for (InitializationListener l : listeners)
            l.onInitialized(passes);
    }

    @Override
    public void onFailure(int pass, Throwable error) {
        for (InitializationListener l : listeners)
            l.onFailure(pass, error);
    }
}
