package com.regiongraph.util;

import com.regiongraph.api.InitializationListener;

/**
 * A listener that logs dimension negotiation progress and keeps simple
 * counters about the last initialization attempt.
 */
public final class LoggingInitializationListener implements InitializationListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(LoggingInitializationListener.class);

    private long startNanos;
    private long lastDurationNanos;
    private int passes;
    private int lastUnresolved;
    private boolean lastSucceeded;

    @Override
    public void onPassStart(int pass) {
        if (pass == 1)
            startNanos = System.nanoTime();
        passes = pass;
    }

    @Override
    public void onPassEnd(int pass, int unresolved) {
        lastUnresolved = unresolved;
        log.debug("Pass {} left {} links unresolved", pass, unresolved);
    }

    @Override
    public void onInitialized(int totalPasses) {
        lastDurationNanos = System.nanoTime() - startNanos;
        lastSucceeded = true;
        log.info(String.format("Network initialized: %d passes in %.1f us", totalPasses, lastDurationNanos / 1000.0));
    }

    @Override
    public void onFailure(int pass, Throwable error) {
        lastDurationNanos = System.nanoTime() - startNanos;
        lastSucceeded = false;
        log.error("Network initialization failed at pass {}: {}", pass, error.getMessage());
    }

    public int passes() {
        return passes;
    }

    public int lastUnresolved() {
        return lastUnresolved;
    }

    public boolean lastSucceeded() {
        return lastSucceeded;
    }

    public long lastDurationNanos() {
        return lastDurationNanos;
    }
}
