package com.panelgate.gateway.runtime;

/**
 * Number of relay sessions currently accepted by this process.
 * <p>
 * Guarded by the instance monitor; never drops below zero.
 */
public class ConnectionCounter {

    private long active;
    private long total;

    public synchronized long increment() {
        total++;
        return ++active;
    }

    public synchronized long decrement() {
        if (active > 0) {
            active--;
        }
        return active;
    }

    public synchronized long current() {
        return active;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(active, total);
    }

    /**
     * Point-in-time view of the counter.
     */
    public record Snapshot(long active, long totalAccepted) {
    }
}
