package com.siteintel.config;

/**
 * Pause between fetch batches. Injected so tests can run without real delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleep() {
        return millis -> {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }

    static Sleeper none() {
        return millis -> {
        };
    }
}
