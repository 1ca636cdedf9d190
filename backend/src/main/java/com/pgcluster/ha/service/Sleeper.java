package com.pgcluster.ha.service;

/**
 * Pause between polls. Injected so polling loops can be driven without real delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
