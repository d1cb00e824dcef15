package com.sportsarchive.scraper;

/**
 * Blocking wait used for backoff, reconnection polling, stabilization polling and politeness delays.
 * Injected everywhere so tests can run the pipeline without real waiting.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
