package com.sportsarchive.scraper;

/**
 * Lightweight connectivity check polled while waiting for the network to come back.
 */
@FunctionalInterface
public interface ReachabilityProbe {
    boolean isReachable();
}
