package com.sportsarchive.scraper;

/**
 * A bounded wait on the page did not reach its condition in time. Classified as a recoverable network error.
 */
public class WaitTimeoutException extends RuntimeException {
    public WaitTimeoutException(String message) {
        super(message);
    }
}
