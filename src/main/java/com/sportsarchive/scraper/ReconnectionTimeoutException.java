package com.sportsarchive.scraper;

/**
 * Raised when connectivity does not come back within the reconnection wait budget.
 * This is the only failure allowed to abort a season crawl outright.
 */
public class ReconnectionTimeoutException extends RuntimeException {
    public ReconnectionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
