package com.sportsarchive.scraper;

/**
 * Interface for the page automation session the crawl drives. One session is used serially for a whole tournament.
 * Implementations must surface timeouts as exceptions recognised by {@link NetworkErrors#isRecoverable(Throwable)}.
 */
public interface BrowserSessionInterface extends AutoCloseable {
    /**
     * Navigates to a URL and waits for the network to settle.
     * @param url Absolute page URL
     * @param timeoutMs Navigation timeout
     */
    void navigate(String url, int timeoutMs);

    /**
     * Waits until at least one element matches the selector.
     * @param selector CSS selector
     * @param timeoutMs Wait timeout
     */
    void waitForSelector(String selector, int timeoutMs);

    /**
     * Waits until an in-page predicate returns a truthy value.
     * @param script Single-argument function, see {@link PageScripts}
     * @param arg Argument passed to the function
     * @param timeoutMs Wait timeout
     */
    void waitForFunction(String script, Object arg, int timeoutMs);

    /**
     * Runs an in-page function against the loaded document.
     * @param script Single-argument function, see {@link PageScripts}
     * @param arg Argument passed to the function
     * @return Result converted to Java values (maps, lists, numbers, strings, booleans or null)
     */
    Object evaluate(String script, Object arg);

    void click(String selector);

    void selectOption(String selector, String value);

    /**
     * @return URL of the currently loaded page
     */
    String url();

    @Override
    void close();
}
