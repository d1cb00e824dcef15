package com.sportsarchive.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Playwright-backed {@link BrowserSessionInterface}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Launches Chromium with sandboxing disabled (container friendly).</li>
 *   <li>Creates a context with a desktop Chrome user agent and browser-like request headers.</li>
 *   <li>Opens a single page that every call of the session operates on.</li>
 * </ul>
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public final class PlaywrightBrowserSession implements BrowserSessionInterface {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
        + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private static final List<String> LAUNCH_ARGS = List.of(
        "--no-sandbox",
        "--disable-setuid-sandbox",
        "--disable-dev-shm-usage",
        "--disable-blink-features=AutomationControlled"
    );

    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    private PlaywrightBrowserSession(Browser browser, BrowserContext context, Page page) {
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    /**
     * Launches a browser and returns a ready session.
     * @param playwright Playwright instance owned by the caller
     * @param config Crawler configuration (headless flag, timeouts, base URL for the Referer header)
     * @return Open session; close it to release the browser
     */
    public static PlaywrightBrowserSession open(Playwright playwright, ScraperConfig config) {
        Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
            .setHeadless(config.headless())
            .setArgs(LAUNCH_ARGS));
        try {
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setUserAgent(USER_AGENT)
                .setViewportSize(1920, 1080)
                .setExtraHTTPHeaders(Map.of(
                    "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
                    "Accept-Language", "en-US,en;q=0.9",
                    "Referer", config.baseUrl()
                )));
            context.setDefaultNavigationTimeout(config.navigationTimeoutMs());
            context.setDefaultTimeout(config.waitTimeoutMs());
            Page page = context.newPage();
            logger.info("Browser session opened (headless={}).", config.headless());
            return new PlaywrightBrowserSession(browser, context, page);
        } catch (PlaywrightException e) {
            logger.error("Failed to create browser context: {}", e.getMessage());
            browser.close();
            throw e;
        }
    }

    @Override
    public void navigate(String url, int timeoutMs) {
        logger.debug("Navigating to {}", url);
        page.navigate(url, new Page.NavigateOptions()
            .setWaitUntil(WaitUntilState.NETWORKIDLE)
            .setTimeout(timeoutMs));
    }

    @Override
    public void waitForSelector(String selector, int timeoutMs) {
        page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(timeoutMs));
    }

    @Override
    public void waitForFunction(String script, Object arg, int timeoutMs) {
        page.waitForFunction(script, arg, new Page.WaitForFunctionOptions().setTimeout(timeoutMs));
    }

    @Override
    public Object evaluate(String script, Object arg) {
        return page.evaluate(script, arg);
    }

    @Override
    public void click(String selector) {
        page.click(selector);
    }

    @Override
    public void selectOption(String selector, String value) {
        page.selectOption(selector, value);
    }

    @Override
    public String url() {
        return page.url();
    }

    @Override
    public void close() {
        try {
            context.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close browser context: {}", e.getMessage());
        }
        try {
            browser.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close browser: {}", e.getMessage());
        }
        logger.info("Browser session closed.");
    }
}
