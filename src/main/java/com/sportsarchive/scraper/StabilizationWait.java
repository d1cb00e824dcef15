package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Waits for a progressively rendered list of rows to settle.
 * <p>
 * Rows are considered stable once two consecutive polls report the same non-zero row count and every row exposes
 * the required child element. The previous count lives in a context object created per call, so overlapping or
 * repeated waits never share state.
 */
public class StabilizationWait {
    private static final Logger logger = LoggerFactory.getLogger(StabilizationWait.class);

    private final Sleeper sleeper;
    private final LongSupplier clock;
    private final long pollMs;

    /**
     * Snapshot of the rows at one poll.
     */
    public record RowState(int count, boolean complete) {}

    private static final class StabilityContext {
        int previousCount = -1;

        boolean observe(RowState state) {
            boolean stable = state.count() > 0 && state.count() == previousCount && state.complete();
            previousCount = state.count();
            return stable;
        }
    }

    public StabilizationWait(Sleeper sleeper, LongSupplier clock, long pollMs) {
        this.sleeper = sleeper;
        this.clock = clock;
        this.pollMs = Math.max(1L, pollMs);
    }

    /**
     * Polls the page until the rows matched by {@code rowSelector} are stable.
     * @param session Page to poll
     * @param rowSelector Selector of the rows
     * @param requiredChild Selector every row must contain
     * @param timeoutMs Upper bound of the wait
     * @param description Description for logging and the timeout message
     * @return Row count at stabilization
     * @throws WaitTimeoutException if the rows did not settle in time
     */
    public int awaitStableRows(BrowserSessionInterface session, String rowSelector, String requiredChild,
                               long timeoutMs, String description) throws InterruptedException {
        return awaitStable(() -> readState(session, rowSelector, requiredChild), timeoutMs, description);
    }

    /**
     * Polls an arbitrary state reader until it reports the same non-zero, complete count twice in a row.
     * @param reader Reads the current state from the page
     * @param timeoutMs Upper bound of the wait
     * @param description Description for logging and the timeout message
     * @return Count at stabilization
     * @throws WaitTimeoutException if the count did not settle in time
     */
    public int awaitStable(Supplier<RowState> reader, long timeoutMs, String description)
            throws InterruptedException {
        StabilityContext context = new StabilityContext();
        long start = clock.getAsLong();
        while (true) {
            RowState state = reader.get();
            if (context.observe(state)) {
                logger.debug("{} stable at {}.", description, state.count());
                return state.count();
            }
            if (clock.getAsLong() - start >= timeoutMs) {
                throw new WaitTimeoutException("Timeout " + timeoutMs + "ms exceeded waiting for " + description);
            }
            sleeper.sleep(pollMs);
        }
    }

    private static RowState readState(BrowserSessionInterface session, String rowSelector, String requiredChild) {
        Map<String, Object> raw = PageScripts.asMap(session.evaluate(PageScripts.ROW_STATE,
            Map.of("rows", rowSelector, "required", requiredChild)));
        return new RowState(PageScripts.asInt(raw.get("count"), 0), PageScripts.asBoolean(raw.get("complete")));
    }
}
