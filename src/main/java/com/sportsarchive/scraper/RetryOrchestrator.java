package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.function.LongSupplier;

/**
 * Bounded retry wrapper used by every navigation and wait call of the crawl.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Runs the operation; on success returns its value.</li>
 *   <li>Failures outside the recoverable network class ({@link NetworkErrors#isRecoverable(Throwable)}) propagate
 *   immediately, without retry.</li>
 *   <li>Recoverable failures with attempts left wait {@code base^attempt} seconds, then poll the
 *   {@link ReachabilityProbe} until the network answers. If it stays silent past the reconnection budget a
 *   {@link ReconnectionTimeoutException} is thrown.</li>
 *   <li>When every attempt failed, the last error is re-thrown.</li>
 * </ul>
 *
 * @author Sports Archive Scraper Team
 * @since 1.0
 */
public class RetryOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(RetryOrchestrator.class);

    private final int maxAttempts;
    private final int backoffBase;
    private final long reconnectPollMs;
    private final long reconnectMaxWaitMs;
    private final Sleeper sleeper;
    private final ReachabilityProbe probe;
    private final LongSupplier clock;

    /**
     * An action with no result, for navigation and wait calls.
     */
    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    private static final class RetryState {
        int attempt;
        Exception lastError;
    }

    public RetryOrchestrator(ScraperConfig config, Sleeper sleeper, ReachabilityProbe probe) {
        this(config.retryMaxAttempts(), config.backoffBase(), config.reconnectPollMs(), config.reconnectMaxWaitMs(),
            sleeper, probe, System::currentTimeMillis);
    }

    public RetryOrchestrator(int maxAttempts, int backoffBase, long reconnectPollMs, long reconnectMaxWaitMs,
                             Sleeper sleeper, ReachabilityProbe probe, LongSupplier clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoffBase = backoffBase;
        this.reconnectPollMs = reconnectPollMs;
        this.reconnectMaxWaitMs = reconnectMaxWaitMs;
        this.sleeper = sleeper;
        this.probe = probe;
        this.clock = clock;
    }

    /**
     * Executes an operation with classified retry.
     * @param operation Operation to run
     * @param description Description for logging
     * @param <T> Return type
     * @return Result of the first successful call
     * @throws Exception the non-recoverable error, the last recoverable error once attempts are exhausted,
     * or {@link ReconnectionTimeoutException}
     */
    public <T> T execute(Callable<T> operation, String description) throws Exception {
        RetryState state = new RetryState();
        while (state.attempt < maxAttempts) {
            state.attempt++;
            try {
                return operation.call();
            } catch (Exception e) {
                state.lastError = e;
                if (!NetworkErrors.isRecoverable(e)) {
                    logger.debug("Non-recoverable failure in {}: {}", description, e.getMessage());
                    throw e;
                }
                if (state.attempt >= maxAttempts) {
                    break;
                }
                long backoffMs = (long) Math.pow(backoffBase, state.attempt) * 1000L;
                logger.warn("Retry {}/{} of {} after {}s: {}", state.attempt, maxAttempts, description,
                    backoffMs / 1000, e.getMessage());
                sleeper.sleep(backoffMs);
                awaitReconnection(e);
            }
        }
        logger.error("Giving up on {} after {} attempts.", description, maxAttempts);
        throw state.lastError;
    }

    public void run(Action action, String description) throws Exception {
        execute(() -> {
            action.run();
            return Boolean.TRUE;
        }, description);
    }

    private void awaitReconnection(Exception cause) throws InterruptedException {
        logger.warn("Network error detected. Waiting for reconnection...");
        long start = clock.getAsLong();
        while (clock.getAsLong() - start < reconnectMaxWaitMs) {
            if (probe.isReachable()) {
                logger.info("Network reconnected.");
                return;
            }
            sleeper.sleep(reconnectPollMs);
        }
        throw new ReconnectionTimeoutException("Network reconnection timeout exceeded", cause);
    }
}
