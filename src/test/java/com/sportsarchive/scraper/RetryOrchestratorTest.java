package com.sportsarchive.scraper;

import com.microsoft.playwright.TimeoutError;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryOrchestratorTest {
    private FakeTime time;

    @BeforeEach
    void setUp() {
        time = new FakeTime();
    }

    private RetryOrchestrator orchestrator(ReachabilityProbe probe) {
        return new RetryOrchestrator(3, 2, 5_000L, 600_000L, time, probe, time);
    }

    @Test
    void testRecoverableFailuresThenSuccessBacksOffTwice() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String result = orchestrator(() -> true).execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new RuntimeException("net::ERR_INTERNET_DISCONNECTED at https://example.org");
            }
            return "ok";
        }, "flaky navigation");

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(2_000L, 4_000L), time.sleeps);
    }

    @Test
    void testNonRecoverableFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException error = assertThrows(IllegalStateException.class, () ->
            orchestrator(() -> true).execute(() -> {
                calls.incrementAndGet();
                throw new IllegalStateException("selector syntax error");
            }, "broken action"));

        assertEquals("selector syntax error", error.getMessage());
        assertEquals(1, calls.get());
        assertTrue(time.sleeps.isEmpty());
    }

    @Test
    void testExhaustedAttemptsRethrowLastError() {
        AtomicInteger calls = new AtomicInteger();
        TimeoutError error = assertThrows(TimeoutError.class, () ->
            orchestrator(() -> true).run(() -> {
                throw new TimeoutError("Timeout 45000ms exceeded. attempt " + calls.incrementAndGet());
            }, "slow wait"));

        assertEquals(3, calls.get());
        assertTrue(error.getMessage().endsWith("attempt 3"));
        assertEquals(List.of(2_000L, 4_000L), time.sleeps);
    }

    @Test
    void testWaitsForReconnectionBeforeRetrying() throws Exception {
        AtomicInteger probes = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        int value = orchestrator(() -> probes.incrementAndGet() >= 3).execute(() -> {
            if (calls.incrementAndGet() == 1) throw new RuntimeException("net::ERR_NAME_NOT_RESOLVED");
            return 7;
        }, "dns hiccup");

        assertEquals(7, value);
        assertEquals(3, probes.get());
        assertEquals(List.of(2_000L, 5_000L, 5_000L), time.sleeps);
    }

    @Test
    void testReconnectionTimeoutIsFatal() {
        AtomicInteger calls = new AtomicInteger();
        ReconnectionTimeoutException error = assertThrows(ReconnectionTimeoutException.class, () ->
            orchestrator(() -> false).run(() -> {
                calls.incrementAndGet();
                throw new RuntimeException("net::ERR_INTERNET_DISCONNECTED");
            }, "offline"));

        assertEquals("Network reconnection timeout exceeded", error.getMessage());
        assertEquals(1, calls.get());
        assertFalse(NetworkErrors.isRecoverable(error));
    }

    @Test
    void testRejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () ->
            new RetryOrchestrator(0, 2, 5_000L, 600_000L, time, () -> true, time));
    }
}
