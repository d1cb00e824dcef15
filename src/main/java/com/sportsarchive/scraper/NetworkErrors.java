package com.sportsarchive.scraper;

import com.microsoft.playwright.TimeoutError;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;

/**
 * Classifies failures into the recoverable network class (connectivity loss, name resolution failure, timeout).
 * Everything else is treated as non-recoverable by {@link RetryOrchestrator}.
 */
public final class NetworkErrors {
    private NetworkErrors() {}

    // Chromium network error codes surfaced in Playwright messages
    private static final List<String> RECOVERABLE_MARKERS = List.of(
        "net::err_internet_disconnected",
        "net::err_name_not_resolved",
        "net::err_connection_reset",
        "net::err_connection_closed",
        "net::err_connection_refused",
        "net::err_network_changed",
        "timeout"
    );

    public static boolean isRecoverable(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current instanceof ReconnectionTimeoutException) {
                return false;
            }
            if (current instanceof TimeoutError
                || current instanceof WaitTimeoutException
                || current instanceof SocketTimeoutException
                || current instanceof HttpTimeoutException
                || current instanceof UnknownHostException
                || current instanceof ConnectException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : RECOVERABLE_MARKERS) {
                    if (lower.contains(marker)) return true;
                }
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
