package com.sportsarchive.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link ReachabilityProbe} issuing an HTTP {@code HEAD} request to a well-known URL.
 * Any response, whatever the status, counts as reachable.
 */
public class HttpReachabilityProbe implements ReachabilityProbe {
    private static final Logger logger = LoggerFactory.getLogger(HttpReachabilityProbe.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient client;
    private final URI target;

    public HttpReachabilityProbe(String url) {
        this.client = HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build();
        this.target = URI.create(url);
    }

    @Override
    public boolean isReachable() {
        HttpRequest request = HttpRequest.newBuilder(target)
            .method("HEAD", HttpRequest.BodyPublishers.noBody())
            .timeout(REQUEST_TIMEOUT)
            .build();
        try {
            client.send(request, HttpResponse.BodyHandlers.discarding());
            return true;
        } catch (IOException e) {
            logger.debug("Reachability probe to {} failed: {}", target, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
