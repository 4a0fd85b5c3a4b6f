package com.stockdiscussion.collector.collect.http;

import com.stockdiscussion.collector.config.CollectorProperties;
import com.stockdiscussion.collector.collect.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rate-limited HTTP client shared by the scrapers: a global concurrency cap, a minimum delay
 * between requests to the same host, a longer pause after 403/429, and bounded retries with
 * jittered exponential backoff for timeouts, 408, 429 and 5xx.
 *
 * <p>Bodies are decoded with the charset the response declares (Naver's board pages are
 * EUC-KR), UTF-8 when it declares none.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final String ACCEPT_LANGUAGE = "ko-KR,ko;q=0.9,en-US;q=0.5";

    private final CollectorProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, HostPacer> pacers = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        CollectorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Map.of());
    }

    public HttpFetchResult get(String url, String acceptHeader, Map<String, String> headers) {
        return send(url, acceptHeader, headers, null);
    }

    public HttpFetchResult postJson(String url, String jsonBody, String acceptHeader, Map<String, String> headers) {
        return send(url, acceptHeader, headers, jsonBody == null ? "" : jsonBody);
    }

    /**
     * @param jsonBody request body for a POST, or null for a GET
     */
    private HttpFetchResult send(String url, String acceptHeader, Map<String, String> headers, String jsonBody) {
        String method = jsonBody == null ? "GET" : "POST";
        URI uri = toUri(url);
        if (uri == null) {
            return HttpFetchResult.failure(url, 1, "invalid_url", "URL missing host or malformed");
        }
        HttpRequest request = buildRequest(uri, acceptHeader, headers, jsonBody);
        HostPacer pacer = pacers.computeIfAbsent(uri.getHost().toLowerCase(Locale.ROOT), HostPacer::new);

        int maxAttempts = 1 + properties.getRequestMaxRetries();
        HttpFetchResult result = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            result = exchange(url, request, pacer, attempt);
            if (attempt == maxAttempts || !result.isTransient()) {
                break;
            }
            log.debug("Retrying {} {} after {} (attempt {}/{})", method, url, result.describeFailure(), attempt, maxAttempts);
            if (!pause(backoffMillis(attempt))) {
                break;
            }
        }
        return result;
    }

    private HttpRequest buildRequest(URI uri, String acceptHeader, Map<String, String> headers, String jsonBody) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", acceptHeader == null || acceptHeader.isBlank() ? "*/*" : acceptHeader)
            .header("Accept-Language", ACCEPT_LANGUAGE);
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (value != null && !value.isBlank()) {
                    builder.setHeader(name, value);
                }
            });
        }
        if (jsonBody == null) {
            return builder.GET().build();
        }
        return builder
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8))
            .build();
    }

    private HttpFetchResult exchange(String url, HttpRequest request, HostPacer pacer, int attempt) {
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            pacer.awaitTurn(properties.getPerHostDelayMs());

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status == 403 || status == 429) {
                pacer.holdOff(Duration.ofSeconds(properties.getRateLimitBackoffSeconds()));
            }
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            return new HttpFetchResult(
                url,
                response.uri(),
                status,
                decode(response.body(), response.headers()),
                contentType,
                attempt,
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return HttpFetchResult.failure(url, attempt, "timeout", e.getMessage());
        } catch (IOException e) {
            return HttpFetchResult.failure(url, attempt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.failure(url, attempt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return HttpFetchResult.failure(url, attempt, "http_error", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    static String decode(byte[] body, HttpHeaders headers) {
        if (body == null) {
            return null;
        }
        return new String(body, charsetOf(headers.firstValue("Content-Type").orElse(null)));
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            Charset declared = MediaType.parseMediaType(contentType).getCharset();
            return declared == null ? StandardCharsets.UTF_8 : declared;
        } catch (IllegalArgumentException e) {
            // unparseable header or a charset this JVM does not know
            log.debug("Ignoring charset of Content-Type '{}': {}", contentType, e.getMessage());
            return StandardCharsets.UTF_8;
        }
    }

    private long backoffMillis(int attempt) {
        long delay = (long) properties.getRequestRetryBaseDelayMs() << Math.min(attempt - 1, 20);
        int cap = properties.getRequestRetryMaxDelayMs();
        if (cap > 0) {
            delay = Math.min(delay, cap);
        }
        if (delay <= 1) {
            return Math.max(0, delay);
        }
        // half fixed, half jitter
        return delay / 2 + ThreadLocalRandom.current().nextLong(delay / 2);
    }

    private static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            URI uri = URI.create(value);
            return uri.getHost() == null ? null : uri;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Earliest instant the next request to one host may start.
     */
    private static final class HostPacer {
        private final String host;
        private Instant nextAllowed = Instant.EPOCH;

        HostPacer(String host) {
            this.host = host;
        }

        synchronized void awaitTurn(long minGapMs) throws InterruptedException {
            long waitMs = Duration.between(Instant.now(), nextAllowed).toMillis();
            if (waitMs > 0) {
                Thread.sleep(waitMs);
            }
            nextAllowed = Instant.now().plusMillis(minGapMs);
        }

        synchronized void holdOff(Duration duration) {
            Instant until = Instant.now().plus(duration);
            if (until.isAfter(nextAllowed)) {
                log.warn("Host {} signalled rate limiting; pausing until {}", host, until);
                nextAllowed = until;
            }
        }
    }
}
