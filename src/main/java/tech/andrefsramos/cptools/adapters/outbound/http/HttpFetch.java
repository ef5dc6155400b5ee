package tech.andrefsramos.cptools.adapters.outbound.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.core.exception.NetworkException;
import tech.andrefsramos.cptools.core.exception.ParsingException;

import java.io.IOException;
import java.util.Map;

/**
 * Plain HTTP GET for judge pages and APIs.

 * Main traits:
 * - Browser-like headers on every request (some judges reject unknown agents).
 * - Retries with constant backoff for I/O failures and 5xx responses only; 4xx fails at once.
 * - Failures surface as {@link NetworkException}; malformed JSON as {@link ParsingException}.
 * - Cookies are sent only when the caller passes them (see {@link HttpSession}).
 */
public class HttpFetch {

    private static final Logger log = LoggerFactory.getLogger(HttpFetch.class);

    private static final String UA =
            "Mozilla/5.0 (X11; Linux x86_64; rv:128.0) Gecko/20100101 Firefox/128.0";
    private static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String ACCEPT_LANG =
            "en-US,en;q=0.5";

    private final ObjectMapper objectMapper;
    private final int apiTimeoutMs;
    private final int pageTimeoutMs;
    private final int retries;
    private final long backoffMs;

    public HttpFetch(ObjectMapper objectMapper, int apiTimeoutMs, int pageTimeoutMs, int retries, long backoffMs) {
        this.objectMapper = objectMapper;
        this.apiTimeoutMs = apiTimeoutMs;
        this.pageTimeoutMs = pageTimeoutMs;
        this.retries = Math.max(0, retries);
        this.backoffMs = Math.max(0, backoffMs);
    }

    public String fetchUrl(String url, int timeoutMs) {
        return fetchUrl(url, timeoutMs, Map.of());
    }

    public String fetchUrl(String url, int timeoutMs, Map<String, String> cookies) {
        long globalStart = System.nanoTime();
        if (log.isDebugEnabled()) {
            log.debug("HttpFetch: GET url={} timeoutMs={} retries={} cookies={}",
                    url, timeoutMs, retries, cookies == null ? 0 : cookies.size());
        }

        NetworkException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            if (attempt > 0) {
                sleep(backoffMs);
            }
            try {
                String body = tryOnce(url, timeoutMs, cookies, attempt);
                if (attempt > 0) {
                    log.info("HttpFetch: success after retry={} url={}", attempt, url);
                }
                return body;
            } catch (NetworkException e) {
                last = e;
                if (!isRetryable(e)) {
                    break;
                }
            }
        }

        long elapsedMs = (System.nanoTime() - globalStart) / 1_000_000;
        log.warn("HttpFetch: giving up url={} elapsedMs={}ms cause={}", url, elapsedMs, last.getMessage());
        throw last;
    }

    public JsonNode fetchJson(String url, int timeoutMs) {
        String body = fetchUrl(url, timeoutMs);
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("HttpFetch: invalid JSON url={} msg={}", url, e.getOriginalMessage());
            throw new ParsingException("Invalid JSON response from " + url + ": " + e.getOriginalMessage(), e);
        }
    }

    public int apiTimeoutMs() {
        return apiTimeoutMs;
    }

    public int pageTimeoutMs() {
        return pageTimeoutMs;
    }

    private String tryOnce(String url, int timeoutMs, Map<String, String> cookies, int attempt) {
        long start = System.nanoTime();
        try {
            Connection conn = Jsoup.connect(url)
                    .userAgent(UA)
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .maxBodySize(0)
                    .header("Accept", ACCEPT)
                    .header("Accept-Language", ACCEPT_LANG);

            if (cookies != null && !cookies.isEmpty()) {
                conn.cookies(cookies);
            }

            Connection.Response r = conn.method(Connection.Method.GET).execute();
            int code = r.statusCode();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            if (log.isDebugEnabled()) {
                log.debug("HttpFetch.tryOnce: attempt={} url={} status={} elapsedMs={}ms contentType={}",
                        attempt, url, code, elapsedMs, r.contentType());
            }

            if (code >= 200 && code < 300) {
                return r.body();
            }
            throw new NetworkException("HTTP error " + code + " fetching " + url, code);
        } catch (IOException ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.warn("HttpFetch.tryOnce: failure attempt={} url={} elapsedMs={}ms msg={}", attempt, url, elapsedMs, ex.toString());
            throw new NetworkException("Network error fetching " + url + ": " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new NetworkException("Invalid URL " + url + ": " + ex.getMessage(), ex);
        }
    }

    private static boolean isRetryable(NetworkException e) {
        if (e.getCause() instanceof IllegalArgumentException) return false;
        int status = e.getStatus();
        return status < 0 || status >= 500;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Interrupted while waiting to retry", ie);
        }
    }
}
