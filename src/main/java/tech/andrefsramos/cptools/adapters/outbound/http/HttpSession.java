package tech.andrefsramos.cptools.adapters.outbound.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.core.application.impl.CookieCacheService;
import tech.andrefsramos.cptools.core.domain.LoginMarkers;
import tech.andrefsramos.cptools.core.exception.PlatformException;

import java.util.Map;

/**
 * HttpSession

 * Authenticated GET on top of {@link HttpFetch}: the browser session cookies of the judge
 * domain (through {@link CookieCacheService}) are attached to the request.

 * Auth retry

 * Two states, CACHED then REFRESHED:
 * 1) request with the cached cookies;
 * 2) no login marker in the body: done;
 * 3) marker while CACHED: invalidate the domain, re-read the browser and retry once;
 * 4) marker while REFRESHED: {@link PlatformException}, no further request.
 */
public class HttpSession {

    private static final Logger log = LoggerFactory.getLogger(HttpSession.class);

    enum AuthState { CACHED, REFRESHED }

    private final HttpFetch http;
    private final CookieCacheService cookieCache;

    public HttpSession(HttpFetch http, CookieCacheService cookieCache) {
        this.http = http;
        this.cookieCache = cookieCache;
    }

    public String fetchUrlWithAuth(String url, String domain, boolean forceRefresh) {
        Map<String, String> cookies = cookieCache.getCookies(domain, forceRefresh);
        if (log.isDebugEnabled()) {
            log.debug("HttpSession.fetchUrlWithAuth: url={} domain={} forceRefresh={} cookies={}",
                    url, domain, forceRefresh, cookies.size());
        }
        return http.fetchUrl(url, http.pageTimeoutMs(), cookies);
    }

    public String fetchWithAuthRetry(String url, String domain, LoginMarkers markers) {
        final long start = System.nanoTime();
        AuthState state = AuthState.CACHED;

        while (true) {
            String body = fetchUrlWithAuth(url, domain, state == AuthState.REFRESHED);

            if (!markers.presentIn(body)) {
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                log.info("HttpSession: authenticated fetch ok url={} state={} elapsedMs={}ms", url, state, elapsedMs);
                return body;
            }

            if (state == AuthState.REFRESHED) {
                log.warn("HttpSession: login still required after cookie refresh url={} domain={}", url, domain);
                throw new PlatformException("Authentication failed for " + domain
                        + ": log in to " + domain + " in your browser and try again.");
            }

            log.info("HttpSession: login marker found url={}; refreshing cookies for domain={}", url, domain);
            cookieCache.invalidate(domain);
            state = AuthState.REFRESHED;
        }
    }
}
