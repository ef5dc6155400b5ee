package tech.andrefsramos.cptools.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.andrefsramos.cptools.adapters.outbound.cookies.BrowserCookieExtractor;
import tech.andrefsramos.cptools.adapters.outbound.cookies.BrowserCookieStore;
import tech.andrefsramos.cptools.adapters.outbound.cookies.ChromiumCookieDecryptor;
import tech.andrefsramos.cptools.adapters.outbound.cookies.ChromiumCookieStore;
import tech.andrefsramos.cptools.adapters.outbound.cookies.DefaultBrowserDetector;
import tech.andrefsramos.cptools.adapters.outbound.cookies.FirefoxCookieStore;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpFetch;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpSession;
import tech.andrefsramos.cptools.adapters.outbound.persistence.JsonFileCookieCacheRepository;
import tech.andrefsramos.cptools.core.application.impl.CookieCacheService;
import tech.andrefsramos.cptools.core.ports.CookieCacheRepository;
import tech.andrefsramos.cptools.core.ports.CookieSourcePort;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/*
 * Purpose

 * Wires the authenticated fetch layer: HTTP client, browser cookie stores, the persisted
 * cookie cache and the session that combines them.

 * Browser stores (Linux locations), in priority order:
 * - Firefox format: zen (~/.zen), firefox (~/.mozilla/firefox), librewolf (~/.librewolf).
 * - Chromium format under ~/.config: chrome, chromium, edge, brave, opera, vivaldi.
 */
@Configuration
public class FetchLayerConfig {

    private static final Logger log = LoggerFactory.getLogger(FetchLayerConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /* ============================= HTTP ============================= */

    @Bean
    HttpFetch httpFetch(
            ObjectMapper objectMapper,
            @Value("${cptools.http.api-timeout-ms:10000}") int apiTimeoutMs,
            @Value("${cptools.http.page-timeout-ms:15000}") int pageTimeoutMs,
            @Value("${cptools.http.retries:1}") int retries,
            @Value("${cptools.http.backoff-ms:500}") long backoffMs
    ) {
        try {
            if (apiTimeoutMs < 1 || pageTimeoutMs < 1) {
                throw new IllegalArgumentException("cptools.http timeouts must be positive (api="
                        + apiTimeoutMs + ", page=" + pageTimeoutMs + ")");
            }
            if (retries < 0) {
                log.warn("[Config] cptools.http.retries={} invalid. Using 0.", retries);
                retries = 0;
            }

            HttpFetch bean = new HttpFetch(objectMapper, apiTimeoutMs, pageTimeoutMs, retries, backoffMs);
            log.info("[Config] HttpFetch ready (apiTimeoutMs={}, pageTimeoutMs={}, retries={}, backoffMs={})",
                    apiTimeoutMs, pageTimeoutMs, retries, backoffMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[Config] Error creating HttpFetch: {}", e.getMessage(), e);
            throw e;
        }
    }

    @Bean
    HttpSession httpSession(HttpFetch httpFetch, CookieCacheService cookieCacheService) {
        return new HttpSession(httpFetch, cookieCacheService);
    }

    /* ============================= Cookies ============================= */

    @Bean
    CookieSourcePort cookieSourcePort(
            @Value("${user.home}") String userHome,
            @Value("${cptools.cookies.preferred-browser:}") String preferredBrowser
    ) {
        final Path home = Path.of(userHome);
        final Path config = home.resolve(".config");
        final ChromiumCookieDecryptor decryptor = new ChromiumCookieDecryptor();

        List<BrowserCookieStore> stores = List.of(
                new FirefoxCookieStore("zen", home.resolve(".zen")),
                new FirefoxCookieStore("firefox", home.resolve(".mozilla").resolve("firefox")),
                new FirefoxCookieStore("librewolf", home.resolve(".librewolf")),
                new ChromiumCookieStore("chrome", config.resolve("google-chrome"), decryptor),
                new ChromiumCookieStore("chromium", config.resolve("chromium"), decryptor),
                new ChromiumCookieStore("edge", config.resolve("microsoft-edge"), decryptor),
                new ChromiumCookieStore("brave", config.resolve("BraveSoftware").resolve("Brave-Browser"), decryptor),
                new ChromiumCookieStore("opera", config.resolve("opera"), decryptor),
                new ChromiumCookieStore("vivaldi", config.resolve("vivaldi"), decryptor)
        );

        log.info("[Config] browser cookie stores={} preferred='{}'",
                stores.stream().map(BrowserCookieStore::name).toList(), preferredBrowser);
        return new BrowserCookieExtractor(stores, new DefaultBrowserDetector(), preferredBrowser);
    }

    @Bean
    CookieCacheRepository cookieCacheRepository(
            ObjectMapper objectMapper,
            @Value("${cptools.cookies.cache-file:${user.home}/.cache/cptools/browser_cookies.json}") String cacheFile
    ) {
        log.info("[Config] cookie cache file={}", cacheFile);
        return new JsonFileCookieCacheRepository(objectMapper, Path.of(cacheFile));
    }

    @Bean
    CookieCacheService cookieCacheService(
            CookieSourcePort cookieSourcePort,
            CookieCacheRepository cookieCacheRepository,
            Clock clock,
            @Value("${cptools.cookies.cache-enabled:true}") boolean enabled,
            @Value("${cptools.cookies.max-age-hours:24}") int maxAgeHours
    ) {
        try {
            if (maxAgeHours < -1) {
                throw new IllegalArgumentException("cptools.cookies.max-age-hours must be -1 or >= 0, got " + maxAgeHours);
            }
            CookieCacheService bean = new CookieCacheService(cookieSourcePort, cookieCacheRepository, clock, enabled, maxAgeHours);
            log.info("[Config] CookieCacheService ready (enabled={}, maxAgeHours={})", enabled, maxAgeHours);
            return bean;
        } catch (RuntimeException e) {
            log.error("[Config] Error creating CookieCacheService: {}", e.getMessage(), e);
            throw e;
        }
    }
}
