package tech.andrefsramos.cptools.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.core.domain.BrowserCookies;
import tech.andrefsramos.cptools.core.domain.CookieCacheEntry;
import tech.andrefsramos.cptools.core.ports.CookieCacheRepository;
import tech.andrefsramos.cptools.core.ports.CookieSourcePort;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/*
 * Purpose

 * Per-domain cache of browser session cookies, so that the browser cookie stores are read
 * once per TTL window instead of on every request.

 * Rules

 * - One entry per domain; a refresh overwrites it.
 * - Stale when (now - fetchedAt) > maxAgeHours, the configured value at lookup time, not the
 *   TTL recorded in a persisted entry; maxAgeHours = -1 never goes stale and is only replaced
 *   after an authentication failure (invalidate + forced refresh).
 * - Disabled cache: every call reads the browser and nothing is stored.
 * - Single-threaded use; no locking.
 */
public class CookieCacheService {
    private static final Logger log = LoggerFactory.getLogger(CookieCacheService.class);

    private final CookieSourcePort source;
    private final CookieCacheRepository repository;
    private final Clock clock;
    private final boolean enabled;
    private final int maxAgeHours;

    public CookieCacheService(CookieSourcePort source,
                              CookieCacheRepository repository,
                              Clock clock,
                              boolean enabled,
                              int maxAgeHours) {
        this.source = source;
        this.repository = repository;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.enabled = enabled;
        this.maxAgeHours = maxAgeHours < CookieCacheEntry.NEVER_EXPIRE ? CookieCacheEntry.NEVER_EXPIRE : maxAgeHours;
    }

    public Map<String, String> getCookies(String domain) {
        return getCookies(domain, false);
    }

    public Map<String, String> getCookies(String domain, boolean forceRefresh) {
        final String key = normalize(domain);

        if (!enabled) {
            log.debug("[CookieCache] cache disabled; reading browser domain={}", key);
            return source.extract(key).cookies();
        }

        if (!forceRefresh) {
            Optional<CookieCacheEntry> cached = repository.findByDomain(key);
            if (cached.isPresent()) {
                CookieCacheEntry e = cached.get();
                Instant now = clock.instant();
                if (!e.isStale(now, maxAgeHours)) {
                    log.debug("[CookieCache] hit domain={} cookies={} browser={}", key, e.cookies().size(), e.browser());
                    return e.cookies();
                }
                log.info("[CookieCache] stale entry domain={} fetchedAt={} maxAgeHours={}", key, e.fetchedAt(), maxAgeHours);
            } else {
                log.debug("[CookieCache] miss domain={}", key);
            }
        } else {
            log.info("[CookieCache] forced refresh domain={}", key);
        }

        final long t0 = System.nanoTime();
        BrowserCookies fresh = source.extract(key);
        CookieCacheEntry entry = new CookieCacheEntry(key, fresh.cookies(), clock.instant(), maxAgeHours, fresh.browser());
        repository.save(entry);

        log.info("[CookieCache] stored domain={} cookies={} browser={} ({} ms)",
                key, entry.cookies().size(), entry.browser(), (System.nanoTime() - t0) / 1_000_000);
        return entry.cookies();
    }

    public void invalidate(String domain) {
        final String key = normalize(domain);
        repository.deleteByDomain(key);
        log.info("[CookieCache] invalidated domain={}", key);
    }

    public void clear() {
        repository.deleteAll();
        log.info("[CookieCache] cleared");
    }

    public boolean isEnabled() {
        return enabled;
    }

    static String normalize(String domain) {
        if (domain == null) return "";
        String d = domain.trim().toLowerCase(Locale.ROOT);
        while (d.startsWith(".")) d = d.substring(1);
        return d;
    }
}
