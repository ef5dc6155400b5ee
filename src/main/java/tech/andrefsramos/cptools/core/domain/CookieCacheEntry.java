package tech.andrefsramos.cptools.core.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Cached browser session for one domain.
 * {@code ttlHours == -1} never expires on its own; only an auth failure replaces it.
 */
public record CookieCacheEntry(
        String domain,
        Map<String, String> cookies,
        Instant fetchedAt,
        int ttlHours,
        String browser
) {
    public static final int NEVER_EXPIRE = -1;

    public CookieCacheEntry {
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    }

    public boolean isStale(Instant now) {
        return isStale(now, ttlHours);
    }

    /** Staleness under {@code maxAgeHours} instead of the TTL recorded when the entry was stored. */
    public boolean isStale(Instant now, int maxAgeHours) {
        if (maxAgeHours == NEVER_EXPIRE) return false;
        if (fetchedAt == null) return true;
        return Duration.between(fetchedAt, now).compareTo(Duration.ofHours(maxAgeHours)) > 0;
    }
}
