package tech.andrefsramos.cptools.core.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.andrefsramos.cptools.core.domain.BrowserCookies;
import tech.andrefsramos.cptools.core.domain.CookieCacheEntry;
import tech.andrefsramos.cptools.core.exception.PlatformException;
import tech.andrefsramos.cptools.core.ports.CookieCacheRepository;
import tech.andrefsramos.cptools.core.ports.CookieSourcePort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CookieCacheServiceTest {

    private static final String DOMAIN = "codeforces.com";

    private MutableClock clock;
    private CountingSource source;
    private InMemoryRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        source = new CountingSource();
        repository = new InMemoryRepository();
    }

    private CookieCacheService service(boolean enabled, int maxAgeHours) {
        return new CookieCacheService(source, repository, clock, enabled, maxAgeHours);
    }

    /* -------------------------- TTL -------------------------- */

    @Nested
    @DisplayName("getCookies with TTL")
    class Ttl {

        @Test
        @DisplayName("getCookies_twiceWithinTtl_oneExtraction")
        void getCookies_twiceWithinTtl_oneExtraction() {
            CookieCacheService cache = service(true, 24);

            Map<String, String> a = cache.getCookies(DOMAIN);
            clock.advance(Duration.ofHours(23));
            Map<String, String> b = cache.getCookies(DOMAIN);

            assertThat(source.calls).isEqualTo(1);
            assertThat(b).isEqualTo(a).containsEntry("session", "v1");
        }

        @Test
        @DisplayName("getCookies_afterTtl_secondExtraction")
        void getCookies_afterTtl_secondExtraction() {
            CookieCacheService cache = service(true, 24);

            cache.getCookies(DOMAIN);
            clock.advance(Duration.ofHours(25));
            Map<String, String> refreshed = cache.getCookies(DOMAIN);

            assertThat(source.calls).isEqualTo(2);
            assertThat(refreshed).containsEntry("session", "v2");
            assertThat(repository.entries).hasSize(1);
            assertThat(repository.entries.get(DOMAIN).fetchedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("getCookies_ttlMinusOne_neverStale")
        void getCookies_ttlMinusOne_neverStale() {
            CookieCacheService cache = service(true, CookieCacheEntry.NEVER_EXPIRE);

            cache.getCookies(DOMAIN);
            clock.advance(Duration.ofDays(3650));
            cache.getCookies(DOMAIN);

            assertThat(source.calls).isEqualTo(1);
        }

        @Test
        @DisplayName("getCookies_entryStoredNeverExpire_configuredTtlApplies")
        void getCookies_entryStoredNeverExpire_configuredTtlApplies() {
            Instant t0 = clock.instant();
            repository.save(new CookieCacheEntry(DOMAIN, Map.of("a", "old"), t0, CookieCacheEntry.NEVER_EXPIRE, "firefox"));
            clock.advance(Duration.ofHours(48));

            Map<String, String> cookies = service(true, 24).getCookies(DOMAIN);

            assertThat(source.calls).isEqualTo(1);
            assertThat(cookies).containsEntry("session", "v1").doesNotContainKey("a");
            assertThat(repository.entries.get(DOMAIN).ttlHours()).isEqualTo(24);
        }

        @Test
        @DisplayName("getCookies_entryStoredWithTtl_configuredNeverExpireKeepsIt")
        void getCookies_entryStoredWithTtl_configuredNeverExpireKeepsIt() {
            repository.save(new CookieCacheEntry(DOMAIN, Map.of("a", "old"), clock.instant(), 24, "firefox"));
            clock.advance(Duration.ofHours(48));

            Map<String, String> cookies = service(true, CookieCacheEntry.NEVER_EXPIRE).getCookies(DOMAIN);

            assertThat(source.calls).isZero();
            assertThat(cookies).containsEntry("a", "old");
        }

        @Test
        @DisplayName("getCookies_forceRefresh_extractsAndOverwrites")
        void getCookies_forceRefresh_extractsAndOverwrites() {
            CookieCacheService cache = service(true, 24);

            cache.getCookies(DOMAIN);
            Map<String, String> forced = cache.getCookies(DOMAIN, true);

            assertThat(source.calls).isEqualTo(2);
            assertThat(forced).containsEntry("session", "v2");
            assertThat(repository.entries.get(DOMAIN).cookies()).containsEntry("session", "v2");
        }
    }

    /* -------------------------- invalidate / clear -------------------------- */

    @Nested
    @DisplayName("invalidate and clear")
    class Invalidate {

        @Test
        @DisplayName("invalidate_thenGet_extractsAgain")
        void invalidate_thenGet_extractsAgain() {
            CookieCacheService cache = service(true, 24);

            cache.getCookies(DOMAIN);
            cache.invalidate(DOMAIN);
            assertThat(repository.entries).doesNotContainKey(DOMAIN);

            cache.getCookies(DOMAIN);
            assertThat(source.calls).isEqualTo(2);
        }

        @Test
        @DisplayName("clear_dropsEveryDomain")
        void clear_dropsEveryDomain() {
            CookieCacheService cache = service(true, 24);

            cache.getCookies(DOMAIN);
            cache.getCookies("atcoder.jp");
            cache.clear();

            assertThat(repository.entries).isEmpty();
        }

        @Test
        @DisplayName("domainKey_normalizedCaseAndLeadingDot")
        void domainKey_normalizedCaseAndLeadingDot() {
            CookieCacheService cache = service(true, 24);

            cache.getCookies(".Codeforces.COM");
            cache.getCookies(DOMAIN);

            assertThat(source.calls).isEqualTo(1);
            assertThat(source.lastDomain).isEqualTo(DOMAIN);
        }
    }

    /* -------------------------- disabled / failures -------------------------- */

    @Nested
    @DisplayName("disabled cache and failures")
    class Disabled {

        @Test
        @DisplayName("getCookies_disabled_alwaysExtractsNeverStores")
        void getCookies_disabled_alwaysExtractsNeverStores() {
            CookieCacheService cache = service(false, 24);

            cache.getCookies(DOMAIN);
            cache.getCookies(DOMAIN);

            assertThat(source.calls).isEqualTo(2);
            assertThat(repository.entries).isEmpty();
            assertThat(cache.isEnabled()).isFalse();
        }

        @Test
        @DisplayName("getCookies_noBrowserCookies_propagatesAndStoresNothing")
        void getCookies_noBrowserCookies_propagatesAndStoresNothing() {
            source.fail = true;
            CookieCacheService cache = service(true, 24);

            assertThatThrownBy(() -> cache.getCookies(DOMAIN))
                    .isInstanceOf(PlatformException.class)
                    .hasMessageContaining(DOMAIN);
            assertThat(repository.entries).isEmpty();
        }
    }

    /* -------------------------- fakes -------------------------- */

    static final class CountingSource implements CookieSourcePort {
        int calls;
        String lastDomain;
        boolean fail;

        @Override
        public BrowserCookies extract(String domain) {
            lastDomain = domain;
            if (fail) {
                throw new PlatformException("No cookies found for " + domain);
            }
            calls++;
            return new BrowserCookies("firefox", Map.of("session", "v" + calls));
        }
    }

    static final class InMemoryRepository implements CookieCacheRepository {
        final Map<String, CookieCacheEntry> entries = new HashMap<>();

        @Override
        public Optional<CookieCacheEntry> findByDomain(String domain) {
            return Optional.ofNullable(entries.get(domain));
        }

        @Override
        public void save(CookieCacheEntry entry) {
            entries.put(entry.domain(), entry);
        }

        @Override
        public void deleteByDomain(String domain) {
            entries.remove(domain);
        }

        @Override
        public void deleteAll() {
            entries.clear();
        }
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
