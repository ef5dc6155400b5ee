package tech.andrefsramos.cptools.core.ports;

import tech.andrefsramos.cptools.core.domain.CookieCacheEntry;

import java.util.Optional;

public interface CookieCacheRepository {
    Optional<CookieCacheEntry> findByDomain(String domain);
    void save(CookieCacheEntry entry);
    void deleteByDomain(String domain);
    void deleteAll();
}
