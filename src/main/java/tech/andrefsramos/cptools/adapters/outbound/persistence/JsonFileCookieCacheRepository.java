package tech.andrefsramos.cptools.adapters.outbound.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.core.domain.CookieCacheEntry;
import tech.andrefsramos.cptools.core.ports.CookieCacheRepository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/*
 * JsonFileCookieCacheRepository

 * Purpose

 * File-backed {@link CookieCacheRepository}, so that the cookie TTL spans CLI invocations.
 * The file holds a JSON object keyed by domain:

 *   { "codeforces.com": { "domain": ..., "cookies": {...}, "fetchedAt": ..., "ttlHours": 24, "browser": "firefox" } }

 * Failure policy

 * - Missing or unreadable file: treated as an empty cache (logged).
 * - Write failure: logged; the in-memory view stays current for this process.
 * - Writes go to a sibling temp file (owner read/write only) and are moved into place.
 */
public class JsonFileCookieCacheRepository implements CookieCacheRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCookieCacheRepository.class);

    private static final TypeReference<LinkedHashMap<String, CookieCacheEntry>> TYPE = new TypeReference<>() {};
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final ObjectMapper objectMapper;
    private final Path file;
    private Map<String, CookieCacheEntry> entries;

    public JsonFileCookieCacheRepository(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper;
        this.file = file;
    }

    @Override
    public Optional<CookieCacheEntry> findByDomain(String domain) {
        return Optional.ofNullable(entries().get(domain));
    }

    @Override
    public void save(CookieCacheEntry entry) {
        entries().put(entry.domain(), entry);
        flush();
    }

    @Override
    public void deleteByDomain(String domain) {
        if (entries().remove(domain) != null) {
            flush();
        }
    }

    @Override
    public void deleteAll() {
        entries().clear();
        try {
            Files.deleteIfExists(file);
            log.info("[CookieStore] removed {}", file);
        } catch (IOException e) {
            log.warn("[CookieStore] could not remove {}: {}", file, e.getMessage());
        }
    }

    public Path file() {
        return file;
    }

    private Map<String, CookieCacheEntry> entries() {
        if (entries == null) {
            entries = load();
        }
        return entries;
    }

    private Map<String, CookieCacheEntry> load() {
        if (!Files.isRegularFile(file)) {
            log.debug("[CookieStore] no cache file at {}", file);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, CookieCacheEntry> loaded = objectMapper.readValue(file.toFile(), TYPE);
            log.debug("[CookieStore] loaded {} entr(ies) from {}", loaded == null ? 0 : loaded.size(), file);
            return loaded == null ? new LinkedHashMap<>() : new LinkedHashMap<>(loaded);
        } catch (IOException e) {
            log.warn("[CookieStore] unreadable cache file {}; starting empty: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void flush() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            createOwnerOnly(tmp);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("[CookieStore] could not write {}: {}", file, e.getMessage());
        }
    }

    // Session cookies: rw------- where the filesystem has POSIX permissions.
    private static void createOwnerOnly(Path tmp) throws IOException {
        Files.deleteIfExists(tmp);
        if (tmp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.createFile(tmp, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        }
    }
}
