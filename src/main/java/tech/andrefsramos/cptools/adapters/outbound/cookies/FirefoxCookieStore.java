package tech.andrefsramos.cptools.adapters.outbound.cookies;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/*
 * Firefox-format cookie store (Firefox, Zen, LibreWolf).
 *
 * Profiles live one level under the browser root, each with its own cookies.sqlite; the
 * most recently written one is taken as the profile in use.
 */
public class FirefoxCookieStore implements BrowserCookieStore {
    private static final Logger log = LoggerFactory.getLogger(FirefoxCookieStore.class);

    private static final String SQL =
            "SELECT name, value FROM moz_cookies WHERE host = ? OR host = ? OR host LIKE ? ORDER BY expiry";

    private final String name;
    private final Path profilesRoot;

    public FirefoxCookieStore(String name, Path profilesRoot) {
        this.name = name;
        this.profilesRoot = profilesRoot;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Map<String, String> read(String domain) {
        Optional<Path> db = newestCookieDatabase();
        if (db.isEmpty()) {
            log.debug("[Cookies] {}: no cookies.sqlite under {}", name, profilesRoot);
            return Map.of();
        }

        try {
            Map<String, String> out = new LinkedHashMap<>();
            List<String[]> rows = SqliteCookieDatabase.query(db.get(), SQL,
                    (rs, i) -> new String[]{rs.getString("name"), rs.getString("value")},
                    domain, "." + domain, "%." + domain);
            for (String[] r : rows) {
                if (r[0] != null && r[1] != null) out.put(r[0], r[1]);
            }
            log.info("[Cookies] {}: {} cookie(s) for {}", name, out.size(), domain);
            return out;
        } catch (DataAccessException | UncheckedIOException e) {
            log.warn("[Cookies] {}: could not read {}: {}", name, db.get(), e.getMessage());
            return Map.of();
        }
    }

    Optional<Path> newestCookieDatabase() {
        if (profilesRoot == null || !Files.isDirectory(profilesRoot)) return Optional.empty();

        try (Stream<Path> profiles = Files.list(profilesRoot)) {
            return profiles
                    .map(p -> p.resolve("cookies.sqlite"))
                    .filter(Files::isRegularFile)
                    .max(Comparator.comparing(FirefoxCookieStore::lastModified));
        } catch (IOException e) {
            log.debug("[Cookies] {}: cannot list {}: {}", name, profilesRoot, e.getMessage());
            return Optional.empty();
        }
    }

    private static FileTime lastModified(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
