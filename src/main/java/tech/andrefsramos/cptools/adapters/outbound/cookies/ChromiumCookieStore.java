package tech.andrefsramos.cptools.adapters.outbound.cookies;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/*
 * Chromium-format cookie store (Chrome, Chromium, Edge, Brave, Opera, Vivaldi).
 *
 * The database is Default/Network/Cookies in current versions, Default/Cookies in older ones.
 * A plain value is used as is; otherwise encrypted_value goes through the decryptor and
 * cookies it cannot decrypt are left out.
 */
public class ChromiumCookieStore implements BrowserCookieStore {
    private static final Logger log = LoggerFactory.getLogger(ChromiumCookieStore.class);

    private static final String SQL =
            "SELECT host_key, name, value, encrypted_value FROM cookies "
                    + "WHERE host_key = ? OR host_key = ? OR host_key LIKE ? ORDER BY expires_utc";

    private final String name;
    private final Path userDataDir;
    private final ChromiumCookieDecryptor decryptor;

    public ChromiumCookieStore(String name, Path userDataDir, ChromiumCookieDecryptor decryptor) {
        this.name = name;
        this.userDataDir = userDataDir;
        this.decryptor = decryptor;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Map<String, String> read(String domain) {
        Optional<Path> db = cookieDatabase();
        if (db.isEmpty()) {
            log.debug("[Cookies] {}: no cookie database under {}", name, userDataDir);
            return Map.of();
        }

        try {
            List<Row> rows = SqliteCookieDatabase.query(db.get(), SQL,
                    (rs, i) -> new Row(rs.getString("host_key"), rs.getString("name"),
                            rs.getString("value"), rs.getBytes("encrypted_value")),
                    domain, "." + domain, "%." + domain);

            Map<String, String> out = new LinkedHashMap<>();
            int skipped = 0;
            for (Row r : rows) {
                if (r.name() == null) continue;
                if (r.value() != null && !r.value().isEmpty()) {
                    out.put(r.name(), r.value());
                    continue;
                }
                Optional<String> plain = decryptor.decrypt(r.encrypted(), r.hostKey());
                if (plain.isPresent()) {
                    out.put(r.name(), plain.get());
                } else {
                    skipped++;
                }
            }
            log.info("[Cookies] {}: {} cookie(s) for {} (undecryptable={})", name, out.size(), domain, skipped);
            return out;
        } catch (DataAccessException | UncheckedIOException e) {
            log.warn("[Cookies] {}: could not read {}: {}", name, db.get(), e.getMessage());
            return Map.of();
        }
    }

    Optional<Path> cookieDatabase() {
        if (userDataDir == null) return Optional.empty();
        Path current = userDataDir.resolve("Default").resolve("Network").resolve("Cookies");
        if (Files.isRegularFile(current)) return Optional.of(current);
        Path legacy = userDataDir.resolve("Default").resolve("Cookies");
        if (Files.isRegularFile(legacy)) return Optional.of(legacy);
        return Optional.empty();
    }

    private record Row(String hostKey, String name, String value, byte[] encrypted) {}
}
