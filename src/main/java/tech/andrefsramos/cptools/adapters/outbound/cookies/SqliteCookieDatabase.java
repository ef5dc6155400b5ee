package tech.andrefsramos.cptools.adapters.outbound.cookies;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/*
 * Read-only queries against a browser's SQLite cookie database.
 *
 * The running browser keeps the file locked, so the database (and its -wal journal, when
 * present) is copied to a temporary directory first and the copy is queried through a
 * single JDBC connection. The copy is removed afterwards.
 */
final class SqliteCookieDatabase {
    private static final Logger log = LoggerFactory.getLogger(SqliteCookieDatabase.class);

    private SqliteCookieDatabase() {}

    static <T> List<T> query(Path database, String sql, RowMapper<T> mapper, Object... args) {
        Path tmpDir = null;
        SingleConnectionDataSource ds = null;
        try {
            tmpDir = Files.createTempDirectory("cptools-cookies");
            Path copy = tmpDir.resolve(database.getFileName());
            Files.copy(database, copy, StandardCopyOption.REPLACE_EXISTING);

            Path wal = database.resolveSibling(database.getFileName() + "-wal");
            if (Files.isRegularFile(wal)) {
                Files.copy(wal, tmpDir.resolve(wal.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            }

            ds = new SingleConnectionDataSource("jdbc:sqlite:" + copy.toAbsolutePath(), true);
            List<T> rows = new JdbcTemplate(ds).query(sql, mapper, args);
            log.debug("[Cookies] {} rows from {}", rows.size(), database);
            return rows;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not copy cookie database " + database, e);
        } finally {
            if (ds != null) {
                ds.destroy();
            }
            deleteQuietly(tmpDir);
        }
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.debug("[Cookies] could not remove temp dir {}: {}", dir, e.getMessage());
        }
    }
}
