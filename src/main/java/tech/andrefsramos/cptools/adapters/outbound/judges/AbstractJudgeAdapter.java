package tech.andrefsramos.cptools.adapters.outbound.judges;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpFetch;
import tech.andrefsramos.cptools.adapters.outbound.http.HttpSession;
import tech.andrefsramos.cptools.core.domain.LoginMarkers;
import tech.andrefsramos.cptools.core.domain.SampleTest;
import tech.andrefsramos.cptools.core.exception.NetworkException;
import tech.andrefsramos.cptools.core.exception.ParsingException;
import tech.andrefsramos.cptools.core.ports.JudgePort;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/*
 * Shared plumbing of the judges that talk to the network:
 *  - host matching for detect();
 *  - page retrieval, routed through the authenticated session when needsAuthentication(url);
 *  - sample scraping that turns network/markup failures into an empty result.
 */
public abstract class AbstractJudgeAdapter implements JudgePort {

    private static final Logger log = LoggerFactory.getLogger(AbstractJudgeAdapter.class);

    protected final HttpFetch http;
    protected final HttpSession session;
    protected final LoginMarkers loginMarkers;

    protected AbstractJudgeAdapter(HttpFetch http, HttpSession session, LoginMarkers loginMarkers) {
        this.http = http;
        this.session = session;
        this.loginMarkers = loginMarkers != null ? loginMarkers : LoginMarkers.none();
    }

    /** Domain whose browser cookies authenticate requests to this judge. */
    public abstract String cookieDomain();

    public LoginMarkers loginMarkers() {
        return loginMarkers;
    }

    @Override
    public boolean requiresAuth() {
        return false;
    }

    protected String fetchPage(String url, int timeoutMs) {
        if (needsAuthentication(url)) {
            return session.fetchWithAuthRetry(url, cookieDomain(), loginMarkers);
        }
        return http.fetchUrl(url, timeoutMs);
    }

    protected Optional<Document> fetchDocument(String url, int timeoutMs) {
        try {
            String html = fetchPage(url, timeoutMs);
            Document doc = Jsoup.parse(html, url);
            doc.outputSettings().prettyPrint(false);
            return Optional.of(doc);
        } catch (NetworkException e) {
            log.warn("[{}] page fetch failed url={}: {}", platformName(), url, e.getMessage());
            return Optional.empty();
        }
    }

    protected Optional<List<SampleTest>> scrapeSamples(String url, Function<Document, List<SampleTest>> parser) {
        final long t0 = System.nanoTime();
        Optional<Document> doc = fetchDocument(url, http.pageTimeoutMs());
        if (doc.isEmpty()) {
            return Optional.empty();
        }

        try {
            List<SampleTest> samples = parser.apply(doc.get());
            log.info("[{}] samples={} url={} ({} ms)", platformName(), samples.size(), url, (System.nanoTime() - t0) / 1_000_000);
            return Optional.of(samples);
        } catch (ParsingException e) {
            log.warn("[{}] unexpected markup url={}: {}", platformName(), url, e.getMessage());
            return Optional.empty();
        }
    }

    protected static boolean hostMatches(String url, String... domains) {
        String host = hostOf(url);
        if (host == null) return false;
        for (String d : domains) {
            if (host.equals(d) || host.endsWith("." + d)) return true;
        }
        return false;
    }

    static String hostOf(String url) {
        if (url == null || url.isBlank()) return null;
        String u = url.strip();
        if (!u.contains("://")) {
            u = "https://" + u;
        }
        try {
            String host = URI.create(u).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    protected static String pathOf(String url) {
        if (url == null) return "";
        String u = url.strip();
        if (!u.contains("://")) {
            u = "https://" + u;
        }
        try {
            String path = URI.create(u).getPath();
            return path == null ? "" : path;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
