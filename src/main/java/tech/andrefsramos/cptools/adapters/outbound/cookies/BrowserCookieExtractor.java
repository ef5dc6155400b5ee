package tech.andrefsramos.cptools.adapters.outbound.cookies;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.core.domain.BrowserCookies;
import tech.andrefsramos.cptools.core.exception.PlatformException;
import tech.andrefsramos.cptools.core.ports.CookieSourcePort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/*
 * Purpose

 * Finds the browser that holds a session for a domain.

 * How it works

 * Candidates in order: the configured browser, the system default browser, then every known
 * store in priority order (zen, firefox, librewolf, chrome, chromium, edge, brave, opera,
 * vivaldi). The first non-empty cookie set wins. A configured browser without cookies does
 * not stop the search.
 */
public class BrowserCookieExtractor implements CookieSourcePort {
    private static final Logger log = LoggerFactory.getLogger(BrowserCookieExtractor.class);

    private final Map<String, BrowserCookieStore> stores;
    private final DefaultBrowserDetector defaultBrowser;
    private final String preferredBrowser;

    public BrowserCookieExtractor(List<BrowserCookieStore> stores,
                                  DefaultBrowserDetector defaultBrowser,
                                  String preferredBrowser) {
        this.stores = new LinkedHashMap<>();
        for (BrowserCookieStore s : stores) {
            this.stores.put(s.name(), s);
        }
        this.defaultBrowser = defaultBrowser;
        this.preferredBrowser = preferredBrowser == null ? "" : preferredBrowser.trim().toLowerCase(Locale.ROOT);

        if (!this.preferredBrowser.isEmpty() && !this.stores.containsKey(this.preferredBrowser)) {
            log.warn("[Cookies] unknown preferred browser '{}'; known: {}", this.preferredBrowser, this.stores.keySet());
        }
    }

    @Override
    public BrowserCookies extract(String domain) {
        final long t0 = System.nanoTime();

        for (String browser : candidates()) {
            Map<String, String> cookies = stores.get(browser).read(domain);
            if (!cookies.isEmpty()) {
                log.info("[Cookies] using {} for {} cookies={} ({} ms)",
                        browser, domain, cookies.size(), (System.nanoTime() - t0) / 1_000_000);
                return new BrowserCookies(browser, cookies);
            }
        }

        log.warn("[Cookies] no browser has cookies for {}", domain);
        throw new PlatformException("No cookies found for " + domain
                + ". Log in to " + domain + " with Firefox or a Chromium-based browser and try again.");
    }

    List<String> candidates() {
        List<String> out = new ArrayList<>();
        if (stores.containsKey(preferredBrowser)) {
            out.add(preferredBrowser);
        }

        Optional<String> system = defaultBrowser != null ? defaultBrowser.detect() : Optional.empty();
        system.filter(stores::containsKey)
                .filter(b -> !out.contains(b))
                .ifPresent(out::add);

        for (String b : stores.keySet()) {
            if (!out.contains(b)) out.add(b);
        }
        return out;
    }
}
