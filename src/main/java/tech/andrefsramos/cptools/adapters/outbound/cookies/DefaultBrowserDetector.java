package tech.andrefsramos.cptools.adapters.outbound.cookies;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/*
 * System default browser on Linux desktops, through "xdg-settings get default-web-browser".
 * The .desktop entry it prints is mapped to one of the known cookie stores.
 */
public class DefaultBrowserDetector {
    private static final Logger log = LoggerFactory.getLogger(DefaultBrowserDetector.class);

    private static final long TIMEOUT_SECONDS = 2;

    public Optional<String> detect() {
        try {
            Process p = new ProcessBuilder("xdg-settings", "get", "default-web-browser")
                    .redirectErrorStream(true)
                    .start();
            if (!p.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                log.debug("[Cookies] xdg-settings timed out");
                return Optional.empty();
            }
            String out;
            try (InputStream in = p.getInputStream()) {
                out = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            }
            if (p.exitValue() != 0) {
                log.debug("[Cookies] xdg-settings exit={} output={}", p.exitValue(), out);
                return Optional.empty();
            }
            Optional<String> browser = browserForDesktopEntry(out);
            log.debug("[Cookies] default browser entry={} mapped={}", out, browser.orElse("-"));
            return browser;
        } catch (IOException e) {
            log.debug("[Cookies] xdg-settings unavailable: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /** Maps e.g. "google-chrome.desktop" to "chrome"; chromium is checked before chrome. */
    static Optional<String> browserForDesktopEntry(String entry) {
        if (entry == null || entry.isBlank()) return Optional.empty();
        String e = entry.toLowerCase(Locale.ROOT);

        if (e.contains("zen")) return Optional.of("zen");
        if (e.contains("librewolf")) return Optional.of("librewolf");
        if (e.contains("firefox")) return Optional.of("firefox");
        if (e.contains("chromium")) return Optional.of("chromium");
        if (e.contains("chrome")) return Optional.of("chrome");
        if (e.contains("edge")) return Optional.of("edge");
        if (e.contains("brave")) return Optional.of("brave");
        if (e.contains("opera")) return Optional.of("opera");
        if (e.contains("vivaldi")) return Optional.of("vivaldi");
        return Optional.empty();
    }
}
