package tech.andrefsramos.cptools.adapters.outbound.cookies;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.cptools.core.domain.BrowserCookies;
import tech.andrefsramos.cptools.core.exception.PlatformException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BrowserCookieExtractorTest {

    private static final String DOMAIN = "codeforces.com";

    @Mock
    private DefaultBrowserDetector detector;

    private final List<String> reads = new ArrayList<>();

    private BrowserCookieStore store(String name, Map<String, String> cookies) {
        return new BrowserCookieStore() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Map<String, String> read(String domain) {
                reads.add(name);
                return cookies;
            }
        };
    }

    private List<BrowserCookieStore> stores(Map<String, String> firefox, Map<String, String> chrome, Map<String, String> brave) {
        return List.of(store("firefox", firefox), store("chrome", chrome), store("brave", brave));
    }

    @Test
    void extract_preferredBrowserFirst() {
        when(detector.detect()).thenReturn(Optional.of("chrome"));
        BrowserCookieExtractor extractor = new BrowserCookieExtractor(
                stores(Map.of("a", "ff"), Map.of("a", "ch"), Map.of("a", "br")), detector, "Brave");

        BrowserCookies cookies = extractor.extract(DOMAIN);

        assertThat(cookies.browser()).isEqualTo("brave");
        assertThat(reads).containsExactly("brave");
    }

    @Test
    void extract_preferredEmpty_fallsBackToSystemDefaultThenPriority() {
        when(detector.detect()).thenReturn(Optional.of("chrome"));
        BrowserCookieExtractor extractor = new BrowserCookieExtractor(
                stores(Map.of("a", "ff"), Map.of(), Map.of()), detector, "brave");

        BrowserCookies cookies = extractor.extract(DOMAIN);

        assertThat(cookies.browser()).isEqualTo("firefox");
        assertThat(cookies.cookies()).containsEntry("a", "ff");
        assertThat(reads).containsExactly("brave", "chrome", "firefox");
    }

    @Test
    void extract_noPreference_priorityOrder() {
        when(detector.detect()).thenReturn(Optional.empty());
        BrowserCookieExtractor extractor = new BrowserCookieExtractor(
                stores(Map.of(), Map.of("a", "ch"), Map.of("a", "br")), detector, "");

        assertThat(extractor.extract(DOMAIN).browser()).isEqualTo("chrome");
        assertThat(reads).containsExactly("firefox", "chrome");
    }

    @Test
    void extract_unknownPreferredAndDefault_ignored() {
        when(detector.detect()).thenReturn(Optional.of("netscape"));
        BrowserCookieExtractor extractor = new BrowserCookieExtractor(
                stores(Map.of(), Map.of(), Map.of("a", "br")), detector, "lynx");

        assertThat(extractor.extract(DOMAIN).browser()).isEqualTo("brave");
        assertThat(reads).containsExactly("firefox", "chrome", "brave");
    }

    @Test
    void extract_noBrowserHasCookies_platformException() {
        when(detector.detect()).thenReturn(Optional.empty());
        BrowserCookieExtractor extractor = new BrowserCookieExtractor(
                stores(Map.of(), Map.of(), Map.of()), detector, null);

        assertThatThrownBy(() -> extractor.extract(DOMAIN))
                .isInstanceOf(PlatformException.class)
                .hasMessageContaining("Log in to codeforces.com");
    }
}
