package tech.andrefsramos.cptools.adapters.outbound.http;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.cptools.core.application.impl.CookieCacheService;
import tech.andrefsramos.cptools.core.domain.LoginMarkers;
import tech.andrefsramos.cptools.core.exception.PlatformException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HttpSessionTest {

    private static final String URL = "https://codeforces.com/group/abc/contest/1/problem/A";
    private static final String DOMAIN = "codeforces.com";
    private static final LoginMarkers MARKERS = new LoginMarkers(List.of("id=\"enterForm\""));

    private static final Map<String, String> CACHED = Map.of("JSESSIONID", "old");
    private static final Map<String, String> FRESH = Map.of("JSESSIONID", "new");
    private static final String LOGIN_PAGE = "<form id=\"enterForm\">";
    private static final String PROBLEM_PAGE = "<div class=\"sample-test\"></div>";

    @Mock
    private HttpFetch http;

    @Mock
    private CookieCacheService cookieCache;

    private HttpSession session;

    @BeforeEach
    void setUp() {
        session = new HttpSession(http, cookieCache);
    }

    @Test
    @DisplayName("fetchWithAuthRetry_cleanFirstResponse_noRefresh")
    void fetchWithAuthRetry_cleanFirstResponse_noRefresh() {
        when(cookieCache.getCookies(DOMAIN, false)).thenReturn(CACHED);
        when(http.fetchUrl(eq(URL), anyInt(), eq(CACHED))).thenReturn(PROBLEM_PAGE);

        assertThat(session.fetchWithAuthRetry(URL, DOMAIN, MARKERS)).isEqualTo(PROBLEM_PAGE);
        verify(cookieCache, never()).invalidate(anyString());
        verify(http, times(1)).fetchUrl(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("fetchWithAuthRetry_markerThenClean_exactlyOneRetryWithFreshCookies")
    void fetchWithAuthRetry_markerThenClean_exactlyOneRetryWithFreshCookies() {
        when(cookieCache.getCookies(DOMAIN, false)).thenReturn(CACHED);
        when(cookieCache.getCookies(DOMAIN, true)).thenReturn(FRESH);
        when(http.fetchUrl(eq(URL), anyInt(), eq(CACHED))).thenReturn(LOGIN_PAGE);
        when(http.fetchUrl(eq(URL), anyInt(), eq(FRESH))).thenReturn(PROBLEM_PAGE);

        String body = session.fetchWithAuthRetry(URL, DOMAIN, MARKERS);

        assertThat(body).isEqualTo(PROBLEM_PAGE);
        InOrder order = inOrder(cookieCache, http);
        order.verify(http).fetchUrl(eq(URL), anyInt(), eq(CACHED));
        order.verify(cookieCache).invalidate(DOMAIN);
        order.verify(cookieCache).getCookies(DOMAIN, true);
        order.verify(http).fetchUrl(eq(URL), anyInt(), eq(FRESH));
        verify(http, times(2)).fetchUrl(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("fetchWithAuthRetry_markerTwice_platformExceptionNoThirdRequest")
    void fetchWithAuthRetry_markerTwice_platformExceptionNoThirdRequest() {
        when(cookieCache.getCookies(DOMAIN, false)).thenReturn(CACHED);
        when(cookieCache.getCookies(DOMAIN, true)).thenReturn(FRESH);
        when(http.fetchUrl(eq(URL), anyInt(), any())).thenReturn(LOGIN_PAGE);

        assertThatThrownBy(() -> session.fetchWithAuthRetry(URL, DOMAIN, MARKERS))
                .isInstanceOf(PlatformException.class)
                .hasMessageContaining("Authentication failed for codeforces.com");

        verify(http, times(2)).fetchUrl(anyString(), anyInt(), any());
        verify(cookieCache, times(1)).invalidate(DOMAIN);
    }

    @Test
    @DisplayName("fetchWithAuthRetry_noMarkersConfigured_neverRetries")
    void fetchWithAuthRetry_noMarkersConfigured_neverRetries() {
        when(cookieCache.getCookies(DOMAIN, false)).thenReturn(CACHED);
        when(http.fetchUrl(eq(URL), anyInt(), eq(CACHED))).thenReturn(LOGIN_PAGE);

        assertThat(session.fetchWithAuthRetry(URL, DOMAIN, LoginMarkers.none())).isEqualTo(LOGIN_PAGE);
        verify(cookieCache, never()).invalidate(anyString());
    }

    @Test
    @DisplayName("fetchUrlWithAuth_forceRefresh_passedToCache")
    void fetchUrlWithAuth_forceRefresh_passedToCache() {
        when(cookieCache.getCookies(DOMAIN, true)).thenReturn(FRESH);
        when(http.fetchUrl(eq(URL), anyInt(), eq(FRESH))).thenReturn(PROBLEM_PAGE);

        assertThat(session.fetchUrlWithAuth(URL, DOMAIN, true)).isEqualTo(PROBLEM_PAGE);
    }

    @Test
    @DisplayName("fetchWithAuthRetry_noBrowserCookies_propagates")
    void fetchWithAuthRetry_noBrowserCookies_propagates() {
        when(cookieCache.getCookies(DOMAIN, false)).thenThrow(new PlatformException("No cookies found for codeforces.com"));

        assertThatThrownBy(() -> session.fetchWithAuthRetry(URL, DOMAIN, MARKERS))
                .isInstanceOf(PlatformException.class)
                .hasMessageContaining("No cookies");
        verify(http, never()).fetchUrl(anyString(), anyInt(), any());
    }
}
