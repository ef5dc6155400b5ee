package tech.andrefsramos.cptools.core.domain;

import java.util.Map;

/** Cookies read from one local browser for one domain. */
public record BrowserCookies(String browser, Map<String, String> cookies) {

    public BrowserCookies {
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    }

    public boolean isEmpty() {
        return cookies.isEmpty();
    }
}
