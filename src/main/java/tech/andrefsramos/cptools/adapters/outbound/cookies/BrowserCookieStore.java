package tech.andrefsramos.cptools.adapters.outbound.cookies;

import java.util.Map;

/** One local browser's cookie database. */
public interface BrowserCookieStore {

    String name();

    /**
     * Cookies whose host is {@code domain} or one of its subdomains.
     * A browser that is not installed, or whose store cannot be read, yields an empty map.
     */
    Map<String, String> read(String domain);
}
