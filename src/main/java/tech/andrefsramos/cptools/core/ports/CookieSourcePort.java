package tech.andrefsramos.cptools.core.ports;

import tech.andrefsramos.cptools.core.domain.BrowserCookies;

public interface CookieSourcePort {

    /**
     * Reads the session cookies a local browser holds for {@code domain}.
     *
     * @throws tech.andrefsramos.cptools.core.exception.PlatformException when no browser yields any
     */
    BrowserCookies extract(String domain);
}
