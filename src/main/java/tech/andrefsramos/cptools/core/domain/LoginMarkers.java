package tech.andrefsramos.cptools.core.domain;

import java.util.List;
import java.util.Objects;

/**
 * Per-judge substrings whose presence in a response body means the session
 * is missing or expired. Heuristic: a judge may redesign its login page.
 */
public record LoginMarkers(List<String> markers) {

    public LoginMarkers {
        markers = markers == null ? List.of() : markers.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(m -> !m.isEmpty())
                .toList();
    }

    public static LoginMarkers none() {
        return new LoginMarkers(List.of());
    }

    public boolean presentIn(String body) {
        if (body == null || body.isEmpty()) return false;
        for (String m : markers) {
            if (body.contains(m)) return true;
        }
        return false;
    }
}
