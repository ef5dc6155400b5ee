package tech.andrefsramos.cptools.core.ports;

import tech.andrefsramos.cptools.core.domain.SampleTest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One online judge: its URL patterns and how its metadata and samples are retrieved.
 *
 * <p>Soft failures (network errors, unexpected markup, unsupported features) come back as
 * empty results. Only {@link tech.andrefsramos.cptools.core.exception.PlatformException}
 * escapes, when authentication is exhausted or no browser cookies exist.
 */
public interface JudgePort {

    String platformName();

    boolean requiresAuth();

    boolean detect(String url);

    /** Group, organization or otherwise private pages. */
    default boolean isPrivateUrl(String url) {
        return false;
    }

    default boolean needsAuthentication(String url) {
        return requiresAuth() || isPrivateUrl(url);
    }

    Optional<String> fetchProblemName(String contestId, String problemId);

    /** Index to name, in contest order; empty when unavailable. */
    Map<String, String> fetchContestProblems(String contestId);

    /**
     * @return empty when samples are unavailable or the fetch failed; a present empty list
     *         when the page was fetched but carries no samples
     */
    Optional<List<SampleTest>> fetchSamples(String url);
}
