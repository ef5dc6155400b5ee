package tech.andrefsramos.cptools.adapters.outbound.judges;

import org.springframework.stereotype.Component;
import tech.andrefsramos.cptools.core.domain.SampleTest;
import tech.andrefsramos.cptools.core.ports.JudgePort;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/*
 * Library Checker (judge.yosupo.jp). Nothing is requested: the name is derived from the
 * problem slug (point_add_range_sum -> Point Add Range Sum) and samples are not scraped.
 */
@Component
public class YosupoJudgeAdapter implements JudgePort {

    private static final String DOMAIN = "judge.yosupo.jp";

    @Override
    public String platformName() {
        return "Yosupo";
    }

    @Override
    public boolean requiresAuth() {
        return false;
    }

    @Override
    public boolean detect(String url) {
        return AbstractJudgeAdapter.hostMatches(url, DOMAIN);
    }

    @Override
    public Optional<String> fetchProblemName(String contestId, String problemId) {
        if (problemId == null || problemId.isBlank()) return Optional.empty();
        return Optional.of(titleCase(problemId));
    }

    @Override
    public Map<String, String> fetchContestProblems(String contestId) {
        return Map.of();
    }

    @Override
    public Optional<List<SampleTest>> fetchSamples(String url) {
        return Optional.empty();
    }

    static String titleCase(String slug) {
        StringBuilder sb = new StringBuilder(slug.length());
        for (String word : slug.trim().split("[_\\-\\s]+")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
              .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
