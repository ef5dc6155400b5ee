package tech.andrefsramos.cptools.adapters.outbound.judges;

import org.springframework.stereotype.Component;
import tech.andrefsramos.cptools.core.domain.SampleTest;
import tech.andrefsramos.cptools.core.ports.JudgePort;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/*
 * vJudge (vjudge.net). Recognised so contest URLs resolve, but it mirrors other judges and
 * exposes no stable API: no metadata and no samples.
 */
@Component
public class VJudgeJudgeAdapter implements JudgePort {

    private static final String DOMAIN = "vjudge.net";

    @Override
    public String platformName() {
        return "vJudge";
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
        return Optional.empty();
    }

    @Override
    public Map<String, String> fetchContestProblems(String contestId) {
        return Map.of();
    }

    @Override
    public Optional<List<SampleTest>> fetchSamples(String url) {
        return Optional.empty();
    }
}
