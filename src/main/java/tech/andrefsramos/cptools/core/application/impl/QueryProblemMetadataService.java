package tech.andrefsramos.cptools.core.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.core.application.DetectJudgeUseCase;
import tech.andrefsramos.cptools.core.application.QueryProblemMetadataUseCase;
import tech.andrefsramos.cptools.core.domain.ContestUrl;
import tech.andrefsramos.cptools.core.domain.ProblemInfo;
import tech.andrefsramos.cptools.core.domain.ProblemUrl;
import tech.andrefsramos.cptools.core.domain.ProblemUrlParser;
import tech.andrefsramos.cptools.core.ports.JudgePort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RequiredArgsConstructor
public class QueryProblemMetadataService implements QueryProblemMetadataUseCase {
    private static final Logger log = LoggerFactory.getLogger(QueryProblemMetadataService.class);

    private final DetectJudgeUseCase router;

    @Override
    public Optional<String> problemName(String problemUrl) {
        Optional<ProblemUrl> parsed = ProblemUrlParser.parseProblemUrl(problemUrl);
        if (parsed.isEmpty()) {
            log.warn("[Metadata] unrecognized problem url={}", problemUrl);
            return Optional.empty();
        }

        Optional<JudgePort> judge = router.detectJudge(problemUrl);
        if (judge.isEmpty()) {
            return Optional.empty();
        }

        ProblemUrl p = parsed.get();
        return judge.get().fetchProblemName(p.contestId(), p.letter());
    }

    @Override
    public List<ProblemInfo> contestProblems(String contestUrl) {
        Optional<ContestUrl> parsed = ProblemUrlParser.parseContestUrl(contestUrl);
        if (parsed.isEmpty()) {
            log.warn("[Metadata] unrecognized contest url={}", contestUrl);
            return List.of();
        }

        Optional<JudgePort> judge = router.detectJudge(contestUrl);
        if (judge.isEmpty()) {
            return List.of();
        }

        ContestUrl c = parsed.get();
        Map<String, String> problems = judge.get().fetchContestProblems(c.contestId());

        List<ProblemInfo> out = new ArrayList<>(problems.size());
        problems.forEach((index, name) -> out.add(new ProblemInfo(index, name, c.problemLink(index))));
        log.info("[Metadata] contest={} judge={} problems={}", c.contestId(), judge.get().platformName(), out.size());
        return out;
    }
}
