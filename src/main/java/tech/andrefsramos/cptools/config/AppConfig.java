package tech.andrefsramos.cptools.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.andrefsramos.cptools.adapters.inbound.cli.CptoolsCommandRunner;
import tech.andrefsramos.cptools.adapters.outbound.files.ProblemFileAdapter;
import tech.andrefsramos.cptools.adapters.outbound.judges.AtCoderJudgeAdapter;
import tech.andrefsramos.cptools.adapters.outbound.judges.CodeforcesJudgeAdapter;
import tech.andrefsramos.cptools.adapters.outbound.judges.CsesJudgeAdapter;
import tech.andrefsramos.cptools.adapters.outbound.judges.VJudgeJudgeAdapter;
import tech.andrefsramos.cptools.adapters.outbound.judges.YosupoJudgeAdapter;
import tech.andrefsramos.cptools.core.application.DetectJudgeUseCase;
import tech.andrefsramos.cptools.core.application.FetchSamplesUseCase;
import tech.andrefsramos.cptools.core.application.QueryProblemMetadataUseCase;
import tech.andrefsramos.cptools.core.application.impl.CookieCacheService;
import tech.andrefsramos.cptools.core.application.impl.FetchSamplesService;
import tech.andrefsramos.cptools.core.application.impl.JudgeRouterService;
import tech.andrefsramos.cptools.core.application.impl.QueryProblemMetadataService;
import tech.andrefsramos.cptools.core.ports.JudgePort;
import tech.andrefsramos.cptools.core.ports.ProblemFilePort;

import java.util.List;
import java.util.Objects;

/*
 * Purpose

 * Composes the use cases and ports with explicit constructor dependencies.

 * Beans

 * - DetectJudgeUseCase: the judge registry. The order is fixed here and is the tie-break
 *   when more than one judge could match: Codeforces, AtCoder, CSES, Yosupo, vJudge.
 * - FetchSamplesUseCase: samples of the problems of a directory, written next to the sources.
 * - QueryProblemMetadataUseCase: problem names and contest problem lists.
 * - CptoolsCommandRunner: the command line, printing to standard output.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /* ============================= DetectJudgeUseCase ============================= */

    @Bean
    DetectJudgeUseCase detectJudgeUseCase(
            CodeforcesJudgeAdapter codeforces,
            AtCoderJudgeAdapter atCoder,
            CsesJudgeAdapter cses,
            YosupoJudgeAdapter yosupo,
            VJudgeJudgeAdapter vJudge
    ) {
        final long t0 = System.nanoTime();
        try {
            List<JudgePort> ordered = List.of(codeforces, atCoder, cses, yosupo, vJudge);
            DetectJudgeUseCase bean = new JudgeRouterService(ordered);

            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] DetectJudgeUseCase ready (judges={}) tookMs={}ms",
                    ordered.stream().map(JudgePort::platformName).toList(), tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Error creating DetectJudgeUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= FetchSamplesUseCase ============================= */

    @Bean
    ProblemFilePort problemFilePort() {
        return new ProblemFileAdapter();
    }

    @Bean
    FetchSamplesUseCase fetchSamplesUseCase(DetectJudgeUseCase detectJudgeUseCase, ProblemFilePort problemFilePort) {
        try {
            Objects.requireNonNull(detectJudgeUseCase, "detectJudgeUseCase is required");
            Objects.requireNonNull(problemFilePort, "problemFilePort is required");

            FetchSamplesUseCase bean = new FetchSamplesService(detectJudgeUseCase, problemFilePort);
            log.info("[AppConfig] FetchSamplesUseCase ready");
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Error creating FetchSamplesUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= QueryProblemMetadataUseCase ============================= */

    @Bean
    QueryProblemMetadataUseCase queryProblemMetadataUseCase(DetectJudgeUseCase detectJudgeUseCase) {
        QueryProblemMetadataUseCase bean = new QueryProblemMetadataService(detectJudgeUseCase);
        log.info("[AppConfig] QueryProblemMetadataUseCase ready");
        return bean;
    }

    /* ============================= CLI ============================= */

    @Bean
    CptoolsCommandRunner cptoolsCommandRunner(
            FetchSamplesUseCase fetchSamplesUseCase,
            QueryProblemMetadataUseCase queryProblemMetadataUseCase,
            CookieCacheService cookieCacheService
    ) {
        return new CptoolsCommandRunner(fetchSamplesUseCase, queryProblemMetadataUseCase, cookieCacheService, System.out);
    }
}
