package tech.andrefsramos.cptools.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.core.application.DetectJudgeUseCase;
import tech.andrefsramos.cptools.core.application.FetchSamplesUseCase;
import tech.andrefsramos.cptools.core.domain.FetchOutcome;
import tech.andrefsramos.cptools.core.domain.FetchReport;
import tech.andrefsramos.cptools.core.domain.ProblemFetchResult;
import tech.andrefsramos.cptools.core.domain.SampleTest;
import tech.andrefsramos.cptools.core.exception.NetworkException;
import tech.andrefsramos.cptools.core.exception.PlatformException;
import tech.andrefsramos.cptools.core.ports.JudgePort;
import tech.andrefsramos.cptools.core.ports.ProblemFilePort;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/*
 * Purpose

 * Backs "fetch <problem|range> [directory]":
 *  1) Reads the Link: field of <problem>.cpp.
 *  2) Resolves the judge through {@link DetectJudgeUseCase}.
 *  3) Fetches the samples and writes <problem>_<n>.in / .out.

 * Problems are processed one at a time. A failure on one problem is recorded and the loop
 * moves on; an interrupt stops the loop between problems and marks the rest as cancelled.
 */
public class FetchSamplesService implements FetchSamplesUseCase {
    private static final Logger log = LoggerFactory.getLogger(FetchSamplesService.class);

    private final DetectJudgeUseCase router;
    private final ProblemFilePort files;

    public FetchSamplesService(DetectJudgeUseCase router, ProblemFilePort files) {
        this.router = router;
        this.files = files;
    }

    @Override
    public ProblemFetchResult fetchProblem(String problem, Path directory) {
        final long t0 = System.nanoTime();
        final String filename = problem + ".cpp";

        if (!files.exists(directory, problem)) {
            log.warn("[Fetch] {} not found in {}", filename, directory);
            return ProblemFetchResult.of(problem, FetchOutcome.MISSING_FILE, filename + " not found");
        }

        Optional<String> link = files.readLink(directory, problem);
        if (link.isEmpty() || link.get().isBlank()) {
            log.warn("[Fetch] {} has no Link", filename);
            return ProblemFetchResult.of(problem, FetchOutcome.NO_LINK, filename + " has no Link");
        }
        final String url = link.get();

        Optional<JudgePort> judge = router.detectJudge(url);
        if (judge.isEmpty()) {
            log.warn("[Fetch] unsupported platform problem={} url={}", problem, url);
            return ProblemFetchResult.of(problem, FetchOutcome.UNSUPPORTED, "Unsupported platform for " + filename);
        }

        final JudgePort j = judge.get();
        try {
            Optional<List<SampleTest>> samples = j.fetchSamples(url);
            if (samples.isEmpty() || samples.get().isEmpty()) {
                log.warn("[Fetch] no samples problem={} judge={} url={}", problem, j.platformName(), url);
                return ProblemFetchResult.of(problem, FetchOutcome.NO_SAMPLES, "No samples found for " + filename);
            }

            int count = files.saveSamples(directory, problem, samples.get());
            log.info("[Fetch] problem={} judge={} saved={} ({} ms)",
                    problem, j.platformName(), count, durMs(t0, System.nanoTime()));
            return ProblemFetchResult.saved(problem, count);
        } catch (PlatformException | NetworkException e) {
            log.error("[Fetch] problem={} judge={} failed: {}", problem, j.platformName(), e.getMessage());
            return ProblemFetchResult.of(problem, FetchOutcome.FAILED, e.getMessage());
        } catch (UncheckedIOException e) {
            log.error("[Fetch] problem={} could not write samples: {}", problem, e.getMessage(), e);
            return ProblemFetchResult.of(problem, FetchOutcome.FAILED, "Could not write samples: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Fetch] problem={} judge={} unexpected failure: {}", problem, j.platformName(), e.getMessage(), e);
            return ProblemFetchResult.of(problem, FetchOutcome.FAILED, "Unexpected error: " + e.getMessage());
        }
    }

    @Override
    public FetchReport fetchAll(List<String> problems, Path directory, Consumer<ProblemFetchResult> onResult) {
        final long t0 = System.nanoTime();
        final List<String> todo = problems != null ? problems : List.of();
        final Consumer<ProblemFetchResult> sink = onResult != null ? onResult : r -> { };

        log.info("[FetchAll] start problems={} directory={}", todo, directory);

        List<ProblemFetchResult> results = new ArrayList<>(todo.size());
        boolean cancelled = false;

        for (String p : todo) {
            if (!cancelled && Thread.currentThread().isInterrupted()) {
                log.warn("[FetchAll] interrupted; remaining problems are skipped.");
                cancelled = true;
            }

            ProblemFetchResult r = cancelled
                    ? ProblemFetchResult.of(p, FetchOutcome.CANCELLED, "cancelled")
                    : fetchProblem(p, directory);
            results.add(r);
            sink.accept(r);
        }

        FetchReport report = new FetchReport(results);
        log.info("[FetchAll] end fetched={}/{} ({} ms)", report.fetched(), report.total(), durMs(t0, System.nanoTime()));
        return report;
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
