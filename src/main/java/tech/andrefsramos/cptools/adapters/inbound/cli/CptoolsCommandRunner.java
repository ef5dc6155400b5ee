package tech.andrefsramos.cptools.adapters.inbound.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import tech.andrefsramos.cptools.core.application.FetchSamplesUseCase;
import tech.andrefsramos.cptools.core.application.QueryProblemMetadataUseCase;
import tech.andrefsramos.cptools.core.application.impl.CookieCacheService;
import tech.andrefsramos.cptools.core.domain.FetchReport;
import tech.andrefsramos.cptools.core.domain.ProblemFetchResult;
import tech.andrefsramos.cptools.core.domain.ProblemInfo;
import tech.andrefsramos.cptools.core.domain.ProblemRange;
import tech.andrefsramos.cptools.core.exception.FetchException;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * CptoolsCommandRunner

 * Entry point of the command line. The first non-option argument selects the command:
 * - fetch &lt;problem|range&gt; [directory]: download the samples of each problem;
 * - name &lt;url&gt;: print the problem name;
 * - contest &lt;url&gt;: print "index  name" for every problem of the contest;
 * - clear-cookies: drop the cached browser cookies.

 * User-facing lines go to the given stream; diagnostics go to the log.
 * The exit code is exposed through {@link ExitCodeGenerator}.
 */
public class CptoolsCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CptoolsCommandRunner.class);

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: cptools <command> [args]",
            "  fetch <problem(s)> [directory]   e.g. fetch A, fetch A~E, fetch A,C",
            "  name <problem-url>",
            "  contest <contest-url>",
            "  clear-cookies");

    private final FetchSamplesUseCase fetchSamples;
    private final QueryProblemMetadataUseCase metadata;
    private final CookieCacheService cookieCache;
    private final PrintStream out;

    private int exitCode;

    public CptoolsCommandRunner(FetchSamplesUseCase fetchSamples,
                                QueryProblemMetadataUseCase metadata,
                                CookieCacheService cookieCache,
                                PrintStream out) {
        this.fetchSamples = fetchSamples;
        this.metadata = metadata;
        this.cookieCache = cookieCache;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> argv = args.getNonOptionArgs();
        if (argv.isEmpty()) {
            out.println(USAGE);
            exitCode = 1;
            return;
        }

        final String command = argv.get(0);
        final List<String> rest = argv.subList(1, argv.size());
        final long t0 = System.nanoTime();
        log.info("[CLI] command={} args={}", command, rest);

        try {
            exitCode = switch (command) {
                case "fetch" -> fetch(rest);
                case "name" -> name(rest);
                case "contest" -> contest(rest);
                case "clear-cookies" -> clearCookies();
                default -> {
                    out.println("Unknown command: " + command);
                    out.println(USAGE);
                    yield 1;
                }
            };
        } catch (FetchException e) {
            log.error("[CLI] command={} failed: {}", command, e.getMessage(), e);
            out.println("Error: " + e.getMessage());
            exitCode = 1;
        }

        log.info("[CLI] command={} exitCode={} ({} ms)", command, exitCode, (System.nanoTime() - t0) / 1_000_000);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int fetch(List<String> args) {
        if (args.isEmpty()) {
            out.println("Usage: cptools fetch <problem(s)> [directory]");
            out.println("  Examples: cptools fetch A, cptools fetch A~E");
            return 1;
        }

        List<String> problems = ProblemRange.parse(args.get(0));
        Path directory = Path.of(args.size() > 1 ? args.get(1) : ".").toAbsolutePath().normalize();

        out.println("--- Fetching Samples ---");
        out.println();
        FetchReport report = fetchSamples.fetchAll(problems, directory, this::printResult);
        out.println();
        out.println("Fetched " + report.fetched() + "/" + report.total() + " problem(s).");

        return report.fetched() > 0 || report.total() == 0 ? 0 : 1;
    }

    int name(List<String> args) {
        if (args.isEmpty()) {
            out.println("Usage: cptools name <problem-url>");
            return 1;
        }

        Optional<String> name = metadata.problemName(args.get(0));
        if (name.isEmpty()) {
            out.println("Could not determine the problem name for " + args.get(0));
            return 1;
        }
        out.println(name.get());
        return 0;
    }

    int contest(List<String> args) {
        if (args.isEmpty()) {
            out.println("Usage: cptools contest <contest-url>");
            return 1;
        }

        List<ProblemInfo> problems = metadata.contestProblems(args.get(0));
        if (problems.isEmpty()) {
            out.println("No problems found for " + args.get(0));
            return 1;
        }
        for (ProblemInfo p : problems) {
            out.println(p.index() + "  " + p.name());
        }
        return 0;
    }

    int clearCookies() {
        cookieCache.clear();
        out.println("Cookie cache cleared.");
        return 0;
    }

    private void printResult(ProblemFetchResult r) {
        if (r.isSaved()) {
            out.println("  + " + r.problem() + ": " + r.message());
        } else {
            out.println("  ! " + r.message());
        }
    }
}
