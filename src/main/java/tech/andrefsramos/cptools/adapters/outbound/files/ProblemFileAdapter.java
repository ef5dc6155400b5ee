package tech.andrefsramos.cptools.adapters.outbound.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.cptools.core.domain.SampleTest;
import tech.andrefsramos.cptools.core.ports.ProblemFilePort;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Solution files and sample files of one problem directory.
 *
 * <problem>.cpp carries its URL in a header comment line "Link: <url>", within the first
 * 500 characters. Samples are written as <problem>_<n>.in (input plus a trailing newline)
 * and, when the expected output is not empty, <problem>_<n>.out; n starts at 1.
 */
public class ProblemFileAdapter implements ProblemFilePort {
    private static final Logger log = LoggerFactory.getLogger(ProblemFileAdapter.class);

    static final int HEADER_CHARS = 500;
    private static final Pattern LINK = Pattern.compile("Link:\\s*(\\S+)");

    @Override
    public boolean exists(Path directory, String problem) {
        return Files.isRegularFile(source(directory, problem));
    }

    @Override
    public Optional<String> readLink(Path directory, String problem) {
        Path src = source(directory, problem);
        try (Reader in = Files.newBufferedReader(src, StandardCharsets.UTF_8)) {
            char[] buf = new char[HEADER_CHARS];
            int n = 0;
            int r;
            while (n < buf.length && (r = in.read(buf, n, buf.length - n)) > 0) {
                n += r;
            }
            Matcher m = LINK.matcher(new String(buf, 0, n));
            return m.find() ? Optional.of(m.group(1)) : Optional.empty();
        } catch (IOException e) {
            log.warn("[Files] could not read header of {}: {}", src, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public int saveSamples(Path directory, String problem, List<SampleTest> samples) {
        int i = 0;
        try {
            for (SampleTest s : samples) {
                i++;
                Path in = directory.resolve(problem + "_" + i + ".in");
                Files.writeString(in, s.input() + "\n", StandardCharsets.UTF_8);
                if (s.hasOutput()) {
                    Path out = directory.resolve(problem + "_" + i + ".out");
                    Files.writeString(out, s.output() + "\n", StandardCharsets.UTF_8);
                }
            }
            log.debug("[Files] {} sample(s) written for {} in {}", i, problem, directory);
            return i;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write sample " + i + " of " + problem, e);
        }
    }

    private static Path source(Path directory, String problem) {
        return directory.resolve(problem + ".cpp");
    }
}
