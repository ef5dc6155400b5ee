package tech.andrefsramos.cptools.core.ports;

import tech.andrefsramos.cptools.core.domain.SampleTest;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface ProblemFilePort {
    boolean exists(Path directory, String problem);
    Optional<String> readLink(Path directory, String problem);
    int saveSamples(Path directory, String problem, List<SampleTest> samples);
}
