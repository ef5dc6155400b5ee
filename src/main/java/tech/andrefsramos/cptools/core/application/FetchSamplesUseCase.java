package tech.andrefsramos.cptools.core.application;

import tech.andrefsramos.cptools.core.domain.FetchReport;
import tech.andrefsramos.cptools.core.domain.ProblemFetchResult;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

public interface FetchSamplesUseCase {
    ProblemFetchResult fetchProblem(String problem, Path directory);
    FetchReport fetchAll(List<String> problems, Path directory, Consumer<ProblemFetchResult> onResult);
}
