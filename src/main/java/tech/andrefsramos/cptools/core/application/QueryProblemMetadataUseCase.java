package tech.andrefsramos.cptools.core.application;

import tech.andrefsramos.cptools.core.domain.ProblemInfo;

import java.util.List;
import java.util.Optional;

public interface QueryProblemMetadataUseCase {
    Optional<String> problemName(String problemUrl);
    List<ProblemInfo> contestProblems(String contestUrl);
}
