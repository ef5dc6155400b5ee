package tech.andrefsramos.cptools.core.application;

import tech.andrefsramos.cptools.core.ports.JudgePort;

import java.util.List;
import java.util.Optional;

public interface DetectJudgeUseCase {
    Optional<JudgePort> detectJudge(String url);
    List<JudgePort> judges();
}
