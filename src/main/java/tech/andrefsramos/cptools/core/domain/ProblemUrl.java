package tech.andrefsramos.cptools.core.domain;

public record ProblemUrl(
        String platformDir,
        String contestId,
        String letter,
        String filename,
        String link,
        String fetchPlatform
) {}
