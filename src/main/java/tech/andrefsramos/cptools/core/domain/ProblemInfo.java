package tech.andrefsramos.cptools.core.domain;

public record ProblemInfo(
        String index,
        String name,
        String link
) {}
