package tech.andrefsramos.cptools.core.domain;

public record ProblemFetchResult(
        String problem,
        FetchOutcome outcome,
        int samples,
        String message
) {
    public static ProblemFetchResult saved(String problem, int samples) {
        return new ProblemFetchResult(problem, FetchOutcome.SAVED, samples, samples + " sample(s) saved");
    }

    public static ProblemFetchResult of(String problem, FetchOutcome outcome, String message) {
        return new ProblemFetchResult(problem, outcome, 0, message);
    }

    public boolean isSaved() {
        return outcome == FetchOutcome.SAVED;
    }
}
