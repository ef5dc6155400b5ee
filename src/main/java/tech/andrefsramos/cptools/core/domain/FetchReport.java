package tech.andrefsramos.cptools.core.domain;

import java.util.List;

public record FetchReport(List<ProblemFetchResult> results) {

    public FetchReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public long fetched() {
        return results.stream().filter(ProblemFetchResult::isSaved).count();
    }

    public int total() {
        return results.size();
    }
}
