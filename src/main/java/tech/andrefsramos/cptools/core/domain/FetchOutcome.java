package tech.andrefsramos.cptools.core.domain;

public enum FetchOutcome {
    SAVED,
    MISSING_FILE,
    NO_LINK,
    UNSUPPORTED,
    NO_SAMPLES,
    FAILED,
    CANCELLED
}
