package tech.andrefsramos.cptools.core.exception;

public class FetchException extends RuntimeException {
    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable e) {
        super(message, e);
    }
}
