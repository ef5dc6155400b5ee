package tech.andrefsramos.cptools.core.exception;

public class ParsingException extends FetchException {
    public ParsingException(String message) {
        super(message);
    }

    public ParsingException(String message, Throwable e) {
        super(message, e);
    }
}
