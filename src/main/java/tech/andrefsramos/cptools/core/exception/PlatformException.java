package tech.andrefsramos.cptools.core.exception;

/**
 * Terminal failure for one fetch: authentication exhausted, or no browser holds
 * cookies for the judge. The message tells the user what to do.
 */
public class PlatformException extends FetchException {
    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable e) {
        super(message, e);
    }
}
