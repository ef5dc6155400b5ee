package tech.andrefsramos.cptools.core.exception;

/** Transport failure, timeout or non-2xx response. {@code status} is -1 when no response was read. */
public class NetworkException extends FetchException {

    private final int status;

    public NetworkException(String message) {
        this(message, -1);
    }

    public NetworkException(String message, int status) {
        super(message);
        this.status = status;
    }

    public NetworkException(String message, Throwable e) {
        super(message, e);
        this.status = -1;
    }

    public int getStatus() {
        return status;
    }
}
