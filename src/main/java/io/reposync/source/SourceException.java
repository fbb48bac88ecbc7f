package io.reposync.source;

/**
 * Failure reported by a source connector, tagged with a host-independent reason.
 *
 * <p>Connectors map their host's status codes onto {@link Reason}; nothing downstream inspects
 * messages.
 */
public class SourceException extends RuntimeException {
    public enum Reason {
        NOT_FOUND,
        UNAUTHORIZED,
        FORBIDDEN,
        ACCOUNT_SUSPENDED,
        RATE_LIMITED,
        UNAVAILABLE
    }

    private final Reason reason;

    public SourceException(Reason reason, String message) {
        super(message);
        this.reason = reason == null ? Reason.UNAVAILABLE : reason;
    }

    public SourceException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason == null ? Reason.UNAVAILABLE : reason;
    }

    public Reason reason() {
        return reason;
    }

    public static SourceException unauthorized() {
        return new SourceException(Reason.UNAUTHORIZED, "bad credentials");
    }

    public static SourceException forbidden() {
        return new SourceException(Reason.FORBIDDEN, "forbidden");
    }

    public static SourceException accountSuspended() {
        return new SourceException(Reason.ACCOUNT_SUSPENDED, "account suspended");
    }

    public static SourceException notFound(String what) {
        return new SourceException(Reason.NOT_FOUND, "not found: " + what);
    }
}
