package pepfrag.error;

/**
 * Base class of all errors raised by the prediction pipeline. Every instance carries
 * the {@link ErrorKind} reported to the caller.
 */
public class PredictionException extends Exception {

    private final ErrorKind kind;

    public PredictionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PredictionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
