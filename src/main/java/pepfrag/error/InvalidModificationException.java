package pepfrag.error;

/**
 * A modification that is unknown, malformed or placed on an incompatible position.
 */
public class InvalidModificationException extends PredictionException {

    public InvalidModificationException(String message) {
        super(ErrorKind.INVALID_MODIFICATION, message);
    }
}
