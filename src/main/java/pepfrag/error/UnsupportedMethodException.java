package pepfrag.error;

/**
 * No ion type mapping exists for the requested fragmentation method.
 */
public class UnsupportedMethodException extends PredictionException {

    public UnsupportedMethodException(String message) {
        super(ErrorKind.UNSUPPORTED_METHOD, message);
    }
}
