package pepfrag.error;

public class InvalidChargeException extends PredictionException {

    public InvalidChargeException(String message) {
        super(ErrorKind.INVALID_CHARGE, message);
    }
}
