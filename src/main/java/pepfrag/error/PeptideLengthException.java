package pepfrag.error;

public class PeptideLengthException extends PredictionException {

    public PeptideLengthException(String message) {
        super(ErrorKind.LENGTH, message);
    }
}
