package pepfrag.error;

public class ModelNotFoundException extends PredictionException {

    public ModelNotFoundException(String message) {
        super(ErrorKind.MODEL_NOT_FOUND, message);
    }
}
