package pepfrag.error;

/**
 * The feature schema of an encoded peptide does not match the schema a model was trained on.
 */
public class ModelMismatchException extends PredictionException {

    public ModelMismatchException(String message) {
        super(ErrorKind.MODEL_MISMATCH, message);
    }
}
