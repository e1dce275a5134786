package pepfrag.error;

/**
 * The model registry could not be initialized. Fatal at start-up, never reported per peptide.
 */
public class ModelLoadException extends PredictionException {

    public ModelLoadException(String message) {
        super(ErrorKind.MODEL_LOAD, message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(ErrorKind.MODEL_LOAD, message, cause);
    }
}
