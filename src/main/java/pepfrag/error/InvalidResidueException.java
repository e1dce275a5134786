package pepfrag.error;

/**
 * A residue symbol that is not in the residue table.
 */
public class InvalidResidueException extends PredictionException {

    public InvalidResidueException(String message) {
        super(ErrorKind.INVALID_RESIDUE, message);
    }
}
