package pepfrag.ai;

import pepfrag.dia.PredictedSpectrum;
import pepfrag.error.ErrorKind;
import pepfrag.error.PredictionException;

/**
 * Outcome for one input peptide: a complete spectrum or an error, never both.
 */
public final class PeptideResult {

    public enum Status {
        OK,
        ERROR
    }

    private final String id;
    private final Status status;
    private final PredictedSpectrum spectrum;
    private final ErrorKind error;
    private final String message;

    private PeptideResult(String id, Status status, PredictedSpectrum spectrum, ErrorKind error, String message){
        this.id = id;
        this.status = status;
        this.spectrum = spectrum;
        this.error = error;
        this.message = message;
    }

    public static PeptideResult ok(String id, PredictedSpectrum spectrum){
        return new PeptideResult(id, Status.OK, spectrum, null, null);
    }

    public static PeptideResult error(String id, ErrorKind error, String message){
        return new PeptideResult(id, Status.ERROR, null, error, message);
    }

    public static PeptideResult error(String id, PredictionException e){
        return error(id, e.getKind(), e.getMessage());
    }

    public String getId() {
        return id;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk(){
        return status == Status.OK;
    }

    /**
     * The spectrum, null for errors.
     */
    public PredictedSpectrum getSpectrum() {
        return spectrum;
    }

    /**
     * The error kind, null for successful predictions.
     */
    public ErrorKind getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isOk() ? id + ": ok" : id + ": " + error + " " + message;
    }
}
