package pepfrag.error;

/**
 * Error kinds reported in per-peptide results.
 */
public enum ErrorKind {
    INVALID_RESIDUE,
    INVALID_MODIFICATION,
    LENGTH,
    INVALID_CHARGE,
    UNSUPPORTED_METHOD,
    MODEL_NOT_FOUND,
    MODEL_MISMATCH,
    MODEL_LOAD,
    WORKER_FAILURE,
    CANCELLED
}
