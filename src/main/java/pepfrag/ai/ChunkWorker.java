package pepfrag.ai;

import pepfrag.error.ErrorKind;
import pepfrag.error.PredictionException;
import pepfrag.input.PeptideRecord;
import pepfrag.util.PLogger;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the pipeline over one chunk of peptides. Results are returned as a whole when the
 * chunk finishes; a failure of one peptide becomes that peptide's error result.
 */
final class ChunkWorker implements Callable<PeptideResult[]> {

    private final int chunkIndex;
    private final List<PeptideRecord> peptides;
    private final String method;
    private final SpectrumPredictor predictor;
    private final AtomicBoolean cancelled;

    ChunkWorker(int chunkIndex, List<PeptideRecord> peptides, String method, SpectrumPredictor predictor, AtomicBoolean cancelled){
        this.chunkIndex = chunkIndex;
        this.peptides = peptides;
        this.method = method;
        this.predictor = predictor;
        this.cancelled = cancelled;
    }

    @Override
    public PeptideResult[] call() {
        PLogger.getInstance().logger.debug(Thread.currentThread().getName() + ": predicting chunk " + chunkIndex + " (" + peptides.size() + " peptides)");
        PeptideResult[] results = new PeptideResult[peptides.size()];
        int n_error = 0;
        for(int i=0;i<results.length;i++){
            PeptideRecord record = peptides.get(i);
            if(cancelled.get()){
                results[i] = PeptideResult.error(record.getId(), ErrorKind.CANCELLED, "Batch cancelled");
                continue;
            }
            try {
                results[i] = PeptideResult.ok(record.getId(), predictor.predict(record, method));
            } catch (PredictionException e) {
                n_error++;
                results[i] = PeptideResult.error(record.getId(), e);
                PLogger.getInstance().logger.warn(Thread.currentThread().getName() + ": " + record.getId() + " " + e.getKind() + ": " + e.getMessage());
            }
        }
        PLogger.getInstance().logger.debug(Thread.currentThread().getName() + ": chunk " + chunkIndex + " done, " + n_error + " errors");
        return results;
    }
}
