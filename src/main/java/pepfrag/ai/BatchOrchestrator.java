package pepfrag.ai;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import pepfrag.error.ErrorKind;
import pepfrag.input.PeptideRecord;
import pepfrag.util.PLogger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Splits a peptide list into chunks, predicts the chunks on a fixed thread pool and merges the
 * results by input index. The output has exactly one entry per input peptide, in input order.
 *
 * <p>At most {@code maxPendingChunks} chunks are queued or running at a time; dispatch blocks
 * until a slot frees up. {@link #cancel()} stops dispatch: running chunks finish the peptide
 * they are on, every peptide that was not predicted is reported as {@link ErrorKind#CANCELLED}.
 * Each run has its own cancellation flag; {@code cancel()} sets the flag of every run in
 * progress, or of the next run when none is in progress.
 * A chunk that dies with an unexpected exception reports {@link ErrorKind#WORKER_FAILURE} for
 * each of its peptides and leaves the other chunks alone.
 */
public final class BatchOrchestrator {

    public static final int DEFAULT_CHUNK_SIZE = 1000;

    private final SpectrumPredictor predictor;
    private final int nThreads;
    private final int maxPendingChunks;
    // guarded by this
    private final Set<AtomicBoolean> activeRuns = new HashSet<>();
    private boolean cancelPending = false;

    public BatchOrchestrator(SpectrumPredictor predictor, int nThreads, int maxPendingChunks){
        if(nThreads < 1 || maxPendingChunks < 1){
            throw new IllegalArgumentException("Thread count and pending chunk limit must be positive");
        }
        this.predictor = predictor;
        this.nThreads = nThreads;
        this.maxPendingChunks = maxPendingChunks;
    }

    public BatchOrchestrator(SpectrumPredictor predictor, int nThreads){
        this(predictor, nThreads, 2 * nThreads);
    }

    /**
     * Stop dispatching chunks of the running batches. Without a running batch the next
     * {@link #run} is cancelled before it dispatches anything.
     */
    public synchronized void cancel(){
        if(activeRuns.isEmpty()){
            cancelPending = true;
        }
        for(AtomicBoolean cancelled : activeRuns){
            cancelled.set(true);
        }
        PLogger.getInstance().logger.warn("Batch cancellation requested");
    }

    public synchronized boolean isCancelled(){
        if(cancelPending){
            return true;
        }
        for(AtomicBoolean cancelled : activeRuns){
            if(cancelled.get()){
                return true;
            }
        }
        return false;
    }

    private synchronized AtomicBoolean startRun(){
        AtomicBoolean cancelled = new AtomicBoolean(cancelPending);
        cancelPending = false;
        activeRuns.add(cancelled);
        return cancelled;
    }

    private synchronized void endRun(AtomicBoolean cancelled){
        activeRuns.remove(cancelled);
    }

    /**
     * Predict all peptides.
     *
     * @param method fragmentation method name; an unknown name gives an
     *               {@link ErrorKind#UNSUPPORTED_METHOD} result for every valid peptide
     * @param chunkSize maximum number of peptides per chunk
     */
    public List<PeptideResult> run(List<PeptideRecord> peptides, String method, int chunkSize){
        if(chunkSize < 1){
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        AtomicBoolean cancelled = startRun();
        try {
            return run(peptides, method, chunkSize, cancelled);
        } finally {
            endRun(cancelled);
        }
    }

    private List<PeptideResult> run(List<PeptideRecord> peptides, String method, int chunkSize, AtomicBoolean cancelled){
        long startTime = System.currentTimeMillis();
        PeptideResult[] results = new PeptideResult[peptides.size()];
        List<List<PeptideRecord>> chunks = Lists.partition(peptides, chunkSize);
        PLogger.getInstance().logger.info("Predicting " + peptides.size() + " peptides (" + method + ") in " + chunks.size()
                + " chunks using " + nThreads + " threads");

        ExecutorService fixedThreadPool = Executors.newFixedThreadPool(nThreads,
                new ThreadFactoryBuilder().setNameFormat("pepfrag-worker-%d").setDaemon(true).build());
        Semaphore slots = new Semaphore(maxPendingChunks);
        List<Future<PeptideResult[]>> futures = new ArrayList<>(chunks.size());
        try {
            for(int i=0;i<chunks.size();i++){
                if(cancelled.get()){
                    break;
                }
                try {
                    slots.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancelled.set(true);
                    break;
                }
                if(cancelled.get()){
                    slots.release();
                    break;
                }
                ChunkWorker worker = new ChunkWorker(i, chunks.get(i), method, predictor, cancelled);
                futures.add(fixedThreadPool.submit(() -> {
                    try {
                        return worker.call();
                    } finally {
                        slots.release();
                    }
                }));
            }

            for(int i=0;i<futures.size();i++){
                int offset = i * chunkSize;
                List<PeptideRecord> chunk = chunks.get(i);
                try {
                    PeptideResult[] chunkResults = futures.get(i).get();
                    System.arraycopy(chunkResults, 0, results, offset, chunkResults.length);
                } catch (ExecutionException e) {
                    PLogger.getInstance().logger.error("Chunk " + i + " failed, reporting " + chunk.size() + " peptides as failed", e.getCause());
                    fill(results, offset, chunk, ErrorKind.WORKER_FAILURE, "Worker failure: " + e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancelled.set(true);
                    fixedThreadPool.shutdownNow();
                    for(int j=i;j<futures.size();j++){
                        fill(results, j * chunkSize, chunks.get(j), ErrorKind.CANCELLED, "Batch interrupted");
                    }
                    break;
                }
            }
        } finally {
            fixedThreadPool.shutdown();
        }

        for(int i=futures.size();i<chunks.size();i++){
            fill(results, i * chunkSize, chunks.get(i), ErrorKind.CANCELLED, "Batch cancelled");
        }

        int n_ok = 0;
        for(PeptideResult r : results){
            if(r.isOk()){
                n_ok++;
            }
        }
        PLogger.getInstance().logger.info("Predicted " + n_ok + " of " + results.length + " peptides in " + PLogger.elapsed(startTime)
                + (results.length - n_ok > 0 ? ", " + (results.length - n_ok) + " failed" : ""));
        return Collections.unmodifiableList(Arrays.asList(results));
    }

    private static void fill(PeptideResult[] results, int offset, List<PeptideRecord> chunk, ErrorKind kind, String message){
        for(int j=0;j<chunk.size();j++){
            results[offset + j] = PeptideResult.error(chunk.get(j).getId(), kind, message);
        }
    }
}
