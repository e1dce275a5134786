package pepfrag.ai;

import pepfrag.dia.IonPrediction;
import pepfrag.dia.PredictedSpectrum;
import pepfrag.dia.SpectrumAssembler;
import pepfrag.error.PredictionException;
import pepfrag.input.PeptideRecord;
import pepfrag.input.PeptideResolver;
import pepfrag.input.ResolvedPeptide;

import java.util.List;

/**
 * The per-peptide pipeline: resolve, encode, predict, assemble. Holds only read-only
 * collaborators, so one instance serves all workers.
 */
public final class SpectrumPredictor {

    private final PeptideResolver resolver;
    private final PeptideEncoder encoder;
    private final PredictionEngine engine;
    private final SpectrumAssembler assembler;

    public SpectrumPredictor(PeptideResolver resolver, PeptideEncoder encoder, PredictionEngine engine, SpectrumAssembler assembler){
        this.resolver = resolver;
        this.encoder = encoder;
        this.engine = engine;
        this.assembler = assembler;
    }

    public PeptideResolver getResolver() {
        return resolver;
    }

    public SpectrumAssembler getAssembler() {
        return assembler;
    }

    /**
     * Predict the spectrum of one peptide. Validation errors are reported before an unknown
     * method, so an invalid peptide is always reported as invalid.
     */
    public PredictedSpectrum predict(PeptideRecord record, String method) throws PredictionException {
        ResolvedPeptide peptide = resolver.resolve(record);
        return predict(peptide, FragmentationMethod.fromName(method));
    }

    public PredictedSpectrum predict(ResolvedPeptide peptide, FragmentationMethod method) throws PredictionException {
        FeatureMatrix matrix = encoder.encode(peptide, method);
        List<IonPrediction> predictions = engine.predict(matrix, method);
        return assembler.assemble(peptide, method, predictions);
    }
}
