package pepfrag.dia;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import pepfrag.ai.FragmentationMethod;
import pepfrag.ai.IonType;
import pepfrag.ai.PeptideEncoder;
import pepfrag.input.ResolvedPeptide;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges ion predictions into a {@link PredictedSpectrum}: canonical order, missing ion
 * policy, then normalization. Stateless apart from its configuration; the same input always
 * gives an equal spectrum.
 */
public final class SpectrumAssembler {

    private final NormalizationMode normalization;
    private final MissingIonPolicy missingIonPolicy;
    private final PeptideEncoder ionCalculator;

    public SpectrumAssembler(NormalizationMode normalization, MissingIonPolicy missingIonPolicy, PeptideEncoder ionCalculator){
        this.normalization = normalization;
        this.missingIonPolicy = missingIonPolicy;
        this.ionCalculator = ionCalculator;
    }

    public SpectrumAssembler(NormalizationMode normalization, MissingIonPolicy missingIonPolicy){
        this(normalization, missingIonPolicy, new PeptideEncoder());
    }

    public NormalizationMode getNormalization() {
        return normalization;
    }

    public MissingIonPolicy getMissingIonPolicy() {
        return missingIonPolicy;
    }

    /**
     * Sort and normalize predictions without checking them against a peptide.
     *
     * @throws IllegalArgumentException if two predictions share ion type and ion number
     */
    public PredictedSpectrum assemble(String peptideId, List<IonPrediction> predictions){
        List<IonPrediction> ions = new ArrayList<>(predictions.size());
        Table<IonType, Integer, IonPrediction> seen = HashBasedTable.create();
        for(IonPrediction p : predictions){
            checkDuplicate(seen, p);
            ions.add(p);
        }
        return finish(peptideId, null, "-", 0, 0.0, ions);
    }

    /**
     * Assemble the spectrum of a peptide. Every theoretical ion of the method appears exactly
     * once, or is omitted when it has no prediction and the policy is {@link MissingIonPolicy#OMIT}.
     *
     * @throws IllegalArgumentException for duplicate predictions or ions the peptide cannot produce
     */
    public PredictedSpectrum assemble(ResolvedPeptide peptide, FragmentationMethod method, List<IonPrediction> predictions){
        int n = peptide.length();
        Table<IonType, Integer, IonPrediction> seen = HashBasedTable.create();
        for(IonPrediction p : predictions){
            if(!method.getIonTypes().contains(p.getIonType())){
                throw new IllegalArgumentException(method.getLabel() + " does not produce " + p.getIonType().getLabel() + " ions");
            }
            if(p.getIonNumber() < 1 || p.getIonNumber() >= n){
                throw new IllegalArgumentException("Ion " + p.getLabel() + " out of range for peptide " + peptide.getSequence());
            }
            checkDuplicate(seen, p);
        }
        List<IonPrediction> ions = new ArrayList<>(method.getIonCount(n));
        for(IonType ionType : method.getIonTypes()){
            for(int k=1;k<n;k++){
                IonPrediction p = seen.get(ionType, k);
                if(p != null){
                    ions.add(p);
                }else if(missingIonPolicy == MissingIonPolicy.FILL){
                    ions.add(new IonPrediction(ionType, k, ionCalculator.ionMz(peptide, ionType, k), 0.0));
                }
            }
        }
        return finish(peptide.getId(), peptide.getSequence(), peptide.getModificationString(), peptide.getCharge(), peptide.getPrecursorMz(), ions);
    }

    private PredictedSpectrum finish(String id, String sequence, String mods, int charge, double precursorMz, List<IonPrediction> ions){
        ions.sort(IonPrediction.CANONICAL_ORDER);
        double[] intensities = new double[ions.size()];
        for(int i=0;i<intensities.length;i++){
            intensities[i] = ions.get(i).getIntensity();
        }
        double[] normalized = normalization.apply(intensities);
        List<IonPrediction> out = new ArrayList<>(ions.size());
        for(int i=0;i<normalized.length;i++){
            out.add(ions.get(i).withIntensity(normalized[i]));
        }
        return new PredictedSpectrum(id, sequence, mods, charge, precursorMz, normalization, out);
    }

    private static void checkDuplicate(Table<IonType, Integer, IonPrediction> seen, IonPrediction p){
        if(seen.put(p.getIonType(), p.getIonNumber(), p) != null){
            throw new IllegalArgumentException("Duplicate prediction for ion " + p.getLabel());
        }
    }
}
