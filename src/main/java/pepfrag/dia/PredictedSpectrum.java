package pepfrag.dia;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Final predicted spectrum of one peptide, ions in canonical order. Immutable.
 */
public final class PredictedSpectrum {

    private final String id;
    private final String sequence;
    private final String modifications;
    private final int precursorCharge;
    private final double precursorMz;
    private final NormalizationMode normalization;
    private final List<IonPrediction> ions;

    public PredictedSpectrum(String id, String sequence, String modifications, int precursorCharge, double precursorMz,
                             NormalizationMode normalization, List<IonPrediction> ions){
        this.id = id;
        this.sequence = sequence;
        this.modifications = modifications;
        this.precursorCharge = precursorCharge;
        this.precursorMz = precursorMz;
        this.normalization = normalization;
        this.ions = Collections.unmodifiableList(new ArrayList<>(ions));
    }

    public String getId() {
        return id;
    }

    /**
     * Peptide sequence, null when the spectrum was assembled from predictions only.
     */
    public String getSequence() {
        return sequence;
    }

    public String getModifications() {
        return modifications;
    }

    /**
     * Precursor charge, 0 when unknown.
     */
    public int getPrecursorCharge() {
        return precursorCharge;
    }

    public double getPrecursorMz() {
        return precursorMz;
    }

    public NormalizationMode getNormalization() {
        return normalization;
    }

    public List<IonPrediction> getIons() {
        return ions;
    }

    public int size(){
        return ions.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PredictedSpectrum)) {
            return false;
        }
        PredictedSpectrum that = (PredictedSpectrum) o;
        return precursorCharge == that.precursorCharge
                && Double.compare(precursorMz, that.precursorMz) == 0
                && Objects.equals(id, that.id)
                && Objects.equals(sequence, that.sequence)
                && Objects.equals(modifications, that.modifications)
                && normalization == that.normalization
                && ions.equals(that.ions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sequence, modifications, precursorCharge, precursorMz, normalization, ions);
    }

    @Override
    public String toString() {
        return id + " " + sequence + "/" + precursorCharge + " (" + ions.size() + " ions)";
    }
}
