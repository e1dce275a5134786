package pepfrag.dia;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import pepfrag.ai.IonType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares predicted spectra with measured ones. Each predicted ion takes the most intense
 * observed peak within the m/z tolerance, 0 when there is none. Observed intensities are
 * divided by the total ion current of the spectrum and then put on the predicted spectrum's
 * scale with its {@link NormalizationMode}.
 */
public final class SpectrumCorrelator {

    public static final double DEFAULT_MS2_TOLERANCE = 0.02;

    private final double tolerance;

    public SpectrumCorrelator(double tolerance){
        if(!(tolerance > 0)){
            throw new IllegalArgumentException("MS2 tolerance must be positive: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public SpectrumCorrelator(){
        this(DEFAULT_MS2_TOLERANCE);
    }

    public double getTolerance() {
        return tolerance;
    }

    /**
     * Observed intensities aligned with {@code predicted.getIons()}.
     */
    public double[] match(PredictedSpectrum predicted, ObservedSpectrum observed){
        List<IonPrediction> ions = predicted.getIons();
        double tic = observed.getTotalIntensity();
        double[] matched = new double[ions.size()];
        for(int i=0;i<matched.length;i++){
            double x = observed.maxIntensity(ions.get(i).getMz(), tolerance);
            matched[i] = tic > 0 ? x / tic : 0.0;
        }
        return predicted.getNormalization().apply(matched);
    }

    public SpectrumCorrelation correlate(PredictedSpectrum predicted, ObservedSpectrum observed){
        List<IonPrediction> ions = predicted.getIons();
        double[] obs = match(predicted, observed);
        double[] pred = new double[ions.size()];
        int matchedCount = 0;
        Map<IonType, List<Integer>> rowsByIonType = new LinkedHashMap<>();
        for(int i=0;i<pred.length;i++){
            pred[i] = ions.get(i).getIntensity();
            if(observed.maxIntensity(ions.get(i).getMz(), tolerance) > 0){
                matchedCount++;
            }
            rowsByIonType.computeIfAbsent(ions.get(i).getIonType(), t -> new ArrayList<>()).add(i);
        }
        EnumMap<IonType, Double> byIonType = new EnumMap<>(IonType.class);
        for(Map.Entry<IonType, List<Integer>> e : rowsByIonType.entrySet()){
            List<Integer> rows = e.getValue();
            double[] x = new double[rows.size()];
            double[] y = new double[rows.size()];
            for(int j=0;j<x.length;j++){
                x[j] = pred[rows.get(j)];
                y[j] = obs[rows.get(j)];
            }
            byIonType.put(e.getKey(), pearson(x, y));
        }
        return new SpectrumCorrelation(predicted.getId(), pearson(pred, obs), byIonType, ions.size(), matchedCount);
    }

    static double pearson(double[] x, double[] y){
        if(x.length < 2){
            return Double.NaN;
        }
        return new PearsonsCorrelation().correlation(x, y);
    }
}
