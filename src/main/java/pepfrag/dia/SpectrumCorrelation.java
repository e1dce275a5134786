package pepfrag.dia;

import pepfrag.ai.IonType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pearson correlation between a predicted and an observed spectrum, over all ions and per ion
 * type. A correlation is NaN when fewer than two ions take part or one side is constant.
 */
public final class SpectrumCorrelation {

    private final String id;
    private final double pearson;
    private final Map<IonType, Double> pearsonByIonType;
    private final int ionCount;
    private final int matchedCount;

    SpectrumCorrelation(String id, double pearson, EnumMap<IonType, Double> pearsonByIonType, int ionCount, int matchedCount){
        this.id = id;
        this.pearson = pearson;
        this.pearsonByIonType = Collections.unmodifiableMap(pearsonByIonType);
        this.ionCount = ionCount;
        this.matchedCount = matchedCount;
    }

    public String getId() {
        return id;
    }

    public double getPearson() {
        return pearson;
    }

    public Map<IonType, Double> getPearsonByIonType() {
        return pearsonByIonType;
    }

    public int getIonCount() {
        return ionCount;
    }

    /**
     * Ions with at least one observed peak inside the tolerance.
     */
    public int getMatchedCount() {
        return matchedCount;
    }

    @Override
    public String toString() {
        return id + " pearson=" + pearson + " " + pearsonByIonType + " matched=" + matchedCount + "/" + ionCount;
    }
}
