package pepfrag.dia;

import pepfrag.ai.IonType;

import java.util.Comparator;

/**
 * Predicted intensity of one fragment ion.
 */
public final class IonPrediction {

    /**
     * Canonical spectrum order: ion series, then ion number, then charge.
     */
    public static final Comparator<IonPrediction> CANONICAL_ORDER = Comparator
            .comparing((IonPrediction p) -> p.ionType.getSeries())
            .thenComparingInt(p -> p.ionNumber)
            .thenComparingInt(p -> p.ionType.getCharge());

    private final IonType ionType;
    private final int ionNumber;
    private final double mz;
    private final double intensity;

    public IonPrediction(IonType ionType, int ionNumber, double mz, double intensity){
        this.ionType = ionType;
        this.ionNumber = ionNumber;
        this.mz = mz;
        this.intensity = intensity;
    }

    public IonType getIonType() {
        return ionType;
    }

    /**
     * Ion number, e.g. 3 for b3; counted from the N-terminus for b/c and from the C-terminus for y/z.
     */
    public int getIonNumber() {
        return ionNumber;
    }

    public int getCharge(){
        return ionType.getCharge();
    }

    public double getMz() {
        return mz;
    }

    public double getIntensity() {
        return intensity;
    }

    public IonPrediction withIntensity(double newIntensity){
        return new IonPrediction(ionType, ionNumber, mz, newIntensity);
    }

    public String getLabel(){
        return ionType.getSeries() + String.valueOf(ionNumber) + (getCharge() > 1 ? "^" + getCharge() : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IonPrediction)) {
            return false;
        }
        IonPrediction that = (IonPrediction) o;
        return ionType == that.ionType && ionNumber == that.ionNumber
                && Double.compare(mz, that.mz) == 0 && Double.compare(intensity, that.intensity) == 0;
    }

    @Override
    public int hashCode() {
        int h = ionType.hashCode();
        h = 31 * h + ionNumber;
        h = 31 * h + Double.hashCode(mz);
        h = 31 * h + Double.hashCode(intensity);
        return h;
    }

    @Override
    public String toString() {
        return getLabel() + " " + String.format("%.4f", mz) + " " + String.format("%.6f", intensity);
    }
}
