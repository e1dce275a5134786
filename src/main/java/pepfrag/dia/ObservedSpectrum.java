package pepfrag.dia;

import java.util.Arrays;

/**
 * Measured fragment peaks of one spectrum, sorted by m/z.
 */
public final class ObservedSpectrum {

    private final String id;
    private final double[] mz;
    private final double[] intensity;

    public ObservedSpectrum(String id, double[] mz, double[] intensity){
        if(mz.length != intensity.length){
            throw new IllegalArgumentException("Spectrum " + id + ": " + mz.length + " m/z values but " + intensity.length + " intensities");
        }
        this.id = id;
        Integer[] order = new Integer[mz.length];
        for(int i=0;i<order.length;i++){
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(mz[a], mz[b]));
        this.mz = new double[mz.length];
        this.intensity = new double[mz.length];
        for(int i=0;i<order.length;i++){
            this.mz[i] = mz[order[i]];
            this.intensity[i] = intensity[order[i]];
        }
    }

    public String getId() {
        return id;
    }

    public int size(){
        return mz.length;
    }

    public double getMz(int i){
        return mz[i];
    }

    public double getIntensity(int i){
        return intensity[i];
    }

    public double getTotalIntensity(){
        double sum = 0.0;
        for(double x : intensity){
            sum += x;
        }
        return sum;
    }

    /**
     * Highest intensity among the peaks within {@code tolerance} of {@code target}, 0 when
     * no peak is that close.
     */
    public double maxIntensity(double target, double tolerance){
        int i = Arrays.binarySearch(mz, target - tolerance);
        if(i < 0){
            i = -i - 1;
        }
        double max = 0.0;
        for(;i<mz.length && mz[i] <= target + tolerance;i++){
            max = Math.max(max, intensity[i]);
        }
        return max;
    }
}
