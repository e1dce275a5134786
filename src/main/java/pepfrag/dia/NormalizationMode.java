package pepfrag.dia;

import org.apache.commons.math3.util.FastMath;

/**
 * Intensity scale of assembled spectra.
 */
public enum NormalizationMode {
    /**
     * Intensities as produced by the model transforms.
     */
    RAW("raw"),
    /**
     * Divided by the most intense ion of the spectrum, so the base peak is 1.0.
     */
    RELATIVE_MAX("relative-max"),
    /**
     * log2(intensity + 0.001), the scale the models are trained on.
     */
    LOG("log");

    public static final double LOG_PSEUDO_COUNT = 0.001;

    private final String label;

    NormalizationMode(String label){
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    double[] apply(double[] intensities){
        double[] out = new double[intensities.length];
        switch (this) {
            case RELATIVE_MAX:
                double max = 0.0;
                for(double x : intensities){
                    max = Math.max(max, x);
                }
                for(int i=0;i<out.length;i++){
                    out[i] = max > 0 ? intensities[i] / max : 0.0;
                }
                break;
            case LOG:
                for(int i=0;i<out.length;i++){
                    out[i] = FastMath.log(intensities[i] + LOG_PSEUDO_COUNT) / FastMath.log(2.0);
                }
                break;
            default:
                System.arraycopy(intensities, 0, out, 0, out.length);
        }
        return out;
    }

    public static NormalizationMode fromLabel(String label){
        for(NormalizationMode m : values()){
            if(m.label.equalsIgnoreCase(label.trim()) || m.name().equalsIgnoreCase(label.trim())){
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown normalization mode: " + label + " (raw, relative-max, log)");
    }
}
