package pepfrag.ai;

import org.apache.commons.math3.util.FastMath;

/**
 * Monotone map from a model's raw score back to intensity units, the inverse of the target
 * transform applied at training time. Negative intensities are clipped to zero.
 */
public enum IntensityTransform {
    /**
     * Scores are intensities already.
     */
    NONE("none"),
    /**
     * Inverse of log2(intensity + 0.001).
     */
    LOG2("log2"),
    /**
     * Inverse of log1p(intensity).
     */
    LOG1P("log1p");

    public static final double LOG2_PSEUDO_COUNT = 0.001;

    private final String label;

    IntensityTransform(String label){
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public double apply(double score){
        double x;
        switch (this) {
            case LOG2:
                x = FastMath.pow(2.0, score) - LOG2_PSEUDO_COUNT;
                break;
            case LOG1P:
                x = FastMath.expm1(score);
                break;
            default:
                x = score;
        }
        return x > 0 ? x : 0.0;
    }

    public static IntensityTransform fromLabel(String label){
        if(label == null || label.isEmpty()){
            return LOG2;
        }
        for(IntensityTransform t : values()){
            if(t.label.equalsIgnoreCase(label.trim())){
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown intensity transform: " + label);
    }
}
