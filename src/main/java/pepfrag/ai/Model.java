package pepfrag.ai;

/**
 * A pretrained scoring function for one (fragmentation method, ion type). Implementations
 * are immutable and safe for concurrent use.
 */
public interface Model {

    ModelKey getKey();

    /**
     * Version of the {@link FeatureSchema} the model was trained on.
     */
    String getSchemaVersion();

    /**
     * Number of features the model reads.
     */
    int getFeatureCount();

    /**
     * Transform from raw scores to intensities.
     */
    IntensityTransform getTransform();

    /**
     * Raw scores, one per row of the matrix, in row order.
     */
    double[] score(FeatureMatrix matrix);
}
