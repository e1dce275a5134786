package pepfrag.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gradient boosted tree ensemble: score = base score + sum of the leaf values of all trees.
 */
public final class TreeEnsembleModel implements Model {

    private final ModelKey key;
    private final String schemaVersion;
    private final int featureCount;
    private final IntensityTransform transform;
    private final double baseScore;
    private final List<RegressionTree> trees;

    TreeEnsembleModel(ModelKey key, String schemaVersion, int featureCount, IntensityTransform transform, double baseScore, List<RegressionTree> trees){
        int maxFeature = -1;
        for(RegressionTree tree : trees){
            maxFeature = Math.max(maxFeature, tree.maxFeature());
        }
        if(maxFeature >= featureCount){
            throw new IllegalArgumentException("Model " + key + " splits on feature " + maxFeature + " but the schema has " + featureCount + " features");
        }
        this.key = key;
        this.schemaVersion = schemaVersion;
        this.featureCount = featureCount;
        this.transform = transform;
        this.baseScore = baseScore;
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
    }

    @Override
    public ModelKey getKey() {
        return key;
    }

    @Override
    public String getSchemaVersion() {
        return schemaVersion;
    }

    @Override
    public int getFeatureCount() {
        return featureCount;
    }

    @Override
    public IntensityTransform getTransform() {
        return transform;
    }

    public double getBaseScore() {
        return baseScore;
    }

    public int getTreeCount(){
        return trees.size();
    }

    @Override
    public double[] score(FeatureMatrix matrix) {
        double[] scores = new double[matrix.rowCount()];
        for(int r=0;r<scores.length;r++){
            double s = baseScore;
            for(RegressionTree tree : trees){
                s += tree.predict(matrix, r);
            }
            scores[r] = s;
        }
        return scores;
    }
}
