package pepfrag.ai;

import pepfrag.dia.IonPrediction;
import pepfrag.error.ModelMismatchException;
import pepfrag.error.ModelNotFoundException;
import pepfrag.error.PredictionException;
import pepfrag.error.UnsupportedMethodException;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores feature matrices with the models of the registry. For every ion type in the
 * matrix the matching model scores that type's rows, and the model's transform turns the
 * scores into intensities. Predictions come back in the row order of the matrix.
 */
public final class PredictionEngine {

    private final ModelRegistry registry;

    public PredictionEngine(ModelRegistry registry){
        this.registry = registry;
    }

    public ModelRegistry getRegistry() {
        return registry;
    }

    public List<IonPrediction> predict(FeatureMatrix matrix, String method) throws PredictionException {
        return predict(matrix, FragmentationMethod.fromName(method));
    }

    /**
     * @throws ModelNotFoundException if the registry has no model for an ion type of the matrix
     * @throws ModelMismatchException if a model expects a different feature schema
     * @throws UnsupportedMethodException if the matrix holds ion types the method does not produce
     */
    public List<IonPrediction> predict(FeatureMatrix matrix, FragmentationMethod method) throws PredictionException {
        int nRows = matrix.rowCount();
        double[] intensities = new double[nRows];
        boolean[] filled = new boolean[nRows];
        for(IonType ionType : matrix.getIonTypes()){
            if(!method.getIonTypes().contains(ionType)){
                throw new UnsupportedMethodException(method.getLabel() + " has no mapping for " + ionType.getLabel() + " ions");
            }
            Model model = registry.lookup(method, ionType);
            checkSchema(model, matrix.getSchema());
            int[] rows = matrix.rowsOf(ionType);
            double[] scores = model.score(matrix.select(rows));
            if(scores.length != rows.length){
                throw new IllegalStateException("Model " + model.getKey() + " returned " + scores.length + " scores for " + rows.length + " rows");
            }
            IntensityTransform transform = model.getTransform();
            for(int i=0;i<rows.length;i++){
                intensities[rows[i]] = transform.apply(scores[i]);
                filled[rows[i]] = true;
            }
        }

        List<IonPrediction> predictions = new ArrayList<>(nRows);
        for(int r=0;r<nRows;r++){
            if(filled[r]){
                predictions.add(new IonPrediction(matrix.ionTypeAt(r), matrix.ionNumberAt(r), matrix.mzAt(r), intensities[r]));
            }
        }
        return predictions;
    }

    static void checkSchema(Model model, FeatureSchema schema) throws ModelMismatchException {
        if(!model.getSchemaVersion().equals(schema.getVersion()) || model.getFeatureCount() != schema.getFeatureCount()){
            throw new ModelMismatchException("Model " + model.getKey() + " expects feature schema " + model.getSchemaVersion()
                    + " with " + model.getFeatureCount() + " features, got " + schema);
        }
    }
}
