package pepfrag.ai;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Feature vectors of one peptide, one row per (ion type, ion number), with the annotation
 * needed to turn scores back into ion predictions. Rows are not copied on access; the
 * matrix is owned by the pipeline pass that created it.
 */
public final class FeatureMatrix {

    private final FeatureSchema schema;
    private final double[][] rows;
    private final IonType[] ionTypes;
    private final int[] ionNumbers;
    private final double[] mzs;

    FeatureMatrix(FeatureSchema schema, double[][] rows, IonType[] ionTypes, int[] ionNumbers, double[] mzs){
        if(rows.length != ionTypes.length || rows.length != ionNumbers.length || rows.length != mzs.length){
            throw new IllegalArgumentException("Row annotations do not match the number of rows");
        }
        this.schema = schema;
        this.rows = rows;
        this.ionTypes = ionTypes;
        this.ionNumbers = ionNumbers;
        this.mzs = mzs;
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public int rowCount(){
        return rows.length;
    }

    public int columnCount(){
        return schema.getFeatureCount();
    }

    public double get(int row, int column){
        return rows[row][column];
    }

    /**
     * Copy of one feature vector.
     */
    public double[] getRow(int row){
        return Arrays.copyOf(rows[row], rows[row].length);
    }

    public IonType ionTypeAt(int row){
        return ionTypes[row];
    }

    public int ionNumberAt(int row){
        return ionNumbers[row];
    }

    public double mzAt(int row){
        return mzs[row];
    }

    /**
     * Distinct ion types in order of first appearance.
     */
    public List<IonType> getIonTypes(){
        List<IonType> types = new ArrayList<>();
        for(IonType t : ionTypes){
            if(!types.contains(t)){
                types.add(t);
            }
        }
        return Collections.unmodifiableList(types);
    }

    /**
     * Indices of the rows of one ion type, ascending.
     */
    public int[] rowsOf(IonType ionType){
        int n = 0;
        for(IonType t : ionTypes){
            if(t == ionType){
                n++;
            }
        }
        int[] idx = new int[n];
        int j = 0;
        for(int i=0;i<ionTypes.length;i++){
            if(ionTypes[i] == ionType){
                idx[j++] = i;
            }
        }
        return idx;
    }

    /**
     * Sub-matrix of the given rows, sharing the row arrays.
     */
    public FeatureMatrix select(int[] rowIndices){
        double[][] r = new double[rowIndices.length][];
        IonType[] t = new IonType[rowIndices.length];
        int[] num = new int[rowIndices.length];
        double[] mz = new double[rowIndices.length];
        for(int i=0;i<rowIndices.length;i++){
            r[i] = rows[rowIndices[i]];
            t[i] = ionTypes[rowIndices[i]];
            num[i] = ionNumbers[rowIndices[i]];
            mz[i] = mzs[rowIndices[i]];
        }
        return new FeatureMatrix(schema, r, t, num, mz);
    }

    /**
     * Bit-level equality of the feature values and row annotations.
     */
    public boolean contentEquals(FeatureMatrix other){
        if(other == null || !schema.equals(other.schema) || rows.length != other.rows.length){
            return false;
        }
        for(int i=0;i<rows.length;i++){
            if(ionTypes[i] != other.ionTypes[i] || ionNumbers[i] != other.ionNumbers[i]
                    || Double.doubleToLongBits(mzs[i]) != Double.doubleToLongBits(other.mzs[i])){
                return false;
            }
            // Arrays.equals compares doubles by their bits
            if(!Arrays.equals(rows[i], other.rows[i])){
                return false;
            }
        }
        return true;
    }
}
