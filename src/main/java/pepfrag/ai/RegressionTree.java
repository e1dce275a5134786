package pepfrag.ai;

/**
 * One decision tree stored as flat node arrays. Node 0 is the root; a node is a leaf when
 * its feature index is -1. A split sends a row to {@code yes} when value &lt; threshold,
 * to {@code no} otherwise, and to {@code missing} when the value is NaN.
 */
final class RegressionTree {

    private final int[] feature;
    private final double[] threshold;
    private final int[] yes;
    private final int[] no;
    private final int[] missing;
    private final double[] leaf;

    RegressionTree(int[] feature, double[] threshold, int[] yes, int[] no, int[] missing, double[] leaf){
        int n = feature.length;
        if(threshold.length != n || yes.length != n || no.length != n || missing.length != n || leaf.length != n){
            throw new IllegalArgumentException("Inconsistent tree arrays");
        }
        for(int i=0;i<n;i++){
            if(feature[i] >= 0 && (!inRange(yes[i], n) || !inRange(no[i], n) || !inRange(missing[i], n))){
                throw new IllegalArgumentException("Node " + i + " points outside the tree");
            }
        }
        this.feature = feature;
        this.threshold = threshold;
        this.yes = yes;
        this.no = no;
        this.missing = missing;
        this.leaf = leaf;
    }

    private static boolean inRange(int node, int n){
        return node > 0 && node < n;
    }

    double predict(FeatureMatrix matrix, int row){
        int node = 0;
        int steps = 0;
        while(feature[node] >= 0){
            double x = matrix.get(row, feature[node]);
            if(Double.isNaN(x)){
                node = missing[node];
            }else if(x < threshold[node]){
                node = yes[node];
            }else{
                node = no[node];
            }
            if(++steps > feature.length){
                throw new IllegalStateException("Cycle in regression tree");
            }
        }
        return leaf[node];
    }

    /**
     * Largest feature index used by a split, -1 for a single leaf.
     */
    int maxFeature(){
        int m = -1;
        for(int f : feature){
            m = Math.max(m, f);
        }
        return m;
    }

    int size(){
        return feature.length;
    }
}
