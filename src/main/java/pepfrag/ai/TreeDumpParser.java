package pepfrag.ai;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import pepfrag.error.ModelLoadException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads XGBoost JSON tree dumps ({@code Booster.dump_model(fout, dump_format="json")}):
 * an array with one nested node object per tree. Split features are named {@code f<index>}
 * or by their name in the feature schema.
 */
final class TreeDumpParser {

    private final FeatureSchema schema;

    TreeDumpParser(FeatureSchema schema){
        this.schema = schema;
    }

    List<RegressionTree> parse(String json, String source) throws ModelLoadException {
        JSONArray treeArray;
        try {
            treeArray = JSON.parseArray(json);
        } catch (JSONException | ClassCastException e) {
            throw new ModelLoadException("Invalid tree dump " + source + ": " + e.getMessage(), e);
        }
        if(treeArray == null || treeArray.isEmpty()){
            throw new ModelLoadException("No trees in " + source);
        }
        List<RegressionTree> trees = new ArrayList<>(treeArray.size());
        for(int t=0;t<treeArray.size();t++){
            try {
                JSONObject root = treeArray.getJSONObject(t);
                if(root == null){
                    throw new IllegalArgumentException("tree is null");
                }
                trees.add(parseTree(root));
            } catch (RuntimeException e) {
                throw new ModelLoadException("Invalid tree " + t + " in " + source + ": " + e.getMessage(), e);
            }
        }
        return trees;
    }

    private RegressionTree parseTree(JSONObject root) throws ModelLoadException {
        List<JSONObject> nodes = new ArrayList<>();
        collect(root, nodes);
        // node ids to dense indices, root first
        Map<Integer, Integer> id2index = new HashMap<>();
        for(int i=0;i<nodes.size();i++){
            Integer nodeId = nodes.get(i).getInteger("nodeid");
            if(nodeId == null){
                throw new IllegalArgumentException("node without nodeid");
            }
            if(id2index.put(nodeId, i) != null){
                throw new IllegalArgumentException("duplicate nodeid " + nodeId);
            }
        }
        int n = nodes.size();
        int[] feature = new int[n];
        double[] threshold = new double[n];
        int[] yes = new int[n];
        int[] no = new int[n];
        int[] missing = new int[n];
        double[] leaf = new double[n];
        for(int i=0;i<n;i++){
            JSONObject node = nodes.get(i);
            if(node.containsKey("leaf")){
                feature[i] = -1;
                leaf[i] = node.getDoubleValue("leaf");
            }else{
                feature[i] = featureIndex(node.getString("split"));
                threshold[i] = node.getDoubleValue("split_condition");
                yes[i] = resolve(id2index, node.getInteger("yes"));
                no[i] = resolve(id2index, node.getInteger("no"));
                Integer m = node.getInteger("missing");
                missing[i] = m == null ? yes[i] : resolve(id2index, m);
            }
        }
        return new RegressionTree(feature, threshold, yes, no, missing, leaf);
    }

    private static void collect(JSONObject node, List<JSONObject> nodes){
        nodes.add(node);
        JSONArray children = node.getJSONArray("children");
        if(children != null){
            for(int i=0;i<children.size();i++){
                collect(children.getJSONObject(i), nodes);
            }
        }
    }

    private static int resolve(Map<Integer, Integer> id2index, Integer nodeId){
        if(nodeId == null || !id2index.containsKey(nodeId)){
            throw new IllegalArgumentException("split points to unknown node " + nodeId);
        }
        return id2index.get(nodeId);
    }

    int featureIndex(String split) throws ModelLoadException {
        if(split == null){
            throw new ModelLoadException("Split node without feature");
        }
        int idx = schema.indexOf(split);
        if(idx >= 0){
            return idx;
        }
        if(split.length() > 1 && split.charAt(0) == 'f'){
            try {
                idx = Integer.parseInt(split.substring(1));
            } catch (NumberFormatException e) {
                idx = -1;
            }
        }
        if(idx < 0 || idx >= schema.getFeatureCount()){
            throw new ModelLoadException("Unknown split feature '" + split + "' for schema " + schema.getVersion());
        }
        return idx;
    }
}
