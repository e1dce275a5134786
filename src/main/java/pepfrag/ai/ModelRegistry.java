package pepfrag.ai;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import pepfrag.error.ModelLoadException;
import pepfrag.error.ModelNotFoundException;
import pepfrag.error.UnsupportedMethodException;
import pepfrag.util.PLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping from (fragmentation method, ion type) to {@link Model}. Loaded once before
 * any prediction starts and shared read-only by all workers.
 */
public final class ModelRegistry {

    public static final String MANIFEST_FILE = "models.json";

    private final ImmutableMap<ModelKey, Model> models;

    private ModelRegistry(Map<ModelKey, Model> models){
        this.models = ImmutableMap.copyOf(models);
    }

    public static Builder builder(){
        return new Builder();
    }

    /**
     * Load all models listed in a manifest. {@code manifest} may be the manifest file or the
     * directory holding {@value #MANIFEST_FILE}. Model files are resolved relative to the
     * manifest's directory.
     *
     * <pre>
     * {"models": [
     *   {"method": "HCD", "ion_type": "b", "file": "HCD_B.json", "schema_version": "ms2-v1",
     *    "transform": "log2", "base_score": 0.5, "sha1": "..."}
     * ]}
     * </pre>
     *
     * @throws ModelLoadException if the manifest or any model cannot be read or is inconsistent
     */
    public static ModelRegistry loadAll(Path manifest) throws ModelLoadException {
        Path manifestFile = Files.isDirectory(manifest) ? manifest.resolve(MANIFEST_FILE) : manifest;
        Path baseDir = manifestFile.toAbsolutePath().getParent();
        return loadAll(readManifest(manifestFile), baseDir);
    }

    public static ModelRegistry loadAll(List<ModelSpec> specs, Path baseDir) throws ModelLoadException {
        long startTime = System.currentTimeMillis();
        Builder builder = builder();
        for(ModelSpec spec : specs){
            builder.register(load(spec, baseDir));
        }
        ModelRegistry registry = builder.build();
        PLogger.getInstance().logger.info("Loaded " + registry.size() + " models in " + PLogger.elapsed(startTime) + ": " + registry.models.keySet());
        return registry;
    }

    static List<ModelSpec> readManifest(Path manifestFile) throws ModelLoadException {
        String json;
        try {
            json = new String(Files.readAllBytes(manifestFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read model manifest " + manifestFile, e);
        }
        JSONArray entries;
        try {
            JSONObject root = JSON.parseObject(json);
            entries = root == null ? null : root.getJSONArray("models");
        } catch (JSONException | ClassCastException e) {
            throw new ModelLoadException("Invalid model manifest " + manifestFile + ": " + e.getMessage(), e);
        }
        if(entries == null || entries.isEmpty()){
            throw new ModelLoadException("No models listed in " + manifestFile);
        }
        List<ModelSpec> specs = new ArrayList<>();
        for(int i=0;i<entries.size();i++){
            try {
                specs.add(parseEntry(entries.getJSONObject(i)));
            } catch (UnsupportedMethodException | RuntimeException ex) {
                throw new ModelLoadException("Model entry " + i + " in " + manifestFile + ": " + ex.getMessage(), ex);
            }
        }
        return specs;
    }

    private static ModelSpec parseEntry(JSONObject e) throws UnsupportedMethodException {
        if(e == null){
            throw new IllegalArgumentException("entry is null");
        }
        String file = e.getString("file");
        String schemaVersion = e.getString("schema_version");
        if(file == null || schemaVersion == null){
            throw new IllegalArgumentException("needs 'file' and 'schema_version'");
        }
        FragmentationMethod method = FragmentationMethod.fromName(e.getString("method"));
        IonType ionType = IonType.fromLabel(String.valueOf(e.getString("ion_type")));
        IntensityTransform transform = IntensityTransform.fromLabel(e.getString("transform"));
        double baseScore = e.containsKey("base_score") ? e.getDoubleValue("base_score") : 0.5;
        return new ModelSpec(new ModelKey(method, ionType), file, schemaVersion, transform, baseScore, e.getString("sha1"));
    }

    static Model load(ModelSpec spec, Path baseDir) throws ModelLoadException {
        ModelKey key = spec.getKey();
        if(!key.getMethod().getIonTypes().contains(key.getIonType())){
            throw new ModelLoadException("Method " + key.getMethod().getLabel() + " does not produce " + key.getIonType().getLabel() + " ions");
        }
        FeatureSchema schema = FeatureSchema.forVersion(spec.getSchemaVersion());
        if(schema == null){
            throw new ModelLoadException("Unknown feature schema version '" + spec.getSchemaVersion() + "' for model " + key);
        }
        Path file = baseDir == null ? Path.of(spec.getFile()) : baseDir.resolve(spec.getFile());
        byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read model file " + file + " for " + key, e);
        }
        if(spec.getSha1() != null && !spec.getSha1().isEmpty()){
            // SHA-1 is what published model manifests carry
            String sha1 = Hashing.sha1().hashBytes(data).toString();
            if(!sha1.equalsIgnoreCase(spec.getSha1())){
                throw new ModelLoadException("Model file " + file + " is corrupt: SHA-1 " + sha1 + " does not match " + spec.getSha1());
            }
        }
        List<RegressionTree> trees = new TreeDumpParser(schema).parse(new String(data, StandardCharsets.UTF_8), file.toString());
        try {
            return new TreeEnsembleModel(key, schema.getVersion(), schema.getFeatureCount(), spec.getTransform(), spec.getBaseScore(), trees);
        } catch (IllegalArgumentException e) {
            throw new ModelLoadException(e.getMessage(), e);
        }
    }

    /**
     * @throws ModelNotFoundException if no model is registered for the key
     */
    public Model lookup(FragmentationMethod method, IonType ionType) throws ModelNotFoundException {
        Model model = models.get(new ModelKey(method, ionType));
        if(model == null){
            throw new ModelNotFoundException("No model registered for " + method.getLabel() + "/" + ionType.getLabel());
        }
        return model;
    }

    /**
     * True when a model is registered for every ion type of the method.
     */
    public boolean supports(FragmentationMethod method){
        for(IonType t : method.getIonTypes()){
            if(!models.containsKey(new ModelKey(method, t))){
                return false;
            }
        }
        return true;
    }

    public Set<ModelKey> getKeys(){
        return models.keySet();
    }

    public int size(){
        return models.size();
    }

    public static final class Builder {

        private final Map<ModelKey, Model> models = new LinkedHashMap<>();

        private Builder(){
        }

        /**
         * @throws ModelLoadException if a model is already registered for the same key
         */
        public Builder register(Model model) throws ModelLoadException {
            if(models.containsKey(model.getKey())){
                throw new ModelLoadException("Duplicate model for " + model.getKey());
            }
            models.put(model.getKey(), model);
            return this;
        }

        public ModelRegistry build(){
            return new ModelRegistry(models);
        }
    }
}
