package pepfrag.ai;

/**
 * One entry of a model manifest: where the artifact for a (method, ion type) lives and
 * which feature schema it expects.
 */
public final class ModelSpec {

    private final ModelKey key;
    private final String file;
    private final String schemaVersion;
    private final IntensityTransform transform;
    private final double baseScore;
    /**
     * Expected SHA-1 of the model file, null to skip the check.
     */
    private final String sha1;

    public ModelSpec(ModelKey key, String file, String schemaVersion, IntensityTransform transform, double baseScore, String sha1){
        this.key = key;
        this.file = file;
        this.schemaVersion = schemaVersion;
        this.transform = transform;
        this.baseScore = baseScore;
        this.sha1 = sha1;
    }

    public ModelKey getKey() {
        return key;
    }

    public String getFile() {
        return file;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public IntensityTransform getTransform() {
        return transform;
    }

    public double getBaseScore() {
        return baseScore;
    }

    public String getSha1() {
        return sha1;
    }
}
