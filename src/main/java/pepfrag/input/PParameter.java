package pepfrag.input;

import pepfrag.dia.MissingIonPolicy;
import pepfrag.dia.NormalizationMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Run configuration. Defaults come from {@code pepfrag.properties} on the classpath; a user
 * properties file and command line options override them.
 */
public class PParameter {

    private static final String DEFAULTS = "/pepfrag.properties";

    /**
     * Fragmentation method / model name, such as HCD, CID, ETD or TMT
     */
    public String method = "HCD";

    /**
     * The maximum number of peptides per chunk
     */
    public int chunk_size = 1000;

    /**
     * Number of worker threads, 0 means all available processors
     */
    public int cpu = 0;

    public NormalizationMode normalization = NormalizationMode.RELATIVE_MAX;

    public MissingIonPolicy missing_ion_policy = MissingIonPolicy.FILL;

    public int min_peptide_length = PeptideResolver.DEFAULT_MIN_LENGTH;
    public int max_peptide_length = PeptideResolver.DEFAULT_MAX_LENGTH;

    /**
     * Directory with models.json, or the manifest file itself
     */
    public String model_dir = "";

    /**
     * Output format: tsv or parquet
     */
    public String output_format = "tsv";

    /**
     * m/z tolerance (Da) when matching predicted ions to observed peaks
     */
    public double ms2_tolerance = 0.02;

    public static PParameter loadDefaults(){
        PParameter p = new PParameter();
        try (InputStream in = PParameter.class.getResourceAsStream(DEFAULTS)) {
            if(in != null){
                Properties properties = new Properties();
                properties.load(in);
                p.apply(properties);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULTS, e);
        }
        return p;
    }

    /**
     * Override settings from a properties file.
     */
    public void load(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        apply(properties);
    }

    /**
     * Override the settings present in {@code properties}; unknown keys are ignored.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public void apply(Properties properties){
        method = properties.getProperty("method", method).trim();
        chunk_size = getInt(properties, "chunk_size", chunk_size);
        cpu = getInt(properties, "cpu", cpu);
        if(properties.containsKey("normalization")){
            normalization = NormalizationMode.fromLabel(properties.getProperty("normalization"));
        }
        if(properties.containsKey("missing_ion_policy")){
            missing_ion_policy = MissingIonPolicy.fromLabel(properties.getProperty("missing_ion_policy"));
        }
        min_peptide_length = getInt(properties, "min_peptide_length", min_peptide_length);
        max_peptide_length = getInt(properties, "max_peptide_length", max_peptide_length);
        model_dir = properties.getProperty("model_dir", model_dir).trim();
        output_format = properties.getProperty("output_format", output_format).trim();
        ms2_tolerance = getDouble(properties, "ms2_tolerance", ms2_tolerance);
        validate();
    }

    public void validate(){
        if(chunk_size < 1){
            throw new IllegalArgumentException("chunk_size must be positive: " + chunk_size);
        }
        if(cpu < 0){
            throw new IllegalArgumentException("cpu must not be negative: " + cpu);
        }
        if(min_peptide_length < 2 || max_peptide_length < min_peptide_length){
            throw new IllegalArgumentException("Invalid peptide length range: " + min_peptide_length + ".." + max_peptide_length);
        }
        if(!output_format.equalsIgnoreCase("tsv") && !output_format.equalsIgnoreCase("parquet")){
            throw new IllegalArgumentException("Unknown output format: " + output_format + " (tsv, parquet)");
        }
        if(!(ms2_tolerance > 0)){
            throw new IllegalArgumentException("ms2_tolerance must be positive: " + ms2_tolerance);
        }
    }

    /**
     * Worker threads to use, resolving 0 to the number of processors.
     */
    public int getThreads(){
        return cpu > 0 ? cpu : Runtime.getRuntime().availableProcessors();
    }

    private static int getInt(Properties properties, String key, int defaultValue){
        String v = properties.getProperty(key);
        if(v == null || v.trim().isEmpty()){
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }

    private static double getDouble(Properties properties, String key, double defaultValue){
        String v = properties.getProperty(key);
        if(v == null || v.trim().isEmpty()){
            return defaultValue;
        }
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + v, e);
        }
    }

    /**
     * Get version
     * @return
     */
    public static String getVersion(){
        Properties properties = new Properties();
        try (InputStream in = PParameter.class.getResourceAsStream("/project.properties")) {
            if(in == null){
                return "unknown";
            }
            properties.load(in);
        } catch (IOException e) {
            return "unknown";
        }
        return properties.getProperty("version", "unknown");
    }

    public String describe(){
        return "Method: " + method + "\n" +
                "Chunk size: " + chunk_size + "\n" +
                "Threads: " + getThreads() + "\n" +
                "Normalization: " + normalization.getLabel() + "\n" +
                "Missing ions: " + missing_ion_policy.getLabel() + "\n" +
                "Peptide length: " + min_peptide_length + ".." + max_peptide_length + "\n" +
                "Model dir: " + model_dir + "\n" +
                "Output format: " + output_format + "\n" +
                "MS2 tolerance: " + ms2_tolerance + "\n";
    }
}
