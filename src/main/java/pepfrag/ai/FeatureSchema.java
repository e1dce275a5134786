package pepfrag.ai;

import pepfrag.input.ResidueTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Names and order of the values in a feature vector. A model is only valid for the schema
 * version it was trained on.
 *
 * <p>Layout for window radius r:
 * <ol>
 *     <li>peptide: length, precursor charge, neutral mass, precursor m/z</li>
 *     <li>ion: charge, ion number (absolute and relative), cleavage index (absolute and relative)</li>
 *     <li>masses: prefix, suffix, fragment, fragment/peptide ratio, fragment m/z</li>
 *     <li>basic residue (K, R, H) counts of prefix and suffix</li>
 *     <li>per property: prefix mean, suffix mean, peptide mean</li>
 *     <li>N- and C-terminal residue: mass and properties</li>
 *     <li>2r residues around the cleavage: mass, properties, modification delta; zero outside the peptide</li>
 * </ol>
 */
public final class FeatureSchema {

    public static final FeatureSchema V1 = new FeatureSchema("ms2-v1", 2);

    private final String version;
    private final int windowRadius;
    private final List<String> featureNames;
    private final Map<String, Integer> name2index;

    public FeatureSchema(String version, int windowRadius){
        if(windowRadius < 1){
            throw new IllegalArgumentException("Window radius must be >= 1: " + windowRadius);
        }
        this.version = version;
        this.windowRadius = windowRadius;
        List<String> names = new ArrayList<>();
        names.add("peptide_length");
        names.add("precursor_charge");
        names.add("peptide_mass");
        names.add("precursor_mz");
        names.add("ion_charge");
        names.add("ion_number");
        names.add("ion_number_rel");
        names.add("cleavage_index");
        names.add("cleavage_rel");
        names.add("prefix_mass");
        names.add("suffix_mass");
        names.add("fragment_mass");
        names.add("fragment_mass_rel");
        names.add("fragment_mz");
        names.add("basic_prefix");
        names.add("basic_suffix");
        for(String p : ResidueTable.PROPERTY_NAMES){
            names.add(p + "_prefix_mean");
            names.add(p + "_suffix_mean");
            names.add(p + "_peptide_mean");
        }
        for(String term : new String[]{"nterm", "cterm"}){
            names.add(term + "_mass");
            for(String p : ResidueTable.PROPERTY_NAMES){
                names.add(term + "_" + p);
            }
        }
        for(int o = -windowRadius + 1; o <= windowRadius; o++){
            String w = o > 0 ? "w+" + o : "w" + o;
            names.add(w + "_mass");
            for(String p : ResidueTable.PROPERTY_NAMES){
                names.add(w + "_" + p);
            }
            names.add(w + "_mod_delta");
        }
        this.featureNames = Collections.unmodifiableList(names);
        Map<String, Integer> m = new HashMap<>();
        for(int i=0;i<names.size();i++){
            m.put(names.get(i), i);
        }
        this.name2index = Collections.unmodifiableMap(m);
    }

    public String getVersion() {
        return version;
    }

    public int getWindowRadius() {
        return windowRadius;
    }

    public int getFeatureCount(){
        return featureNames.size();
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    /**
     * @return the index of a named feature or -1
     */
    public int indexOf(String featureName){
        Integer i = name2index.get(featureName);
        return i == null ? -1 : i;
    }

    /**
     * Known schemas by version.
     */
    public static FeatureSchema forVersion(String version){
        if(V1.version.equals(version)){
            return V1;
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureSchema)) {
            return false;
        }
        FeatureSchema that = (FeatureSchema) o;
        return windowRadius == that.windowRadius && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return 31 * version.hashCode() + windowRadius;
    }

    @Override
    public String toString() {
        return version + " (" + getFeatureCount() + " features, window radius " + windowRadius + ")";
    }
}
