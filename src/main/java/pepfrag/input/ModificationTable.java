package pepfrag.input;

import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of modifications by name. Built once at start-up and read-only afterwards.
 */
public final class ModificationTable {

    private static final String DEFAULT_MODIFICATIONS = "/default_modifications.tsv";

    private final Map<String, Modification> name2mod;
    private final List<Modification> fixedMods;

    private ModificationTable(Map<String, Modification> name2mod){
        this.name2mod = Collections.unmodifiableMap(new LinkedHashMap<>(name2mod));
        List<Modification> fixed = new ArrayList<>();
        for(Modification mod : name2mod.values()){
            if(mod.isFixed()){
                fixed.add(mod);
            }
        }
        this.fixedMods = Collections.unmodifiableList(fixed);
    }

    public static Builder builder(){
        return new Builder();
    }

    /**
     * Table with the modifications listed in {@code default_modifications.tsv}, all variable.
     */
    public static ModificationTable loadDefault(){
        return builder().addDefaults().build();
    }

    /**
     * @return the modification or null when the name is not registered
     */
    public Modification get(String name){
        return name2mod.get(name);
    }

    public boolean contains(String name){
        return name2mod.containsKey(name);
    }

    public Collection<Modification> getModifications(){
        return name2mod.values();
    }

    public List<Modification> getFixedModifications(){
        return fixedMods;
    }

    public int size(){
        return name2mod.size();
    }

    public void printMods(){
        System.out.println("mod_name\tmod_mass\tsite\ttype");
        for(Modification mod : name2mod.values()){
            System.out.println(mod.getName() + "\t" + mod.getMassShift() + "\t" + mod.getSiteName() + "\t" + (mod.isFixed() ? "fix" : "opt"));
        }
    }

    public static final class Builder {

        private final Map<String, Modification> name2mod = new LinkedHashMap<>();

        private Builder(){
        }

        public Builder add(Modification mod){
            name2mod.put(mod.getName(), mod);
            return this;
        }

        /**
         * Add a modification from a string like {@code Oxidation,15.994915,opt,M}. The third
         * field is {@code opt} for variable or {@code fix} for fixed modifications, the fourth
         * field a residue letter, {@code N-term} or {@code C-term}.
         */
        public Builder add(String modString){
            String[] d = modString.trim().split(",");
            if(d.length != 4){
                throw new IllegalArgumentException("Invalid modification definition: " + modString);
            }
            String name = d[0].trim();
            double massShift;
            try {
                massShift = Double.parseDouble(d[1].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid mass shift in modification definition: " + modString, e);
            }
            boolean fixed = d[2].trim().equalsIgnoreCase("fix") || d[2].trim().equalsIgnoreCase("fixed");
            String site = d[3].trim();
            Modification mod;
            if(site.equalsIgnoreCase("N-term")){
                mod = new Modification(name, massShift, Modification.Site.N_TERM, -1, fixed);
            }else if(site.equalsIgnoreCase("C-term")){
                mod = new Modification(name, massShift, Modification.Site.C_TERM, -1, fixed);
            }else{
                int residue = site.length() == 1 ? ResidueTable.getDefault().indexOf(site.charAt(0)) : -1;
                if(residue < 0){
                    throw new IllegalArgumentException("Unsupported modification site '" + site + "' in: " + modString);
                }
                mod = new Modification(name, massShift, Modification.Site.RESIDUE, residue, fixed);
            }
            return add(mod);
        }

        public Builder addAll(Collection<String> modStrings){
            for(String s : modStrings){
                if(!s.isBlank() && !s.startsWith("#")){
                    add(s);
                }
            }
            return this;
        }

        public Builder addDefaults(){
            for(Modification mod : load_default_modifications()){
                add(mod);
            }
            return this;
        }

        public ModificationTable build(){
            return new ModificationTable(name2mod);
        }
    }

    static List<Modification> load_default_modifications(){
        List<Modification> mods = new ArrayList<>();
        InputStream inputStream = ModificationTable.class.getResourceAsStream(DEFAULT_MODIFICATIONS);
        if(inputStream == null){
            throw new IllegalStateException("Resource not found: " + DEFAULT_MODIFICATIONS);
        }
        try (InputStream in = inputStream) {
            List<String> lines = IOUtils.readLines(in, StandardCharsets.UTF_8);
            String[] head = lines.get(0).split("\t");
            HashMap<String, Integer> column2index = new HashMap<>();
            for (int i = 0; i < head.length; i++) {
                column2index.put(head[i], i);
            }
            Builder parser = new Builder();
            for (int i = 1; i < lines.size(); i++) {
                if(lines.get(i).isBlank()){
                    continue;
                }
                String[] line = lines.get(i).split("\t");
                parser.add(line[column2index.get("mod_name")] + "," + line[column2index.get("mod_mass")] + ",opt," + line[column2index.get("site")]);
            }
            mods.addAll(parser.name2mod.values());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_MODIFICATIONS, e);
        }
        return mods;
    }
}
