package pepfrag.input;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One input peptide: sequence, modification references, precursor charge and identifier.
 * No validation happens here, see {@link PeptideResolver}.
 */
public final class PeptideRecord {

    private final String id;
    private final String sequence;
    private final List<PeptideModification> modifications;
    private final int charge;

    public PeptideRecord(String id, String sequence, List<PeptideModification> modifications, int charge){
        this.id = id;
        this.sequence = sequence;
        this.modifications = modifications == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(modifications));
        this.charge = charge;
    }

    public PeptideRecord(String id, String sequence, int charge){
        this(id, sequence, Collections.emptyList(), charge);
    }

    /**
     * Build a record from a PEPREC style modification string such as {@code 0|Acetyl|3|Oxidation};
     * {@code -} or an empty string means no modification.
     *
     * @throws IllegalArgumentException if the modification string is malformed
     */
    public static PeptideRecord fromPeprec(String id, String sequence, String modifications, int charge){
        return new PeptideRecord(id, sequence, parseModifications(modifications), charge);
    }

    public static List<PeptideModification> parseModifications(String modifications){
        List<PeptideModification> mods = new ArrayList<>();
        if(StringUtils.isBlank(modifications) || modifications.trim().equals("-")){
            return mods;
        }
        String[] d = modifications.trim().split("\\|");
        if(d.length % 2 != 0){
            throw new IllegalArgumentException("Invalid modification string: " + modifications);
        }
        for(int i=0;i<d.length;i+=2){
            int pos;
            try {
                pos = Integer.parseInt(d[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid modification position '" + d[i] + "' in: " + modifications, e);
            }
            mods.add(new PeptideModification(pos, d[i+1].trim()));
        }
        return mods;
    }

    public String getId() {
        return id;
    }

    public String getSequence() {
        return sequence;
    }

    public List<PeptideModification> getModifications() {
        return modifications;
    }

    public int getCharge() {
        return charge;
    }

    public String getModificationString(){
        if(modifications.isEmpty()){
            return "-";
        }
        return StringUtils.join(modifications, '|');
    }

    @Override
    public String toString() {
        return id + " " + sequence + "/" + charge + " " + getModificationString();
    }
}
