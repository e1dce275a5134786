package pepfrag.input;

import java.util.Arrays;

/**
 * A validated peptide: residue indices, per-position modification data and precursor
 * properties. Produced by {@link PeptideResolver}; immutable.
 */
public final class ResolvedPeptide {

    private final String id;
    private final String sequence;
    private final int[] residues;
    /**
     * Modification per position, 0 = N-term, length+1 = C-term, null where unmodified.
     */
    private final Modification[] mods;
    private final int charge;
    private final double mass;

    ResolvedPeptide(String id, String sequence, int[] residues, Modification[] mods, int charge, ResidueTable residueTable){
        this.id = id;
        this.sequence = sequence;
        this.residues = residues;
        this.mods = mods;
        this.charge = charge;
        double m = ResidueTable.H2O_MASS;
        for(int r : residues){
            m += residueTable.mass(r);
        }
        for(Modification mod : mods){
            if(mod != null){
                m += mod.getMassShift();
            }
        }
        this.mass = m;
    }

    public String getId() {
        return id;
    }

    public String getSequence() {
        return sequence;
    }

    public int length(){
        return residues.length;
    }

    /**
     * @param i 0-based residue index
     */
    public int residueAt(int i){
        return residues[i];
    }

    public int[] getResidues(){
        return Arrays.copyOf(residues, residues.length);
    }

    /**
     * @param position 0 = N-term, 1..length residues, length+1 = C-term
     */
    public Modification modificationAt(int position){
        return mods[position];
    }

    /**
     * Mass delta of the modification at a position, 0.0 when unmodified.
     */
    public double modMassAt(int position){
        return mods[position] == null ? 0.0 : mods[position].getMassShift();
    }

    public boolean isModified(){
        for(Modification mod : mods){
            if(mod != null){
                return true;
            }
        }
        return false;
    }

    public int getCharge() {
        return charge;
    }

    /**
     * Neutral monoisotopic mass including modifications.
     */
    public double getMass() {
        return mass;
    }

    public double getPrecursorMz(){
        return (mass + charge * ResidueTable.PROTON_MASS) / charge;
    }

    /**
     * PEPREC style modification string of the resolved modifications, fixed ones included.
     */
    public String getModificationString(){
        StringBuilder sb = new StringBuilder();
        for(int i=0;i<mods.length;i++){
            if(mods[i] != null){
                if(sb.length() > 0){
                    sb.append('|');
                }
                sb.append(i).append('|').append(mods[i].getName());
            }
        }
        return sb.length() == 0 ? "-" : sb.toString();
    }
}
