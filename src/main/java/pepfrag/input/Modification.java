package pepfrag.input;

/**
 * A registered modification. Instances are created once when the {@link ModificationTable}
 * is built and are shared by every peptide that references them.
 */
public final class Modification {

    public enum Site {
        RESIDUE,
        N_TERM,
        C_TERM
    }

    private final String name;
    private final double massShift;
    private final Site site;
    /**
     * Residue index in {@link ResidueTable}, -1 for terminal modifications.
     */
    private final int residue;
    private final boolean fixed;

    public Modification(String name, double massShift, Site site, int residue, boolean fixed){
        if(site == Site.RESIDUE && residue < 0){
            throw new IllegalArgumentException("Residue modification without a residue: " + name);
        }
        this.name = name;
        this.massShift = massShift;
        this.site = site;
        this.residue = site == Site.RESIDUE ? residue : -1;
        this.fixed = fixed;
    }

    public String getName() {
        return name;
    }

    public double getMassShift() {
        return massShift;
    }

    public Site getSite() {
        return site;
    }

    public int getResidue() {
        return residue;
    }

    public boolean isFixed() {
        return fixed;
    }

    /**
     * Whether this modification may sit at {@code position} of a peptide of the given length.
     * Position 0 is the N-terminus, length+1 the C-terminus, 1..length the residues.
     *
     * @param residueAtPosition residue index at the position, ignored for terminal positions
     */
    public boolean isCompatible(int position, int length, int residueAtPosition){
        switch (site) {
            case N_TERM:
                return position == 0;
            case C_TERM:
                return position == length + 1;
            default:
                return position >= 1 && position <= length && residueAtPosition == residue;
        }
    }

    public String getSiteName(){
        if(site == Site.N_TERM){
            return "N-term";
        }else if(site == Site.C_TERM){
            return "C-term";
        }
        return String.valueOf(ResidueTable.getDefault().symbol(residue));
    }

    @Override
    public String toString() {
        return name + "," + massShift + "," + (fixed ? "fix" : "opt") + "," + getSiteName();
    }
}
