package pepfrag.input;

import pepfrag.error.InvalidChargeException;
import pepfrag.error.InvalidModificationException;
import pepfrag.error.InvalidResidueException;
import pepfrag.error.PeptideLengthException;
import pepfrag.error.PredictionException;

/**
 * Validates input peptides against the residue and modification tables.
 * Stateless apart from the read-only tables, so one instance is shared by all workers.
 */
public final class PeptideResolver {

    public static final int DEFAULT_MIN_LENGTH = 4;
    public static final int DEFAULT_MAX_LENGTH = 100;

    private final ResidueTable residueTable;
    private final ModificationTable modificationTable;
    private final int minLength;
    private final int maxLength;

    public PeptideResolver(ResidueTable residueTable, ModificationTable modificationTable, int minLength, int maxLength){
        if(minLength < 2 || maxLength < minLength){
            throw new IllegalArgumentException("Invalid peptide length bounds: " + minLength + ".." + maxLength);
        }
        this.residueTable = residueTable;
        this.modificationTable = modificationTable;
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public PeptideResolver(ResidueTable residueTable, ModificationTable modificationTable){
        this(residueTable, modificationTable, DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH);
    }

    public ResidueTable getResidueTable() {
        return residueTable;
    }

    public ModificationTable getModificationTable() {
        return modificationTable;
    }

    /**
     * Resolve a peptide record.
     *
     * @throws PeptideLengthException if the sequence length is outside the supported bounds
     * @throws InvalidResidueException if the sequence contains an unknown residue symbol
     * @throws InvalidModificationException if a modification is unknown, out of range, placed on
     * an incompatible position or shares its position with another modification
     * @throws InvalidChargeException if the precursor charge is not positive
     */
    public ResolvedPeptide resolve(PeptideRecord record) throws PredictionException {
        String sequence = record.getSequence() == null ? "" : record.getSequence().trim();
        int n = sequence.length();
        if(n < minLength || n > maxLength){
            throw new PeptideLengthException("Peptide length " + n + " is outside the supported range " + minLength + ".." + maxLength + ": '" + sequence + "'");
        }
        int[] residues = new int[n];
        for(int i=0;i<n;i++){
            int r = residueTable.indexOf(sequence.charAt(i));
            if(r < 0){
                throw new InvalidResidueException("Unsupported amino acid '" + sequence.charAt(i) + "' at position " + (i+1) + " in peptide " + sequence);
            }
            residues[i] = r;
        }
        if(record.getCharge() < 1){
            throw new InvalidChargeException("Invalid precursor charge " + record.getCharge() + " for peptide " + sequence);
        }

        Modification[] mods = new Modification[n + 2];
        for(PeptideModification pm : record.getModifications()){
            int pos = pm.getPosition();
            if(pos < 0 || pos > n + 1){
                throw new InvalidModificationException("Modification position " + pos + " is out of range for peptide " + sequence + " (length " + n + ")");
            }
            Modification mod = modificationTable.get(pm.getName());
            if(mod == null){
                throw new InvalidModificationException("Unknown modification: " + pm.getName());
            }
            int residue = pos >= 1 && pos <= n ? residues[pos - 1] : -1;
            if(!mod.isCompatible(pos, n, residue)){
                throw new InvalidModificationException("Modification " + mod.getName() + " (" + mod.getSiteName() + ") cannot be placed at position " + pos + " of peptide " + sequence);
            }
            if(mods[pos] != null){
                throw new InvalidModificationException("More than one modification at position " + pos + " of peptide " + sequence);
            }
            mods[pos] = mod;
        }

        // fixed modifications go to every compatible free position
        for(Modification mod : modificationTable.getFixedModifications()){
            for(int pos=0;pos<=n+1;pos++){
                if(mods[pos] != null){
                    continue;
                }
                int residue = pos >= 1 && pos <= n ? residues[pos - 1] : -1;
                if(mod.isCompatible(pos, n, residue)){
                    mods[pos] = mod;
                }
            }
        }

        return new ResolvedPeptide(record.getId(), sequence.toUpperCase(), residues, mods, record.getCharge(), residueTable);
    }
}
