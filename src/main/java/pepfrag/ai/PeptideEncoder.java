package pepfrag.ai;

import pepfrag.error.UnsupportedMethodException;
import pepfrag.input.ResidueTable;
import pepfrag.input.ResolvedPeptide;

import java.util.List;

/**
 * Turns a resolved peptide into a {@link FeatureMatrix}: one feature vector per ion type of
 * the fragmentation method and per ion number 1..length-1.
 *
 * <p>Rows are ordered by the method's ion types, then by ion number. For N-terminal ions
 * (b, c) ion number k is the cleavage after residue k; for C-terminal ions (y, z) it is the
 * cleavage after residue length-k. Encoding is a pure function of its input, all sums are
 * accumulated in a fixed order so repeated calls give bit-identical matrices.
 */
public final class PeptideEncoder {

    private final FeatureSchema schema;
    private final ResidueTable residueTable;

    public PeptideEncoder(FeatureSchema schema, ResidueTable residueTable){
        this.schema = schema;
        this.residueTable = residueTable;
    }

    public PeptideEncoder(){
        this(FeatureSchema.V1, ResidueTable.getDefault());
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    /**
     * @throws UnsupportedMethodException if the method name is unknown
     */
    public FeatureMatrix encode(ResolvedPeptide peptide, String method) throws UnsupportedMethodException {
        return encode(peptide, FragmentationMethod.fromName(method));
    }

    public FeatureMatrix encode(ResolvedPeptide peptide, FragmentationMethod method){
        PeptideProfile profile = new PeptideProfile(peptide);
        List<IonType> ionTypes = method.getIonTypes();
        int n = peptide.length();
        int nRows = method.getIonCount(n);
        double[][] rows = new double[nRows][];
        IonType[] rowTypes = new IonType[nRows];
        int[] ionNumbers = new int[nRows];
        double[] mzs = new double[nRows];
        int r = 0;
        for(IonType ionType : ionTypes){
            for(int k=1;k<n;k++){
                int cleavage = ionType.isNTerminal() ? k : n - k;
                double mz = fragmentMz(profile, ionType, cleavage);
                rows[r] = encodeRow(profile, ionType, k, cleavage, mz);
                rowTypes[r] = ionType;
                ionNumbers[r] = k;
                mzs[r] = mz;
                r++;
            }
        }
        return new FeatureMatrix(schema, rows, rowTypes, ionNumbers, mzs);
    }

    /**
     * Theoretical m/z of one ion of a peptide.
     *
     * @param ionNumber 1..length-1
     */
    public double ionMz(ResolvedPeptide peptide, IonType ionType, int ionNumber){
        int n = peptide.length();
        if(ionNumber < 1 || ionNumber >= n){
            throw new IllegalArgumentException("Ion number " + ionNumber + " out of range for peptide length " + n);
        }
        return fragmentMz(new PeptideProfile(peptide), ionType, ionType.isNTerminal() ? ionNumber : n - ionNumber);
    }

    /**
     * Theoretical m/z of an ion, {@code cleavage} residues form the N-terminal part.
     */
    static double fragmentMz(PeptideProfile profile, IonType ionType, int cleavage){
        double neutral;
        switch (ionType.getSeries()) {
            case 'b':
                neutral = profile.prefixMass(cleavage);
                break;
            case 'c':
                neutral = profile.prefixMass(cleavage) + ResidueTable.NH3_MASS;
                break;
            case 'y':
                neutral = profile.suffixMass(cleavage) + ResidueTable.H2O_MASS;
                break;
            case 'z':
                neutral = profile.suffixMass(cleavage) + ResidueTable.H2O_MASS - ResidueTable.NH2_MASS;
                break;
            default:
                throw new IllegalStateException("Unknown ion series: " + ionType.getSeries());
        }
        int z = ionType.getCharge();
        return (neutral + z * ResidueTable.PROTON_MASS) / z;
    }

    private double[] encodeRow(PeptideProfile p, IonType ionType, int ionNumber, int cleavage, double mz){
        int n = p.length;
        double[] v = new double[schema.getFeatureCount()];
        int i = 0;

        v[i++] = n;
        v[i++] = p.peptide.getCharge();
        v[i++] = p.peptide.getMass();
        v[i++] = p.peptide.getPrecursorMz();

        v[i++] = ionType.getCharge();
        v[i++] = ionNumber;
        v[i++] = (double) ionNumber / n;
        v[i++] = cleavage;
        v[i++] = (double) cleavage / n;

        double prefix = p.prefixMass(cleavage);
        double suffix = p.suffixMass(cleavage);
        double fragment = ionType.isNTerminal() ? prefix : suffix;
        v[i++] = prefix;
        v[i++] = suffix;
        v[i++] = fragment;
        v[i++] = fragment / p.totalMass;
        v[i++] = mz;

        v[i++] = p.basicPrefix[cleavage];
        v[i++] = p.basicPrefix[n] - p.basicPrefix[cleavage];

        for(int prop=0;prop<ResidueTable.N_PROPERTIES;prop++){
            double[] sums = p.propertyPrefix[prop];
            v[i++] = sums[cleavage] / cleavage;
            v[i++] = (sums[n] - sums[cleavage]) / (n - cleavage);
            v[i++] = sums[n] / n;
        }

        i = writeResidue(v, i, p, 1, false);
        i = writeResidue(v, i, p, n, false);

        int radius = schema.getWindowRadius();
        for(int o = -radius + 1; o <= radius; o++){
            i = writeResidue(v, i, p, cleavage + o, true);
        }

        if(i != v.length){
            throw new IllegalStateException("Encoded " + i + " features, schema " + schema + " expects " + v.length);
        }
        return v;
    }

    /**
     * Write mass and properties of the residue at a 1-based position, zeros outside the peptide.
     */
    private int writeResidue(double[] v, int i, PeptideProfile p, int position, boolean withModDelta){
        if(position >= 1 && position <= p.length){
            int residue = p.peptide.residueAt(position - 1);
            v[i++] = residueTable.mass(residue);
            for(int prop=0;prop<ResidueTable.N_PROPERTIES;prop++){
                v[i++] = residueTable.property(residue, prop);
            }
            if(withModDelta){
                v[i++] = p.peptide.modMassAt(position);
            }
        }else{
            // arrays are zero-initialized
            i += 1 + ResidueTable.N_PROPERTIES + (withModDelta ? 1 : 0);
        }
        return i;
    }

    /**
     * Cumulative sums of one peptide, shared by all of its rows.
     */
    final class PeptideProfile {

        final ResolvedPeptide peptide;
        final int length;
        /**
         * prefix[c] = N-term modification + residues 1..c with their modifications.
         */
        final double[] prefix;
        /**
         * Residues plus all modifications, without water.
         */
        final double totalMass;
        final int[] basicPrefix;
        final double[][] propertyPrefix;

        PeptideProfile(ResolvedPeptide peptide){
            this.peptide = peptide;
            this.length = peptide.length();
            prefix = new double[length + 1];
            basicPrefix = new int[length + 1];
            propertyPrefix = new double[ResidueTable.N_PROPERTIES][length + 1];
            prefix[0] = peptide.modMassAt(0);
            for(int c=1;c<=length;c++){
                int residue = peptide.residueAt(c - 1);
                prefix[c] = prefix[c-1] + residueTable.mass(residue) + peptide.modMassAt(c);
                basicPrefix[c] = basicPrefix[c-1] + (residueTable.isBasic(residue) ? 1 : 0);
                for(int prop=0;prop<ResidueTable.N_PROPERTIES;prop++){
                    propertyPrefix[prop][c] = propertyPrefix[prop][c-1] + residueTable.property(residue, prop);
                }
            }
            totalMass = prefix[length] + peptide.modMassAt(length + 1);
        }

        double prefixMass(int cleavage){
            return prefix[cleavage];
        }

        double suffixMass(int cleavage){
            return totalMass - prefix[cleavage];
        }
    }
}
