package pepfrag.input;

import java.util.Arrays;

/**
 * Static amino acid data: monoisotopic residue masses and the physicochemical properties
 * used by the feature encoder. Leucine is isobaric with isoleucine and is encoded as I.
 */
public final class ResidueTable {

    public static final double PROTON_MASS = 1.007276466812;
    public static final double H2O_MASS = 18.010564684;
    public static final double NH3_MASS = 17.026549101;
    public static final double NH2_MASS = 16.018724069;

    /**
     * Residue symbols in index order. L is not listed, see {@link #indexOf(char)}.
     */
    private static final char[] RESIDUES = {
            'A', 'C', 'D', 'E', 'F', 'G', 'H', 'I', 'K', 'M',
            'N', 'P', 'Q', 'R', 'S', 'T', 'V', 'W', 'Y'
    };

    private static final double[] MASSES = {
            71.037114, 103.00919, 115.026943, 129.042593, 147.068414,
            57.021464, 137.058912, 113.084064, 128.094963, 131.040485,
            114.042927, 97.052764, 128.058578, 156.101111, 87.032028,
            101.047679, 99.068414, 186.079313, 163.063329
    };

    // gas-phase basicity (kcal/mol)
    private static final double[] BASICITY = {
            206.4, 206.2, 208.6, 215.6, 212.1, 202.7, 223.7, 210.8, 221.8, 213.3,
            212.8, 214.4, 214.2, 237.0, 207.6, 211.7, 208.7, 216.1, 213.1
    };

    // Kyte-Doolittle
    private static final double[] HYDROPHOBICITY = {
            1.8, 2.5, -3.5, -3.5, 2.8, -0.4, -3.2, 4.5, -3.9, 1.9,
            -3.5, -1.6, -3.5, -4.5, -0.8, -0.7, 4.2, -0.9, -1.3
    };

    // Chou-Fasman helix propensity
    private static final double[] HELICITY = {
            1.42, 0.70, 1.01, 1.51, 1.13, 0.57, 1.00, 1.08, 1.16, 1.45,
            0.67, 0.57, 1.11, 0.98, 0.77, 0.83, 1.06, 1.08, 0.69
    };

    private static final double[] PI = {
            6.00, 5.07, 2.77, 3.22, 5.48, 5.97, 7.59, 6.02, 9.74, 5.74,
            5.41, 6.30, 5.65, 10.76, 5.68, 5.60, 5.96, 5.89, 5.66
    };

    /**
     * Number of physicochemical properties per residue, excluding mass.
     */
    public static final int N_PROPERTIES = 4;

    public static final String[] PROPERTY_NAMES = {"basicity", "hydrophobicity", "helicity", "pi"};

    private static final ResidueTable DEFAULT = new ResidueTable();

    private final int[] symbol2index = new int[128];
    private final double[][] properties;

    private ResidueTable(){
        Arrays.fill(symbol2index, -1);
        for(int i=0;i<RESIDUES.length;i++){
            symbol2index[RESIDUES[i]] = i;
        }
        symbol2index['L'] = symbol2index['I'];
        properties = new double[RESIDUES.length][];
        for(int i=0;i<RESIDUES.length;i++){
            properties[i] = new double[]{BASICITY[i], HYDROPHOBICITY[i], HELICITY[i], PI[i]};
        }
    }

    public static ResidueTable getDefault() {
        return DEFAULT;
    }

    /**
     * @return the residue index of the symbol (case-insensitive, L maps to I), or -1 when unknown
     */
    public int indexOf(char symbol){
        char c = Character.toUpperCase(symbol);
        if(c >= symbol2index.length){
            return -1;
        }
        return symbol2index[c];
    }

    public boolean isKnown(char symbol){
        return indexOf(symbol) >= 0;
    }

    public char symbol(int index){
        return RESIDUES[index];
    }

    public int size(){
        return RESIDUES.length;
    }

    public double mass(int index){
        return MASSES[index];
    }

    /**
     * Property value of a residue; {@code property} indexes {@link #PROPERTY_NAMES}.
     */
    public double property(int index, int property){
        return properties[index][property];
    }

    public boolean isBasic(int index){
        char c = RESIDUES[index];
        return c == 'K' || c == 'R' || c == 'H';
    }
}
