package pepfrag.ai;

/**
 * Fragment ion types a model can be trained for. Doubly charged series are separate
 * types because they are predicted by their own models.
 */
public enum IonType {
    B('b', 1, true),
    Y('y', 1, false),
    C('c', 1, true),
    Z('z', 1, false),
    B2('b', 2, true),
    Y2('y', 2, false);

    private final char series;
    private final int charge;
    private final boolean nTerminal;

    IonType(char series, int charge, boolean nTerminal){
        this.series = series;
        this.charge = charge;
        this.nTerminal = nTerminal;
    }

    /**
     * Series letter: b, c, y or z.
     */
    public char getSeries() {
        return series;
    }

    public int getCharge() {
        return charge;
    }

    /**
     * True for ions that keep the N-terminus (b, c).
     */
    public boolean isNTerminal() {
        return nTerminal;
    }

    /**
     * Label used in model manifests and output, e.g. "b" or "y2".
     */
    public String getLabel(){
        return charge == 1 ? String.valueOf(series) : series + String.valueOf(charge);
    }

    public static IonType fromLabel(String label){
        for(IonType t : values()){
            if(t.getLabel().equalsIgnoreCase(label.trim())){
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown ion type: " + label);
    }
}
