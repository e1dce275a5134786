package pepfrag.dia;

/**
 * What the assembler does with a theoretical ion that has no prediction. One policy
 * applies to a whole batch.
 */
public enum MissingIonPolicy {
    /**
     * Add the ion with zero intensity.
     */
    FILL("fill"),
    /**
     * Leave the ion out of the spectrum.
     */
    OMIT("omit");

    private final String label;

    MissingIonPolicy(String label){
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static MissingIonPolicy fromLabel(String label){
        for(MissingIonPolicy p : values()){
            if(p.label.equalsIgnoreCase(label.trim())){
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown missing ion policy: " + label + " (fill, omit)");
    }
}
