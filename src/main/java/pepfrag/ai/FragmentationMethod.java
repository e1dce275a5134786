package pepfrag.ai;

import pepfrag.error.UnsupportedMethodException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Supported fragmentation methods / instruments and the ordered ion types each one produces.
 */
public enum FragmentationMethod {
    HCD("HCD", new String[]{"HCD2021"}, IonType.B, IonType.Y),
    HCD2019("HCD2019", new String[0], IonType.B, IonType.Y),
    IMMUNO_HCD("Immuno-HCD", new String[0], IonType.B, IonType.Y),
    CID("CID", new String[0], IonType.B, IonType.Y),
    TMT("TMT", new String[]{"TMT-HCD"}, IonType.B, IonType.Y),
    CID_TMT("CID-TMT", new String[0], IonType.B, IonType.Y),
    ITRAQ("iTRAQ", new String[0], IonType.B, IonType.Y),
    ITRAQ_PHOSPHO("iTRAQphospho", new String[0], IonType.B, IonType.Y),
    TTOF5600("TTOF5600", new String[0], IonType.B, IonType.Y),
    HCD_CH2("HCDch2", new String[0], IonType.B, IonType.Y, IonType.B2, IonType.Y2),
    CID_CH2("CIDch2", new String[0], IonType.B, IonType.Y, IonType.B2, IonType.Y2),
    ETD("ETD", new String[0], IonType.B, IonType.Y, IonType.C, IonType.Z);

    private final String label;
    private final String[] aliases;
    private final List<IonType> ionTypes;

    FragmentationMethod(String label, String[] aliases, IonType... ionTypes){
        this.label = label;
        this.aliases = aliases;
        this.ionTypes = Collections.unmodifiableList(Arrays.asList(ionTypes));
    }

    public String getLabel() {
        return label;
    }

    /**
     * Ion types in the order their feature rows are emitted.
     */
    public List<IonType> getIonTypes() {
        return ionTypes;
    }

    /**
     * Number of theoretical ions for a peptide of the given length.
     */
    public int getIonCount(int peptideLength){
        return (peptideLength - 1) * ionTypes.size();
    }

    /**
     * Look up a method by label or alias, case-insensitive.
     *
     * @throws UnsupportedMethodException if no method has this name
     */
    public static FragmentationMethod fromName(String name) throws UnsupportedMethodException {
        if(name != null){
            String s = name.trim();
            for(FragmentationMethod m : values()){
                if(m.label.equalsIgnoreCase(s) || m.name().equalsIgnoreCase(s)){
                    return m;
                }
                for(String alias : m.aliases){
                    if(alias.equalsIgnoreCase(s)){
                        return m;
                    }
                }
            }
        }
        throw new UnsupportedMethodException("Unsupported fragmentation method: " + name);
    }
}
