package pepfrag.input;

/**
 * A modification reference as given in the input: a position and a modification name.
 * Position 0 is the N-terminus, length+1 the C-terminus and 1..length the residues.
 */
public final class PeptideModification {

    private final int position;
    private final String name;

    public PeptideModification(int position, String name){
        this.position = position;
        this.name = name;
    }

    public int getPosition() {
        return position;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PeptideModification)) {
            return false;
        }
        PeptideModification that = (PeptideModification) o;
        return position == that.position && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return 31 * position + name.hashCode();
    }

    @Override
    public String toString() {
        return position + "|" + name;
    }
}
