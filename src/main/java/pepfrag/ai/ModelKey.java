package pepfrag.ai;

public final class ModelKey {

    private final FragmentationMethod method;
    private final IonType ionType;

    public ModelKey(FragmentationMethod method, IonType ionType){
        this.method = method;
        this.ionType = ionType;
    }

    public FragmentationMethod getMethod() {
        return method;
    }

    public IonType getIonType() {
        return ionType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModelKey)) {
            return false;
        }
        ModelKey that = (ModelKey) o;
        return method == that.method && ionType == that.ionType;
    }

    @Override
    public int hashCode() {
        return 31 * method.hashCode() + ionType.hashCode();
    }

    @Override
    public String toString() {
        return method.getLabel() + "/" + ionType.getLabel();
    }
}
