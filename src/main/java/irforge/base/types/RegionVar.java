package irforge.base.types;

import java.util.Objects;

/**
 * A region variable introduced by a binder. The name is absent for anonymous regions.
 */
public class RegionVar {
    public final int index;
    public final String name;

    public RegionVar(int index, String name) {
        this.index = index;
        this.name = name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RegionVar that = (RegionVar) o;
        return index == that.index && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name);
    }

    @Override
    public String toString() {
        return name != null ? name : "'_" + index;
    }
}
