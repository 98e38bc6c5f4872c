package irforge.base.types;

import java.util.Objects;

public class TypeVar {
    public final int index;
    public final String name;

    public TypeVar(int index, String name) {
        this.index = index;
        this.name = name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeVar typeVar = (TypeVar) o;
        return index == typeVar.index && name.equals(typeVar.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
