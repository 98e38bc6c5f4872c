package irforge.base.types;

import java.util.Objects;

public class ConstGenericVar {
    public final int index;
    public final String name;
    public final LiteralTy ty;

    public ConstGenericVar(int index, String name, LiteralTy ty) {
        this.index = index;
        this.name = name;
        this.ty = ty;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstGenericVar that = (ConstGenericVar) o;
        return index == that.index && name.equals(that.name) && ty.equals(that.ty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name, ty);
    }

    @Override
    public String toString() {
        return String.format("const %s: %s", name, ty);
    }
}
