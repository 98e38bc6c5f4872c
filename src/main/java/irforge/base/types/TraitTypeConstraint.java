package irforge.base.types;

import java.util.Objects;

/**
 * A constraint on an associated type, e.g. the {@code S = String} in {@code T: Foo<S = String>}.
 */
public class TraitTypeConstraint {
    public final TraitRef traitRef;
    public final String typeName;
    public final Ty ty;

    public TraitTypeConstraint(TraitRef traitRef, String typeName, Ty ty) {
        this.traitRef = Objects.requireNonNull(traitRef);
        this.typeName = Objects.requireNonNull(typeName);
        this.ty = Objects.requireNonNull(ty);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitTypeConstraint that = (TraitTypeConstraint) o;
        return traitRef.equals(that.traitRef) && typeName.equals(that.typeName) && ty.equals(that.ty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traitRef, typeName, ty);
    }

    @Override
    public String toString() {
        return String.format("%s::%s = %s", traitRef.kind, typeName, ty);
    }
}
