package irforge.base.types;

import java.util.Objects;

/**
 * A resolved trait obligation: how it is discharged ({@code kind}) and which trait it is about.
 */
public class TraitRef {
    public final TraitRefKind kind;
    public final RegionBinder<TraitDeclRef> traitDeclRef;

    public TraitRef(TraitRefKind kind, RegionBinder<TraitDeclRef> traitDeclRef) {
        this.kind = Objects.requireNonNull(kind);
        this.traitDeclRef = Objects.requireNonNull(traitDeclRef);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitRef traitRef = (TraitRef) o;
        return kind.equals(traitRef.kind) && traitDeclRef.equals(traitRef.traitDeclRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, traitDeclRef);
    }

    @Override
    public String toString() {
        return kind + " : " + traitDeclRef;
    }
}
