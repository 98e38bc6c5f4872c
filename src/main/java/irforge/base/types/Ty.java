package irforge.base.types;

/**
 * Canonical handle of a type. Only {@link TyStore#intern(TyKind)} creates handles, so two handles
 * are structurally equal exactly when they are the same object.
 */
public final class Ty {
    private final TyKind kind;
    private final int hash;

    Ty(TyKind kind) {
        this.kind = kind;
        this.hash = kind.hashCode();
    }

    public TyKind kind() {
        return kind;
    }

    public boolean isUnit() {
        return kind instanceof TyKind.Adt adt && adt.id.isTuple() && adt.generics.types.isEmpty();
    }

    public boolean isNever() {
        return kind instanceof TyKind.Never;
    }

    /** Reference identity: interning guarantees one handle per shape. */
    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return kind.toString();
    }
}
