package irforge.base.types;

import java.util.Objects;

/**
 * The head constructor of an applied type: a declared ADT, a tuple, or a built-in.
 */
public class TypeId {
    public static final TypeId TUPLE = new TypeId(null, null);

    /** Set for user-declared (or external) ADTs. */
    public final AnyDeclId adt;
    /** Set for built-in types. */
    public final BuiltinTy builtin;

    private TypeId(AnyDeclId adt, BuiltinTy builtin) {
        this.adt = adt;
        this.builtin = builtin;
    }

    public static TypeId adt(AnyDeclId id) {
        return new TypeId(id.expect(AnyDeclId.Kind.TYPE), null);
    }

    public static TypeId builtin(BuiltinTy builtin) {
        return new TypeId(null, Objects.requireNonNull(builtin));
    }

    public boolean isTuple() {
        return adt == null && builtin == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeId typeId = (TypeId) o;
        return Objects.equals(adt, typeId.adt) && builtin == typeId.builtin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(adt, builtin);
    }

    @Override
    public String toString() {
        if (adt != null) return adt.toString();
        if (builtin != null) return builtin.name();
        return "Tuple";
    }
}
