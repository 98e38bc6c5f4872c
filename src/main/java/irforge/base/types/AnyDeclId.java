package irforge.base.types;

import java.util.Objects;

/**
 * Identifier of a translated item. Indices are dense within each kind.
 */
public class AnyDeclId implements Comparable<AnyDeclId> {

    public enum Kind {
        TYPE("Type"),
        FUN("Fun"),
        GLOBAL("Global"),
        TRAIT_DECL("TraitDecl"),
        TRAIT_IMPL("TraitImpl");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }
    }

    public final Kind kind;
    public final int index;

    public AnyDeclId(Kind kind, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative item index: " + index);
        }
        this.kind = kind;
        this.index = index;
    }

    public static AnyDeclId type(int index) {
        return new AnyDeclId(Kind.TYPE, index);
    }

    public static AnyDeclId fun(int index) {
        return new AnyDeclId(Kind.FUN, index);
    }

    public static AnyDeclId global(int index) {
        return new AnyDeclId(Kind.GLOBAL, index);
    }

    public static AnyDeclId traitDecl(int index) {
        return new AnyDeclId(Kind.TRAIT_DECL, index);
    }

    public static AnyDeclId traitImpl(int index) {
        return new AnyDeclId(Kind.TRAIT_IMPL, index);
    }

    public AnyDeclId expect(Kind expected) {
        if (kind != expected) {
            throw new IllegalArgumentException(String.format("Expected a %s id, got %s", expected, this));
        }
        return this;
    }

    @Override
    public int compareTo(AnyDeclId o) {
        int c = kind.compareTo(o.kind);
        return c != 0 ? c : Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AnyDeclId that = (AnyDeclId) o;
        return index == that.index && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index);
    }

    @Override
    public String toString() {
        return kind.prefix + "@" + index;
    }
}
