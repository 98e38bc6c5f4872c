package irforge.base.types;

import java.util.Objects;

/**
 * A trait applied to generic arguments, e.g. {@code String: Foo<bool>} has generics {@code [String, bool]}.
 * Usually found under a {@link RegionBinder} (a poly trait decl ref).
 */
public class TraitDeclRef {
    public final AnyDeclId traitId;
    public final GenericArgs generics;

    public TraitDeclRef(AnyDeclId traitId, GenericArgs generics) {
        this.traitId = traitId.expect(AnyDeclId.Kind.TRAIT_DECL);
        this.generics = Objects.requireNonNull(generics);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitDeclRef that = (TraitDeclRef) o;
        return traitId.equals(that.traitId) && generics.equals(that.generics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traitId, generics);
    }

    @Override
    public String toString() {
        return traitId + generics.toString();
    }
}
