package irforge.base.types;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * The structural shape of a type. Instances are keys of the {@link TyStore}: they are immutable
 * and compare structurally. Children are {@link Ty} handles, so comparing two shapes only compares
 * the handles one level down.
 */
public abstract class TyKind {

    /** A nominal type, a tuple or a built-in type applied to generic arguments. */
    public static final class Adt extends TyKind {
        public final TypeId id;
        public final GenericArgs generics;

        public Adt(TypeId id, GenericArgs generics) {
            this.id = Objects.requireNonNull(id);
            this.generics = Objects.requireNonNull(generics);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Adt other && id.equals(other.id) && generics.equals(other.generics);
        }

        @Override
        public int hashCode() {
            return Objects.hash(1, id, generics);
        }

        @Override
        public String toString() {
            if (id.isTuple()) {
                StringJoiner joiner = new StringJoiner(", ", "(", ")");
                generics.types.forEach(t -> joiner.add(t.toString()));
                return joiner.toString();
            }
            return id + generics.toString();
        }
    }

    /** A type parameter of the enclosing item. */
    public static final class TypeVar extends TyKind {
        public final int index;

        public TypeVar(int index) {
            this.index = index;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TypeVar other && index == other.index;
        }

        @Override
        public int hashCode() {
            return Objects.hash(2, index);
        }

        @Override
        public String toString() {
            return "T" + index;
        }
    }

    public static final class Literal extends TyKind {
        public final LiteralTy ty;

        public Literal(LiteralTy ty) {
            this.ty = Objects.requireNonNull(ty);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal other && ty.equals(other.ty);
        }

        @Override
        public int hashCode() {
            return Objects.hash(3, ty);
        }

        @Override
        public String toString() {
            return ty.toString();
        }
    }

    public static final class Never extends TyKind {
        public static final Never INSTANCE = new Never();

        private Never() {}

        @Override
        public String toString() {
            return "!";
        }
    }

    public static final class Ref extends TyKind {
        public final Region region;
        public final Ty ty;
        public final RefKind refKind;

        public Ref(Region region, Ty ty, RefKind refKind) {
            this.region = Objects.requireNonNull(region);
            this.ty = Objects.requireNonNull(ty);
            this.refKind = Objects.requireNonNull(refKind);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ref other && region.equals(other.region) && ty.equals(other.ty)
                    && refKind == other.refKind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(4, region, ty, refKind);
        }

        @Override
        public String toString() {
            return String.format("&%s %s%s", region, refKind == RefKind.MUT ? "mut " : "", ty);
        }
    }

    public static final class RawPtr extends TyKind {
        public final Ty ty;
        public final RefKind refKind;

        public RawPtr(Ty ty, RefKind refKind) {
            this.ty = Objects.requireNonNull(ty);
            this.refKind = Objects.requireNonNull(refKind);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RawPtr other && ty.equals(other.ty) && refKind == other.refKind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(5, ty, refKind);
        }

        @Override
        public String toString() {
            return (refKind == RefKind.MUT ? "*mut " : "*const ") + ty;
        }
    }

    /** An associated type projection {@code <T as Trait>::Name}. */
    public static final class TraitType extends TyKind {
        public final TraitRef traitRef;
        public final String name;

        public TraitType(TraitRef traitRef, String name) {
            this.traitRef = Objects.requireNonNull(traitRef);
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TraitType other && traitRef.equals(other.traitRef) && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(6, traitRef, name);
        }

        @Override
        public String toString() {
            return traitRef.kind + "::" + name;
        }
    }

    /** An existential {@code dyn Trait1 + Trait2}. */
    public static final class DynTrait extends TyKind {
        public final List<RegionBinder<TraitDeclRef>> traits;

        public DynTrait(List<RegionBinder<TraitDeclRef>> traits) {
            this.traits = List.copyOf(traits);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DynTrait other && traits.equals(other.traits);
        }

        @Override
        public int hashCode() {
            return Objects.hash(7, traits);
        }

        @Override
        public String toString() {
            return "dyn " + traits;
        }
    }

    /** A function pointer type; it binds its own late-bound regions. */
    public static final class Arrow extends TyKind {
        public final RegionBinder<ArrowSig> sig;

        public Arrow(RegionBinder<ArrowSig> sig) {
            this.sig = Objects.requireNonNull(sig);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Arrow other && sig.equals(other.sig);
        }

        @Override
        public int hashCode() {
            return Objects.hash(8, sig);
        }

        @Override
        public String toString() {
            return sig.toString();
        }
    }
}
