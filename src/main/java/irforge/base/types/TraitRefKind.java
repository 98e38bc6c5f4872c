package irforge.base.types;

import java.util.Objects;

/**
 * How a trait obligation is discharged. A tree whose leaves are a concrete impl, a local clause,
 * {@code Self}, a builtin/auto witness, a {@code dyn} witness, or an error; inner nodes climb
 * supertrait edges ({@link ParentClause}) or associated-type clauses ({@link ItemClause}).
 */
public abstract class TraitRefKind {

    /** A specific top-level implementation. */
    public static final class TraitImpl extends TraitRefKind {
        public final AnyDeclId implId;
        public final GenericArgs generics;

        public TraitImpl(AnyDeclId implId, GenericArgs generics) {
            this.implId = implId.expect(AnyDeclId.Kind.TRAIT_IMPL);
            this.generics = Objects.requireNonNull(generics);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TraitImpl other && implId.equals(other.implId) && generics.equals(other.generics);
        }

        @Override
        public int hashCode() {
            return Objects.hash(implId, generics);
        }

        @Override
        public String toString() {
            return implId + generics.toString();
        }
    }

    /**
     * One of the clauses of the current item.
     * <pre>
     * fn f&lt;T&gt;(...) where T: Foo
     *                    ^^^^^^ Clause(0)
     * </pre>
     */
    public static final class Clause extends TraitRefKind {
        public final int clauseId;

        public Clause(int clauseId) {
            this.clauseId = clauseId;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Clause other && clauseId == other.clauseId;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(clauseId) * 17 + 1;
        }

        @Override
        public String toString() {
            return "Clause(" + clauseId + ")";
        }
    }

    /**
     * Parent clause {@code clauseId} of the trait {@code traitDeclId} implemented by {@code parent}.
     * <pre>
     * trait Bar: Foo1 + Foo2 {}
     * fn g&lt;T: Bar&gt;(x: T) { x.f() }   // f from Foo2: ParentClause(Clause(0), Bar, 1)
     * </pre>
     */
    public static final class ParentClause extends TraitRefKind {
        public final TraitRefKind parent;
        public final AnyDeclId traitDeclId;
        public final int clauseId;

        public ParentClause(TraitRefKind parent, AnyDeclId traitDeclId, int clauseId) {
            this.parent = Objects.requireNonNull(parent);
            this.traitDeclId = traitDeclId.expect(AnyDeclId.Kind.TRAIT_DECL);
            this.clauseId = clauseId;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ParentClause other && clauseId == other.clauseId
                    && parent.equals(other.parent) && traitDeclId.equals(other.traitDeclId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parent, traitDeclId, clauseId);
        }

        @Override
        public String toString() {
            return String.format("ParentClause(%s, %s, %d)", parent, traitDeclId, clauseId);
        }
    }

    /**
     * Clause {@code clauseId} attached to the associated type {@code itemName} of the trait
     * {@code traitDeclId} implemented by {@code parent}.
     */
    public static final class ItemClause extends TraitRefKind {
        public final TraitRefKind parent;
        public final AnyDeclId traitDeclId;
        public final String itemName;
        public final int clauseId;

        public ItemClause(TraitRefKind parent, AnyDeclId traitDeclId, String itemName, int clauseId) {
            this.parent = Objects.requireNonNull(parent);
            this.traitDeclId = traitDeclId.expect(AnyDeclId.Kind.TRAIT_DECL);
            this.itemName = Objects.requireNonNull(itemName);
            this.clauseId = clauseId;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ItemClause other && clauseId == other.clauseId
                    && parent.equals(other.parent) && traitDeclId.equals(other.traitDeclId)
                    && itemName.equals(other.itemName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parent, traitDeclId, itemName, clauseId);
        }

        @Override
        public String toString() {
            return String.format("ItemClause(%s, %s, %s, %d)", parent, traitDeclId, itemName, clauseId);
        }
    }

    /** The implicit witness inside a trait declaration or implementation. */
    public static final class SelfId extends TraitRefKind {
        public static final SelfId INSTANCE = new SelfId();

        private SelfId() {}

        @Override
        public String toString() {
            return "Self";
        }
    }

    /** A builtin trait implementation (e.g. {@code Sized}) or an auto trait implementation. */
    public static final class BuiltinOrAuto extends TraitRefKind {
        public final RegionBinder<TraitDeclRef> traitDeclRef;

        public BuiltinOrAuto(RegionBinder<TraitDeclRef> traitDeclRef) {
            this.traitDeclRef = Objects.requireNonNull(traitDeclRef);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BuiltinOrAuto other && traitDeclRef.equals(other.traitDeclRef);
        }

        @Override
        public int hashCode() {
            return traitDeclRef.hashCode() * 31 + 3;
        }

        @Override
        public String toString() {
            return "BuiltinOrAuto(" + traitDeclRef + ")";
        }
    }

    /** The implementation generated for {@code dyn Trait}. */
    public static final class Dyn extends TraitRefKind {
        public final RegionBinder<TraitDeclRef> traitDeclRef;

        public Dyn(RegionBinder<TraitDeclRef> traitDeclRef) {
            this.traitDeclRef = Objects.requireNonNull(traitDeclRef);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Dyn other && traitDeclRef.equals(other.traitDeclRef);
        }

        @Override
        public int hashCode() {
            return traitDeclRef.hashCode() * 31 + 5;
        }

        @Override
        public String toString() {
            return "Dyn(" + traitDeclRef + ")";
        }
    }

    /** Resolution failed; carries the diagnostic. */
    public static final class Unknown extends TraitRefKind {
        public final String message;

        public Unknown(String message) {
            this.message = Objects.requireNonNull(message);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Unknown other && message.equals(other.message);
        }

        @Override
        public int hashCode() {
            return message.hashCode();
        }

        @Override
        public String toString() {
            return "Unknown(" + message + ")";
        }
    }
}
