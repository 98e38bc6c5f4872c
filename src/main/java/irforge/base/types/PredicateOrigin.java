package irforge.base.types;

import java.util.Objects;

/**
 * Where a predicate was written, relative to the item that requires it.
 */
public class PredicateOrigin {

    public enum Kind {
        /** {@code fn f<T: Clone>()}, also used for globals. */
        WHERE_CLAUSE_ON_FN,
        /** {@code struct S<T: Clone>}, type aliases. */
        WHERE_CLAUSE_ON_TYPE,
        /** Trait impls and inherent impl blocks. */
        WHERE_CLAUSE_ON_IMPL,
        /** The {@code Self: Trait} clause in scope inside a trait declaration or its items. */
        TRAIT_SELF,
        /** Where clauses on a trait, including supertraits. */
        WHERE_CLAUSE_ON_TRAIT,
        /** Bounds on an associated type: {@code type Assoc: Clone;} */
        TRAIT_ITEM
    }

    public static final PredicateOrigin WHERE_CLAUSE_ON_FN = new PredicateOrigin(Kind.WHERE_CLAUSE_ON_FN, null);
    public static final PredicateOrigin WHERE_CLAUSE_ON_TYPE = new PredicateOrigin(Kind.WHERE_CLAUSE_ON_TYPE, null);
    public static final PredicateOrigin WHERE_CLAUSE_ON_IMPL = new PredicateOrigin(Kind.WHERE_CLAUSE_ON_IMPL, null);
    public static final PredicateOrigin TRAIT_SELF = new PredicateOrigin(Kind.TRAIT_SELF, null);
    public static final PredicateOrigin WHERE_CLAUSE_ON_TRAIT = new PredicateOrigin(Kind.WHERE_CLAUSE_ON_TRAIT, null);

    public final Kind kind;
    /** Set for {@link Kind#TRAIT_ITEM}. */
    public final String itemName;

    private PredicateOrigin(Kind kind, String itemName) {
        this.kind = kind;
        this.itemName = itemName;
    }

    public static PredicateOrigin traitItem(String itemName) {
        return new PredicateOrigin(Kind.TRAIT_ITEM, Objects.requireNonNull(itemName));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PredicateOrigin that = (PredicateOrigin) o;
        return kind == that.kind && Objects.equals(itemName, that.itemName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, itemName);
    }

    @Override
    public String toString() {
        return itemName == null ? kind.name() : kind.name() + "(" + itemName + ")";
    }
}
