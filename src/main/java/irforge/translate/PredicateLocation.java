package irforge.translate;

import irforge.base.types.TraitClause;

import java.util.List;

/**
 * Which clause list a trait predicate is registered in.
 */
public class PredicateLocation {
    public enum Kind {
        /** The item's own generic parameters. */
        BASE,
        /** Supertrait clauses of a trait declaration. */
        PARENT,
        /** Bounds of an associated type of a trait declaration. */
        ITEM
    }

    public final Kind kind;
    public final String itemName;
    final List<TraitClause> target;

    private PredicateLocation(Kind kind, String itemName, List<TraitClause> target) {
        this.kind = kind;
        this.itemName = itemName;
        this.target = target;
    }

    public static PredicateLocation base(ItemTransCtx ctx) {
        return new PredicateLocation(Kind.BASE, null, ctx.generics.traitClauses);
    }

    public static PredicateLocation parent(List<TraitClause> parentClauses) {
        return new PredicateLocation(Kind.PARENT, null, parentClauses);
    }

    public static PredicateLocation item(String itemName, List<TraitClause> itemClauses) {
        return new PredicateLocation(Kind.ITEM, itemName, itemClauses);
    }

    @Override
    public String toString() {
        return kind == Kind.ITEM ? "Item(" + itemName + ")" : kind.name();
    }
}
