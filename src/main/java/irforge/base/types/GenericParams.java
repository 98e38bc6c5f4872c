package irforge.base.types;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Declaration-side generic parameters of an item: region, type and const-generic variables,
 * trait clauses, and the non-trait predicates (outlives and associated-type constraints).
 * Built incrementally while an item is translated, frozen afterwards except for the whole-crate
 * clause pruning.
 */
public class GenericParams {
    public final List<RegionVar> regions = new ArrayList<>();
    public final List<TypeVar> types = new ArrayList<>();
    public final List<ConstGenericVar> constGenerics = new ArrayList<>();
    public final List<TraitClause> traitClauses = new ArrayList<>();
    public final List<RegionBinder<OutlivesPred<Region, Region>>> regionsOutlive = new ArrayList<>();
    public final List<RegionBinder<OutlivesPred<Ty, Region>>> typesOutlive = new ArrayList<>();
    public final List<RegionBinder<TraitTypeConstraint>> traitTypeConstraints = new ArrayList<>();

    public boolean isEmpty() {
        return regions.isEmpty() && types.isEmpty() && constGenerics.isEmpty() && traitClauses.isEmpty()
                && regionsOutlive.isEmpty() && typesOutlive.isEmpty() && traitTypeConstraints.isEmpty();
    }

    /**
     * The arguments that instantiate these parameters with themselves, as seen from directly
     * inside the item (no extra binder open).
     */
    public GenericArgs identityArgs(TyStore store, GenericsSource target) {
        List<Region> regionArgs = new ArrayList<>();
        for (var r : regions) {
            regionArgs.add(Region.bound(0, r.index));
        }
        List<Ty> typeArgs = new ArrayList<>();
        for (var t : types) {
            typeArgs.add(store.typeVar(t.index));
        }
        List<ConstGeneric> constArgs = new ArrayList<>();
        for (var c : constGenerics) {
            constArgs.add(new ConstGeneric.Var(c.index));
        }
        List<TraitRef> traitRefs = new ArrayList<>();
        for (var clause : traitClauses) {
            traitRefs.add(new TraitRef(new TraitRefKind.Clause(clause.clauseId), clause.trait));
        }
        return new GenericArgs(regionArgs, typeArgs, constArgs, traitRefs, target);
    }

    /** A copy whose lists can be changed independently; the elements themselves are immutable. */
    public GenericParams copy() {
        GenericParams copy = new GenericParams();
        copy.regions.addAll(regions);
        copy.types.addAll(types);
        copy.constGenerics.addAll(constGenerics);
        copy.traitClauses.addAll(traitClauses);
        copy.regionsOutlive.addAll(regionsOutlive);
        copy.typesOutlive.addAll(typesOutlive);
        copy.traitTypeConstraints.addAll(traitTypeConstraints);
        return copy;
    }

    public TraitClause findClause(int clauseId) {
        for (var clause : traitClauses) {
            if (clause.clauseId == clauseId) {
                return clause;
            }
        }
        return null;
    }

    /**
     * Remove the clause with the given id and shift every higher clause id down by one.
     * References to the clauses are not touched: callers rewrite them with a {@link TypeFolder}.
     */
    public void removeTraitClause(int clauseId) {
        List<TraitClause> kept = new ArrayList<>();
        boolean found = false;
        for (var clause : traitClauses) {
            if (clause.clauseId == clauseId) {
                found = true;
            } else if (clause.clauseId > clauseId) {
                kept.add(clause.withClauseId(clause.clauseId - 1));
            } else {
                kept.add(clause);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("No trait clause with id " + clauseId);
        }
        traitClauses.clear();
        traitClauses.addAll(kept);
    }

    /**
     * Replace every type-level value held by these parameters with its image under {@code folder}.
     */
    public void foldInPlace(TypeFolder folder) {
        traitClauses.replaceAll(c -> c.withTrait(folder.foldPolyTraitDeclRef(c.trait)));
        regionsOutlive.replaceAll(b -> folder.foldBinder(b, p ->
                new OutlivesPred<>(folder.foldRegion(p.lhs), folder.foldRegion(p.rhs))));
        typesOutlive.replaceAll(b -> folder.foldBinder(b, p ->
                new OutlivesPred<>(folder.foldTy(p.lhs), folder.foldRegion(p.rhs))));
        traitTypeConstraints.replaceAll(b -> folder.foldBinder(b, c ->
                new TraitTypeConstraint(folder.foldTraitRef(c.traitRef), c.typeName, folder.foldTy(c.ty))));
    }

    public void visit(TypeVisitor visitor) {
        traitClauses.forEach(c -> visitor.visitPolyTraitDeclRef(c.trait));
        regionsOutlive.forEach(b -> visitor.visitBinder(b, p -> {
            visitor.visitRegion(p.lhs);
            visitor.visitRegion(p.rhs);
        }));
        typesOutlive.forEach(b -> visitor.visitBinder(b, p -> {
            visitor.visitTy(p.lhs);
            visitor.visitRegion(p.rhs);
        }));
        traitTypeConstraints.forEach(b -> visitor.visitBinder(b, c -> {
            visitor.visitTraitRef(c.traitRef);
            visitor.visitTy(c.ty);
        }));
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "<", ">");
        regions.forEach(r -> joiner.add(r.toString()));
        types.forEach(t -> joiner.add(t.toString()));
        constGenerics.forEach(c -> joiner.add(c.toString()));
        StringBuilder sb = new StringBuilder(joiner.toString());
        if (!traitClauses.isEmpty() || !regionsOutlive.isEmpty() || !typesOutlive.isEmpty()
                || !traitTypeConstraints.isEmpty()) {
            StringJoiner where = new StringJoiner(", ", " where ", "");
            traitClauses.forEach(c -> where.add(c.toString()));
            regionsOutlive.forEach(p -> where.add(p.toString()));
            typesOutlive.forEach(p -> where.add(p.toString()));
            traitTypeConstraints.forEach(p -> where.add(p.toString()));
            sb.append(where);
        }
        return sb.toString();
    }
}
