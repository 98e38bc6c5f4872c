package irforge.base.types;

import irforge.base.meta.Span;

import java.util.Objects;

/**
 * A declared obligation {@code Type: Trait<Args>}, identified by a clause id that is dense and
 * zero-based within its owning list.
 */
public class TraitClause {
    public final int clauseId;
    public final Span span;
    public final PredicateOrigin origin;
    public final RegionBinder<TraitDeclRef> trait;

    public TraitClause(int clauseId, Span span, PredicateOrigin origin, RegionBinder<TraitDeclRef> trait) {
        this.clauseId = clauseId;
        this.span = span;
        this.origin = Objects.requireNonNull(origin);
        this.trait = Objects.requireNonNull(trait);
    }

    public TraitClause withClauseId(int newId) {
        return new TraitClause(newId, span, origin, trait);
    }

    public TraitClause withTrait(RegionBinder<TraitDeclRef> newTrait) {
        return new TraitClause(clauseId, span, origin, newTrait);
    }

    /** Span and origin do not take part in equality. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitClause that = (TraitClause) o;
        return clauseId == that.clauseId && trait.equals(that.trait);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauseId, trait);
    }

    @Override
    public String toString() {
        return String.format("[%d]: %s", clauseId, trait);
    }
}
