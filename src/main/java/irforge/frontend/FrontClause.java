package irforge.frontend;

import irforge.base.meta.Span;

public class FrontClause {
    public final FrontBinder<FrontPredicate> predicate;
    public final Span span;

    public FrontClause(FrontBinder<FrontPredicate> predicate, Span span) {
        this.predicate = predicate;
        this.span = span;
    }
}
