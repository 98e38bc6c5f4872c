package irforge.translate;

import irforge.base.meta.Span;
import irforge.base.types.*;
import irforge.errors.TranslationError;
import irforge.frontend.*;
import irforge.utils.Logging;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers the predicates of an item and translates the front end's trait witnesses into
 * {@link TraitRef} trees.
 */
public class PredicateTranslator {
    private final ItemTransCtx ctx;

    PredicateTranslator(ItemTransCtx ctx) {
        this.ctx = ctx;
    }

    /**
     * Register a list of predicates: the trait predicates first, in order, then the other ones,
     * which may mention the witnesses of the former.
     * <p>
     * Trait predicates go to the clause list of {@code location}; outlives predicates and
     * associated type constraints always go to the item's generic parameters.
     */
    public void registerPredicates(List<FrontClause> preds, PredicateOrigin origin, PredicateLocation location) {
        List<FrontClause> others = new ArrayList<>();
        for (FrontClause clause : preds) {
            if (clause.predicate.value instanceof FrontPredicate.Trait) {
                registerTraitPredicate(clause, origin, location);
            } else {
                others.add(clause);
            }
        }
        for (FrontClause clause : others) {
            try {
                registerOtherPredicate(clause);
            } catch (TranslationError e) {
                if (!ctx.t.errorCtx.canRecover(e)) {
                    throw e;
                }
                Logging.debug("PredicateTranslator", "Skipped predicate: " + e.getMessage());
            }
        }
    }

    private void registerTraitPredicate(FrontClause clause, PredicateOrigin origin, PredicateLocation location) {
        int clauseId = location.target.size();
        RegionBinder<TraitDeclRef> trait = ctx.translateRegionBinder(clause.span, clause.predicate,
                p -> ctx.translateTraitDeclRef(clause.span, ((FrontPredicate.Trait) p).traitRef));
        location.target.add(new TraitClause(clauseId, clause.span, origin, trait));
        Logging.trace("PredicateTranslator", String.format("%s: clause %d in %s: %s",
                ctx.def, clauseId, location, trait));
    }

    private void registerOtherPredicate(FrontClause clause) {
        Span span = clause.span;
        FrontPredicate pred = clause.predicate.value;
        if (pred instanceof FrontPredicate.RegionOutlives outlives) {
            ctx.generics.regionsOutlive.add(ctx.translateRegionBinder(span, clause.predicate, p ->
                    new OutlivesPred<>(ctx.translateRegion(span, outlives.lhs), ctx.translateRegion(span, outlives.rhs))));
        } else if (pred instanceof FrontPredicate.TypeOutlives outlives) {
            ctx.generics.typesOutlive.add(ctx.translateRegionBinder(span, clause.predicate, p ->
                    new OutlivesPred<>(ctx.translateTy(span, outlives.lhs), ctx.translateRegion(span, outlives.rhs))));
        } else if (pred instanceof FrontPredicate.Projection proj) {
            ctx.generics.traitTypeConstraints.add(ctx.translateRegionBinder(span, clause.predicate, p ->
                    new TraitTypeConstraint(translateTraitImplExpr(span, proj.implExpr), proj.name,
                            ctx.translateTy(span, proj.ty))));
        } else if (pred instanceof FrontPredicate.ConstArgHasType) {
            // Carries no information once const generics are typed.
            return;
        } else if (pred instanceof FrontPredicate.Unsupported unsupported) {
            throw ctx.error(span, TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                    "Unsupported predicate kind: " + unsupported.kind);
        } else {
            throw new IllegalStateException("Unhandled predicate " + pred.getClass().getSimpleName());
        }
    }

    /**
     * Translate a witness. When it cannot be translated and recovery is allowed, an
     * {@link TraitRefKind.Unknown} witness is returned instead.
     */
    public TraitRef translateTraitImplExpr(Span span, ImplExpr implExpr) {
        RegionBinder<TraitDeclRef> traitDeclRef = ctx.translatePolyTraitDeclRef(span, implExpr.trait);
        try {
            return new TraitRef(translateImplExprAtom(span, implExpr, traitDeclRef), traitDeclRef);
        } catch (TranslationError e) {
            if (!ctx.t.errorCtx.canRecover(e)) {
                throw e;
            }
            String msg = String.format("Error during trait resolution: %s", e.getMessage());
            return new TraitRef(new TraitRefKind.Unknown(msg), traitDeclRef);
        }
    }

    private TraitRefKind translateImplExprAtom(Span span, ImplExpr implExpr, RegionBinder<TraitDeclRef> traitDeclRef) {
        ImplExprAtom atom = implExpr.atom;
        if (atom instanceof ImplExprAtom.Concrete concrete) {
            AnyDeclId implId = ctx.t.registerId(span, concrete.implId, AnyDeclId.Kind.TRAIT_IMPL);
            GenericArgs args = ctx.translateGenericArgs(span, concrete.args, GenericsSource.item(implId));
            return new TraitRefKind.TraitImpl(implId, args);
        } else if (atom instanceof ImplExprAtom.SelfImpl self) {
            AnyDeclId traitId = ctx.t.registerId(span, self.trait.value.traitId, AnyDeclId.Kind.TRAIT_DECL);
            return walkPath(span, TraitRefKind.SelfId.INSTANCE, traitId, self.path);
        } else if (atom instanceof ImplExprAtom.LocalBound local) {
            AnyDeclId traitId = ctx.t.registerId(span, local.predicate.value.traitId, AnyDeclId.Kind.TRAIT_DECL);
            return walkPath(span, new TraitRefKind.Clause(local.index), traitId, local.path);
        } else if (atom instanceof ImplExprAtom.Dyn) {
            return new TraitRefKind.Dyn(traitDeclRef);
        } else if (atom instanceof ImplExprAtom.Builtin builtin) {
            return new TraitRefKind.BuiltinOrAuto(ctx.translatePolyTraitDeclRef(span, builtin.trait));
        } else if (atom instanceof ImplExprAtom.Error err) {
            if (ctx.t.options.errorOnImplExprError) {
                throw ctx.error(span, TranslationError.Kind.RESOLUTION_FAILURE, err.message);
            }
            ctx.t.errorCtx.spanErr(span, TranslationError.Kind.RESOLUTION_FAILURE, err.message);
            return new TraitRefKind.Unknown(err.message);
        }
        throw new IllegalStateException("Unhandled witness " + atom.getClass().getSimpleName());
    }

    /**
     * Apply the path steps in order; each step starts from the trait reached by the previous one.
     */
    private TraitRefKind walkPath(Span span, TraitRefKind root, AnyDeclId rootTrait, List<ImplExprPathChunk> path) {
        TraitRefKind current = root;
        AnyDeclId currentTrait = rootTrait;
        for (ImplExprPathChunk chunk : path) {
            if (chunk instanceof ImplExprPathChunk.AssocItem item) {
                if (!item.itemArgs.isEmpty()) {
                    throw ctx.error(span, TranslationError.Kind.UNSUPPORTED_CONSTRUCT, String.format(
                            "Witness path through associated item %s with generic arguments", item.itemName));
                }
                current = new TraitRefKind.ItemClause(current, currentTrait, item.itemName, item.index);
            } else if (chunk instanceof ImplExprPathChunk.Parent) {
                current = new TraitRefKind.ParentClause(current, currentTrait, chunk.index);
            } else {
                throw new IllegalStateException("Unhandled path chunk " + chunk.getClass().getSimpleName());
            }
            currentTrait = ctx.t.registerId(span, chunk.predicate.value.traitId, AnyDeclId.Kind.TRAIT_DECL);
        }
        return current;
    }
}
