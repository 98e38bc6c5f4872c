package irforge.transform;

import irforge.base.items.FunDecl;
import irforge.base.items.GlobalDecl;
import irforge.base.items.ItemDecl;
import irforge.base.items.TraitDecl;
import irforge.base.types.*;
import irforge.utils.Logging;

import java.util.*;

/**
 * Methods and associated constants of a trait declaration carry a {@code Self: Trait} clause
 * with id 0. This pass removes the clause from the items that never use it, shifts their other
 * clause ids down, and drops the corresponding witness from every argument list that targets
 * them. Functions without a body are assumed to use the clause.
 */
public class RemoveUnusedSelfClause implements Pass.CratePass {
    static final int SELF_CLAUSE = 0;

    @Override
    public String name() {
        return "remove_unused_self_clause";
    }

    @Override
    public void transformCrate(TransformCtx ctx) {
        var crate = ctx.crate;
        Set<AnyDeclId> doesntUseSelf = new HashSet<>();

        for (TraitDecl trait : crate.traitDecls.values()) {
            List<FunDecl> funs = new ArrayList<>();
            for (AnyDeclId method : trait.methods()) {
                FunDecl fun = crate.funDecls.get(method);
                if (fun != null) {
                    funs.add(fun);
                }
            }
            for (AnyDeclId constDefault : trait.constDefaults.values()) {
                GlobalDecl global = crate.globalDecls.get(constDefault);
                if (global != null && crate.funDecls.containsKey(global.init)) {
                    funs.add(crate.funDecls.get(global.init));
                }
            }
            for (FunDecl fun : funs) {
                if (!hasSelfClause(fun) || usesSelfClause(fun)) {
                    continue;
                }
                doesntUseSelf.add(fun.id);
                if (fun.globalInitializerOf != null) {
                    GlobalDecl global = crate.globalDecls.get(fun.globalInitializerOf);
                    if (global != null && hasSelfClause(global)) {
                        doesntUseSelf.add(global.id);
                    }
                }
            }
        }
        if (doesntUseSelf.isEmpty()) {
            return;
        }

        // Renumber the clauses inside each pruned item.
        TypeFolder shift = new TypeFolder(ctx.store()) {
            @Override
            public int foldClauseId(int clauseId) {
                if (clauseId == SELF_CLAUSE) {
                    throw new IllegalStateException("Pruned item still refers to its Self clause");
                }
                return clauseId - 1;
            }
        };
        for (AnyDeclId id : doesntUseSelf) {
            ItemDecl item = crate.item(id);
            item.generics.removeTraitClause(SELF_CLAUSE);
            item.foldTypes(shift);
        }

        // Drop the witness of the removed clause wherever the pruned items are instantiated.
        TypeFolder dropWitness = new TypeFolder(ctx.store()) {
            @Override
            public GenericArgs foldGenericArgs(GenericArgs args) {
                GenericArgs folded = super.foldGenericArgs(args);
                if (args.target.item != null && doesntUseSelf.contains(args.target.item)) {
                    folded = folded.removeTraitRef(SELF_CLAUSE);
                }
                return folded;
            }
        };
        for (ItemDecl item : crate.allItems()) {
            item.foldTypes(dropWitness);
        }
        Logging.info("RemoveUnusedSelfClause", String.format("Removed the Self clause of %d items", doesntUseSelf.size()));
    }

    private static boolean hasSelfClause(ItemDecl item) {
        TraitClause clause = item.generics.findClause(SELF_CLAUSE);
        return clause != null && clause.origin.kind == PredicateOrigin.Kind.TRAIT_SELF;
    }

    static boolean usesSelfClause(FunDecl fun) {
        if (!fun.hasBody()) {
            return true;
        }
        UsesClauseVisitor visitor = new UsesClauseVisitor();
        fun.signature.inputs.forEach(visitor::visitTy);
        visitor.visitTy(fun.signature.output);
        fun.visitBody(visitor);
        for (TraitClause clause : fun.generics.traitClauses) {
            if (clause.clauseId != SELF_CLAUSE) {
                visitor.visitPolyTraitDeclRef(clause.trait);
            }
        }
        fun.generics.regionsOutlive.forEach(p -> visitor.visitBinder(p, o -> {
            visitor.visitRegion(o.lhs);
            visitor.visitRegion(o.rhs);
        }));
        fun.generics.typesOutlive.forEach(p -> visitor.visitBinder(p, o -> visitor.visitTy(o.lhs)));
        fun.generics.traitTypeConstraints.forEach(p -> visitor.visitBinder(p, c -> {
            visitor.visitTraitRef(c.traitRef);
            visitor.visitTy(c.ty);
        }));
        return visitor.found;
    }

    private static class UsesClauseVisitor extends TypeVisitor {
        private final Set<Ty> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        boolean found = false;

        @Override
        public void visitTy(Ty ty) {
            if (!found && seen.add(ty)) {
                visitInside(ty);
            }
        }

        @Override
        public void visitClauseRef(int clauseId) {
            if (clauseId == SELF_CLAUSE) {
                found = true;
            }
        }
    }
}
