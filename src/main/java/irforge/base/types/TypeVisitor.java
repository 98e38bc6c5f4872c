package irforge.base.types;

import java.util.function.Consumer;

/**
 * Read-only traversal of type-level values.
 * <p>
 * Types are shallow by default: {@link #visitTy} does nothing, so a traversal over an item does
 * not re-walk every occurrence of a shared type. Visitors that need to see inside types override
 * {@code visitTy} and call {@link #visitInside}.
 */
public abstract class TypeVisitor {
    /** Number of region binders entered since the traversal started. */
    protected int binderDepth = 0;

    public void visitTy(Ty ty) {
    }

    public void visitInside(Ty ty) {
        TyKind kind = ty.kind();
        if (kind instanceof TyKind.Adt adt) {
            if (adt.id.adt != null) {
                visitDeclId(adt.id.adt);
            }
            visitGenericArgs(adt.generics);
        } else if (kind instanceof TyKind.Ref ref) {
            visitRegion(ref.region);
            visitTy(ref.ty);
        } else if (kind instanceof TyKind.RawPtr ptr) {
            visitTy(ptr.ty);
        } else if (kind instanceof TyKind.TraitType traitType) {
            visitTraitRef(traitType.traitRef);
        } else if (kind instanceof TyKind.DynTrait dyn) {
            dyn.traits.forEach(this::visitPolyTraitDeclRef);
        } else if (kind instanceof TyKind.Arrow arrow) {
            visitBinder(arrow.sig, sig -> {
                sig.inputs.forEach(this::visitTy);
                visitTy(sig.output);
            });
        }
    }

    public void visitRegion(Region region) {
    }

    /** Called for every item id mentioned by a type-level value. */
    public void visitDeclId(AnyDeclId id) {
    }

    /** Called for every {@link TraitRefKind.Clause} reference. */
    public void visitClauseRef(int clauseId) {
    }

    public void visitConstGeneric(ConstGeneric cg) {
        if (cg instanceof ConstGeneric.Global global) {
            visitDeclId(global.globalId);
        }
    }

    public void visitGenericArgs(GenericArgs args) {
        args.regions.forEach(this::visitRegion);
        args.types.forEach(this::visitTy);
        args.constGenerics.forEach(this::visitConstGeneric);
        args.traitRefs.forEach(this::visitTraitRef);
    }

    public void visitTraitRef(TraitRef traitRef) {
        visitTraitRefKind(traitRef.kind);
        visitPolyTraitDeclRef(traitRef.traitDeclRef);
    }

    public void visitTraitRefKind(TraitRefKind kind) {
        if (kind instanceof TraitRefKind.TraitImpl impl) {
            visitDeclId(impl.implId);
            visitGenericArgs(impl.generics);
        } else if (kind instanceof TraitRefKind.Clause clause) {
            visitClauseRef(clause.clauseId);
        } else if (kind instanceof TraitRefKind.ParentClause parent) {
            visitTraitRefKind(parent.parent);
        } else if (kind instanceof TraitRefKind.ItemClause item) {
            visitTraitRefKind(item.parent);
        } else if (kind instanceof TraitRefKind.BuiltinOrAuto builtin) {
            visitPolyTraitDeclRef(builtin.traitDeclRef);
        } else if (kind instanceof TraitRefKind.Dyn dyn) {
            visitPolyTraitDeclRef(dyn.traitDeclRef);
        }
    }

    public void visitTraitDeclRef(TraitDeclRef ref) {
        visitDeclId(ref.traitId);
        visitGenericArgs(ref.generics);
    }

    public void visitPolyTraitDeclRef(RegionBinder<TraitDeclRef> ref) {
        visitBinder(ref, this::visitTraitDeclRef);
    }

    public <T> void visitBinder(RegionBinder<T> binder, Consumer<T> f) {
        binderDepth++;
        try {
            f.accept(binder.skipBinder);
        } finally {
            binderDepth--;
        }
    }
}
