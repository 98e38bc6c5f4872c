package irforge.base.types;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.function.Function;

/**
 * Rebuilds type-level values bottom-up. Subclasses override the leaf hooks
 * ({@link #foldRegion}, {@link #foldClauseId}, {@link #foldGenericArgs}, ...) and the folder takes
 * care of reconstruction and re-interning.
 * <p>
 * Folding a {@link Ty} is memoized per handle and per binder depth, so a type shared by many
 * locations is rebuilt once. Hooks must therefore be pure functions of their input and of
 * {@link #binderDepth}.
 */
public abstract class TypeFolder {
    protected final TyStore store;
    /** Number of region binders entered since the folder started. */
    protected int binderDepth = 0;
    private final List<IdentityHashMap<Ty, Ty>> cache = new ArrayList<>();

    protected TypeFolder(TyStore store) {
        this.store = store;
    }

    public Ty foldTy(Ty ty) {
        while (cache.size() <= binderDepth) {
            cache.add(new IdentityHashMap<>());
        }
        var memo = cache.get(binderDepth);
        Ty folded = memo.get(ty);
        if (folded == null) {
            folded = store.intern(foldTyKind(ty.kind()));
            memo.put(ty, folded);
        }
        return folded;
    }

    public TyKind foldTyKind(TyKind kind) {
        if (kind instanceof TyKind.Adt adt) {
            return new TyKind.Adt(adt.id, foldGenericArgs(adt.generics));
        } else if (kind instanceof TyKind.Ref ref) {
            return new TyKind.Ref(foldRegion(ref.region), foldTy(ref.ty), ref.refKind);
        } else if (kind instanceof TyKind.RawPtr ptr) {
            return new TyKind.RawPtr(foldTy(ptr.ty), ptr.refKind);
        } else if (kind instanceof TyKind.TraitType traitType) {
            return new TyKind.TraitType(foldTraitRef(traitType.traitRef), traitType.name);
        } else if (kind instanceof TyKind.DynTrait dyn) {
            List<RegionBinder<TraitDeclRef>> traits = new ArrayList<>();
            dyn.traits.forEach(t -> traits.add(foldPolyTraitDeclRef(t)));
            return new TyKind.DynTrait(traits);
        } else if (kind instanceof TyKind.Arrow arrow) {
            return new TyKind.Arrow(foldBinder(arrow.sig, sig -> {
                List<Ty> inputs = new ArrayList<>();
                sig.inputs.forEach(t -> inputs.add(foldTy(t)));
                return new ArrowSig(inputs, foldTy(sig.output));
            }));
        }
        // TypeVar, Literal, Never
        return kind;
    }

    public Region foldRegion(Region region) {
        return region;
    }

    public ConstGeneric foldConstGeneric(ConstGeneric cg) {
        return cg;
    }

    /**
     * Hook for references to trait clauses of the current item ({@link TraitRefKind.Clause}).
     * The clause ids annotating parent and item clause steps name clauses of a trait declaration
     * and are not passed here.
     */
    public int foldClauseId(int clauseId) {
        return clauseId;
    }

    public GenericArgs foldGenericArgs(GenericArgs args) {
        List<Region> regions = new ArrayList<>();
        args.regions.forEach(r -> regions.add(foldRegion(r)));
        List<Ty> types = new ArrayList<>();
        args.types.forEach(t -> types.add(foldTy(t)));
        List<ConstGeneric> consts = new ArrayList<>();
        args.constGenerics.forEach(c -> consts.add(foldConstGeneric(c)));
        List<TraitRef> traitRefs = new ArrayList<>();
        args.traitRefs.forEach(t -> traitRefs.add(foldTraitRef(t)));
        return new GenericArgs(regions, types, consts, traitRefs, args.target);
    }

    public TraitRef foldTraitRef(TraitRef traitRef) {
        return new TraitRef(foldTraitRefKind(traitRef.kind), foldPolyTraitDeclRef(traitRef.traitDeclRef));
    }

    public TraitRefKind foldTraitRefKind(TraitRefKind kind) {
        if (kind instanceof TraitRefKind.TraitImpl impl) {
            return new TraitRefKind.TraitImpl(impl.implId, foldGenericArgs(impl.generics));
        } else if (kind instanceof TraitRefKind.Clause clause) {
            return new TraitRefKind.Clause(foldClauseId(clause.clauseId));
        } else if (kind instanceof TraitRefKind.ParentClause parent) {
            return new TraitRefKind.ParentClause(foldTraitRefKind(parent.parent), parent.traitDeclId,
                    parent.clauseId);
        } else if (kind instanceof TraitRefKind.ItemClause item) {
            return new TraitRefKind.ItemClause(foldTraitRefKind(item.parent), item.traitDeclId, item.itemName,
                    item.clauseId);
        } else if (kind instanceof TraitRefKind.BuiltinOrAuto builtin) {
            return new TraitRefKind.BuiltinOrAuto(foldPolyTraitDeclRef(builtin.traitDeclRef));
        } else if (kind instanceof TraitRefKind.Dyn dyn) {
            return new TraitRefKind.Dyn(foldPolyTraitDeclRef(dyn.traitDeclRef));
        } else if (kind instanceof TraitRefKind.SelfId || kind instanceof TraitRefKind.Unknown) {
            return kind;
        }
        throw new IllegalStateException("Unhandled trait ref kind " + kind.getClass().getSimpleName());
    }

    public TraitDeclRef foldTraitDeclRef(TraitDeclRef ref) {
        return new TraitDeclRef(ref.traitId, foldGenericArgs(ref.generics));
    }

    public RegionBinder<TraitDeclRef> foldPolyTraitDeclRef(RegionBinder<TraitDeclRef> ref) {
        return foldBinder(ref, this::foldTraitDeclRef);
    }

    /** Fold the payload of a binder with the de Bruijn depth incremented. */
    public <T> RegionBinder<T> foldBinder(RegionBinder<T> binder, Function<T, T> f) {
        binderDepth++;
        try {
            return new RegionBinder<>(binder.regions, f.apply(binder.skipBinder));
        } finally {
            binderDepth--;
        }
    }
}
