package irforge.translate;

import irforge.base.meta.Span;
import irforge.base.types.*;
import irforge.errors.TranslationError;
import irforge.frontend.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Translation state of a single item: its generic parameters, as registered so far, and the stack
 * of region binders opened inside it.
 * <p>
 * The item's own parameters form the outermost binder. An early-bound region parameter seen under
 * {@code n} inner binders becomes {@code BVar(n, index)}; a late-bound region keeps the de Bruijn
 * index the front end gives it, which must not escape the binders opened so far.
 */
public class ItemTransCtx {
    public final TranslateCtx t;
    public final AnyDeclId itemId;
    public final DefId def;
    public final GenericParams generics = new GenericParams();
    public final PredicateTranslator predicates;

    /** Innermost binder first. */
    private final Deque<List<RegionVar>> binders = new ArrayDeque<>();

    public ItemTransCtx(TranslateCtx t, AnyDeclId itemId, DefId def) {
        this.t = t;
        this.itemId = itemId;
        this.def = def;
        this.predicates = new PredicateTranslator(this);
    }

    public TyStore store() {
        return t.store();
    }

    public TranslationError error(Span span, TranslationError.Kind kind, String msg) {
        return t.errorCtx.raise(span, kind, msg);
    }

    /** Number of binders open inside the item. */
    public int innerBinderDepth() {
        return binders.size();
    }

    /**
     * A binder scope. Closing it pops the scope; scopes must be closed innermost first.
     */
    public class BinderScope implements AutoCloseable {
        public final List<RegionVar> regions;
        private final int depth;

        private BinderScope(List<RegionVar> regions) {
            this.regions = regions;
            binders.push(regions);
            this.depth = binders.size();
        }

        @Override
        public void close() {
            if (binders.size() != depth || binders.peek() != regions) {
                throw new IllegalStateException("Region binders closed out of order");
            }
            binders.pop();
        }
    }

    public BinderScope openBinder(Span span, List<String> regionNames) {
        List<RegionVar> regions = new ArrayList<>();
        for (int i = 0; i < regionNames.size(); i++) {
            regions.add(new RegionVar(i, regionNames.get(i)));
        }
        return new BinderScope(regions);
    }

    public <T, U> RegionBinder<U> translateRegionBinder(Span span, FrontBinder<T> binder, Function<T, U> f) {
        try (BinderScope scope = openBinder(span, binder.boundRegions)) {
            return new RegionBinder<>(scope.regions, f.apply(binder.value));
        }
    }

    // Generic parameters

    public void pushRegionParam(String name) {
        generics.regions.add(new RegionVar(generics.regions.size(), name));
    }

    public void pushTypeParam(String name) {
        generics.types.add(new TypeVar(generics.types.size(), name));
    }

    public void pushConstParam(String name, LiteralTy ty) {
        generics.constGenerics.add(new ConstGenericVar(generics.constGenerics.size(), name, ty));
    }

    // Types

    public Region translateRegion(Span span, FrontRegion region) {
        if (region instanceof FrontRegion.Static) {
            return Region.STATIC;
        } else if (region instanceof FrontRegion.Erased) {
            return Region.ERASED;
        } else if (region instanceof FrontRegion.Bound bound) {
            if (bound.debruijn >= binders.size()) {
                throw error(span, TranslationError.Kind.RESOLUTION_FAILURE, String.format(
                        "Bound region (%d, %d) escapes its binder (%d open)", bound.debruijn, bound.var,
                        binders.size()));
            }
            List<RegionVar> level = get(bound.debruijn);
            if (bound.var >= level.size()) {
                throw error(span, TranslationError.Kind.RESOLUTION_FAILURE, String.format(
                        "Bound region (%d, %d) does not exist", bound.debruijn, bound.var));
            }
            return Region.bound(bound.debruijn, bound.var);
        } else if (region instanceof FrontRegion.EarlyParam param) {
            if (param.index >= generics.regions.size()) {
                throw error(span, TranslationError.Kind.RESOLUTION_FAILURE,
                        "Unknown region parameter " + param.index);
            }
            return Region.bound(binders.size(), param.index);
        } else if (region instanceof FrontRegion.Error err) {
            throw error(span, TranslationError.Kind.RESOLUTION_FAILURE, err.message);
        }
        throw new IllegalStateException("Unhandled region " + region.getClass().getSimpleName());
    }

    private List<RegionVar> get(int debruijn) {
        int i = 0;
        for (List<RegionVar> level : binders) {
            if (i++ == debruijn) {
                return level;
            }
        }
        throw new IllegalStateException("Unreachable");
    }

    public Ty translateTy(Span span, FrontTy ty) {
        TyStore store = store();
        if (ty instanceof FrontTy.Bool) {
            return store.bool();
        } else if (ty instanceof FrontTy.Char) {
            return store.literal(LiteralTy.CHAR);
        } else if (ty instanceof FrontTy.Int i) {
            return store.integer(i.ty);
        } else if (ty instanceof FrontTy.Float f) {
            return store.literal(LiteralTy.floating(f.ty));
        } else if (ty instanceof FrontTy.Never) {
            return store.never();
        } else if (ty instanceof FrontTy.Tuple tuple) {
            List<Ty> fields = new ArrayList<>();
            tuple.fields.forEach(f -> fields.add(translateTy(span, f)));
            return store.tuple(fields);
        } else if (ty instanceof FrontTy.Adt adt) {
            AnyDeclId id = t.registerId(span, adt.id, AnyDeclId.Kind.TYPE);
            return store.adt(id, translateGenericArgs(span, adt.args, GenericsSource.item(id)));
        } else if (ty instanceof FrontTy.Builtin builtin) {
            GenericArgs args = translateGenericArgs(span, builtin.args, GenericsSource.BUILTIN);
            return store.intern(new TyKind.Adt(TypeId.builtin(builtin.ty), args));
        } else if (ty instanceof FrontTy.Ref ref) {
            return store.ref(translateRegion(span, ref.region), translateTy(span, ref.ty),
                    ref.mutable ? RefKind.MUT : RefKind.SHARED);
        } else if (ty instanceof FrontTy.RawPtr ptr) {
            return store.intern(new TyKind.RawPtr(translateTy(span, ptr.ty), ptr.mutable ? RefKind.MUT : RefKind.SHARED));
        } else if (ty instanceof FrontTy.Param param) {
            if (param.index >= generics.types.size()) {
                throw error(span, TranslationError.Kind.RESOLUTION_FAILURE,
                        String.format("Unknown type parameter %s (%d)", param.name, param.index));
            }
            return store.typeVar(param.index);
        } else if (ty instanceof FrontTy.Projection proj) {
            TraitRef traitRef = predicates.translateTraitImplExpr(span, proj.implExpr);
            return store.intern(new TyKind.TraitType(traitRef, proj.name));
        } else if (ty instanceof FrontTy.Dyn dyn) {
            List<RegionBinder<TraitDeclRef>> traits = new ArrayList<>();
            dyn.traits.forEach(tr -> traits.add(translatePolyTraitDeclRef(span, tr)));
            return store.intern(new TyKind.DynTrait(traits));
        } else if (ty instanceof FrontTy.Arrow arrow) {
            RegionBinder<ArrowSig> sig = translateRegionBinder(span, arrow.sig, s -> {
                List<Ty> inputs = new ArrayList<>();
                s.inputs.forEach(in -> inputs.add(translateTy(span, in)));
                return new ArrowSig(inputs, translateTy(span, s.output));
            });
            return store.intern(new TyKind.Arrow(sig));
        } else if (ty instanceof FrontTy.Error err) {
            throw error(span, TranslationError.Kind.RESOLUTION_FAILURE, err.message);
        }
        throw new IllegalStateException("Unhandled type " + ty.getClass().getSimpleName());
    }

    public ConstGeneric translateConstGeneric(Span span, FrontConst c) {
        if (c instanceof FrontConst.Value value) {
            return new ConstGeneric.Value(value.value);
        } else if (c instanceof FrontConst.Param param) {
            if (param.index >= generics.constGenerics.size()) {
                throw error(span, TranslationError.Kind.RESOLUTION_FAILURE, "Unknown const parameter " + param.index);
            }
            return new ConstGeneric.Var(param.index);
        } else if (c instanceof FrontConst.Global global) {
            return new ConstGeneric.Global(t.registerId(span, global.id, AnyDeclId.Kind.GLOBAL));
        }
        throw new IllegalStateException("Unhandled const generic " + c.getClass().getSimpleName());
    }

    public GenericArgs translateGenericArgs(Span span, FrontGenericArgs args, GenericsSource target) {
        List<Region> regions = new ArrayList<>();
        args.regions.forEach(r -> regions.add(translateRegion(span, r)));
        List<Ty> types = new ArrayList<>();
        args.types.forEach(ty -> types.add(translateTy(span, ty)));
        List<ConstGeneric> consts = new ArrayList<>();
        args.consts.forEach(c -> consts.add(translateConstGeneric(span, c)));
        List<TraitRef> traitRefs = new ArrayList<>();
        args.implExprs.forEach(e -> traitRefs.add(predicates.translateTraitImplExpr(span, e)));
        return new GenericArgs(regions, types, consts, traitRefs, target);
    }

    public TraitDeclRef translateTraitDeclRef(Span span, FrontTraitRef ref) {
        AnyDeclId traitId = t.registerId(span, ref.traitId, AnyDeclId.Kind.TRAIT_DECL);
        return new TraitDeclRef(traitId, translateGenericArgs(span, ref.args, GenericsSource.item(traitId)));
    }

    public RegionBinder<TraitDeclRef> translatePolyTraitDeclRef(Span span, FrontBinder<FrontTraitRef> ref) {
        return translateRegionBinder(span, ref, r -> translateTraitDeclRef(span, r));
    }
}
