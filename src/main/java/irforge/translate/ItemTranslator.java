package irforge.translate;

import irforge.base.items.*;
import irforge.base.meta.Span;
import irforge.base.types.*;
import irforge.errors.TranslationError;
import irforge.frontend.*;
import irforge.utils.Logging;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates one front-end definition into one item (two for globals, whose initializer is a
 * separate function).
 * <p>
 * A recoverable failure anywhere in the item leaves a placeholder in the crate: type
 * declarations get an error kind, other items keep whatever generics were translated, an empty
 * signature and no body. The reason is stored in {@link ItemMeta#error}.
 */
public class ItemTranslator {
    private static final Pattern RENAME_ATTR = Pattern.compile("rename\\(\"(.*)\"\\)");
    private static final String OPAQUE_ATTR = "opaque";

    private final TranslateCtx t;
    private final DefId def;
    private final AnyDeclId id;
    private final List<ItemDecl> produced = new ArrayList<>();
    /** Id of the initializer function, when this item is a global. */
    private AnyDeclId initId;

    public ItemTranslator(TranslateCtx t, DefId def) {
        this.t = t;
        this.def = def;
        this.id = t.registerId(null, def);
    }

    public List<ItemDecl> translate() {
        Optional<FrontItem> front = t.frontItem(def);
        if (front.isEmpty()) {
            Logging.warn("ItemTranslator", String.format("No definition available for %s, keeping it opaque", def));
            ItemMeta meta = new ItemMeta(def.path, Span.DUMMY, true, t.isLocal(def));
            meta.opaque = true;
            produced.add(placeholder(meta, new GenericParams(), ItemKind.REGULAR, null));
            return produced;
        }
        FrontItem item = front.get();
        ItemMeta meta = translateMeta(item);
        ItemTransCtx ctx = new ItemTransCtx(t, id, def);
        ItemKind kind = ItemKind.REGULAR;
        try {
            kind = itemKind(item);
            produced.add(translateItem(ctx, item, meta, kind));
        } catch (TranslationError e) {
            if (!t.errorCtx.canRecover(e)) {
                throw e;
            }
            Logging.warn("ItemTranslator", String.format("Failed to translate %s: %s", def, e.getMessage()));
            meta.error = e.getMessage();
            produced.clear();
            produced.add(placeholder(meta, ctx.generics, kind, e.getMessage()));
        }
        return produced;
    }

    private ItemMeta translateMeta(FrontItem item) {
        ItemMeta meta = new ItemMeta(def.path, item.span, item.isPublic, t.isLocal(def));
        meta.attributes.addAll(item.attributes);
        for (String attr : item.attributes) {
            Matcher m = RENAME_ATTR.matcher(attr);
            if (m.matches()) {
                meta.rename = m.group(1);
            } else if (attr.equals(OPAQUE_ATTR)) {
                meta.opaque = true;
            }
        }
        return meta;
    }

    private ItemKind itemKind(FrontItem item) {
        FrontItem.Member member = null;
        if (item instanceof FrontItem.FnItem fn) {
            member = fn.member;
        } else if (item instanceof FrontItem.GlobalItem global) {
            member = global.member;
        }
        if (member == null) {
            return ItemKind.REGULAR;
        }
        if (member.inTraitDecl) {
            AnyDeclId traitId = t.registerId(item.span, member.container, AnyDeclId.Kind.TRAIT_DECL);
            return ItemKind.traitDecl(traitId, member.itemName, member.hasDefault);
        }
        AnyDeclId implId = t.registerId(item.span, member.container, AnyDeclId.Kind.TRAIT_IMPL);
        AnyDeclId traitId = t.registerId(item.span, member.implTrait.traitId, AnyDeclId.Kind.TRAIT_DECL);
        return ItemKind.traitImpl(implId, traitId, member.itemName);
    }

    private ItemDecl translateItem(ItemTransCtx ctx, FrontItem item, ItemMeta meta, ItemKind kind) {
        if (item instanceof FrontItem.FnItem fn) {
            return translateFn(ctx, fn, meta, kind);
        } else if (item instanceof FrontItem.GlobalItem global) {
            return translateGlobal(ctx, global, meta, kind);
        } else if (item instanceof FrontItem.TypeItem type) {
            return translateType(ctx, type, meta);
        } else if (item instanceof FrontItem.TraitDeclItem trait) {
            return translateTraitDecl(ctx, trait, meta);
        } else if (item instanceof FrontItem.TraitImplItem impl) {
            return translateTraitImpl(ctx, impl, meta);
        }
        throw new IllegalStateException("Unhandled item " + item.getClass().getSimpleName());
    }

    // Generics

    /**
     * Register the parameters and predicates of an item. Members of a trait declaration first
     * get the {@code Self: Trait} clause, with id 0.
     */
    private void translateGenerics(ItemTransCtx ctx, FrontItem item, PredicateOrigin origin, FrontItem.Member member) {
        FrontGenerics generics = item.generics;
        generics.regions.forEach(ctx::pushRegionParam);
        generics.types.forEach(ctx::pushTypeParam);
        generics.consts.forEach(c -> ctx.pushConstParam(c.name, c.ty));
        if (member != null && member.inTraitDecl) {
            registerSelfClause(ctx, item.span, member.container);
        }
        ctx.predicates.registerPredicates(generics.predicates, origin, PredicateLocation.base(ctx));
    }

    private void registerSelfClause(ItemTransCtx ctx, Span span, DefId traitDef) {
        FrontTraitRef selfRef = selfTraitRef(span, traitDef);
        RegionBinder<TraitDeclRef> trait = ctx.translatePolyTraitDeclRef(span, FrontBinder.dummy(selfRef));
        ctx.generics.traitClauses.add(new TraitClause(ctx.generics.traitClauses.size(), span,
                PredicateOrigin.TRAIT_SELF, trait));
    }

    /**
     * The trait instantiated with its own parameters. The witnesses of the trait's where-clauses
     * are the clauses that follow the {@code Self} clause.
     */
    private FrontTraitRef selfTraitRef(Span span, DefId traitDef) {
        Optional<FrontItem> container = t.frontItem(traitDef);
        if (container.isEmpty() || !(container.get() instanceof FrontItem.TraitDeclItem)) {
            throw t.errorCtx.raise(span, TranslationError.Kind.RESOLUTION_FAILURE,
                    "Cannot find the trait declaration " + traitDef);
        }
        FrontGenerics traitGenerics = container.get().generics;
        List<FrontRegion> regions = new ArrayList<>();
        for (int i = 0; i < traitGenerics.regions.size(); i++) {
            regions.add(new FrontRegion.EarlyParam(i));
        }
        List<FrontTy> types = new ArrayList<>();
        for (int i = 0; i < traitGenerics.types.size(); i++) {
            types.add(FrontTy.param(i, traitGenerics.types.get(i)));
        }
        List<FrontConst> consts = new ArrayList<>();
        for (int i = 0; i < traitGenerics.consts.size(); i++) {
            consts.add(new FrontConst.Param(i));
        }
        List<ImplExpr> implExprs = new ArrayList<>();
        for (FrontClause clause : traitGenerics.predicates) {
            if (clause.predicate.value instanceof FrontPredicate.Trait tr) {
                FrontBinder<FrontTraitRef> bound = new FrontBinder<>(clause.predicate.boundRegions, tr.traitRef);
                implExprs.add(new ImplExpr(bound, new ImplExprAtom.LocalBound(bound, implExprs.size() + 1, List.of())));
            }
        }
        return new FrontTraitRef(traitDef, new FrontGenericArgs(regions, types, consts, implExprs));
    }

    // Functions and globals

    private FunDecl translateFn(ItemTransCtx ctx, FrontItem.FnItem fn, ItemMeta meta, ItemKind kind) {
        translateGenerics(ctx, fn, PredicateOrigin.WHERE_CLAUSE_ON_FN, fn.member);
        List<Ty> inputs = new ArrayList<>();
        fn.sig.inputs.forEach(in -> inputs.add(ctx.translateTy(fn.span, in)));
        FunSig sig = new FunSig(fn.sig.isUnsafe, inputs, ctx.translateTy(fn.span, fn.sig.output));
        FunDecl decl = new FunDecl(id, meta, ctx.generics, sig, kind, null);
        translateBody(ctx, decl, fn.body);
        return decl;
    }

    private GlobalDecl translateGlobal(ItemTransCtx ctx, FrontItem.GlobalItem global, ItemMeta meta, ItemKind kind) {
        AnyDeclId initId = initId();
        translateGenerics(ctx, global, PredicateOrigin.WHERE_CLAUSE_ON_FN, global.member);
        Ty ty = ctx.translateTy(global.span, global.ty);
        ItemMeta initMeta = new ItemMeta(def.path + "::{init}", global.span, global.isPublic, meta.isLocal);
        initMeta.opaque = meta.opaque;
        FunDecl init = new FunDecl(initId, initMeta, ctx.generics.copy(), new FunSig(false, List.of(), ty), kind, id);
        translateBody(ctx, init, global.initializer);
        produced.add(init);
        return new GlobalDecl(id, meta, ctx.generics, ty, kind, initId);
    }

    /**
     * Build the body of {@code decl}. A body that fails to translate is dropped and the function
     * kept opaque, with the error recorded in its metadata.
     */
    private void translateBody(ItemTransCtx ctx, FunDecl decl, FrontBody body) {
        if (body == null || decl.meta.opaque) {
            decl.makeOpaque();
            return;
        }
        try {
            decl.unstructuredBody = new BodyBuilder(ctx, body).build();
        } catch (TranslationError e) {
            if (!t.errorCtx.canRecover(e)) {
                throw e;
            }
            Logging.warn("ItemTranslator", String.format("Body of %s is opaque: %s", decl.meta.name, e.getMessage()));
            decl.makeOpaque();
            decl.meta.error = e.getMessage();
        }
    }

    // Types

    private TypeDecl translateType(ItemTransCtx ctx, FrontItem.TypeItem type, ItemMeta meta) {
        translateGenerics(ctx, type, PredicateOrigin.WHERE_CLAUSE_ON_TYPE, null);
        TypeDecl decl = new TypeDecl(id, meta, ctx.generics, TypeDeclKind.Opaque.INSTANCE);
        if (meta.opaque) {
            return decl;
        }
        try {
            decl.kind = translateTypeKind(ctx, type);
        } catch (TranslationError e) {
            if (!t.errorCtx.canRecover(e)) {
                throw e;
            }
            meta.error = e.getMessage();
            decl.kind = new TypeDeclKind.Error(e.getMessage());
        }
        return decl;
    }

    private TypeDeclKind translateTypeKind(ItemTransCtx ctx, FrontItem.TypeItem type) {
        return switch (def.kind) {
            case STRUCT -> new TypeDeclKind.Struct(translateFields(ctx, type.fields));
            case UNION -> new TypeDeclKind.Union(translateFields(ctx, type.fields));
            case ENUM -> {
                List<Variant> variants = new ArrayList<>();
                for (FrontItem.VariantDef v : type.variants) {
                    variants.add(new Variant(v.span, v.name, translateFields(ctx, v.fields), v.discriminant));
                }
                yield new TypeDeclKind.Enum(variants);
            }
            case TYPE_ALIAS -> new TypeDeclKind.Alias(ctx.translateTy(type.span, type.aliased));
            case FOREIGN_TYPE -> TypeDeclKind.Opaque.INSTANCE;
            default -> throw new IllegalStateException("Not a type definition: " + def);
        };
    }

    private List<Field> translateFields(ItemTransCtx ctx, List<FrontItem.FieldDef> fields) {
        List<Field> translated = new ArrayList<>();
        for (FrontItem.FieldDef f : fields) {
            translated.add(new Field(f.span, f.name, ctx.translateTy(f.span, f.ty)));
        }
        return translated;
    }

    // Traits

    private TraitDecl translateTraitDecl(ItemTransCtx ctx, FrontItem.TraitDeclItem trait, ItemMeta meta) {
        translateGenerics(ctx, trait, PredicateOrigin.WHERE_CLAUSE_ON_TRAIT, null);
        TraitDecl decl = new TraitDecl(id, meta, ctx.generics);
        ctx.predicates.registerPredicates(trait.parentClauses, PredicateOrigin.WHERE_CLAUSE_ON_TRAIT,
                PredicateLocation.parent(decl.parentClauses));
        for (FrontItem.AssocTy ty : trait.types) {
            decl.types.add(ty.name);
            List<TraitClause> clauses = new ArrayList<>();
            ctx.predicates.registerPredicates(ty.clauses, PredicateOrigin.traitItem(ty.name),
                    PredicateLocation.item(ty.name, clauses));
            decl.typeClauses.put(ty.name, clauses);
        }
        for (FrontItem.AssocConst c : trait.consts) {
            decl.consts.put(c.name, ctx.translateTy(trait.span, c.ty));
            if (c.defaultValue != null) {
                decl.constDefaults.put(c.name, t.registerId(trait.span, c.defaultValue, AnyDeclId.Kind.GLOBAL));
            }
        }
        for (FrontItem.AssocFn m : trait.methods) {
            AnyDeclId fnId = t.registerId(trait.span, m.fn, AnyDeclId.Kind.FUN);
            (m.provided ? decl.providedMethods : decl.requiredMethods).put(m.name, fnId);
        }
        return decl;
    }

    private TraitImpl translateTraitImpl(ItemTransCtx ctx, FrontItem.TraitImplItem impl, ItemMeta meta) {
        translateGenerics(ctx, impl, PredicateOrigin.WHERE_CLAUSE_ON_IMPL, null);
        Span span = impl.span;
        TraitImpl decl = new TraitImpl(id, meta, ctx.generics, ctx.translateTraitDeclRef(span, impl.implTrait));
        impl.parentImplExprs.forEach(e -> decl.parentTraitRefs.add(ctx.predicates.translateTraitImplExpr(span, e)));
        for (FrontItem.AssocTyValue ty : impl.types) {
            decl.types.put(ty.name, ctx.translateTy(span, ty.ty));
            List<TraitRef> refs = new ArrayList<>();
            ty.implExprs.forEach(e -> refs.add(ctx.predicates.translateTraitImplExpr(span, e)));
            decl.typeClauses.put(ty.name, refs);
        }
        for (FrontItem.AssocValue c : impl.consts) {
            decl.consts.put(c.name, t.registerId(span, c.id, AnyDeclId.Kind.GLOBAL));
        }
        for (FrontItem.AssocValue m : impl.methods) {
            AnyDeclId fnId = t.registerId(span, m.id, AnyDeclId.Kind.FUN);
            (m.provided ? decl.providedMethods : decl.requiredMethods).put(m.name, fnId);
        }
        return decl;
    }

    // Placeholders

    private AnyDeclId initId() {
        if (initId == null) {
            initId = t.freshId(AnyDeclId.Kind.FUN);
        }
        return initId;
    }

    private ItemDecl placeholder(ItemMeta meta, GenericParams generics, ItemKind kind, String error) {
        TyStore store = t.store();
        return switch (id.kind) {
            case TYPE -> new TypeDecl(id, meta, generics,
                    error == null ? TypeDeclKind.Opaque.INSTANCE : new TypeDeclKind.Error(error));
            case FUN -> {
                FunDecl decl = new FunDecl(id, meta, generics, new FunSig(false, List.of(), store.unit()), kind, null);
                decl.makeOpaque();
                yield decl;
            }
            case GLOBAL -> {
                AnyDeclId initId = initId();
                ItemMeta initMeta = new ItemMeta(meta.name + "::{init}", meta.span, meta.isPublic, meta.isLocal);
                FunDecl init = new FunDecl(initId, initMeta, generics.copy(),
                        new FunSig(false, List.of(), store.unit()), kind, id);
                init.makeOpaque();
                produced.add(init);
                yield new GlobalDecl(id, meta, generics, store.unit(), kind, initId);
            }
            case TRAIT_DECL -> new TraitDecl(id, meta, generics);
            case TRAIT_IMPL -> new TraitImpl(id, meta, generics, null);
        };
    }
}
