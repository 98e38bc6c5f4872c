package irforge.frontend;

import irforge.base.meta.Span;
import irforge.base.types.ScalarValue;

import java.util.ArrayList;
import java.util.List;

/**
 * A definition as the front end exposes it. Items declared inside a trait or an impl block
 * carry a {@link Member} describing their container; their generics include the container's.
 */
public abstract class FrontItem {
    public final DefId id;
    public final Span span;
    public final boolean isPublic;
    public final List<String> attributes = new ArrayList<>();
    public final FrontGenerics generics;

    protected FrontItem(DefId id, Span span, boolean isPublic, FrontGenerics generics) {
        this.id = id;
        this.span = span == null ? Span.DUMMY : span;
        this.isPublic = isPublic;
        this.generics = generics;
    }

    /** Container of an associated function or constant. */
    public static class Member {
        public final DefId container;
        public final String itemName;
        /** True for trait declarations, false for trait implementations. */
        public final boolean inTraitDecl;
        public final boolean hasDefault;
        /** For members of an impl block: the implemented trait. */
        public final FrontTraitRef implTrait;

        private Member(DefId container, String itemName, boolean inTraitDecl, boolean hasDefault,
                       FrontTraitRef implTrait) {
            this.container = container;
            this.itemName = itemName;
            this.inTraitDecl = inTraitDecl;
            this.hasDefault = hasDefault;
            this.implTrait = implTrait;
        }

        public static Member ofTraitDecl(DefId traitId, String itemName, boolean hasDefault) {
            return new Member(traitId, itemName, true, hasDefault, null);
        }

        public static Member ofTraitImpl(DefId implId, String itemName, FrontTraitRef implTrait) {
            return new Member(implId, itemName, false, false, implTrait);
        }
    }

    public static final class FnItem extends FrontItem {
        public final FrontFnSig sig;
        /** Null when the body is not available. */
        public final FrontBody body;
        public final Member member;

        public FnItem(DefId id, Span span, boolean isPublic, FrontGenerics generics, FrontFnSig sig,
                      FrontBody body, Member member) {
            super(id, span, isPublic, generics);
            this.sig = sig;
            this.body = body;
            this.member = member;
        }
    }

    public static final class GlobalItem extends FrontItem {
        public final FrontTy ty;
        public final FrontBody initializer;
        public final Member member;

        public GlobalItem(DefId id, Span span, boolean isPublic, FrontGenerics generics, FrontTy ty,
                          FrontBody initializer, Member member) {
            super(id, span, isPublic, generics);
            this.ty = ty;
            this.initializer = initializer;
            this.member = member;
        }
    }

    public static class FieldDef {
        public final String name;
        public final FrontTy ty;
        public final Span span;

        public FieldDef(String name, FrontTy ty, Span span) {
            this.name = name;
            this.ty = ty;
            this.span = span;
        }
    }

    public static class VariantDef {
        public final String name;
        public final List<FieldDef> fields;
        public final ScalarValue discriminant;
        public final Span span;

        public VariantDef(String name, List<FieldDef> fields, ScalarValue discriminant, Span span) {
            this.name = name;
            this.fields = List.copyOf(fields);
            this.discriminant = discriminant;
            this.span = span;
        }
    }

    /**
     * A struct, union, enum, alias or foreign type, according to {@code id.kind}. Unused lists are
     * empty; {@code aliased} is only set for aliases.
     */
    public static final class TypeItem extends FrontItem {
        public final List<FieldDef> fields = new ArrayList<>();
        public final List<VariantDef> variants = new ArrayList<>();
        public FrontTy aliased;

        public TypeItem(DefId id, Span span, boolean isPublic, FrontGenerics generics) {
            super(id, span, isPublic, generics);
        }
    }

    public static class AssocTy {
        public final String name;
        /** Bounds on the associated type, e.g. {@code type Assoc: Clone}. */
        public final List<FrontClause> clauses;

        public AssocTy(String name, List<FrontClause> clauses) {
            this.name = name;
            this.clauses = List.copyOf(clauses);
        }
    }

    public static class AssocConst {
        public final String name;
        public final FrontTy ty;
        /** Global holding the default value, or null. */
        public final DefId defaultValue;

        public AssocConst(String name, FrontTy ty, DefId defaultValue) {
            this.name = name;
            this.ty = ty;
            this.defaultValue = defaultValue;
        }
    }

    public static class AssocFn {
        public final String name;
        public final DefId fn;
        public final boolean provided;

        public AssocFn(String name, DefId fn, boolean provided) {
            this.name = name;
            this.fn = fn;
            this.provided = provided;
        }
    }

    /**
     * A trait declaration. Its type parameter 0 is {@code Self}; supertraits appear in
     * {@code parentClauses}, other where-clauses in the generics.
     */
    public static final class TraitDeclItem extends FrontItem {
        public final List<FrontClause> parentClauses = new ArrayList<>();
        public final List<AssocTy> types = new ArrayList<>();
        public final List<AssocConst> consts = new ArrayList<>();
        public final List<AssocFn> methods = new ArrayList<>();

        public TraitDeclItem(DefId id, Span span, boolean isPublic, FrontGenerics generics) {
            super(id, span, isPublic, generics);
        }
    }

    public static class AssocTyValue {
        public final String name;
        public final FrontTy ty;
        /** Witnesses for the bounds declared on the associated type, in order. */
        public final List<ImplExpr> implExprs;

        public AssocTyValue(String name, FrontTy ty, List<ImplExpr> implExprs) {
            this.name = name;
            this.ty = ty;
            this.implExprs = List.copyOf(implExprs);
        }
    }

    public static class AssocValue {
        public final String name;
        public final DefId id;
        public final boolean provided;

        public AssocValue(String name, DefId id, boolean provided) {
            this.name = name;
            this.id = id;
            this.provided = provided;
        }
    }

    public static final class TraitImplItem extends FrontItem {
        public final FrontTraitRef implTrait;
        /** Witnesses for the parent clauses of the implemented trait. */
        public final List<ImplExpr> parentImplExprs = new ArrayList<>();
        public final List<AssocTyValue> types = new ArrayList<>();
        public final List<AssocValue> consts = new ArrayList<>();
        public final List<AssocValue> methods = new ArrayList<>();

        public TraitImplItem(DefId id, Span span, boolean isPublic, FrontGenerics generics,
                             FrontTraitRef implTrait) {
            super(id, span, isPublic, generics);
            this.implTrait = implTrait;
        }
    }
}
