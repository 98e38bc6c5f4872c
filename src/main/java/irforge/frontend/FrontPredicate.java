package irforge.frontend;

/**
 * A where-clause or bound as reported by the front end.
 */
public abstract class FrontPredicate {

    public static final class Trait extends FrontPredicate {
        public final FrontTraitRef traitRef;

        public Trait(FrontTraitRef traitRef) {
            this.traitRef = traitRef;
        }
    }

    public static final class RegionOutlives extends FrontPredicate {
        public final FrontRegion lhs;
        public final FrontRegion rhs;

        public RegionOutlives(FrontRegion lhs, FrontRegion rhs) {
            this.lhs = lhs;
            this.rhs = rhs;
        }
    }

    public static final class TypeOutlives extends FrontPredicate {
        public final FrontTy lhs;
        public final FrontRegion rhs;

        public TypeOutlives(FrontTy lhs, FrontRegion rhs) {
            this.lhs = lhs;
            this.rhs = rhs;
        }
    }

    /** {@code <T as Trait>::Name == ty}. */
    public static final class Projection extends FrontPredicate {
        public final ImplExpr implExpr;
        public final String name;
        public final FrontTy ty;

        public Projection(ImplExpr implExpr, String name, FrontTy ty) {
            this.implExpr = implExpr;
            this.name = name;
            this.ty = ty;
        }
    }

    public static final class ConstArgHasType extends FrontPredicate {
    }

    /**
     * A goal kind with no representation in the translated crate: well-formedness, alias-relate,
     * coerce, subtype, const-evaluatable, const-equate, ambiguous, normalizes-to, dyn-compatible.
     */
    public static final class Unsupported extends FrontPredicate {
        public final String kind;

        public Unsupported(String kind) {
            this.kind = kind;
        }
    }
}
