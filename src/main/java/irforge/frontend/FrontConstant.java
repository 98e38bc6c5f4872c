package irforge.frontend;

import irforge.base.types.Literal;

/**
 * A constant operand of a front-end body.
 */
public abstract class FrontConstant {
    public final FrontTy ty;

    protected FrontConstant(FrontTy ty) {
        this.ty = ty;
    }

    public static final class Lit extends FrontConstant {
        public final Literal value;

        public Lit(Literal value, FrontTy ty) {
            super(ty);
            this.value = value;
        }
    }

    public static final class Global extends FrontConstant {
        public final DefId id;
        public final FrontGenericArgs args;

        public Global(DefId id, FrontGenericArgs args, FrontTy ty) {
            super(ty);
            this.id = id;
            this.args = args;
        }
    }

    /**
     * A function item. For trait methods, {@code traitImpl} is the witness of the trait and
     * {@code id} the method as declared in the trait.
     */
    public static final class FnDef extends FrontConstant {
        public final DefId id;
        public final FrontGenericArgs args;
        public final ImplExpr traitImpl;

        public FnDef(DefId id, FrontGenericArgs args, ImplExpr traitImpl, FrontTy ty) {
            super(ty);
            this.id = id;
            this.args = args;
            this.traitImpl = traitImpl;
        }
    }
}
