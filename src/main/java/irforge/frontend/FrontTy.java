package irforge.frontend;

import irforge.base.types.BuiltinTy;
import irforge.base.types.FloatTy;
import irforge.base.types.IntegerTy;

import java.util.List;

/**
 * A type as reported by the front end.
 */
public abstract class FrontTy {
    public static final FrontTy BOOL = new Bool();
    public static final FrontTy CHAR = new Char();
    public static final FrontTy NEVER = new Never();

    public static FrontTy integer(IntegerTy ty) {
        return new Int(ty);
    }

    public static FrontTy tuple(FrontTy... fields) {
        return new Tuple(List.of(fields));
    }

    public static FrontTy param(int index, String name) {
        return new Param(index, name);
    }

    public static final class Bool extends FrontTy {
        private Bool() {}
    }

    public static final class Char extends FrontTy {
        private Char() {}
    }

    public static final class Never extends FrontTy {
        private Never() {}
    }

    public static final class Int extends FrontTy {
        public final IntegerTy ty;

        public Int(IntegerTy ty) {
            this.ty = ty;
        }
    }

    public static final class Float extends FrontTy {
        public final FloatTy ty;

        public Float(FloatTy ty) {
            this.ty = ty;
        }
    }

    public static final class Tuple extends FrontTy {
        public final List<FrontTy> fields;

        public Tuple(List<FrontTy> fields) {
            this.fields = List.copyOf(fields);
        }
    }

    public static final class Adt extends FrontTy {
        public final DefId id;
        public final FrontGenericArgs args;

        public Adt(DefId id, FrontGenericArgs args) {
            this.id = id;
            this.args = args;
        }
    }

    /** Box, arrays, slices and {@code str}. */
    public static final class Builtin extends FrontTy {
        public final BuiltinTy ty;
        public final FrontGenericArgs args;

        public Builtin(BuiltinTy ty, FrontGenericArgs args) {
            this.ty = ty;
            this.args = args;
        }
    }

    public static final class Ref extends FrontTy {
        public final FrontRegion region;
        public final FrontTy ty;
        public final boolean mutable;

        public Ref(FrontRegion region, FrontTy ty, boolean mutable) {
            this.region = region;
            this.ty = ty;
            this.mutable = mutable;
        }
    }

    public static final class RawPtr extends FrontTy {
        public final FrontTy ty;
        public final boolean mutable;

        public RawPtr(FrontTy ty, boolean mutable) {
            this.ty = ty;
            this.mutable = mutable;
        }
    }

    /** A type parameter of the current item. */
    public static final class Param extends FrontTy {
        public final int index;
        public final String name;

        public Param(int index, String name) {
            this.index = index;
            this.name = name;
        }
    }

    /** {@code <T as Trait>::Name}, with the witness of {@code T: Trait}. */
    public static final class Projection extends FrontTy {
        public final ImplExpr implExpr;
        public final String name;

        public Projection(ImplExpr implExpr, String name) {
            this.implExpr = implExpr;
            this.name = name;
        }
    }

    public static final class Dyn extends FrontTy {
        public final List<FrontBinder<FrontTraitRef>> traits;

        public Dyn(List<FrontBinder<FrontTraitRef>> traits) {
            this.traits = List.copyOf(traits);
        }
    }

    /** A function pointer; it binds its late-bound regions. */
    public static final class Arrow extends FrontTy {
        public final FrontBinder<FrontFnSig> sig;

        public Arrow(FrontBinder<FrontFnSig> sig) {
            this.sig = sig;
        }
    }

    /** The front end could not type this expression. */
    public static final class Error extends FrontTy {
        public final String message;

        public Error(String message) {
            this.message = message;
        }
    }
}
