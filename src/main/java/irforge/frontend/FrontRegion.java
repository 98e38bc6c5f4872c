package irforge.frontend;

/**
 * A region as the front end reports it. Late-bound regions use de Bruijn indices relative to the
 * binders of the front-end types; early-bound ones index the item's region parameters.
 */
public abstract class FrontRegion {
    public static final FrontRegion STATIC = new Static();
    public static final FrontRegion ERASED = new Erased();

    public static final class Static extends FrontRegion {
        private Static() {}
    }

    public static final class Erased extends FrontRegion {
        private Erased() {}
    }

    public static final class Bound extends FrontRegion {
        public final int debruijn;
        public final int var;

        public Bound(int debruijn, int var) {
            this.debruijn = debruijn;
            this.var = var;
        }
    }

    public static final class EarlyParam extends FrontRegion {
        public final int index;

        public EarlyParam(int index) {
            this.index = index;
        }
    }

    public static final class Error extends FrontRegion {
        public final String message;

        public Error(String message) {
            this.message = message;
        }
    }
}
