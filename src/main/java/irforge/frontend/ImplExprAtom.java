package irforge.frontend;

import java.util.List;

/**
 * Root of a witness: where the implementation comes from.
 */
public abstract class ImplExprAtom {

    /** A top-level impl block; nested obligations are in {@code args.implExprs}. */
    public static final class Concrete extends ImplExprAtom {
        public final DefId implId;
        public final FrontGenericArgs args;

        public Concrete(DefId implId, FrontGenericArgs args) {
            this.implId = implId;
            this.args = args;
        }
    }

    /** The implicit {@code Self: Trait} inside a trait, followed by a path. */
    public static final class SelfImpl extends ImplExprAtom {
        public final FrontBinder<FrontTraitRef> trait;
        public final List<ImplExprPathChunk> path;

        public SelfImpl(FrontBinder<FrontTraitRef> trait, List<ImplExprPathChunk> path) {
            this.trait = trait;
            this.path = List.copyOf(path);
        }
    }

    /** Clause {@code index} of the current item, whose predicate is {@code predicate}, followed by a path. */
    public static final class LocalBound extends ImplExprAtom {
        public final FrontBinder<FrontTraitRef> predicate;
        public final int index;
        public final List<ImplExprPathChunk> path;

        public LocalBound(FrontBinder<FrontTraitRef> predicate, int index, List<ImplExprPathChunk> path) {
            this.predicate = predicate;
            this.index = index;
            this.path = List.copyOf(path);
        }
    }

    public static final class Dyn extends ImplExprAtom {
        public static final Dyn INSTANCE = new Dyn();

        private Dyn() {}
    }

    public static final class Builtin extends ImplExprAtom {
        public final FrontBinder<FrontTraitRef> trait;

        public Builtin(FrontBinder<FrontTraitRef> trait) {
            this.trait = trait;
        }
    }

    public static final class Error extends ImplExprAtom {
        public final String message;

        public Error(String message) {
            this.message = message;
        }
    }
}
