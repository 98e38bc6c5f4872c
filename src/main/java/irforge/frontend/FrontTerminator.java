package irforge.frontend;

import irforge.base.expressions.Place;
import irforge.base.meta.Span;

import java.math.BigInteger;
import java.util.List;

/**
 * Block terminators of a front-end body. Unwinding edges are not reported.
 */
public abstract class FrontTerminator {
    public final Span span;

    protected FrontTerminator(Span span) {
        this.span = span;
    }

    public static final class Goto extends FrontTerminator {
        public final int target;

        public Goto(Span span, int target) {
            super(span);
            this.target = target;
        }
    }

    /**
     * Branch on {@code discr}. A boolean discriminant has the single value 0 whose target is the
     * false branch and {@code otherwise} as the true branch.
     */
    public static final class SwitchInt extends FrontTerminator {
        public final FrontOperand discr;
        public final FrontTy discrTy;
        public final List<BigInteger> values;
        public final List<Integer> targets;
        public final int otherwise;

        public SwitchInt(Span span, FrontOperand discr, FrontTy discrTy, List<BigInteger> values,
                         List<Integer> targets, int otherwise) {
            super(span);
            this.discr = discr;
            this.discrTy = discrTy;
            this.values = List.copyOf(values);
            this.targets = List.copyOf(targets);
            this.otherwise = otherwise;
        }
    }

    /** A call; {@code target} is null for functions that do not return. */
    public static final class Call extends FrontTerminator {
        public final FrontOperand func;
        public final List<FrontOperand> args;
        public final Place dest;
        public final Integer target;

        public Call(Span span, FrontOperand func, List<FrontOperand> args, Place dest, Integer target) {
            super(span);
            this.func = func;
            this.args = List.copyOf(args);
            this.dest = dest;
            this.target = target;
        }
    }

    public static final class Drop extends FrontTerminator {
        public final Place place;
        public final int target;

        public Drop(Span span, Place place, int target) {
            super(span);
            this.place = place;
            this.target = target;
        }
    }

    public static final class Assert extends FrontTerminator {
        public final FrontOperand cond;
        public final boolean expected;
        public final int target;

        public Assert(Span span, FrontOperand cond, boolean expected, int target) {
            super(span);
            this.cond = cond;
            this.expected = expected;
            this.target = target;
        }
    }

    public static final class Return extends FrontTerminator {
        public Return(Span span) {
            super(span);
        }
    }

    /** Panic or resumed unwinding. */
    public static final class Abort extends FrontTerminator {
        public Abort(Span span) {
            super(span);
        }
    }

    public static final class Unreachable extends FrontTerminator {
        public Unreachable(Span span) {
            super(span);
        }
    }
}
