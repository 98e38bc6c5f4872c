package irforge.base.ullbc;

import irforge.base.expressions.Call;
import irforge.base.expressions.Operand;
import irforge.base.expressions.Place;
import irforge.base.meta.Span;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/**
 * The control transfer that ends a basic block.
 */
public abstract class Terminator {
    public final Span span;

    protected Terminator(Span span) {
        this.span = span == null ? Span.DUMMY : span;
    }

    /** Successor blocks, in declaration order. May contain duplicates. */
    public abstract List<Integer> targets();

    public abstract Terminator retarget(IntUnaryOperator f);

    public Terminator mapLocals(IntUnaryOperator f) {
        return this;
    }

    public void forEachLocal(IntConsumer f) {
    }

    public Terminator foldTypes(TypeFolder folder) {
        return this;
    }

    public void visitTypes(TypeVisitor visitor) {
    }

    public static final class Goto extends Terminator {
        public final int target;

        public Goto(Span span, int target) {
            super(span);
            this.target = target;
        }

        @Override
        public List<Integer> targets() {
            return List.of(target);
        }

        @Override
        public Terminator retarget(IntUnaryOperator f) {
            return new Goto(span, f.applyAsInt(target));
        }

        @Override
        public String toString() {
            return "goto bb" + target;
        }
    }

    public static final class Switch extends Terminator {
        public final Operand discr;
        public final SwitchTargets targets;

        public Switch(Span span, Operand discr, SwitchTargets targets) {
            super(span);
            this.discr = Objects.requireNonNull(discr);
            this.targets = Objects.requireNonNull(targets);
        }

        @Override
        public List<Integer> targets() {
            return targets.targets();
        }

        @Override
        public Terminator retarget(IntUnaryOperator f) {
            return new Switch(span, discr, targets.retarget(f));
        }

        @Override
        public Terminator mapLocals(IntUnaryOperator f) {
            return new Switch(span, discr.mapLocals(f), targets);
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            discr.forEachLocal(f);
        }

        @Override
        public Terminator foldTypes(TypeFolder folder) {
            return new Switch(span, discr.foldTypes(folder), targets);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            discr.visitTypes(visitor);
        }

        @Override
        public String toString() {
            return "switch " + discr + " [" + targets + "]";
        }
    }

    public static final class CallTerm extends Terminator {
        public final Call call;
        public final int target;

        public CallTerm(Span span, Call call, int target) {
            super(span);
            this.call = Objects.requireNonNull(call);
            this.target = target;
        }

        @Override
        public List<Integer> targets() {
            return List.of(target);
        }

        @Override
        public Terminator retarget(IntUnaryOperator f) {
            return new CallTerm(span, call, f.applyAsInt(target));
        }

        @Override
        public Terminator mapLocals(IntUnaryOperator f) {
            return new CallTerm(span, call.mapLocals(f), target);
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            call.forEachLocal(f);
        }

        @Override
        public Terminator foldTypes(TypeFolder folder) {
            return new CallTerm(span, call.foldTypes(folder), target);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            call.visitTypes(visitor);
        }

        @Override
        public String toString() {
            return call + " -> bb" + target;
        }
    }

    public static final class Drop extends Terminator {
        public final Place place;
        public final int target;

        public Drop(Span span, Place place, int target) {
            super(span);
            this.place = Objects.requireNonNull(place);
            this.target = target;
        }

        @Override
        public List<Integer> targets() {
            return List.of(target);
        }

        @Override
        public Terminator retarget(IntUnaryOperator f) {
            return new Drop(span, place, f.applyAsInt(target));
        }

        @Override
        public Terminator mapLocals(IntUnaryOperator f) {
            return new Drop(span, place.mapLocals(f), target);
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            f.accept(place.local);
        }

        @Override
        public String toString() {
            return "drop " + place + " -> bb" + target;
        }
    }

    /** Continue to {@code target} if {@code cond} evaluates to {@code expected}, panic otherwise. */
    public static final class Assert extends Terminator {
        public final Operand cond;
        public final boolean expected;
        public final int target;

        public Assert(Span span, Operand cond, boolean expected, int target) {
            super(span);
            this.cond = Objects.requireNonNull(cond);
            this.expected = expected;
            this.target = target;
        }

        @Override
        public List<Integer> targets() {
            return List.of(target);
        }

        @Override
        public Terminator retarget(IntUnaryOperator f) {
            return new Assert(span, cond, expected, f.applyAsInt(target));
        }

        @Override
        public Terminator mapLocals(IntUnaryOperator f) {
            return new Assert(span, cond.mapLocals(f), expected, target);
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            cond.forEachLocal(f);
        }

        @Override
        public Terminator foldTypes(TypeFolder folder) {
            return new Assert(span, cond.foldTypes(folder), expected, target);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            cond.visitTypes(visitor);
        }

        @Override
        public String toString() {
            return String.format("assert(%s == %b) -> bb%d", cond, expected, target);
        }
    }

    public static final class Return extends Terminator {
        public Return(Span span) {
            super(span);
        }

        @Override
        public List<Integer> targets() {
            return List.of();
        }

        @Override
        public Terminator retarget(IntUnaryOperator f) {
            return this;
        }

        @Override
        public String toString() {
            return "return";
        }
    }

    /** Diverges: the function does not return from here. */
    public static final class Panic extends Terminator {
        public Panic(Span span) {
            super(span);
        }

        @Override
        public List<Integer> targets() {
            return List.of();
        }

        @Override
        public Terminator retarget(IntUnaryOperator f) {
            return this;
        }

        @Override
        public String toString() {
            return "panic";
        }
    }

    public static final class Unreachable extends Terminator {
        public Unreachable(Span span) {
            super(span);
        }

        @Override
        public List<Integer> targets() {
            return List.of();
        }

        @Override
        public Terminator retarget(IntUnaryOperator f) {
            return this;
        }

        @Override
        public String toString() {
            return "unreachable";
        }
    }
}
