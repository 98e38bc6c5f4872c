package irforge.base.ullbc;

import irforge.base.expressions.Operand;
import irforge.base.expressions.Place;
import irforge.base.expressions.Rvalue;
import irforge.base.meta.Span;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/**
 * A statement of a basic block. Statements never transfer control.
 */
public abstract class Statement {
    public final Span span;

    protected Statement(Span span) {
        this.span = span == null ? Span.DUMMY : span;
    }

    public abstract Statement mapLocals(IntUnaryOperator f);

    public abstract void forEachLocal(IntConsumer f);

    public Statement foldTypes(TypeFolder folder) {
        return this;
    }

    public void visitTypes(TypeVisitor visitor) {
    }

    public static final class Assign extends Statement {
        public final Place place;
        public final Rvalue rvalue;

        public Assign(Span span, Place place, Rvalue rvalue) {
            super(span);
            this.place = Objects.requireNonNull(place);
            this.rvalue = Objects.requireNonNull(rvalue);
        }

        @Override
        public Statement mapLocals(IntUnaryOperator f) {
            return new Assign(span, place.mapLocals(f), rvalue.mapLocals(f));
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            f.accept(place.local);
            rvalue.forEachLocal(f);
        }

        @Override
        public Statement foldTypes(TypeFolder folder) {
            return new Assign(span, place, rvalue.foldTypes(folder));
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            rvalue.visitTypes(visitor);
        }

        @Override
        public String toString() {
            return place + " := " + rvalue;
        }
    }

    public static final class FakeRead extends Statement {
        public final Place place;

        public FakeRead(Span span, Place place) {
            super(span);
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public Statement mapLocals(IntUnaryOperator f) {
            return new FakeRead(span, place.mapLocals(f));
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            f.accept(place.local);
        }

        @Override
        public String toString() {
            return "@fake_read(" + place + ")";
        }
    }

    public static final class SetDiscriminant extends Statement {
        public final Place place;
        public final int variant;

        public SetDiscriminant(Span span, Place place, int variant) {
            super(span);
            this.place = Objects.requireNonNull(place);
            this.variant = variant;
        }

        @Override
        public Statement mapLocals(IntUnaryOperator f) {
            return new SetDiscriminant(span, place.mapLocals(f), variant);
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            f.accept(place.local);
        }

        @Override
        public String toString() {
            return String.format("@discriminant(%s) := %d", place, variant);
        }
    }

    public static final class StorageDead extends Statement {
        public final int local;

        public StorageDead(Span span, int local) {
            super(span);
            this.local = local;
        }

        @Override
        public Statement mapLocals(IntUnaryOperator f) {
            return new StorageDead(span, f.applyAsInt(local));
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            f.accept(local);
        }

        @Override
        public String toString() {
            return "@storage_dead(_" + local + ")";
        }
    }

    public static final class Deinit extends Statement {
        public final Place place;

        public Deinit(Span span, Place place) {
            super(span);
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public Statement mapLocals(IntUnaryOperator f) {
            return new Deinit(span, place.mapLocals(f));
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            f.accept(place.local);
        }

        @Override
        public String toString() {
            return "@deinit(" + place + ")";
        }
    }

    /** Panics unless {@code cond} evaluates to {@code expected}. */
    public static final class Assert extends Statement {
        public final Operand cond;
        public final boolean expected;

        public Assert(Span span, Operand cond, boolean expected) {
            super(span);
            this.cond = Objects.requireNonNull(cond);
            this.expected = expected;
        }

        @Override
        public Statement mapLocals(IntUnaryOperator f) {
            return new Assert(span, cond.mapLocals(f), expected);
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            cond.forEachLocal(f);
        }

        @Override
        public Statement foldTypes(TypeFolder folder) {
            return new Assert(span, cond.foldTypes(folder), expected);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            cond.visitTypes(visitor);
        }

        @Override
        public String toString() {
            return String.format("assert(%s == %b)", cond, expected);
        }
    }

    public static final class Nop extends Statement {
        public Nop(Span span) {
            super(span);
        }

        @Override
        public Statement mapLocals(IntUnaryOperator f) {
            return this;
        }

        @Override
        public void forEachLocal(IntConsumer f) {
        }

        @Override
        public String toString() {
            return "nop";
        }
    }
}
