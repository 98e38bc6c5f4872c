package irforge.base.expressions;

import irforge.base.types.RefKind;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/**
 * The right-hand side of an assignment.
 */
public abstract class Rvalue {

    public abstract Rvalue mapLocals(IntUnaryOperator f);

    public abstract void forEachLocal(IntConsumer f);

    public Rvalue foldTypes(TypeFolder folder) {
        return this;
    }

    public void visitTypes(TypeVisitor visitor) {
    }

    public static final class Use extends Rvalue {
        public final Operand operand;

        public Use(Operand operand) {
            this.operand = Objects.requireNonNull(operand);
        }

        @Override
        public Rvalue mapLocals(IntUnaryOperator f) {
            return new Use(operand.mapLocals(f));
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            operand.forEachLocal(f);
        }

        @Override
        public Rvalue foldTypes(TypeFolder folder) {
            return new Use(operand.foldTypes(folder));
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            operand.visitTypes(visitor);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Use other && operand.equals(other.operand);
        }

        @Override
        public int hashCode() {
            return operand.hashCode();
        }

        @Override
        public String toString() {
            return operand.toString();
        }
    }

    public static final class Ref extends Rvalue {
        public final Place place;
        public final RefKind kind;

        public Ref(Place place, RefKind kind) {
            this.place = Objects.requireNonNull(place);
            this.kind = Objects.requireNonNull(kind);
        }

        @Override
        public Rvalue mapLocals(IntUnaryOperator f) {
            return new Ref(place.mapLocals(f), kind);
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            f.accept(place.local);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ref other && place.equals(other.place) && kind == other.kind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(place, kind);
        }

        @Override
        public String toString() {
            return (kind == RefKind.MUT ? "&mut " : "&") + place;
        }
    }

    public static final class BinaryOp extends Rvalue {
        public final BinOp op;
        public final Operand left;
        public final Operand right;

        public BinaryOp(BinOp op, Operand left, Operand right) {
            this.op = Objects.requireNonNull(op);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override
        public Rvalue mapLocals(IntUnaryOperator f) {
            return new BinaryOp(op, left.mapLocals(f), right.mapLocals(f));
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            left.forEachLocal(f);
            right.forEachLocal(f);
        }

        @Override
        public Rvalue foldTypes(TypeFolder folder) {
            return new BinaryOp(op, left.foldTypes(folder), right.foldTypes(folder));
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            left.visitTypes(visitor);
            right.visitTypes(visitor);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BinaryOp other && op == other.op && left.equals(other.left)
                    && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, left, right);
        }

        @Override
        public String toString() {
            return String.format("%s %s %s", left, op.symbol, right);
        }
    }

    public static final class UnaryOp extends Rvalue {
        public final UnOp op;
        public final Operand operand;

        public UnaryOp(UnOp op, Operand operand) {
            this.op = Objects.requireNonNull(op);
            this.operand = Objects.requireNonNull(operand);
        }

        @Override
        public Rvalue mapLocals(IntUnaryOperator f) {
            return new UnaryOp(op, operand.mapLocals(f));
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            operand.forEachLocal(f);
        }

        @Override
        public Rvalue foldTypes(TypeFolder folder) {
            return new UnaryOp(op, operand.foldTypes(folder));
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            operand.visitTypes(visitor);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UnaryOp other && op == other.op && operand.equals(other.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, operand);
        }

        @Override
        public String toString() {
            return (op == UnOp.NOT ? "!" : "-") + operand;
        }
    }

    public static final class Discriminant extends Rvalue {
        public final Place place;

        public Discriminant(Place place) {
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public Rvalue mapLocals(IntUnaryOperator f) {
            return new Discriminant(place.mapLocals(f));
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            f.accept(place.local);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Discriminant other && place.equals(other.place);
        }

        @Override
        public int hashCode() {
            return place.hashCode() * 31 + 5;
        }

        @Override
        public String toString() {
            return "@discriminant(" + place + ")";
        }
    }

    public static final class Aggregate extends Rvalue {
        public final AggregateKind kind;
        public final List<Operand> operands;

        public Aggregate(AggregateKind kind, List<Operand> operands) {
            this.kind = Objects.requireNonNull(kind);
            this.operands = List.copyOf(operands);
        }

        @Override
        public Rvalue mapLocals(IntUnaryOperator f) {
            List<Operand> mapped = new ArrayList<>();
            operands.forEach(op -> mapped.add(op.mapLocals(f)));
            return new Aggregate(kind, mapped);
        }

        @Override
        public void forEachLocal(IntConsumer f) {
            operands.forEach(op -> op.forEachLocal(f));
        }

        @Override
        public Rvalue foldTypes(TypeFolder folder) {
            List<Operand> folded = new ArrayList<>();
            operands.forEach(op -> folded.add(op.foldTypes(folder)));
            return new Aggregate(kind.foldTypes(folder), folded);
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            kind.visitTypes(visitor);
            operands.forEach(op -> op.visitTypes(visitor));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Aggregate other && kind.equals(other.kind) && operands.equals(other.operands);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, operands);
        }

        @Override
        public String toString() {
            StringJoiner joiner = new StringJoiner(", ", kind + " { ", " }");
            operands.forEach(op -> joiner.add(op.toString()));
            return joiner.toString();
        }
    }
}
