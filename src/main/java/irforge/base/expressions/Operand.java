package irforge.base.expressions;

import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

public abstract class Operand {

    public static Operand copy(Place place) {
        return new Copy(place);
    }

    public static Operand move(Place place) {
        return new Move(place);
    }

    public static Operand constant(ConstantExpr value) {
        return new Const(value);
    }

    /** The place read by this operand, or null for constants. */
    public abstract Place place();

    public abstract Operand mapLocals(IntUnaryOperator f);

    public Operand foldTypes(TypeFolder folder) {
        return this;
    }

    public void visitTypes(TypeVisitor visitor) {
    }

    public void forEachLocal(IntConsumer f) {
        Place p = place();
        if (p != null) {
            f.accept(p.local);
        }
    }

    public static final class Copy extends Operand {
        public final Place place;

        public Copy(Place place) {
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public Place place() {
            return place;
        }

        @Override
        public Operand mapLocals(IntUnaryOperator f) {
            return new Copy(place.mapLocals(f));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Copy other && place.equals(other.place);
        }

        @Override
        public int hashCode() {
            return place.hashCode() * 31 + 1;
        }

        @Override
        public String toString() {
            return "copy " + place;
        }
    }

    public static final class Move extends Operand {
        public final Place place;

        public Move(Place place) {
            this.place = Objects.requireNonNull(place);
        }

        @Override
        public Place place() {
            return place;
        }

        @Override
        public Operand mapLocals(IntUnaryOperator f) {
            return new Move(place.mapLocals(f));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Move other && place.equals(other.place);
        }

        @Override
        public int hashCode() {
            return place.hashCode() * 31 + 2;
        }

        @Override
        public String toString() {
            return "move " + place;
        }
    }

    public static final class Const extends Operand {
        public final ConstantExpr value;

        public Const(ConstantExpr value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public Place place() {
            return null;
        }

        @Override
        public Operand mapLocals(IntUnaryOperator f) {
            return this;
        }

        @Override
        public Operand foldTypes(TypeFolder folder) {
            return new Const(value.foldTypes(folder));
        }

        @Override
        public void visitTypes(TypeVisitor visitor) {
            value.visitTypes(visitor);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Const other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "const " + value;
        }
    }
}
