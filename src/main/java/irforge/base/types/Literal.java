package irforge.base.types;

import java.util.Objects;

/**
 * A constant value of a primitive type, or a string literal.
 */
public abstract class Literal {

    public static class Scalar extends Literal {
        public final ScalarValue value;

        public Scalar(ScalarValue value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Scalar other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static class Bool extends Literal {
        public final boolean value;

        public Bool(boolean value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bool other && value == other.value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    public static class Char extends Literal {
        public final int codePoint;

        public Char(int codePoint) {
            this.codePoint = codePoint;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Char other && codePoint == other.codePoint;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(codePoint);
        }

        @Override
        public String toString() {
            return "'" + new String(Character.toChars(codePoint)) + "'";
        }
    }

    /** Floats are kept in their source spelling. */
    public static class Float extends Literal {
        public final FloatTy ty;
        public final String repr;

        public Float(FloatTy ty, String repr) {
            this.ty = ty;
            this.repr = repr;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Float other && ty == other.ty && repr.equals(other.repr);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ty, repr);
        }

        @Override
        public String toString() {
            return repr + ":" + ty.name().toLowerCase();
        }
    }

    public static class Str extends Literal {
        public final String value;

        public Str(String value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Str other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }
}
