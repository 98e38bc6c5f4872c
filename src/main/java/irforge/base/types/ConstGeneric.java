package irforge.base.types;

import java.util.Objects;

/**
 * A const-generic argument: a global constant, a const-generic variable, or a literal.
 */
public abstract class ConstGeneric {

    public static class Global extends ConstGeneric {
        public final AnyDeclId globalId;

        public Global(AnyDeclId globalId) {
            this.globalId = globalId.expect(AnyDeclId.Kind.GLOBAL);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Global other && globalId.equals(other.globalId);
        }

        @Override
        public int hashCode() {
            return globalId.hashCode();
        }

        @Override
        public String toString() {
            return globalId.toString();
        }
    }

    public static class Var extends ConstGeneric {
        public final int index;

        public Var(int index) {
            this.index = index;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Var other && index == other.index;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(index) * 31 + 7;
        }

        @Override
        public String toString() {
            return "C" + index;
        }
    }

    public static class Value extends ConstGeneric {
        public final Literal value;

        public Value(Literal value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Value other && value.equals(other.value);
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
}
