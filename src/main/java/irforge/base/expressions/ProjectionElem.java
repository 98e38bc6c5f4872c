package irforge.base.expressions;

import java.util.Objects;

public abstract class ProjectionElem {
    public static final ProjectionElem DEREF = new Deref();

    public static ProjectionElem field(int index) {
        return new Field(index, null);
    }

    public static final class Deref extends ProjectionElem {
        private Deref() {}

        @Override
        public String toString() {
            return "*";
        }
    }

    /** Field of a struct or tuple, or of the given enum variant when {@code variant} is set. */
    public static final class Field extends ProjectionElem {
        public final int index;
        public final Integer variant;

        public Field(int index, Integer variant) {
            this.index = index;
            this.variant = variant;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Field other && index == other.index && Objects.equals(variant, other.variant);
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, variant);
        }

        @Override
        public String toString() {
            return variant == null ? "." + index : String.format(" as %d).%d", variant, index);
        }
    }
}
