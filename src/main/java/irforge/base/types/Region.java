package irforge.base.types;

import java.util.Objects;

/**
 * A region (lifetime).
 * <p>
 * Bound regions use de Bruijn indices: {@code depth} counts the binders between the use and
 * the binder that introduces the variable (0 = innermost), {@code index} selects the variable
 * inside that binder's region list. The item's own generic parameters form the outermost binder.
 * <pre>
 * fn f&lt;'a, 'b&gt;(x: for&lt;'c&gt; fn(&amp;'a u8, &amp;'b u16, &amp;'c u32))
 *                            BVar(1,0) BVar(1,1) BVar(0,0)
 * </pre>
 */
public abstract class Region {

    public static final Region STATIC = new Static();
    public static final Region ERASED = new Erased();
    public static final Region UNKNOWN = new Unknown();

    public static Region bound(int depth, int index) {
        return new BVar(depth, index);
    }

    public static final class Static extends Region {
        private Static() {}

        @Override
        public String toString() {
            return "'static";
        }
    }

    /** Used where borrows are not tracked. */
    public static final class Erased extends Region {
        private Erased() {}

        @Override
        public String toString() {
            return "'_";
        }
    }

    /** Placeholder left behind by a recovered error. */
    public static final class Unknown extends Region {
        private Unknown() {}

        @Override
        public String toString() {
            return "'?";
        }
    }

    public static final class BVar extends Region {
        public final int depth;
        public final int index;

        private BVar(int depth, int index) {
            if (depth < 0 || index < 0) {
                throw new IllegalArgumentException(String.format("Invalid bound region (%d, %d)", depth, index));
            }
            this.depth = depth;
            this.index = index;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BVar other && depth == other.depth && index == other.index;
        }

        @Override
        public int hashCode() {
            return Objects.hash(depth, index);
        }

        @Override
        public String toString() {
            return String.format("'(%d,%d)", depth, index);
        }
    }
}
