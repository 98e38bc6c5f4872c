package irforge.base.types;

import java.util.Objects;

/**
 * {@code lhs} outlives {@code rhs}.
 */
public class OutlivesPred<L, R> {
    public final L lhs;
    public final R rhs;

    public OutlivesPred(L lhs, R rhs) {
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OutlivesPred<?, ?> that = (OutlivesPred<?, ?>) o;
        return lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, rhs);
    }

    @Override
    public String toString() {
        return lhs + ": " + rhs;
    }
}
