package irforge.base.types;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A value under a binder that quantifies over some region variables, e.g. {@code for<'a> T: Trait<'a>}.
 * Inside {@code skipBinder}, {@code BVar(0, i)} refers to {@code regions.get(i)}.
 * @param <T> the bound payload
 */
public class RegionBinder<T> {
    public final List<RegionVar> regions;
    /** Accessing this directly skips the binder: callers must account for the extra de Bruijn level. */
    public final T skipBinder;

    public RegionBinder(List<RegionVar> regions, T skipBinder) {
        this.regions = List.copyOf(regions);
        this.skipBinder = Objects.requireNonNull(skipBinder);
    }

    /** Wrap a value that does not mention any bound region of this level. */
    public static <T> RegionBinder<T> empty(T value) {
        return new RegionBinder<>(List.of(), value);
    }

    public <U> RegionBinder<U> map(Function<T, U> f) {
        return new RegionBinder<>(regions, f.apply(skipBinder));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RegionBinder<?> that = (RegionBinder<?>) o;
        return regions.equals(that.regions) && skipBinder.equals(that.skipBinder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regions, skipBinder);
    }

    @Override
    public String toString() {
        if (regions.isEmpty()) {
            return skipBinder.toString();
        }
        return "for<" + regions + "> " + skipBinder;
    }
}
