package irforge.base.types;

import java.util.Objects;

/**
 * What a {@link GenericArgs} list instantiates. Whole-crate passes use this to find every
 * argument list destined for a given item.
 */
public class GenericsSource {
    public static final GenericsSource BUILTIN = new GenericsSource(null);
    public static final GenericsSource OTHER = new GenericsSource(null);

    /** The target item, or null for builtins and anonymous targets. */
    public final AnyDeclId item;

    private GenericsSource(AnyDeclId item) {
        this.item = item;
    }

    public static GenericsSource item(AnyDeclId id) {
        return new GenericsSource(Objects.requireNonNull(id));
    }

    public boolean targets(AnyDeclId id) {
        return item != null && item.equals(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenericsSource that = (GenericsSource) o;
        // The two item-less singletons are only equal to themselves.
        return item != null && item.equals(that.item);
    }

    @Override
    public int hashCode() {
        return item != null ? item.hashCode() : System.identityHashCode(this);
    }

    @Override
    public String toString() {
        if (item != null) return item.toString();
        return this == BUILTIN ? "builtin" : "other";
    }
}
