package irforge.frontend;

import java.util.List;

/**
 * A value that quantifies over late-bound regions.
 */
public class FrontBinder<T> {
    public final List<String> boundRegions;
    public final T value;

    public FrontBinder(List<String> boundRegions, T value) {
        this.boundRegions = List.copyOf(boundRegions);
        this.value = value;
    }

    public static <T> FrontBinder<T> dummy(T value) {
        return new FrontBinder<>(List.of(), value);
    }
}
