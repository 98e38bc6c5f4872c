package irforge.base.expressions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * A local variable followed by a path of projections.
 */
public class Place {
    public final int local;
    public final List<ProjectionElem> projection;

    public Place(int local, List<ProjectionElem> projection) {
        this.local = local;
        this.projection = List.copyOf(projection);
    }

    public static Place local(int local) {
        return new Place(local, List.of());
    }

    public Place project(ProjectionElem elem) {
        List<ProjectionElem> elems = new ArrayList<>(projection);
        elems.add(elem);
        return new Place(local, elems);
    }

    public boolean isLocal() {
        return projection.isEmpty();
    }

    public Place mapLocals(IntUnaryOperator f) {
        int mapped = f.applyAsInt(local);
        return mapped == local ? this : new Place(mapped, projection);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Place place = (Place) o;
        return local == place.local && projection.equals(place.projection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(local, projection);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("_" + local);
        for (var elem : projection) {
            if (elem instanceof ProjectionElem.Deref) {
                sb.insert(0, "(*").append(")");
            } else {
                sb.append(elem);
            }
        }
        return sb.toString();
    }
}
