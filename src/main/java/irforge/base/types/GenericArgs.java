package irforge.base.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Use-side substitution for a {@link GenericParams} list. Component lists match the target's
 * parameter lists in arity and order; {@code traitRefs.get(i)} discharges trait clause {@code i}.
 */
public class GenericArgs {
    public final List<Region> regions;
    public final List<Ty> types;
    public final List<ConstGeneric> constGenerics;
    public final List<TraitRef> traitRefs;
    public final GenericsSource target;

    public GenericArgs(List<Region> regions, List<Ty> types, List<ConstGeneric> constGenerics,
                       List<TraitRef> traitRefs, GenericsSource target) {
        this.regions = List.copyOf(regions);
        this.types = List.copyOf(types);
        this.constGenerics = List.copyOf(constGenerics);
        this.traitRefs = List.copyOf(traitRefs);
        this.target = Objects.requireNonNull(target);
    }

    public static GenericArgs empty(GenericsSource target) {
        return new GenericArgs(List.of(), List.of(), List.of(), List.of(), target);
    }

    public boolean isEmpty() {
        return regions.isEmpty() && types.isEmpty() && constGenerics.isEmpty() && traitRefs.isEmpty();
    }

    public GenericArgs withTraitRefs(List<TraitRef> newTraitRefs) {
        return new GenericArgs(regions, types, constGenerics, newTraitRefs, target);
    }

    /**
     * Drop the trait reference at {@code slot}; later witnesses move down by one.
     */
    public GenericArgs removeTraitRef(int slot) {
        var refs = new ArrayList<>(traitRefs);
        refs.remove(slot);
        return withTraitRefs(refs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenericArgs that = (GenericArgs) o;
        return regions.equals(that.regions) && types.equals(that.types)
                && constGenerics.equals(that.constGenerics) && traitRefs.equals(that.traitRefs)
                && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regions, types, constGenerics, traitRefs, target);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(", ", "<", ">");
        regions.forEach(r -> joiner.add(r.toString()));
        types.forEach(t -> joiner.add(t.toString()));
        constGenerics.forEach(c -> joiner.add(c.toString()));
        traitRefs.forEach(t -> joiner.add(t.kind.toString()));
        return joiner.toString();
    }
}
