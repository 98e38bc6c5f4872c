package irforge.base.expressions;

import irforge.base.types.GenericArgs;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeId;
import irforge.base.types.TypeVisitor;

import java.util.Objects;

/**
 * What an aggregate rvalue builds: a tuple, a struct, or the given variant of an enum.
 */
public class AggregateKind {
    public final TypeId typeId;
    public final Integer variant;
    public final GenericArgs generics;

    public AggregateKind(TypeId typeId, Integer variant, GenericArgs generics) {
        this.typeId = Objects.requireNonNull(typeId);
        this.variant = variant;
        this.generics = Objects.requireNonNull(generics);
    }

    public AggregateKind foldTypes(TypeFolder folder) {
        return new AggregateKind(typeId, variant, folder.foldGenericArgs(generics));
    }

    public void visitTypes(TypeVisitor visitor) {
        if (typeId.adt != null) {
            visitor.visitDeclId(typeId.adt);
        }
        visitor.visitGenericArgs(generics);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregateKind that = (AggregateKind) o;
        return typeId.equals(that.typeId) && Objects.equals(variant, that.variant) && generics.equals(that.generics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeId, variant, generics);
    }

    @Override
    public String toString() {
        return variant == null ? typeId.toString() : typeId + "::" + variant;
    }
}
