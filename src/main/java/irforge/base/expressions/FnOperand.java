package irforge.base.expressions;

import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;

import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/**
 * The callee of a call: a statically known function, or a function pointer held in a place.
 */
public class FnOperand {
    public final FnPtr regular;
    public final Place dynamic;

    private FnOperand(FnPtr regular, Place dynamic) {
        this.regular = regular;
        this.dynamic = dynamic;
    }

    public static FnOperand regular(FnPtr fnPtr) {
        return new FnOperand(Objects.requireNonNull(fnPtr), null);
    }

    public static FnOperand dynamic(Place place) {
        return new FnOperand(null, Objects.requireNonNull(place));
    }

    public FnOperand mapLocals(IntUnaryOperator f) {
        return dynamic == null ? this : dynamic(dynamic.mapLocals(f));
    }

    public void forEachLocal(IntConsumer f) {
        if (dynamic != null) {
            f.accept(dynamic.local);
        }
    }

    public FnOperand foldTypes(TypeFolder folder) {
        return regular == null ? this : regular(regular.foldTypes(folder));
    }

    public void visitTypes(TypeVisitor visitor) {
        if (regular != null) {
            regular.visitTypes(visitor);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FnOperand that = (FnOperand) o;
        return Objects.equals(regular, that.regular) && Objects.equals(dynamic, that.dynamic);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regular, dynamic);
    }

    @Override
    public String toString() {
        return regular != null ? regular.toString() : "(*" + dynamic + ")";
    }
}
