package irforge.base.expressions;

import irforge.base.types.Ty;

import java.util.Objects;

/**
 * A local variable of a body. Local 0 is the return place; locals {@code 1..=argCount} are the
 * arguments.
 */
public class Local {
    public final int index;
    /** Source name, or null for compiler temporaries. */
    public final String name;
    public final Ty ty;

    public Local(int index, String name, Ty ty) {
        this.index = index;
        this.name = name;
        this.ty = Objects.requireNonNull(ty);
    }

    public Local withIndex(int newIndex) {
        return new Local(newIndex, name, ty);
    }

    public Local withTy(Ty newTy) {
        return new Local(index, name, newTy);
    }

    @Override
    public String toString() {
        return (name == null ? "_" + index : name + "_" + index) + ": " + ty;
    }
}
