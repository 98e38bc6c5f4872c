package irforge.base.types;

import java.util.Objects;

/**
 * Primitive value types: integers, floats, bool and char.
 */
public class LiteralTy {
    public static final LiteralTy BOOL = new LiteralTy(null, null, "bool");
    public static final LiteralTy CHAR = new LiteralTy(null, null, "char");

    public final IntegerTy integer;
    public final FloatTy floating;
    private final String name;

    private LiteralTy(IntegerTy integer, FloatTy floating, String name) {
        this.integer = integer;
        this.floating = floating;
        this.name = name;
    }

    public static LiteralTy integer(IntegerTy ty) {
        return new LiteralTy(Objects.requireNonNull(ty), null, ty.name().toLowerCase());
    }

    public static LiteralTy floating(FloatTy ty) {
        return new LiteralTy(null, Objects.requireNonNull(ty), ty.name().toLowerCase());
    }

    public boolean isInteger() {
        return integer != null;
    }

    public boolean isFloat() {
        return floating != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((LiteralTy) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
