package irforge.base.types;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An integer value together with its integer type.
 */
public class ScalarValue {
    public final IntegerTy ty;
    public final BigInteger value;

    public ScalarValue(IntegerTy ty, BigInteger value) {
        if (!ty.fits(value)) {
            throw new IllegalArgumentException(String.format("%s does not fit in %s", value, ty));
        }
        this.ty = ty;
        this.value = value;
    }

    public static ScalarValue of(IntegerTy ty, long value) {
        return new ScalarValue(ty, BigInteger.valueOf(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScalarValue that = (ScalarValue) o;
        return ty == that.ty && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ty, value);
    }

    @Override
    public String toString() {
        return value + ":" + ty.name().toLowerCase();
    }
}
