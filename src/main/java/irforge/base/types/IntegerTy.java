package irforge.base.types;

import java.math.BigInteger;

public enum IntegerTy {
    ISIZE(true, 64),
    I8(true, 8),
    I16(true, 16),
    I32(true, 32),
    I64(true, 64),
    I128(true, 128),
    USIZE(false, 64),
    U8(false, 8),
    U16(false, 16),
    U32(false, 32),
    U64(false, 64),
    U128(false, 128);

    public final boolean signed;
    /** Width in bits; pointer-sized integers are taken to be 64 bits wide. */
    public final int bits;

    IntegerTy(boolean signed, int bits) {
        this.signed = signed;
        this.bits = bits;
    }

    public BigInteger min() {
        return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    }

    public BigInteger max() {
        return signed
                ? BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE)
                : BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }

    public boolean fits(BigInteger value) {
        return value.compareTo(min()) >= 0 && value.compareTo(max()) <= 0;
    }
}
