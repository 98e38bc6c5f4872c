package irforge.base.types;

public enum FloatTy {
    F16,
    F32,
    F64,
    F128
}
