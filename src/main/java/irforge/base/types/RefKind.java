package irforge.base.types;

public enum RefKind {
    MUT,
    SHARED
}
