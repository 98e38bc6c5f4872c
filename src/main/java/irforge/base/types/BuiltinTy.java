package irforge.base.types;

/**
 * Built-in type constructors. These are opaque leaf identifiers: the translator
 * never looks at their definition.
 */
public enum BuiltinTy {
    BOX,
    ARRAY,
    SLICE,
    STR
}
