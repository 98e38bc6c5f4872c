package irforge.base.expressions;

public enum UnOp {
    NOT,
    NEG
}
