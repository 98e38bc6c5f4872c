package irforge.base.expressions;

public enum BinOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    REM("%"),
    BIT_AND("&"),
    BIT_OR("|"),
    BIT_XOR("^"),
    SHL("<<"),
    SHR(">>"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    /** Produce a {@code (result, overflowed)} pair instead of panicking. */
    CHECKED_ADD("checked.+"),
    CHECKED_SUB("checked.-"),
    CHECKED_MUL("checked.*");

    public final String symbol;

    BinOp(String symbol) {
        this.symbol = symbol;
    }

    public boolean isChecked() {
        return this == CHECKED_ADD || this == CHECKED_SUB || this == CHECKED_MUL;
    }

    /**
     * The panicking operator that corresponds to a checked one.
     */
    public BinOp unchecked() {
        return switch (this) {
            case CHECKED_ADD -> ADD;
            case CHECKED_SUB -> SUB;
            case CHECKED_MUL -> MUL;
            default -> this;
        };
    }
}
