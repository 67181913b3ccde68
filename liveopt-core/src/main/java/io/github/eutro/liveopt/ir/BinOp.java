package io.github.eutro.liveopt.ir;

/**
 * The binary operators of {@link Insn.AssignOp}. None of them have side effects.
 */
public enum BinOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    SHL("<<"),
    BIT_OR("|"),
    BIT_AND("&"),
    LT("<"),
    GT(">"),
    EQ("=="),
    AND("&&"),
    OR("||"),
    ;

    /**
     * The symbol used when displaying the operator.
     */
    public final String symbol;

    BinOp(String symbol) {
        this.symbol = symbol;
    }
}
