package io.github.eutro.liveopt.ir;

/**
 * Whether memory address operands and branch conditions count as reads for liveness.
 */
public enum OperandPolicy {
    /**
     * Only the operands that produce a value count as reads.
     * Addresses of {@link Insn.Load} and {@link Insn.Store}, and the condition of
     * {@link Control.Branch}, are ignored.
     */
    FAITHFUL,
    /**
     * Identifiers in addresses and branch conditions are also reads.
     */
    CONSERVATIVE,
    ;

    /**
     * The policy used by the default instances of the liveness passes.
     * {@link #CONSERVATIVE} if {@code LIVEOPT_CONSERVATIVE_OPERANDS} is set in the environment.
     */
    public static final OperandPolicy DEFAULT =
            System.getenv("LIVEOPT_CONSERVATIVE_OPERANDS") != null ? CONSERVATIVE : FAITHFUL;
}
