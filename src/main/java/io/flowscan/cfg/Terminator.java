package io.flowscan.cfg;

/**
 * How control leaves a basic block.
 */
public enum Terminator {
    /**
     * Block ends with a {@code return}.
     */
    RETURN,

    /**
     * Block ends with a {@code raise}.
     */
    RAISE,

    /**
     * Block ends with a {@code break} out of the innermost loop.
     */
    BREAK,

    /**
     * Block ends with a {@code continue} back to the innermost loop header.
     */
    CONTINUE,

    /**
     * Block hands control to its successors without a jump statement (sequence, branch
     * or loop edges).
     */
    FALLTHROUGH,

    /**
     * Block has no successors: the implicit exit, or a block control never leaves.
     */
    NONE;

    /**
     * Checks if this terminator is an explicit jump statement.
     */
    public boolean isJump() {
        return this == RETURN || this == RAISE || this == BREAK || this == CONTINUE;
    }
}
