package io.github.eutro.tacflow.core.ir;

/**
 * The opcodes of the flattened three-address IR.
 * <p>
 * Every opcode is either a producer, writing exactly one result register,
 * or a consumer, which has no result. {@link #LABEL} is a pseudo-instruction
 * that only carries a block name.
 */
public enum Opcode {
    // producers
    CONST(Kind.PRODUCER),
    LOAD_VAR(Kind.PRODUCER),
    LOAD_FIELD(Kind.PRODUCER),
    LOAD_INDEX(Kind.PRODUCER),
    NEW_OBJECT(Kind.PRODUCER),
    NEW_ARRAY(Kind.PRODUCER),
    BINOP(Kind.PRODUCER),
    UNOP(Kind.PRODUCER),
    CALL_FUNCTION(Kind.PRODUCER),
    CALL_METHOD(Kind.PRODUCER),
    CALL_UNKNOWN(Kind.PRODUCER),
    SYMBOLIC(Kind.PRODUCER),

    // consumers and control
    STORE_VAR(Kind.CONSUMER),
    STORE_FIELD(Kind.CONSUMER),
    STORE_INDEX(Kind.CONSUMER),
    BRANCH_IF(Kind.CONSUMER),
    BRANCH(Kind.CONSUMER),
    RETURN(Kind.CONSUMER),
    THROW(Kind.CONSUMER),

    LABEL(Kind.PSEUDO),
    ;

    private enum Kind {
        PRODUCER,
        CONSUMER,
        PSEUDO,
    }

    private final Kind kind;

    Opcode(Kind kind) {
        this.kind = kind;
    }

    /**
     * Whether instructions with this opcode write a result register.
     *
     * @return Whether this is a producer.
     */
    public boolean isProducer() {
        return kind == Kind.PRODUCER;
    }

    /**
     * Whether this opcode ends straight-line execution of a block.
     *
     * @return Whether this is a branch, return or throw.
     */
    public boolean isTerminator() {
        switch (this) {
            case BRANCH:
            case BRANCH_IF:
            case RETURN:
            case THROW:
                return true;
            default:
                return false;
        }
    }

    /**
     * The lower case mnemonic used in the textual form.
     *
     * @return The mnemonic.
     */
    public String mnemonic() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
