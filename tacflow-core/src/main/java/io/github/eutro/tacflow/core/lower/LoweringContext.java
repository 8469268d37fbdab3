package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.ir.*;
import io.github.eutro.tacflow.core.tree.Point;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * The mutable state of a single lowering call.
 * <p>
 * A context owns the register and label counters, the output buffer and the loop and break
 * target stacks, and dispatches nodes to the handlers of its {@link LanguageProfile}.
 * Every handler receives the context explicitly, so independent lowerings never share state.
 */
public final class LoweringContext {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * Whether every dispatched node is logged at debug level.
     */
    public static boolean TRACE_LOWERING = System.getenv("TACFLOW_TRACE_LOWERING") != null;

    /**
     * The profile of the language being lowered.
     */
    public final LanguageProfile profile;
    private final byte[] source;
    private final List<IRInstruction> instructions = new ArrayList<>();
    private int regCounter;
    private int labelCounter;

    private static final class LoopFrame {
        final String continueTarget;
        final String endTarget;

        LoopFrame(String continueTarget, String endTarget) {
            this.continueTarget = continueTarget;
            this.endTarget = endTarget;
        }
    }

    private final Deque<LoopFrame> loops = new ArrayDeque<>();
    private final Deque<String> breakTargets = new ArrayDeque<>();

    public LoweringContext(LanguageProfile profile, byte[] source) {
        this.profile = profile;
        this.source = source;
    }

    // state

    /**
     * Allocate the next register.
     * <p>
     * The register must be written by the very next instruction that produces a value,
     * otherwise the register set of the output is not contiguous.
     *
     * @return The register.
     */
    public Reg freshReg() {
        return Reg.of(regCounter++);
    }

    /**
     * Allocate a fresh label.
     *
     * @param prefix The label prefix.
     * @return The label, {@code <prefix>_<counter>}.
     */
    public String freshLabel(String prefix) {
        return prefix + "_" + labelCounter++;
    }

    /**
     * Enter a loop, which is both a continue and a break target.
     *
     * @param continueTarget The label {@code continue} jumps to.
     * @param endTarget      The label {@code break} jumps to.
     */
    public void pushLoop(String continueTarget, String endTarget) {
        loops.push(new LoopFrame(continueTarget, endTarget));
        breakTargets.push(endTarget);
    }

    public void popLoop() {
        loops.pop();
        breakTargets.pop();
    }

    /**
     * Enter a construct that {@code break} may leave, but which {@code continue} ignores.
     *
     * @param endTarget The label {@code break} jumps to.
     */
    public void pushBreakTarget(String endTarget) {
        breakTargets.push(endTarget);
    }

    public void popBreakTarget() {
        breakTargets.pop();
    }

    public @Nullable String breakTarget() {
        return breakTargets.peek();
    }

    public @Nullable String continueTarget() {
        LoopFrame frame = loops.peek();
        return frame == null ? null : frame.continueTarget;
    }

    /**
     * Get the instructions emitted so far.
     *
     * @return An unmodifiable copy of the buffer.
     */
    public List<IRInstruction> instructions() {
        return Collections.unmodifiableList(new ArrayList<>(instructions));
    }

    // source

    /**
     * Get the source text of a node.
     *
     * @param node The node.
     * @return The text between its byte offsets.
     */
    public String text(SyntaxNode node) {
        int start = Math.max(0, Math.min(node.getStartByte(), source.length));
        int end = Math.max(start, Math.min(node.getEndByte(), source.length));
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Get the source location of a node.
     *
     * @param node The node, possibly null.
     * @return The location, or {@link SourceLocation#UNKNOWN} for a null node.
     */
    public SourceLocation loc(@Nullable SyntaxNode node) {
        if (node == null) return SourceLocation.UNKNOWN;
        Point start = node.getStartPoint();
        Point end = node.getEndPoint();
        return SourceLocation.of(start.row + 1, start.column, end.row + 1, end.column);
    }

    // emission

    public void emit(IRInstruction insn) {
        instructions.add(insn);
    }

    /**
     * Emit a value-producing instruction into a fresh register.
     * <p>
     * Operands must be lowered before calling this, so that the result register
     * is numbered after theirs.
     *
     * @param opcode   The opcode.
     * @param location The source location.
     * @param operands The operands, registers or strings.
     * @return The result register.
     */
    public Reg produce(Opcode opcode, SourceLocation location, Object... operands) {
        Reg reg = freshReg();
        emit(IRInstruction.produce(opcode, reg, Arrays.asList(operands), location));
        return reg;
    }

    /**
     * Emit a value-producing instruction with a variable number of trailing operands.
     *
     * @param opcode   The opcode.
     * @param location The source location.
     * @param leading  The leading operands.
     * @param trailing The trailing operands, e.g. call arguments.
     * @return The result register.
     */
    public Reg produce(Opcode opcode, SourceLocation location, List<?> leading, List<?> trailing) {
        List<Object> operands = new ArrayList<>(leading);
        operands.addAll(trailing);
        Reg reg = freshReg();
        emit(IRInstruction.produce(opcode, reg, operands, location));
        return reg;
    }

    public void consume(Opcode opcode, SourceLocation location, Object... operands) {
        emit(IRInstruction.consume(opcode, Arrays.asList(operands), location));
    }

    public Reg constant(String value) {
        return produce(Opcode.CONST, SourceLocation.UNKNOWN, value);
    }

    public Reg constant(String value, SourceLocation location) {
        return produce(Opcode.CONST, location, value);
    }

    public Reg loadVar(String name, SourceLocation location) {
        return produce(Opcode.LOAD_VAR, location, name);
    }

    public void storeVar(String name, Reg value, SourceLocation location) {
        consume(Opcode.STORE_VAR, location, name, value);
    }

    public Reg symbolic(String marker, SourceLocation location) {
        return produce(Opcode.SYMBOLIC, location, marker);
    }

    public void label(String name) {
        emit(IRInstruction.label(name));
    }

    public void branch(String target) {
        emit(IRInstruction.branch(target, SourceLocation.UNKNOWN));
    }

    public void branchIf(Reg condition, String ifTrue, String ifFalse, SourceLocation location) {
        emit(IRInstruction.branchIf(condition, BranchTargets.of(ifTrue, ifFalse), location));
    }

    public void ret(Reg value, SourceLocation location) {
        consume(Opcode.RETURN, location, value);
    }

    /**
     * Report a supported construct whose tree did not have the expected shape.
     * <p>
     * Lowering carries on with whatever partial IR it can produce.
     *
     * @param node    The node.
     * @param problem What was missing.
     */
    public void malformed(@Nullable SyntaxNode node, String problem) {
        LOGGER.warn("malformed {} in {} at {}: {}",
                node == null ? "node" : node.getType(), profile.name, loc(node), problem);
    }

    // dispatch

    /**
     * Lower the {@code entry} label and the whole tree.
     *
     * @param root The root node.
     * @return The instructions.
     */
    public List<IRInstruction> lowerRoot(SyntaxNode root) {
        label(IRNames.ENTRY_LABEL);
        lowerChildren(root);
        return instructions();
    }

    /**
     * Lower a body, which may be a block of statements or a single statement.
     *
     * @param node The body, possibly null.
     */
    public void lowerBlock(@Nullable SyntaxNode node) {
        if (node == null) return;
        String type = node.getType();
        if (!profile.isBlock(type)
                && (profile.statementHandler(type) != null || profile.expressionHandler(type) != null)) {
            lowerStmt(node);
        } else {
            lowerChildren(node);
        }
    }

    /**
     * Lower every named child of a node as a statement.
     *
     * @param node The node.
     */
    public void lowerChildren(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            if (child.isNamed()) lowerStmt(child);
        }
    }

    /**
     * Lower a list of statements.
     *
     * @param nodes The statements.
     */
    public void lowerStatements(List<SyntaxNode> nodes) {
        for (SyntaxNode node : nodes) {
            lowerStmt(node);
        }
    }

    /**
     * Lower a statement, falling back to lowering it as an expression.
     *
     * @param node The statement.
     */
    public void lowerStmt(SyntaxNode node) {
        String type = node.getType();
        if (profile.isSkipped(type)) return;
        trace(node, "statement");
        StatementHandler handler = profile.statementHandler(type);
        if (handler != null) {
            handler.lower(this, node);
            return;
        }
        lowerExpr(node);
    }

    /**
     * Lower an expression.
     * <p>
     * An expression of an unknown kind becomes a {@code SYMBOLIC "unsupported:<kind>"} placeholder.
     * A missing expression becomes the profile's none literal.
     *
     * @param node The expression, possibly null.
     * @return The register holding its value.
     */
    public Reg lowerExpr(@Nullable SyntaxNode node) {
        if (node == null) {
            LOGGER.warn("missing expression in {}, substituting {}", profile.name, profile.literals.none());
            return constant(profile.literals.none());
        }
        trace(node, "expression");
        ExpressionHandler handler = profile.expressionHandler(node.getType());
        if (handler != null) {
            return handler.lower(this, node);
        }
        LOGGER.warn("unsupported node kind '{}' in {} at {}", node.getType(), profile.name, loc(node));
        return symbolic(IRNames.UNSUPPORTED_PREFIX + node.getType(), loc(node));
    }

    private void trace(SyntaxNode node, String as) {
        Level level = TRACE_LOWERING ? Level.DEBUG : Level.TRACE;
        if (LOGGER.isEnabled(level)) {
            LOGGER.log(level, "lowering {} '{}' at {}", as, node.getType(), loc(node));
        }
    }
}
