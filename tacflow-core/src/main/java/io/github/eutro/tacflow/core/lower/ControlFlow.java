package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Shared lowerings of structured control flow.
 * <p>
 * Every construct is flattened to labels and branches. Values that change between loop
 * iterations are kept in named variables, never in registers.
 */
public final class ControlFlow {
    private ControlFlow() {
    }

    // conditionals

    /**
     * Lower an if statement through the profile's condition, consequence and alternative fields.
     * <p>
     * {@code elif_clause}, {@code else_if_clause} and {@code else_clause} children are chained in
     * order when present, otherwise the single alternative field is used.
     *
     * @param ctx  The context.
     * @param node The statement.
     */
    public static void ifStmt(LoweringContext ctx, SyntaxNode node) {
        LanguageProfile.FieldNames fields = ctx.profile.fields;
        SyntaxNode cond = node.getChildByFieldName(fields.ifCondition());
        SyntaxNode cons = node.getChildByFieldName(fields.ifConsequence());
        List<SyntaxNode> alternatives = Nodes.childrenOfType(node, "elif_clause", "else_if_clause", "else_clause");
        if (alternatives.isEmpty()) {
            SyntaxNode alt = node.getChildByFieldName(fields.ifAlternative());
            alternatives = alt == null ? Collections.emptyList() : Collections.singletonList(alt);
        }
        if (cond == null) ctx.malformed(node, "if without a condition");
        ifChain(ctx, node, cond, () -> ctx.lowerBlock(cons), alternatives);
    }

    /**
     * Lower an if statement with a list of alternative clauses.
     *
     * @param ctx          The context.
     * @param node         The statement, for its location.
     * @param condition    The condition.
     * @param consequence  Lowers the consequence.
     * @param alternatives The alternative clauses, in order.
     */
    public static void ifChain(LoweringContext ctx, SyntaxNode node, @Nullable SyntaxNode condition,
                               Runnable consequence, List<SyntaxNode> alternatives) {
        Reg cond = ctx.lowerExpr(condition);
        Alternative alt = alternatives.isEmpty() ? null : endLabel -> alternative(ctx, alternatives, 0, endLabel);
        ifThen(ctx, node, cond, consequence, alt);
    }

    /**
     * Lower a two-way branch on an already lowered condition.
     *
     * @param ctx         The context.
     * @param node        The statement, for its location.
     * @param cond        The condition register.
     * @param consequence Lowers the consequence.
     * @param alternative Lowers the alternative given the end label, or null for none.
     */
    public static void ifThen(LoweringContext ctx, SyntaxNode node, Reg cond,
                              Runnable consequence, @Nullable Alternative alternative) {
        String trueLabel = ctx.freshLabel("if_true");
        String falseLabel = ctx.freshLabel("if_false");
        String endLabel = ctx.freshLabel("if_end");
        ctx.branchIf(cond, trueLabel, alternative != null ? falseLabel : endLabel, ctx.loc(node));

        ctx.label(trueLabel);
        consequence.run();
        ctx.branch(endLabel);

        if (alternative != null) {
            ctx.label(falseLabel);
            alternative.lower(endLabel);
            ctx.branch(endLabel);
        }

        ctx.label(endLabel);
    }

    /**
     * Lower a two-way branch whose bodies are plain runnables.
     *
     * @param ctx         The context.
     * @param node        The statement, for its location.
     * @param cond        The condition register.
     * @param consequence Lowers the consequence.
     * @param alternative Lowers the alternative, or null for none.
     */
    public static void ifElse(LoweringContext ctx, SyntaxNode node, Reg cond,
                              Runnable consequence, @Nullable Runnable alternative) {
        Alternative alt = alternative == null ? null : endLabel -> alternative.run();
        ifThen(ctx, node, cond, consequence, alt);
    }

    /**
     * Lowers the alternative of a conditional, which branches to the given end label when done.
     */
    @FunctionalInterface
    public interface Alternative {
        void lower(String endLabel);
    }

    private static void alternative(LoweringContext ctx, List<SyntaxNode> clauses, int i, String endLabel) {
        SyntaxNode clause = clauses.get(i);
        switch (clause.getType()) {
            case "elif_clause":
            case "else_if_clause":
                elif(ctx, clauses, i, endLabel);
                break;
            case "else_clause":
            case "else":
                SyntaxNode body = clause.getChildByFieldName("body");
                if (body != null) {
                    ctx.lowerBlock(body);
                } else {
                    ctx.lowerChildren(clause);
                }
                break;
            default:
                ctx.lowerBlock(clause);
        }
    }

    private static void elif(LoweringContext ctx, List<SyntaxNode> clauses, int i, String endLabel) {
        SyntaxNode node = clauses.get(i);
        LanguageProfile.FieldNames fields = ctx.profile.fields;
        boolean more = i + 1 < clauses.size();

        Reg cond = ctx.lowerExpr(node.getChildByFieldName(fields.ifCondition()));
        String trueLabel = ctx.freshLabel("elif_true");
        String falseLabel = more ? ctx.freshLabel("elif_false") : endLabel;
        ctx.branchIf(cond, trueLabel, falseLabel, ctx.loc(node));

        ctx.label(trueLabel);
        ctx.lowerBlock(node.getChildByFieldName(fields.ifConsequence()));
        ctx.branch(endLabel);

        if (more) {
            ctx.label(falseLabel);
            alternative(ctx, clauses, i + 1, endLabel);
            ctx.branch(endLabel);
        }
    }

    /**
     * Lower a conditional whose branches produce values, through a synthetic result variable.
     *
     * @param ctx         The context.
     * @param node        The expression, for its location.
     * @param cond        The condition register.
     * @param consequence Lowers the consequence, returning its value.
     * @param alternative Lowers the alternative, returning its value, or null for the none literal.
     * @return The result register.
     */
    public static Reg ifValue(LoweringContext ctx, SyntaxNode node, Reg cond,
                              Supplier<Reg> consequence, @Nullable Supplier<Reg> alternative) {
        String result = ctx.freshLabel("__if_result");
        ifElse(ctx, node, cond,
                () -> ctx.storeVar(result, consequence.get(), SourceLocation.UNKNOWN),
                () -> ctx.storeVar(result, alternative != null
                        ? alternative.get()
                        : ctx.constant(ctx.profile.literals.none()), SourceLocation.UNKNOWN));
        return ctx.loadVar(result, ctx.loc(node));
    }

    // loops

    /**
     * Lower a while loop through the profile's condition and body fields.
     *
     * @param ctx  The context.
     * @param node The loop.
     */
    public static void whileStmt(LoweringContext ctx, SyntaxNode node) {
        LanguageProfile.FieldNames fields = ctx.profile.fields;
        SyntaxNode body = node.getChildByFieldName(fields.whileBody());
        whileLoop(ctx, node, node.getChildByFieldName(fields.whileCondition()), () -> ctx.lowerBlock(body), false);
    }

    /**
     * Lower a loop that re-evaluates its condition before every iteration.
     *
     * @param ctx       The context.
     * @param node      The loop, for its location.
     * @param condition The condition.
     * @param body      Lowers the body.
     * @param until     Whether the loop runs until the condition holds, rather than while it does.
     */
    public static void whileLoop(LoweringContext ctx, SyntaxNode node, @Nullable SyntaxNode condition,
                                 Runnable body, boolean until) {
        String condLabel = ctx.freshLabel("while_cond");
        String bodyLabel = ctx.freshLabel("while_body");
        String endLabel = ctx.freshLabel("while_end");

        ctx.label(condLabel);
        Reg cond = ctx.lowerExpr(condition);
        if (until) {
            ctx.branchIf(cond, endLabel, bodyLabel, ctx.loc(node));
        } else {
            ctx.branchIf(cond, bodyLabel, endLabel, ctx.loc(node));
        }

        ctx.label(bodyLabel);
        ctx.pushLoop(condLabel, endLabel);
        body.run();
        ctx.popLoop();
        ctx.branch(condLabel);

        ctx.label(endLabel);
    }

    /**
     * Lower a loop that tests its condition after every iteration.
     *
     * @param ctx       The context.
     * @param node      The loop, for its location.
     * @param body      Lowers the body.
     * @param condition The condition.
     * @param until     Whether the loop runs until the condition holds, as {@code repeat ... until}.
     */
    public static void doWhile(LoweringContext ctx, SyntaxNode node, Runnable body,
                               @Nullable SyntaxNode condition, boolean until) {
        String bodyLabel = ctx.freshLabel("do_body");
        String condLabel = ctx.freshLabel("do_cond");
        String endLabel = ctx.freshLabel("do_end");

        ctx.label(bodyLabel);
        ctx.pushLoop(condLabel, endLabel);
        body.run();
        ctx.popLoop();

        ctx.label(condLabel);
        Reg cond = ctx.lowerExpr(condition);
        if (until) {
            ctx.branchIf(cond, endLabel, bodyLabel, ctx.loc(node));
        } else {
            ctx.branchIf(cond, bodyLabel, endLabel, ctx.loc(node));
        }

        ctx.label(endLabel);
    }

    public static void doStmt(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        doWhile(ctx, node, () -> ctx.lowerBlock(body), node.getChildByFieldName("condition"), false);
    }

    /**
     * Lower an unconditional loop, left only through {@code break} or {@code return}.
     *
     * @param ctx  The context.
     * @param node The loop, for its location.
     * @param body Lowers the body.
     */
    public static void infiniteLoop(LoweringContext ctx, SyntaxNode node, Runnable body) {
        String topLabel = ctx.freshLabel("loop_top");
        String endLabel = ctx.freshLabel("loop_end");

        ctx.label(topLabel);
        ctx.pushLoop(topLabel, endLabel);
        body.run();
        ctx.popLoop();
        ctx.emit(IRInstruction.branch(topLabel, ctx.loc(node)));

        ctx.label(endLabel);
    }

    /**
     * Lower a C-style {@code for (init; cond; update)} loop from its
     * {@code initializer}, {@code condition}, {@code update} and {@code body} fields.
     *
     * @param ctx  The context.
     * @param node The loop.
     */
    public static void cStyleFor(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        SyntaxNode update = node.getChildByFieldName("update");
        cStyleFor(ctx, node,
                node.getChildByFieldName("initializer"),
                node.getChildByFieldName("condition"),
                update == null ? null : () -> ctx.lowerExpr(update),
                () -> ctx.lowerBlock(body));
    }

    /**
     * Lower a C-style for loop from its parts.
     *
     * @param ctx       The context.
     * @param node      The loop, for its location.
     * @param init      The initializer, lowered once as a statement.
     * @param condition The condition, or null to loop forever.
     * @param update    Lowers the update, or null for none.
     * @param body      Lowers the body.
     */
    public static void cStyleFor(LoweringContext ctx, SyntaxNode node, @Nullable SyntaxNode init,
                                 @Nullable SyntaxNode condition, @Nullable Runnable update, Runnable body) {
        if (init != null) ctx.lowerStmt(init);

        String condLabel = ctx.freshLabel("for_cond");
        String bodyLabel = ctx.freshLabel("for_body");
        String endLabel = ctx.freshLabel("for_end");
        String updateLabel = update != null ? ctx.freshLabel("for_update") : condLabel;

        ctx.label(condLabel);
        if (condition != null) {
            Reg cond = ctx.lowerExpr(condition);
            ctx.branchIf(cond, bodyLabel, endLabel, ctx.loc(node));
        } else {
            ctx.branch(bodyLabel);
        }

        ctx.label(bodyLabel);
        ctx.pushLoop(updateLabel, endLabel);
        body.run();
        ctx.popLoop();
        if (update != null) {
            ctx.label(updateLabel);
            update.run();
        }
        ctx.branch(condLabel);

        ctx.label(endLabel);
    }

    /**
     * Binds the loop variables of an iteration.
     */
    @FunctionalInterface
    public interface ElementBinder {
        /**
         * Bind the loop variables.
         *
         * @param index   The register holding the current index.
         * @param element The register holding the current element.
         */
        void bind(Reg index, Reg element);
    }

    /**
     * Lower an iteration over a collection as an index-based loop.
     * <p>
     * The index lives in a synthetic variable, incremented through a store and a reload
     * on every iteration.
     *
     * @param ctx      The context.
     * @param node     The loop, for its location.
     * @param iterable The collection expression.
     * @param binder   Binds the loop variables to the index and element.
     * @param body     Lowers the body.
     */
    public static void forEach(LoweringContext ctx, SyntaxNode node, @Nullable SyntaxNode iterable,
                               ElementBinder binder, Runnable body) {
        forEach(ctx, node, "for", ctx.lowerExpr(iterable), binder, body);
    }

    /**
     * Lower an iteration over an already lowered collection.
     *
     * @param ctx        The context.
     * @param node       The loop, for its location.
     * @param prefix     The prefix of the loop labels, e.g. {@code "for"}.
     * @param collection The register holding the collection.
     * @param binder     Binds the loop variables to the index and element.
     * @param body       Lowers the body.
     */
    public static void forEach(LoweringContext ctx, SyntaxNode node, String prefix, Reg collection,
                               ElementBinder binder, Runnable body) {
        SourceLocation loc = ctx.loc(node);
        String idxVar = ctx.freshLabel("__" + prefix + "_idx");
        ctx.storeVar(idxVar, ctx.constant("0"), loc);
        Reg length = Expressions.callFunction(ctx, node, "len", Collections.singletonList(collection));

        String condLabel = ctx.freshLabel(prefix + "_cond");
        String bodyLabel = ctx.freshLabel(prefix + "_body");
        String updateLabel = ctx.freshLabel(prefix + "_update");
        String endLabel = ctx.freshLabel(prefix + "_end");

        ctx.label(condLabel);
        Reg idx = ctx.loadVar(idxVar, SourceLocation.UNKNOWN);
        Reg cond = ctx.produce(Opcode.BINOP, loc, "<", idx, length);
        ctx.branchIf(cond, bodyLabel, endLabel, loc);

        ctx.label(bodyLabel);
        Reg current = ctx.loadVar(idxVar, SourceLocation.UNKNOWN);
        Reg element = ctx.produce(Opcode.LOAD_INDEX, loc, collection, current);
        binder.bind(current, element);
        ctx.pushLoop(updateLabel, endLabel);
        body.run();
        ctx.popLoop();

        ctx.label(updateLabel);
        Reg before = ctx.loadVar(idxVar, SourceLocation.UNKNOWN);
        Reg one = ctx.constant("1");
        Reg after = ctx.produce(Opcode.BINOP, SourceLocation.UNKNOWN, "+", before, one);
        ctx.storeVar(idxVar, after, SourceLocation.UNKNOWN);
        ctx.branch(condLabel);

        ctx.label(endLabel);
    }

    /**
     * Lower an iteration binding one loop target to each element.
     *
     * @param ctx      The context.
     * @param node     The loop.
     * @param target   The loop target, e.g. a name or a tuple pattern.
     * @param iterable The collection expression.
     * @param body     The body.
     */
    public static void forEach(LoweringContext ctx, SyntaxNode node, @Nullable SyntaxNode target,
                               @Nullable SyntaxNode iterable, @Nullable SyntaxNode body) {
        forEach(ctx, node, iterable, (idx, elem) -> {
            if (target != null) {
                Statements.storeTarget(ctx, target, elem, node);
            } else {
                ctx.malformed(node, "loop without a target");
            }
        }, () -> ctx.lowerBlock(body));
    }

    /**
     * Lower a counting loop over a numeric range.
     *
     * @param ctx        The context.
     * @param node       The loop, for its location.
     * @param variable   The loop variable.
     * @param start      The first value.
     * @param bound      The bound the variable is compared against.
     * @param step       The increment, negative for descending loops.
     * @param comparison The comparison that keeps the loop running, e.g. {@code "<="}.
     * @param body       Lowers the body.
     */
    public static void rangeFor(LoweringContext ctx, SyntaxNode node, String variable, Reg start, Reg bound,
                                Reg step, String comparison, Runnable body) {
        SourceLocation loc = ctx.loc(node);
        ctx.storeVar(variable, start, loc);

        String condLabel = ctx.freshLabel("for_cond");
        String bodyLabel = ctx.freshLabel("for_body");
        String updateLabel = ctx.freshLabel("for_update");
        String endLabel = ctx.freshLabel("for_end");

        ctx.label(condLabel);
        Reg current = ctx.loadVar(variable, SourceLocation.UNKNOWN);
        Reg cond = ctx.produce(Opcode.BINOP, loc, comparison, current, bound);
        ctx.branchIf(cond, bodyLabel, endLabel, loc);

        ctx.label(bodyLabel);
        ctx.pushLoop(updateLabel, endLabel);
        body.run();
        ctx.popLoop();

        ctx.label(updateLabel);
        Reg before = ctx.loadVar(variable, SourceLocation.UNKNOWN);
        Reg after = ctx.produce(Opcode.BINOP, SourceLocation.UNKNOWN, "+", before, step);
        ctx.storeVar(variable, after, SourceLocation.UNKNOWN);
        ctx.branch(condLabel);

        ctx.label(endLabel);
    }

    // jumps

    public static void breakStmt(LoweringContext ctx, SyntaxNode node) {
        String target = ctx.breakTarget();
        if (target == null) {
            ctx.malformed(node, "break outside of a loop");
            ctx.symbolic("break_outside_loop", ctx.loc(node));
        } else {
            ctx.emit(IRInstruction.branch(target, ctx.loc(node)));
        }
    }

    public static void continueStmt(LoweringContext ctx, SyntaxNode node) {
        String target = ctx.continueTarget();
        if (target == null) {
            ctx.malformed(node, "continue outside of a loop");
            ctx.symbolic("continue_outside_loop", ctx.loc(node));
        } else {
            ctx.emit(IRInstruction.branch(target, ctx.loc(node)));
        }
    }

    // switch

    /**
     * One arm of a multi-way branch.
     */
    public static final class Case {
        /**
         * The values the subject is compared against. Empty for the default arm.
         */
        public final List<SyntaxNode> values;
        public final Runnable body;

        public Case(List<SyntaxNode> values, Runnable body) {
            this.values = values;
            this.body = body;
        }

        public static Case otherwise(Runnable body) {
            return new Case(Collections.emptyList(), body);
        }

        public boolean isDefault() {
            return values.isEmpty();
        }
    }

    /**
     * Lower a multi-way branch as a chain of equality tests.
     * <p>
     * Each arm is entered when the subject equals any of its values, and leaves to the end of
     * the chain. The default arm runs when no other arm matched, wherever it appears.
     * {@code break} inside an arm leaves the chain. Without a subject, each value is itself
     * a condition.
     *
     * @param ctx     The context.
     * @param node    The statement, for its location.
     * @param subject The register holding the subject, or null.
     * @param cases   The arms, in order.
     * @param eq      The equality operator of the language.
     */
    public static void switchChain(LoweringContext ctx, SyntaxNode node, @Nullable Reg subject, List<Case> cases,
                                   String eq) {
        switchChain(ctx, node, subject, cases, eq, true);
    }

    /**
     * Lower a multi-way branch as a chain of equality tests, with the default arm deferred
     * until every other arm has been tried.
     *
     * @param ctx       The context.
     * @param node      The statement, for its location.
     * @param subject   The register holding the subject, or null.
     * @param cases     The arms, in order.
     * @param eq        The equality operator of the language.
     * @param breakable Whether {@code break} inside an arm leaves the chain, rather than an
     *                  enclosing loop.
     */
    public static void switchChain(LoweringContext ctx, SyntaxNode node, @Nullable Reg subject, List<Case> cases,
                                   String eq, boolean breakable) {
        switchChain(ctx, node, subject, cases, eq, breakable, false);
    }

    /**
     * Lower a multi-way branch as a chain of equality tests.
     * <p>
     * In an ordered chain, arms are tried strictly in source order, as pattern matches are:
     * the first default arm is taken as soon as it is reached, and the arms after it are
     * unreachable and not lowered. Otherwise the first default arm runs only once every
     * other arm has failed, wherever it appears, as in a C {@code switch}.
     *
     * @param ctx       The context.
     * @param node      The statement, for its location.
     * @param subject   The register holding the subject, or null.
     * @param cases     The arms, in order.
     * @param eq        The equality operator of the language.
     * @param breakable Whether {@code break} inside an arm leaves the chain, rather than an
     *                  enclosing loop.
     * @param ordered   Whether a default arm cuts off the arms after it.
     */
    public static void switchChain(LoweringContext ctx, SyntaxNode node, @Nullable Reg subject, List<Case> cases,
                                   String eq, boolean breakable, boolean ordered) {
        String endLabel = ctx.freshLabel("switch_end");
        if (breakable) ctx.pushBreakTarget(endLabel);
        Case fallback = null;
        for (Case arm : cases) {
            if (arm.isDefault()) {
                if (fallback == null) fallback = arm;
                if (ordered) break;
                continue;
            }
            String bodyLabel = ctx.freshLabel("case_body");
            String nextLabel = ctx.freshLabel("case_next");
            Reg cond = null;
            for (SyntaxNode value : arm.values) {
                Reg v = ctx.lowerExpr(value);
                Reg test = subject == null ? v : ctx.produce(Opcode.BINOP, ctx.loc(value), eq, subject, v);
                cond = cond == null ? test : ctx.produce(Opcode.BINOP, ctx.loc(value), "||", cond, test);
            }
            ctx.branchIf(cond, bodyLabel, nextLabel, ctx.loc(node));
            ctx.label(bodyLabel);
            arm.body.run();
            ctx.branch(endLabel);
            ctx.label(nextLabel);
        }
        if (fallback != null) {
            fallback.body.run();
        }
        ctx.branch(endLabel);
        ctx.label(endLabel);
        if (breakable) ctx.popBreakTarget();
    }

    /**
     * Lower a pattern match whose arms produce values, through a synthetic result variable.
     * Arms are tried in order, and a default arm cuts off the arms after it.
     * <p>
     * The chain is not a break target, so {@code break} in an arm leaves the enclosing loop.
     *
     * @param ctx     The context.
     * @param node    The expression, for its location.
     * @param subject The register holding the subject, or null if each value is a condition.
     * @param values  The values of each arm, empty for the default arm.
     * @param results Lowers the result of each arm.
     * @param eq      The equality operator of the language.
     * @return The result register.
     */
    public static Reg switchValue(LoweringContext ctx, SyntaxNode node, @Nullable Reg subject, List<List<SyntaxNode>> values,
                                  List<Supplier<Reg>> results, String eq) {
        return switchValue(ctx, node, subject, values, results, eq, true);
    }

    /**
     * Lower a multi-way branch whose arms produce values, through a synthetic result variable.
     *
     * @param ctx     The context.
     * @param node    The expression, for its location.
     * @param subject The register holding the subject, or null if each value is a condition.
     * @param values  The values of each arm, empty for the default arm.
     * @param results Lowers the result of each arm.
     * @param eq      The equality operator of the language.
     * @param ordered Whether a default arm cuts off the arms after it, rather than running
     *                once every other arm has failed.
     * @return The result register.
     */
    public static Reg switchValue(LoweringContext ctx, SyntaxNode node, @Nullable Reg subject, List<List<SyntaxNode>> values,
                                  List<Supplier<Reg>> results, String eq, boolean ordered) {
        String result = ctx.freshLabel("__match_result");
        ctx.storeVar(result, ctx.constant(ctx.profile.literals.none()), SourceLocation.UNKNOWN);
        List<Case> cases = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            Supplier<Reg> arm = results.get(i);
            cases.add(new Case(values.get(i), () -> ctx.storeVar(result, arm.get(), SourceLocation.UNKNOWN)));
        }
        switchChain(ctx, node, subject, cases, eq, false, ordered);
        return ctx.loadVar(result, ctx.loc(node));
    }

    // exceptions

    /**
     * A catch clause of a try statement.
     */
    public static final class CatchClause {
        /**
         * The variable the exception is bound to, or null.
         */
        public final @Nullable String variable;
        /**
         * The exception type tag, or null to catch anything.
         */
        public final @Nullable String type;
        public final Runnable body;

        public CatchClause(@Nullable String variable, @Nullable String type, Runnable body) {
            this.variable = variable;
            this.type = type;
            this.body = body;
        }
    }

    /**
     * Lower a try statement with catch, else and finally clauses.
     * <p>
     * The try body and every catch clause leave to the finally clause if there is one, and to the
     * end otherwise. If there is an else clause, the try body leaves to it instead, and it leaves
     * to the finally clause or the end. Each catch clause binds
     * {@code SYMBOLIC "caught_exception:<type>"} to its variable.
     *
     * @param ctx         The context.
     * @param node        The statement, for its location.
     * @param body        Lowers the try body.
     * @param catches     The catch clauses, in order.
     * @param finallyBody Lowers the finally clause, or null for none.
     * @param elseBody    Lowers the else clause, or null for none.
     */
    public static void tryCatch(LoweringContext ctx, SyntaxNode node, Runnable body, List<CatchClause> catches,
                                @Nullable Runnable finallyBody, @Nullable Runnable elseBody) {
        SourceLocation loc = ctx.loc(node);
        String bodyLabel = ctx.freshLabel("try_body");
        List<String> catchLabels = new ArrayList<>();
        for (int i = 0; i < catches.size(); i++) {
            catchLabels.add(ctx.freshLabel("catch_" + i));
        }
        String finallyLabel = finallyBody != null ? ctx.freshLabel("try_finally") : null;
        String elseLabel = elseBody != null ? ctx.freshLabel("try_else") : null;
        String endLabel = ctx.freshLabel("try_end");
        String exitLabel = finallyLabel != null ? finallyLabel : endLabel;

        ctx.label(bodyLabel);
        body.run();
        ctx.branch(elseLabel != null ? elseLabel : exitLabel);

        for (int i = 0; i < catches.size(); i++) {
            CatchClause clause = catches.get(i);
            ctx.label(catchLabels.get(i));
            String type = clause.type != null ? clause.type : "Exception";
            Reg caught = ctx.symbolic(IRNames.CAUGHT_EXCEPTION_PREFIX + type, loc);
            if (clause.variable != null) {
                ctx.storeVar(clause.variable, caught, loc);
            }
            clause.body.run();
            ctx.branch(exitLabel);
        }

        if (elseBody != null) {
            ctx.label(elseLabel);
            elseBody.run();
            ctx.branch(exitLabel);
        }

        if (finallyBody != null) {
            ctx.label(finallyLabel);
            finallyBody.run();
        }

        ctx.label(endLabel);
    }
}
