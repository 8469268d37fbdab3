package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The profile of Go.
 * <p>
 * Multiple assignment and multiple return lower each value independently, in order.
 * The body of {@code func main} is lowered at the top level rather than as a function.
 */
public class GoProfile extends LanguageProfile {
    private static final String MAIN = "main";

    public GoProfile() {
        super("go");
        literals.setNone("nil");
        literals.setTrueValue("true");
        literals.setFalseValue("false");
        literals.setDefaultReturn("nil");
        fields.setAttrObject("operand");
        fields.setAttrAttribute("field");
        fields.setSubscriptValue("operand");
        fields.setSubscriptIndex("index");
        blockTypes.addAll(Arrays.asList("source_file", "block", "statement_list"));
        identifierTypes.addAll(Arrays.asList("field_identifier", "type_identifier", "package_identifier"));
        subscriptTypes.add("index_expression");

        expr(Expressions::identifier, "identifier", "field_identifier", "type_identifier", "package_identifier");
        expr(Expressions::constLiteral, "int_literal", "float_literal", "imaginary_literal", "rune_literal",
                "interpreted_string_literal", "raw_string_literal", "iota", "channel_type", "slice_type",
                "array_type", "map_type");
        expr(Expressions::canonicalTrue, "true");
        expr(Expressions::canonicalFalse, "false");
        expr(Expressions::canonicalNone, "nil");
        expr(Expressions::binop, "binary_expression");
        expr(Expressions::unop, "unary_expression");
        expr(Expressions::call, "call_expression");
        expr(Expressions::attribute, "selector_expression");
        expr(Expressions::subscript, "index_expression");
        expr(Expressions::paren, "parenthesized_expression");
        expr(GoProfile::compositeLiteral, "composite_literal");
        expr(GoProfile::typeAssertion, "type_assertion_expression");
        expr(GoProfile::sliceExpression, "slice_expression");
        expr(GoProfile::funcLiteral, "func_literal");
        expr(Expressions::tupleLiteral, "expression_list");
        expr(Expressions::unwrap, "literal_element", "variadic_argument");

        stmt(Statements::expressionStatement, "expression_statement");
        stmt(GoProfile::shortVarDeclaration, "short_var_declaration");
        stmt(GoProfile::assignment, "assignment_statement");
        stmt(GoProfile::ret, "return_statement");
        stmt(GoProfile::ifStatement, "if_statement");
        stmt(GoProfile::forStatement, "for_statement");
        stmt(GoProfile::functionDeclaration, "function_declaration");
        stmt(GoProfile::methodDeclaration, "method_declaration");
        stmt(GoProfile::typeDeclaration, "type_declaration");
        stmt((ctx, n) -> step(ctx, n, "+"), "inc_statement");
        stmt((ctx, n) -> step(ctx, n, "-"), "dec_statement");
        stmt((ctx, n) -> ctx.lowerChildren(n), "block", "statement_list");
        stmt(GoProfile::varDeclaration, "var_declaration", "const_declaration");
        stmt(ControlFlow::breakStmt, "break_statement");
        stmt(ControlFlow::continueStmt, "continue_statement");
        stmt((ctx, n) -> wrapCall(ctx, n, "defer"), "defer_statement");
        stmt((ctx, n) -> wrapCall(ctx, n, "go"), "go_statement");
        stmt(GoProfile::expressionSwitch, "expression_switch_statement");
        stmt(GoProfile::typeSwitch, "type_switch_statement");
        stmt(GoProfile::selectStatement, "select_statement");
        stmt(GoProfile::sendStatement, "send_statement");
        stmt(GoProfile::receiveStatement, "receive_statement");
        stmt(GoProfile::labeledStatement, "labeled_statement");
        stmt(GoProfile::gotoStatement, "goto_statement");
        ignore("package_clause", "import_declaration", "fallthrough_statement", "empty_statement");
    }

    @Override
    public void lowerParams(LoweringContext ctx, SyntaxNode params) {
        for (SyntaxNode child : params.getNamedChildren()) {
            switch (child.getType()) {
                case "parameter_declaration":
                case "variadic_parameter_declaration":
                    for (SyntaxNode name : child.getChildrenByFieldName("name")) {
                        Definitions.emitParam(ctx, ctx.text(name), ctx.loc(child));
                    }
                    break;
                case "identifier":
                    Definitions.emitParam(ctx, ctx.text(child), ctx.loc(child));
                    break;
                default:
                    break;
            }
        }
    }

    private static List<SyntaxNode> listItems(@Nullable SyntaxNode node) {
        if (node == null) return Collections.emptyList();
        if (node.getType().equals("expression_list")) return node.getNamedChildren();
        return Collections.singletonList(node);
    }

    /**
     * Store values to targets pairwise. A single value for several targets is taken apart by index.
     */
    private static void assignPairwise(LoweringContext ctx, SyntaxNode node, List<SyntaxNode> targets,
                                       List<SyntaxNode> values) {
        if (values.size() == 1 && targets.size() > 1) {
            Reg value = ctx.lowerExpr(values.get(0));
            Statements.destructure(ctx, targets, value, node);
            return;
        }
        List<Reg> regs = Statements.lowerAll(ctx, values);
        for (int i = 0; i < Math.min(targets.size(), regs.size()); i++) {
            Statements.storeTarget(ctx, targets.get(i), regs.get(i), node);
        }
    }

    static void shortVarDeclaration(LoweringContext ctx, SyntaxNode node) {
        assignPairwise(ctx, node, listItems(node.getChildByFieldName("left")),
                listItems(node.getChildByFieldName("right")));
    }

    static void assignment(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode operator = node.getChildByFieldName("operator");
        if (operator != null && !ctx.text(operator).equals("=")) {
            Statements.augmentedAssignment(ctx, node);
            return;
        }
        assignPairwise(ctx, node, listItems(node.getChildByFieldName("left")),
                listItems(node.getChildByFieldName("right")));
    }

    /**
     * Lower a return, emitting one {@code RETURN} per returned value.
     */
    static void ret(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> values = new ArrayList<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!ctx.profile.isSkipped(child.getType())) values.addAll(listItems(child));
        }
        if (values.isEmpty()) {
            ctx.ret(ctx.constant(ctx.profile.literals.defaultReturn()), ctx.loc(node));
            return;
        }
        for (Reg reg : Statements.lowerAll(ctx, values)) {
            ctx.ret(reg, ctx.loc(node));
        }
    }

    static void ifStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode init = node.getChildByFieldName("initializer");
        if (init != null) ctx.lowerStmt(init);
        ControlFlow.ifStmt(ctx, node);
    }

    /**
     * Lower the three shapes of {@code for}: a C-style clause, a range clause, and a bare
     * condition or none.
     */
    static void forStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        SyntaxNode forClause = Nodes.firstChildOfType(node, "for_clause");
        SyntaxNode rangeClause = Nodes.firstChildOfType(node, "range_clause");
        if (forClause != null) {
            SyntaxNode update = forClause.getChildByFieldName("update");
            ControlFlow.cStyleFor(ctx, node,
                    forClause.getChildByFieldName("initializer"),
                    forClause.getChildByFieldName("condition"),
                    update == null ? null : () -> ctx.lowerStmt(update),
                    () -> ctx.lowerBlock(body));
        } else if (rangeClause != null) {
            rangeFor(ctx, node, rangeClause, body);
        } else {
            SyntaxNode condition = null;
            for (SyntaxNode child : node.getNamedChildren()) {
                if (child != body && !ctx.profile.isSkipped(child.getType())) {
                    condition = child;
                    break;
                }
            }
            if (condition == null) {
                ControlFlow.infiniteLoop(ctx, node, () -> ctx.lowerBlock(body));
            } else {
                ControlFlow.whileLoop(ctx, node, condition, () -> ctx.lowerBlock(body), false);
            }
        }
    }

    /**
     * Lower {@code for k, v := range xs}, binding the index to the first name and the element
     * to the second.
     */
    private static void rangeFor(LoweringContext ctx, SyntaxNode node, SyntaxNode clause,
                                 @Nullable SyntaxNode body) {
        List<SyntaxNode> names = listItems(clause.getChildByFieldName("left"));
        Reg collection = ctx.lowerExpr(clause.getChildByFieldName("right"));
        ControlFlow.forEach(ctx, node, "range", collection,
                (idx, elem) -> {
                    if (names.size() >= 1) Statements.storeTarget(ctx, names.get(0), idx, node);
                    if (names.size() >= 2) Statements.storeTarget(ctx, names.get(1), elem, node);
                },
                () -> ctx.lowerBlock(body));
    }

    static void functionDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode body = node.getChildByFieldName("body");
        if (name != null && ctx.text(name).equals(MAIN)) {
            ctx.lowerBlock(body);
            return;
        }
        Definitions.functionDef(ctx, node);
    }

    static void methodDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode receiver = node.getChildByFieldName("receiver");
        SyntaxNode params = node.getChildByFieldName("parameters");
        SyntaxNode body = node.getChildByFieldName("body");
        Definitions.function(ctx, node, name != null ? ctx.text(name) : "__anon",
                () -> {
                    if (receiver != null) ctx.profile.lowerParams(ctx, receiver);
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> ctx.lowerBlock(body));
    }

    static Reg funcLiteral(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode params = node.getChildByFieldName("parameters");
        SyntaxNode body = node.getChildByFieldName("body");
        return Definitions.lambda(ctx, node,
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> {
                    ctx.lowerBlock(body);
                    return null;
                });
    }

    static void typeDeclaration(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode spec : Nodes.childrenOfType(node, "type_spec", "type_alias")) {
            SyntaxNode name = spec.getChildByFieldName("name");
            SyntaxNode type = spec.getChildByFieldName("type");
            if (name == null) continue;
            boolean struct = type != null && type.getType().equals("struct_type");
            Definitions.typeMarker(ctx, node, struct ? "struct" : "type", ctx.text(name));
        }
    }

    static void step(LoweringContext ctx, SyntaxNode node, String op) {
        SyntaxNode operand = Nodes.firstNamedChild(node);
        if (operand == null) {
            ctx.malformed(node, "expected an operand");
            return;
        }
        Reg value = ctx.lowerExpr(operand);
        Reg one = ctx.constant("1");
        Reg result = ctx.produce(Opcode.BINOP, ctx.loc(node), op, value, one);
        Statements.storeTarget(ctx, operand, result, node);
    }

    /**
     * Lower {@code var} and {@code const} declarations. Names without a value are bound to nil.
     */
    static void varDeclaration(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> specs = new ArrayList<>(Nodes.childrenOfType(node, "var_spec", "const_spec"));
        for (SyntaxNode list : Nodes.childrenOfType(node, "var_spec_list", "const_spec_list")) {
            specs.addAll(Nodes.childrenOfType(list, "var_spec", "const_spec"));
        }
        for (SyntaxNode spec : specs) {
            List<SyntaxNode> names = spec.getChildrenByFieldName("name");
            List<SyntaxNode> values = listItems(spec.getChildByFieldName("value"));
            List<Reg> regs = Statements.lowerAll(ctx, values);
            for (int i = 0; i < names.size(); i++) {
                Reg value = i < regs.size() ? regs.get(i) : ctx.constant(ctx.profile.literals.none());
                ctx.storeVar(ctx.text(names.get(i)), value, ctx.loc(spec));
            }
        }
    }

    /**
     * Lower {@code T{k: v}} and {@code []T{a, b}}. Keyed elements are stored as fields,
     * positional elements at their index.
     */
    static Reg compositeLiteral(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = node.getChildByFieldName("type");
        SyntaxNode body = Nodes.fieldOrType(node, "body", "literal_value");
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), type != null ? ctx.text(type) : "Object");
        if (body == null) return obj;
        int i = 0;
        for (SyntaxNode elem : body.getNamedChildren()) {
            if (ctx.profile.isSkipped(elem.getType())) continue;
            if (elem.getType().equals("keyed_element")) {
                List<SyntaxNode> parts = elem.getNamedChildren();
                if (parts.size() < 2) {
                    ctx.malformed(elem, "expected a key and a value");
                    continue;
                }
                SyntaxNode key = unwrapElement(parts.get(0));
                Reg value = ctx.lowerExpr(unwrapElement(parts.get(1)));
                ctx.consume(Opcode.STORE_FIELD, ctx.loc(elem), obj, ctx.text(key), value);
            } else {
                Reg value = ctx.lowerExpr(unwrapElement(elem));
                Reg idx = ctx.constant(String.valueOf(i));
                ctx.consume(Opcode.STORE_INDEX, ctx.loc(elem), obj, idx, value);
            }
            i++;
        }
        return obj;
    }

    private static SyntaxNode unwrapElement(SyntaxNode node) {
        if (node.getType().equals("literal_element")) {
            SyntaxNode inner = Nodes.firstNamedChild(node);
            if (inner != null) return inner;
        }
        return node;
    }

    static Reg typeAssertion(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode operand = node.getChildByFieldName("operand");
        SyntaxNode type = node.getChildByFieldName("type");
        List<SyntaxNode> named = node.getNamedChildren();
        if (operand == null && !named.isEmpty()) operand = named.get(0);
        if (type == null && named.size() > 1) type = named.get(named.size() - 1);
        Reg value = ctx.lowerExpr(operand);
        return ctx.produce(Opcode.CALL_FUNCTION, ctx.loc(node), "type_assert", value,
                type != null ? ctx.text(type) : "interface{}");
    }

    static Reg sliceExpression(LoweringContext ctx, SyntaxNode node) {
        Reg obj = ctx.lowerExpr(node.getChildByFieldName("operand"));
        SyntaxNode start = node.getChildByFieldName("start");
        SyntaxNode end = node.getChildByFieldName("end");
        Reg startReg = start != null ? ctx.lowerExpr(start) : ctx.constant("0");
        Reg endReg = end != null ? ctx.lowerExpr(end) : ctx.constant(ctx.profile.literals.none());
        return Expressions.callFunction(ctx, node, "slice", Arrays.asList(obj, startReg, endReg));
    }

    /**
     * Lower {@code defer f()} and {@code go f()} as the call, passed to a marker function.
     */
    static void wrapCall(LoweringContext ctx, SyntaxNode node, String marker) {
        SyntaxNode call = Nodes.firstNamedChild(node);
        if (call == null) {
            ctx.malformed(node, "expected a call");
            return;
        }
        Reg value = ctx.lowerExpr(call);
        Expressions.callFunction(ctx, node, marker, Collections.singletonList(value));
    }

    private static List<SyntaxNode> caseBody(SyntaxNode arm, List<SyntaxNode> exclude) {
        List<SyntaxNode> body = new ArrayList<>();
        for (SyntaxNode child : arm.getNamedChildren()) {
            if (!exclude.contains(child)) body.add(child);
        }
        return body;
    }

    static void expressionSwitch(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode init = node.getChildByFieldName("initializer");
        if (init != null) ctx.lowerStmt(init);
        SyntaxNode value = node.getChildByFieldName("value");
        Reg subject = value != null ? ctx.lowerExpr(value) : null;
        List<ControlFlow.Case> cases = new ArrayList<>();
        for (SyntaxNode arm : Nodes.childrenOfType(node, "expression_case", "default_case")) {
            SyntaxNode values = arm.getChildByFieldName("value");
            List<SyntaxNode> body = caseBody(arm, values == null
                    ? Collections.emptyList()
                    : Collections.singletonList(values));
            Runnable lowerBody = () -> ctx.lowerStatements(body);
            cases.add(arm.getType().equals("default_case")
                    ? ControlFlow.Case.otherwise(lowerBody)
                    : new ControlFlow.Case(listItems(values), lowerBody));
        }
        ControlFlow.switchChain(ctx, node, subject, cases, "==");
    }

    /**
     * Lower {@code switch v := x.(type)}, testing each case with {@code type_check}.
     */
    static void typeSwitch(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode alias = node.getChildByFieldName("alias");
        SyntaxNode value = node.getChildByFieldName("value");
        SyntaxNode header = Nodes.firstChildOfType(node, "type_switch_header");
        if (value == null && header != null) {
            List<SyntaxNode> named = header.getNamedChildren();
            value = named.isEmpty() ? null : named.get(named.size() - 1);
        }
        Reg subject = ctx.lowerExpr(value);
        if (alias != null) {
            for (SyntaxNode name : listItems(alias)) ctx.storeVar(ctx.text(name), subject, ctx.loc(node));
        }

        String endLabel = ctx.freshLabel("switch_end");
        ctx.pushBreakTarget(endLabel);
        List<SyntaxNode> defaults = new ArrayList<>();
        for (SyntaxNode arm : Nodes.childrenOfType(node, "type_case", "default_case")) {
            if (arm.getType().equals("default_case")) {
                defaults.add(arm);
                continue;
            }
            List<SyntaxNode> types = arm.getChildrenByFieldName("type");
            String bodyLabel = ctx.freshLabel("case_body");
            String nextLabel = ctx.freshLabel("case_next");
            Reg cond = null;
            for (SyntaxNode type : types) {
                Reg test = ctx.produce(Opcode.CALL_FUNCTION, ctx.loc(arm), "type_check", subject, ctx.text(type));
                cond = cond == null ? test : ctx.produce(Opcode.BINOP, ctx.loc(arm), "||", cond, test);
            }
            if (cond == null) {
                ctx.branch(bodyLabel);
            } else {
                ctx.branchIf(cond, bodyLabel, nextLabel, ctx.loc(arm));
            }
            ctx.label(bodyLabel);
            ctx.lowerStatements(caseBody(arm, types));
            ctx.branch(endLabel);
            ctx.label(nextLabel);
        }
        if (!defaults.isEmpty()) {
            ctx.lowerChildren(defaults.get(0));
        }
        ctx.branch(endLabel);
        ctx.label(endLabel);
        ctx.popBreakTarget();
    }

    /**
     * Lower {@code select}. Which case runs is not modelled, so each case is lowered in turn.
     */
    static void selectStatement(LoweringContext ctx, SyntaxNode node) {
        String endLabel = ctx.freshLabel("select_end");
        ctx.pushBreakTarget(endLabel);
        for (SyntaxNode arm : Nodes.childrenOfType(node, "communication_case", "default_case")) {
            ctx.label(ctx.freshLabel("select_case"));
            ctx.lowerChildren(arm);
            ctx.branch(endLabel);
        }
        ctx.label(endLabel);
        ctx.popBreakTarget();
    }

    static void sendStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode channel = node.getChildByFieldName("channel");
        SyntaxNode value = node.getChildByFieldName("value");
        Reg chan = ctx.lowerExpr(channel);
        Reg val = ctx.lowerExpr(value);
        Expressions.callFunction(ctx, node, "chan_send", Arrays.asList(chan, val));
    }

    /**
     * Lower {@code v := <-ch}, binding every name on the left to the received value.
     */
    static void receiveStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode left = node.getChildByFieldName("left");
        SyntaxNode right = node.getChildByFieldName("right");
        SyntaxNode channel = right;
        if (channel != null && channel.getType().equals("unary_expression")) {
            SyntaxNode operand = channel.getChildByFieldName("operand");
            if (operand != null) channel = operand;
        }
        Reg received = Expressions.callFunction(ctx, node, "chan_recv",
                Collections.singletonList(ctx.lowerExpr(channel)));
        for (SyntaxNode name : listItems(left)) {
            ctx.storeVar(ctx.text(name), received, ctx.loc(node));
        }
    }

    static void labeledStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode label = Nodes.fieldOrType(node, "label", "label_name");
        ctx.label(label != null ? ctx.text(label) : "__label");
        for (SyntaxNode child : node.getNamedChildren()) {
            if (child != label) ctx.lowerStmt(child);
        }
    }

    static void gotoStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode label = Nodes.fieldOrType(node, "label", "label_name");
        ctx.emit(IRInstruction.branch(label != null ? ctx.text(label) : "__unknown_label", ctx.loc(node)));
    }
}
