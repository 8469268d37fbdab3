package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The profile of Pascal.
 * <p>
 * The Pascal grammar produces keywords, including operators, as named nodes such as
 * {@code kBegin} or {@code kAdd}. Keywords are skipped as noise, except operators, which are
 * mapped to their symbols. Most constructs are taken apart positionally among their
 * non-keyword children.
 * <p>
 * A function returns the value last assigned to {@code Result} or to its own name.
 */
public class PascalProfile extends LanguageProfile {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * Operator keywords and the symbols they lower to.
     */
    public static final Map<String, String> OPERATORS;

    static {
        Map<String, String> ops = new HashMap<>();
        ops.put("kAdd", "+");
        ops.put("kSub", "-");
        ops.put("kMul", "*");
        ops.put("kFdiv", "/");
        ops.put("kDiv", "/");
        ops.put("kMod", "mod");
        ops.put("kEq", "==");
        ops.put("kNeq", "!=");
        ops.put("kLt", "<");
        ops.put("kLte", "<=");
        ops.put("kGt", ">");
        ops.put("kGte", ">=");
        ops.put("kAnd", "and");
        ops.put("kOr", "or");
        ops.put("kXor", "xor");
        ops.put("kNot", "not");
        ops.put("kShl", "shl");
        ops.put("kShr", "shr");
        ops.put("kIn", "in");
        ops.put("kIs", "is");
        ops.put("kAs", "as");
        // the same operators as plain tokens
        ops.put("=", "==");
        ops.put("<>", "!=");
        OPERATORS = Collections.unmodifiableMap(ops);
    }

    private static final List<String> KEYWORDS = Arrays.asList(
            "kProgram", "kUnit", "kUses", "kBegin", "kEnd", "kEndDot", "kVar", "kConst", "kType", "kDo",
            "kThen", "kElse", "kOf", "kTo", "kDownto", "kAssign", "kSemicolon", "kColon", "kComma", "kDot",
            "kLParen", "kRParen", "kIf", "kWhile", "kFor", "kRepeat", "kUntil", "kCase", "kFunction",
            "kProcedure", "kForward", ";", ":", ",", ".", "(", ")", "[", "]", ":="
    );

    public PascalProfile() {
        super("pascal");
        literals.setNone("nil");
        literals.setDefaultReturn("nil");
        noiseTypes.addAll(KEYWORDS);
        blockTypes.addAll(Arrays.asList("root", "program", "block", "statements"));
        attributeTypes.add("exprDot");
        subscriptTypes.add("exprSubscript");

        expr(Expressions::identifier, "identifier");
        expr(Expressions::constLiteral, "literalNumber", "literalString", "literalChar");
        expr(Expressions::canonicalTrue, "kTrue");
        expr(Expressions::canonicalFalse, "kFalse");
        expr(Expressions::noneLiteral, "kNil");
        expr(PascalProfile::binary, "exprBinary");
        expr(PascalProfile::unary, "exprUnary");
        expr(PascalProfile::call, "exprCall");
        expr(Expressions::paren, "exprParens", "parenthesized_expression");
        expr(Expressions::attribute, "exprDot");
        expr(Expressions::subscript, "exprSubscript");
        expr(PascalProfile::set, "exprBrackets");
        expr(PascalProfile::range, "range");

        stmt(PascalProfile::program, "root", "program", "block", "statements");
        stmt(PascalProfile::statement, "statement");
        stmt(PascalProfile::assignment, "assignment");
        stmt(PascalProfile::declarations, "declVars", "declConsts");
        stmt(PascalProfile::declaration, "declVar", "declConst");
        stmt(PascalProfile::ifStatement, "if", "ifElse");
        stmt(PascalProfile::whileStatement, "while");
        stmt(PascalProfile::repeat, "repeat");
        stmt(PascalProfile::forStatement, "for");
        stmt(PascalProfile::caseStatement, "case");
        stmt(PascalProfile::procedure, "defProc");
        ignore("moduleName", "declUses", "declTypes", "declType", "declProc", "declLabels");
    }

    @Override
    public @Nullable Pair<SyntaxNode, SyntaxNode> subscriptParts(SyntaxNode node) {
        List<SyntaxNode> parts = operands(node);
        if (parts.size() < 2) return null;
        SyntaxNode index = parts.get(1);
        if (index.getType().equals("exprArgs") || index.getType().equals("exprBrackets")) {
            index = Nodes.firstNamedChild(index);
        }
        return index == null ? null : Pair.of(parts.get(0), index);
    }

    @Override
    public void lowerParams(LoweringContext ctx, SyntaxNode params) {
        for (SyntaxNode child : params.getNamedChildren()) {
            if (child.getType().equals("declArg")) {
                for (SyntaxNode name : Nodes.childrenOfType(child, "identifier")) {
                    Definitions.emitParam(ctx, ctx.text(name), ctx.loc(name));
                }
            } else if (child.getType().equals("identifier")) {
                Definitions.emitParam(ctx, ctx.text(child), ctx.loc(child));
            }
        }
    }

    /**
     * Get the children of a node that are neither keywords nor comments.
     */
    static List<SyntaxNode> operands(SyntaxNode node) {
        List<SyntaxNode> operands = new ArrayList<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            String type = child.getType();
            if (KEYWORDS.contains(type) || type.equals("comment") || OPERATORS.containsKey(type)) continue;
            operands.add(child);
        }
        return operands;
    }

    /**
     * Map the operator of an operation through the keyword table, falling back to its text.
     */
    static @Nullable String operator(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode op = node.getChildByFieldName("operator");
        if (op != null) {
            String mapped = OPERATORS.get(op.getType());
            if (mapped == null) mapped = OPERATORS.get(ctx.text(op));
            return mapped != null ? mapped : ctx.text(op);
        }
        for (SyntaxNode child : node.getChildren()) {
            String mapped = OPERATORS.get(child.getType());
            if (mapped != null) return mapped;
        }
        for (SyntaxNode child : node.getChildren()) {
            if (!child.isNamed()) {
                String text = ctx.text(child);
                return OPERATORS.getOrDefault(text, text);
            }
        }
        return null;
    }

    static Reg binary(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> parts = operands(node);
        String op = operator(ctx, node);
        if (parts.size() < 2 || op == null) {
            ctx.malformed(node, "expected two operands and an operator");
            return Expressions.constLiteral(ctx, node);
        }
        return Expressions.binop(ctx, node, op, parts.get(0), parts.get(parts.size() - 1));
    }

    static Reg unary(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> parts = operands(node);
        String op = operator(ctx, node);
        if (parts.isEmpty() || op == null) {
            ctx.malformed(node, "expected an operator and an operand");
            return Expressions.constLiteral(ctx, node);
        }
        Reg value = ctx.lowerExpr(parts.get(0));
        return ctx.produce(Opcode.UNOP, ctx.loc(node), op, value);
    }

    static Reg call(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode args = Nodes.firstChildOfType(node, "exprArgs");
        SyntaxNode callee = node.getChildByFieldName("entity");
        if (callee == null) {
            for (SyntaxNode part : operands(node)) {
                if (part != args) {
                    callee = part;
                    break;
                }
            }
        }
        return Expressions.call(ctx, node, callee, args);
    }

    static Reg set(LoweringContext ctx, SyntaxNode node) {
        return Expressions.array(ctx, node, "set", operands(node));
    }

    static Reg range(LoweringContext ctx, SyntaxNode node) {
        return ctx.symbolic("range:" + ctx.text(node), ctx.loc(node));
    }

    static void program(LoweringContext ctx, SyntaxNode node) {
        ctx.lowerStatements(operands(node));
    }

    static void statement(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> parts = operands(node);
        if (parts.isEmpty()) return;
        ctx.lowerStmt(parts.get(0));
    }

    static void assignment(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> parts = operands(node);
        if (parts.size() < 2) {
            ctx.malformed(node, "assignment without a target and a value");
            return;
        }
        Reg value = ctx.lowerExpr(parts.get(parts.size() - 1));
        Statements.storeTarget(ctx, parts.get(0), value, node);
    }

    static void declarations(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode child : Nodes.childrenOfType(node, "declVar", "declConst")) {
            declaration(ctx, child);
        }
    }

    /**
     * Lower {@code x: T = v} or {@code x, y: T}, binding {@code nil} where there is no value.
     */
    static void declaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("defaultValue");
        if (value != null && value.getType().equals("defaultValue")) value = Nodes.firstNamedChild(value);
        if (value == null) {
            SyntaxNode defaultValue = Nodes.firstChildOfType(node, "defaultValue");
            if (defaultValue != null) value = operands(defaultValue).stream().findFirst().orElse(null);
        }
        for (SyntaxNode name : Nodes.childrenOfType(node, "identifier")) {
            Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
            ctx.storeVar(ctx.text(name), reg, ctx.loc(node));
        }
    }

    static void ifStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode condition = node.getChildByFieldName("condition");
        SyntaxNode consequence = node.getChildByFieldName("then");
        SyntaxNode alternative = node.getChildByFieldName("else");
        List<SyntaxNode> parts = operands(node);
        if (condition == null && !parts.isEmpty()) condition = parts.get(0);
        if (consequence == null && parts.size() > 1) consequence = parts.get(1);
        if (alternative == null && parts.size() > 2) alternative = parts.get(2);
        if (condition == null) {
            ctx.malformed(node, "if without a condition");
            return;
        }
        SyntaxNode cons = consequence;
        SyntaxNode alt = alternative;
        Reg cond = ctx.lowerExpr(condition);
        ControlFlow.ifElse(ctx, node, cond, () -> ctx.lowerBlock(cons), alt == null ? null : () -> ctx.lowerBlock(alt));
    }

    static void whileStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode condition = node.getChildByFieldName("condition");
        SyntaxNode body = node.getChildByFieldName("body");
        List<SyntaxNode> parts = operands(node);
        if (condition == null && !parts.isEmpty()) condition = parts.get(0);
        if (body == null && parts.size() > 1) body = parts.get(1);
        SyntaxNode bodyNode = body;
        ControlFlow.whileLoop(ctx, node, condition, () -> ctx.lowerBlock(bodyNode), false);
    }

    /**
     * Lower {@code repeat ... until c}, whose body is every statement before the condition.
     */
    static void repeat(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode condition = node.getChildByFieldName("condition");
        List<SyntaxNode> parts = operands(node);
        if (condition == null && !parts.isEmpty()) condition = parts.get(parts.size() - 1);
        List<SyntaxNode> body = new ArrayList<>(parts);
        body.remove(condition);
        ControlFlow.doWhile(ctx, node, () -> ctx.lowerStatements(body), condition, true);
    }

    /**
     * Lower {@code for i := a to b do}, or {@code downto}, which counts down and tests {@code >=}.
     */
    static void forStatement(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> parts = operands(node);
        SyntaxNode start = node.getChildByFieldName("start");
        SyntaxNode end = node.getChildByFieldName("end");
        SyntaxNode body = node.getChildByFieldName("body");
        SyntaxNode variable;
        SyntaxNode initial;
        if (start != null && start.getType().equals("assignment")) {
            List<SyntaxNode> init = operands(start);
            variable = init.isEmpty() ? null : init.get(0);
            initial = init.size() > 1 ? init.get(init.size() - 1) : null;
        } else if (parts.size() >= 4) {
            variable = parts.get(0);
            initial = parts.get(1);
            end = parts.get(2);
            body = parts.get(3);
        } else {
            ctx.symbolic("unsupported:for_incomplete", ctx.loc(node));
            return;
        }
        if (end == null && parts.size() > 1) end = parts.get(1);
        if (body == null && !parts.isEmpty()) body = parts.get(parts.size() - 1);
        if (variable == null) {
            ctx.malformed(node, "for without a loop variable");
            return;
        }
        boolean downto = Nodes.hasChildOfType(node, "kDownto");
        Reg startReg = ctx.lowerExpr(initial);
        Reg bound = ctx.lowerExpr(end);
        Reg step = ctx.constant(downto ? "-1" : "1");
        SyntaxNode bodyNode = body;
        ControlFlow.rangeFor(ctx, node, ctx.text(variable), startReg, bound, step, downto ? ">=" : "<=",
                () -> ctx.lowerBlock(bodyNode));
    }

    /**
     * Lower a case statement as a chain of equality tests, one disjunction per arm. The
     * statements after {@code else} are the default arm.
     */
    static void caseStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = node.getChildByFieldName("value");
        List<SyntaxNode> parts = operands(node);
        if (value == null && !parts.isEmpty()) value = parts.get(0);
        Reg subject = ctx.lowerExpr(value);
        List<ControlFlow.Case> cases = new ArrayList<>();
        List<SyntaxNode> otherwise = new ArrayList<>();
        boolean afterElse = false;
        for (SyntaxNode child : node.getChildren()) {
            if (child.getType().equals("kElse")) {
                afterElse = true;
            } else if (child.getType().equals("caseCase")) {
                cases.add(caseArm(ctx, child));
            } else if (afterElse && child.isNamed() && !ctx.profile.isSkipped(child.getType())) {
                otherwise.add(child);
            }
        }
        if (!otherwise.isEmpty()) {
            cases.add(ControlFlow.Case.otherwise(() -> ctx.lowerStatements(otherwise)));
        }
        ControlFlow.switchChain(ctx, node, subject, cases, "==", false);
    }

    private static ControlFlow.Case caseArm(LoweringContext ctx, SyntaxNode arm) {
        SyntaxNode body = arm.getChildByFieldName("body");
        List<SyntaxNode> values = new ArrayList<>();
        for (SyntaxNode part : operands(arm)) {
            if (part == body) continue;
            if (part.getType().equals("caseLabel")) {
                values.addAll(operands(part));
            } else if (body == null) {
                body = part;
            } else {
                values.add(part);
            }
        }
        if (values.isEmpty()) ctx.malformed(arm, "case arm without labels");
        SyntaxNode bodyNode = body;
        return new ControlFlow.Case(values, () -> ctx.lowerBlock(bodyNode));
    }

    /**
     * Lower a procedure or function definition. Local declarations are lowered before the body.
     */
    static void procedure(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode header = Nodes.firstChildOfType(node, "declProc");
        if (header == null) header = node;
        SyntaxNode name = header.getChildByFieldName("name");
        if (name == null) name = Nodes.firstChildOfType(header, "identifier");
        SyntaxNode args = Nodes.firstChildOfType(header, "declArgs");
        boolean function = Nodes.hasChildOfType(header, "kFunction");
        String funcName = name != null ? ctx.text(name) : "__anon";
        List<SyntaxNode> locals = new ArrayList<>();
        SyntaxNode body = null;
        for (SyntaxNode child : operands(node)) {
            if (child == header) continue;
            if (child.getType().equals("block")) {
                body = child;
            } else {
                locals.add(child);
            }
        }
        SyntaxNode bodyNode = body;
        LOGGER.debug("lowering {} {}", function ? "function" : "procedure", funcName);
        Definitions.function(ctx, node, funcName,
                () -> {
                    if (args != null) ctx.profile.lowerParams(ctx, args);
                },
                () -> {
                    ctx.lowerStatements(locals);
                    ctx.lowerBlock(bodyNode);
                    if (!function || bodyNode == null) return;
                    String result = assigns(ctx, bodyNode, "Result") ? "Result" : funcName;
                    ctx.ret(ctx.loadVar(result, ctx.loc(bodyNode)), ctx.loc(bodyNode));
                });
    }

    /**
     * Whether any assignment under a node stores to the given name, ignoring case.
     */
    private static boolean assigns(LoweringContext ctx, SyntaxNode node, String name) {
        if (node.getType().equals("assignment")) {
            List<SyntaxNode> parts = operands(node);
            if (!parts.isEmpty() && ctx.text(parts.get(0)).equalsIgnoreCase(name)) return true;
        }
        for (SyntaxNode child : node.getNamedChildren()) {
            if (assigns(ctx, child, name)) return true;
        }
        return false;
    }
}
