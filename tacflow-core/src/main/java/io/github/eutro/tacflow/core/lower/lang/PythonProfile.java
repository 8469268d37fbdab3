package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The profile of Python.
 * <p>
 * Beyond the shared constructs, this lowers comprehensions into index-based loops filling a
 * fresh collection, {@code with} into {@code __enter__}/{@code __exit__} calls, decorators into
 * re-stores of the decorated name, and {@code match} into a chain of equality tests.
 */
public class PythonProfile extends LanguageProfile {
    public PythonProfile() {
        super("python");
        literals.setNone("None");
        literals.setTrueValue("True");
        literals.setFalseValue("False");
        literals.setDefaultReturn("None");
        blockTypes.addAll(Arrays.asList("module", "block"));
        identifierTypes.add("dotted_name");

        expr(Expressions::identifier, "identifier", "dotted_name");
        expr(Expressions::constLiteral, "integer", "float", "string", "concatenated_string",
                "true", "false", "none", "ellipsis");
        expr(Expressions::binop, "binary_operator", "boolean_operator");
        expr(PythonProfile::comparison, "comparison_operator");
        expr(Expressions::unop, "unary_operator", "not_operator");
        expr(Expressions::call, "call");
        expr(Expressions::attribute, "attribute");
        expr(Expressions::subscript, "subscript");
        expr(Expressions::paren, "parenthesized_expression");
        expr(Expressions::listLiteral, "list");
        expr(Expressions::tupleLiteral, "tuple", "expression_list", "pattern_list");
        expr((ctx, n) -> Expressions.array(ctx, n, "set", Expressions.elements(ctx, n)), "set");
        expr(Expressions::dictLiteral, "dictionary");
        expr(PythonProfile::conditionalExpr, "conditional_expression");
        expr((ctx, n) -> comprehension(ctx, n, "list"), "list_comprehension", "generator_expression");
        expr((ctx, n) -> comprehension(ctx, n, "set"), "set_comprehension");
        expr(PythonProfile::dictComprehension, "dictionary_comprehension");
        expr(Definitions::lambda, "lambda");
        expr((ctx, n) -> ctx.lowerExpr(n.getChildByFieldName("value")), "keyword_argument");
        expr(Expressions::unwrap, "list_splat", "dictionary_splat", "parenthesized_list_splat");
        expr((ctx, n) -> Expressions.callFunction(ctx, n, "await",
                Collections.singletonList(Expressions.unwrap(ctx, n))), "await");
        expr(PythonProfile::namedExpression, "named_expression");

        stmt(Statements::expressionStatement, "expression_statement");
        stmt(Statements::assignment, "assignment");
        stmt(Statements::augmentedAssignment, "augmented_assignment");
        stmt(Statements::ret, "return_statement");
        stmt(ControlFlow::ifStmt, "if_statement");
        stmt(ControlFlow::whileStmt, "while_statement");
        stmt(PythonProfile::forStatement, "for_statement");
        stmt(Definitions::functionDef, "function_definition");
        stmt(Definitions::classDef, "class_definition");
        stmt(Statements::throwStmt, "raise_statement");
        stmt(PythonProfile::tryStatement, "try_statement");
        stmt(ControlFlow::breakStmt, "break_statement");
        stmt(ControlFlow::continueStmt, "continue_statement");
        stmt(PythonProfile::withStatement, "with_statement");
        stmt(PythonProfile::decoratedDefinition, "decorated_definition");
        stmt(PythonProfile::matchStatement, "match_statement");
        stmt(PythonProfile::assertStatement, "assert_statement");
        ignore("pass_statement", "import_statement", "import_from_statement", "future_import_statement",
                "global_statement", "nonlocal_statement");
    }

    @Override
    public @Nullable String paramName(LoweringContext ctx, SyntaxNode param) {
        switch (param.getType()) {
            case "identifier":
                return ctx.text(param);
            case "default_parameter":
            case "typed_default_parameter": {
                SyntaxNode name = param.getChildByFieldName("name");
                return name == null ? null : ctx.text(name);
            }
            case "typed_parameter":
            case "list_splat_pattern":
            case "dictionary_splat_pattern": {
                SyntaxNode id = Nodes.firstChildOfType(param, "identifier");
                return id == null ? null : ctx.text(id);
            }
            default:
                return null;
        }
    }

    /**
     * Lower a possibly chained comparison, {@code a < b < c} meaning {@code a < b and b < c}.
     */
    static Reg comparison(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> operands = new ArrayList<>();
        List<String> operators = new ArrayList<>();
        StringBuilder op = new StringBuilder();
        for (SyntaxNode child : node.getChildren()) {
            if (child.isNamed()) {
                if (op.length() > 0) {
                    operators.add(op.toString());
                    op.setLength(0);
                }
                operands.add(child);
            } else {
                if (op.length() > 0) op.append(' ');
                op.append(ctx.text(child));
            }
        }
        if (operands.size() < 2 || operators.size() != operands.size() - 1) {
            ctx.malformed(node, "expected operands separated by operators");
            return Expressions.constLiteral(ctx, node);
        }
        Reg lhs = ctx.lowerExpr(operands.get(0));
        Reg result = null;
        for (int i = 0; i < operators.size(); i++) {
            Reg rhs = ctx.lowerExpr(operands.get(i + 1));
            Reg cmp = ctx.produce(Opcode.BINOP, ctx.loc(node), operators.get(i), lhs, rhs);
            result = result == null ? cmp : ctx.produce(Opcode.BINOP, ctx.loc(node), "and", result, cmp);
            lhs = rhs;
        }
        return result;
    }

    static Reg conditionalExpr(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() < 3) {
            ctx.malformed(node, "expected a value, a condition and an alternative");
        }
        return Expressions.ternary(ctx, node,
                named.size() > 1 ? named.get(1) : null,
                named.size() > 0 ? named.get(0) : null,
                named.size() > 2 ? named.get(2) : null);
    }

    static Reg namedExpression(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        Reg value = ctx.lowerExpr(node.getChildByFieldName("value"));
        if (name != null) {
            ctx.storeVar(ctx.text(name), value, ctx.loc(node));
        }
        return value;
    }

    static void forStatement(LoweringContext ctx, SyntaxNode node) {
        ControlFlow.forEach(ctx, node,
                node.getChildByFieldName("left"),
                node.getChildByFieldName("right"),
                node.getChildByFieldName("body"));
    }

    static void assertStatement(LoweringContext ctx, SyntaxNode node) {
        List<Reg> args = new ArrayList<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!ctx.profile.isSkipped(child.getType())) args.add(ctx.lowerExpr(child));
        }
        Expressions.callFunction(ctx, node, "assert", args);
    }

    // comprehensions

    /**
     * Lower a list, set or generator comprehension into a loop appending to a fresh array.
     */
    static Reg comprehension(LoweringContext ctx, SyntaxNode node, String kind) {
        SyntaxNode body = node.getChildByFieldName("body");
        if (body == null) body = Nodes.firstNamedChild(node);
        SyntaxNode element = body;
        Reg size = ctx.constant("0");
        Reg result = ctx.produce(Opcode.NEW_ARRAY, ctx.loc(node), kind, size);
        String resultIdx = ctx.freshLabel("__comp_result_idx");
        ctx.storeVar(resultIdx, ctx.constant("0"), SourceLocation.UNKNOWN);
        comprehensionLoops(ctx, node, "comp", Nodes.childrenOfType(node, "for_in_clause"), 0,
                Nodes.childrenOfType(node, "if_clause"), () -> {
                    Reg value = ctx.lowerExpr(element);
                    Reg idx = ctx.loadVar(resultIdx, SourceLocation.UNKNOWN);
                    ctx.consume(Opcode.STORE_INDEX, ctx.loc(element), result, idx, value);
                    Reg one = ctx.constant("1");
                    Reg next = ctx.produce(Opcode.BINOP, SourceLocation.UNKNOWN, "+", idx, one);
                    ctx.storeVar(resultIdx, next, SourceLocation.UNKNOWN);
                });
        return result;
    }

    /**
     * Lower a dictionary comprehension into a loop storing each pair into a fresh object.
     */
    static Reg dictComprehension(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode pair = node.getChildByFieldName("body");
        if (pair == null) pair = Nodes.firstChildOfType(node, "pair");
        SyntaxNode entry = pair;
        Reg result = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "dict");
        comprehensionLoops(ctx, node, "dcomp", Nodes.childrenOfType(node, "for_in_clause"), 0,
                Nodes.childrenOfType(node, "if_clause"), () -> {
                    if (entry == null) {
                        ctx.malformed(node, "comprehension without a key and value");
                        return;
                    }
                    Reg key = ctx.lowerExpr(entry.getChildByFieldName("key"));
                    Reg value = ctx.lowerExpr(entry.getChildByFieldName("value"));
                    ctx.consume(Opcode.STORE_INDEX, ctx.loc(entry), result, key, value);
                });
        return result;
    }

    private static void comprehensionLoops(LoweringContext ctx, SyntaxNode node, String prefix,
                                           List<SyntaxNode> clauses, int i, List<SyntaxNode> filters,
                                           Runnable store) {
        if (i == clauses.size()) {
            filtered(ctx, prefix, filters, store);
            return;
        }
        SyntaxNode clause = clauses.get(i);
        SyntaxNode target = clause.getChildByFieldName("left");
        Reg iterable = ctx.lowerExpr(clause.getChildByFieldName("right"));
        ControlFlow.forEach(ctx, clause, prefix, iterable,
                (idx, elem) -> {
                    if (target != null) Statements.storeTarget(ctx, target, elem, clause);
                },
                () -> comprehensionLoops(ctx, node, prefix, clauses, i + 1, filters, store));
    }

    private static void filtered(LoweringContext ctx, String prefix, List<SyntaxNode> filters, Runnable store) {
        if (filters.isEmpty()) {
            store.run();
            return;
        }
        String skipLabel = ctx.freshLabel(prefix + "_skip");
        for (SyntaxNode filter : filters) {
            Reg cond = ctx.lowerExpr(Nodes.firstNamedChild(filter));
            String storeLabel = ctx.freshLabel(prefix + "_store");
            ctx.branchIf(cond, storeLabel, skipLabel, ctx.loc(filter));
            ctx.label(storeLabel);
        }
        store.run();
        ctx.branch(skipLabel);
        ctx.label(skipLabel);
    }

    // compound statements

    static void tryStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.CatchClause> catches = new ArrayList<>();
        SyntaxNode finallyBlock = null;
        SyntaxNode elseBlock = null;
        for (SyntaxNode child : node.getChildren()) {
            switch (child.getType()) {
                case "except_clause":
                case "except_group_clause": {
                    String variable = null;
                    String type = null;
                    for (SyntaxNode sub : child.getChildren()) {
                        if (sub.getType().equals("as_pattern")) {
                            List<SyntaxNode> parts = sub.getNamedChildren();
                            if (!parts.isEmpty()) type = ctx.text(parts.get(0));
                            if (parts.size() >= 2) variable = ctx.text(parts.get(parts.size() - 1));
                        } else if (type == null && (sub.getType().equals("identifier")
                                || sub.getType().equals("attribute"))) {
                            type = ctx.text(sub);
                        }
                    }
                    SyntaxNode block = Nodes.firstChildOfType(child, "block");
                    catches.add(new ControlFlow.CatchClause(variable, type, () -> ctx.lowerBlock(block)));
                    break;
                }
                case "finally_clause":
                    finallyBlock = Nodes.firstChildOfType(child, "block");
                    break;
                case "else_clause":
                    elseBlock = Nodes.fieldOrType(child, "body", "block");
                    break;
            }
        }
        SyntaxNode finallyNode = finallyBlock;
        SyntaxNode elseNode = elseBlock;
        ControlFlow.tryCatch(ctx, node, () -> ctx.lowerBlock(body), catches,
                finallyNode == null ? null : () -> ctx.lowerBlock(finallyNode),
                elseNode == null ? null : () -> ctx.lowerBlock(elseNode));
    }

    /**
     * Lower {@code with a as x, b: ...} by calling {@code __enter__} on each context in order,
     * then {@code __exit__} on each in reverse order after the body.
     */
    static void withStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode clause = Nodes.firstChildOfType(node, "with_clause");
        List<Reg> contexts = new ArrayList<>();
        if (clause != null) {
            for (SyntaxNode item : Nodes.childrenOfType(clause, "with_item")) {
                SyntaxNode value = item.getChildByFieldName("value");
                if (value == null) value = Nodes.firstNamedChild(item);
                SyntaxNode contextExpr = value;
                String variable = null;
                if (value != null && value.getType().equals("as_pattern")) {
                    List<SyntaxNode> named = value.getNamedChildren();
                    contextExpr = named.isEmpty() ? null : named.get(0);
                    if (named.size() >= 2) {
                        SyntaxNode target = named.get(named.size() - 1);
                        SyntaxNode id = Nodes.firstChildOfType(target, "identifier");
                        variable = ctx.text(id != null ? id : target);
                    }
                }
                Reg contextReg = ctx.lowerExpr(contextExpr);
                Reg entered = Expressions.callMethod(ctx, item, contextReg, "__enter__", Collections.emptyList());
                if (variable != null) {
                    ctx.storeVar(variable, entered, ctx.loc(item));
                }
                contexts.add(contextReg);
            }
        } else {
            ctx.malformed(node, "with statement without items");
        }
        ctx.lowerBlock(node.getChildByFieldName("body"));
        for (int i = contexts.size() - 1; i >= 0; i--) {
            Expressions.callMethod(ctx, node, contexts.get(i), "__exit__", Collections.emptyList());
        }
    }

    /**
     * Lower a definition, then pass it through each decorator, innermost first, storing the
     * result back to the defined name.
     */
    static void decoratedDefinition(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode definition = Nodes.fieldOrType(node, "definition", "function_definition", "class_definition");
        if (definition == null) {
            ctx.malformed(node, "decorators without a definition");
            return;
        }
        ctx.lowerStmt(definition);
        SyntaxNode nameNode = definition.getChildByFieldName("name");
        if (nameNode == null) return;
        String name = ctx.text(nameNode);
        List<SyntaxNode> decorators = Nodes.childrenOfType(node, "decorator");
        for (int i = decorators.size() - 1; i >= 0; i--) {
            SyntaxNode decorator = decorators.get(i);
            SyntaxNode expr = Nodes.firstNamedChild(decorator);
            if (expr == null) continue;
            Reg function = ctx.loadVar(name, SourceLocation.UNKNOWN);
            Reg result;
            if (ctx.profile.isIdentifier(expr)) {
                result = Expressions.callFunction(ctx, decorator, ctx.text(expr), Collections.singletonList(function));
            } else {
                Reg target = ctx.lowerExpr(expr);
                result = ctx.produce(Opcode.CALL_UNKNOWN, ctx.loc(decorator), target, function);
            }
            ctx.storeVar(name, result, ctx.loc(decorator));
        }
    }

    /**
     * Lower {@code match} as a chain of equality tests against each case pattern. A wildcard
     * matches anything, and a capture pattern matches anything and binds the subject.
     */
    static void matchStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode subjectNode = node.getChildByFieldName("subject");
        if (subjectNode == null) subjectNode = Nodes.firstNamedChild(node);
        Reg subject = ctx.lowerExpr(subjectNode);
        SyntaxNode body = Nodes.fieldOrType(node, "body", "block");
        List<ControlFlow.Case> cases = new ArrayList<>();
        for (SyntaxNode clause : Nodes.childrenOfType(body != null ? body : node, "case_clause")) {
            SyntaxNode consequence = Nodes.fieldOrType(clause, "consequence", "block");
            List<SyntaxNode> values = new ArrayList<>();
            boolean wildcard = false;
            String capture = null;
            for (SyntaxNode pattern : Nodes.childrenOfType(clause, "case_pattern")) {
                SyntaxNode value = Nodes.firstNamedChild(pattern);
                if (value == null || ctx.text(value).equals("_")) {
                    wildcard = true;
                } else if (value.getType().equals("dotted_name") && value.getNamedChildren().size() == 1) {
                    wildcard = true;
                    capture = ctx.text(value);
                } else {
                    values.add(value);
                }
            }
            String bound = capture;
            Runnable arm = () -> {
                if (bound != null) ctx.storeVar(bound, subject, ctx.loc(clause));
                ctx.lowerBlock(consequence);
            };
            cases.add(wildcard ? ControlFlow.Case.otherwise(arm) : new ControlFlow.Case(values, arm));
        }
        ControlFlow.switchChain(ctx, node, subject, cases, "==", false, true);
    }
}
