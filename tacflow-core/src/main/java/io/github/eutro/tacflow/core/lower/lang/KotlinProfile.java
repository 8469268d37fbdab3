package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * The profile of Kotlin.
 * <p>
 * The Kotlin grammar names few fields, so most constructs are taken apart by the kinds of their
 * children. Member and index accesses carry their member or index in a suffix node.
 */
public class KotlinProfile extends LanguageProfile {
    private static final List<String> BODY_TYPES = Arrays.asList("statements", "control_structure_body");

    public KotlinProfile() {
        super("kotlin");
        literals.setNone("null");
        literals.setDefaultReturn("Unit");
        commentTypes.addAll(Arrays.asList("multiline_comment", "line_comment"));
        noiseTypes.add("shebang_line");
        blockTypes.addAll(Arrays.asList("source_file", "statements", "control_structure_body", "class_body",
                "function_body"));
        identifierTypes.addAll(Arrays.asList("simple_identifier", "this_expression", "super_expression",
                "interpolated_identifier"));
        attributeTypes.addAll(Arrays.asList("navigation_expression", "directly_assignable_expression"));
        subscriptTypes.addAll(Arrays.asList("indexing_expression", "directly_assignable_expression"));

        expr(Expressions::identifier, "simple_identifier", "this_expression", "super_expression",
                "interpolated_identifier");
        expr(Expressions::constLiteral, "integer_literal", "long_literal", "real_literal", "character_literal",
                "hex_literal", "bin_literal", "unsigned_literal");
        expr(PhpProfile::bool, "boolean_literal");
        expr(Expressions::canonicalNone, "null_literal");
        expr(KotlinProfile::string, "string_literal");
        expr(Expressions::binop, "additive_expression", "multiplicative_expression", "comparison_expression",
                "equality_expression", "conjunction_expression", "disjunction_expression");
        expr(KotlinProfile::prefix, "prefix_expression");
        expr(KotlinProfile::postfix, "postfix_expression");
        expr(Expressions::paren, "parenthesized_expression");
        expr(KotlinProfile::call, "call_expression");
        expr(Expressions::attribute, "navigation_expression");
        expr(Expressions::subscript, "indexing_expression");
        expr(KotlinProfile::ifExpression, "if_expression");
        expr(KotlinProfile::when, "when_expression");
        expr(Expressions::listLiteral, "collection_literal");
        expr(KotlinProfile::lambda, "lambda_literal", "annotated_lambda");
        expr(KotlinProfile::objectLiteral, "object_literal");
        expr(KotlinProfile::range, "range_expression");
        expr(KotlinProfile::statementsValue, "statements");
        expr(KotlinProfile::asUnit, "jump_expression", "assignment", "try_expression", "while_statement",
                "for_statement", "do_while_statement");
        expr((ctx, n) -> typeCall(ctx, n, "is"), "check_expression");
        expr((ctx, n) -> typeCall(ctx, n, "as"), "as_expression");
        expr(KotlinProfile::elvis, "elvis_expression");
        expr(KotlinProfile::infix, "infix_expression");

        stmt(KotlinProfile::propertyDeclaration, "property_declaration");
        stmt(KotlinProfile::assignment, "assignment");
        stmt(KotlinProfile::functionDeclaration, "function_declaration");
        stmt(KotlinProfile::classDeclaration, "class_declaration");
        stmt(KotlinProfile::ifStatement, "if_expression");
        stmt(KotlinProfile::whileStatement, "while_statement");
        stmt(KotlinProfile::forStatement, "for_statement");
        stmt(KotlinProfile::doWhileStatement, "do_while_statement");
        stmt(KotlinProfile::jump, "jump_expression");
        stmt((ctx, n) -> ctx.lowerChildren(n), "source_file", "statements", "control_structure_body");
        stmt(KotlinProfile::objectDeclaration, "object_declaration");
        stmt(KotlinProfile::companionObject, "companion_object");
        stmt(KotlinProfile::tryStatement, "try_expression");
        stmt(KotlinProfile::secondaryConstructor, "secondary_constructor");
        stmt((ctx, n) -> ctx.lowerChildren(n), "anonymous_initializer");
        ignore("import_list", "import_header", "package_header", "type_alias", "modifiers", "annotation",
                "getter", "setter", "file_annotation");
    }

    /**
     * Splits {@code a.b} into {@code a} and the name in its navigation suffix.
     */
    @Override
    public @Nullable Pair<SyntaxNode, SyntaxNode> attributeParts(SyntaxNode node) {
        SyntaxNode suffix = Nodes.firstChildOfType(node, "navigation_suffix");
        SyntaxNode receiver = Nodes.firstNamedChild(node);
        if (suffix == null || receiver == null || receiver == suffix) return null;
        SyntaxNode name = Nodes.firstChildOfType(suffix, "simple_identifier");
        return name != null ? Pair.of(receiver, name) : null;
    }

    /**
     * Splits {@code a[i]} into {@code a} and the first index in its indexing suffix.
     */
    @Override
    public @Nullable Pair<SyntaxNode, SyntaxNode> subscriptParts(SyntaxNode node) {
        SyntaxNode suffix = Nodes.firstChildOfType(node, "indexing_suffix");
        SyntaxNode receiver = Nodes.firstNamedChild(node);
        if (suffix == null || receiver == null || receiver == suffix) return null;
        SyntaxNode index = Nodes.firstNamedChild(suffix);
        return index != null ? Pair.of(receiver, index) : null;
    }

    @Override
    public void lowerParams(LoweringContext ctx, SyntaxNode params) {
        for (SyntaxNode param : Nodes.childrenOfType(params, "parameter", "class_parameter", "variable_declaration")) {
            SyntaxNode name = Nodes.firstChildOfType(param, "simple_identifier");
            if (name != null) {
                Definitions.emitParam(ctx, ctx.text(name), ctx.loc(param));
            }
        }
    }

    /**
     * Lower the statements of a body, returning the value of the last one.
     *
     * @param ctx  The context.
     * @param node The body, or null.
     * @return The value register.
     */
    static Reg bodyValue(LoweringContext ctx, @Nullable SyntaxNode node) {
        if (node == null) return ctx.constant(ctx.profile.literals.none());
        if (!BODY_TYPES.contains(node.getType())) {
            if (ctx.profile.expressionHandler(node.getType()) != null) return ctx.lowerExpr(node);
            ctx.lowerStmt(node);
            return ctx.constant(ctx.profile.literals.none());
        }
        List<SyntaxNode> children = Expressions.elements(ctx, node);
        if (children.isEmpty()) return ctx.constant(ctx.profile.literals.none());
        ctx.lowerStatements(children.subList(0, children.size() - 1));
        return bodyValue(ctx, children.get(children.size() - 1));
    }

    static Reg statementsValue(LoweringContext ctx, SyntaxNode node) {
        return bodyValue(ctx, node);
    }

    /**
     * Lower a construct used as an expression for its effect, producing the none literal.
     */
    static Reg asUnit(LoweringContext ctx, SyntaxNode node) {
        ctx.lowerStmt(node);
        return ctx.constant(ctx.profile.literals.none());
    }

    static Reg string(LoweringContext ctx, SyntaxNode node) {
        return Expressions.interpolated(ctx, node, Arrays.asList("string_content"),
                Arrays.asList("interpolated_identifier", "interpolated_expression"));
    }

    static Reg prefix(LoweringContext ctx, SyntaxNode node) {
        String text = ctx.text(node);
        if (text.startsWith("++") || text.startsWith("--")) {
            return Expressions.updateExpr(ctx, node);
        }
        return Expressions.unop(ctx, node);
    }

    /**
     * Lower {@code x++}, {@code x--} as updates and {@code x!!} as {@code UNOP "!!"}.
     */
    static Reg postfix(LoweringContext ctx, SyntaxNode node) {
        String text = ctx.text(node);
        if (text.endsWith("++") || text.endsWith("--")) {
            return Expressions.updateExpr(ctx, node);
        }
        SyntaxNode operand = Nodes.firstNamedChild(node);
        if (text.endsWith("!!") && operand != null) {
            Reg value = ctx.lowerExpr(operand);
            return ctx.produce(Opcode.UNOP, ctx.loc(node), "!!", value);
        }
        return Expressions.constLiteral(ctx, node);
    }

    /**
     * Lower a call. Its arguments sit in a call suffix, followed by an optional trailing lambda.
     */
    static Reg call(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode callee = Nodes.firstNamedChild(node);
        SyntaxNode suffix = Nodes.firstChildOfType(node, "call_suffix");
        List<Reg> args = new ArrayList<>();
        if (suffix != null) {
            args.addAll(Expressions.callArgs(ctx, Nodes.firstChildOfType(suffix, "value_arguments")));
            SyntaxNode trailing = Nodes.firstChildOfType(suffix, "annotated_lambda", "lambda_literal");
            if (trailing != null) args.add(ctx.lowerExpr(trailing));
        }
        if (callee == null || callee == suffix) {
            return Expressions.constLiteral(ctx, node);
        }
        Pair<SyntaxNode, SyntaxNode> parts = callee.getType().equals("navigation_expression")
                ? ctx.profile.attributeParts(callee)
                : null;
        if (parts != null) {
            Reg receiver = ctx.lowerExpr(parts.left);
            return Expressions.callMethod(ctx, node, receiver, ctx.text(parts.right), args);
        }
        if (callee.getType().equals("simple_identifier")) {
            return Expressions.callFunction(ctx, node, ctx.text(callee), args);
        }
        Reg target = ctx.lowerExpr(callee);
        return ctx.produce(Opcode.CALL_UNKNOWN, ctx.loc(node), Collections.singletonList(target), args);
    }

    static Reg ifExpression(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        Reg cond = ctx.lowerExpr(named.isEmpty() ? null : named.get(0));
        SyntaxNode consequence = named.size() > 1 ? named.get(1) : null;
        SyntaxNode alternative = named.size() > 2 ? named.get(2) : null;
        return ControlFlow.ifValue(ctx, node, cond,
                () -> bodyValue(ctx, consequence),
                alternative == null ? null : () -> bodyValue(ctx, alternative));
    }

    static void ifStatement(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        Reg cond = ctx.lowerExpr(named.isEmpty() ? null : named.get(0));
        SyntaxNode consequence = named.size() > 1 ? named.get(1) : null;
        SyntaxNode alternative = named.size() > 2 ? named.get(2) : null;
        ControlFlow.ifElse(ctx, node, cond,
                () -> ctx.lowerBlock(consequence),
                alternative == null ? null : () -> ctx.lowerBlock(alternative));
    }

    /**
     * Lower a {@code when} as a chain of tests. With a subject each condition is compared to it,
     * without one each condition is tested directly. The {@code else} entry is the default.
     */
    static Reg when(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode subjectNode = Nodes.firstChildOfType(node, "when_subject");
        Reg subject = null;
        if (subjectNode != null) {
            SyntaxNode inner = subjectNode.getChildByFieldName("value");
            if (inner == null) {
                List<SyntaxNode> named = subjectNode.getNamedChildren();
                inner = named.isEmpty() ? null : named.get(named.size() - 1);
            }
            subject = ctx.lowerExpr(inner);
        }
        List<List<SyntaxNode>> values = new ArrayList<>();
        List<Supplier<Reg>> results = new ArrayList<>();
        for (SyntaxNode entry : Nodes.childrenOfType(node, "when_entry")) {
            List<SyntaxNode> conditions = new ArrayList<>();
            for (SyntaxNode condition : Nodes.childrenOfType(entry, "when_condition")) {
                SyntaxNode inner = Nodes.firstNamedChild(condition);
                conditions.add(inner != null ? inner : condition);
            }
            SyntaxNode body = Nodes.firstChildOfType(entry, "control_structure_body");
            values.add(conditions);
            results.add(() -> bodyValue(ctx, body));
        }
        return ControlFlow.switchValue(ctx, node, subject, values, results, "==");
    }

    /**
     * Lower a lambda. Its value is the value of its last statement.
     */
    static Reg lambda(LoweringContext ctx, SyntaxNode node) {
        if (node.getType().equals("annotated_lambda")) {
            SyntaxNode inner = Nodes.firstChildOfType(node, "lambda_literal");
            return inner != null ? lambda(ctx, inner) : Expressions.constLiteral(ctx, node);
        }
        SyntaxNode params = Nodes.firstChildOfType(node, "lambda_parameters");
        SyntaxNode body = Nodes.firstChildOfType(node, "statements");
        return Definitions.lambda(ctx, node,
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> body != null ? bodyValue(ctx, body) : null);
    }

    /**
     * Lower {@code object : T { ... }} as a class body followed by a new object of the supertype.
     */
    static Reg objectLiteral(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode delegation = Nodes.firstChildOfType(node, "delegation_specifier");
        SyntaxNode body = Nodes.firstChildOfType(node, "class_body");
        String type = delegation != null ? ctx.text(delegation) : "__anon_object";
        Definitions.classBody(ctx, node, type, () -> ctx.lowerBlock(body));
        return ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), type);
    }

    static Reg range(LoweringContext ctx, SyntaxNode node) {
        List<Reg> bounds = Statements.lowerAll(ctx, node.getNamedChildren());
        return Expressions.callFunction(ctx, node, "range", bounds);
    }

    /**
     * Lower {@code x is T} or {@code x as T} as a call of the operator with the value and the
     * type name.
     */
    static Reg typeCall(LoweringContext ctx, SyntaxNode node, String operator) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() < 2) return Expressions.constLiteral(ctx, node);
        Reg value = ctx.lowerExpr(named.get(0));
        String type = ctx.text(named.get(named.size() - 1));
        return ctx.produce(Opcode.CALL_FUNCTION, ctx.loc(node), operator, value, type);
    }

    static Reg elvis(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() < 2) return Expressions.constLiteral(ctx, node);
        return Expressions.binop(ctx, node, "?:", named.get(0), named.get(named.size() - 1));
    }

    /**
     * Lower {@code a to b} as a call of the infix function {@code to}.
     */
    static Reg infix(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() < 3) return Expressions.constLiteral(ctx, node);
        Reg left = ctx.lowerExpr(named.get(0));
        Reg right = ctx.lowerExpr(named.get(2));
        return Expressions.callFunction(ctx, node, ctx.text(named.get(1)), Arrays.asList(left, right));
    }

    private static @Nullable SyntaxNode valueAfterEquals(LoweringContext ctx, SyntaxNode node) {
        boolean seen = false;
        for (SyntaxNode child : node.getChildren()) {
            if (seen && child.isNamed()) return child;
            if (!child.isNamed() && ctx.text(child).equals("=")) seen = true;
        }
        return null;
    }

    private static String declaredName(LoweringContext ctx, @Nullable SyntaxNode decl) {
        if (decl == null) return "__unknown";
        if (decl.getType().equals("simple_identifier")) return ctx.text(decl);
        SyntaxNode id = Nodes.firstChildOfType(decl, "simple_identifier");
        return id != null ? ctx.text(id) : "__unknown";
    }

    /**
     * Lower {@code val x = v}, or {@code val (a, b) = v} as an indexed load per name.
     */
    static void propertyDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode value = valueAfterEquals(ctx, node);
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
        SyntaxNode multi = Nodes.firstChildOfType(node, "multi_variable_declaration");
        if (multi != null) {
            destructure(ctx, multi, reg, node);
            return;
        }
        SyntaxNode decl = Nodes.firstChildOfType(node, "variable_declaration");
        ctx.storeVar(declaredName(ctx, decl), reg, ctx.loc(node));
    }

    private static void destructure(LoweringContext ctx, SyntaxNode multi, Reg value, SyntaxNode parent) {
        int i = 0;
        for (SyntaxNode decl : Nodes.childrenOfType(multi, "variable_declaration")) {
            Reg idx = ctx.constant(String.valueOf(i++));
            Reg elem = ctx.produce(Opcode.LOAD_INDEX, ctx.loc(decl), value, idx);
            ctx.storeVar(declaredName(ctx, decl), elem, ctx.loc(parent));
        }
    }

    /**
     * Lower {@code target = value} and {@code target op= value}.
     */
    static void assignment(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() < 2) {
            ctx.malformed(node, "expected a target and a value");
            return;
        }
        SyntaxNode target = named.get(0);
        SyntaxNode value = named.get(named.size() - 1);
        String op = "=";
        for (SyntaxNode child : node.getChildren()) {
            if (!child.isNamed() && ctx.text(child).endsWith("=")) {
                op = ctx.text(child);
                break;
            }
        }
        Reg reg;
        if (op.equals("=")) {
            reg = ctx.lowerExpr(value);
        } else {
            Reg current = ctx.lowerExpr(target);
            Reg rhs = ctx.lowerExpr(value);
            reg = ctx.produce(Opcode.BINOP, ctx.loc(node), Statements.stripAssign(op), current, rhs);
        }
        store(ctx, target, reg, node);
    }

    private static void store(LoweringContext ctx, SyntaxNode target, Reg value, SyntaxNode parent) {
        if (target.getType().equals("directly_assignable_expression")
                && ctx.profile.attributeParts(target) == null
                && ctx.profile.subscriptParts(target) == null) {
            SyntaxNode inner = Nodes.firstNamedChild(target);
            if (inner != null) {
                store(ctx, inner, value, parent);
                return;
            }
        }
        Statements.storeTarget(ctx, target, value, parent);
    }

    /**
     * Lower a function. A body given as {@code = expression} returns the expression.
     */
    static void functionDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = Nodes.firstChildOfType(node, "simple_identifier");
        SyntaxNode params = Nodes.firstChildOfType(node, "function_value_parameters");
        SyntaxNode body = Nodes.firstChildOfType(node, "function_body");
        Definitions.function(ctx, node, name != null ? ctx.text(name) : "__anon",
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> functionBody(ctx, body));
    }

    private static void functionBody(LoweringContext ctx, @Nullable SyntaxNode body) {
        if (body == null) return;
        SyntaxNode statements = Nodes.firstChildOfType(body, "statements");
        if (statements != null) {
            ctx.lowerBlock(statements);
        } else if (valueAfterEquals(ctx, body) != null) {
            SyntaxNode value = valueAfterEquals(ctx, body);
            ctx.ret(ctx.lowerExpr(value), ctx.loc(value));
        }
    }

    static void secondaryConstructor(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode params = Nodes.firstChildOfType(node, "function_value_parameters");
        SyntaxNode statements = Nodes.firstChildOfType(node, "statements");
        Definitions.function(ctx, node, "__init__",
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> ctx.lowerBlock(statements));
    }

    /**
     * Lower a class or interface. Entries of an enum class become {@code enum:<Name>} objects stored
     * to their names.
     */
    static void classDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = Nodes.firstChildOfType(node, "type_identifier");
        SyntaxNode body = Nodes.firstChildOfType(node, "class_body", "enum_class_body");
        Definitions.classBody(ctx, node, name != null ? ctx.text(name) : "__anon_class", () -> {
            if (body == null) return;
            for (SyntaxNode member : Expressions.elements(ctx, body)) {
                if (member.getType().equals("enum_entry")) {
                    enumEntry(ctx, member);
                } else {
                    ctx.lowerStmt(member);
                }
            }
        });
    }

    private static void enumEntry(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = Nodes.firstChildOfType(node, "simple_identifier");
        String entry = name != null ? ctx.text(name) : "__unknown_enum";
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "enum:" + entry);
        ctx.storeVar(entry, obj, ctx.loc(node));
    }

    /**
     * Lower a singleton object as a class and its one instance, stored to its name.
     */
    static void objectDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = Nodes.firstChildOfType(node, "type_identifier");
        SyntaxNode body = Nodes.firstChildOfType(node, "class_body");
        String objName = name != null ? ctx.text(name) : "__anon_object";
        Definitions.classBody(ctx, node, objName, () -> ctx.lowerBlock(body));
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), objName);
        ctx.storeVar(objName, obj, ctx.loc(node));
    }

    static void companionObject(LoweringContext ctx, SyntaxNode node) {
        ctx.lowerBlock(Nodes.firstChildOfType(node, "class_body"));
    }

    static void whileStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode cond = Nodes.firstNamedChild(node);
        SyntaxNode body = Nodes.firstChildOfType(node, "control_structure_body");
        ControlFlow.whileLoop(ctx, node, cond == body ? null : cond, () -> ctx.lowerBlock(body), false);
    }

    static void doWhileStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = Nodes.firstChildOfType(node, "control_structure_body");
        SyntaxNode cond = null;
        for (SyntaxNode child : node.getNamedChildren()) {
            if (child != body && !ctx.profile.isSkipped(child.getType())) cond = child;
        }
        ControlFlow.doWhile(ctx, node, () -> ctx.lowerBlock(body), cond, false);
    }

    /**
     * Lower {@code for (x in a..b)}, {@code until} and {@code downTo} ranges as counting loops, and
     * any other {@code for} as an iteration over the collection.
     */
    static void forStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode var = Nodes.firstChildOfType(node, "variable_declaration", "multi_variable_declaration",
                "simple_identifier");
        SyntaxNode body = Nodes.firstChildOfType(node, "control_structure_body");
        SyntaxNode iterable = null;
        boolean seenIn = false;
        for (SyntaxNode child : node.getChildren()) {
            if (seenIn && child.isNamed() && child != body) {
                iterable = child;
                break;
            }
            if (!child.isNamed() && ctx.text(child).equals("in")) seenIn = true;
        }
        if (var != null && !var.getType().equals("multi_variable_declaration") && iterable != null
                && countingLoop(ctx, node, declaredName(ctx, var), iterable, null, body)) {
            return;
        }
        Reg collection = ctx.lowerExpr(iterable);
        ControlFlow.forEach(ctx, node, "for", collection,
                (idx, elem) -> {
                    if (var == null) {
                        ctx.malformed(node, "loop without a variable");
                    } else if (var.getType().equals("multi_variable_declaration")) {
                        destructure(ctx, var, elem, node);
                    } else {
                        ctx.storeVar(declaredName(ctx, var), elem, ctx.loc(var));
                    }
                },
                () -> ctx.lowerBlock(body));
    }

    private static boolean countingLoop(LoweringContext ctx, SyntaxNode node, String variable, SyntaxNode iterable,
                                        @Nullable SyntaxNode step, @Nullable SyntaxNode body) {
        List<SyntaxNode> named = iterable.getNamedChildren();
        String comparison;
        boolean descending = false;
        if (iterable.getType().equals("range_expression") && named.size() == 2) {
            comparison = "<=";
        } else if (iterable.getType().equals("infix_expression") && named.size() == 3) {
            switch (ctx.text(named.get(1))) {
                case "until":
                    comparison = "<";
                    break;
                case "downTo":
                    comparison = ">=";
                    descending = true;
                    break;
                case "step":
                    return step == null && countingLoop(ctx, node, variable, named.get(0), named.get(2), body);
                default:
                    return false;
            }
            named = Arrays.asList(named.get(0), named.get(2));
        } else {
            return false;
        }
        Reg start = ctx.lowerExpr(named.get(0));
        Reg bound = ctx.lowerExpr(named.get(1));
        Reg stepReg = step != null ? ctx.lowerExpr(step) : ctx.constant("1");
        if (descending) {
            stepReg = ctx.produce(Opcode.UNOP, SourceLocation.UNKNOWN, "-", stepReg);
        }
        ControlFlow.rangeFor(ctx, node, variable, start, bound, stepReg, comparison, () -> ctx.lowerBlock(body));
        return true;
    }

    /**
     * Lower {@code return}, {@code throw}, {@code break} and {@code continue}, which share one
     * node kind.
     */
    static void jump(LoweringContext ctx, SyntaxNode node) {
        String text = ctx.text(node);
        SyntaxNode value = Nodes.firstNamedChild(node);
        if (text.startsWith("return")) {
            Statements.ret(ctx, node, value);
        } else if (text.startsWith("throw")) {
            Statements.throwStmt(ctx, node);
        } else if (text.startsWith("break")) {
            ControlFlow.breakStmt(ctx, node);
        } else if (text.startsWith("continue")) {
            ControlFlow.continueStmt(ctx, node);
        } else {
            ctx.malformed(node, "unrecognised jump");
        }
    }

    static void tryStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = Nodes.firstChildOfType(node, "statements", "control_structure_body");
        List<ControlFlow.CatchClause> catches = new ArrayList<>();
        Runnable finallyBody = null;
        for (SyntaxNode child : node.getNamedChildren()) {
            if (child.getType().equals("catch_block")) {
                SyntaxNode variable = Nodes.firstChildOfType(child, "simple_identifier");
                SyntaxNode type = Nodes.firstChildOfType(child, "user_type", "nullable_type");
                SyntaxNode catchBody = Nodes.firstChildOfType(child, "statements");
                catches.add(new ControlFlow.CatchClause(
                        variable != null ? ctx.text(variable) : null,
                        type != null ? ctx.text(type) : null,
                        () -> ctx.lowerBlock(catchBody)));
            } else if (child.getType().equals("finally_block")) {
                SyntaxNode finallyNode = Nodes.firstChildOfType(child, "statements");
                finallyBody = () -> ctx.lowerBlock(finallyNode);
            }
        }
        ControlFlow.tryCatch(ctx, node, () -> ctx.lowerBlock(body), catches, finallyBody, null);
    }
}
