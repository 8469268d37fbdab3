package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.IRInstruction;
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
import java.util.function.Supplier;

/**
 * The profile of PHP.
 * <p>
 * Variables keep their sigil, so {@code $x = 1} stores to {@code "$x"}. Class properties and
 * enum cases are stored as fields of {@code $this}.
 */
public class PhpProfile extends LanguageProfile {
    private static final String THIS = "$this";

    public PhpProfile() {
        super("php");
        literals.setNone("null");
        literals.setTrueValue("true");
        literals.setFalseValue("false");
        literals.setDefaultReturn("null");
        fields.setIfConsequence("body");
        fields.setAttrAttribute("name");
        noiseTypes.addAll(Arrays.asList("php_tag", "text_interpolation", "php_end_tag"));
        blockTypes.addAll(Arrays.asList("program", "compound_statement", "declaration_list", "enum_declaration_list",
                "colon_block"));
        identifierTypes.addAll(Arrays.asList("variable_name", "name", "qualified_name"));
        attributeTypes.add("nullsafe_member_access_expression");
        subscriptTypes.add("subscript_expression");

        expr(Expressions::identifier, "variable_name", "name", "qualified_name");
        expr(Expressions::constLiteral, "integer", "float", "string", "encapsed_string", "heredoc", "nowdoc");
        expr(PhpProfile::bool, "boolean");
        expr(Expressions::canonicalNone, "null");
        expr(Expressions::binop, "binary_expression");
        expr(Expressions::unop, "unary_op_expression");
        expr(Expressions::updateExpr, "update_expression");
        expr(PhpProfile::functionCall, "function_call_expression");
        expr(PhpProfile::memberCall, "member_call_expression", "nullsafe_member_call_expression");
        expr(Expressions::attribute, "member_access_expression", "nullsafe_member_access_expression");
        expr(Expressions::subscript, "subscript_expression");
        expr(Expressions::paren, "parenthesized_expression");
        expr(PhpProfile::arrayCreation, "array_creation_expression");
        expr(Statements::anyAssignmentExpr, "assignment_expression", "augmented_assignment_expression",
                "reference_assignment_expression");
        expr(PhpProfile::cast, "cast_expression");
        expr(PhpProfile::conditional, "conditional_expression");
        expr(PhpProfile::throwExpr, "throw_expression");
        expr(PhpProfile::objectCreation, "object_creation_expression");
        expr(PhpProfile::match, "match_expression");
        expr(PhpProfile::arrowFunction, "arrow_function");
        expr(PhpProfile::anonymousFunction, "anonymous_function", "anonymous_function_creation_expression");
        expr(PhpProfile::scopedCall, "scoped_call_expression");
        expr(PhpProfile::scopedAccess, "class_constant_access_expression", "scoped_property_access_expression");
        expr(PhpProfile::yield, "yield_expression");
        expr(PhpProfile::sequence, "sequence_expression");
        expr(Expressions::unwrap, "by_ref", "argument");

        stmt(Statements::expressionStatement, "expression_statement");
        stmt(Statements::ret, "return_statement");
        stmt(PhpProfile::echo, "echo_statement");
        stmt(ControlFlow::ifStmt, "if_statement");
        stmt(ControlFlow::whileStmt, "while_statement");
        stmt(ControlFlow::doStmt, "do_statement");
        stmt(PhpProfile::forStatement, "for_statement");
        stmt(PhpProfile::foreach, "foreach_statement");
        stmt(Definitions::functionDef, "function_definition", "method_declaration");
        stmt(Definitions::classDef, "class_declaration", "interface_declaration", "trait_declaration",
                "enum_declaration");
        stmt((ctx, n) -> ctx.lowerChildren(n), "compound_statement", "colon_block");
        stmt(ControlFlow::breakStmt, "break_statement");
        stmt(ControlFlow::continueStmt, "continue_statement");
        stmt(PhpProfile::tryStatement, "try_statement");
        stmt(PhpProfile::switchStatement, "switch_statement");
        stmt(PhpProfile::namespace, "namespace_definition");
        stmt(PhpProfile::staticDeclaration, "function_static_declaration");
        stmt(PhpProfile::propertyDeclaration, "property_declaration");
        stmt(PhpProfile::enumCase, "enum_case");
        stmt(PhpProfile::useTrait, "use_declaration");
        stmt(PhpProfile::namedLabel, "named_label_statement");
        stmt(PhpProfile::gotoStatement, "goto_statement");
        ignore("namespace_use_declaration", "visibility_modifier", "static_modifier", "abstract_modifier",
                "final_modifier", "readonly_modifier", "empty_statement", "attribute_list");
    }

    static Reg bool(LoweringContext ctx, SyntaxNode node) {
        return ctx.text(node).equalsIgnoreCase("true")
                ? Expressions.canonicalTrue(ctx, node)
                : Expressions.canonicalFalse(ctx, node);
    }

    /**
     * Lower {@code f(args)}. Only a bare or qualified name is a known function; calling through a
     * variable or any other expression is an unknown call.
     */
    static Reg functionCall(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode function = node.getChildByFieldName("function");
        SyntaxNode args = node.getChildByFieldName("arguments");
        if (function != null && (function.getType().equals("name") || function.getType().equals("qualified_name"))) {
            return Expressions.callFunction(ctx, node, ctx.text(function), Expressions.callArgs(ctx, args));
        }
        Reg target = function != null
                ? ctx.lowerExpr(function)
                : ctx.symbolic("unknown_call_target", ctx.loc(node));
        return ctx.produce(Opcode.CALL_UNKNOWN, ctx.loc(node), Collections.singletonList(target),
                Expressions.callArgs(ctx, args));
    }

    static Reg memberCall(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode object = node.getChildByFieldName("object");
        SyntaxNode name = node.getChildByFieldName("name");
        Reg receiver = ctx.lowerExpr(object);
        List<Reg> args = Expressions.callArgs(ctx, node.getChildByFieldName("arguments"));
        return Expressions.callMethod(ctx, node, receiver, name != null ? ctx.text(name) : "unknown", args);
    }

    /**
     * Lower {@code Scope::method(args)} as a call of the qualified name.
     */
    static Reg scopedCall(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode scope = node.getChildByFieldName("scope");
        SyntaxNode name = node.getChildByFieldName("name");
        String qualified = (scope != null ? ctx.text(scope) : "Unknown") + "::"
                + (name != null ? ctx.text(name) : "unknown");
        return Expressions.callFunction(ctx, node, qualified,
                Expressions.callArgs(ctx, node.getChildByFieldName("arguments")));
    }

    /**
     * Lower {@code Scope::CONST} and {@code Scope::$prop} as a field load on the scope.
     */
    static Reg scopedAccess(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() < 2) {
            return Expressions.constLiteral(ctx, node);
        }
        Reg scope = ctx.lowerExpr(named.get(0));
        return ctx.produce(Opcode.LOAD_FIELD, ctx.loc(node), scope, ctx.text(named.get(1)));
    }

    /**
     * Lower {@code array(...)} and {@code [...]}. An array with any {@code key => value} element is
     * an object keyed by index stores; otherwise it is a plain array.
     */
    static Reg arrayCreation(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> elems = Nodes.childrenOfType(node, "array_element_initializer");
        boolean associative = false;
        for (SyntaxNode elem : elems) {
            if (Nodes.hasChildOfType(elem, "=>")) {
                associative = true;
                break;
            }
        }
        if (!associative) {
            List<SyntaxNode> values = new ArrayList<>();
            for (SyntaxNode elem : elems) {
                SyntaxNode value = Nodes.firstNamedChild(elem);
                values.add(value != null ? value : elem);
            }
            return Expressions.array(ctx, node, "array", values);
        }
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "array");
        int next = 0;
        for (SyntaxNode elem : elems) {
            List<SyntaxNode> named = elem.getNamedChildren();
            if (named.isEmpty()) continue;
            Reg key;
            Reg value;
            if (named.size() >= 2) {
                key = ctx.lowerExpr(named.get(0));
                value = ctx.lowerExpr(named.get(1));
            } else {
                key = ctx.constant(String.valueOf(next++));
                value = ctx.lowerExpr(named.get(0));
            }
            ctx.consume(Opcode.STORE_INDEX, ctx.loc(elem), obj, key, value);
        }
        return obj;
    }

    static Reg cast(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.isEmpty()) {
            return Expressions.constLiteral(ctx, node);
        }
        return ctx.lowerExpr(named.get(named.size() - 1));
    }

    static Reg conditional(LoweringContext ctx, SyntaxNode node) {
        return Expressions.ternary(ctx, node,
                node.getChildByFieldName("condition"),
                node.getChildByFieldName("body"),
                node.getChildByFieldName("alternative"));
    }

    static Reg throwExpr(LoweringContext ctx, SyntaxNode node) {
        Statements.throwStmt(ctx, node);
        return ctx.constant(ctx.profile.literals.none());
    }

    static Reg objectCreation(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode type = Nodes.fieldOrType(node, "name", "name", "qualified_name");
        SyntaxNode args = Nodes.firstChildOfType(node, "arguments");
        return Expressions.construct(ctx, node, type != null ? ctx.text(type) : "Object", args);
    }

    /**
     * Lower {@code match (x) { a, b => r, default => d }}, comparing with {@code ===}.
     */
    static Reg match(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(node.getChildByFieldName("condition"));
        SyntaxNode body = node.getChildByFieldName("body");
        List<List<SyntaxNode>> values = new ArrayList<>();
        List<Supplier<Reg>> results = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode arm : Nodes.childrenOfType(body, "match_conditional_expression", "match_default_expression")) {
                SyntaxNode conditions = arm.getChildByFieldName("conditional_expressions");
                SyntaxNode result = arm.getChildByFieldName("return_expression");
                values.add(conditions != null ? Expressions.elements(ctx, conditions) : Collections.emptyList());
                results.add(() -> ctx.lowerExpr(result));
            }
        }
        return ControlFlow.switchValue(ctx, node, subject, values, results, "===", false);
    }

    static Reg arrowFunction(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode params = node.getChildByFieldName("parameters");
        SyntaxNode body = node.getChildByFieldName("body");
        return Definitions.lambda(ctx, node,
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> ctx.lowerExpr(body));
    }

    static Reg anonymousFunction(LoweringContext ctx, SyntaxNode node) {
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

    static Reg yield(LoweringContext ctx, SyntaxNode node) {
        return Expressions.callFunction(ctx, node, "yield", Statements.lowerAll(ctx, Expressions.elements(ctx, node)));
    }

    static Reg sequence(LoweringContext ctx, SyntaxNode node) {
        List<Reg> regs = Statements.lowerAll(ctx, Expressions.elements(ctx, node));
        return regs.isEmpty() ? Expressions.constLiteral(ctx, node) : regs.get(regs.size() - 1);
    }

    static void echo(LoweringContext ctx, SyntaxNode node) {
        List<Reg> args = new ArrayList<>();
        for (SyntaxNode child : Expressions.elements(ctx, node)) {
            if (child.getType().equals("sequence_expression")) {
                args.addAll(Statements.lowerAll(ctx, Expressions.elements(ctx, child)));
            } else {
                args.add(ctx.lowerExpr(child));
            }
        }
        Expressions.callFunction(ctx, node, "echo", args);
    }

    /**
     * Lower {@code for (init; cond; update)}, where each part may be a comma separated sequence.
     */
    static void forStatement(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode init : node.getChildrenByFieldName("initialize")) {
            ctx.lowerExpr(init);
        }
        List<SyntaxNode> conditions = node.getChildrenByFieldName("condition");
        List<SyntaxNode> updates = new ArrayList<>(node.getChildrenByFieldName("update"));
        updates.addAll(node.getChildrenByFieldName("increment"));
        SyntaxNode condition = conditions.isEmpty() ? null : conditions.get(conditions.size() - 1);
        for (int i = 0; i < conditions.size() - 1; i++) {
            ctx.lowerExpr(conditions.get(i));
        }
        SyntaxNode body = node.getChildByFieldName("body");
        ControlFlow.cStyleFor(ctx, node, null, condition,
                updates.isEmpty() ? null : () -> {
                    for (SyntaxNode update : updates) ctx.lowerExpr(update);
                },
                () -> ctx.lowerBlock(body));
    }

    /**
     * Lower {@code foreach ($xs as $v)} and {@code foreach ($xs as $k => $v)}, binding the index
     * to the key.
     */
    static void foreach(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        List<SyntaxNode> named = new ArrayList<>();
        for (SyntaxNode child : Expressions.elements(ctx, node)) {
            if (child != body) named.add(child);
        }
        if (named.isEmpty()) {
            ctx.malformed(node, "foreach without a collection");
            return;
        }
        Reg collection = ctx.lowerExpr(named.get(0));
        SyntaxNode binding = named.size() > 1 ? named.get(1) : null;
        ControlFlow.forEach(ctx, node, "foreach", collection,
                (idx, elem) -> {
                    if (binding == null) return;
                    if (binding.getType().equals("pair")) {
                        List<SyntaxNode> parts = binding.getNamedChildren();
                        if (parts.size() >= 1) Statements.storeTarget(ctx, unref(parts.get(0)), idx, node);
                        if (parts.size() >= 2) Statements.storeTarget(ctx, unref(parts.get(1)), elem, node);
                    } else {
                        Statements.storeTarget(ctx, unref(binding), elem, node);
                    }
                },
                () -> ctx.lowerBlock(body));
    }

    private static SyntaxNode unref(SyntaxNode node) {
        if (node.getType().equals("by_ref")) {
            SyntaxNode inner = Nodes.firstNamedChild(node);
            if (inner != null) return inner;
        }
        return node;
    }

    static void tryStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.CatchClause> catches = new ArrayList<>();
        for (SyntaxNode clause : Nodes.childrenOfType(node, "catch_clause")) {
            SyntaxNode type = Nodes.fieldOrType(clause, "type", "type_list", "named_type", "name", "qualified_name");
            SyntaxNode variable = Nodes.fieldOrType(clause, "name", "variable_name");
            SyntaxNode clauseBody = Nodes.fieldOrType(clause, "body", "compound_statement");
            catches.add(new ControlFlow.CatchClause(
                    variable != null ? ctx.text(variable) : null,
                    type != null ? ctx.text(type) : null,
                    () -> ctx.lowerBlock(clauseBody)));
        }
        SyntaxNode finallyClause = Nodes.firstChildOfType(node, "finally_clause");
        SyntaxNode finallyBody = finallyClause == null
                ? null
                : Nodes.fieldOrType(finallyClause, "body", "compound_statement");
        ControlFlow.tryCatch(ctx, node, () -> ctx.lowerBlock(body), catches,
                finallyClause == null ? null : () -> ctx.lowerBlock(finallyBody), null);
    }

    static void switchStatement(LoweringContext ctx, SyntaxNode node) {
        Reg subject = ctx.lowerExpr(node.getChildByFieldName("condition"));
        SyntaxNode body = node.getChildByFieldName("body");
        List<ControlFlow.Case> cases = new ArrayList<>();
        if (body != null) {
            for (SyntaxNode arm : Nodes.childrenOfType(body, "case_statement", "default_statement")) {
                SyntaxNode value = arm.getChildByFieldName("value");
                List<SyntaxNode> stmts = new ArrayList<>();
                for (SyntaxNode child : arm.getNamedChildren()) {
                    if (child != value) stmts.add(child);
                }
                Runnable lowerBody = () -> ctx.lowerStatements(stmts);
                cases.add(value == null
                        ? ControlFlow.Case.otherwise(lowerBody)
                        : new ControlFlow.Case(Collections.singletonList(value), lowerBody));
            }
        }
        ControlFlow.switchChain(ctx, node, subject, cases, "==");
    }

    static void namespace(LoweringContext ctx, SyntaxNode node) {
        ctx.lowerBlock(Nodes.fieldOrType(node, "body", "compound_statement"));
    }

    /**
     * Lower {@code static $x = v;}. A static without a value is bound to null.
     */
    static void staticDeclaration(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode decl : Nodes.childrenOfType(node, "static_variable_declaration")) {
            Statements.declarator(ctx, node, decl, "name", "value");
        }
    }

    static void propertyDeclaration(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode element : Nodes.childrenOfType(node, "property_element")) {
            SyntaxNode name = Nodes.firstChildOfType(element, "variable_name");
            if (name == null) {
                ctx.malformed(element, "property without a name");
                continue;
            }
            SyntaxNode value = null;
            for (SyntaxNode child : element.getNamedChildren()) {
                if (child != name) {
                    value = child.getType().equals("property_initializer") ? Nodes.firstNamedChild(child) : child;
                    break;
                }
            }
            Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.profile.literals.none());
            Reg self = ctx.loadVar(THIS, SourceLocation.UNKNOWN);
            ctx.consume(Opcode.STORE_FIELD, ctx.loc(node), self, ctx.text(name), reg);
        }
    }

    /**
     * Lower an enum case. A case without a backing value is its own name.
     */
    static void enumCase(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        if (name == null) {
            ctx.malformed(node, "enum case without a name");
            return;
        }
        SyntaxNode value = node.getChildByFieldName("value");
        Reg reg = value != null ? ctx.lowerExpr(value) : ctx.constant(ctx.text(name));
        Reg self = ctx.loadVar(THIS, SourceLocation.UNKNOWN);
        ctx.consume(Opcode.STORE_FIELD, ctx.loc(node), self, ctx.text(name), reg);
    }

    static void useTrait(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode trait : Expressions.elements(ctx, node)) {
            ctx.symbolic("use_trait:" + ctx.text(trait), ctx.loc(node));
        }
    }

    static void namedLabel(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = userLabel(node, "name");
        if (name == null) {
            ctx.malformed(node, "label without a name");
            return;
        }
        ctx.label("user_" + ctx.text(name));
    }

    static void gotoStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = userLabel(node, "label");
        if (name == null) {
            ctx.malformed(node, "goto without a label");
            return;
        }
        ctx.emit(IRInstruction.branch("user_" + ctx.text(name), ctx.loc(node)));
    }

    private static @Nullable SyntaxNode userLabel(SyntaxNode node, String field) {
        return Nodes.fieldOrType(node, field, "name");
    }
}
