package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.lower.*;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The profile of Lua.
 * <p>
 * Multiple assignment pairs the variable list with the expression list by index, missing values
 * being {@code nil}. Tables are objects of kind {@code table}, with positional entries stored
 * under indices counting from 1.
 */
public class LuaProfile extends LanguageProfile {
    private static final Set<String> ITERATORS = new HashSet<>(Arrays.asList("pairs", "ipairs"));

    public LuaProfile() {
        super("lua");
        literals.setNone("nil");
        literals.setDefaultReturn("nil");
        fields.setCallFunction("name");
        fields.setAttrObject("table");
        fields.setAttrAttribute("field");
        fields.setSubscriptValue("table");
        fields.setSubscriptIndex("field");
        noiseTypes.add("hash_bang_line");
        blockTypes.addAll(Arrays.asList("chunk", "block"));
        attributeTypes.add("dot_index_expression");
        subscriptTypes.add("bracket_index_expression");

        expr(Expressions::identifier, "identifier");
        expr(Expressions::constLiteral, "number", "string", "true", "false", "nil");
        expr((ctx, n) -> ctx.symbolic("varargs", ctx.loc(n)), "vararg_expression");
        expr(Expressions::binop, "binary_expression");
        expr(Expressions::unop, "unary_expression");
        expr(Expressions::paren, "parenthesized_expression");
        expr(Expressions::call, "function_call");
        expr(Expressions::attribute, "dot_index_expression", "method_index_expression");
        expr(Expressions::subscript, "bracket_index_expression");
        expr(LuaProfile::table, "table_constructor");
        expr(LuaProfile::expressionList, "expression_list");
        expr(Definitions::lambda, "function_definition");

        stmt((ctx, n) -> ctx.lowerChildren(n), "chunk", "block");
        stmt(LuaProfile::variableDeclaration, "variable_declaration");
        stmt(LuaProfile::assignment, "assignment_statement");
        stmt(LuaProfile::functionDeclaration, "function_declaration");
        stmt(LuaProfile::ifStatement, "if_statement");
        stmt(ControlFlow::whileStmt, "while_statement");
        stmt(LuaProfile::forStatement, "for_statement");
        stmt(LuaProfile::repeat, "repeat_statement");
        stmt(LuaProfile::ret, "return_statement");
        stmt((ctx, n) -> ctx.lowerBlock(n.getChildByFieldName("body")), "do_statement");
        stmt(Statements::expressionStatement, "expression_statement");
        stmt(ControlFlow::breakStmt, "break_statement");
        stmt(LuaProfile::gotoStatement, "goto_statement");
        stmt(LuaProfile::labelStatement, "label_statement");
        ignore("empty_statement");
    }

    @Override
    public @Nullable Pair<SyntaxNode, SyntaxNode> attributeParts(SyntaxNode node) {
        if (node.getType().equals("method_index_expression")) {
            SyntaxNode table = node.getChildByFieldName("table");
            SyntaxNode method = node.getChildByFieldName("method");
            return table == null || method == null ? null : Pair.of(table, method);
        }
        return super.attributeParts(node);
    }

    @Override
    public void lowerParams(LoweringContext ctx, SyntaxNode params) {
        for (SyntaxNode param : params.getNamedChildren()) {
            if (param.getType().equals("identifier")) {
                Definitions.emitParam(ctx, ctx.text(param), ctx.loc(param));
            } else if (param.getType().equals("vararg_expression")) {
                Definitions.emitParam(ctx, "...", ctx.loc(param));
            }
        }
    }

    /**
     * Lower an expression list in a single value position as its first expression.
     */
    static Reg expressionList(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode first = Nodes.firstNamedChild(node);
        return first != null ? ctx.lowerExpr(first) : ctx.constant(ctx.profile.literals.defaultReturn(), ctx.loc(node));
    }

    /**
     * Lower a table constructor. Keyed entries are stored under their key, {@code name = v} under
     * the name as a constant, and positional entries under successive indices from 1.
     */
    static Reg table(LoweringContext ctx, SyntaxNode node) {
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "table");
        int position = 1;
        for (SyntaxNode field : Nodes.childrenOfType(node, "field")) {
            SyntaxNode name = field.getChildByFieldName("name");
            SyntaxNode value = field.getChildByFieldName("value");
            if (value == null) {
                ctx.malformed(field, "table entry without a value");
                continue;
            }
            Reg key;
            if (name == null) {
                key = ctx.constant(Integer.toString(position++));
            } else if (Nodes.hasChildOfType(field, "[")) {
                key = ctx.lowerExpr(name);
            } else {
                key = ctx.constant(ctx.text(name));
            }
            Reg reg = ctx.lowerExpr(value);
            ctx.consume(Opcode.STORE_INDEX, ctx.loc(field), obj, key, reg);
        }
        return obj;
    }

    /**
     * Lower {@code local x = v}, or {@code local x} which binds {@code nil}.
     */
    static void variableDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode assignment = Nodes.firstChildOfType(node, "assignment_statement");
        if (assignment != null) {
            assignment(ctx, assignment);
            return;
        }
        SyntaxNode names = Nodes.firstChildOfType(node, "variable_list", "attrib_name_list");
        List<SyntaxNode> targets = names != null
                ? Nodes.childrenOfType(names, "identifier")
                : Nodes.childrenOfType(node, "identifier");
        for (SyntaxNode target : targets) {
            ctx.storeVar(ctx.text(target), ctx.constant(ctx.profile.literals.none()), ctx.loc(node));
        }
    }

    /**
     * Lower {@code a, b = x, y}. Every value is lowered before any store.
     */
    static void assignment(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode variables = Nodes.firstChildOfType(node, "variable_list");
        SyntaxNode expressions = Nodes.firstChildOfType(node, "expression_list");
        if (variables == null || expressions == null) {
            List<SyntaxNode> named = node.getNamedChildren();
            if (named.size() < 2) {
                ctx.malformed(node, "assignment without variables or values");
                return;
            }
            variables = named.get(0);
            expressions = named.get(1);
        }
        List<SyntaxNode> targets = listElements(variables, "variable_list");
        List<Reg> values = Statements.lowerAll(ctx, listElements(expressions, "expression_list"));
        for (int i = 0; i < targets.size(); i++) {
            Reg value = i < values.size() ? values.get(i) : ctx.constant(ctx.profile.literals.none());
            Statements.storeTarget(ctx, targets.get(i), value, node);
        }
    }

    private static List<SyntaxNode> listElements(SyntaxNode list, String listType) {
        if (!list.getType().equals(listType)) return Collections.singletonList(list);
        return Nodes.namedChildrenExcept(list, Collections.singleton("comment"));
    }

    /**
     * Lower a function declaration. A function named {@code t.f} or {@code t:m} is stored into
     * the table, the latter with an implicit {@code self} parameter.
     */
    static void functionDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        SyntaxNode params = node.getChildByFieldName("parameters");
        SyntaxNode body = node.getChildByFieldName("body");
        if (name == null) {
            Definitions.function(ctx, node, "__anon", params, body);
            return;
        }
        boolean method = name.getType().equals("method_index_expression");
        Pair<SyntaxNode, SyntaxNode> parts = ctx.profile.isAttribute(name) ? ctx.profile.attributeParts(name) : null;
        String simpleName = parts != null ? ctx.text(parts.right) : ctx.text(name);
        Definitions.function(ctx, node, simpleName,
                () -> {
                    if (method) Definitions.emitParam(ctx, "self", ctx.loc(name));
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> ctx.lowerBlock(body));
        if (parts != null) {
            Reg ref = ctx.loadVar(simpleName, SourceLocation.UNKNOWN);
            Reg table = ctx.lowerExpr(parts.left);
            ctx.consume(Opcode.STORE_FIELD, ctx.loc(node), table, simpleName, ref);
        }
    }

    static void ifStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode condition = node.getChildByFieldName("condition");
        SyntaxNode consequence = node.getChildByFieldName("consequence");
        List<SyntaxNode> clauses = Nodes.childrenOfType(node, "elseif_statement", "else_statement");
        Reg cond = ctx.lowerExpr(condition);
        ControlFlow.ifThen(ctx, node, cond, () -> ctx.lowerBlock(consequence),
                clauses.isEmpty() ? null : end -> elseChain(ctx, clauses, 0));
    }

    private static void elseChain(LoweringContext ctx, List<SyntaxNode> clauses, int i) {
        SyntaxNode clause = clauses.get(i);
        if (clause.getType().equals("else_statement")) {
            SyntaxNode body = clause.getChildByFieldName("body");
            if (body != null) {
                ctx.lowerBlock(body);
            } else {
                ctx.lowerChildren(clause);
            }
            return;
        }
        Reg cond = ctx.lowerExpr(clause.getChildByFieldName("condition"));
        SyntaxNode consequence = clause.getChildByFieldName("consequence");
        ControlFlow.ifThen(ctx, clause, cond, () -> ctx.lowerBlock(consequence),
                i + 1 < clauses.size() ? end -> elseChain(ctx, clauses, i + 1) : null);
    }

    static void forStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode clause = node.getChildByFieldName("clause");
        if (clause == null) clause = Nodes.firstChildOfType(node, "for_numeric_clause", "for_generic_clause");
        SyntaxNode body = node.getChildByFieldName("body");
        if (clause == null) {
            ctx.symbolic("unsupported:for_statement_unknown_clause", ctx.loc(node));
            return;
        }
        if (clause.getType().equals("for_numeric_clause")) {
            numericFor(ctx, node, clause, body);
        } else {
            genericFor(ctx, node, clause, body);
        }
    }

    /**
     * Lower {@code for i = a, b, s}. A step written as a negative number counts down, testing
     * {@code >=} instead of {@code <=}.
     */
    private static void numericFor(LoweringContext ctx, SyntaxNode node, SyntaxNode clause, @Nullable SyntaxNode body) {
        SyntaxNode name = clause.getChildByFieldName("name");
        SyntaxNode start = clause.getChildByFieldName("start");
        SyntaxNode end = clause.getChildByFieldName("end");
        SyntaxNode step = clause.getChildByFieldName("step");
        Reg startReg = ctx.lowerExpr(start);
        Reg endReg = ctx.lowerExpr(end);
        Reg stepReg = step != null ? ctx.lowerExpr(step) : ctx.constant("1");
        boolean descending = step != null && ctx.text(step).trim().startsWith("-");
        ControlFlow.rangeFor(ctx, node, name != null ? ctx.text(name) : "__for_var", startReg, endReg, stepReg,
                descending ? ">=" : "<=", () -> ctx.lowerBlock(body));
    }

    /**
     * Lower {@code for k, v in pairs(t)} as an iteration over {@code t}, binding the key to the
     * index and the value to the element. With any other iterator expression, the single loop
     * variable is bound to each element of the expression's value.
     */
    private static void genericFor(LoweringContext ctx, SyntaxNode node, SyntaxNode clause, @Nullable SyntaxNode body) {
        SyntaxNode variables = Nodes.firstChildOfType(clause, "variable_list");
        SyntaxNode expressions = Nodes.firstChildOfType(clause, "expression_list");
        List<SyntaxNode> names = variables != null
                ? Nodes.childrenOfType(variables, "identifier")
                : Nodes.childrenOfType(clause, "identifier");
        SyntaxNode iterable = expressions != null ? Nodes.firstNamedChild(expressions) : null;
        if (iterable == null) {
            ctx.malformed(clause, "generic for without an iterator");
            return;
        }
        SyntaxNode collection = iterable;
        boolean keyed = false;
        if (iterable.getType().equals("function_call")) {
            SyntaxNode fn = iterable.getChildByFieldName("name");
            SyntaxNode args = iterable.getChildByFieldName("arguments");
            SyntaxNode arg = args != null ? Nodes.firstNamedChild(args) : null;
            if (fn != null && ITERATORS.contains(ctx.text(fn)) && arg != null) {
                collection = arg;
                keyed = true;
            }
        }
        boolean bindKey = keyed;
        ControlFlow.forEach(ctx, node, collection,
                (idx, elem) -> {
                    if (names.isEmpty()) return;
                    if (bindKey) {
                        ctx.storeVar(ctx.text(names.get(0)), idx, ctx.loc(clause));
                        if (names.size() > 1) ctx.storeVar(ctx.text(names.get(1)), elem, ctx.loc(clause));
                    } else {
                        ctx.storeVar(ctx.text(names.get(0)), elem, ctx.loc(clause));
                    }
                },
                () -> ctx.lowerBlock(body));
    }

    static void repeat(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode body = node.getChildByFieldName("body");
        ControlFlow.doWhile(ctx, node, () -> ctx.lowerBlock(body), node.getChildByFieldName("condition"), true);
    }

    /**
     * Lower a return. Several values are returned as a tuple.
     */
    static void ret(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode list = Nodes.firstChildOfType(node, "expression_list");
        if (list != null && list.getNamedChildren().size() > 1) {
            ctx.ret(Expressions.tupleLiteral(ctx, list), ctx.loc(node));
            return;
        }
        Statements.ret(ctx, node, list != null ? Nodes.firstNamedChild(list) : Nodes.firstNamedChild(node));
    }

    static void gotoStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode label = Nodes.firstNamedChild(node);
        if (label == null) {
            ctx.malformed(node, "goto without a label");
            return;
        }
        ctx.branch("user_" + ctx.text(label));
    }

    static void labelStatement(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode label = Nodes.firstNamedChild(node);
        if (label != null) ctx.label("user_" + ctx.text(label));
    }
}
