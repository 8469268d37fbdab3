package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Shared lowerings of expressions.
 */
public final class Expressions {
    private Expressions() {
    }

    private static final String[] PARENS = {"(", ")"};

    /**
     * Node kinds that wrap a single call argument.
     */
    private static final List<String> ARGUMENT_WRAPPERS = Arrays.asList("argument", "value_argument");

    // leaves

    public static Reg constLiteral(LoweringContext ctx, SyntaxNode node) {
        return ctx.constant(ctx.text(node), ctx.loc(node));
    }

    public static Reg identifier(LoweringContext ctx, SyntaxNode node) {
        return ctx.loadVar(ctx.text(node), ctx.loc(node));
    }

    public static Reg canonicalTrue(LoweringContext ctx, SyntaxNode node) {
        return ctx.constant("True", ctx.loc(node));
    }

    public static Reg canonicalFalse(LoweringContext ctx, SyntaxNode node) {
        return ctx.constant("False", ctx.loc(node));
    }

    public static Reg canonicalNone(LoweringContext ctx, SyntaxNode node) {
        return ctx.constant("None", ctx.loc(node));
    }

    public static Reg noneLiteral(LoweringContext ctx, SyntaxNode node) {
        return ctx.constant(ctx.profile.literals.none(), ctx.loc(node));
    }

    /**
     * Lower a parenthesized expression as its content.
     *
     * @param ctx  The context.
     * @param node The parenthesized expression.
     * @return The value register.
     */
    public static Reg paren(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode inner = Nodes.firstNamedChild(node);
        if (inner == null) {
            return constLiteral(ctx, node);
        }
        return ctx.lowerExpr(inner);
    }

    /**
     * Lower the first named child of a node, for wrappers that carry no meaning of their own.
     *
     * @param ctx  The context.
     * @param node The wrapper.
     * @return The value register.
     */
    public static Reg unwrap(LoweringContext ctx, SyntaxNode node) {
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!ctx.profile.isSkipped(child.getType())) {
                return ctx.lowerExpr(child);
            }
        }
        return constLiteral(ctx, node);
    }

    // operators

    /**
     * Lower a binary operation {@code lhs op rhs}.
     * <p>
     * The operator text becomes the first operand of the {@code BINOP}.
     *
     * @param ctx  The context.
     * @param node The operation.
     * @return The result register.
     */
    public static Reg binop(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> children = Nodes.childrenExcept(node, PARENS);
        SyntaxNode lhs = Nodes.fieldOrType(node, "left");
        SyntaxNode op = node.getChildByFieldName("operator");
        SyntaxNode rhs = node.getChildByFieldName("right");
        if (lhs == null && !children.isEmpty()) lhs = children.get(0);
        if (op == null && children.size() > 1) op = children.get(1);
        if (rhs == null && children.size() > 2) rhs = children.get(children.size() - 1);
        if (lhs == null || op == null || rhs == null) {
            ctx.malformed(node, "expected two operands and an operator");
            return constLiteral(ctx, node);
        }
        return binop(ctx, node, ctx.text(op), lhs, rhs);
    }

    /**
     * Lower a binary operation with a known operator.
     *
     * @param ctx  The context.
     * @param node The operation, for its location.
     * @param op   The operator text.
     * @param lhs  The left operand.
     * @param rhs  The right operand.
     * @return The result register.
     */
    public static Reg binop(LoweringContext ctx, SyntaxNode node, String op, SyntaxNode lhs, SyntaxNode rhs) {
        Reg l = ctx.lowerExpr(lhs);
        Reg r = ctx.lowerExpr(rhs);
        return ctx.produce(Opcode.BINOP, ctx.loc(node), op, l, r);
    }

    /**
     * Lower a prefix unary operation {@code op operand}.
     *
     * @param ctx  The context.
     * @param node The operation.
     * @return The result register.
     */
    public static Reg unop(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> children = Nodes.childrenExcept(node, PARENS);
        SyntaxNode op = node.getChildByFieldName("operator");
        SyntaxNode operand = Nodes.fieldOrType(node, "argument");
        if (operand == null) operand = node.getChildByFieldName("operand");
        if (op == null && !children.isEmpty()) op = children.get(0);
        if (operand == null && children.size() > 1) operand = children.get(children.size() - 1);
        if (op == null || operand == null) {
            ctx.malformed(node, "expected an operator and an operand");
            return constLiteral(ctx, node);
        }
        Reg value = ctx.lowerExpr(operand);
        return ctx.produce(Opcode.UNOP, ctx.loc(node), ctx.text(op), value);
    }

    /**
     * Lower {@code i++}, {@code ++i}, {@code i--} or {@code --i} as an addition and a store.
     *
     * @param ctx  The context.
     * @param node The update expression.
     * @return The register holding the updated value.
     */
    public static Reg updateExpr(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode operand = Nodes.firstNamedChild(node);
        if (operand == null) {
            return constLiteral(ctx, node);
        }
        String op = ctx.text(node).contains("++") ? "+" : "-";
        Reg value = ctx.lowerExpr(operand);
        Reg one = ctx.constant("1");
        Reg result = ctx.produce(Opcode.BINOP, ctx.loc(node), op, value, one);
        Statements.storeTarget(ctx, operand, result, node);
        return result;
    }

    // calls

    public static Reg call(LoweringContext ctx, SyntaxNode node) {
        return call(ctx, node,
                node.getChildByFieldName(ctx.profile.fields.callFunction()),
                node.getChildByFieldName(ctx.profile.fields.callArguments()));
    }

    /**
     * Lower a call, classifying the callee.
     * <p>
     * A member access callee becomes {@code CALL_METHOD receiver name args...}, a plain name
     * {@code CALL_FUNCTION name args...}, and anything else {@code CALL_UNKNOWN target args...}.
     *
     * @param ctx    The context.
     * @param node   The call, for its location.
     * @param callee The callee node.
     * @param args   The argument list node.
     * @return The result register.
     */
    public static Reg call(LoweringContext ctx, SyntaxNode node, @Nullable SyntaxNode callee, @Nullable SyntaxNode args) {
        LanguageProfile profile = ctx.profile;
        if (callee != null && profile.isAttribute(callee)) {
            Pair<SyntaxNode, SyntaxNode> parts = profile.attributeParts(callee);
            if (parts != null) {
                Reg receiver = ctx.lowerExpr(parts.left);
                List<Reg> argRegs = callArgs(ctx, args);
                return ctx.produce(Opcode.CALL_METHOD, ctx.loc(node),
                        Arrays.asList(receiver, ctx.text(parts.right)), argRegs);
            }
        }
        if (callee != null && profile.isIdentifier(callee)) {
            return callFunction(ctx, node, ctx.text(callee), callArgs(ctx, args));
        }
        Reg target = callee != null
                ? ctx.lowerExpr(callee)
                : ctx.symbolic("unknown_call_target", ctx.loc(node));
        List<Reg> argRegs = callArgs(ctx, args);
        return ctx.produce(Opcode.CALL_UNKNOWN, ctx.loc(node), Collections.singletonList(target), argRegs);
    }

    public static Reg callFunction(LoweringContext ctx, SyntaxNode node, String name, List<Reg> args) {
        return ctx.produce(Opcode.CALL_FUNCTION, ctx.loc(node), Collections.singletonList(name), args);
    }

    public static Reg callMethod(LoweringContext ctx, SyntaxNode node, Reg receiver, String name, List<Reg> args) {
        return ctx.produce(Opcode.CALL_METHOD, ctx.loc(node), Arrays.asList(receiver, name), args);
    }

    /**
     * Allocate an object of a class and call its constructor.
     *
     * @param ctx  The context.
     * @param node The construction, for its location.
     * @param type The class name.
     * @param args The constructor argument list node, or null.
     * @return The register holding the new object.
     */
    public static Reg construct(LoweringContext ctx, SyntaxNode node, String type, @Nullable SyntaxNode args) {
        List<Reg> argRegs = callArgs(ctx, args);
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), type);
        callMethod(ctx, node, obj, "constructor", argRegs);
        return obj;
    }

    /**
     * Lower call arguments left to right.
     * <p>
     * Argument wrapper nodes are unwrapped to the expression they contain.
     *
     * @param ctx  The context.
     * @param args The argument list node, or null.
     * @return The argument registers.
     */
    public static List<Reg> callArgs(LoweringContext ctx, @Nullable SyntaxNode args) {
        List<Reg> regs = new ArrayList<>();
        if (args == null) return regs;
        for (SyntaxNode child : args.getNamedChildren()) {
            if (ctx.profile.isSkipped(child.getType())) continue;
            if (ARGUMENT_WRAPPERS.contains(child.getType())) {
                SyntaxNode inner = lastNamedChild(child);
                if (inner != null) regs.add(ctx.lowerExpr(inner));
            } else {
                regs.add(ctx.lowerExpr(child));
            }
        }
        return regs;
    }

    private static @Nullable SyntaxNode lastNamedChild(SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        return named.isEmpty() ? null : named.get(named.size() - 1);
    }

    // access

    public static Reg attribute(LoweringContext ctx, SyntaxNode node) {
        Pair<SyntaxNode, SyntaxNode> parts = ctx.profile.attributeParts(node);
        if (parts == null) {
            return constLiteral(ctx, node);
        }
        Reg obj = ctx.lowerExpr(parts.left);
        return ctx.produce(Opcode.LOAD_FIELD, ctx.loc(node), obj, ctx.text(parts.right));
    }

    public static Reg subscript(LoweringContext ctx, SyntaxNode node) {
        Pair<SyntaxNode, SyntaxNode> parts = ctx.profile.subscriptParts(node);
        if (parts == null) {
            return constLiteral(ctx, node);
        }
        Reg obj = ctx.lowerExpr(parts.left);
        Reg idx = ctx.lowerExpr(parts.right);
        return ctx.produce(Opcode.LOAD_INDEX, ctx.loc(node), obj, idx);
    }

    /**
     * Join the parts of an interpolated string with {@code BINOP "+"}, left to right.
     *
     * @param ctx   The context.
     * @param node  The string, for its location.
     * @param parts The fragment and substitution registers.
     * @return The result register, or an empty string constant if there are no parts.
     */
    public static Reg concat(LoweringContext ctx, SyntaxNode node, List<Reg> parts) {
        if (parts.isEmpty()) {
            return ctx.constant("\"\"", ctx.loc(node));
        }
        Reg result = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            result = ctx.produce(Opcode.BINOP, ctx.loc(node), "+", result, parts.get(i));
        }
        return result;
    }

    /**
     * Lower a string whose children are literal fragments and substitutions.
     * <p>
     * A string without substitutions is a single constant of its text.
     *
     * @param ctx               The context.
     * @param node              The string.
     * @param fragmentTypes     The kinds of literal fragments.
     * @param substitutionTypes The kinds of substitutions, lowered through their first named child
     *                          unless they are plain names.
     * @return The result register.
     */
    public static Reg interpolated(LoweringContext ctx, SyntaxNode node, Collection<String> fragmentTypes,
                                   Collection<String> substitutionTypes) {
        boolean substituted = false;
        for (SyntaxNode child : node.getChildren()) {
            if (substitutionTypes.contains(child.getType())) {
                substituted = true;
                break;
            }
        }
        if (!substituted) {
            return constLiteral(ctx, node);
        }
        List<Reg> parts = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (fragmentTypes.contains(child.getType())) {
                parts.add(ctx.constant(ctx.text(child), ctx.loc(child)));
            } else if (substitutionTypes.contains(child.getType())) {
                SyntaxNode inner = Nodes.firstNamedChild(child);
                parts.add(inner != null ? ctx.lowerExpr(inner) : ctx.lowerExpr(child));
            }
        }
        return concat(ctx, node, parts);
    }

    // collections

    public static Reg listLiteral(LoweringContext ctx, SyntaxNode node) {
        return array(ctx, node, "list", elements(ctx, node));
    }

    public static Reg tupleLiteral(LoweringContext ctx, SyntaxNode node) {
        return array(ctx, node, "tuple", elements(ctx, node));
    }

    /**
     * Get the element nodes of a collection literal.
     *
     * @param ctx  The context.
     * @param node The literal.
     * @return Its named children, without comments.
     */
    public static List<SyntaxNode> elements(LoweringContext ctx, SyntaxNode node) {
        List<SyntaxNode> elems = new ArrayList<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!ctx.profile.isSkipped(child.getType())) elems.add(child);
        }
        return elems;
    }

    /**
     * Allocate an array and store each element at a constant index.
     *
     * @param ctx   The context.
     * @param node  The literal, for its location.
     * @param kind  The array kind, e.g. {@code "list"}.
     * @param elems The element expressions.
     * @return The array register.
     */
    public static Reg array(LoweringContext ctx, SyntaxNode node, String kind, List<SyntaxNode> elems) {
        return array(ctx, node, kind, elems, 0);
    }

    public static Reg array(LoweringContext ctx, SyntaxNode node, String kind, List<SyntaxNode> elems, int firstIndex) {
        Reg size = ctx.constant(String.valueOf(elems.size()));
        Reg arr = ctx.produce(Opcode.NEW_ARRAY, ctx.loc(node), kind, size);
        int i = firstIndex;
        for (SyntaxNode elem : elems) {
            Reg value = ctx.lowerExpr(elem);
            Reg idx = ctx.constant(String.valueOf(i++));
            ctx.consume(Opcode.STORE_INDEX, SourceLocation.UNKNOWN, arr, idx, value);
        }
        return arr;
    }

    /**
     * Lower a dictionary literal of {@code pair} children with {@code key} and {@code value} fields.
     *
     * @param ctx  The context.
     * @param node The literal.
     * @return The object register.
     */
    public static Reg dictLiteral(LoweringContext ctx, SyntaxNode node) {
        return object(ctx, node, "dict", Nodes.childrenOfType(node, "pair"), "key", "value");
    }

    /**
     * Allocate an object and store each entry under its key.
     *
     * @param ctx        The context.
     * @param node       The literal, for its location.
     * @param kind       The object kind.
     * @param entries    The entry nodes.
     * @param keyField   The field of an entry holding the key.
     * @param valueField The field of an entry holding the value.
     * @return The object register.
     */
    public static Reg object(LoweringContext ctx, SyntaxNode node, String kind, List<SyntaxNode> entries,
                             String keyField, String valueField) {
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), kind);
        for (SyntaxNode entry : entries) {
            SyntaxNode key = entry.getChildByFieldName(keyField);
            SyntaxNode value = entry.getChildByFieldName(valueField);
            List<SyntaxNode> named = entry.getNamedChildren();
            if (key == null && !named.isEmpty()) key = named.get(0);
            if (value == null && named.size() > 1) value = named.get(named.size() - 1);
            if (key == null || value == null) {
                ctx.malformed(entry, "expected a key and a value");
                continue;
            }
            Reg k = ctx.lowerExpr(key);
            Reg v = ctx.lowerExpr(value);
            ctx.consume(Opcode.STORE_INDEX, ctx.loc(entry), obj, k, v);
        }
        return obj;
    }

    // conditionals

    /**
     * Lower a conditional expression through a synthetic result variable.
     *
     * @param ctx       The context.
     * @param node      The expression.
     * @param condition The condition.
     * @param ifTrue    The value if the condition holds.
     * @param ifFalse   The value otherwise, or null for the none literal.
     * @return The result register.
     */
    public static Reg ternary(LoweringContext ctx, SyntaxNode node, @Nullable SyntaxNode condition,
                              @Nullable SyntaxNode ifTrue, @Nullable SyntaxNode ifFalse) {
        Reg cond = ctx.lowerExpr(condition);
        String trueLabel = ctx.freshLabel("ternary_true");
        String falseLabel = ctx.freshLabel("ternary_false");
        String endLabel = ctx.freshLabel("ternary_end");
        String result = ctx.freshLabel("__ternary");
        ctx.branchIf(cond, trueLabel, falseLabel, ctx.loc(node));

        ctx.label(trueLabel);
        ctx.storeVar(result, ctx.lowerExpr(ifTrue), SourceLocation.UNKNOWN);
        ctx.branch(endLabel);

        ctx.label(falseLabel);
        Reg falseValue = ifFalse != null ? ctx.lowerExpr(ifFalse) : ctx.constant(ctx.profile.literals.none());
        ctx.storeVar(result, falseValue, SourceLocation.UNKNOWN);
        ctx.branch(endLabel);

        ctx.label(endLabel);
        return ctx.loadVar(result, ctx.loc(node));
    }

    /**
     * Lower a C-family {@code cond ? a : b} expression.
     *
     * @param ctx  The context.
     * @param node The expression.
     * @return The result register.
     */
    public static Reg conditional(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode cond = node.getChildByFieldName("condition");
        SyntaxNode cons = node.getChildByFieldName("consequence");
        SyntaxNode alt = node.getChildByFieldName("alternative");
        List<SyntaxNode> named = node.getNamedChildren();
        if (cond == null && named.size() > 0) cond = named.get(0);
        if (cons == null && named.size() > 1) cons = named.get(1);
        if (alt == null && named.size() > 2) alt = named.get(2);
        return ternary(ctx, node, cond, cons, alt);
    }
}
