package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Shared lowerings of function, class and lambda definitions.
 * <p>
 * A definition is emitted inline, jumped over by a branch to its end label, and its value is a
 * reference constant naming its entry label.
 */
public final class Definitions {
    private Definitions() {
    }

    /**
     * Emit the encoding of a parameter: {@code SYMBOLIC "param:<name>"} immediately followed by
     * a store of that register to the name.
     *
     * @param ctx  The context.
     * @param name The parameter name.
     * @param loc  The location of the parameter.
     */
    public static void emitParam(LoweringContext ctx, String name, SourceLocation loc) {
        Reg reg = ctx.symbolic(IRNames.PARAM_PREFIX + name, loc);
        ctx.storeVar(name, reg, SourceLocation.UNKNOWN);
    }

    /**
     * Lower a function definition through the profile's name, parameters and body fields.
     *
     * @param ctx  The context.
     * @param node The definition.
     */
    public static void functionDef(LoweringContext ctx, SyntaxNode node) {
        LanguageProfile.FieldNames fields = ctx.profile.fields;
        SyntaxNode nameNode = node.getChildByFieldName(fields.funcName());
        SyntaxNode params = node.getChildByFieldName(fields.funcParams());
        SyntaxNode body = node.getChildByFieldName(fields.funcBody());
        String name;
        if (nameNode != null) {
            name = ctx.text(nameNode);
        } else {
            ctx.malformed(node, "function without a name");
            name = "__anon";
        }
        function(ctx, node, name, params, body);
    }

    /**
     * Lower a function from its parts.
     *
     * @param ctx    The context.
     * @param node   The definition, for its location.
     * @param name   The function name.
     * @param params The parameter list, or null.
     * @param body   The body, or null.
     * @return The entry label of the function.
     */
    public static String function(LoweringContext ctx, SyntaxNode node, String name,
                                  @Nullable SyntaxNode params, @Nullable SyntaxNode body) {
        return function(ctx, node, name,
                () -> {
                    if (params != null) ctx.profile.lowerParams(ctx, params);
                },
                () -> ctx.lowerBlock(body));
    }

    /**
     * Lower a function, storing a reference to it in a variable of the same name.
     * <p>
     * A return of the profile's default value is appended to the body.
     *
     * @param ctx    The context.
     * @param node   The definition, for its location.
     * @param name   The function name.
     * @param params Lowers the parameters.
     * @param body   Lowers the body.
     * @return The entry label of the function.
     */
    public static String function(LoweringContext ctx, SyntaxNode node, String name, Runnable params, Runnable body) {
        SourceLocation loc = ctx.loc(node);
        String funcLabel = ctx.freshLabel(IRNames.FUNC_LABEL_PREFIX + name);
        String endLabel = ctx.freshLabel(IRNames.END_LABEL_PREFIX + name);

        ctx.emit(IRInstruction.branch(endLabel, loc));
        ctx.label(funcLabel);
        params.run();
        body.run();
        ctx.ret(ctx.constant(ctx.profile.literals.defaultReturn()), SourceLocation.UNKNOWN);
        ctx.label(endLabel);

        Reg ref = ctx.constant(IRNames.functionRef(name, funcLabel));
        ctx.storeVar(name, ref, loc);
        return funcLabel;
    }

    /**
     * Lower a class definition through the profile's name and body fields.
     *
     * @param ctx  The context.
     * @param node The definition.
     */
    public static void classDef(LoweringContext ctx, SyntaxNode node) {
        LanguageProfile.FieldNames fields = ctx.profile.fields;
        SyntaxNode nameNode = node.getChildByFieldName(fields.className());
        SyntaxNode body = node.getChildByFieldName(fields.classBody());
        String name;
        if (nameNode != null) {
            name = ctx.text(nameNode);
        } else {
            ctx.malformed(node, "class without a name");
            name = "__anon";
        }
        classBody(ctx, node, name, () -> {
            if (body != null) ctx.lowerChildren(body);
        });
    }

    /**
     * Lower a class, storing a reference to it in a variable of the same name.
     * <p>
     * Members are lowered inline between the class labels. Unlike a function, the body
     * has no implicit return.
     *
     * @param ctx  The context.
     * @param node The definition, for its location.
     * @param name The class name.
     * @param body Lowers the members.
     * @return The entry label of the class.
     */
    public static String classBody(LoweringContext ctx, SyntaxNode node, String name, Runnable body) {
        SourceLocation loc = ctx.loc(node);
        String classLabel = ctx.freshLabel(IRNames.CLASS_LABEL_PREFIX + name);
        String endLabel = ctx.freshLabel(IRNames.END_CLASS_LABEL_PREFIX + name);

        ctx.emit(IRInstruction.branch(endLabel, loc));
        ctx.label(classLabel);
        body.run();
        ctx.label(endLabel);

        Reg ref = ctx.constant(IRNames.classRef(name, classLabel));
        ctx.storeVar(name, ref, loc);
        return classLabel;
    }

    /**
     * Lower an enumeration as an object mapping each member name to its ordinal, stored to the
     * enumeration's name.
     *
     * @param ctx     The context.
     * @param node    The declaration, for its location.
     * @param name    The enumeration name.
     * @param members The member names, in order.
     */
    public static void enumDef(LoweringContext ctx, SyntaxNode node, String name, List<String> members) {
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "enum:" + name);
        int i = 0;
        for (String member : members) {
            Reg key = ctx.constant(member);
            Reg ordinal = ctx.constant(String.valueOf(i++));
            ctx.consume(Opcode.STORE_INDEX, SourceLocation.UNKNOWN, obj, key, ordinal);
        }
        ctx.storeVar(name, obj, ctx.loc(node));
    }

    /**
     * Lower a type declaration with no behaviour as a {@code SYMBOLIC "<kind>:<name>"} marker
     * stored to the type's name.
     *
     * @param ctx  The context.
     * @param node The declaration, for its location.
     * @param kind The kind of type, e.g. {@code "struct"}.
     * @param name The type name.
     */
    public static void typeMarker(LoweringContext ctx, SyntaxNode node, String kind, String name) {
        Reg marker = ctx.symbolic(kind + ":" + name, ctx.loc(node));
        ctx.storeVar(name, marker, ctx.loc(node));
    }

    /**
     * Lower an anonymous function whose body is a single expression or a block.
     *
     * @param ctx    The context.
     * @param node   The lambda.
     * @param params Lowers the parameters.
     * @param body   Lowers the body, returning the value of an expression body, or null for a
     *               block body, which falls through to the default return.
     * @return The register holding the function reference.
     */
    public static Reg lambda(LoweringContext ctx, SyntaxNode node, Runnable params, BodyLowering body) {
        String lambdaLabel = ctx.freshLabel("lambda");
        String endLabel = ctx.freshLabel("lambda_end");

        ctx.branch(endLabel);
        ctx.label(lambdaLabel);
        params.run();
        Reg value = body.lower();
        ctx.ret(value != null ? value : ctx.constant(ctx.profile.literals.defaultReturn()), SourceLocation.UNKNOWN);
        ctx.label(endLabel);

        return ctx.constant(IRNames.functionRef("__lambda", lambdaLabel), ctx.loc(node));
    }

    /**
     * Lower a lambda with {@code parameters} and {@code body} fields, whose body is an expression
     * unless it is one of the profile's block kinds.
     *
     * @param ctx  The context.
     * @param node The lambda.
     * @return The register holding the function reference.
     */
    public static Reg lambda(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode params = node.getChildByFieldName(ctx.profile.fields.funcParams());
        if (params == null) params = node.getChildByFieldName("parameter");
        SyntaxNode body = node.getChildByFieldName(ctx.profile.fields.funcBody());
        SyntaxNode paramNode = params;
        return lambda(ctx, node,
                () -> {
                    if (paramNode == null) return;
                    if (ctx.profile.isIdentifier(paramNode)) {
                        ctx.profile.lowerParam(ctx, paramNode);
                    } else {
                        ctx.profile.lowerParams(ctx, paramNode);
                    }
                },
                () -> {
                    if (body == null || ctx.profile.isBlock(body.getType())) {
                        ctx.lowerBlock(body);
                        return null;
                    }
                    return ctx.lowerExpr(body);
                });
    }

    /**
     * Lowers the body of a lambda.
     */
    @FunctionalInterface
    public interface BodyLowering {
        /**
         * Lower the body.
         *
         * @return The value of the body, or null if it falls through.
         */
        @Nullable Reg lower();
    }
}
