package io.github.eutro.tacflow.core.lower.lang;

import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.Reg;
import io.github.eutro.tacflow.core.lower.Definitions;
import io.github.eutro.tacflow.core.lower.Expressions;
import io.github.eutro.tacflow.core.lower.LoweringContext;
import io.github.eutro.tacflow.core.tree.Nodes;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The profile of TypeScript, which lowers like JavaScript with type annotations skipped.
 * <p>
 * Interfaces and enums become objects mapping member names to ordinals.
 */
public class TypeScriptProfile extends JavaScriptProfile {
    public TypeScriptProfile() {
        super("typescript");
        identifierTypes.add("type_identifier");

        expr(Expressions::identifier, "type_identifier");
        expr(Expressions::constLiteral, "predefined_type");
        expr(Expressions::unwrap, "as_expression", "non_null_expression", "satisfies_expression",
                "type_assertion");

        stmt(TypeScriptProfile::interfaceDeclaration, "interface_declaration");
        stmt(TypeScriptProfile::enumDeclaration, "enum_declaration");
        stmt(Definitions::classDef, "abstract_class_declaration");
        stmt(TypeScriptProfile::abstractMethod, "abstract_method_signature");
        stmt((ctx, n) -> ctx.lowerBlock(n.getChildByFieldName("body")), "internal_module", "module");
        ignore("type_alias_declaration", "ambient_declaration", "method_signature", "index_signature");
    }

    @Override
    public @Nullable String paramName(LoweringContext ctx, SyntaxNode param) {
        switch (param.getType()) {
            case "required_parameter":
            case "optional_parameter": {
                SyntaxNode pattern = Nodes.fieldOrType(param, "pattern", "identifier");
                return pattern == null ? null : ctx.text(pattern);
            }
            case "type_annotation":
                return null;
            default:
                return super.paramName(ctx, param);
        }
    }

    static void interfaceDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        if (name == null) {
            ctx.malformed(node, "interface without a name");
            return;
        }
        Reg obj = ctx.produce(Opcode.NEW_OBJECT, ctx.loc(node), "interface:" + ctx.text(name));
        SyntaxNode body = node.getChildByFieldName("body");
        if (body != null) {
            int i = 0;
            for (SyntaxNode member : body.getNamedChildren()) {
                if (ctx.profile.isSkipped(member.getType())) continue;
                SyntaxNode memberName = member.getChildByFieldName("name");
                String key = memberName != null
                        ? ctx.text(memberName)
                        : ctx.text(member).split(":")[0].trim();
                Reg k = ctx.constant(key);
                Reg v = ctx.constant(String.valueOf(i++));
                ctx.consume(Opcode.STORE_INDEX, ctx.loc(member), obj, k, v);
            }
        }
        ctx.storeVar(ctx.text(name), obj, ctx.loc(node));
    }

    static void enumDeclaration(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        if (name == null) {
            ctx.malformed(node, "enum without a name");
            return;
        }
        List<String> members = new ArrayList<>();
        SyntaxNode body = node.getChildByFieldName("body");
        if (body != null) {
            for (SyntaxNode member : body.getNamedChildren()) {
                if (ctx.profile.isSkipped(member.getType())) continue;
                members.add(ctx.text(member).split("=")[0].trim());
            }
        }
        Definitions.enumDef(ctx, node, ctx.text(name), members);
    }

    /**
     * Lower an abstract method as a function that returns the default value.
     */
    static void abstractMethod(LoweringContext ctx, SyntaxNode node) {
        SyntaxNode name = node.getChildByFieldName("name");
        Definitions.function(ctx, node, name != null ? ctx.text(name) : "__abstract", () -> {
        }, () -> {
        });
    }
}
