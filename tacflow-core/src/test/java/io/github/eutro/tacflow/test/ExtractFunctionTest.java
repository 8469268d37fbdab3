package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.cfg.ExtractFunction;
import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRNames;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.passes.Passes;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

public class ExtractFunctionTest {
    static final String TWO_FUNCTIONS = "(module"
            + " (function_definition \"def\" name: (identifier \"f\") parameters: (parameters \"(\" \")\") \":\""
            + "   body: (block (return_statement \"return\" (integer \"1\"))))"
            + " (function_definition \"def\" name: (identifier \"g\") parameters: (parameters \"(\" (identifier \"y\") \")\") \":\""
            + "   body: (block (return_statement \"return\" (call function: (identifier \"f\")"
            + "     arguments: (argument_list \"(\" \")\"))))))";

    @Test
    void testExtract() {
        List<IRInstruction> insns = Utils.lower("python", TWO_FUNCTIONS);
        List<IRInstruction> g = ExtractFunction.extract(insns, "g");
        Assertions.assertEquals(IRInstruction.label("func_g_2"), g.get(0));
        Assertions.assertEquals(IRInstruction.label("end_g_3"), g.get(g.size() - 1));
        Assertions.assertEquals(Arrays.asList("func_g_2", "end_g_3"), Utils.labels(g));
        Assertions.assertEquals("%3 = symbolic param:y", g.get(1).toText());
        Assertions.assertTrue(g.stream().noneMatch($ -> $.getOpcode() == Opcode.LABEL
                && IRNames.stripCounter($.getLabel()).equals("func_f")));
    }

    @Test
    void testFunctionCfg() {
        List<IRInstruction> insns = Utils.lower("python", TWO_FUNCTIONS);
        Assertions.assertEquals("func_f_0", Passes.functionCfg("f").run(insns).entry);
        Assertions.assertEquals(1, Passes.functionCfg("f").run(insns).blocks.size());
    }

    @Test
    void testNotFound() {
        List<IRInstruction> insns = Utils.lower("python", TWO_FUNCTIONS);
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> ExtractFunction.extract(insns, "nope"));
        Assertions.assertEquals("function 'nope' not found", e.getMessage());

        e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> Passes.functionMermaid("nope").run(insns));
        Assertions.assertEquals("function 'nope' not found", e.getMessage());
        Assertions.assertTrue(Arrays.stream(e.getSuppressed())
                .anyMatch($ -> $.getMessage().contains("(ExtractFunction)")));
    }

    @Test
    void testPrefixIsNotAMatch() {
        List<IRInstruction> insns = Utils.lower("python", TWO_FUNCTIONS);
        Assertions.assertThrows(IllegalArgumentException.class, () -> ExtractFunction.extract(insns, "func"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ExtractFunction.extract(insns, "g_2"));
    }

    @Test
    void testNestedSameName() {
        List<IRInstruction> insns = Utils.lower("python", "(module"
                + " (function_definition \"def\" name: (identifier \"f\") parameters: (parameters \"(\" \")\") \":\""
                + "   body: (block"
                + "     (function_definition \"def\" name: (identifier \"f\") parameters: (parameters \"(\" \")\") \":\""
                + "       body: (block (return_statement \"return\" (integer \"1\"))))"
                + "     (return_statement \"return\" (call function: (identifier \"f\") arguments: (argument_list \"(\" \")\"))))))");
        List<IRInstruction> f = ExtractFunction.extract(insns, "f");
        Assertions.assertEquals(Arrays.asList("func_f_0", "func_f_2", "end_f_3", "end_f_1"), Utils.labels(f));
        Assertions.assertEquals(IRInstruction.label("end_f_1"), f.get(f.size() - 1));
        Assertions.assertEquals("store_var f %5", insns.get(insns.size() - 1).toText());
    }
}
