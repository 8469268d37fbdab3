package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRStats;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.ir.SourceLocation;
import io.github.eutro.tacflow.core.lower.Frontends;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

public class PythonLoweringTest {
    static List<String> lower(String tree) {
        return Utils.lowerText("python", tree);
    }

    static void assertContainsInOrder(List<String> actual, String... expected) {
        Utils.assertContainsInOrder(actual, expected);
    }

    @Test
    void testFunction() {
        List<String> text = lower("(module (function_definition \"def\" name: (identifier \"f\")"
                + " parameters: (parameters \"(\" (identifier \"x\") \")\") \":\""
                + " body: (block (return_statement \"return\" (identifier \"x\")))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "branch end_f_1",
                "func_f_0:",
                "%0 = symbolic param:x",
                "store_var x %0",
                "%1 = load_var x",
                "return %1",
                "%2 = const None",
                "return %2",
                "end_f_1:",
                "%3 = const <function:f@func_f_0>",
                "store_var f %3"
        ), text);
    }

    @Test
    void testBreakContinue() {
        List<String> text = lower("(module (while_statement \"while\" condition: (true \"True\") \":\""
                + " body: (block"
                + "  (if_statement \"if\" condition: (identifier \"x\") \":\" consequence: (block (break_statement \"break\")))"
                + "  (continue_statement \"continue\"))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "while_cond_0:",
                "%0 = const True",
                "branch_if %0 while_body_1,while_end_2",
                "while_body_1:",
                "%1 = load_var x",
                "branch_if %1 if_true_3,if_end_5",
                "if_true_3:",
                "branch while_end_2",
                "branch if_end_5",
                "if_end_5:",
                "branch while_cond_0",
                "branch while_cond_0",
                "while_end_2:"
        ), text);
    }

    @Test
    void testBreakOutsideLoop() {
        List<IRInstruction> insns = Utils.lower("python", "(module (break_statement \"break\"))");
        Assertions.assertEquals("%0 = symbolic break_outside_loop", insns.get(1).toText());
        Assertions.assertEquals(0, IRStats.countUnsupported(insns));
    }

    @Test
    void testElif() {
        List<String> text = lower("(module (if_statement \"if\" condition: (identifier \"a\") \":\""
                + " consequence: (block (expression_statement (integer \"1\")))"
                + " alternative: (elif_clause \"elif\" condition: (identifier \"b\") \":\""
                + "   consequence: (block (expression_statement (integer \"2\"))))"
                + " alternative: (else_clause \"else\" \":\" body: (block (expression_statement (integer \"3\"))))))");
        assertContainsInOrder(text,
                "branch_if %0 if_true_0,if_false_1",
                "if_true_0:",
                "%1 = const 1",
                "branch if_end_2",
                "if_false_1:",
                "%2 = load_var b",
                "branch_if %2 elif_true_3,elif_false_4",
                "elif_true_3:",
                "%3 = const 2",
                "branch if_end_2",
                "elif_false_4:",
                "%4 = const 3",
                "branch if_end_2",
                "branch if_end_2",
                "if_end_2:");
    }

    @Test
    void testForLoop() {
        List<String> text = lower("(module (for_statement \"for\" left: (identifier \"x\") \"in\""
                + " right: (identifier \"xs\") \":\""
                + " body: (block (expression_statement (call function: (identifier \"print\")"
                + "   arguments: (argument_list \"(\" (identifier \"x\") \")\"))))))");
        assertContainsInOrder(text,
                "%0 = load_var xs",
                "%1 = const 0",
                "store_var __for_idx_0 %1",
                "%2 = call_function len %0",
                "for_cond_1:",
                "%3 = load_var __for_idx_0",
                "%4 = binop < %3 %2",
                "branch_if %4 for_body_2,for_end_4",
                "for_body_2:",
                "%5 = load_var __for_idx_0",
                "%6 = load_index %0 %5",
                "store_var x %6",
                "%7 = load_var x",
                "%8 = call_function print %7",
                "for_update_3:",
                "branch for_cond_1",
                "for_end_4:");
    }

    @Test
    void testTryExcept() {
        List<String> text = lower("(module (try_statement \"try\" \":\""
                + " body: (block (expression_statement (call function: (identifier \"f\") arguments: (argument_list \"(\" \")\"))))"
                + " (except_clause \"except\" (as_pattern (identifier \"ValueError\") \"as\""
                + "   alias: (as_pattern_target (identifier \"e\"))) \":\" (block (pass_statement \"pass\")))"
                + " (finally_clause \"finally\" \":\" (block (expression_statement (call function: (identifier \"g\")"
                + "   arguments: (argument_list \"(\" \")\")))))))");
        assertContainsInOrder(text,
                "try_body_0:",
                "%0 = call_function f",
                "branch try_finally_2",
                "catch_0_1:",
                "%1 = symbolic caught_exception:ValueError",
                "store_var e %1",
                "branch try_finally_2",
                "try_finally_2:",
                "%2 = call_function g",
                "try_end_3:");
    }

    @Test
    void testClass() {
        List<String> text = lower("(module (class_definition \"class\" name: (identifier \"A\") \":\""
                + " body: (block (function_definition \"def\" name: (identifier \"m\")"
                + "   parameters: (parameters \"(\" (identifier \"self\") \")\") \":\""
                + "   body: (block (pass_statement \"pass\"))))))");
        assertContainsInOrder(text,
                "branch end_class_A_1",
                "class_A_0:",
                "branch end_m_3",
                "func_m_2:",
                "%0 = symbolic param:self",
                "end_m_3:",
                "store_var m %2",
                "end_class_A_1:",
                "%3 = const <class:A@class_A_0>",
                "store_var A %3");
    }

    @Test
    void testUnsupported() {
        List<IRInstruction> insns = Utils.lower("python",
                "(module (expression_statement (yield \"yield\" (identifier \"x\"))) (expression_statement (integer \"1\")))");
        Assertions.assertEquals(1, IRStats.countUnsupported(insns));
        Assertions.assertEquals("%0 = symbolic unsupported:yield", insns.get(1).toText());
        Assertions.assertEquals("%1 = const 1", insns.get(2).toText());
    }

    @Test
    void testLocations() {
        List<IRInstruction> insns = Utils.lower("python",
                "(module (expression_statement (integer \"1\")) (expression_statement (identifier \"abc\")))");
        Assertions.assertEquals(SourceLocation.of(1, 0, 1, 1), insns.get(1).getLocation());
        Assertions.assertEquals(SourceLocation.of(2, 0, 2, 3), insns.get(2).getLocation());
        Assertions.assertEquals(Opcode.LOAD_VAR, insns.get(2).getOpcode());
    }

    @Test
    void testComprehensionFilter() {
        List<String> text = lower("(module (expression_statement (list_comprehension \"[\" body: (identifier \"v\")"
                + " (for_in_clause \"for\" left: (identifier \"v\") \"in\" right: (identifier \"xs\"))"
                + " (if_clause \"if\" (identifier \"v\")) \"]\")))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = const 0",
                "%1 = new_array list %0",
                "%2 = const 0",
                "store_var __comp_result_idx_0 %2",
                "%3 = load_var xs",
                "%4 = const 0",
                "store_var __comp_idx_1 %4",
                "%5 = call_function len %3",
                "comp_cond_2:",
                "%6 = load_var __comp_idx_1",
                "%7 = binop < %6 %5",
                "branch_if %7 comp_body_3,comp_end_5",
                "comp_body_3:",
                "%8 = load_var __comp_idx_1",
                "%9 = load_index %3 %8",
                "store_var v %9",
                "%10 = load_var v",
                "branch_if %10 comp_store_7,comp_skip_6",
                "comp_store_7:",
                "%11 = load_var v",
                "%12 = load_var __comp_result_idx_0",
                "store_index %1 %12 %11",
                "%13 = const 1",
                "%14 = binop + %12 %13",
                "store_var __comp_result_idx_0 %14",
                "branch comp_skip_6",
                "comp_skip_6:",
                "comp_update_4:",
                "%15 = load_var __comp_idx_1",
                "%16 = const 1",
                "%17 = binop + %15 %16",
                "store_var __comp_idx_1 %17",
                "branch comp_cond_2",
                "comp_end_5:"
        ), text);
    }

    @Test
    void testWithExitsInReverse() {
        List<String> text = lower("(module (with_statement \"with\" (with_clause"
                + " (with_item value: (as_pattern (identifier \"a\") \"as\" alias: (as_pattern_target (identifier \"x\"))))"
                + " \",\" (with_item value: (identifier \"b\"))) \":\""
                + " body: (block (expression_statement (call function: (identifier \"f\")"
                + "   arguments: (argument_list \"(\" \")\"))))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var a",
                "%1 = call_method %0 __enter__",
                "store_var x %1",
                "%2 = load_var b",
                "%3 = call_method %2 __enter__",
                "%4 = call_function f",
                "%5 = call_method %2 __exit__",
                "%6 = call_method %0 __exit__"
        ), text);
    }

    @Test
    void testDecoratorsInnermostFirst() {
        List<String> text = lower("(module (decorated_definition"
                + " (decorator \"@\" (identifier \"outer\")) (decorator \"@\" (identifier \"inner\"))"
                + " definition: (function_definition \"def\" name: (identifier \"f\")"
                + "   parameters: (parameters \"(\" \")\") \":\" body: (block (pass_statement \"pass\")))))");
        assertContainsInOrder(text,
                "end_f_1:",
                "%1 = const <function:f@func_f_0>",
                "store_var f %1",
                "%2 = load_var f",
                "%3 = call_function inner %2",
                "store_var f %3",
                "%4 = load_var f",
                "%5 = call_function outer %4",
                "store_var f %5");
        Assertions.assertEquals("store_var f %5", text.get(text.size() - 1));
    }

    static String matchCase(String pattern, String value) {
        return " (case_clause \"case\" (case_pattern " + pattern + ") \":\""
                + " consequence: (block (expression_statement (integer \"" + value + "\"))))";
    }

    @Test
    void testMatch() {
        List<String> text = lower("(module (match_statement \"match\" subject: (identifier \"x\") \":\" body: (block"
                + matchCase("(integer \"1\")", "10")
                + matchCase("(integer \"2\")", "20")
                + matchCase("\"_\"", "30") + ")))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var x",
                "%1 = const 1",
                "%2 = binop == %0 %1",
                "branch_if %2 case_body_1,case_next_2",
                "case_body_1:",
                "%3 = const 10",
                "branch switch_end_0",
                "case_next_2:",
                "%4 = const 2",
                "%5 = binop == %0 %4",
                "branch_if %5 case_body_3,case_next_4",
                "case_body_3:",
                "%6 = const 20",
                "branch switch_end_0",
                "case_next_4:",
                "%7 = const 30",
                "branch switch_end_0",
                "switch_end_0:"
        ), text);
    }

    @Test
    void testMatchWildcardFirstShortCircuits() {
        List<String> text = lower("(module (match_statement \"match\" subject: (identifier \"x\") \":\" body: (block"
                + matchCase("\"_\"", "20")
                + matchCase("(integer \"1\")", "10") + ")))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var x",
                "%1 = const 20",
                "branch switch_end_0",
                "switch_end_0:"
        ), text);
    }

    @Test
    void testMatchCapture() {
        List<String> text = lower("(module (match_statement \"match\" subject: (identifier \"x\") \":\" body: (block"
                + " (case_clause \"case\" (case_pattern (dotted_name (identifier \"y\"))) \":\""
                + "   consequence: (block (expression_statement (identifier \"y\")))))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var x",
                "store_var y %0",
                "%1 = load_var y",
                "branch switch_end_0",
                "switch_end_0:"
        ), text);
    }

    @Test
    void testHandledKinds() {
        Assertions.assertTrue(Frontends.profile("python").handledKinds().containsAll(Arrays.asList(
                "list_comprehension", "with_statement", "decorated_definition", "match_statement",
                "function_definition", "class_definition", "try_statement")));
    }
}
