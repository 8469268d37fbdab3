package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.lower.Frontends;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

public class RustLoweringTest {
    static List<String> lower(String tree) {
        return Utils.lowerText("rust", tree);
    }

    static String arm(String pattern, String value) {
        return " (match_arm pattern: (match_pattern " + pattern + ") \"=>\" value: (integer_literal \"" + value + "\") \",\")";
    }

    static String letMatch(String arms) {
        return "(source_file (let_declaration \"let\" pattern: (identifier \"y\") \"=\""
                + " value: (match_expression \"match\" value: (identifier \"x\")"
                + " body: (match_block \"{\"" + arms + " \"}\")) \";\"))";
    }

    @Test
    void testMatchWildcardFirst() {
        List<String> text = lower(letMatch(arm("\"_\"", "20") + arm("(integer_literal \"1\")", "10")));
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var x",
                "%1 = const ()",
                "store_var __match_result_0 %1",
                "%2 = const 20",
                "store_var __match_result_0 %2",
                "branch switch_end_1",
                "switch_end_1:",
                "%3 = load_var __match_result_0",
                "store_var y %3"
        ), text);
    }

    @Test
    void testMatchOrPattern() {
        List<String> text = lower(letMatch(
                arm("(or_pattern (integer_literal \"1\") \"|\" (integer_literal \"2\"))", "10")
                        + arm("\"_\"", "20")));
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var x",
                "%1 = const ()",
                "store_var __match_result_0 %1",
                "%2 = const 1",
                "%3 = binop == %0 %2",
                "%4 = const 2",
                "%5 = binop == %0 %4",
                "%6 = binop || %3 %5",
                "branch_if %6 case_body_2,case_next_3",
                "case_body_2:",
                "%7 = const 10",
                "store_var __match_result_0 %7",
                "branch switch_end_1",
                "case_next_3:",
                "%8 = const 20",
                "store_var __match_result_0 %8",
                "branch switch_end_1",
                "switch_end_1:",
                "%9 = load_var __match_result_0",
                "store_var y %9"
        ), text);
    }

    @Test
    void testTryAndAwait() {
        List<String> text = lower("(source_file (let_declaration \"let\" pattern: (identifier \"v\") \"=\""
                + " value: (try_expression (await_expression (call_expression function: (identifier \"fetch\")"
                + "   arguments: (arguments \"(\" \")\")) \".\" \"await\") \"?\") \";\"))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = call_function fetch",
                "%1 = call_function await %0",
                "%2 = call_function try_unwrap %1",
                "store_var v %2"
        ), text);
    }

    @Test
    void testTrailingExpressionIsReturned() {
        List<String> text = lower("(source_file (function_item \"fn\" name: (identifier \"f\")"
                + " parameters: (parameters \"(\" (parameter pattern: (identifier \"a\") \":\" type: (primitive_type \"i32\")) \")\")"
                + " \"->\" return_type: (primitive_type \"i32\")"
                + " body: (block \"{\""
                + "   (let_declaration \"let\" pattern: (identifier \"b\") \"=\""
                + "     value: (binary_expression left: (identifier \"a\") operator: \"+\" right: (integer_literal \"1\")) \";\")"
                + "   (binary_expression left: (identifier \"b\") operator: \"*\" right: (integer_literal \"2\"))"
                + " \"}\")))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "branch end_f_1",
                "func_f_0:",
                "%0 = symbolic param:a",
                "store_var a %0",
                "%1 = load_var a",
                "%2 = const 1",
                "%3 = binop + %1 %2",
                "store_var b %3",
                "%4 = load_var b",
                "%5 = const 2",
                "%6 = binop * %4 %5",
                "return %6",
                "%7 = const ()",
                "return %7",
                "end_f_1:",
                "%8 = const <function:f@func_f_0>",
                "store_var f %8"
        ), text);
    }

    @Test
    void testBlockValue() {
        List<String> text = lower("(source_file (let_declaration \"let\" pattern: (identifier \"z\") \"=\""
                + " value: (block \"{\" (let_declaration \"let\" pattern: (identifier \"t\") \"=\""
                + "   value: (integer_literal \"1\") \";\") (identifier \"t\") \"}\") \";\"))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = const 1",
                "store_var t %0",
                "%1 = load_var t",
                "store_var z %1"
        ), text);
    }

    @Test
    void testInclusiveRange() {
        List<String> text = lower("(source_file (expression_statement (for_expression \"for\" pattern: (identifier \"i\") \"in\""
                + " value: (range_expression (integer_literal \"0\") \"..=\" (identifier \"n\"))"
                + " body: (block \"{\" \"}\"))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = const 0",
                "%1 = load_var n",
                "%2 = const 1",
                "store_var i %0",
                "for_cond_0:",
                "%3 = load_var i",
                "%4 = binop <= %3 %1",
                "branch_if %4 for_body_1,for_end_3",
                "for_body_1:",
                "for_update_2:",
                "%5 = load_var i",
                "%6 = binop + %5 %2",
                "store_var i %6",
                "branch for_cond_0",
                "for_end_3:"
        ), text);
    }

    @Test
    void testHandledKinds() {
        Assertions.assertTrue(Frontends.profile("rust").handledKinds().containsAll(Arrays.asList(
                "match_expression", "try_expression", "await_expression", "block", "function_item",
                "impl_item", "for_expression", "loop_expression")));
    }
}
