package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.lower.Frontends;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

public class GoLoweringTest {
    static List<String> lower(String tree) {
        return Utils.lowerText("go", tree);
    }

    @Test
    void testRange() {
        List<String> text = lower("(source_file (for_statement \"for\""
                + " (range_clause left: (expression_list (identifier \"i\") \",\" (identifier \"v\"))"
                + "   \":=\" \"range\" right: (identifier \"xs\"))"
                + " body: (block \"{\" \"}\")))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var xs",
                "%1 = const 0",
                "store_var __range_idx_0 %1",
                "%2 = call_function len %0",
                "range_cond_1:",
                "%3 = load_var __range_idx_0",
                "%4 = binop < %3 %2",
                "branch_if %4 range_body_2,range_end_4",
                "range_body_2:",
                "%5 = load_var __range_idx_0",
                "%6 = load_index %0 %5",
                "store_var i %5",
                "store_var v %6",
                "range_update_3:",
                "%7 = load_var __range_idx_0",
                "%8 = const 1",
                "%9 = binop + %7 %8",
                "store_var __range_idx_0 %9",
                "branch range_cond_1",
                "range_end_4:"
        ), text);
    }

    @Test
    void testSwapLowersValuesFirst() {
        List<String> text = lower("(source_file (assignment_statement"
                + " left: (expression_list (identifier \"a\") \",\" (identifier \"b\"))"
                + " operator: \"=\""
                + " right: (expression_list (identifier \"b\") \",\" (identifier \"a\"))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = load_var b",
                "%1 = load_var a",
                "store_var a %0",
                "store_var b %1"
        ), text);
    }

    @Test
    void testMultiAssignFromOneValue() {
        List<String> text = lower("(source_file (short_var_declaration"
                + " left: (expression_list (identifier \"q\") \",\" (identifier \"r\"))"
                + " \":=\""
                + " right: (expression_list (call_expression function: (identifier \"divmod\")"
                + "   arguments: (argument_list \"(\" \")\")))))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = call_function divmod",
                "%1 = const 0",
                "%2 = load_index %0 %1",
                "store_var q %2",
                "%3 = const 1",
                "%4 = load_index %0 %3",
                "store_var r %4"
        ), text);
    }

    @Test
    void testMultiReturn() {
        List<String> text = lower("(source_file (function_declaration \"func\" name: (identifier \"pair\")"
                + " parameters: (parameter_list \"(\" \")\")"
                + " result: (parameter_list \"(\" (parameter_declaration type: (type_identifier \"int\")) \",\""
                + "   (parameter_declaration type: (type_identifier \"int\")) \")\")"
                + " body: (block \"{\""
                + "   (return_statement \"return\" (expression_list (int_literal \"1\") \",\" (int_literal \"2\")))"
                + " \"}\")))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "branch end_pair_1",
                "func_pair_0:",
                "%0 = const 1",
                "%1 = const 2",
                "return %0",
                "return %1",
                "%2 = const nil",
                "return %2",
                "end_pair_1:",
                "%3 = const <function:pair@func_pair_0>",
                "store_var pair %3"
        ), text);
    }

    @Test
    void testMainIsTopLevel() {
        List<String> text = lower("(source_file"
                + " (package_clause \"package\" (package_identifier \"main\"))"
                + " (function_declaration \"func\" name: (identifier \"main\")"
                + "   parameters: (parameter_list \"(\" \")\")"
                + "   body: (block \"{\""
                + "     (short_var_declaration left: (expression_list (identifier \"x\")) \":=\""
                + "       right: (expression_list (int_literal \"1\")))"
                + "     (inc_statement (identifier \"x\") \"++\")"
                + "   \"}\")))");
        Assertions.assertEquals(Arrays.asList(
                "entry:",
                "%0 = const 1",
                "store_var x %0",
                "%1 = load_var x",
                "%2 = const 1",
                "%3 = binop + %1 %2",
                "store_var x %3"
        ), text);
    }

    @Test
    void testHandledKinds() {
        Assertions.assertTrue(Frontends.profile("go").handledKinds().containsAll(Arrays.asList(
                "for_statement", "assignment_statement", "short_var_declaration", "return_statement",
                "inc_statement", "function_declaration", "expression_switch_statement", "index_expression")));
    }
}
