package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.cfg.BuildCfg;
import io.github.eutro.tacflow.core.cfg.MermaidRenderer;
import io.github.eutro.tacflow.core.ir.*;
import io.github.eutro.tacflow.core.passes.Passes;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.eutro.tacflow.test.CfgTest.*;

public class MermaidRendererTest {
    static List<IRInstruction> function() {
        List<IRInstruction> insns = new ArrayList<>(Arrays.asList(
                IRInstruction.label("entry"),
                IRInstruction.branch("end_foo_1", LOC),
                IRInstruction.label("func_foo_0"),
                constant(0, "1"),
                branchIf(0, "a_2", "b_3"),
                IRInstruction.label("a_2"),
                ret(0),
                IRInstruction.label("b_3")
        ));
        for (int i = 1; i <= 6; i++) {
            insns.add(constant(i, Integer.toString(i)));
        }
        insns.add(ret(6));
        insns.add(IRInstruction.label("end_foo_1"));
        insns.add(constant(7, IRNames.functionRef("foo", "func_foo_0")));
        insns.add(call(8, "foo"));
        insns.add(ret(8));
        return insns;
    }

    @Test
    void testFunctionSubgraph() {
        String chart = Passes.TO_MERMAID.run(function());
        Assertions.assertTrue(chart.startsWith("flowchart TD\n"), chart);
        Assertions.assertTrue(chart.contains("    entry([\"entry:<br/>branch end_foo_1\"])\n"), chart);
        Assertions.assertTrue(chart.contains("    subgraph sg_func_foo_0 [\"foo\"]\n"
                + "        func_foo_0{\"func_foo_0:<br/>%0 = const 1<br/>branch_if %0 a_2,b_3\"}\n"
                + "        a_2([\"a_2:<br/>return %0\"])\n"), chart);
        Assertions.assertTrue(chart.contains("        end_foo_1([\"end_foo_1:<br/>"
                + "%7 = const #lt;function:foo@func_foo_0><br/>%8 = call_function foo<br/>return %8\"])\n"
                + "    end\n"), chart);
        Assertions.assertTrue(chart.endsWith("    style entry fill:#28a745,color:#fff\n"), chart);
    }

    @Test
    void testEdges() {
        String chart = Passes.TO_MERMAID.run(function());
        Assertions.assertTrue(chart.contains("    entry --> end_foo_1\n"), chart);
        Assertions.assertTrue(chart.contains("    func_foo_0 -->|T| a_2\n"), chart);
        Assertions.assertTrue(chart.contains("    func_foo_0 -->|F| b_3\n"), chart);
        Assertions.assertTrue(chart.contains("    end_foo_1 -.-> func_foo_0\n"), chart);
    }

    @Test
    void testCollapse() {
        String chart = Passes.TO_MERMAID.run(function());
        Assertions.assertTrue(chart.contains("        b_3([\"b_3:<br/>%1 = const 1<br/>%2 = const 2<br/>%3 = const 3"
                + "<br/>%4 = const 4<br/>... (2 more)<br/>return %6\"])\n"), chart);
        Assertions.assertFalse(chart.contains("%5 = const 5"), chart);
    }

    @Test
    void testClassSubgraph() {
        String chart = Passes.TO_MERMAID.run(Arrays.asList(
                IRInstruction.label("entry"),
                IRInstruction.label("class_Point_0"),
                constant(0, "0"),
                IRInstruction.label("end_class_Point_1"),
                ret(0)
        ));
        Assertions.assertTrue(chart.contains("    subgraph sg_class_Point_0 [\"class Point\"]\n"
                + "        class_Point_0[\"class_Point_0:<br/>%0 = const 0\"]\n"
                + "        end_class_Point_1([\"end_class_Point_1:<br/>return %0\"])\n"
                + "    end\n"), chart);
        Assertions.assertTrue(chart.contains("    class_Point_0 --> end_class_Point_1\n"), chart);
    }

    @Test
    void testFunctionChart() {
        String chart = Passes.functionMermaid("foo").run(function());
        Assertions.assertFalse(chart.contains("entry"), chart);
        Assertions.assertTrue(chart.endsWith("    style func_foo_0 fill:#28a745,color:#fff\n"), chart);
        Assertions.assertTrue(chart.contains("    func_foo_0([\"func_foo_0:"), chart);
    }

    @Test
    void testEscape() {
        Assertions.assertEquals("say #quot;hi#quot; #lt;b>", MermaidRenderer.escape("say \"hi\" <b>"));
        Assertions.assertEquals("end_", MermaidRenderer.nodeId("end"));
        Assertions.assertEquals("END_", MermaidRenderer.nodeId("END"));
        Assertions.assertEquals("end_foo_1", MermaidRenderer.nodeId("end_foo_1"));
        Assertions.assertEquals("a_b_c", MermaidRenderer.nodeId("a.b-c"));
    }

    @Test
    void testNestedSameName() {
        String chart = MermaidRenderer.INSTANCE.run(BuildCfg.INSTANCE.run(Arrays.asList(
                IRInstruction.label("entry"),
                IRInstruction.branch("end_f_1", LOC),
                IRInstruction.label("func_f_0"),
                IRInstruction.branch("end_f_3", LOC),
                IRInstruction.label("func_f_2"),
                constant(0, "1"),
                ret(0),
                IRInstruction.label("end_f_3"),
                ret(0),
                IRInstruction.label("end_f_1"),
                ret(0)
        )));
        Assertions.assertTrue(chart.contains("    subgraph sg_func_f_0 [\"f\"]\n"
                + "        func_f_0[\"func_f_0:<br/>branch end_f_3\"]\n"
                + "        subgraph sg_func_f_2 [\"f\"]\n"
                + "            func_f_2([\"func_f_2:<br/>%0 = const 1<br/>return %0\"])\n"
                + "            end_f_3([\"end_f_3:<br/>return %0\"])\n"
                + "        end\n"
                + "        end_f_1([\"end_f_1:<br/>return %0\"])\n"
                + "    end\n"), chart);
    }
}
