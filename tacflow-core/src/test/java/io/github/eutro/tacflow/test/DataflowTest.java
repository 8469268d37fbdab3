package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.analysis.BlockFacts;
import io.github.eutro.tacflow.core.analysis.DataflowResult;
import io.github.eutro.tacflow.core.analysis.Definition;
import io.github.eutro.tacflow.core.cfg.BuildCfg;
import io.github.eutro.tacflow.core.ir.*;
import io.github.eutro.tacflow.core.passes.Passes;
import io.github.eutro.tacflow.core.passes.meta.AnalyzeDataflow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.tacflow.test.CfgTest.*;

public class DataflowTest {
    static IRInstruction storeVar(String name, int reg) {
        return IRInstruction.consume(Opcode.STORE_VAR, Arrays.asList(name, Reg.of(reg)), LOC);
    }

    static IRInstruction loadVar(int reg, String name) {
        return IRInstruction.produce(Opcode.LOAD_VAR, Reg.of(reg), Collections.singletonList(name), LOC);
    }

    static IRInstruction binop(int reg, String op, int lhs, int rhs) {
        return IRInstruction.produce(Opcode.BINOP, Reg.of(reg), Arrays.asList(op, Reg.of(lhs), Reg.of(rhs)), LOC);
    }

    static DataflowResult analyse(IRInstruction... insns) {
        return AnalyzeDataflow.INSTANCE.run(BuildCfg.INSTANCE.run(Arrays.asList(insns)));
    }

    static Definition def(String variable, String block, int index) {
        return new Definition(variable, block, index, IRInstruction.label(block));
    }

    static Set<Definition> defs(Definition... defs) {
        return new HashSet<>(Arrays.asList(defs));
    }

    @Test
    void testSingleBlock() {
        DataflowResult result = analyse(
                IRInstruction.label("entry"),
                constant(0, "1"),
                storeVar("x", 0),
                loadVar(1, "x"),
                ret(1));
        Assertions.assertEquals(Arrays.asList(def("%0", "entry", 0), def("x", "entry", 1), def("%1", "entry", 2)),
                result.definitions);
        Assertions.assertEquals(Collections.singletonList(def("x", "entry", 1)),
                result.reachingDefinitions("x", "entry", 2));
        Assertions.assertEquals(Collections.singletonList(def("%1", "entry", 2)),
                result.reachingDefinitions("%1", "entry", 3));
        BlockFacts facts = result.blockFacts.get("entry");
        Assertions.assertTrue(facts.reachIn.isEmpty());
        Assertions.assertEquals(defs(def("%0", "entry", 0), def("x", "entry", 1), def("%1", "entry", 2)),
                facts.reachOut);
    }

    @Test
    void testRedefinitionKills() {
        DataflowResult result = analyse(
                IRInstruction.label("entry"),
                constant(0, "1"),
                storeVar("x", 0),
                IRInstruction.branch("next", LOC),
                IRInstruction.label("next"),
                constant(1, "2"),
                storeVar("x", 1),
                loadVar(2, "x"),
                ret(2));
        BlockFacts next = result.blockFacts.get("next");
        Assertions.assertTrue(next.kill.contains(def("x", "entry", 1)));
        Assertions.assertTrue(next.reachIn.contains(def("x", "entry", 1)));
        Assertions.assertTrue(next.reachOut.contains(def("x", "next", 1)));
        Assertions.assertFalse(next.reachOut.contains(def("x", "entry", 1)));
        Assertions.assertEquals(Collections.singletonList(def("x", "next", 1)),
                result.reachingDefinitions("x", "next", 2));
    }

    @Test
    void testBranchesMerge() {
        DataflowResult result = analyse(
                IRInstruction.label("entry"),
                constant(0, "True"),
                branchIf(0, "a", "b"),
                IRInstruction.label("a"),
                constant(1, "1"),
                storeVar("x", 1),
                IRInstruction.branch("join", LOC),
                IRInstruction.label("b"),
                constant(2, "2"),
                storeVar("x", 2),
                IRInstruction.branch("join", LOC),
                IRInstruction.label("join"),
                loadVar(3, "x"),
                ret(3));
        Assertions.assertEquals(defs(def("x", "a", 1), def("x", "b", 1)),
                new HashSet<>(result.reachingDefinitions("x", "join", 0)));
        Assertions.assertEquals(defs(def("%0", "entry", 0)),
                new HashSet<>(result.reachingDefinitions("%0", "entry", 1)));
    }

    static IRInstruction[] countingLoop() {
        return new IRInstruction[]{
                IRInstruction.label("entry"),
                constant(0, "0"),
                storeVar("i", 0),
                IRInstruction.branch("cond", LOC),
                IRInstruction.label("cond"),
                loadVar(1, "i"),
                constant(2, "10"),
                binop(3, "<", 1, 2),
                branchIf(3, "body", "end"),
                IRInstruction.label("body"),
                loadVar(4, "i"),
                constant(5, "1"),
                binop(6, "+", 4, 5),
                storeVar("i", 6),
                IRInstruction.branch("cond", LOC),
                IRInstruction.label("end"),
                loadVar(7, "i"),
                ret(7),
        };
    }

    @Test
    void testLoop() {
        DataflowResult result = analyse(countingLoop());
        Set<Definition> both = defs(def("i", "entry", 1), def("i", "body", 3));
        Assertions.assertEquals(both, new HashSet<>(result.reachingDefinitions("i", "cond", 0)));
        Assertions.assertEquals(both, new HashSet<>(result.reachingDefinitions("i", "body", 0)));
        Assertions.assertEquals(both, new HashSet<>(result.reachingDefinitions("i", "end", 0)));
        Assertions.assertTrue(result.blockFacts.get("body").kill.contains(def("i", "entry", 1)));
    }

    @Test
    void testDependencies() {
        DataflowResult result = analyse(
                IRInstruction.label("entry"),
                constant(0, "1"),
                storeVar("a", 0),
                loadVar(1, "a"),
                constant(2, "1"),
                binop(3, "+", 1, 2),
                storeVar("b", 3),
                loadVar(4, "b"),
                constant(5, "2"),
                binop(6, "*", 4, 5),
                storeVar("c", 6),
                ret(6));
        Assertions.assertEquals(Collections.emptySet(), result.dependenciesOf("a"));
        Assertions.assertEquals(Collections.singleton("a"), result.dependenciesOf("b"));
        Assertions.assertEquals(new HashSet<>(Arrays.asList("a", "b")), result.dependenciesOf("c"));
        Assertions.assertEquals(Collections.emptySet(), result.dependenciesOf("nope"));
        Assertions.assertEquals(Arrays.asList("a", "b", "c"), new ArrayList<>(result.dependencyGraph.keySet()));
    }

    @Test
    void testLoopSelfDependency() {
        DataflowResult result = analyse(countingLoop());
        Assertions.assertEquals(Collections.singleton("i"), result.dependenciesOf("i"));
    }

    @Test
    void testLoweredSource() {
        DataflowResult result = Passes.DATAFLOW.run(Utils.lower("python", "(module"
                + " (expression_statement (assignment left: (identifier \"x\") \"=\" right: (integer \"1\")))"
                + " (expression_statement (assignment left: (identifier \"y\") \"=\""
                + "   right: (binary_operator left: (identifier \"x\") operator: \"+\" right: (integer \"2\")))))"));
        Assertions.assertEquals(Collections.singleton("x"), result.dependenciesOf("y"));
        Assertions.assertEquals(Collections.singletonList(def("x", "entry", 1)),
                result.reachingDefinitions("x", "entry", 2));
    }
}
