package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.cfg.*;
import io.github.eutro.tacflow.core.ir.*;
import io.github.eutro.tacflow.core.passes.Passes;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.*;

public class CfgTest {
    static final SourceLocation LOC = SourceLocation.UNKNOWN;

    static IRInstruction constant(int reg, String value) {
        return IRInstruction.produce(Opcode.CONST, Reg.of(reg), Collections.singletonList(value), LOC);
    }

    static IRInstruction ret(int reg) {
        return IRInstruction.consume(Opcode.RETURN, Collections.singletonList(Reg.of(reg)), LOC);
    }

    static IRInstruction branchIf(int reg, String ifTrue, String ifFalse) {
        return IRInstruction.branchIf(Reg.of(reg), BranchTargets.of(ifTrue, ifFalse), LOC);
    }

    static IRInstruction call(int reg, String callee) {
        return IRInstruction.produce(Opcode.CALL_FUNCTION, Reg.of(reg), Collections.singletonList(callee), LOC);
    }

    @Test
    void testUnconditional() {
        CFG cfg = Passes.BUILD_CFG.run(Arrays.asList(
                IRInstruction.label("a"),
                IRInstruction.branch("b", LOC),
                IRInstruction.label("b"),
                ret(0)
        ));
        Assertions.assertEquals(Arrays.asList("a", "b"), new ArrayList<>(cfg.blocks.keySet()));
        Assertions.assertEquals("a", cfg.entry);
        Assertions.assertEquals(Collections.singletonList(new Edge("a", "b", EdgeKind.UNCONDITIONAL)), cfg.edges());
        Assertions.assertEquals(Collections.singleton("a"), cfg.getBlock("b").getPredecessors());
        Assertions.assertEquals(Opcode.RETURN, cfg.getBlock("b").getTerminatorOpcode());
    }

    @Test
    void testConditional() {
        CFG cfg = Passes.BUILD_CFG.run(Arrays.asList(
                IRInstruction.label("entry"),
                constant(0, "True"),
                branchIf(0, "yes", "no"),
                IRInstruction.label("yes"),
                IRInstruction.branch("join", LOC),
                IRInstruction.label("no"),
                IRInstruction.label("join"),
                ret(0)
        ));
        List<Edge> edges = cfg.getBlock("entry").getSuccessors();
        Assertions.assertEquals(Arrays.asList(
                new Edge("entry", "yes", EdgeKind.TRUE),
                new Edge("entry", "no", EdgeKind.FALSE)
        ), edges);
        Assertions.assertEquals(Collections.singletonList(new Edge("no", "join", EdgeKind.FALLTHROUGH)),
                cfg.getBlock("no").getSuccessors());
        Assertions.assertEquals(new HashSet<>(Arrays.asList("yes", "no")), cfg.getBlock("join").getPredecessors());
    }

    @Test
    void testUnreachablePruned() {
        List<IRInstruction> insns = Arrays.asList(
                IRInstruction.label("a"),
                IRInstruction.branch("b", LOC),
                IRInstruction.label("b"),
                ret(0),
                IRInstruction.label("dead"),
                constant(1, "1")
        );
        Assertions.assertTrue(BuildCfg.INSTANCE.run(insns).blocks.containsKey("dead"));
        CFG cfg = Passes.BUILD_CFG.run(insns);
        Assertions.assertFalse(cfg.blocks.containsKey("dead"));
        Assertions.assertFalse(Passes.TO_MERMAID.run(insns).contains("dead"));
    }

    @Test
    void testFunctionsAreRoots() {
        CFG cfg = Passes.BUILD_CFG.run(Arrays.asList(
                IRInstruction.label("entry"),
                IRInstruction.branch("end_f_1", LOC),
                IRInstruction.label("func_f_0"),
                ret(0),
                IRInstruction.label("end_f_1"),
                call(1, "f"),
                ret(1),
                IRInstruction.label("orphan_2"),
                ret(1)
        ));
        Assertions.assertEquals(Arrays.asList("entry", "func_f_0", "end_f_1"), new ArrayList<>(cfg.blocks.keySet()));
        Assertions.assertTrue(cfg.edges().contains(new Edge("end_f_1", "func_f_0", EdgeKind.CALL)));
        Assertions.assertTrue(cfg.getBlock("func_f_0").getPredecessors().isEmpty());
    }

    @Test
    void testPrelude() {
        CFG cfg = BuildCfg.INSTANCE.run(Arrays.asList(
                constant(0, "1"),
                IRInstruction.label("next"),
                ret(0)
        ));
        Assertions.assertEquals(BuildCfg.PRELUDE_LABEL, cfg.entry);
        Assertions.assertEquals("__block_0", cfg.entry);
        Assertions.assertEquals(Collections.singletonList(new Edge("__block_0", "next", EdgeKind.FALLTHROUGH)),
                cfg.edges());
    }

    @Test
    void testFirstTerminatorWins() {
        CFG cfg = BuildCfg.INSTANCE.run(Arrays.asList(
                IRInstruction.label("a"),
                ret(0),
                IRInstruction.branch("b", LOC),
                IRInstruction.label("b"),
                ret(0)
        ));
        Assertions.assertTrue(cfg.edges().isEmpty());
    }

    @Test
    void testUnknownTargetDropped() {
        CFG cfg = BuildCfg.INSTANCE.run(Arrays.asList(
                IRInstruction.label("a"),
                IRInstruction.branch("nowhere", LOC)
        ));
        Assertions.assertEquals(1, cfg.blocks.size());
        Assertions.assertTrue(cfg.edges().isEmpty());
    }

    @Test
    void testEmpty() {
        CFG cfg = Passes.BUILD_CFG.run(Collections.emptyList());
        Assertions.assertTrue(cfg.blocks.isEmpty());
        Assertions.assertNull(cfg.entry);
        Assertions.assertEquals("flowchart TD\n", MermaidRenderer.INSTANCE.run(cfg));
    }

    @Test
    void testUnknownBlock() {
        CFG cfg = BuildCfg.INSTANCE.run(Collections.singletonList(IRInstruction.label("a")));
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> cfg.getBlock("b"));
        Assertions.assertEquals("no block labelled 'b'", e.getMessage());
    }
}
