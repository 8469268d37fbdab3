package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.Opcode;
import io.github.eutro.tacflow.core.lower.Frontends;
import io.github.eutro.tacflow.core.tree.sexp.SExprReader;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Assertions;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class Utils {
    @NotNull
    public static String readResource(String name) throws IOException {
        try (InputStream stream = RosettaTest.class.getResourceAsStream(name)) {
            if (stream == null) throw new IOException("missing resource " + name);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buf = new byte[4096];
            int read;
            while ((read = stream.read(buf)) != -1) {
                out.write(buf, 0, read);
            }
            return new String(out.toByteArray(), StandardCharsets.UTF_8);
        }
    }

    @NotNull
    public static List<IRInstruction> lowerResource(String language, String name) throws IOException {
        return lower(language, readResource(name));
    }

    @NotNull
    public static List<IRInstruction> lower(String language, String tree) {
        return Frontends.get(language).lower(SExprReader.read(tree), tree.getBytes(StandardCharsets.UTF_8));
    }

    public static List<String> labels(List<IRInstruction> insns) {
        return insns.stream()
                .filter($ -> $.getOpcode() == Opcode.LABEL)
                .map(IRInstruction::getLabel)
                .collect(Collectors.toList());
    }

    public static List<IRInstruction> withOpcode(List<IRInstruction> insns, Opcode opcode) {
        List<IRInstruction> found = new ArrayList<>();
        for (IRInstruction insn : insns) {
            if (insn.getOpcode() == opcode) found.add(insn);
        }
        return found;
    }

    public static String dump(List<IRInstruction> insns) {
        return insns.stream().map(IRInstruction::toText).collect(Collectors.joining("\n"));
    }

    public static List<String> lowerText(String language, String tree) {
        return lower(language, tree).stream()
                .map(IRInstruction::toText)
                .collect(Collectors.toList());
    }

    /**
     * Assert that the expected lines appear in the actual text in order, not necessarily adjacent.
     */
    public static void assertContainsInOrder(List<String> actual, String... expected) {
        int from = 0;
        for (String line : expected) {
            int idx = actual.subList(from, actual.size()).indexOf(line);
            Assertions.assertTrue(idx != -1, () -> "missing '" + line + "' in\n" + String.join("\n", actual));
            from += idx + 1;
        }
    }
}
