package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.ir.IRStats;
import io.github.eutro.tacflow.core.lower.DeterministicFrontend;
import io.github.eutro.tacflow.core.lower.Frontends;
import io.github.eutro.tacflow.core.lower.LanguageProfile;
import io.github.eutro.tacflow.core.lower.lang.PythonProfile;
import io.github.eutro.tacflow.core.tree.sexp.SExprReader;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

public class FrontendsTest {
    @Test
    void testLanguages() {
        Assertions.assertEquals(Arrays.asList("python", "javascript", "typescript", "java", "ruby", "go", "php",
                "csharp", "c", "cpp", "rust", "kotlin", "scala", "lua", "pascal"), Frontends.SUPPORTED_LANGUAGES);
        for (String lang : Frontends.SUPPORTED_LANGUAGES) {
            Assertions.assertEquals(lang, Frontends.profile(lang).name);
            Assertions.assertSame(Frontends.profile(lang), Frontends.get(lang).getProfile());
        }
    }

    @Test
    void testUnknownLanguage() {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> Frontends.get("cobol"));
        Assertions.assertTrue(e.getMessage().startsWith("unsupported language 'cobol', expected one of [python, "),
                e.getMessage());
    }

    @Test
    void testParserRequired() {
        byte[] source = "(module (integer \"1\"))".getBytes(StandardCharsets.UTF_8);
        DeterministicFrontend frontend = Frontends.get("python");
        Assertions.assertThrows(IllegalArgumentException.class, () -> frontend.lower(null, source));

        List<IRInstruction> insns = frontend.withParser(SExprReader.INSTANCE).lower(null, source);
        Assertions.assertEquals(2, insns.size());
        Assertions.assertEquals("%0 = const 1", insns.get(1).toText());
    }

    @Test
    void testDeterministic() throws Throwable {
        for (String lang : Frontends.SUPPORTED_LANGUAGES) {
            String tree = Utils.readResource("/rosetta/gcd/" + lang + ".sexp");
            Assertions.assertEquals(Utils.lower(lang, tree), Utils.lower(lang, tree), lang);
        }
    }

    @Test
    void testEmptyProgram() {
        for (String lang : Frontends.SUPPORTED_LANGUAGES) {
            List<IRInstruction> insns = Utils.lower(lang, "(program)");
            Assertions.assertEquals(1, insns.size(), lang);
            Assertions.assertEquals(0, IRStats.countUnsupported(insns));
        }
    }

    static class OpenPythonProfile extends PythonProfile {
        void addNoise(String kind) {
            noiseTypes.add(kind);
        }

        void registerIgnored(String kind) {
            ignore(kind);
        }
    }

    @Test
    void testSharedProfilesAreFrozen() {
        LanguageProfile python = Frontends.profile("python");
        Assertions.assertTrue(python.isFrozen());
        Assertions.assertThrows(IllegalStateException.class, () -> python.literals.setDefaultReturn("HACKED"));
        Assertions.assertThrows(IllegalStateException.class, () -> python.fields.setFuncName("title"));
        Assertions.assertEquals("None", python.literals.defaultReturn());

        List<String> text = PythonLoweringTest.lower("(module (function_definition \"def\" name: (identifier \"g\")"
                + " parameters: (parameters \"(\" \")\") \":\""
                + " body: (block (return_statement \"return\"))))");
        Assertions.assertTrue(text.contains("%0 = const None"), () -> String.join("\n", text));
        Assertions.assertTrue(text.contains("return %0"), () -> String.join("\n", text));
    }

    @Test
    void testFrozenKindSets() {
        OpenPythonProfile profile = new OpenPythonProfile();
        Assertions.assertFalse(profile.isFrozen());
        profile.addNoise("ellipsis");
        Assertions.assertTrue(profile.isSkipped("ellipsis"));

        Assertions.assertSame(profile, profile.freeze());
        Assertions.assertSame(profile, profile.freeze());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> profile.addNoise("return_statement"));
        Assertions.assertThrows(IllegalStateException.class, () -> profile.registerIgnored("return_statement"));
        Assertions.assertFalse(profile.isSkipped("return_statement"));
        Assertions.assertNotNull(profile.statementHandler("return_statement"));
    }

    @Test
    void testFrontendFreezesItsProfile() {
        PythonProfile profile = new PythonProfile();
        DeterministicFrontend frontend = new DeterministicFrontend(profile, SExprReader.INSTANCE);
        Assertions.assertTrue(profile.isFrozen());
        Assertions.assertSame(profile, frontend.getProfile());
    }
}
