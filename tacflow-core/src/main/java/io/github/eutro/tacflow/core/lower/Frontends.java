package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.lower.lang.*;

import java.util.*;
import java.util.function.Supplier;

/**
 * The registry of supported languages.
 */
public final class Frontends {
    private Frontends() {
    }

    private static final Map<String, Supplier<LanguageProfile>> FACTORIES = new LinkedHashMap<>();

    static {
        FACTORIES.put("python", PythonProfile::new);
        FACTORIES.put("javascript", JavaScriptProfile::new);
        FACTORIES.put("typescript", TypeScriptProfile::new);
        FACTORIES.put("java", JavaProfile::new);
        FACTORIES.put("ruby", RubyProfile::new);
        FACTORIES.put("go", GoProfile::new);
        FACTORIES.put("php", PhpProfile::new);
        FACTORIES.put("csharp", CSharpProfile::new);
        FACTORIES.put("c", CProfile::new);
        FACTORIES.put("cpp", CppProfile::new);
        FACTORIES.put("rust", RustProfile::new);
        FACTORIES.put("kotlin", KotlinProfile::new);
        FACTORIES.put("scala", ScalaProfile::new);
        FACTORIES.put("lua", LuaProfile::new);
        FACTORIES.put("pascal", PascalProfile::new);
    }

    /**
     * The names of the supported languages, in registration order.
     */
    public static final List<String> SUPPORTED_LANGUAGES = Collections.unmodifiableList(new ArrayList<>(FACTORIES.keySet()));

    private static final Map<String, LanguageProfile> PROFILES = new HashMap<>();

    /**
     * Get the profile of a language. Profiles are frozen on first use and shared.
     *
     * @param language The language name, e.g. {@code "python"}.
     * @return The profile.
     * @throws IllegalArgumentException If the language is not supported.
     */
    public static LanguageProfile profile(String language) {
        Supplier<LanguageProfile> factory = FACTORIES.get(language);
        if (factory == null) {
            throw new IllegalArgumentException(String.format(
                    "unsupported language '%s', expected one of %s", language, SUPPORTED_LANGUAGES));
        }
        synchronized (PROFILES) {
            return PROFILES.computeIfAbsent(language, $ -> factory.get().freeze());
        }
    }

    /**
     * Get a frontend for a language.
     *
     * @param language The language name.
     * @return A frontend which must be given parse trees.
     * @throws IllegalArgumentException If the language is not supported.
     */
    public static DeterministicFrontend get(String language) {
        return new DeterministicFrontend(profile(language));
    }
}
