package modernizer.sandbox;

import modernizer.config.ModernizerConfig;

/**
 * One of the two environments a harness runs in.
 *
 * @param id {@code legacy} or {@code modern}
 * @param image container image used by the sandboxed executor
 * @param interpreter interpreter command, used inside the container or locally
 */
public record RuntimeEnvironment(String id, String image, String interpreter) {

    public static final String LEGACY = "legacy";
    public static final String MODERN = "modern";

    public static RuntimeEnvironment legacy(ModernizerConfig config) {
        return new RuntimeEnvironment(LEGACY, config.legacyImage(), config.legacyInterpreter());
    }

    public static RuntimeEnvironment modern(ModernizerConfig config) {
        return new RuntimeEnvironment(MODERN, config.modernImage(), config.modernInterpreter());
    }
}
