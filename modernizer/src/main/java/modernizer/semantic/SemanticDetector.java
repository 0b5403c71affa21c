package modernizer.semantic;

/**
 * Detects one class of constructs whose meaning changed between dialects and
 * proposes edits for them.
 */
public interface SemanticDetector {

    String id();

    /** Name of the per-unit counter this detector increments, e.g. {@code division_fixes}. */
    String counter();

    Detection detect(SemanticContext ctx);
}
