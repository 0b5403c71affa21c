package modernizer.semantic;

import modernizer.syntax.TextEdit;

import java.util.List;

/**
 * What one detector found in one unit.
 *
 * @param edits proposed edits against the unit text
 * @param count number of constructs rewritten
 * @param warnings constructs noticed but left alone
 */
public record Detection(List<TextEdit> edits, int count, List<String> warnings) {

    public Detection {
        edits = List.copyOf(edits);
        warnings = List.copyOf(warnings);
    }

    public static Detection none() {
        return new Detection(List.of(), 0, List.of());
    }
}
