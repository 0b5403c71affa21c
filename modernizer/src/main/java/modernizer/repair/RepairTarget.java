package modernizer.repair;

import modernizer.syntax.ParsedSource;
import modernizer.syntax.PyGrammar;
import modernizer.syntax.PySyntaxException;
import modernizer.syntax.SourceText;
import modernizer.syntax.TextEdit;
import modernizer.unit.SourceUnit;
import modernizer.verify.VerificationReport;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A failing unit as seen by the repair strategies.
 *
 * @param unit current content of the unit
 * @param divisionLines lines where a division was rewritten to floor division
 * @param report the latest verification report of the unit
 */
public record RepairTarget(SourceUnit unit, Set<Integer> divisionLines, VerificationReport report) {

    public RepairTarget {
        divisionLines = Set.copyOf(divisionLines);
    }

    /** Parses the unit, or returns empty when it does not parse. */
    public Optional<ParsedSource> parse() {
        try {
            return Optional.of(ParsedSource.parse(SourceText.of(unit.content()), PyGrammar.TRANSITIONAL));
        } catch (PySyntaxException e) {
            return Optional.empty();
        }
    }

    /** Applies edits, returning empty when there are none or the content is unchanged. */
    public Optional<String> rewrite(ParsedSource parsed, List<TextEdit> edits) {
        if (edits.isEmpty()) {
            return Optional.empty();
        }
        String content = parsed.text().apply(edits).render();
        return content.equals(unit.content()) ? Optional.empty() : Optional.of(content);
    }
}
