package modernizer.unit;

import java.util.List;

/**
 * One entry in a unit's transformation history.
 *
 * @param ruleId the rule or strategy that changed the unit
 * @param lines the 1-based lines it touched, ascending
 */
public record AppliedRule(String ruleId, List<Integer> lines) {
    public AppliedRule {
        lines = List.copyOf(lines);
    }
}
