package modernizer.structural;

import java.util.List;

/**
 * One syntax-preserving rewrite of a parseable unit.
 *
 * <p>A rule inspects the unit through the {@link StructuralContext} and returns
 * its proposed changes grouped by line. It never mutates anything: all edits
 * refer to the unit text the context was built from, and the transformer
 * decides which of them are kept.
 */
public interface StructuralRule {

    /** Stable identifier used in findings and metadata. */
    String id();

    List<LineChange> apply(StructuralContext ctx);
}
