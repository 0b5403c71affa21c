package modernizer.repair;

import java.util.Optional;

/**
 * One targeted rewrite tried on a unit whose outputs still differ.
 */
public interface RepairStrategy {

    String id();

    /**
     * Returns the repaired content, or empty when the strategy has nothing to
     * change in this unit. Implementations never throw for unparseable input;
     * they simply do not apply.
     */
    Optional<String> apply(RepairTarget target);
}
