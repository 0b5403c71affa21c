package modernizer.repair;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Repair history of one unit that was failing when repair started.
 */
public final class UnitRepair {

    /**
     * One strategy application and the verdict of the re-verification that
     * followed it.
     */
    public record Applied(String strategy, boolean success, String diffAfter) {
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("strategy", strategy);
            map.put("success", success);
            map.put("diff_after", diffAfter);
            return map;
        }
    }

    private final String unit;
    private final List<Applied> applied = new ArrayList<>();
    private boolean repaired;

    UnitRepair(String unit) {
        this.unit = unit;
    }

    void record(Applied attempt) {
        applied.add(attempt);
        repaired = attempt.success();
    }

    public String unit() {
        return unit;
    }

    public List<Applied> applied() {
        return List.copyOf(applied);
    }

    public boolean repaired() {
        return repaired;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file_path", unit);
        map.put("applied", applied.stream().map(Applied::toMap).toList());
        map.put("repaired", repaired);
        return map;
    }
}
