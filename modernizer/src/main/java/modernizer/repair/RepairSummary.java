package modernizer.repair;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the repair loop.
 *
 * @param units history of every unit that was failing when repair started
 * @param stillFailing units whose latest report still mismatches
 * @param attempts repair rounds that were followed by a re-verification
 * @param exhausted true when the attempt bound was reached with failures left
 */
public record RepairSummary(List<UnitRepair> units, List<String> stillFailing, int attempts, boolean exhausted) {

    public RepairSummary {
        units = List.copyOf(units);
        stillFailing = List.copyOf(stillFailing);
    }

    public static RepairSummary nothingToRepair() {
        return new RepairSummary(List.of(), List.of(), 0, false);
    }

    public long repairedCount() {
        return units.stream().filter(UnitRepair::repaired).count();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_files", units.size());
        map.put("repaired", repairedCount());
        map.put("still_failing", stillFailing.size());
        map.put("attempts", attempts);
        map.put("exhausted", exhausted);
        return map;
    }
}
