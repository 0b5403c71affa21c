package modernizer.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The durable audit trail of one pipeline run.
 *
 * <p>A session is created once, then mutated only by appending
 * {@link StageRecord}s and by a single terminal transition to
 * {@link SessionStatus#COMPLETED} or {@link SessionStatus#FAILED}.
 * {@link #toMap()} is what {@code metadata.json} contains.
 */
public final class Session {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final String id;
    private final SessionLayout layout;
    private final String sourceRoot;
    private final Instant startTime;
    private final Map<String, Object> config;
    private final String executor;
    private final List<StageRecord> stages = new ArrayList<>();

    private volatile SessionStatus status = SessionStatus.RUNNING;
    private volatile Instant endTime;
    private volatile String finalOutputStage;
    private volatile String error;
    private volatile String traceback;
    private volatile String failedStage;
    private volatile Map<String, Object> metrics;

    public Session(String id, SessionLayout layout, String sourceRoot, Map<String, Object> config, String executor) {
        this.id = Objects.requireNonNull(id, "id");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.sourceRoot = sourceRoot;
        this.config = Map.copyOf(config);
        this.executor = executor;
        this.startTime = Instant.now();
    }

    public String id() { return id; }

    public SessionLayout layout() { return layout; }

    public SessionStatus status() { return status; }

    public String executor() { return executor; }

    public String error() { return error; }

    public String traceback() { return traceback; }

    public String failedStage() { return failedStage; }

    /** Name of the stage {@code final_output/} currently mirrors, or null. */
    public String finalOutputStage() { return finalOutputStage; }

    public List<StageRecord> stages() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(stages));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Appends a stage record.
     *
     * @throws IllegalStateException if the session already reached a terminal state
     */
    public void append(StageRecord record) {
        lock.writeLock().lock();
        try {
            requireRunning();
            stages.add(record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void finalOutputMirrors(String stage) {
        this.finalOutputStage = stage;
    }

    public void completed(Map<String, Object> sessionMetrics) {
        lock.writeLock().lock();
        try {
            requireRunning();
            this.metrics = sessionMetrics;
            this.endTime = Instant.now();
            this.status = SessionStatus.COMPLETED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void failed(String stage, String message, String trace, Map<String, Object> partialMetrics) {
        lock.writeLock().lock();
        try {
            requireRunning();
            this.failedStage = stage;
            this.error = message != null && !message.isEmpty() ? message : "Unknown error";
            this.traceback = trace;
            this.metrics = partialMetrics;
            this.endTime = Instant.now();
            this.status = SessionStatus.FAILED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void requireRunning() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Session " + id + " is already " + status.label());
        }
    }

    public Map<String, Object> toMap() {
        lock.readLock().lock();
        try {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("session_id", id);
            map.put("status", status.label());
            map.put("source_root", sourceRoot);
            map.put("start_time", startTime.toString());
            map.put("end_time", endTime != null ? endTime.toString() : null);
            map.put("executor", executor);
            map.put("config", config);
            List<Map<String, Object>> stageMaps = new ArrayList<>();
            List<String> completed = new ArrayList<>();
            for (StageRecord r : stages) {
                stageMaps.add(r.toMap());
                if (r.isOk()) {
                    completed.add(r.stage());
                }
            }
            map.put("stages", stageMaps);
            map.put("completed_stages", completed);
            map.put("final_output_stage", finalOutputStage);
            map.put("failed_stage", failedStage);
            map.put("error", error);
            map.put("traceback", traceback);
            if (metrics != null) {
                map.put("metrics", metrics);
            }
            return map;
        } finally {
            lock.readLock().unlock();
        }
    }
}
