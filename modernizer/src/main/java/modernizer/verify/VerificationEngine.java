package modernizer.verify;

import modernizer.alert.PipelineAlertLogger;
import modernizer.config.ModernizerConfig;
import modernizer.sandbox.ExecutionRequest;
import modernizer.sandbox.ExecutionResult;
import modernizer.sandbox.Executor;
import modernizer.sandbox.RuntimeEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Runs units in both environments and compares what they print.
 *
 * <p>The legacy side runs the original unit, the modern side the migrated one,
 * each from a workspace prepared by {@link HarnessBuilder}. Units run on a
 * bounded pool and the two sides of a unit run concurrently. A run that times
 * out, or cannot be started, is a mismatch rather than an error.
 */
public final class VerificationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    private final Executor executor;
    private final RuntimeEnvironment legacy;
    private final RuntimeEnvironment modern;
    private final Duration timeout;
    private final OutputComparator comparator;
    private final ExecutorService unitPool;
    private final ExecutorService sidePool;

    public VerificationEngine(Executor executor, ModernizerConfig config) {
        this(executor, RuntimeEnvironment.legacy(config), RuntimeEnvironment.modern(config),
                config.executionTimeout(), config.verificationWorkers(), new OutputComparator());
    }

    VerificationEngine(Executor executor, RuntimeEnvironment legacy, RuntimeEnvironment modern, Duration timeout,
                       int workers, OutputComparator comparator) {
        this.executor = executor;
        this.legacy = legacy;
        this.modern = modern;
        this.timeout = timeout;
        this.comparator = comparator;
        this.unitPool = Executors.newFixedThreadPool(workers, daemonThreads("verify-unit"));
        this.sidePool = Executors.newFixedThreadPool(workers, daemonThreads("verify-side"));
    }

    /**
     * Verifies one unit.
     *
     * @param unit unit path relative to both workspaces
     * @param legacyRoot workspace holding the original tree and the harness
     * @param modernRoot workspace holding the migrated tree and the harness
     * @param pass verification pass number recorded on the report
     */
    public VerificationReport verify(String unit, Path legacyRoot, Path modernRoot, int pass) {
        CompletableFuture<SideRun> legacyRun = CompletableFuture.supplyAsync(
                () -> run(legacy, legacyRoot, unit), sidePool);
        SideRun modernRun = run(modern, modernRoot, unit);
        SideRun legacyResult = legacyRun.join();

        Comparison comparison;
        if (legacyResult.launchError() != null || modernRun.launchError() != null) {
            comparison = new Comparison(false, launchFailure(legacyResult, modernRun));
        } else if (legacyResult.result().timedOut() || modernRun.result().timedOut()) {
            comparison = new Comparison(false, timeoutDetail(legacyResult.result(), modernRun.result()));
        } else {
            comparison = comparator.compare(legacyResult.result().stdout(), modernRun.result().stdout());
        }
        log.debug("Verified {} (pass {}): match={}", unit, pass, comparison.match());
        return VerificationReport.of(unit, pass, legacyResult.result(), modernRun.result(), comparison);
    }

    /**
     * Verifies many units on the worker pool. Units for which {@code executable}
     * is false are reported as manual without being run.
     *
     * @return reports in the order of {@code units}
     */
    public List<VerificationReport> verifyAll(List<String> units, Path legacyRoot, Path modernRoot, int pass,
                                              Predicate<String> executable) {
        List<CompletableFuture<VerificationReport>> futures = new ArrayList<>(units.size());
        for (String unit : units) {
            if (!executable.test(unit)) {
                futures.add(CompletableFuture.completedFuture(
                        VerificationReport.notExecuted(unit, pass, executor.name())));
            } else {
                futures.add(CompletableFuture.supplyAsync(() -> verify(unit, legacyRoot, modernRoot, pass), unitPool));
            }
        }
        List<VerificationReport> reports = new ArrayList<>(futures.size());
        for (CompletableFuture<VerificationReport> f : futures) {
            reports.add(f.join());
        }
        return reports;
    }

    public String executorName() {
        return executor.name();
    }

    @Override
    public void close() {
        unitPool.shutdownNow();
        sidePool.shutdownNow();
    }

    private SideRun run(RuntimeEnvironment env, Path root, String unit) {
        ExecutionRequest request = new ExecutionRequest(env, root, HarnessBuilder.HARNESS_FILE, List.of(unit), timeout);
        try {
            ExecutionResult result = executor.execute(request);
            if (result.timedOut()) {
                PipelineAlertLogger.executionTimeout(unit, env.id(), timeout.toMillis());
            }
            return new SideRun(result, null);
        } catch (IOException e) {
            log.warn("Could not run {} in the {} environment: {}", unit, env.id(), e.getMessage());
            return new SideRun(new ExecutionResult("", e.getMessage(), -1, false, 0, executor.name()), e.getMessage());
        }
    }

    private static String timeoutDetail(ExecutionResult legacy, ExecutionResult modern) {
        if (legacy.timedOut() && modern.timedOut()) {
            return "Execution timed out in both environments";
        }
        return "Execution timed out in the " + (legacy.timedOut() ? "legacy" : "modern") + " environment";
    }

    private static String launchFailure(SideRun legacy, SideRun modern) {
        String side = legacy.launchError() != null ? RuntimeEnvironment.LEGACY : RuntimeEnvironment.MODERN;
        String error = legacy.launchError() != null ? legacy.launchError() : modern.launchError();
        return "Execution failed in the " + side + " environment: " + error;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record SideRun(ExecutionResult result, String launchError) {
    }
}
