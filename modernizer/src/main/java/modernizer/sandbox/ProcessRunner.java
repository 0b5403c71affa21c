package modernizer.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts an external process and collects its output within a timeout.
 *
 * <p>Both output streams are drained concurrently so a chatty process cannot
 * block on a full pipe. Standard input is closed immediately. On timeout the
 * process is destroyed forcibly and the result carries {@code timedOut=true}.
 */
public final class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private static final ExecutorService DRAINERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "modernizer-process-drain");
        t.setDaemon(true);
        return t;
    });

    private static final long DRAIN_GRACE_MS = 2_000;

    private ProcessRunner() {}

    public static ExecutionResult run(List<String> command, Path workDir, Duration timeout, String executorName)
            throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        log.debug("Running {} in {}", command, workDir);

        long start = System.nanoTime();
        Process process = pb.start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + command.get(0), e);
        }

        if (!finished) {
            process.destroyForcibly();
            long elapsed = elapsedMillis(start);
            log.warn("Process {} timed out after {} ms", command.get(0), timeout.toMillis());
            return ExecutionResult.timeout(collect(stdout), elapsed, executorName);
        }

        return new ExecutionResult(collect(stdout), collect(stderr), process.exitValue(), false,
                elapsedMillis(start), executorName);
    }

    private static CompletableFuture<String> drain(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (in) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, DRAINERS);
    }

    private static String collect(CompletableFuture<String> future) {
        try {
            return future.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException e) {
            log.debug("Output stream closed abruptly: {}", e.getCause().getMessage());
            return "";
        }
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
