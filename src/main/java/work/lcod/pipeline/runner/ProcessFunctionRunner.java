package work.lcod.pipeline.runner;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.codec.ResourceListCodec;
import work.lcod.pipeline.codec.ResourceListParseException;
import work.lcod.pipeline.model.ResourceCollection;
import work.lcod.pipeline.model.RuntimeDescriptor;

/**
 * Process boundary shared by the exec and container runners: the request goes to stdin as YAML,
 * the response is read from stdout and diagnostics from stderr. Exit status zero means success.
 *
 * <p>Every call gets its own scratch directory and a minimal environment, and the process is
 * killed as soon as the context is cancelled or its deadline passes.
 */
public abstract class ProcessFunctionRunner implements FunctionRunner {
    private static final Logger logger = LoggerFactory.getLogger(ProcessFunctionRunner.class);
    private static final long POLL_MILLIS = 50L;
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();
    private static final ExecutorService IO = Executors.newCachedThreadPool(runnable -> {
        var thread = new Thread(runnable, "lcod-fn-io-" + THREAD_IDS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    /**
     * Full command line for {@code runtime}, run with {@code workDir} as working directory.
     */
    protected abstract List<String> command(RuntimeDescriptor runtime, Path workDir);

    /**
     * Environment of the spawned process. Defaults to {@code PATH} plus the declared variables.
     */
    protected Map<String, String> environment(RuntimeDescriptor runtime) {
        var env = new LinkedHashMap<String, String>();
        var path = System.getenv("PATH");
        if (path != null) {
            env.put("PATH", path);
        }
        return env;
    }

    @Override
    public RunnerResponse run(RuntimeDescriptor runtime, ResourceCollection request, RunnerContext context) {
        context.ensureNotCancelled();
        if (context.expired()) {
            throw new RunnerCancelledException("Deadline exceeded before starting " + runtime.reference());
        }
        var payload = ResourceListCodec.encode(request).getBytes(StandardCharsets.UTF_8);
        Path workDir;
        try {
            workDir = Files.createTempDirectory("lcod-fn-");
        } catch (IOException ex) {
            throw new RunnerInvocationException("Unable to create scratch directory: " + ex.getMessage(), ex);
        }
        try {
            return execute(runtime, payload, workDir, context);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private RunnerResponse execute(RuntimeDescriptor runtime, byte[] payload, Path workDir, RunnerContext context) {
        var command = command(runtime, workDir);
        var builder = new ProcessBuilder(command).directory(workDir.toFile());
        builder.environment().clear();
        builder.environment().putAll(environment(runtime));
        logger.debug("Starting {}", command);

        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new RunnerInvocationException("Unable to start " + runtime.reference() + ": " + ex.getMessage(), ex);
        }

        var stdin = CompletableFuture.runAsync(() -> feed(process.getOutputStream(), payload), IO);
        var stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), IO);
        var stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), IO);

        try {
            while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (context.cancellation().isCancelled()) {
                    kill(process);
                    throw new RunnerCancelledException(
                        "Cancelled while running " + runtime.reference() + ": " + context.cancellation().reason()
                    );
                }
                if (context.expired()) {
                    kill(process);
                    throw new RunnerCancelledException("Deadline exceeded while running " + runtime.reference());
                }
            }
        } catch (InterruptedException ex) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new RunnerCancelledException("Interrupted while running " + runtime.reference());
        }

        int exitCode = process.exitValue();
        String output;
        String diagnostics;
        try {
            stdin.get();
            output = stdout.get();
            diagnostics = stderr.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RunnerCancelledException("Interrupted while collecting output of " + runtime.reference());
        } catch (ExecutionException ex) {
            throw new RunnerInvocationException("Unable to collect output of " + runtime.reference(), ex.getCause());
        }
        logger.debug("{} exited with {}", runtime.reference(), exitCode);
        return toResponse(output, exitCode, diagnostics);
    }

    static RunnerResponse toResponse(String output, int exitCode, String diagnostics) {
        if (output == null || output.isBlank()) {
            return RunnerResponse.unparsable("function produced no output", exitCode, diagnostics);
        }
        try {
            return RunnerResponse.of(ResourceListCodec.decode(output), exitCode, diagnostics);
        } catch (ResourceListParseException ex) {
            return RunnerResponse.unparsable(ex.getMessage(), exitCode, diagnostics);
        }
    }

    private static void feed(OutputStream stdin, byte[] payload) {
        try (stdin) {
            stdin.write(payload);
        } catch (IOException ex) {
            // A function may exit without reading its input; its exit status tells the rest.
            logger.debug("Function closed stdin early: {}", ex.getMessage());
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new RunnerInvocationException("Unable to read function output: " + ex.getMessage(), ex);
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void deleteQuietly(Path root) {
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            logger.warn("Unable to delete scratch directory {}: {}", root, ex.getMessage());
        }
    }
}
