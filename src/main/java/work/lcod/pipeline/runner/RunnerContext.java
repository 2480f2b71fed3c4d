package work.lcod.pipeline.runner;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call execution limits: an optional deadline and the run's cancellation token.
 */
public record RunnerContext(Optional<Instant> deadline, CancellationToken cancellation) {
    public RunnerContext {
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(cancellation, "cancellation");
    }

    public static RunnerContext unbounded() {
        return new RunnerContext(Optional.empty(), new CancellationToken());
    }

    public static RunnerContext of(Optional<Duration> timeout, CancellationToken cancellation) {
        return new RunnerContext(timeout.map(t -> Instant.now().plus(t)), cancellation);
    }

    public boolean expired() {
        return deadline.map(d -> !Instant.now().isBefore(d)).orElse(false);
    }

    public void ensureNotCancelled() {
        if (cancellation.isCancelled()) {
            throw new RunnerCancelledException("Execution cancelled: " + cancellation.reason());
        }
    }
}
