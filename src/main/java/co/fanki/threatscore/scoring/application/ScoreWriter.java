package co.fanki.threatscore.scoring.application;

import co.fanki.threatscore.scoring.domain.ScoreUpdate;
import co.fanki.threatscore.shared.Preconditions;
import co.fanki.threatscore.suspect.domain.SuspectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Writes computed threat scores back to the suspect store.
 *
 * <p>Every update is independent: a failed write is recorded and the
 * remaining writes still run. Nothing is retried. With a write
 * concurrency above one, updates are issued from a bounded pool since
 * each one targets a different row. When a write deadline is set and
 * passes, unfinished writes are cancelled and reported as failed, and
 * the writes already done are kept.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ScoreWriter {

    private static final Logger LOG = LoggerFactory.getLogger(
            ScoreWriter.class);

    /** Highest score first, then suspect ID ascending. */
    static final Comparator<ScoreUpdate> RANKING = Comparator
            .comparingInt(ScoreUpdate::threatScore).reversed()
            .thenComparing(ScoreUpdate::suspectId);

    private final SuspectRepository suspectRepository;

    private final int concurrency;

    /** Overall write budget; null means unbounded. */
    private final Duration deadline;

    /**
     * Creates a new ScoreWriter from configuration.
     *
     * @param theSuspectRepository the suspect repository
     * @param theConcurrency the maximum number of concurrent writes
     * @param theDeadline the ISO-8601 write deadline, blank for none
     */
    @Autowired
    public ScoreWriter(final SuspectRepository theSuspectRepository,
            @Value("${threat-scoring.write-concurrency:1}")
            final int theConcurrency,
            @Value("${threat-scoring.write-deadline:}")
            final String theDeadline) {
        this(theSuspectRepository, theConcurrency,
                theDeadline == null || theDeadline.isBlank()
                        ? null : Duration.parse(theDeadline));
    }

    /**
     * Creates a new ScoreWriter.
     *
     * @param theSuspectRepository the suspect repository
     * @param theConcurrency the maximum number of concurrent writes
     * @param theDeadline the overall write deadline, null for none
     */
    public ScoreWriter(final SuspectRepository theSuspectRepository,
            final int theConcurrency, final Duration theDeadline) {
        this.suspectRepository = Preconditions.requireNonNull(
                theSuspectRepository, "Suspect repository is required");
        this.concurrency = Preconditions.requirePositive(theConcurrency,
                "Write concurrency must be positive");
        Preconditions.require(theDeadline == null
                || !(theDeadline.isNegative() || theDeadline.isZero()),
                "Write deadline must be positive");
        this.deadline = theDeadline;
    }

    /**
     * Writes every update, collecting failures instead of stopping.
     *
     * @param updates the computed scores
     * @return the outcome of the writes
     */
    public WriteReport write(final List<ScoreUpdate> updates) {
        Preconditions.requireNonNull(updates, "Updates are required");

        if (updates.isEmpty()) {
            return new WriteReport(0, 0, List.of());
        }

        final long startedAt = System.nanoTime();
        final WriteReport report = concurrency == 1
                ? writeSequentially(updates, startedAt)
                : writeConcurrently(updates, startedAt);

        LOG.info("Wrote {} of {} threat scores in {} ms ({} failed)",
                report.updated(), report.attempted(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt),
                report.failed());
        return report;
    }

    /**
     * Ranks updates for the kingpin summary.
     *
     * @param updates the computed scores
     * @param limit the maximum number of entries
     * @return the highest scores first, ties by suspect ID ascending
     */
    public List<ScoreUpdate> rank(final List<ScoreUpdate> updates,
            final int limit) {
        Preconditions.requireNonNull(updates, "Updates are required");
        Preconditions.requireNonNegative(limit, "Limit must not be negative");
        return updates.stream()
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }

    private WriteReport writeSequentially(final List<ScoreUpdate> updates,
            final long startedAt) {
        final List<WriteFailure> failures = new ArrayList<>();
        int updated = 0;

        for (final ScoreUpdate update : updates) {
            if (deadlinePassed(startedAt)) {
                failures.add(deadlineFailure(update));
                continue;
            }
            final WriteFailure failure = writeOne(update);
            if (failure == null) {
                updated++;
            } else {
                failures.add(failure);
            }
        }
        return new WriteReport(updates.size(), updated, failures);
    }

    private WriteReport writeConcurrently(final List<ScoreUpdate> updates,
            final long startedAt) {
        final List<WriteFailure> failures = new ArrayList<>();
        int updated = 0;

        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(concurrency, updates.size()));
        try {
            final List<Future<WriteFailure>> futures = new ArrayList<>(
                    updates.size());
            for (final ScoreUpdate update : updates) {
                futures.add(executor.submit(() -> writeOne(update)));
            }

            for (int i = 0; i < futures.size(); i++) {
                final ScoreUpdate update = updates.get(i);
                final Future<WriteFailure> future = futures.get(i);
                try {
                    final WriteFailure failure = awaitWrite(future, startedAt);
                    if (failure == null) {
                        updated++;
                    } else {
                        failures.add(failure);
                    }
                } catch (final TimeoutException e) {
                    final WriteFailure outcome = cancelOrCollect(future,
                            update, deadlineFailure(update).message());
                    if (outcome == null) {
                        updated++;
                    } else {
                        failures.add(outcome);
                    }
                } catch (final ExecutionException e) {
                    LOG.warn("Failed to update suspect {}: {}",
                            update.suspectId(), e.getCause().getMessage());
                    failures.add(new WriteFailure(update.suspectId(),
                            e.getCause().getMessage()));
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.cancel(true);
                    failures.add(new WriteFailure(update.suspectId(),
                            "Interrupted before the write completed"));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return new WriteReport(updates.size(), updated, failures);
    }

    private WriteFailure awaitWrite(final Future<WriteFailure> future,
            final long startedAt)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (deadline == null) {
            return future.get();
        }
        final long remaining = deadline.toNanos()
                - (System.nanoTime() - startedAt);
        return future.get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
    }

    /**
     * Cancels a write that missed the deadline. A write that completed
     * before it could be cancelled keeps its own outcome.
     *
     * @param future the pending write
     * @param update the update being written
     * @param deadlineMessage the failure message for a cancelled write
     * @return null if the write succeeded, the failure otherwise
     */
    static WriteFailure cancelOrCollect(final Future<WriteFailure> future,
            final ScoreUpdate update, final String deadlineMessage) {
        if (future.cancel(true)) {
            LOG.warn("Cancelled score write for suspect {}: {}",
                    update.suspectId(), deadlineMessage);
            return new WriteFailure(update.suspectId(), deadlineMessage);
        }
        try {
            // Already done, get() does not block.
            return future.get();
        } catch (final CancellationException e) {
            return new WriteFailure(update.suspectId(), deadlineMessage);
        } catch (final ExecutionException e) {
            return new WriteFailure(update.suspectId(),
                    e.getCause().getMessage());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return new WriteFailure(update.suspectId(),
                    "Interrupted before the write completed");
        }
    }

    /** Returns null on success, the failure otherwise. */
    private WriteFailure writeOne(final ScoreUpdate update) {
        try {
            if (suspectRepository.updateThreatScore(update.suspectId(),
                    update.score())) {
                return null;
            }
            LOG.warn("Suspect {} no longer exists, score not written",
                    update.suspectId());
            return new WriteFailure(update.suspectId(), "Suspect not found");
        } catch (final RuntimeException e) {
            LOG.warn("Failed to update suspect {}: {}", update.suspectId(),
                    e.getMessage());
            return new WriteFailure(update.suspectId(), e.getMessage());
        }
    }

    private boolean deadlinePassed(final long startedAt) {
        return deadline != null
                && System.nanoTime() - startedAt >= deadline.toNanos();
    }

    private WriteFailure deadlineFailure(final ScoreUpdate update) {
        return new WriteFailure(update.suspectId(),
                "Write deadline of " + deadline + " exceeded");
    }

    /**
     * A score that could not be computed or written.
     *
     * @param suspectId the suspect ID
     * @param message what went wrong
     */
    public record WriteFailure(String suspectId, String message) {}

    /**
     * Outcome of writing a batch of scores.
     *
     * @param attempted the number of updates handed to the writer
     * @param updated the number of rows written
     * @param failures the updates that were not written
     */
    public record WriteReport(
            int attempted,
            int updated,
            List<WriteFailure> failures
    ) {

        /** Returns the number of failed writes. */
        public int failed() {
            return failures.size();
        }
    }

}
