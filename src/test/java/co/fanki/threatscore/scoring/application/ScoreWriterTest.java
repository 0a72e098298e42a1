package co.fanki.threatscore.scoring.application;

import co.fanki.threatscore.scoring.application.ScoreWriter.WriteFailure;
import co.fanki.threatscore.scoring.application.ScoreWriter.WriteReport;
import co.fanki.threatscore.scoring.domain.ScoreUpdate;
import co.fanki.threatscore.suspect.domain.SuspectRepository;
import co.fanki.threatscore.suspect.domain.ThreatScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ScoreWriter.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ScoreWriterTest {

    private SuspectRepository suspectRepository;

    @BeforeEach
    void setUp() {
        suspectRepository = createMock(SuspectRepository.class);
    }

    @Test
    void whenWriting_givenAllWritesSucceed_shouldReportAllUpdated() {
        expect(suspectRepository.updateThreatScore("s-1", ThreatScore.of(80)))
                .andReturn(true);
        expect(suspectRepository.updateThreatScore("s-2", ThreatScore.of(20)))
                .andReturn(true);
        replay(suspectRepository);

        final WriteReport report = writer(1)
                .write(List.of(update("s-1", 80), update("s-2", 20)));

        assertEquals(2, report.attempted());
        assertEquals(2, report.updated());
        assertEquals(0, report.failed());
        verify(suspectRepository);
    }

    @Test
    void whenWriting_givenOneWriteFails_shouldContinueWithTheRest() {
        expect(suspectRepository.updateThreatScore("s-1", ThreatScore.of(80)))
                .andReturn(true);
        expect(suspectRepository.updateThreatScore("s-2", ThreatScore.of(50)))
                .andThrow(new IllegalStateException("connection reset"));
        expect(suspectRepository.updateThreatScore("s-3", ThreatScore.of(10)))
                .andReturn(true);
        replay(suspectRepository);

        final WriteReport report = writer(1)
                .write(List.of(update("s-1", 80), update("s-2", 50),
                        update("s-3", 10)));

        assertEquals(2, report.updated());
        assertEquals(List.of(new WriteFailure("s-2", "connection reset")),
                report.failures());
        verify(suspectRepository);
    }

    @Test
    void whenWriting_givenDeletedSuspect_shouldReportNotFound() {
        expect(suspectRepository.updateThreatScore("gone", ThreatScore.of(30)))
                .andReturn(false);
        replay(suspectRepository);

        final WriteReport report = writer(1)
                .write(List.of(update("gone", 30)));

        assertEquals(0, report.updated());
        assertEquals("Suspect not found", report.failures().get(0).message());
        verify(suspectRepository);
    }

    @Test
    void whenWriting_givenNoUpdates_shouldNotTouchRepository() {
        replay(suspectRepository);

        final WriteReport report = writer(4)
                .write(List.of());

        assertEquals(0, report.attempted());
        verify(suspectRepository);
    }

    @Test
    void whenWritingConcurrently_givenMixedOutcomes_shouldReportInInputOrder() {
        final List<ScoreUpdate> updates = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            updates.add(update("s-" + i, i * 10));
        }
        expect(suspectRepository.updateThreatScore(eq("s-3"),
                anyObject(ThreatScore.class)))
                .andThrow(new IllegalStateException("deadlock detected"));
        expect(suspectRepository.updateThreatScore(eq("s-7"),
                anyObject(ThreatScore.class)))
                .andReturn(false);
        expect(suspectRepository.updateThreatScore(anyString(),
                anyObject(ThreatScore.class)))
                .andReturn(true).times(8);
        replay(suspectRepository);

        final WriteReport report = writer(4)
                .write(updates);

        assertEquals(10, report.attempted());
        assertEquals(8, report.updated());
        assertEquals(List.of(
                new WriteFailure("s-3", "deadlock detected"),
                new WriteFailure("s-7", "Suspect not found")),
                report.failures());
        verify(suspectRepository);
    }

    @Test
    void whenWriting_givenDeadlinePassed_shouldFailRemainingWrites() {
        expect(suspectRepository.updateThreatScore("s-1", ThreatScore.of(90)))
                .andAnswer(() -> {
                    Thread.sleep(200);
                    return true;
                });
        replay(suspectRepository);

        final WriteReport report = new ScoreWriter(suspectRepository, 1,
                Duration.ofMillis(50))
                .write(List.of(update("s-1", 90), update("s-2", 60),
                        update("s-3", 30)));

        assertEquals(1, report.updated());
        assertEquals(2, report.failed());
        assertTrue(report.failures().get(0).message()
                .startsWith("Write deadline of"));
        verify(suspectRepository);
    }

    @Test
    void whenWritingConcurrently_givenSlowWrite_shouldCancelItAtDeadline() {
        expect(suspectRepository.updateThreatScore("fast", ThreatScore.of(90)))
                .andReturn(true);
        expect(suspectRepository.updateThreatScore("slow", ThreatScore.of(60)))
                .andAnswer(() -> {
                    Thread.sleep(5000);
                    return true;
                });
        replay(suspectRepository);

        final WriteReport report = new ScoreWriter(suspectRepository, 2,
                Duration.ofMillis(300))
                .write(List.of(update("fast", 90), update("slow", 60)));

        assertEquals(1, report.updated());
        assertEquals("slow", report.failures().get(0).suspectId());
        assertTrue(report.failures().get(0).message()
                .startsWith("Write deadline of"));
    }

    @Test
    void whenCancelling_givenWriteAlreadyDone_shouldKeepItsOutcome() {
        final CompletableFuture<WriteFailure> succeeded =
                CompletableFuture.completedFuture(null);
        final CompletableFuture<WriteFailure> notFound =
                CompletableFuture.completedFuture(
                        new WriteFailure("s-2", "Suspect not found"));

        assertNull(ScoreWriter.cancelOrCollect(succeeded,
                update("s-1", 40), "deadline"));
        assertEquals("Suspect not found", ScoreWriter.cancelOrCollect(
                notFound, update("s-2", 40), "deadline").message());
    }

    @Test
    void whenCancelling_givenWriteStillRunning_shouldReportDeadline() {
        final CompletableFuture<WriteFailure> pending =
                new CompletableFuture<>();

        final WriteFailure failure = ScoreWriter.cancelOrCollect(pending,
                update("s-1", 40), "deadline");

        assertEquals("s-1", failure.suspectId());
        assertEquals("deadline", failure.message());
        assertTrue(pending.isCancelled());
    }

    @Test
    void whenRanking_givenTies_shouldOrderBySuspectId() {
        final ScoreWriter writer = writer(1);

        final List<ScoreUpdate> ranked = writer.rank(List.of(
                update("b", 50),
                update("z", 80),
                update("a", 50),
                update("c", 10)), 3);

        assertEquals(List.of("z", "a", "b"), ranked.stream()
                .map(ScoreUpdate::suspectId)
                .toList());
    }

    @Test
    void whenRanking_givenLimitAboveSize_shouldReturnAll() {
        final ScoreWriter writer = writer(1);

        assertEquals(2, writer.rank(List.of(update("a", 1),
                update("b", 2)), 5).size());
    }

    @Test
    void whenCreating_givenInvalidSettings_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ScoreWriter(suspectRepository, 0, (Duration) null));
        assertThrows(IllegalArgumentException.class,
                () -> new ScoreWriter(suspectRepository, 1, Duration.ZERO));
    }

    @Test
    void whenCreating_givenBlankDeadlineProperty_shouldHaveNoDeadline() {
        expect(suspectRepository.updateThreatScore("s-1", ThreatScore.of(5)))
                .andReturn(true);
        replay(suspectRepository);

        final WriteReport report = new ScoreWriter(suspectRepository, 1, "")
                .write(List.of(update("s-1", 5)));

        assertEquals(1, report.updated());
        verify(suspectRepository);
    }

    private ScoreWriter writer(final int concurrency) {
        return new ScoreWriter(suspectRepository, concurrency,
                (Duration) null);
    }

    private static ScoreUpdate update(final String suspectId,
            final int score) {
        return new ScoreUpdate(suspectId, ThreatScore.of(score));
    }

}
