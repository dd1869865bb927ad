package com.gt.srs.progress.impl;

import com.gt.srs.model.Progress;
import com.gt.srs.model.ProgressKey;
import com.gt.srs.model.ProgressStatus;
import com.gt.srs.util.TestDatabase;
import com.gt.srs.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
public class ProgressDaoPGTests {

    private static final long TEST_LEARNER_ID = 5;
    private static final long OTHER_LEARNER_ID = 6;
    private static final long TEST_CARD_ID = 10;
    private static final Instant REVIEW_TIME = Instant.parse("2024-03-01T12:00:00Z");

    private ProgressDaoPG progressDao;

    @BeforeEach
    public void setup() {
        TestDatabase.clear();
        for (long cardId = TEST_CARD_ID; cardId < TEST_CARD_ID + 3; cardId++) {
            TestDatabase.insertCard(TestUtils.buildCard(cardId, 4.5));
        }

        progressDao = new ProgressDaoPG(TestDatabase.getTemplate());
    }

    @Test
    public void testSaveProgress_firstInsert() {
        Progress progress = firstReview(TEST_CARD_ID, 2.5);

        assertTrue(progressDao.saveProgress(progress));
        assertEquals(Optional.of(progress), progressDao.loadProgress(progress.key()));
    }

    @Test
    public void testSaveProgress_duplicateFirstInsert() {
        Progress winner = firstReview(TEST_CARD_ID, 2.5);
        Progress loser = firstReview(TEST_CARD_ID, 0.25);

        assertTrue(progressDao.saveProgress(winner));
        assertFalse(progressDao.saveProgress(loser));

        assertEquals(Optional.of(winner), progressDao.loadProgress(winner.key()));
    }

    @Test
    public void testSaveProgress_staleVersion() {
        Progress first = firstReview(TEST_CARD_ID, 2.5);
        Progress winner = nextReview(first, 6.0, "event-2");
        Progress loser = nextReview(first, 0.25, "event-3");

        assertTrue(progressDao.saveProgress(first));
        assertTrue(progressDao.saveProgress(winner));
        assertFalse(progressDao.saveProgress(loser));

        assertEquals(Optional.of(winner), progressDao.loadProgress(first.key()));

        Progress third = nextReview(winner, 14.0, "event-4");
        assertTrue(progressDao.saveProgress(third));
        assertEquals(3, progressDao.loadProgress(first.key()).orElseThrow().version());
    }

    @Test
    public void testSaveProgress_updateWithoutStoredRow() {
        Progress orphan = nextReview(firstReview(TEST_CARD_ID, 2.5), 6.0, null);

        assertFalse(progressDao.saveProgress(orphan));
        assertTrue(progressDao.loadProgress(orphan.key()).isEmpty());
    }

    @Test
    public void testLoadProgress_notReviewed() {
        assertTrue(progressDao.loadProgress(new ProgressKey(TEST_LEARNER_ID, TEST_CARD_ID)).isEmpty());
    }

    @Test
    public void testLoadLearnerProgress() {
        progressDao.saveProgress(firstReview(TEST_CARD_ID + 2, 1.0));
        progressDao.saveProgress(firstReview(TEST_CARD_ID, 2.5));
        progressDao.saveProgress(new Progress(OTHER_LEARNER_ID, TEST_CARD_ID + 1, 2.5, 4.5, REVIEW_TIME,
                REVIEW_TIME.plusSeconds(3 * 86400), 1, 0, ProgressStatus.Learning, 1, null));

        List<Progress> learnerProgress = progressDao.loadLearnerProgress(TEST_LEARNER_ID);

        assertEquals(List.of(TEST_CARD_ID, TEST_CARD_ID + 2), learnerProgress.stream().map(Progress::cardId).toList());
        assertTrue(progressDao.loadLearnerProgress(99).isEmpty());
    }

    private static Progress firstReview(long cardId, double stability) {
        return TestUtils.buildProgress(TEST_LEARNER_ID, cardId, stability, 4.5, REVIEW_TIME, ProgressStatus.Learning, 1, 0);
    }

    private static Progress nextReview(Progress previous, double stability, String reviewEventId) {
        Instant reviewTime = previous.nextDueAt();

        return new Progress(previous.learnerId(), previous.cardId(), stability, previous.difficulty(), reviewTime,
                reviewTime.plusSeconds((long) Math.ceil(stability) * 86400), previous.repetitions() + 1, previous.lapses(),
                ProgressStatus.Reviewing, previous.version() + 1, reviewEventId);
    }
}
