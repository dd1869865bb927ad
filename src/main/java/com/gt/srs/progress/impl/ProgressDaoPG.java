package com.gt.srs.progress.impl;

import com.gt.srs.model.Progress;
import com.gt.srs.model.ProgressKey;
import com.gt.srs.model.ProgressStatus;
import com.gt.srs.progress.ProgressDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ProgressDaoPG implements ProgressDao {

    private static final Logger log = LoggerFactory.getLogger(ProgressDaoPG.class);

    public static final String PROGRESS_COLUMNS =
            "p.learner_id, p.card_id, p.stability, p.difficulty, p.last_review_at, p.next_due_at, p.repetitions, p.lapses, p.status, p.version, p.last_review_event_id ";

    private static final String LOAD_PROGRESS_SQL =
            "SELECT " + PROGRESS_COLUMNS +
            "FROM card_progress p " +
            "WHERE p.learner_id = :learnerId AND p.card_id = :cardId";

    private static final String LOAD_LEARNER_PROGRESS_SQL =
            "SELECT " + PROGRESS_COLUMNS +
            "FROM card_progress p " +
            "WHERE p.learner_id = :learnerId " +
            "ORDER BY p.card_id";

    private static final String INSERT_PROGRESS_SQL =
            "INSERT INTO card_progress " +
                    "(learner_id, card_id, stability, difficulty, last_review_at, next_due_at, repetitions, lapses, status, version, last_review_event_id, update_instant) " +
                    "VALUES (:learnerId, :cardId, :stability, :difficulty, :lastReviewAt, :nextDueAt, :repetitions, :lapses, :status, :version, :lastReviewEventId, now()) " +
            "ON CONFLICT (learner_id, card_id) DO NOTHING";

    private static final String UPDATE_PROGRESS_SQL =
            "UPDATE card_progress " +
            "SET stability = :stability, difficulty = :difficulty, last_review_at = :lastReviewAt, next_due_at = :nextDueAt, " +
                    "repetitions = :repetitions, lapses = :lapses, status = :status, version = :version, last_review_event_id = :lastReviewEventId, " +
                    "update_instant = now() " +
            "WHERE learner_id = :learnerId AND card_id = :cardId AND version = :expectedVersion";

    private final NamedParameterJdbcTemplate template;

    public ProgressDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Optional<Progress> loadProgress(ProgressKey key) {
        List<Progress> progress = template.query(LOAD_PROGRESS_SQL,
                Map.of("learnerId", key.learnerId(), "cardId", key.cardId()),
                ProgressDaoPG::getProgressFromResultSet);

        return progress.stream().findFirst();
    }

    @Override
    public boolean saveProgress(Progress progress) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("learnerId", progress.learnerId())
                .addValue("cardId", progress.cardId())
                .addValue("stability", progress.stability())
                .addValue("difficulty", progress.difficulty())
                .addValue("lastReviewAt", toTimestamp(progress.lastReviewAt()))
                .addValue("nextDueAt", toTimestamp(progress.nextDueAt()))
                .addValue("repetitions", progress.repetitions())
                .addValue("lapses", progress.lapses())
                .addValue("status", progress.status().getStatusValue())
                .addValue("version", progress.version())
                .addValue("lastReviewEventId", progress.lastReviewEventId())
                .addValue("expectedVersion", progress.version() - 1);

        int rowsUpdated = progress.version() <= 1
                ? template.update(INSERT_PROGRESS_SQL, params)
                : template.update(UPDATE_PROGRESS_SQL, params);

        if (rowsUpdated == 0) {
            log.warn("Progress for {} was not saved. Expected stored version {}.", progress.key(), progress.version() - 1);
        }

        return rowsUpdated == 1;
    }

    @Override
    public List<Progress> loadLearnerProgress(long learnerId) {
        return template.query(LOAD_LEARNER_PROGRESS_SQL, Map.of("learnerId", learnerId), ProgressDaoPG::getProgressFromResultSet);
    }

    public static Progress getProgressFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new Progress(
                rs.getLong("learner_id"),
                rs.getLong("card_id"),
                rs.getDouble("stability"),
                rs.getDouble("difficulty"),
                toInstant(rs.getTimestamp("last_review_at")),
                toInstant(rs.getTimestamp("next_due_at")),
                rs.getInt("repetitions"),
                rs.getInt("lapses"),
                ProgressStatus.fromStatusValue(rs.getString("status")),
                rs.getLong("version"),
                rs.getString("last_review_event_id"));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
