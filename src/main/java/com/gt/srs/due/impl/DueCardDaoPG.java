package com.gt.srs.due.impl;

import com.gt.srs.card.impl.CardDaoPG;
import com.gt.srs.due.DueCard;
import com.gt.srs.due.DueCardDao;
import com.gt.srs.progress.impl.ProgressDaoPG;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class DueCardDaoPG implements DueCardDao {

    // Backed by the (learner_id, next_due_at) index on card_progress
    private static final String LOAD_DUE_REVIEW_BATCH_SQL =
            "SELECT " + ProgressDaoPG.PROGRESS_COLUMNS + ", " + CardDaoPG.CARD_COLUMNS +
            "FROM card_progress p JOIN card c ON c.id = p.card_id " +
            "WHERE p.learner_id = :learnerId AND p.next_due_at <= :now AND (:scope = '' OR c.scope = :scope) " +
                    "AND (:firstBatch OR p.next_due_at > :afterNextDueAt OR (p.next_due_at = :afterNextDueAt AND p.card_id > :afterCardId)) " +
            "ORDER BY p.next_due_at ASC, p.card_id ASC " +
            "LIMIT :batchSize";

    private static final String NEW_CARD_CONDITION_SQL =
            "c.scope IN (SELECT s.scope FROM learner_scope s WHERE s.learner_id = :learnerId) " +
            "AND (:scope = '' OR c.scope = :scope) " +
            "AND NOT EXISTS (SELECT 1 FROM card_progress p WHERE p.learner_id = :learnerId AND p.card_id = c.id) ";

    private static final String LOAD_NEW_CARD_BATCH_SQL =
            "SELECT " + CardDaoPG.CARD_COLUMNS +
            "FROM card c " +
            "WHERE " + NEW_CARD_CONDITION_SQL +
                    "AND (:firstBatch OR c.created_at > :afterCreatedAt OR (c.created_at = :afterCreatedAt AND c.id > :afterCardId)) " +
            "ORDER BY c.created_at ASC, c.id ASC " +
            "LIMIT :batchSize";

    private static final String COUNT_NEW_CARDS_SQL =
            "SELECT count(*) FROM card c WHERE " + NEW_CARD_CONDITION_SQL;

    private final NamedParameterJdbcTemplate template;

    public DueCardDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<DueCard> loadDueReviewBatch(long learnerId, String scope, Instant now, DueCard lastCard, int batchSize) {
        Instant afterNextDueAt = lastCard == null ? now : lastCard.progress().nextDueAt();

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("learnerId", learnerId)
                .addValue("scope", scope == null ? "" : scope)
                .addValue("now", Timestamp.from(now))
                .addValue("firstBatch", lastCard == null)
                .addValue("afterNextDueAt", Timestamp.from(afterNextDueAt))    // ignored on the first batch but must be typed
                .addValue("afterCardId", lastCard == null ? -1L : lastCard.card().id())
                .addValue("batchSize", batchSize);

        return template.query(LOAD_DUE_REVIEW_BATCH_SQL, params, DueCardDaoPG::getDueReviewFromResultSet);
    }

    @Override
    public List<DueCard> loadNewCardBatch(long learnerId, String scope, DueCard lastCard, int batchSize) {
        Instant afterCreatedAt = lastCard == null || lastCard.card().createdAt() == null ? Instant.EPOCH : lastCard.card().createdAt();

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("learnerId", learnerId)
                .addValue("scope", scope == null ? "" : scope)
                .addValue("firstBatch", lastCard == null)
                .addValue("afterCreatedAt", Timestamp.from(afterCreatedAt))
                .addValue("afterCardId", lastCard == null ? -1L : lastCard.card().id())
                .addValue("batchSize", batchSize);

        return template.query(LOAD_NEW_CARD_BATCH_SQL, params, (rs, rowNum) -> new DueCard(CardDaoPG.getCardFromResultSet(rs, rowNum), null));
    }

    @Override
    public int countNewCards(long learnerId, String scope) {
        Integer count = template.queryForObject(COUNT_NEW_CARDS_SQL,
                Map.of("learnerId", learnerId, "scope", scope == null ? "" : scope),
                Integer.class);

        return count == null ? 0 : count;
    }

    private static DueCard getDueReviewFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new DueCard(CardDaoPG.getCardFromResultSet(rs, rowNum), ProgressDaoPG.getProgressFromResultSet(rs, rowNum));
    }
}
