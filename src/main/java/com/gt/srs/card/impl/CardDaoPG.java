package com.gt.srs.card.impl;

import com.gt.srs.card.CardDao;
import com.gt.srs.model.Card;
import com.gt.srs.model.CardSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class CardDaoPG implements CardDao {

    public static final String CARD_COLUMNS = "c.id, c.prompt, c.answer, c.explanation, c.scope, c.base_difficulty, c.source, c.created_at ";

    private static final String LOAD_CARDS_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM card c " +
            "WHERE c.id IN (:cardIds)";

    private final NamedParameterJdbcTemplate template;

    public CardDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Card loadCard(long cardId) {
        List<Card> cards = loadCards(List.of(cardId));

        return cards.isEmpty() ? null : cards.get(0);
    }

    @Override
    public List<Card> loadCards(Collection<Long> cardIds) {
        if (cardIds == null || cardIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_CARDS_SQL, Map.of("cardIds", cardIds), CardDaoPG::getCardFromResultSet);
    }

    public static Card getCardFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        double baseDifficultyValue = rs.getDouble("base_difficulty");
        Double baseDifficulty = rs.wasNull() ? null : baseDifficultyValue;

        return new Card(
                rs.getLong("id"),
                rs.getString("prompt"),
                rs.getString("answer"),
                rs.getString("explanation"),
                rs.getString("scope"),
                baseDifficulty,
                CardSource.fromSourceValue(rs.getString("source")),
                toInstant(rs.getTimestamp("created_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
