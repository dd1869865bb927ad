package com.gt.srs.util;

import com.gt.srs.model.Card;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.util.Map;

// One PostgreSQL container per test run, created from db/schema.sql
public class TestDatabase {

    private static final String INSERT_CARD_SQL =
            "INSERT INTO card (id, prompt, answer, explanation, scope, base_difficulty, source, created_at) " +
            "VALUES (:id, :prompt, :answer, :explanation, :scope, :baseDifficulty, :source, :createdAt)";

    private static final String INSERT_LEARNER_SCOPE_SQL =
            "INSERT INTO learner_scope (learner_id, scope) VALUES (:learnerId, :scope)";

    private static PostgreSQLContainer<?> postgres;
    private static NamedParameterJdbcTemplate template;

    public static synchronized NamedParameterJdbcTemplate getTemplate() {
        if (template == null) {
            postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
                    .withDatabaseName("srs")
                    .withUsername("srs")
                    .withPassword("srs");
            postgres.start();

            DataSource dataSource = new DriverManagerDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
            new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);

            template = new NamedParameterJdbcTemplate(dataSource);
        }

        return template;
    }

    public static void clear() {
        getTemplate().getJdbcTemplate().execute("TRUNCATE card_progress, learner_scope, card");
    }

    public static void insertCard(Card card) {
        getTemplate().update(INSERT_CARD_SQL, new MapSqlParameterSource()
                .addValue("id", card.id())
                .addValue("prompt", card.prompt())
                .addValue("answer", card.answer())
                .addValue("explanation", card.explanation())
                .addValue("scope", card.scope())
                .addValue("baseDifficulty", card.baseDifficulty())
                .addValue("source", card.source().getSourceValue())
                .addValue("createdAt", Timestamp.from(card.createdAt())));
    }

    public static void enrol(long learnerId, String scope) {
        getTemplate().update(INSERT_LEARNER_SCOPE_SQL, Map.of("learnerId", learnerId, "scope", scope));
    }
}
