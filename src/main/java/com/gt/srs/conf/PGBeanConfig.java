package com.gt.srs.conf;

import com.gt.srs.card.CardDao;
import com.gt.srs.card.impl.CardDaoPG;
import com.gt.srs.due.DueCardDao;
import com.gt.srs.due.impl.DueCardDaoPG;
import com.gt.srs.progress.ProgressDao;
import com.gt.srs.progress.impl.ProgressDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    public static final String GRADE_TRANSACTION_TEMPLATE = "gradeTransactionTemplate";
    public static final String SNAPSHOT_TRANSACTION_TEMPLATE = "snapshotTransactionTemplate";

    @Bean
    public DataSource getDataSource(@Value("${srs.datasource.postgres.url}") String url,
                                    @Value("${srs.datasource.postgres.username}") String username,
                                    @Value("${srs.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager getTransactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean(GRADE_TRANSACTION_TEMPLATE)
    public TransactionTemplate getGradeTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);

        return transactionTemplate;
    }

    @Bean(SNAPSHOT_TRANSACTION_TEMPLATE)
    public TransactionTemplate getSnapshotTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        transactionTemplate.setReadOnly(true);

        return transactionTemplate;
    }

    @Bean
    public CardDao getCardDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new CardDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public ProgressDao getProgressDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ProgressDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public DueCardDao getDueCardDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new DueCardDaoPG(namedParameterJdbcTemplate);
    }
}
