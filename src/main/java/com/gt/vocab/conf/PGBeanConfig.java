package com.gt.vocab.conf;

import com.gt.vocab.reviewItem.ReviewItemStore;
import com.gt.vocab.reviewItem.impl.ReviewItemStorePG;
import com.gt.vocab.word.WordDao;
import com.gt.vocab.word.impl.WordDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
@ConditionalOnProperty(value = "vocab.store", havingValue = "postgres", matchIfMissing = true)
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${vocab.datasource.postgres.url}") String url,
                                    @Value("${vocab.datasource.postgres.username}") String username,
                                    @Value("${vocab.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public ReviewItemStore getReviewItemStore(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewItemStorePG(namedParameterJdbcTemplate);
    }

    @Bean
    public WordDao getWordDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new WordDaoPG(namedParameterJdbcTemplate);
    }
}
