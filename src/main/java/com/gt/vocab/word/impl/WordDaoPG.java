package com.gt.vocab.word.impl;

import com.gt.vocab.exception.StorageUnavailableException;
import com.gt.vocab.model.Word;
import com.gt.vocab.word.WordDao;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class WordDaoPG implements WordDao {

    private static final String WORDS_QUERY_SQL =
            "SELECT id, text_en, level, example_en, example_ru, tags " +
            "FROM words " +
            "WHERE id IN (:wordIds)";

    private final NamedParameterJdbcTemplate template;

    public WordDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<Word> loadWords(Collection<String> wordIds) {
        if (wordIds.isEmpty()) {
            return List.of();
        }

        try {
            return template.query(WORDS_QUERY_SQL,
                    Map.of("wordIds", wordIds),
                    WordDaoPG::getWordFromResultSet);
        } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException ex) {
            throw new StorageUnavailableException("loadWords", ex);
        }
    }

    static Word getWordFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new Word(
                rs.getString("id"),
                rs.getString("text_en"),
                rs.getString("level"),
                rs.getString("example_en"),
                rs.getString("example_ru"),
                toTagList(rs.getArray("tags")));
    }

    private static List<String> toTagList(Array tags) throws SQLException {
        if (tags == null) {
            return List.of();
        }

        return Arrays.asList((String[]) tags.getArray());
    }
}
