package com.gt.vocab.word.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.vocab.model.Word;
import com.gt.vocab.word.WordDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only catalog held in memory, seeded from a JSON array of words.
 */
public class WordDaoMemory implements WordDao {

    private static final Logger log = LoggerFactory.getLogger(WordDaoMemory.class);

    private static final TypeReference<List<Word>> WORD_LIST_TYPE = new TypeReference<>() { };

    private final Map<String, Word> wordsById;

    public WordDaoMemory(Collection<Word> words) {
        this.wordsById = words.stream()
                .collect(Collectors.toUnmodifiableMap(Word::id, Function.identity(), (first, second) -> first));
    }

    public static WordDaoMemory fromJson(ObjectMapper objectMapper, InputStream json) throws IOException {
        List<Word> words = objectMapper.readValue(json, WORD_LIST_TYPE);

        log.info("Loaded {} catalog words", words.size());
        return new WordDaoMemory(words);
    }

    @Override
    public List<Word> loadWords(Collection<String> wordIds) {
        List<Word> words = new ArrayList<>();

        for (String wordId : new LinkedHashSet<>(wordIds)) {
            Word word = wordsById.get(wordId);
            if (word != null) {
                words.add(word);
            }
        }

        return words;
    }
}
