package com.gt.vocab.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.vocab.reviewItem.ReviewItemStore;
import com.gt.vocab.reviewItem.impl.ReviewItemStoreMemory;
import com.gt.vocab.word.WordDao;
import com.gt.vocab.word.impl.WordDaoMemory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

// Local development setup. Review items live only as long as the process.
@Configuration
@ConditionalOnProperty(value = "vocab.store", havingValue = "memory")
public class MemoryBeanConfig {

    @Bean
    public ReviewItemStore getReviewItemStore() {
        return new ReviewItemStoreMemory();
    }

    @Bean
    public WordDao getWordDao(ObjectMapper objectMapper,
                              @Value("${vocab.memory.sampleWords:classpath:sample-words.json}") Resource sampleWords) throws IOException {
        try (InputStream json = sampleWords.getInputStream()) {
            return WordDaoMemory.fromJson(objectMapper, json);
        }
    }
}
