package com.gt.vocab.reviewItem;

import com.gt.vocab.exception.WordNotFoundException;
import com.gt.vocab.model.*;
import com.gt.vocab.util.LimitUtil;
import com.gt.vocab.word.WordDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ReviewItemService {

    private static final Logger log = LoggerFactory.getLogger(ReviewItemService.class);

    private final ReviewItemStore reviewItemStore;
    private final WordDao wordDao;
    private final Clock clock;

    @Autowired
    public ReviewItemService(ReviewItemStore reviewItemStore, WordDao wordDao, Clock clock) {
        this.reviewItemStore = reviewItemStore;
        this.wordDao = wordDao;
        this.clock = clock;
    }

    public List<ReviewWithWord> getDueReviews(String userId, int limit) {
        List<ReviewItem> dueItems = reviewItemStore.getDueItems(userId, clock.instant(), LimitUtil.clampLimit(limit));
        if (dueItems.isEmpty()) {
            return List.of();
        }

        Map<String, Word> wordsById = wordDao.loadWords(dueItems.stream().map(ReviewItem::wordId).toList())
                .stream()
                .collect(Collectors.toMap(Word::id, Function.identity(), (first, second) -> first));

        List<ReviewWithWord> dueReviews = new ArrayList<>();
        for (ReviewItem item : dueItems) {
            Word word = wordsById.get(item.wordId());
            if (word == null) {
                log.warn("Word {} missing from catalog, skipping due review for user {}", item.wordId(), userId);
            } else {
                dueReviews.add(new ReviewWithWord(item, word));
            }
        }

        return dueReviews;
    }

    public Optional<ReviewItem> getItem(String userId, String wordId) {
        return reviewItemStore.getItem(userId, wordId);
    }

    public ReviewItem createItem(String userId, String wordId) {
        if (wordDao.loadWords(List.of(wordId)).isEmpty()) {
            throw new WordNotFoundException(wordId);
        }

        return reviewItemStore.createOrGet(userId, wordId, clock.instant());
    }

    public boolean deactivateItem(String userId, String wordId) {
        boolean deactivated = reviewItemStore.deactivate(userId, wordId);
        if (deactivated) {
            log.info("Deactivated review item {}:{}", userId, wordId);
        }
        return deactivated;
    }

    public ReviewItemStats getStats(String userId) {
        return reviewItemStore.getStats(userId, clock.instant());
    }
}
