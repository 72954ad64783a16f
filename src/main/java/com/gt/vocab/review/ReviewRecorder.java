package com.gt.vocab.review;

import com.gt.vocab.exception.WordNotFoundException;
import com.gt.vocab.model.Difficulty;
import com.gt.vocab.model.ReviewItem;
import com.gt.vocab.model.ReviewSchedule;
import com.gt.vocab.reviewItem.ReviewItemStore;
import com.gt.vocab.schedule.SchedulingPolicy;
import com.gt.vocab.word.WordDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Applies a user's answer to a review item. Every call counts as one completed review; callers that may deliver the
 * same answer twice must de-duplicate before calling.
 */
@Component
public class ReviewRecorder {

    private static final Logger log = LoggerFactory.getLogger(ReviewRecorder.class);

    private final ReviewItemStore reviewItemStore;
    private final WordDao wordDao;
    private final Clock clock;

    @Autowired
    public ReviewRecorder(ReviewItemStore reviewItemStore, WordDao wordDao, Clock clock) {
        this.reviewItemStore = reviewItemStore;
        this.wordDao = wordDao;
        this.clock = clock;
    }

    public ReviewItem recordReview(String userId, String wordId, Difficulty difficulty) {
        return recordReview(userId, wordId, difficulty, clock.instant());
    }

    public ReviewItem recordReview(String userId, String wordId, Difficulty difficulty, Instant now) {
        // Existing items were checked against the catalog when they were created
        if (reviewItemStore.getItem(userId, wordId).isEmpty() && wordDao.loadWords(List.of(wordId)).isEmpty()) {
            throw new WordNotFoundException(wordId);
        }

        ReviewItem item = reviewItemStore.createOrGet(userId, wordId, now);
        if (!item.active()) {
            throw new IllegalStateException("Review item " + item.key() + " is deactivated");
        }

        ReviewSchedule schedule = SchedulingPolicy.computeNextSchedule(now, item.intervalMinutes(),
                Math.max(0, item.reviewCount()), difficulty);

        // Only fails if the item was deactivated after it was read
        if (!reviewItemStore.updateAfterReview(userId, wordId, schedule, difficulty, now)) {
            throw new IllegalStateException("Review item " + item.key() + " is deactivated");
        }

        log.debug("Recorded {} review for {}, next review in {} minutes", difficulty, item.key(), schedule.nextIntervalMinutes());

        return reviewItemStore.getItem(userId, wordId)
                .orElseThrow(() -> new IllegalStateException("Review item " + item.key() + " missing after review"));
    }
}
