package com.gt.vocab.reviewItem;

import com.gt.vocab.model.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent store of review items. Every state change is a conditional transition on the item's current state;
 * a transition that does not apply reports false (or a zero count) rather than throwing. Implementations must make
 * {@link #claimReviews(int, Instant)} a single atomic select-and-mark so concurrent workers never claim the same item.
 */
public interface ReviewItemStore {

    Optional<ReviewItem> getItem(String userId, String wordId);

    List<ReviewItem> getDueItems(String userId, Instant now, int limit);

    ReviewItem createOrGet(String userId, String wordId, Instant now);

    boolean updateAfterReview(String userId, String wordId, ReviewSchedule schedule, Difficulty difficulty, Instant now);

    boolean deactivate(String userId, String wordId);

    ReviewItemStats getStats(String userId, Instant now);

    List<ReviewItem> getGlobalDueReviews(Instant now, int limit, int offset);

    List<ReviewItem> claimReviews(int limit, Instant now);

    boolean markSent(String userId, String wordId, String messageId, Instant sentAt);

    boolean resetToDue(String userId, String wordId);

    int processTimeouts(Duration timeout, Instant now);

    int releaseStaleClaims(Duration claimTimeout, Instant now);

    ProcessingStats getProcessingStats(Instant now);
}
