package com.gt.vocab.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A user's review schedule for a single word. Delivery state is persisted as the nullable claimedAt / sentAt /
 * messageId columns; {@link #state()} derives the explicit state from them and the transition methods below are the
 * only legal ways to move between states.
 */
public record ReviewItem(String userId,
                         String wordId,
                         Instant nextReviewAt,
                         Instant lastReviewAt,
                         int intervalMinutes,
                         int reviewCount,
                         Difficulty difficultyLast,
                         boolean active,
                         Instant claimedAt,
                         Instant sentAt,
                         String messageId) {

    // Oldest due first, ties broken by (userId, wordId) so that claim batches are deterministic
    public static final Comparator<ReviewItem> DUE_ORDER = Comparator
            .comparing(ReviewItem::nextReviewAt)
            .thenComparing(ReviewItem::key, ReviewItemKey.ORDER);

    public ReviewItem {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(wordId, "wordId");
        Objects.requireNonNull(nextReviewAt, "nextReviewAt");

        if (intervalMinutes < 0 || reviewCount < 0) {
            throw new IllegalArgumentException("Interval and review count must not be negative for " + userId + ":" + wordId);
        }
        if (claimedAt != null && !active) {
            throw new IllegalStateException("Inactive item " + userId + ":" + wordId + " cannot be claimed");
        }
        if (sentAt != null && claimedAt == null) {
            throw new IllegalStateException("Item " + userId + ":" + wordId + " cannot be sent without a claim");
        }
        if (messageId != null && sentAt == null) {
            throw new IllegalStateException("Item " + userId + ":" + wordId + " has a message id but was never sent");
        }
    }

    public static ReviewItem newItem(String userId, String wordId, ReviewSchedule initialSchedule) {
        return new ReviewItem(userId, wordId, initialSchedule.nextReviewAt(), null, initialSchedule.nextIntervalMinutes(),
                0, null, true, null, null, null);
    }

    public ReviewItemKey key() {
        return new ReviewItemKey(userId, wordId);
    }

    @JsonProperty("state")
    public ReviewItemState state() {
        if (!active) {
            return ReviewItemState.INACTIVE;
        } else if (sentAt != null) {
            return ReviewItemState.SENT;
        } else if (claimedAt != null) {
            return ReviewItemState.CLAIMED;
        }
        return ReviewItemState.DUE;
    }

    public boolean isEligibleForClaim(Instant now) {
        return state() == ReviewItemState.DUE && !nextReviewAt.isAfter(now);
    }

    public ReviewItem claim(Instant now) {
        if (!isEligibleForClaim(now)) {
            throw new IllegalStateException("Item " + userId + ":" + wordId + " is not eligible for claim (state " + state() + ")");
        }
        return new ReviewItem(userId, wordId, nextReviewAt, lastReviewAt, intervalMinutes, reviewCount, difficultyLast,
                true, now, null, null);
    }

    public ReviewItem markSent(String sentMessageId, Instant sentInstant) {
        if (sentMessageId == null || sentMessageId.isBlank()) {
            throw new IllegalArgumentException("Item " + userId + ":" + wordId + " cannot be marked sent without a message id");
        }
        if (state() != ReviewItemState.CLAIMED) {
            throw new IllegalStateException("Item " + userId + ":" + wordId + " must be claimed before it is sent (state " + state() + ")");
        }
        return new ReviewItem(userId, wordId, nextReviewAt, lastReviewAt, intervalMinutes, reviewCount, difficultyLast,
                true, claimedAt, sentInstant, sentMessageId);
    }

    // nextReviewAt is left untouched so the item is immediately eligible again
    public ReviewItem resetToDue() {
        if (!active) {
            throw new IllegalStateException("Inactive item " + userId + ":" + wordId + " cannot be reset");
        }
        return new ReviewItem(userId, wordId, nextReviewAt, lastReviewAt, intervalMinutes, reviewCount, difficultyLast,
                true, null, null, null);
    }

    public ReviewItem afterReview(ReviewSchedule schedule, Difficulty difficulty, Instant reviewInstant) {
        if (!active) {
            throw new IllegalStateException("Inactive item " + userId + ":" + wordId + " cannot be reviewed");
        }
        return new ReviewItem(userId, wordId, schedule.nextReviewAt(), reviewInstant, schedule.nextIntervalMinutes(),
                reviewCount + 1, difficulty, true, null, null, null);
    }

    public ReviewItem deactivate() {
        return new ReviewItem(userId, wordId, nextReviewAt, lastReviewAt, intervalMinutes, reviewCount, difficultyLast,
                false, null, null, null);
    }
}
