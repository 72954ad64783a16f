package com.gt.vocab.reviewItem.impl;

import com.gt.vocab.model.*;
import com.gt.vocab.reviewItem.ReviewItemStore;
import com.gt.vocab.schedule.SchedulingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-process store used for local runs and tests. A single read/write lock gives every transition, including the
 * scan-and-mark claim, the same atomicity the SQL statements have in {@link ReviewItemStorePG}.
 */
public class ReviewItemStoreMemory implements ReviewItemStore {

    private static final Logger log = LoggerFactory.getLogger(ReviewItemStoreMemory.class);

    private final Map<ReviewItemKey, ReviewItem> items = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<ReviewItem> getItem(String userId, String wordId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(items.get(new ReviewItemKey(userId, wordId)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ReviewItem> getDueItems(String userId, Instant now, int limit) {
        lock.readLock().lock();
        try {
            return items.values()
                    .stream()
                    .filter(item -> item.userId().equals(userId) && item.isEligibleForClaim(now))
                    .sorted(ReviewItem.DUE_ORDER)
                    .limit(limit)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ReviewItem createOrGet(String userId, String wordId, Instant now) {
        lock.writeLock().lock();
        try {
            return items.computeIfAbsent(new ReviewItemKey(userId, wordId),
                    key -> ReviewItem.newItem(userId, wordId, SchedulingPolicy.initialSchedule(now)));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean updateAfterReview(String userId, String wordId, ReviewSchedule schedule, Difficulty difficulty, Instant now) {
        return transition(new ReviewItemKey(userId, wordId),
                item -> item.active() ? item.afterReview(schedule, difficulty, now) : null);
    }

    @Override
    public boolean deactivate(String userId, String wordId) {
        return transition(new ReviewItemKey(userId, wordId), ReviewItem::deactivate);
    }

    @Override
    public ReviewItemStats getStats(String userId, Instant now) {
        lock.readLock().lock();
        try {
            int total = 0, active = 0, due = 0, reviewCount = 0;
            for (ReviewItem item : items.values()) {
                if (item.userId().equals(userId)) {
                    total++;
                    reviewCount += item.reviewCount();
                    if (item.active()) {
                        active++;
                    }
                    if (item.isEligibleForClaim(now)) {
                        due++;
                    }
                }
            }
            return new ReviewItemStats(total, active, due, reviewCount);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ReviewItem> getGlobalDueReviews(Instant now, int limit, int offset) {
        lock.readLock().lock();
        try {
            return items.values()
                    .stream()
                    .filter(item -> item.isEligibleForClaim(now))
                    .sorted(ReviewItem.DUE_ORDER)
                    .skip(offset)
                    .limit(limit)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ReviewItem> claimReviews(int limit, Instant now) {
        lock.writeLock().lock();
        try {
            List<ReviewItem> toClaim = items.values()
                    .stream()
                    .filter(item -> item.isEligibleForClaim(now))
                    .sorted(ReviewItem.DUE_ORDER)
                    .limit(limit)
                    .toList();

            List<ReviewItem> claimed = new ArrayList<>(toClaim.size());
            for (ReviewItem item : toClaim) {
                ReviewItem claimedItem = item.claim(now);
                items.put(claimedItem.key(), claimedItem);
                claimed.add(claimedItem);
            }

            log.debug("Claimed {} review items", claimed.size());
            return claimed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean markSent(String userId, String wordId, String messageId, Instant sentAt) {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("Review item " + userId + ":" + wordId + " cannot be marked sent without a message id");
        }

        return transition(new ReviewItemKey(userId, wordId),
                item -> item.state() == ReviewItemState.CLAIMED ? item.markSent(messageId, sentAt) : null);
    }

    @Override
    public boolean resetToDue(String userId, String wordId) {
        return transition(new ReviewItemKey(userId, wordId),
                item -> item.active() ? item.resetToDue() : null);
    }

    @Override
    public int processTimeouts(Duration timeout, Instant now) {
        Instant cutoff = now.minus(timeout);

        return resetWhere(item -> item.state() == ReviewItemState.SENT && item.sentAt().isBefore(cutoff));
    }

    @Override
    public int releaseStaleClaims(Duration claimTimeout, Instant now) {
        Instant cutoff = now.minus(claimTimeout);

        return resetWhere(item -> item.state() == ReviewItemState.CLAIMED && item.claimedAt().isBefore(cutoff));
    }

    @Override
    public ProcessingStats getProcessingStats(Instant now) {
        Instant startOfDay = now.truncatedTo(ChronoUnit.DAYS);

        lock.readLock().lock();
        try {
            int due = 0, claimed = 0, awaitingResponse = 0, processedToday = 0;
            for (ReviewItem item : items.values()) {
                if (item.isEligibleForClaim(now)) {
                    due++;
                }
                switch (item.state()) {
                    case CLAIMED -> claimed++;
                    case SENT -> awaitingResponse++;
                    default -> { }
                }
                if (item.lastReviewAt() != null && !item.lastReviewAt().isBefore(startOfDay)) {
                    processedToday++;
                }
            }
            return new ProcessingStats(due, claimed, awaitingResponse, processedToday);
        } finally {
            lock.readLock().unlock();
        }
    }

    // Applies the update under the write lock. An update returning null means the transition does not apply.
    private boolean transition(ReviewItemKey key, UnaryOperator<ReviewItem> update) {
        lock.writeLock().lock();
        try {
            ReviewItem existing = items.get(key);
            if (existing == null) {
                return false;
            }

            ReviewItem updated = update.apply(existing);
            if (updated == null) {
                return false;
            }

            items.put(key, updated);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int resetWhere(Predicate<ReviewItem> condition) {
        lock.writeLock().lock();
        try {
            int resetCnt = 0;
            for (Map.Entry<ReviewItemKey, ReviewItem> entry : items.entrySet()) {
                if (condition.test(entry.getValue())) {
                    entry.setValue(entry.getValue().resetToDue());
                    resetCnt++;
                }
            }
            return resetCnt;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
