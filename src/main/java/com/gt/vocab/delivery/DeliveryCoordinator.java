package com.gt.vocab.delivery;

import com.gt.vocab.exception.DaoException;
import com.gt.vocab.model.*;
import com.gt.vocab.reviewItem.ReviewItemStore;
import com.gt.vocab.util.LimitUtil;
import com.gt.vocab.word.WordDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the claim, dispatch and acknowledge cycle against the review item store. All coordination between workers
 * happens in the store's conditional transitions, so any number of coordinators may run against the same store.
 */
@Component
public class DeliveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DeliveryCoordinator.class);

    private final ReviewItemStore reviewItemStore;
    private final WordDao wordDao;
    private final ReviewNotifier reviewNotifier;
    private final Clock clock;

    @Autowired
    public DeliveryCoordinator(ReviewItemStore reviewItemStore,
                               WordDao wordDao,
                               ReviewNotifier reviewNotifier,
                               Clock clock) {
        this.reviewItemStore = reviewItemStore;
        this.wordDao = wordDao;
        this.reviewNotifier = reviewNotifier;
        this.clock = clock;
    }

    public List<ReviewWithWord> claim(int limit) {
        return claimBatch(limit).reviews();
    }

    public DeliveryReport deliver(int limit) {
        ClaimBatch batch = claimBatch(limit);
        if (batch.claimedCnt() == 0) {
            return DeliveryReport.EMPTY;
        }

        int sentCnt = 0;
        int failedCnt = 0;
        for (ReviewWithWord review : batch.reviews()) {
            boolean sent;
            try {
                sent = dispatch(review);
            } catch (DaoException ex) {
                // Claim is left in place for the stale claim sweep
                log.error("Storage error while delivering review item {}", review.item().key(), ex);
                sent = false;
            }

            if (sent) {
                sentCnt++;
            } else {
                failedCnt++;
            }
        }

        DeliveryReport report = new DeliveryReport(batch.claimedCnt(), sentCnt, failedCnt, batch.claimedCnt() - batch.reviews().size());
        log.info("Delivered reviews. {} claimed, {} sent, {} failed, {} skipped.",
                report.claimed(), report.sent(), report.failed(), report.skipped());

        return report;
    }

    public boolean markSent(String userId, String wordId, String messageId, Instant sentAt) {
        boolean marked = reviewItemStore.markSent(userId, wordId, messageId, sentAt == null ? clock.instant() : sentAt);
        if (!marked) {
            log.debug("Review item {}:{} was not awaiting send", userId, wordId);
        }
        return marked;
    }

    public boolean resetToDue(String userId, String wordId) {
        return reviewItemStore.resetToDue(userId, wordId);
    }

    public DueReviewPage getGlobalDueReviews(int limit, int offset) {
        Instant now = clock.instant();
        int pageOffset = Math.max(0, offset);

        List<ReviewItem> items = reviewItemStore.getGlobalDueReviews(now, LimitUtil.clampLimit(limit), pageOffset);
        int total = reviewItemStore.getProcessingStats(now).due();

        List<ReviewWithWord> reviews = joinWords(items);
        if (reviews.size() < items.size()) {
            log.warn("{} due review items reference words missing from the catalog", items.size() - reviews.size());
        }

        return new DueReviewPage(reviews, total, pageOffset + items.size() < total);
    }

    public ProcessingStats getProcessingStats() {
        return reviewItemStore.getProcessingStats(clock.instant());
    }

    private ClaimBatch claimBatch(int limit) {
        List<ReviewItem> claimedItems = reviewItemStore.claimReviews(LimitUtil.clampLimit(limit), clock.instant());
        if (claimedItems.isEmpty()) {
            return new ClaimBatch(List.of(), 0);
        }

        List<ReviewWithWord> reviews = joinWords(claimedItems);
        if (reviews.size() < claimedItems.size()) {
            deactivateMissingWords(claimedItems, reviews);
        }

        return new ClaimBatch(reviews, claimedItems.size());
    }

    // Keeps the order of the items; those without a catalog word are dropped
    private List<ReviewWithWord> joinWords(List<ReviewItem> items) {
        if (items.isEmpty()) {
            return List.of();
        }

        Map<String, Word> wordsById = wordDao.loadWords(items.stream().map(ReviewItem::wordId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(Word::id, Function.identity(), (first, second) -> first));

        List<ReviewWithWord> reviews = new ArrayList<>(items.size());
        for (ReviewItem item : items) {
            Word word = wordsById.get(item.wordId());
            if (word != null) {
                reviews.add(new ReviewWithWord(item, word));
            }
        }

        return reviews;
    }

    // Items without a catalog word leave the eligible set for good
    private void deactivateMissingWords(List<ReviewItem> claimedItems, List<ReviewWithWord> reviews) {
        List<ReviewItemKey> joinedKeys = reviews.stream().map(review -> review.item().key()).toList();

        for (ReviewItem item : claimedItems) {
            if (!joinedKeys.contains(item.key())) {
                log.warn("Word {} missing from catalog, deactivating review item {}", item.wordId(), item.key());
                try {
                    reviewItemStore.deactivate(item.userId(), item.wordId());
                } catch (DaoException ex) {
                    log.error("Failed to deactivate review item {}", item.key(), ex);
                }
            }
        }
    }

    private boolean dispatch(ReviewWithWord review) {
        ReviewItem item = review.item();

        String messageId;
        try {
            messageId = reviewNotifier.send(item.userId(), ReviewPayload.from(review));
        } catch (NotificationException | RuntimeException ex) {
            log.warn("Failed to send review item {}, returning it to due", item.key(), ex);
            reviewItemStore.resetToDue(item.userId(), item.wordId());
            return false;
        }

        if (messageId == null || messageId.isBlank()) {
            log.warn("Notifier returned no message id for review item {}, returning it to due", item.key());
            reviewItemStore.resetToDue(item.userId(), item.wordId());
            return false;
        }

        if (!reviewItemStore.markSent(item.userId(), item.wordId(), messageId, clock.instant())) {
            log.warn("Review item {} sent as message {} but its claim was already released", item.key(), messageId);
            return false;
        }

        return true;
    }

    private record ClaimBatch(List<ReviewWithWord> reviews, int claimedCnt) { }
}
