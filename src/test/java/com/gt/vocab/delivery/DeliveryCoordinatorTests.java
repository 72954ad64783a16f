package com.gt.vocab.delivery;

import com.gt.vocab.exception.StorageUnavailableException;
import com.gt.vocab.model.*;
import com.gt.vocab.reviewItem.impl.ReviewItemStoreMemory;
import com.gt.vocab.word.WordDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

import static com.gt.vocab.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class DeliveryCoordinatorTests {

    private static final String TEST_USER_ID = "user-1";
    private static final String TEST_USER_ID_2 = "user-2";

    // Items created an hour before TEST_NOW are due by TEST_NOW
    private static final Instant CREATED_AT = TEST_NOW.minus(Duration.ofHours(1));

    private ReviewItemStoreMemory reviewItemStore;
    private DeliveryCoordinator deliveryCoordinator;

    @Mock private WordDao wordDao;
    @Mock private ReviewNotifier reviewNotifier;

    @BeforeEach
    public void setup() {
        reviewItemStore = new ReviewItemStoreMemory();
        deliveryCoordinator = new DeliveryCoordinator(reviewItemStore, wordDao, reviewNotifier, fixedClock(TEST_NOW));

        when(wordDao.loadWords(anyCollection())).thenAnswer(invocation -> {
            Collection<String> wordIds = invocation.getArgument(0);
            return wordIds.stream().filter(wordId -> !wordId.startsWith("missing")).map(wordId -> testWord(wordId)).toList();
        });
    }

    @Test
    public void testClaim() {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-2", CREATED_AT);
        reviewItemStore.createOrGet(TEST_USER_ID_2, "word-1", CREATED_AT.minusSeconds(60));
        reviewItemStore.createOrGet(TEST_USER_ID, "word-3", TEST_NOW);

        List<ReviewWithWord> claimed = deliveryCoordinator.claim(10);

        assertEquals(2, claimed.size());
        assertEquals(new ReviewItemKey(TEST_USER_ID_2, "word-1"), claimed.get(0).item().key());
        assertEquals(new ReviewItemKey(TEST_USER_ID, "word-2"), claimed.get(1).item().key());
        assertEquals(testWord("word-1"), claimed.get(0).word());
        for (ReviewWithWord review : claimed) {
            assertEquals(ReviewItemState.CLAIMED, review.item().state());
        }
    }

    @Test
    public void testClaim_DeactivatesItemsWithMissingWords() {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", CREATED_AT);
        reviewItemStore.createOrGet(TEST_USER_ID, "missing-1", CREATED_AT);

        List<ReviewWithWord> claimed = deliveryCoordinator.claim(10);

        assertEquals(1, claimed.size());
        assertEquals("word-1", claimed.get(0).item().wordId());
        assertEquals(ReviewItemState.INACTIVE, reviewItemStore.getItem(TEST_USER_ID, "missing-1").orElseThrow().state());
        assertEquals(ReviewItemState.CLAIMED, reviewItemStore.getItem(TEST_USER_ID, "word-1").orElseThrow().state());
    }

    @Test
    public void testDeliver_MissingWordsDoNotBlockLaterItems() throws Exception {
        for (int i = 0; i < 10; i++) {
            reviewItemStore.createOrGet("user-" + i, "missing-" + i, CREATED_AT.minusSeconds(600 - i));
        }
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", CREATED_AT);
        when(reviewNotifier.send(anyString(), any(ReviewPayload.class))).thenReturn("msg-1");

        assertEquals(new DeliveryReport(10, 0, 0, 10), deliveryCoordinator.deliver(10));
        assertEquals(new DeliveryReport(1, 1, 0, 0), deliveryCoordinator.deliver(10));
        assertEquals(DeliveryReport.EMPTY, deliveryCoordinator.deliver(10));

        assertEquals(ReviewItemState.SENT, reviewItemStore.getItem(TEST_USER_ID, "word-1").orElseThrow().state());
        assertEquals(0, deliveryCoordinator.getProcessingStats().due());
    }

    @Test
    public void testClaim_LimitIsClamped() {
        for (int i = 0; i < 60; i++) {
            reviewItemStore.createOrGet(TEST_USER_ID, "word-" + i, CREATED_AT);
        }

        assertEquals(1, deliveryCoordinator.claim(0).size());
        assertEquals(50, deliveryCoordinator.claim(500).size());
    }

    @Test
    public void testDeliver() throws Exception {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", CREATED_AT);
        reviewItemStore.createOrGet(TEST_USER_ID_2, "word-2", CREATED_AT);
        when(reviewNotifier.send(anyString(), any(ReviewPayload.class))).thenReturn("msg-1", "msg-2");

        DeliveryReport report = deliveryCoordinator.deliver(10);

        assertEquals(new DeliveryReport(2, 2, 0, 0), report);

        ReviewItem first = reviewItemStore.getItem(TEST_USER_ID, "word-1").orElseThrow();
        assertEquals(ReviewItemState.SENT, first.state());
        assertEquals("msg-1", first.messageId());
        assertEquals(TEST_NOW, first.sentAt());

        ArgumentCaptor<ReviewPayload> payloadCaptor = ArgumentCaptor.forClass(ReviewPayload.class);
        verify(reviewNotifier).send(eq(TEST_USER_ID), payloadCaptor.capture());
        assertEquals("word-1", payloadCaptor.getValue().wordId());
        assertEquals(testWord("word-1").text(), payloadCaptor.getValue().text());
    }

    @Test
    public void testDeliver_FailureResetsItemAndContinues() throws Exception {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", CREATED_AT.minusSeconds(60));
        reviewItemStore.createOrGet(TEST_USER_ID, "word-2", CREATED_AT);
        reviewItemStore.createOrGet(TEST_USER_ID, "word-3", CREATED_AT.plusSeconds(60));
        when(reviewNotifier.send(eq(TEST_USER_ID), any(ReviewPayload.class)))
                .thenThrow(new NotificationException("chat not found"))
                .thenThrow(new RuntimeException("connection reset"))
                .thenReturn("msg-3");

        DeliveryReport report = deliveryCoordinator.deliver(10);

        assertEquals(new DeliveryReport(3, 1, 2, 0), report);
        assertEquals(ReviewItemState.DUE, reviewItemStore.getItem(TEST_USER_ID, "word-1").orElseThrow().state());
        assertEquals(ReviewItemState.DUE, reviewItemStore.getItem(TEST_USER_ID, "word-2").orElseThrow().state());
        assertEquals(ReviewItemState.SENT, reviewItemStore.getItem(TEST_USER_ID, "word-3").orElseThrow().state());
    }

    @Test
    public void testDeliver_SkipsMissingWords() throws Exception {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", CREATED_AT);
        reviewItemStore.createOrGet(TEST_USER_ID, "missing-1", CREATED_AT);
        when(reviewNotifier.send(anyString(), any(ReviewPayload.class))).thenReturn("msg-1");

        DeliveryReport report = deliveryCoordinator.deliver(10);

        assertEquals(new DeliveryReport(2, 1, 0, 1), report);
        verify(reviewNotifier, times(1)).send(anyString(), any(ReviewPayload.class));
    }

    @Test
    public void testDeliver_StorageErrorIsolatedToItem() throws Exception {
        ReviewItemStoreMemory failingStore = new ReviewItemStoreMemory() {
            @Override
            public boolean markSent(String userId, String wordId, String messageId, Instant sentAt) {
                if (wordId.equals("word-0")) {
                    throw new StorageUnavailableException("markSent", new RuntimeException("connection refused"));
                }
                return super.markSent(userId, wordId, messageId, sentAt);
            }
        };
        DeliveryCoordinator coordinator = new DeliveryCoordinator(failingStore, wordDao, reviewNotifier, fixedClock(TEST_NOW));
        for (int i = 0; i < 3; i++) {
            failingStore.createOrGet(TEST_USER_ID, "word-" + i, CREATED_AT.plusSeconds(i));
        }
        when(reviewNotifier.send(anyString(), any(ReviewPayload.class))).thenReturn("msg-0", "msg-1", "msg-2");

        DeliveryReport report = coordinator.deliver(10);

        assertEquals(new DeliveryReport(3, 2, 1, 0), report);
        verify(reviewNotifier, times(3)).send(anyString(), any(ReviewPayload.class));
        assertEquals(ReviewItemState.CLAIMED, failingStore.getItem(TEST_USER_ID, "word-0").orElseThrow().state());
        assertEquals(ReviewItemState.SENT, failingStore.getItem(TEST_USER_ID, "word-1").orElseThrow().state());
        assertEquals(ReviewItemState.SENT, failingStore.getItem(TEST_USER_ID, "word-2").orElseThrow().state());
    }

    @Test
    public void testDeliver_NoMessageIdResetsItem() throws Exception {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", CREATED_AT.minusSeconds(60));
        reviewItemStore.createOrGet(TEST_USER_ID, "word-2", CREATED_AT);
        when(reviewNotifier.send(anyString(), any(ReviewPayload.class))).thenReturn(null, "msg-2");

        DeliveryReport report = deliveryCoordinator.deliver(10);

        assertEquals(new DeliveryReport(2, 1, 1, 0), report);

        ReviewItem unsent = reviewItemStore.getItem(TEST_USER_ID, "word-1").orElseThrow();
        assertEquals(ReviewItemState.DUE, unsent.state());
        assertNull(unsent.messageId());
        assertEquals(ReviewItemState.SENT, reviewItemStore.getItem(TEST_USER_ID, "word-2").orElseThrow().state());
    }

    @Test
    public void testDeliver_NothingDue() throws Exception {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", TEST_NOW);

        assertEquals(DeliveryReport.EMPTY, deliveryCoordinator.deliver(10));
        verify(reviewNotifier, never()).send(anyString(), any(ReviewPayload.class));
    }

    @Test
    public void testMarkSent() {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", CREATED_AT);

        assertFalse(deliveryCoordinator.markSent(TEST_USER_ID, "word-1", "msg-1", null));

        deliveryCoordinator.claim(1);
        assertTrue(deliveryCoordinator.markSent(TEST_USER_ID, "word-1", "msg-1", null));
        assertEquals(TEST_NOW, reviewItemStore.getItem(TEST_USER_ID, "word-1").orElseThrow().sentAt());
    }

    @Test
    public void testResetToDue() {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", CREATED_AT);
        deliveryCoordinator.claim(1);

        assertTrue(deliveryCoordinator.resetToDue(TEST_USER_ID, "word-1"));
        assertFalse(deliveryCoordinator.resetToDue(TEST_USER_ID, "missing"));
        assertEquals(1, deliveryCoordinator.claim(1).size());
    }

    @Test
    public void testGetGlobalDueReviews() {
        for (int i = 0; i < 5; i++) {
            reviewItemStore.createOrGet("user-" + i, "word-" + i, CREATED_AT.plusSeconds(i));
        }
        reviewItemStore.createOrGet("user-9", "missing-1", CREATED_AT.plusSeconds(2));

        DueReviewPage firstPage = deliveryCoordinator.getGlobalDueReviews(3, 0);
        assertEquals(6, firstPage.total());
        assertTrue(firstPage.hasMore());
        assertEquals(List.of("word-0", "word-1", "word-2"), firstPage.reviews().stream().map(review -> review.word().id()).toList());

        DueReviewPage secondPage = deliveryCoordinator.getGlobalDueReviews(3, 3);
        assertFalse(secondPage.hasMore());
        assertEquals(List.of("word-3", "word-4"), secondPage.reviews().stream().map(review -> review.word().id()).toList());
    }

    @Test
    public void testGetProcessingStats() {
        reviewItemStore.createOrGet(TEST_USER_ID, "word-1", CREATED_AT);
        reviewItemStore.createOrGet(TEST_USER_ID, "word-2", CREATED_AT);
        deliveryCoordinator.claim(1);

        ProcessingStats stats = deliveryCoordinator.getProcessingStats();

        assertEquals(1, stats.due());
        assertEquals(1, stats.claimed());
        assertEquals(0, stats.awaitingResponse());
    }
}
