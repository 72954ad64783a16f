package com.gt.vocab.reviewItem.impl;

import com.gt.vocab.model.ReviewItem;
import com.gt.vocab.model.ReviewItemKey;
import com.gt.vocab.model.ReviewItemState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;

import static com.gt.vocab.util.TestUtils.TEST_NOW;
import static org.junit.jupiter.api.Assertions.*;

// Runs the store's SQL against a real PostgreSQL; skipped when no Docker daemon is available
@Testcontainers(disabledWithoutDocker = true)
public class ReviewItemStorePGContainerTests {

    private static final String TEST_USER_ID = "user-1";
    private static final Instant DUE_NOW = TEST_NOW.plus(Duration.ofHours(1));

    @Container
    private static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    private NamedParameterJdbcTemplate template;
    private ReviewItemStorePG store;

    @BeforeEach
    public void setup() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/schema-postgres.sql")).execute(dataSource);

        template = new NamedParameterJdbcTemplate(dataSource);
        template.getJdbcTemplate().execute("TRUNCATE review_item, words");
        store = new ReviewItemStorePG(template);
    }

    @Test
    public void testClaimReviews_OrderAndLimit() {
        insertWords(3);
        store.createOrGet(TEST_USER_ID, "word-2", TEST_NOW.minusSeconds(60));
        store.createOrGet(TEST_USER_ID, "word-0", TEST_NOW.minusSeconds(120));
        store.createOrGet(TEST_USER_ID, "word-1", TEST_NOW);

        List<ReviewItem> claimed = store.claimReviews(2, DUE_NOW);

        assertEquals(List.of("word-0", "word-2"), claimed.stream().map(ReviewItem::wordId).toList());
        for (ReviewItem item : claimed) {
            assertEquals(ReviewItemState.CLAIMED, item.state());
            assertEquals(DUE_NOW, item.claimedAt());
        }
        assertEquals(List.of("word-1"), store.claimReviews(10, DUE_NOW).stream().map(ReviewItem::wordId).toList());
        assertTrue(store.claimReviews(10, DUE_NOW).isEmpty());
    }

    @Test
    public void testClaimReviews_ConcurrentWorkersClaimDisjointItems() throws Exception {
        int itemCnt = 40;
        insertWords(itemCnt);
        for (int i = 0; i < itemCnt; i++) {
            store.createOrGet(TEST_USER_ID, "word-" + i, TEST_NOW.plusSeconds(i));
        }

        int workerCnt = 4;
        ExecutorService executor = Executors.newFixedThreadPool(workerCnt);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<List<ReviewItem>>> futures = new ArrayList<>();
            for (int i = 0; i < workerCnt; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    List<ReviewItem> claimed = new ArrayList<>();
                    List<ReviewItem> batch;
                    while (!(batch = store.claimReviews(3, DUE_NOW)).isEmpty()) {
                        claimed.addAll(batch);
                    }
                    return claimed;
                }));
            }
            start.countDown();

            Set<ReviewItemKey> claimedKeys = new HashSet<>();
            int claimedCnt = 0;
            for (Future<List<ReviewItem>> future : futures) {
                for (ReviewItem item : future.get(60, TimeUnit.SECONDS)) {
                    claimedKeys.add(item.key());
                    claimedCnt++;
                }
            }

            assertEquals(itemCnt, claimedCnt);
            assertEquals(itemCnt, claimedKeys.size());
            assertEquals(itemCnt, store.getProcessingStats(DUE_NOW).claimed());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testDeliveryLifecycle() {
        insertWords(2);
        store.createOrGet(TEST_USER_ID, "word-0", TEST_NOW);
        store.createOrGet(TEST_USER_ID, "word-1", TEST_NOW);
        store.claimReviews(10, DUE_NOW);

        assertTrue(store.markSent(TEST_USER_ID, "word-0", "msg-0", DUE_NOW));
        assertFalse(store.markSent(TEST_USER_ID, "word-0", "msg-dup", DUE_NOW));

        ReviewItem sent = store.getItem(TEST_USER_ID, "word-0").orElseThrow();
        assertEquals(ReviewItemState.SENT, sent.state());
        assertEquals("msg-0", sent.messageId());

        Instant later = DUE_NOW.plus(Duration.ofMinutes(30));
        assertEquals(1, store.releaseStaleClaims(Duration.ofMinutes(15), later));
        assertEquals(0, store.processTimeouts(Duration.ofMinutes(60), later));
        assertEquals(1, store.processTimeouts(Duration.ofMinutes(15), later));

        for (String wordId : List.of("word-0", "word-1")) {
            ReviewItem item = store.getItem(TEST_USER_ID, wordId).orElseThrow();
            assertEquals(ReviewItemState.DUE, item.state());
            assertNull(item.messageId());
        }
    }

    @Test
    public void testDeactivatedItemsAreNotClaimed() {
        insertWords(2);
        store.createOrGet(TEST_USER_ID, "word-0", TEST_NOW);
        store.createOrGet(TEST_USER_ID, "word-1", TEST_NOW);
        assertTrue(store.deactivate(TEST_USER_ID, "word-0"));

        assertEquals(List.of("word-1"), store.claimReviews(10, DUE_NOW).stream().map(ReviewItem::wordId).toList());
    }

    @Test
    public void testCreateOrGet_UnknownWordRejected() {
        assertThrows(DataIntegrityViolationException.class, () -> store.createOrGet(TEST_USER_ID, "word-unknown", TEST_NOW));
    }

    private void insertWords(int wordCnt) {
        for (int i = 0; i < wordCnt; i++) {
            template.update("INSERT INTO words (id, text_en) VALUES (:id, :text)", Map.of("id", "word-" + i, "text", "text-" + i));
        }
    }
}
