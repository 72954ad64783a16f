package com.gt.vocab.reviewItem.impl;

import com.gt.vocab.exception.MappingException;
import com.gt.vocab.exception.StorageUnavailableException;
import com.gt.vocab.model.*;
import com.gt.vocab.reviewItem.ReviewItemStore;
import com.gt.vocab.schedule.SchedulingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

public class ReviewItemStorePG implements ReviewItemStore {

    private static final Logger log = LoggerFactory.getLogger(ReviewItemStorePG.class);

    private static final String ITEM_COLUMNS =
            "user_id, word_id, next_review_at, last_review_at, interval_minutes, review_count, difficulty_last, active, claimed_at, sent_at, message_id";

    private static final String ELIGIBLE_CONDITION =
            "active IS TRUE AND claimed_at IS NULL AND next_review_at <= :now";

    private static final String DUE_ORDER_BY =
            "ORDER BY next_review_at ASC, user_id ASC, word_id ASC";

    private static final String GET_ITEM_SQL =
            "SELECT " + ITEM_COLUMNS + " " +
            "FROM review_item " +
            "WHERE user_id = :userId AND word_id = :wordId";

    private static final String GET_DUE_ITEMS_SQL =
            "SELECT " + ITEM_COLUMNS + " " +
            "FROM review_item " +
            "WHERE user_id = :userId AND " + ELIGIBLE_CONDITION + " " +
            DUE_ORDER_BY + " LIMIT :limit";

    private static final String CREATE_ITEM_SQL =
            "INSERT INTO review_item " +
                    "(user_id, word_id, next_review_at, interval_minutes, review_count, active, create_instant, update_instant) " +
                    "VALUES (:userId, :wordId, :nextReviewAt, :intervalMinutes, 0, true, :now, :now) " +
            "ON CONFLICT (user_id, word_id) DO NOTHING";

    private static final String UPDATE_AFTER_REVIEW_SQL =
            "UPDATE review_item " +
            "SET next_review_at = :nextReviewAt, interval_minutes = :intervalMinutes, difficulty_last = :difficulty, " +
                "last_review_at = :now, review_count = review_count + 1, " +
                "claimed_at = NULL, sent_at = NULL, message_id = NULL, update_instant = :now " +
            "WHERE user_id = :userId AND word_id = :wordId AND active IS TRUE";

    private static final String DEACTIVATE_SQL =
            "UPDATE review_item " +
            "SET active = false, claimed_at = NULL, sent_at = NULL, message_id = NULL, update_instant = now() " +
            "WHERE user_id = :userId AND word_id = :wordId";

    private static final String GET_STATS_SQL =
            "SELECT COUNT(*) AS total, " +
                "COUNT(*) FILTER (WHERE active IS TRUE) AS active, " +
                "COUNT(*) FILTER (WHERE " + ELIGIBLE_CONDITION + ") AS due, " +
                "COALESCE(SUM(review_count), 0) AS review_count " +
            "FROM review_item " +
            "WHERE user_id = :userId";

    private static final String GET_GLOBAL_DUE_REVIEWS_SQL =
            "SELECT " + ITEM_COLUMNS + " " +
            "FROM review_item " +
            "WHERE " + ELIGIBLE_CONDITION + " " +
            DUE_ORDER_BY + " LIMIT :limit OFFSET :offset";

    // Select and mark in one statement. SKIP LOCKED keeps concurrent claimers from blocking on each other's rows, and
    // the outer claimed_at check stops a row from being claimed twice if it was changed after the subquery read it.
    private static final String CLAIM_REVIEWS_SQL =
            "UPDATE review_item " +
            "SET claimed_at = :now, update_instant = :now " +
            "WHERE (user_id, word_id) IN (" +
                "SELECT user_id, word_id " +
                "FROM review_item " +
                "WHERE " + ELIGIBLE_CONDITION + " " +
                DUE_ORDER_BY + " LIMIT :limit " +
                "FOR UPDATE SKIP LOCKED) " +
            "AND claimed_at IS NULL " +
            "RETURNING " + ITEM_COLUMNS;

    private static final String MARK_SENT_SQL =
            "UPDATE review_item " +
            "SET sent_at = :sentAt, message_id = :messageId, update_instant = :sentAt " +
            "WHERE user_id = :userId AND word_id = :wordId AND active IS TRUE AND claimed_at IS NOT NULL AND sent_at IS NULL";

    private static final String RESET_TO_DUE_SQL =
            "UPDATE review_item " +
            "SET claimed_at = NULL, sent_at = NULL, message_id = NULL, update_instant = now() " +
            "WHERE user_id = :userId AND word_id = :wordId AND active IS TRUE";

    private static final String PROCESS_TIMEOUTS_SQL =
            "UPDATE review_item " +
            "SET claimed_at = NULL, sent_at = NULL, message_id = NULL, update_instant = :now " +
            "WHERE claimed_at IS NOT NULL AND sent_at IS NOT NULL AND sent_at < :cutoff";

    private static final String RELEASE_STALE_CLAIMS_SQL =
            "UPDATE review_item " +
            "SET claimed_at = NULL, update_instant = :now " +
            "WHERE claimed_at IS NOT NULL AND sent_at IS NULL AND claimed_at < :cutoff";

    private static final String GET_PROCESSING_STATS_SQL =
            "SELECT COUNT(*) FILTER (WHERE " + ELIGIBLE_CONDITION + ") AS due, " +
                "COUNT(*) FILTER (WHERE active IS TRUE AND claimed_at IS NOT NULL AND sent_at IS NULL) AS claimed, " +
                "COUNT(*) FILTER (WHERE active IS TRUE AND sent_at IS NOT NULL) AS awaiting_response, " +
                "COUNT(*) FILTER (WHERE last_review_at >= :startOfDay) AS processed_today " +
            "FROM review_item";

    private final NamedParameterJdbcTemplate template;

    public ReviewItemStorePG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Optional<ReviewItem> getItem(String userId, String wordId) {
        return withStorage("getItem", () -> template.query(GET_ITEM_SQL,
                        Map.of("userId", userId, "wordId", wordId),
                        ReviewItemStorePG::getReviewItemFromResultSet)
                .stream()
                .findFirst());
    }

    @Override
    public List<ReviewItem> getDueItems(String userId, Instant now, int limit) {
        return withStorage("getDueItems", () -> template.query(GET_DUE_ITEMS_SQL,
                Map.of("userId", userId,
                       "now", Timestamp.from(now),
                       "limit", limit),
                ReviewItemStorePG::getReviewItemFromResultSet));
    }

    @Override
    public ReviewItem createOrGet(String userId, String wordId, Instant now) {
        ReviewSchedule initialSchedule = SchedulingPolicy.initialSchedule(now);

        int created = withStorage("createOrGet", () -> template.update(CREATE_ITEM_SQL, Map.of(
                "userId", userId,
                "wordId", wordId,
                "nextReviewAt", Timestamp.from(initialSchedule.nextReviewAt()),
                "intervalMinutes", initialSchedule.nextIntervalMinutes(),
                "now", Timestamp.from(now))));

        if (created > 0) {
            log.debug("Created review item {}:{}", userId, wordId);
        }

        // The insert is a no-op when the item already exists, so the stored row is returned either way
        return getItem(userId, wordId).orElseThrow(() ->
                new IllegalStateException("Review item " + userId + ":" + wordId + " missing after create"));
    }

    @Override
    public boolean updateAfterReview(String userId, String wordId, ReviewSchedule schedule, Difficulty difficulty, Instant now) {
        return withStorage("updateAfterReview", () -> template.update(UPDATE_AFTER_REVIEW_SQL, Map.of(
                "userId", userId,
                "wordId", wordId,
                "nextReviewAt", Timestamp.from(schedule.nextReviewAt()),
                "intervalMinutes", schedule.nextIntervalMinutes(),
                "difficulty", difficulty.name(),
                "now", Timestamp.from(now)))) > 0;
    }

    @Override
    public boolean deactivate(String userId, String wordId) {
        return withStorage("deactivate", () -> template.update(DEACTIVATE_SQL,
                Map.of("userId", userId, "wordId", wordId))) > 0;
    }

    @Override
    public ReviewItemStats getStats(String userId, Instant now) {
        return withStorage("getStats", () -> template.queryForObject(GET_STATS_SQL,
                Map.of("userId", userId, "now", Timestamp.from(now)),
                (rs, rowNum) -> new ReviewItemStats(
                        rs.getInt("total"),
                        rs.getInt("active"),
                        rs.getInt("due"),
                        rs.getInt("review_count"))));
    }

    @Override
    public List<ReviewItem> getGlobalDueReviews(Instant now, int limit, int offset) {
        return withStorage("getGlobalDueReviews", () -> template.query(GET_GLOBAL_DUE_REVIEWS_SQL,
                Map.of("now", Timestamp.from(now),
                       "limit", limit,
                       "offset", offset),
                ReviewItemStorePG::getReviewItemFromResultSet));
    }

    @Override
    public List<ReviewItem> claimReviews(int limit, Instant now) {
        List<ReviewItem> returned = withStorage("claimReviews", () -> template.query(CLAIM_REVIEWS_SQL,
                Map.of("now", Timestamp.from(now), "limit", limit),
                ReviewItemStorePG::getReviewItemFromResultSet));

        // RETURNING does not preserve the subquery order
        List<ReviewItem> claimed = new ArrayList<>(returned);
        claimed.sort(ReviewItem.DUE_ORDER);

        log.debug("Claimed {} review items", claimed.size());
        return claimed;
    }

    @Override
    public boolean markSent(String userId, String wordId, String messageId, Instant sentAt) {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("Review item " + userId + ":" + wordId + " cannot be marked sent without a message id");
        }

        return withStorage("markSent", () -> template.update(MARK_SENT_SQL, Map.of(
                "userId", userId,
                "wordId", wordId,
                "messageId", messageId,
                "sentAt", Timestamp.from(sentAt)))) > 0;
    }

    @Override
    public boolean resetToDue(String userId, String wordId) {
        return withStorage("resetToDue", () -> template.update(RESET_TO_DUE_SQL,
                Map.of("userId", userId, "wordId", wordId))) > 0;
    }

    @Override
    public int processTimeouts(Duration timeout, Instant now) {
        return withStorage("processTimeouts", () -> template.update(PROCESS_TIMEOUTS_SQL, Map.of(
                "now", Timestamp.from(now),
                "cutoff", Timestamp.from(now.minus(timeout)))));
    }

    @Override
    public int releaseStaleClaims(Duration claimTimeout, Instant now) {
        return withStorage("releaseStaleClaims", () -> template.update(RELEASE_STALE_CLAIMS_SQL, Map.of(
                "now", Timestamp.from(now),
                "cutoff", Timestamp.from(now.minus(claimTimeout)))));
    }

    @Override
    public ProcessingStats getProcessingStats(Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("now", Timestamp.from(now));
        params.addValue("startOfDay", Timestamp.from(now.truncatedTo(ChronoUnit.DAYS)));

        return withStorage("getProcessingStats", () -> template.queryForObject(GET_PROCESSING_STATS_SQL, params,
                (rs, rowNum) -> new ProcessingStats(
                        rs.getInt("due"),
                        rs.getInt("claimed"),
                        rs.getInt("awaiting_response"),
                        rs.getInt("processed_today"))));
    }

    private static <T> T withStorage(String operation, Supplier<T> statement) {
        try {
            return statement.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException ex) {
            log.error("Review item store unavailable during {}", operation, ex);
            throw new StorageUnavailableException(operation, ex);
        }
    }

    static ReviewItem getReviewItemFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewItem(
                rs.getString("user_id"),
                rs.getString("word_id"),
                toInstant(rs.getTimestamp("next_review_at")),
                toInstant(rs.getTimestamp("last_review_at")),
                rs.getInt("interval_minutes"),
                rs.getInt("review_count"),
                toDifficulty(rs.getString("difficulty_last")),
                rs.getBoolean("active"),
                toInstant(rs.getTimestamp("claimed_at")),
                toInstant(rs.getTimestamp("sent_at")),
                rs.getString("message_id"));
    }

    private static Difficulty toDifficulty(String value) {
        if (value == null) {
            return null;
        }

        try {
            return Difficulty.valueOf(value);
        } catch (IllegalArgumentException ex) {
            throw new MappingException("difficulty_last", value, ex);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
