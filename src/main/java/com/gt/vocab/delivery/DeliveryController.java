package com.gt.vocab.delivery;

import com.gt.vocab.model.DueReviewPage;
import com.gt.vocab.model.ProcessingStats;
import com.gt.vocab.model.ReviewWithWord;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

// Operational endpoints for delivery workers that dispatch reviews themselves
@RestController
@RequestMapping("/rest/delivery")
public class DeliveryController {

    private static final int DEFAULT_LIMIT = 10;

    private final DeliveryCoordinator deliveryCoordinator;
    private final TimeoutSweeper timeoutSweeper;

    public DeliveryController(DeliveryCoordinator deliveryCoordinator,
                              TimeoutSweeper timeoutSweeper) {
        this.deliveryCoordinator = deliveryCoordinator;
        this.timeoutSweeper = timeoutSweeper;
    }

    @GetMapping(value = "/due-reviews", produces = "application/json")
    public DueReviewPage getDueReviews(@RequestParam(value = "limit", defaultValue = "10") int limit,
                                       @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return deliveryCoordinator.getGlobalDueReviews(limit, offset);
    }

    @PostMapping(value = "/claim", produces = "application/json")
    public List<ReviewWithWord> claimReviews(@RequestBody(required = false) ClaimRequest request) {
        return deliveryCoordinator.claim(request == null || request.limit() == null ? DEFAULT_LIMIT : request.limit());
    }

    @PutMapping(value = "/items/{userId}/{wordId}/mark-sent", consumes = "application/json")
    public void markSent(@PathVariable("userId") String userId,
                         @PathVariable("wordId") String wordId,
                         @RequestBody MarkSentRequest request) {
        if (request.messageId() == null || request.messageId().isBlank()) {
            throw new IllegalArgumentException("messageId is required");
        }

        if (!deliveryCoordinator.markSent(userId, wordId, request.messageId(), request.sentAt())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Review item " + userId + ":" + wordId + " is not claimed");
        }
    }

    @PutMapping(value = "/items/{userId}/{wordId}/reset-to-due")
    public void resetToDue(@PathVariable("userId") String userId,
                           @PathVariable("wordId") String wordId) {
        if (!deliveryCoordinator.resetToDue(userId, wordId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No active review item for " + userId + ":" + wordId);
        }
    }

    @PostMapping(value = "/process-timeouts", produces = "application/json")
    public ProcessTimeoutsResponse processTimeouts(@RequestBody(required = false) ProcessTimeoutsRequest request) {
        int timeoutMinutes = request == null || request.timeoutMinutes() == null
                ? timeoutSweeper.getTimeoutMinutes()
                : request.timeoutMinutes();

        return new ProcessTimeoutsResponse(timeoutSweeper.processTimeouts(timeoutMinutes));
    }

    @GetMapping(value = "/processing-stats", produces = "application/json")
    public ProcessingStats getProcessingStats() {
        return deliveryCoordinator.getProcessingStats();
    }

    private record ClaimRequest(Integer limit) { }
    private record MarkSentRequest(String messageId, Instant sentAt) { }
    private record ProcessTimeoutsRequest(Integer timeoutMinutes) { }
    public record ProcessTimeoutsResponse(int processedCount) { }
}
