package com.gt.vocab.reviewItem;

import com.gt.vocab.model.Difficulty;
import com.gt.vocab.model.ReviewItem;
import com.gt.vocab.model.ReviewItemStats;
import com.gt.vocab.model.ReviewWithWord;
import com.gt.vocab.review.ReviewRecorder;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/rest/review-items")
public class ReviewItemController {

    private final ReviewItemService reviewItemService;
    private final ReviewRecorder reviewRecorder;

    public ReviewItemController(ReviewItemService reviewItemService,
                                ReviewRecorder reviewRecorder) {
        this.reviewItemService = reviewItemService;
        this.reviewRecorder = reviewRecorder;
    }

    @GetMapping(value = "/due", produces = "application/json")
    public List<ReviewWithWord> getDueReviews(@RequestParam(value = "userId") String userId,
                                              @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return reviewItemService.getDueReviews(requireId("userId", userId), limit);
    }

    @PostMapping(value = "/review", consumes = "application/json", produces = "application/json")
    public ReviewItem recordReview(@RequestBody RecordReviewRequest request) {
        return reviewRecorder.recordReview(
                requireId("userId", request.userId()),
                requireId("wordId", request.wordId()),
                Difficulty.fromValue(request.difficulty()));
    }

    @GetMapping(value = "/stats", produces = "application/json")
    public ReviewItemStats getStats(@RequestParam(value = "userId") String userId) {
        return reviewItemService.getStats(requireId("userId", userId));
    }

    @PostMapping(value = "/create", consumes = "application/json", produces = "application/json")
    public ReviewItem createItem(@RequestBody ReviewItemRequest request) {
        return reviewItemService.createItem(requireId("userId", request.userId()), requireId("wordId", request.wordId()));
    }

    @PostMapping(value = "/deactivate", consumes = "application/json")
    public void deactivateItem(@RequestBody ReviewItemRequest request) {
        if (!reviewItemService.deactivateItem(requireId("userId", request.userId()), requireId("wordId", request.wordId()))) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No review item for " + request.userId() + ":" + request.wordId());
        }
    }

    private static String requireId(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private record RecordReviewRequest(String userId, String wordId, String difficulty) { }
    private record ReviewItemRequest(String userId, String wordId) { }
}
