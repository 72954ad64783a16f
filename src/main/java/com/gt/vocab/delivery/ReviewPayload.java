package com.gt.vocab.delivery;

import com.gt.vocab.model.ReviewWithWord;

import java.util.List;

public record ReviewPayload(String wordId,
                            String text,
                            String level,
                            String exampleEn,
                            String exampleRu,
                            List<String> tags,
                            int reviewCount) {

    public static ReviewPayload from(ReviewWithWord review) {
        return new ReviewPayload(
                review.word().id(),
                review.word().text(),
                review.word().level(),
                review.word().exampleEn(),
                review.word().exampleRu(),
                review.word().tags(),
                review.item().reviewCount());
    }
}
