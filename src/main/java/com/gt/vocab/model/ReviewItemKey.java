package com.gt.vocab.model;

import java.util.Comparator;

public record ReviewItemKey(String userId, String wordId) {

    public static final Comparator<ReviewItemKey> ORDER =
            Comparator.comparing(ReviewItemKey::userId).thenComparing(ReviewItemKey::wordId);

    @Override
    public String toString() {
        return userId + ":" + wordId;
    }
}
