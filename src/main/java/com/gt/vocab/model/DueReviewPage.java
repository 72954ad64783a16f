package com.gt.vocab.model;

import java.util.List;

public record DueReviewPage(List<ReviewWithWord> reviews, int total, boolean hasMore) { }
