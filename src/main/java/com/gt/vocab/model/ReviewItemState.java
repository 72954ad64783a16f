package com.gt.vocab.model;

public enum ReviewItemState {
    // Active and not reserved. Eligible for claim once nextReviewAt has passed.
    DUE,
    // Reserved by a delivery worker, not yet confirmed sent
    CLAIMED,
    // Dispatched by the notifier, waiting for the user's response
    SENT,
    // Permanently excluded from scheduling
    INACTIVE
}
