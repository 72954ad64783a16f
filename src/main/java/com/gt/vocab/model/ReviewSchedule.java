package com.gt.vocab.model;

import java.time.Instant;

public record ReviewSchedule(int nextIntervalMinutes, Instant nextReviewAt) { }
