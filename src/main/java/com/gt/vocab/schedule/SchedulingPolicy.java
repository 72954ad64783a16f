package com.gt.vocab.schedule;

import com.gt.vocab.model.Difficulty;
import com.gt.vocab.model.ReviewSchedule;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Computes review intervals from a difficulty rating. The interval is the difficulty's base interval multiplied by the
 * number of reviews completed before this one, floored at 1 so a first review still gets the full base interval.
 * Reviews are scheduled on an absolute timeline; no calendar or time zone adjustment is applied.
 */
public final class SchedulingPolicy {

    private SchedulingPolicy() { }

    public static ReviewSchedule computeNextSchedule(Instant now, int previousIntervalMinutes, int previousReviewCount, Difficulty difficulty) {
        int factor = Math.max(1, previousReviewCount);
        int nextIntervalMinutes = difficulty.getBaseIntervalMinutes() * factor;

        return new ReviewSchedule(nextIntervalMinutes, now.plus(nextIntervalMinutes, ChronoUnit.MINUTES));
    }

    // New items start at the hardest difficulty's interval
    public static ReviewSchedule initialSchedule(Instant now) {
        int intervalMinutes = Difficulty.HARD.getBaseIntervalMinutes();

        return new ReviewSchedule(intervalMinutes, now.plus(intervalMinutes, ChronoUnit.MINUTES));
    }
}
