package com.gt.vocab.model;

import java.util.Locale;

/**
 * Self-reported difficulty of a completed review. Each level carries the base interval used by the scheduling policy,
 * increasing with ease.
 */
public enum Difficulty {
    HARD(10),
    NORMAL(24 * 60),
    GOOD(3 * 24 * 60),
    EASY(7 * 24 * 60);

    private final int baseIntervalMinutes;

    Difficulty(int baseIntervalMinutes) {
        this.baseIntervalMinutes = baseIntervalMinutes;
    }

    public int getBaseIntervalMinutes() {
        return baseIntervalMinutes;
    }

    // Accepts the enum names as well as the rating names used by the quiz and bot clients
    public static Difficulty fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Difficulty is required");
        }

        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "very_hard", "hard" -> HARD;
            case "medium", "normal" -> NORMAL;
            case "good" -> GOOD;
            case "easy" -> EASY;
            default -> throw new IllegalArgumentException("Unknown difficulty " + value);
        };
    }
}
