package com.gt.vocab.util;

public class LimitUtil {

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 50;

    // Batch and page sizes coming from callers are kept within 1..50
    public static int clampLimit(int limit) {
        return Math.max(MIN_LIMIT, Math.min(MAX_LIMIT, limit));
    }
}
