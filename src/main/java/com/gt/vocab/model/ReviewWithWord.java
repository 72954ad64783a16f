package com.gt.vocab.model;

/**
 * A review item joined with its catalog word, as handed to delivery workers and API callers.
 */
public record ReviewWithWord(ReviewItem item, Word word) { }
