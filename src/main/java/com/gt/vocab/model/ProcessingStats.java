package com.gt.vocab.model;

public record ProcessingStats(int due, int claimed, int awaitingResponse, int processedToday) { }
