package com.gt.vocab.model;

// total and reviewCount include deactivated items
public record ReviewItemStats(int total, int active, int due, int reviewCount) { }
