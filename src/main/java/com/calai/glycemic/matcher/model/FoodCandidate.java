package com.calai.glycemic.matcher.model;

/** score 落在 [0, 1]，越大越像 */
public record FoodCandidate(String name, double score) {}
