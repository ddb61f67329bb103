package com.storereplenishment.feature;

public record WindowStats(int window, double mean, double std, double min, double max) {}
