package com.scholar.classify;

public record CategoryMetrics(double precision, double recall, double f1, int support) {}
