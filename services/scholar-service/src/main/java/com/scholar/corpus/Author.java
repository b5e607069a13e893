package com.scholar.corpus;

public record Author(String name, String profile) {}
