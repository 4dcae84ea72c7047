package com.xpdustry.lexiscan.common.text;

public record Token(String term, Span span) {}
