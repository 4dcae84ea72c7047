package com.xpdustry.lexiscan.common.search;

import com.xpdustry.lexiscan.common.text.Span;
import org.jspecify.annotations.Nullable;

public record Match<V>(String match, String surface, @Nullable V meta, Span span) {}
