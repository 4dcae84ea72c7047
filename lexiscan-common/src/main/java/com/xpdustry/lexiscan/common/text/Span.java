package com.xpdustry.lexiscan.common.text;

import com.google.common.base.Preconditions;

public record Span(int start, int end) {

    public Span {
        Preconditions.checkArgument(start >= 0, "start must not be negative, got %s", start);
        Preconditions.checkArgument(end >= start, "end (%s) must not precede start (%s)", end, start);
    }

    public int length() {
        return this.end - this.start;
    }

    public String substring(final CharSequence text) {
        return text.subSequence(this.start, this.end).toString();
    }
}
