package com.xpdustry.lexiscan.common.text;

import java.util.List;

public interface Tokenizer {

    List<Token> tokens(final String buffer);

    default List<String> strings(final String buffer) {
        return this.tokens(buffer).stream().map(Token::term).toList();
    }

    default List<Span> spans(final String buffer) {
        return this.tokens(buffer).stream().map(Token::span).toList();
    }

    String separator();

    default String join(final Iterable<? extends CharSequence> terms) {
        return String.join(this.separator(), terms);
    }
}
