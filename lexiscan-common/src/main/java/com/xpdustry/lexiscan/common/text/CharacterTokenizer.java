package com.xpdustry.lexiscan.common.text;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

public final class CharacterTokenizer implements Tokenizer {

    public static final CharacterTokenizer INSTANCE = new CharacterTokenizer();

    private CharacterTokenizer() {}

    @Override
    public List<Token> tokens(final String buffer) {
        Preconditions.checkNotNull(buffer, "buffer");
        final List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < buffer.length()) {
            final var codepoint = buffer.codePointAt(i);
            final var next = i + Character.charCount(codepoint);
            if (!Character.isWhitespace(codepoint)) {
                tokens.add(new Token(buffer.substring(i, next), new Span(i, next)));
            }
            i = next;
        }
        return tokens;
    }

    @Override
    public String separator() {
        return "";
    }
}
