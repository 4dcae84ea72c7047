package com.xpdustry.lexiscan.common.text;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class WordTokenizer implements Tokenizer {

    public static final WordTokenizer INSTANCE = new WordTokenizer();

    // Marks belong to the word so decomposed accents stay attached to their letter
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{M}\\p{N}]+");

    private WordTokenizer() {}

    @Override
    public List<Token> tokens(final String buffer) {
        Preconditions.checkNotNull(buffer, "buffer");
        final List<Token> tokens = new ArrayList<>();
        final var matcher = WORD.matcher(buffer);
        while (matcher.find()) {
            tokens.add(new Token(matcher.group(), new Span(matcher.start(), matcher.end())));
        }
        return tokens;
    }

    @Override
    public String separator() {
        return " ";
    }
}
