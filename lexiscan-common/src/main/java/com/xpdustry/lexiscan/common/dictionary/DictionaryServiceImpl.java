package com.xpdustry.lexiscan.common.dictionary;

import com.xpdustry.lexiscan.common.collection.Trie;
import com.xpdustry.lexiscan.common.config.LexiscanConfig;
import com.xpdustry.lexiscan.common.search.Match;
import com.xpdustry.lexiscan.common.search.StringFinder;
import com.xpdustry.lexiscan.common.text.Normalizer;
import com.xpdustry.lexiscan.common.text.Tokenizer;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class DictionaryServiceImpl implements DictionaryService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DictionaryServiceImpl.class);

    private final StringFinder<String> finder;
    private final int size;

    @Inject
    public DictionaryServiceImpl(final LexiscanConfig config, final Normalizer normalizer, final Tokenizer tokenizer) {
        final var location = config.dictionary();
        final Dictionary dictionary;
        if (location == null) {
            LOGGER.warn("No dictionary configured, nothing will ever match");
            dictionary = new Dictionary("<empty>", Trie.<String>create().freeze(), 0);
        } else {
            final var loader = new DictionaryLoader(normalizer, tokenizer);
            dictionary = location.startsWith(LexiscanConfig.CLASSPATH_PREFIX)
                    ? loader.loadResource(location.substring(LexiscanConfig.CLASSPATH_PREFIX.length()))
                    : loader.load(Path.of(location));
        }
        this.finder = StringFinder.create(dictionary.trie(), normalizer, tokenizer);
        this.size = dictionary.entries();
    }

    @Override
    public Stream<Match<String>> scan(final String buffer) {
        return this.finder.stream(buffer);
    }

    @Override
    public int size() {
        return this.size;
    }
}
