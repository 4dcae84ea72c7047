package com.xpdustry.lexiscan.common.dictionary;

import com.xpdustry.lexiscan.common.config.LexiscanConfig;
import com.xpdustry.lexiscan.common.factory.ObjectBinder;
import com.xpdustry.lexiscan.common.factory.ObjectModule;
import com.xpdustry.lexiscan.common.text.CharacterTokenizer;
import com.xpdustry.lexiscan.common.text.FoldingNormalizer;
import com.xpdustry.lexiscan.common.text.Normalizer;
import com.xpdustry.lexiscan.common.text.SimpleNormalizer;
import com.xpdustry.lexiscan.common.text.Tokenizer;
import com.xpdustry.lexiscan.common.text.WordTokenizer;
import jakarta.inject.Inject;
import jakarta.inject.Provider;

public final class DictionaryModule implements ObjectModule {

    private final LexiscanConfig config;

    public DictionaryModule(final LexiscanConfig config) {
        this.config = config;
    }

    @Override
    public void configure(final ObjectBinder binder) {
        binder.bind(LexiscanConfig.class).toInst(this.config);
        binder.bind(Normalizer.class).toProv(NormalizerProvider.class);
        binder.bind(Tokenizer.class).toProv(TokenizerProvider.class);
        binder.bind(DictionaryService.class).toImpl(DictionaryServiceImpl.class);
    }

    private static class NormalizerProvider implements Provider<Normalizer> {
        private final LexiscanConfig config;

        @Inject
        public NormalizerProvider(final LexiscanConfig config) {
            this.config = config;
        }

        @Override
        public Normalizer get() {
            return switch (this.config.normalizer()) {
                case SIMPLE -> SimpleNormalizer.INSTANCE;
                case FOLDING -> FoldingNormalizer.INSTANCE;
            };
        }
    }

    private static class TokenizerProvider implements Provider<Tokenizer> {
        private final LexiscanConfig config;

        @Inject
        public TokenizerProvider(final LexiscanConfig config) {
            this.config = config;
        }

        @Override
        public Tokenizer get() {
            return switch (this.config.tokenizer()) {
                case WORD -> WordTokenizer.INSTANCE;
                case CHARACTER -> CharacterTokenizer.INSTANCE;
            };
        }
    }
}
