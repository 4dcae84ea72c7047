package com.xpdustry.lexiscan.common.dictionary;

@SuppressWarnings("serial")
public final class DictionaryLoadException extends RuntimeException {

    private final String source;

    public DictionaryLoadException(final String message, final String source) {
        super(message);
        this.source = source;
    }

    public DictionaryLoadException(final String message, final String source, final Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String source() {
        return this.source;
    }
}
