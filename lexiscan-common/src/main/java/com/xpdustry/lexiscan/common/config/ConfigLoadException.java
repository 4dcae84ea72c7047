package com.xpdustry.lexiscan.common.config;

@SuppressWarnings("serial")
public final class ConfigLoadException extends RuntimeException {

    private final String source;

    public ConfigLoadException(final String message, final String source) {
        super(message);
        this.source = source;
    }

    public ConfigLoadException(final String message, final String source, final Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String source() {
        return this.source;
    }
}
