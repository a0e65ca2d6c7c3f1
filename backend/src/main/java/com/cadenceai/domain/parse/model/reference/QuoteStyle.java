package com.cadenceai.domain.parse.model.reference;

public enum QuoteStyle {
    SINGLE,
    DOUBLE,
    SMART_SINGLE,
    SMART_DOUBLE,
    BACKTICK,
    NONE;

    public static QuoteStyle of(char quote) {
        return switch (quote) {
            case '\'' -> SINGLE;
            case '"' -> DOUBLE;
            case '‘', '’', '‚', '‛' -> SMART_SINGLE;
            case '“', '”', '„', '‟' -> SMART_DOUBLE;
            case '`' -> BACKTICK;
            default -> NONE;
        };
    }

    public boolean isQuoted() {
        return this != NONE;
    }
}
