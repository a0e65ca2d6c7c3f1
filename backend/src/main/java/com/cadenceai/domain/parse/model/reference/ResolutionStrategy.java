package com.cadenceai.domain.parse.model.reference;

/**
 * How a name must be matched against project entities. Decided purely by quoting:
 * quoted names match exactly, unquoted names need fuzzy matching, tags match tags.
 */
public enum ResolutionStrategy {
    EXACT_MATCH,
    CASE_INSENSITIVE,
    FUZZY_MATCH,
    PREFIX_MATCH,
    TAG_MATCH;

    public static ResolutionStrategy forQuoteStyle(QuoteStyle style) {
        return style.isQuoted() ? EXACT_MATCH : FUZZY_MATCH;
    }
}
