package com.cadenceai.infrastructure.parse.tokenizer;

import org.springframework.stereotype.Component;

/**
 * Folds typographic characters to their ASCII counterparts before the raw scan:
 * - smart single quotes → '
 * - smart double quotes → "
 * - en/em dash → -
 * - ellipsis → .
 *
 * Every replacement is one char for one char, so offsets into the folded text are offsets
 * into the source.
 */
@Component
public class TextNormalizer {

    /**
     * @param text raw user input, may be null
     * @return folded text of the same length; empty for null
     */
    public String foldTypography(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        char[] chars = text.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = fold(chars[i]);
        }
        return new String(chars);
    }

    static char fold(char ch) {
        return switch (ch) {
            case '‘', '’', '‚', '‛' -> '\'';
            case '“', '”', '„', '‟' -> '"';
            case '–', '—' -> '-';
            case '…' -> '.';
            default -> ch;
        };
    }
}
