package com.cadenceai.domain.parse.model.unit;

/**
 * @param value        magnitude, already signed
 * @param explicitSign true if the text carried a leading '+' or '-'
 * @param original     the number as written ("+3", "twelve", "0.5")
 */
public record ParsedNumber(
        double value,
        boolean explicitSign,
        String original
) {
    public int sign() {
        if (!explicitSign) {
            return 0;
        }
        return value < 0 ? -1 : 1;
    }
}
