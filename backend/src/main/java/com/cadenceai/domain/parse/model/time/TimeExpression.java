package com.cadenceai.domain.parse.model.time;

import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.WarningCode;
import com.cadenceai.domain.parse.model.token.Span;

import java.util.List;

/**
 * A parsed time expression with its provenance.
 *
 * @param range      the time range
 * @param surface    matched source text
 * @param span       source range
 * @param wordCount  number of words consumed
 * @param confidence in [0, 1]
 * @param warnings   ambiguity reports
 */
public record TimeExpression(
        TimeRange range,
        String surface,
        Span span,
        int wordCount,
        double confidence,
        List<AnalysisWarning> warnings
) {
    public TimeExpression {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarning(WarningCode code) {
        return warnings.stream().anyMatch(w -> w.is(code));
    }
}
