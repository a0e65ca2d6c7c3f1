package com.cadenceai.domain.parse.model.reference;

import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.WarningCode;
import com.cadenceai.domain.parse.model.token.Span;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A user-given name in the utterance: "the track called 'Glass Pad'".
 *
 * @param refId              stable id within one utterance ("ref:0", ...)
 * @param name               the name itself, quotes stripped
 * @param surface            full matched text including quotes and context words
 * @param type               reference pattern
 * @param quoteStyle         quoting used in the source
 * @param entityTypeHint     canonical entity type ("track", "section", ...), nullable
 * @param entityKeyword      entity keyword as written, nullable
 * @param namingVerb         naming verb as matched, nullable
 * @param namingOperation    operation implied by the naming verb, nullable
 * @param span               source range of {@code surface}
 * @param resolutionStrategy how the name must be matched
 * @param confidence         in [0, 1]
 * @param warnings           anomalies
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NamedReference(
        String refId,
        String name,
        String surface,
        NamedReferenceType type,
        QuoteStyle quoteStyle,
        String entityTypeHint,
        String entityKeyword,
        String namingVerb,
        NamingOperation namingOperation,
        Span span,
        ResolutionStrategy resolutionStrategy,
        double confidence,
        List<AnalysisWarning> warnings
) {
    public NamedReference {
        warnings = List.copyOf(warnings);
    }

    public boolean isQuoted() {
        return quoteStyle.isQuoted();
    }

    public boolean hasWarning(WarningCode code) {
        return warnings.stream().anyMatch(w -> w.is(code));
    }
}
