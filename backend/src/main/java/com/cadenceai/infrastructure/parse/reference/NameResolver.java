package com.cadenceai.infrastructure.parse.reference;

import com.cadenceai.domain.parse.lexicon.EntityDirectory;
import com.cadenceai.domain.parse.lexicon.KnownEntity;
import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.reference.NameResolution;
import com.cadenceai.domain.parse.model.reference.NamedReference;
import com.cadenceai.domain.parse.model.reference.ReferenceWarningCode;
import com.cadenceai.domain.parse.model.reference.ResolutionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Matches named references against the project's entities.
 *
 * A quoted name that matches nothing is reported as not found with the name as written.
 * There is no fallback to a similar-looking entity.
 */
@Slf4j
@Component
public class NameResolver {

    public NameResolution resolve(NamedReference reference, EntityDirectory directory) {
        return switch (reference.resolutionStrategy()) {
            case EXACT_MATCH -> match(reference, directory, entity -> entity.name().equals(reference.name()));
            case CASE_INSENSITIVE -> match(reference, directory, entity -> entity.name().equalsIgnoreCase(reference.name()));
            case PREFIX_MATCH -> match(reference, directory, entity -> entity.name().startsWith(reference.name()));
            case TAG_MATCH -> match(reference, directory, entity -> entity.tags().contains(reference.name())
                    || entity.tags().contains(reference.name().toLowerCase(Locale.ROOT)));
            case FUZZY_MATCH -> new NameResolution(reference, ResolutionStatus.FUZZY_REQUIRED, List.of(),
                    List.of(new AnalysisWarning(ReferenceWarningCode.FUZZY_MATCH_USED,
                            "Unquoted name \"" + reference.name() + "\" needs fuzzy matching", reference.span())));
        };
    }

    public List<NameResolution> resolveAll(List<NamedReference> references, EntityDirectory directory) {
        return references.stream().map(reference -> resolve(reference, directory)).toList();
    }

    private NameResolution match(NamedReference reference, EntityDirectory directory, Predicate<KnownEntity> matcher) {
        List<KnownEntity> candidates = directory.entities().stream()
                .filter(entity -> reference.entityTypeHint() == null || entity.entityType() == null
                        || entity.entityType().equals(reference.entityTypeHint()))
                .filter(matcher)
                .toList();
        List<String> names = candidates.stream().map(KnownEntity::name).toList();

        if (names.isEmpty()) {
            log.debug("[NameResolver] \"{}\" not found among {} entities", reference.name(), directory.entities().size());
            return new NameResolution(reference, ResolutionStatus.NOT_FOUND, names,
                    List.of(new AnalysisWarning(ReferenceWarningCode.NAME_NOT_FOUND,
                            "No entity named \"" + reference.name() + "\"", reference.span())));
        }
        if (names.size() > 1) {
            return new NameResolution(reference, ResolutionStatus.MULTIPLE_MATCHES, names,
                    List.of(new AnalysisWarning(ReferenceWarningCode.MULTIPLE_MATCHES,
                            names.size() + " entities match \"" + reference.name() + "\"", reference.span(), names)));
        }
        return new NameResolution(reference, ResolutionStatus.RESOLVED, names, List.of());
    }
}
