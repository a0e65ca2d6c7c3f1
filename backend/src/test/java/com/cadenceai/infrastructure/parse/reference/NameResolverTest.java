package com.cadenceai.infrastructure.parse.reference;

import com.cadenceai.domain.parse.lexicon.EntityDirectory;
import com.cadenceai.domain.parse.lexicon.KnownEntity;
import com.cadenceai.domain.parse.model.AnalysisWarning;
import com.cadenceai.domain.parse.model.reference.NameResolution;
import com.cadenceai.domain.parse.model.reference.NamedReference;
import com.cadenceai.domain.parse.model.reference.ReferenceWarningCode;
import com.cadenceai.domain.parse.model.reference.ResolutionStatus;
import com.cadenceai.infrastructure.parse.ParserFixtures;
import com.cadenceai.infrastructure.parse.lexicon.StaticNamingLexicon;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NameResolverTest {

    private NamedReferenceAnalyzer analyzer;
    private NameResolver resolver;
    private EntityDirectory directory;

    @BeforeEach
    void setUp() {
        analyzer = new NamedReferenceAnalyzer(new StaticNamingLexicon());
        resolver = new NameResolver();
        directory = EntityDirectory.of(List.of(
                new KnownEntity("Glass Pad", "track", Set.of("pad", "lead")),
                new KnownEntity("Glass Pads", "track", Set.of()),
                new KnownEntity("Lead Vox", "track", Set.of("lead", "vocal")),
                new KnownEntity("Warm Keys", "layer", null)
        ));
    }

    private NamedReference reference(String text) {
        return analyzer.analyze(ParserFixtures.tokenizer().tokenize(text)).get(0);
    }

    @Test
    @DisplayName("a quoted name resolves only to the exact entity")
    void exact_match() {
        NameResolution resolution = resolver.resolve(reference("mute the track called 'Glass Pad'"), directory);

        assertThat(resolution.status()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(resolution.isResolved()).isTrue();
        assertThat(resolution.matches()).containsExactly("Glass Pad");
        assertThat(resolution.warnings()).isEmpty();
    }

    @Test
    @DisplayName("a quoted name with no exact match is not found, never approximated")
    void no_fallback_to_similar_names() {
        NameResolution resolution = resolver.resolve(reference("mute the track called 'glass pad'"), directory);

        assertThat(resolution.status()).isEqualTo(ResolutionStatus.NOT_FOUND);
        assertThat(resolution.matches()).isEmpty();
        assertThat(resolution.warnings()).extracting(AnalysisWarning::codeName).containsExactly("name_not_found");
    }

    @Test
    @DisplayName("the entity type hint narrows the candidates")
    void type_hint_filters() {
        NameResolution resolution = resolver.resolve(reference("solo the track called 'Warm Keys'"), directory);

        assertThat(resolution.status()).isEqualTo(ResolutionStatus.NOT_FOUND);
    }

    @Test
    @DisplayName("a shared tag matches several entities")
    void tag_multiple_matches() {
        NameResolution resolution = resolver.resolve(reference("solo #lead"), directory);

        assertThat(resolution.status()).isEqualTo(ResolutionStatus.MULTIPLE_MATCHES);
        assertThat(resolution.matches()).containsExactly("Glass Pad", "Lead Vox");
        assertThat(resolution.warnings()).singleElement()
                .satisfies(w -> assertThat(w.candidates()).containsExactly("Glass Pad", "Lead Vox"));
    }

    @Test
    @DisplayName("an unquoted name is left to fuzzy matching")
    void bare_name_needs_fuzzy_matching() {
        NameResolution resolution = resolver.resolve(reference("the track called Glass Pad"), directory);

        assertThat(resolution.status()).isEqualTo(ResolutionStatus.FUZZY_REQUIRED);
        assertThat(resolution.matches()).isEmpty();
        assertThat(resolution.warnings()).anyMatch(w -> w.is(ReferenceWarningCode.FUZZY_MATCH_USED));
    }

    @Test
    @DisplayName("resolveAll keeps reference order")
    void resolve_all() {
        List<NamedReference> references = analyzer.analyze(
                ParserFixtures.tokenizer().tokenize("rename Lead to Hook"));

        List<NameResolution> resolutions = resolver.resolveAll(references, directory);

        assertThat(resolutions).extracting(r -> r.reference().name()).containsExactly("Lead", "Hook");
    }
}
