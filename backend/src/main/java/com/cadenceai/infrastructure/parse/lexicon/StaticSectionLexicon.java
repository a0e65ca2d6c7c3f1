package com.cadenceai.infrastructure.parse.lexicon;

import com.cadenceai.domain.parse.lexicon.SectionEntry;
import com.cadenceai.domain.parse.lexicon.SectionLexicon;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Song-form section names. Plural forms resolve to the same entry.
 */
@Component
public class StaticSectionLexicon implements SectionLexicon {

    private static final List<SectionEntry> SECTIONS = List.of(
            new SectionEntry("intro", List.of("intro", "introduction", "opening", "intros"), 1, false),
            new SectionEntry("verse", List.of("verse", "verses", "vrs"), 2, true),
            new SectionEntry("pre-chorus", List.of("pre-chorus", "prechorus", "pre chorus", "build",
                    "buildup", "build-up", "ramp", "pre-choruses"), 3, true),
            new SectionEntry("chorus", List.of("chorus", "choruses", "hook", "refrain"), 4, true),
            new SectionEntry("post-chorus", List.of("post-chorus", "postchorus", "post chorus"), 5, true),
            new SectionEntry("bridge", List.of("bridge", "middle 8", "middle eight", "b-section", "bridges"), 6, false),
            new SectionEntry("breakdown", List.of("breakdown", "break", "drop", "breakdowns", "drops"), 7, false),
            new SectionEntry("solo", List.of("solo", "instrumental", "inst", "solos"), 8, false),
            new SectionEntry("outro", List.of("outro", "ending", "coda", "tag", "finale", "outros"), 9, false),
            new SectionEntry("interlude", List.of("interlude", "transition", "fill", "interludes"), 5, true)
    );

    private static final Map<String, SectionEntry> BY_FORM = indexForms();
    private static final int MAX_FORM_WORDS = BY_FORM.keySet().stream()
            .mapToInt(form -> form.split(" ").length)
            .max()
            .orElse(1);

    @Override
    public Optional<SectionEntry> lookup(String form) {
        return Optional.ofNullable(BY_FORM.get(form));
    }

    @Override
    public int maxFormWords() {
        return MAX_FORM_WORDS;
    }

    private static Map<String, SectionEntry> indexForms() {
        Map<String, SectionEntry> index = new HashMap<>();
        SECTIONS.forEach(section -> section.forms().forEach(form -> index.putIfAbsent(form, section)));
        return Map.copyOf(index);
    }
}
