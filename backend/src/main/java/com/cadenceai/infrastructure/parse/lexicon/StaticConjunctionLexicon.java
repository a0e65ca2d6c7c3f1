package com.cadenceai.infrastructure.parse.lexicon;

import com.cadenceai.domain.parse.lexicon.ConjunctionEntry;
import com.cadenceai.domain.parse.lexicon.ConjunctionLexicon;
import com.cadenceai.domain.parse.model.coordination.CoordinationKind;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.cadenceai.domain.parse.model.coordination.ConjunctionPosition.CORRELATIVE;
import static com.cadenceai.domain.parse.model.coordination.ConjunctionPosition.INFIX;
import static com.cadenceai.domain.parse.model.coordination.ConjunctionPosition.PREFIX;
import static com.cadenceai.domain.parse.model.coordination.ConjunctionPosition.SUFFIX;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.ADDITIVE;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.ALTERNATIVE;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.CAUSAL;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.CONCURRENT;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.CONDITIONAL;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.CONTRASTIVE;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.CORRECTIVE;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.ELABORATIVE;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.PARALLEL;
import static com.cadenceai.domain.parse.model.coordination.CoordinationKind.SEQUENTIAL;

@Component
public class StaticConjunctionLexicon implements ConjunctionLexicon {

    private static final List<ConjunctionEntry> ENTRIES = List.of(
            new ConjunctionEntry(List.of("and", "plus", "as well as"), PARALLEL, false, INFIX, "both", false, 10),
            new ConjunctionEntry(List.of("both"), PARALLEL, false, CORRELATIVE, "and", true, 15),
            new ConjunctionEntry(List.of("also", "additionally", "in addition"), ADDITIVE, false, INFIX, null, false, 8),
            new ConjunctionEntry(List.of("as well", "too"), ADDITIVE, false, SUFFIX, null, false, 5),

            new ConjunctionEntry(List.of("and then", "then", "next", "after that", "afterwards"), SEQUENTIAL, true, INFIX, "first", false, 15),
            new ConjunctionEntry(List.of("first"), SEQUENTIAL, true, PREFIX, "then", true, 12),
            new ConjunctionEntry(List.of("before"), SEQUENTIAL, true, INFIX, null, false, 12),
            new ConjunctionEntry(List.of("after"), SEQUENTIAL, true, INFIX, null, false, 12),
            new ConjunctionEntry(List.of("followed by"), SEQUENTIAL, true, INFIX, null, false, 10),

            new ConjunctionEntry(List.of("but", "however", "yet", "though", "although"), CONTRASTIVE, true, INFIX, null, false, 12),
            new ConjunctionEntry(List.of("except", "except for", "other than"), CONTRASTIVE, true, INFIX, null, false, 10),
            new ConjunctionEntry(List.of("without"), CONTRASTIVE, true, INFIX, null, false, 10),

            new ConjunctionEntry(List.of("or", "alternatively"), ALTERNATIVE, false, INFIX, "either", false, 10),
            new ConjunctionEntry(List.of("either"), ALTERNATIVE, false, CORRELATIVE, "or", true, 12),
            new ConjunctionEntry(List.of("otherwise"), ALTERNATIVE, true, INFIX, null, false, 8),

            new ConjunctionEntry(List.of("if", "in case", "provided that", "assuming"), CONDITIONAL, true, PREFIX, "then", false, 15),
            new ConjunctionEntry(List.of("unless"), CONDITIONAL, true, INFIX, null, false, 12),
            new ConjunctionEntry(List.of("when", "whenever", "once"), CONDITIONAL, true, PREFIX, null, false, 10),

            new ConjunctionEntry(List.of("while", "whilst", "at the same time"), CONCURRENT, false, INFIX, null, false, 10),
            new ConjunctionEntry(List.of("simultaneously", "at once", "together"), CONCURRENT, false, SUFFIX, null, false, 8),

            new ConjunctionEntry(List.of("instead", "instead of", "rather than"), CORRECTIVE, true, INFIX, null, false, 15),
            new ConjunctionEntry(List.of("not"), CORRECTIVE, true, PREFIX, "but", true, 12),

            new ConjunctionEntry(List.of("specifically", "in particular", "namely", "especially"), ELABORATIVE, true, INFIX, null, false, 8),
            new ConjunctionEntry(List.of("meaning", "that is", "i.e."), ELABORATIVE, true, INFIX, null, false, 6),
            new ConjunctionEntry(List.of("like", "such as", "for example", "e.g."), ELABORATIVE, true, INFIX, null, false, 6),

            // bare "to" is left out: it collides with range and rename prepositions
            new ConjunctionEntry(List.of("so that", "in order to", "so"), CAUSAL, true, INFIX, null, false, 10),
            new ConjunctionEntry(List.of("because", "since"), CAUSAL, true, INFIX, null, false, 8)
    );

    private static final Map<String, Set<CoordinationKind>> ALTERNATIVE_KINDS = Map.of(
            "while", Set.of(CONCURRENT, CONTRASTIVE),
            "whilst", Set.of(CONCURRENT, CONTRASTIVE),
            "since", Set.of(CAUSAL, SEQUENTIAL),
            "so", Set.of(CAUSAL, SEQUENTIAL),
            "then", Set.of(SEQUENTIAL, CONDITIONAL)
    );

    private static final Map<String, ConjunctionEntry> BY_FORM = indexForms();
    private static final int MAX_FORM_WORDS = BY_FORM.keySet().stream()
            .mapToInt(form -> form.split(" ").length)
            .max()
            .orElse(1);

    @Override
    public Optional<ConjunctionEntry> lookup(String phrase) {
        return Optional.ofNullable(BY_FORM.get(phrase));
    }

    @Override
    public int maxFormWords() {
        return MAX_FORM_WORDS;
    }

    @Override
    public Set<CoordinationKind> alternativeKinds(String surface) {
        Set<CoordinationKind> kinds = ALTERNATIVE_KINDS.get(surface);
        return kinds == null ? Set.of() : EnumSet.copyOf(kinds);
    }

    private static Map<String, ConjunctionEntry> indexForms() {
        Map<String, ConjunctionEntry> index = new HashMap<>();
        for (ConjunctionEntry entry : ENTRIES) {
            for (String form : entry.forms()) {
                index.merge(form, entry, (existing, candidate) ->
                        candidate.priority() > existing.priority() ? candidate : existing);
            }
        }
        return Map.copyOf(index);
    }
}
