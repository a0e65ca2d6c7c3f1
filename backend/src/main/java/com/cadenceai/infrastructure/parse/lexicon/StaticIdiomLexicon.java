package com.cadenceai.infrastructure.parse.lexicon;

import com.cadenceai.domain.parse.lexicon.IdiomLexicon;
import com.cadenceai.domain.parse.lexicon.MultiWordIdiom;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.cadenceai.domain.parse.model.token.TokenTag.ADVERB;
import static com.cadenceai.domain.parse.model.token.TokenTag.CONJUNCTION;
import static com.cadenceai.domain.parse.model.token.TokenTag.DEGREE;
import static com.cadenceai.domain.parse.model.token.TokenTag.DETERMINER;
import static com.cadenceai.domain.parse.model.token.TokenTag.IMPERATIVE;
import static com.cadenceai.domain.parse.model.token.TokenTag.MUSICAL;
import static com.cadenceai.domain.parse.model.token.TokenTag.NEGATION;
import static com.cadenceai.domain.parse.model.token.TokenTag.PREPOSITION;
import static com.cadenceai.domain.parse.model.token.TokenTag.QUANTIFIER;
import static com.cadenceai.domain.parse.model.token.TokenTag.QUESTION;

/**
 * Built-in multi-word idioms. Table order matters: it breaks ties between idioms of equal
 * priority and length.
 */
@Component
public class StaticIdiomLexicon implements IdiomLexicon {

    static final List<MultiWordIdiom> IDIOMS = List.of(
            // Conjunctions and connectives
            MultiWordIdiom.of("and then", 10, CONJUNCTION),
            MultiWordIdiom.of("as well as", 10, CONJUNCTION),
            MultiWordIdiom.of("along with", 10, CONJUNCTION),
            MultiWordIdiom.of("together with", 10, CONJUNCTION),
            MultiWordIdiom.of("rather than", 10, CONJUNCTION),
            MultiWordIdiom.of("instead of", 10, CONJUNCTION),
            MultiWordIdiom.of("in place of", 10, CONJUNCTION),
            MultiWordIdiom.of("in lieu of", 10, CONJUNCTION),
            MultiWordIdiom.of("as opposed to", 10, CONJUNCTION),
            MultiWordIdiom.of("in order to", 10, CONJUNCTION),
            MultiWordIdiom.of("so that", 10, CONJUNCTION),
            MultiWordIdiom.of("at the same time", 10, CONJUNCTION),
            MultiWordIdiom.of("after that", 10, CONJUNCTION),
            MultiWordIdiom.of("and after that", 11, CONJUNCTION),
            MultiWordIdiom.of("followed by", 10, CONJUNCTION),
            MultiWordIdiom.of("while still", 10, CONJUNCTION),

            // Retractions
            MultiWordIdiom.of("on second thought", 10),
            MultiWordIdiom.of("never mind", 10, NEGATION),
            MultiWordIdiom.of("scratch that", 10, NEGATION),
            MultiWordIdiom.of("forget it", 10, NEGATION),
            MultiWordIdiom.of("forget that", 10, NEGATION),
            MultiWordIdiom.of("cancel that", 10, NEGATION),
            MultiWordIdiom.of("undo that", 10),
            MultiWordIdiom.of("roll back", 10),

            // Temporal adverbials
            MultiWordIdiom.of("right now", 9, ADVERB),
            MultiWordIdiom.of("so far", 9, ADVERB),
            MultiWordIdiom.of("up to now", 9, ADVERB),
            MultiWordIdiom.of("from now on", 9, ADVERB),
            MultiWordIdiom.of("at first", 9, ADVERB),

            // Degree
            MultiWordIdiom.of("a lot", 9, DEGREE),
            MultiWordIdiom.of("a little", 9, DEGREE),
            MultiWordIdiom.of("a bit", 9, DEGREE),
            MultiWordIdiom.of("a touch", 9, DEGREE),
            MultiWordIdiom.of("a ton", 9, DEGREE),
            MultiWordIdiom.of("quite a bit", 10, DEGREE),
            MultiWordIdiom.of("a great deal", 10, DEGREE),
            MultiWordIdiom.of("not much", 9, DEGREE),
            MultiWordIdiom.of("as much as possible", 10, DEGREE),

            // Preposition + determiner
            MultiWordIdiom.of("in the", 5, PREPOSITION, DETERMINER),
            MultiWordIdiom.of("on the", 5, PREPOSITION, DETERMINER),
            MultiWordIdiom.of("at the", 5, PREPOSITION, DETERMINER),

            // Quantifier shells
            MultiWordIdiom.of("each of", 9, QUANTIFIER),
            MultiWordIdiom.of("all of", 9, QUANTIFIER),
            MultiWordIdiom.of("every other", 9, QUANTIFIER),
            MultiWordIdiom.of("none of", 9, QUANTIFIER),

            // Suggestions
            MultiWordIdiom.of("how about", 9, QUESTION),
            MultiWordIdiom.of("what if", 9, QUESTION),
            MultiWordIdiom.of("what about", 9, QUESTION),

            // Musical
            MultiWordIdiom.of("four on the floor", 12, MUSICAL),
            MultiWordIdiom.of("on the beat", 10, MUSICAL),
            MultiWordIdiom.of("off the beat", 10, MUSICAL),
            MultiWordIdiom.of("on beat", 9, MUSICAL),
            MultiWordIdiom.of("off beat", 9, MUSICAL),

            // Imperative openers
            MultiWordIdiom.of("go ahead and", 8, IMPERATIVE),
            MultiWordIdiom.of("let me", 8, IMPERATIVE),
            MultiWordIdiom.of("let us", 8, IMPERATIVE),
            MultiWordIdiom.of("let's", 8, IMPERATIVE)
    );

    private static final Map<String, List<MultiWordIdiom>> BY_FIRST_WORD = indexByFirstWord(IDIOMS);

    @Override
    public List<MultiWordIdiom> candidates(String firstWord) {
        return BY_FIRST_WORD.getOrDefault(firstWord, List.of());
    }

    static Map<String, List<MultiWordIdiom>> indexByFirstWord(List<MultiWordIdiom> idioms) {
        Map<String, List<MultiWordIdiom>> index = new LinkedHashMap<>();
        for (MultiWordIdiom idiom : idioms) {
            index.computeIfAbsent(idiom.firstWord(), k -> new ArrayList<>()).add(idiom);
        }
        index.replaceAll((word, list) -> List.copyOf(list));
        return Map.copyOf(index);
    }
}
