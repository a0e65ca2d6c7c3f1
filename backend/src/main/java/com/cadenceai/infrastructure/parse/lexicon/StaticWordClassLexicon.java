package com.cadenceai.infrastructure.parse.lexicon;

import com.cadenceai.domain.parse.lexicon.WordClassLexicon;
import com.cadenceai.domain.parse.model.token.TokenTag;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Closed word lists for tokenizer tagging.
 */
@Component
public class StaticWordClassLexicon implements WordClassLexicon {

    static final Set<String> VERBS = Set.of(
            "make", "add", "remove", "delete", "change", "adjust", "set", "move", "copy", "duplicate",
            "boost", "cut", "raise", "lower", "increase", "decrease", "brighten", "darken", "widen",
            "narrow", "tighten", "loosen", "soften", "harden", "warm", "cool", "thicken", "thin",
            "compress", "expand", "reduce", "swap", "switch", "replace", "undo", "redo", "keep",
            "preserve", "maintain", "fix", "apply", "try", "transpose", "harmonize", "modulate",
            "reharmonize", "revoice", "pan", "mute", "solo", "quantize", "humanize", "automate",
            "fade", "crossfade", "trim", "extend", "shorten", "lengthen", "stretch", "pitch",
            "retune", "detune", "filter", "eq", "limit", "gate", "sidechain"
    );

    static final Set<String> ADJECTIVES = Set.of(
            "brighter", "darker", "wider", "narrower", "louder", "quieter", "softer", "harder",
            "warmer", "cooler", "thicker", "thinner", "heavier", "lighter", "denser", "sparser",
            "punchier", "muddier", "cleaner", "dirtier", "crisper", "smoother", "rougher",
            "bigger", "smaller", "fuller", "emptier", "richer", "leaner",
            "bright", "dark", "wide", "loud", "quiet", "soft", "hard", "warm", "cool", "thick",
            "thin", "heavy", "light", "dense", "sparse", "punchy", "muddy", "clean", "dirty",
            "crisp", "big", "small", "full", "empty", "rich", "lean", "energetic", "mellow",
            "aggressive", "gentle", "ethereal", "gritty", "airy", "compressed", "dynamic", "static",
            "smooth", "rough", "syncopated", "straight", "swung", "jazzy", "funky", "groovy"
    );

    static final Set<String> PREPOSITIONS = Set.of(
            "in", "at", "on", "to", "for", "from", "by", "with", "without", "before", "after",
            "during", "between", "through", "across", "above", "below", "over", "under", "into",
            "onto", "around", "throughout", "until", "towards"
    );

    static final Set<String> DETERMINERS = Set.of(
            "the", "a", "an", "this", "that", "these", "those", "my", "your", "our", "its", "their",
            "some", "any", "no", "each", "every", "all", "both"
    );

    static final Set<String> PRONOUNS = Set.of(
            "it", "them", "they", "this", "that", "these", "those", "one", "ones", "everything",
            "something", "nothing"
    );

    static final Set<String> CONJUNCTIONS = Set.of(
            "and", "but", "or", "yet", "so", "nor", "then", "however", "although", "though",
            "while", "whereas", "because", "since", "if", "unless", "until", "when"
    );

    static final Set<String> NEGATIONS = Set.of(
            "not", "no", "never", "neither", "nor", "none", "nothing", "without", "except",
            "don't", "doesn't", "didn't", "can't", "won't", "shouldn't", "wouldn't", "couldn't"
    );

    static final Set<String> DEGREE_WORDS = Set.of(
            "more", "less", "very", "slightly", "much", "somewhat", "barely", "really", "extremely",
            "fairly", "quite", "rather", "pretty", "super", "ultra", "way", "significantly",
            "dramatically", "subtly", "massively", "noticeably", "considerably", "moderately",
            "tremendously"
    );

    static final Set<String> QUESTION_WORDS = Set.of("what", "which", "who", "where", "when", "why", "how");

    static final Set<String> MODALS = Set.of("can", "could", "should", "would", "might", "may", "must", "shall", "will");

    static final Set<String> NUMBER_WORDS = Set.of(
            "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten",
            "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen", "seventeen",
            "eighteen", "nineteen", "twenty", "thirty", "forty", "fifty", "sixty", "seventy",
            "eighty", "ninety", "hundred", "thousand", "half", "quarter", "third", "double",
            "triple", "couple", "few", "several", "dozen"
    );

    static final Set<String> UNIT_WORDS = Set.of(
            "bar", "bars", "beat", "beats", "measure", "measures", "semitone", "semitones", "step",
            "steps", "octave", "octaves", "cent", "cents", "hz", "khz", "mhz", "db", "decibel",
            "decibels", "bpm", "ms", "millisecond", "milliseconds", "second", "seconds", "percent", "%"
    );

    private static final Map<String, Set<TokenTag>> TAGS = buildIndex();

    @Override
    public Set<TokenTag> tagsFor(String word) {
        return TAGS.getOrDefault(word, Set.of());
    }

    private static Map<String, Set<TokenTag>> buildIndex() {
        Map<String, Set<TokenTag>> index = new HashMap<>();
        register(index, VERBS, TokenTag.VERB);
        register(index, ADJECTIVES, TokenTag.ADJECTIVE);
        register(index, PREPOSITIONS, TokenTag.PREPOSITION);
        register(index, DETERMINERS, TokenTag.DETERMINER);
        register(index, PRONOUNS, TokenTag.PRONOUN);
        register(index, CONJUNCTIONS, TokenTag.CONJUNCTION);
        register(index, NEGATIONS, TokenTag.NEGATION);
        register(index, DEGREE_WORDS, TokenTag.DEGREE);
        register(index, QUESTION_WORDS, TokenTag.QUESTION);
        register(index, MODALS, TokenTag.MODAL);
        register(index, NUMBER_WORDS, TokenTag.NUMBER_WORD);
        register(index, UNIT_WORDS, TokenTag.UNIT_WORD);
        index.replaceAll((word, tags) -> Set.copyOf(tags));
        return Map.copyOf(index);
    }

    private static void register(Map<String, Set<TokenTag>> index, Set<String> words, TokenTag tag) {
        for (String word : words) {
            index.computeIfAbsent(word, k -> EnumSet.noneOf(TokenTag.class)).add(tag);
        }
    }
}
