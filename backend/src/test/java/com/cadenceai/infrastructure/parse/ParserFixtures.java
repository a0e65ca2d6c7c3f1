package com.cadenceai.infrastructure.parse;

import com.cadenceai.domain.parse.model.token.Word;
import com.cadenceai.infrastructure.parse.lexicon.StaticIdiomLexicon;
import com.cadenceai.infrastructure.parse.lexicon.StaticMorphologyLexicon;
import com.cadenceai.infrastructure.parse.lexicon.StaticUnitLexicon;
import com.cadenceai.infrastructure.parse.lexicon.StaticWordClassLexicon;
import com.cadenceai.infrastructure.parse.morphology.MorphologicalNormalizer;
import com.cadenceai.infrastructure.parse.tokenizer.SpanTokenizer;
import com.cadenceai.infrastructure.parse.tokenizer.TextNormalizer;
import com.cadenceai.infrastructure.parse.tokenizer.TokenStreams;
import com.cadenceai.infrastructure.parse.unit.NumberParser;
import com.cadenceai.infrastructure.parse.unit.UnitExpressionParser;

import java.util.List;

/**
 * Parser components wired by hand with the built-in lexicons.
 */
public final class ParserFixtures {

    private ParserFixtures() {
    }

    public static SpanTokenizer tokenizer() {
        return new SpanTokenizer(new TextNormalizer(), new StaticIdiomLexicon(),
                new StaticWordClassLexicon(), new StaticUnitLexicon());
    }

    public static MorphologicalNormalizer normalizer() {
        return new MorphologicalNormalizer(new StaticMorphologyLexicon());
    }

    public static UnitExpressionParser unitParser() {
        return new UnitExpressionParser(new NumberParser(), new StaticUnitLexicon());
    }

    public static List<Word> words(String text) {
        return TokenStreams.words(tokenizer().tokenize(text));
    }
}
