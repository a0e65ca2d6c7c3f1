package com.cadenceai.domain.parse.lexicon;

import java.util.List;

public interface IdiomLexicon {

    /**
     * Idioms whose first word is {@code firstWord}, in table order.
     */
    List<MultiWordIdiom> candidates(String firstWord);
}
