package com.cadenceai.domain.parse.lexicon;

import java.util.Optional;

public interface SectionLexicon {

    Optional<SectionEntry> lookup(String form);

    int maxFormWords();
}
